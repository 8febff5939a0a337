//
// Copyright 2026 Google LLC
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//      http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//

package com.google.privacy.dpaccess;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Doubles;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class FederatedDataTest {
  private FederatedDataRegistry registry;

  @Before
  public void setUp() {
    registry = new FederatedDataRegistry();
  }

  @Test
  public void create_identifierInUse_throwsException() {
    new FederatedData<double[]>(registry, "data");

    assertThrows(
        IllegalArgumentException.class, () -> new FederatedData<double[]>(registry, "data"));
  }

  @Test
  public void create_sameIdentifierInOtherRegistry_isAccepted() {
    new FederatedData<double[]>(registry, "data");
    FederatedData<double[]> other = new FederatedData<>(new FederatedDataRegistry(), "data");

    assertThat(other.getIdentifier()).isEqualTo("data");
    assertThat(registry.isRegistered("data")).isTrue();
  }

  @Test
  public void addDataNode_storesDataUnderIdentifier() {
    FederatedData<String> federatedData = new FederatedData<>(registry, "names");
    DataNode node = new DataNode();

    federatedData.addDataNode(node, "Alice");
    node.configureDataAccess("names", new UnprotectedAccess<String>());

    assertThat(federatedData.numNodes()).isEqualTo(1);
    assertThat(federatedData.get(0)).isSameInstanceAs(node);
    String name = node.query("names");
    assertThat(name).isEqualTo("Alice");
  }

  @Test
  public void query_broadcastsToNodesInOrder() {
    FederatedData<String> federatedData = new FederatedData<>(registry, "names");
    federatedData.addDataNode(new DataNode(), "Alice");
    federatedData.addDataNode(new DataNode(), "Bob");
    federatedData.addDataNode(new DataNode(), "Carol");
    federatedData.configureDataAccess(new UnprotectedAccess<String>());

    ImmutableList<String> results = federatedData.query();

    assertThat(results).containsExactly("Alice", "Bob", "Carol").inOrder();
  }

  @Test
  public void federateArray_splitsArrayIntoContiguousChunks() {
    double[] array = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9};

    FederatedData<double[]> federatedData =
        FederatedData.federateArray(registry, "array", array, 3);
    federatedData.configureDataAccess(new UnprotectedAccess<double[]>());
    ImmutableList<double[]> chunks = federatedData.query();

    assertThat(federatedData.numNodes()).isEqualTo(3);
    assertThat(chunks.get(0)).hasLength(3);
    assertThat(chunks.get(1)).hasLength(3);
    assertThat(chunks.get(2)).hasLength(4);
    List<Double> concatenated = new ArrayList<>();
    for (double[] chunk : chunks) {
      concatenated.addAll(Doubles.asList(chunk));
    }
    assertThat(concatenated).containsExactlyElementsIn(Doubles.asList(array)).inOrder();
  }

  @Test
  public void federateArray_invalidNumberOfNodes_throwsException() {
    assertThrows(
        IllegalArgumentException.class,
        () -> FederatedData.federateArray(registry, "array", new double[] {1}, 0));
  }

  @Test
  public void configureDataAccess_sharedFilter_chargesSingleBudget() {
    FederatedData<double[]> federatedData =
        FederatedData.federateArray(registry, "array", new double[] {1, 2, 3, 4, 5, 6}, 3);
    AdaptiveDifferentialPrivacy<double[], double[]> filter =
        new AdaptiveDifferentialPrivacy<>(
            PrivacyBudget.ofEpsilon(1.0), new LaplaceMechanism(1.0, 0.25));
    federatedData.configureDataAccess(filter);

    assertThat(federatedData.<double[]>query()).hasSize(3);
    // The fourth query of epsilon 0.25 still fits, the fifth does not.
    assertThrows(ExceededPrivacyBudgetException.class, () -> federatedData.query());
    assertThat(filter.accessCount()).isEqualTo(4);
  }

  @Test
  public void query_override_isPassedToEveryNode() {
    FederatedData<double[]> federatedData =
        FederatedData.federateArray(registry, "array", new double[] {1, 2, 3, 4}, 2);
    federatedData.configureDataAccess(
        new AdaptiveDifferentialPrivacy<double[], double[]>(PrivacyBudget.ofEpsilon(1.0)));

    ImmutableList<double[]> results = federatedData.query(new LaplaceMechanism(1.0, 0.1));

    assertThat(results).hasSize(2);
    assertThat(results.get(0)).hasLength(2);
  }

  @Test
  public void applyDataTransformation_transformsEveryNode() {
    FederatedData<double[]> federatedData =
        FederatedData.federateArray(registry, "array", new double[] {1, 2, 3, 4}, 2);
    federatedData.configureDataAccess(new UnrandomizedMechanism<>(new Mean()));

    federatedData.applyDataTransformation(data -> new double[] {data[0] * 10});
    ImmutableList<double[]> results = federatedData.query();

    assertThat(results.get(0)).usingExactEquality().containsExactly(10.0);
    assertThat(results.get(1)).usingExactEquality().containsExactly(30.0);
  }

  @Test
  public void iterator_visitsNodesInOrderAndIsUnmodifiable() {
    FederatedData<String> federatedData = new FederatedData<>(registry, "names");
    DataNode first = new DataNode();
    DataNode second = new DataNode();
    federatedData.addDataNode(first, "Alice");
    federatedData.addDataNode(second, "Bob");

    assertThat(federatedData).containsExactly(first, second).inOrder();
    Iterator<DataNode> iterator = federatedData.iterator();
    iterator.next();
    assertThrows(UnsupportedOperationException.class, iterator::remove);
  }
}
