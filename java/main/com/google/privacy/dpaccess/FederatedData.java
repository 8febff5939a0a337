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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A dataset distributed across several {@link DataNode}s. Each node holds its part of the dataset
 * under the identifier of the federated data, and all operations are broadcast to the nodes in the
 * order they were added.
 *
 * @param <T> type of the part of the data held by each node
 */
public class FederatedData<T> implements Iterable<DataNode> {
  private final String identifier;
  private final List<DataNode> dataNodes = new ArrayList<>();

  /** @throws IllegalArgumentException if {@code identifier} is already used in {@code registry}. */
  public FederatedData(FederatedDataRegistry registry, String identifier) {
    checkNotNull(registry, "registry must not be null.");
    registry.register(identifier);
    this.identifier = identifier;
  }

  /**
   * Splits {@code array} into {@code numNodes} contiguous chunks of (almost) equal size and stores
   * each chunk in a new node.
   */
  public static FederatedData<double[]> federateArray(
      FederatedDataRegistry registry, String identifier, double[] array, int numNodes) {
    checkArgument(numNodes > 0, "numNodes must be > 0. Provided value: %s", numNodes);
    FederatedData<double[]> federatedData = new FederatedData<>(registry, identifier);
    for (int i = 0; i < numNodes; i++) {
      int from = (int) ((long) i * array.length / numNodes);
      int to = (int) ((long) (i + 1) * array.length / numNodes);
      federatedData.addDataNode(new DataNode(), Arrays.copyOfRange(array, from, to));
    }
    return federatedData;
  }

  public String getIdentifier() {
    return identifier;
  }

  /** Stores {@code data} in {@code node} under the identifier of this federated data. */
  public void addDataNode(DataNode node, T data) {
    checkNotNull(node, "node must not be null.");
    node.setPrivateData(identifier, data);
    dataNodes.add(node);
  }

  public int numNodes() {
    return dataNodes.size();
  }

  public DataNode get(int index) {
    return dataNodes.get(index);
  }

  @Override
  public Iterator<DataNode> iterator() {
    return Iterators.unmodifiableIterator(dataNodes.iterator());
  }

  /**
   * Configures {@code definition} on every node. All nodes share the instance, so a stateful
   * definition such as {@link AdaptiveDifferentialPrivacy} charges a single budget for all of them.
   */
  public void configureDataAccess(DataAccessDefinition<? super T, ?> definition) {
    for (DataNode node : dataNodes) {
      node.configureDataAccess(identifier, definition);
    }
  }

  /** Returns the release of every node's part of the data, in node order. */
  public <R> ImmutableList<R> query() {
    return query(null);
  }

  /**
   * Returns the release of every node's part of the data, in node order, passing {@code override}
   * to each node's access definition.
   *
   * @see DataNode#query(String, DataAccessDefinition)
   */
  public <R> ImmutableList<R> query(
      @Nullable DataAccessDefinition<? super T, ? extends R> override) {
    ImmutableList.Builder<R> results = ImmutableList.builder();
    for (DataNode node : dataNodes) {
      R result = node.query(identifier, override);
      results.add(result);
    }
    return results.build();
  }

  /** Replaces every node's part of the data by the result of {@code transformation}. */
  public void applyDataTransformation(Query<T, ? extends T> transformation) {
    for (DataNode node : dataNodes) {
      node.applyDataTransformation(identifier, transformation);
    }
  }
}
