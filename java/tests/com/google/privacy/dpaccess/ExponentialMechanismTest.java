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

import com.google.common.math.Stats;
import java.util.Random;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ExponentialMechanismTest {
  private static final int NUM_SAMPLES = 100000;

  /** Scores outcomes by their closeness to the private value. */
  private static final ExponentialMechanism.UtilityFunction<Double> CLOSENESS =
      (data, outcome) -> -Math.abs(data - outcome);

  @Test
  public void apply_returnsRequestedNumberOfOutcomesFromRange() {
    ExponentialMechanism<Double> mechanism =
        ExponentialMechanism.<Double>builder()
            .utilityFunction(CLOSENESS)
            .range(1.0, 2.0, 3.0)
            .deltaU(1.0)
            .epsilon(1.0)
            .repetitions(50)
            .build();

    double[] outcomes = mechanism.apply(2.0);

    assertThat(outcomes).hasLength(50);
    for (double outcome : outcomes) {
      assertThat(outcome).isAnyOf(1.0, 2.0, 3.0);
    }
  }

  @Test
  public void apply_defaultRepetitions_returnsSingleOutcome() {
    ExponentialMechanism<Double> mechanism =
        ExponentialMechanism.<Double>builder()
            .utilityFunction(CLOSENESS)
            .range(1.0, 2.0)
            .deltaU(1.0)
            .epsilon(1.0)
            .build();

    assertThat(mechanism.apply(1.0)).hasLength(1);
  }

  @Test
  public void apply_largeEpsilon_selectsBestOutcome() {
    ExponentialMechanism<Double> mechanism =
        ExponentialMechanism.<Double>builder()
            .utilityFunction(CLOSENESS)
            .range(0.0, 1.0, 2.0, 3.0, 4.0, 5.0)
            .deltaU(1.0)
            .epsilon(200.0)
            .repetitions(1000)
            .random(new Random(42))
            .build();

    for (double outcome : mechanism.apply(3.0)) {
      assertThat(outcome).isEqualTo(3.0);
    }
  }

  @Test
  public void apply_selectsOutcomesWithExponentialWeights() {
    // With epsilon = 2 ln 3 and deltaU = 1, an outcome whose utility is larger by 1 is 3 times as
    // likely.
    ExponentialMechanism<Double> mechanism =
        ExponentialMechanism.<Double>builder()
            .utilityFunction((data, outcome) -> outcome)
            .range(0.0, 1.0)
            .deltaU(1.0)
            .epsilon(2 * Math.log(3))
            .repetitions(NUM_SAMPLES)
            .build();

    double p = 0.75;
    // The tolerance is chosen according to the 99.9995% quantile of the anticipated distribution
    // of the sample mean. Thus, the test falsely rejects with a probability of 10^-5.
    double sampleMeanTolerance = 4.41717 * Math.sqrt(p * (1 - p) / NUM_SAMPLES);
    assertThat(Stats.meanOf(mechanism.apply(0.0))).isWithin(sampleMeanTolerance).of(p);
  }

  @Test
  public void apply_largeUtilities_doesNotOverflow() {
    // exp(1e6) is not representable as a double.
    ExponentialMechanism<Double> mechanism =
        ExponentialMechanism.<Double>builder()
            .utilityFunction((data, outcome) -> outcome == 0.0 ? -1e6 : 1e6)
            .range(0.0, 1.0, 2.0)
            .deltaU(1.0)
            .epsilon(2.0)
            .repetitions(1000)
            .build();

    for (double outcome : mechanism.apply(0.0)) {
      assertThat(outcome).isAnyOf(1.0, 2.0);
    }
  }

  @Test
  public void apply_nonFiniteUtility_throwsException() {
    ExponentialMechanism<Double> mechanism =
        ExponentialMechanism.<Double>builder()
            .utilityFunction((data, outcome) -> outcome == 0.0 ? Double.NaN : 0.0)
            .range(0.0, 1.0)
            .deltaU(1.0)
            .epsilon(1.0)
            .build();

    assertThrows(IllegalArgumentException.class, () -> mechanism.apply(0.0));
  }

  @Test
  public void epsilonDelta_hasZeroDelta() {
    ExponentialMechanism<Double> mechanism =
        ExponentialMechanism.<Double>builder()
            .utilityFunction(CLOSENESS)
            .range(0.0)
            .deltaU(1.0)
            .epsilon(0.7)
            .build();

    assertThat(mechanism.epsilonDelta()).isEqualTo(PrivacyBudget.ofEpsilon(0.7));
  }

  @Test
  public void build_missingParameters_throwsException() {
    assertThrows(
        IllegalStateException.class,
        () -> ExponentialMechanism.<Double>builder().range(0.0).deltaU(1.0).epsilon(1.0).build());
  }

  @Test
  public void build_invalidParameters_throwsException() {
    assertThrows(
        IllegalArgumentException.class,
        () -> validBuilder().range(new double[0]).build());
    assertThrows(IllegalArgumentException.class, () -> validBuilder().deltaU(0.0).build());
    assertThrows(IllegalArgumentException.class, () -> validBuilder().epsilon(-1.0).build());
    assertThrows(IllegalArgumentException.class, () -> validBuilder().repetitions(0).build());
  }

  private static ExponentialMechanism.Params.Builder<Double> validBuilder() {
    return ExponentialMechanism.<Double>builder()
        .utilityFunction(CLOSENESS)
        .range(0.0, 1.0)
        .deltaU(1.0)
        .epsilon(1.0);
  }
}
