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
import java.util.Arrays;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class LaplaceMechanismTest {
  private static final int NUM_SAMPLES = 100000;
  private static final double SENSITIVITY = 1.0;
  private static final double EPSILON = Math.log(3);

  @Test
  public void apply_constantInput_hasAccurateStatisticalProperties() {
    LaplaceMechanism mechanism = new LaplaceMechanism(SENSITIVITY, EPSILON);
    double[] data = new double[NUM_SAMPLES];
    Arrays.fill(data, 5.0);

    Stats stats = Stats.of(mechanism.apply(data));

    double variance = LaplaceNoise.getVariance(SENSITIVITY, EPSILON);
    // The tolerance is chosen according to the 99.9995% quantile of the anticipated distributions
    // of the sample mean and variance. Thus, the test falsely rejects with a probability of 10^-5.
    double sampleMeanTolerance = 4.41717 * Math.sqrt(variance / NUM_SAMPLES);
    double sampleVarianceTolerance = 4.41717 * Math.sqrt(5.0 * variance * variance / NUM_SAMPLES);
    assertThat(stats.mean()).isWithin(sampleMeanTolerance).of(5.0);
    assertThat(stats.populationVariance()).isWithin(sampleVarianceTolerance).of(variance);
  }

  @Test
  public void apply_doesNotModifyInput() {
    LaplaceMechanism mechanism = new LaplaceMechanism(SENSITIVITY, EPSILON);
    double[] data = {1.0, 2.0, 3.0};

    double[] result = mechanism.apply(data);

    assertThat(result).hasLength(3);
    assertThat(data).usingExactEquality().containsExactly(1.0, 2.0, 3.0).inOrder();
  }

  @Test
  public void apply_scalar_returnsFiniteValue() {
    LaplaceMechanism mechanism = new LaplaceMechanism(SENSITIVITY, EPSILON);

    assertThat(Double.isFinite(mechanism.apply(7.0))).isTrue();
  }

  @Test
  public void epsilonDelta_hasZeroDelta() {
    LaplaceMechanism mechanism = new LaplaceMechanism(SENSITIVITY, 0.5);

    assertThat(mechanism.epsilonDelta()).isEqualTo(PrivacyBudget.of(0.5, 0.0));
    assertThat(mechanism.getSensitivity()).isEqualTo(SENSITIVITY);
  }

  @Test
  public void create_invalidParameters_throwsException() {
    assertThrows(IllegalArgumentException.class, () -> new LaplaceMechanism(0.0, EPSILON));
    assertThrows(IllegalArgumentException.class, () -> new LaplaceMechanism(-1.0, EPSILON));
    assertThrows(
        IllegalArgumentException.class,
        () -> new LaplaceMechanism(Double.POSITIVE_INFINITY, EPSILON));
    assertThrows(IllegalArgumentException.class, () -> new LaplaceMechanism(SENSITIVITY, 0.0));
    assertThrows(IllegalArgumentException.class, () -> new LaplaceMechanism(SENSITIVITY, -0.1));
  }
}
