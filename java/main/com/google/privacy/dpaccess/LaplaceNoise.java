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

import static com.google.common.base.Preconditions.checkNotNull;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Generates and adds Laplace noise to a raw piece of numerical data.
 *
 * <p>The Laplace noise is generated according to the geometric sampling mechanism described <a
 * href="https://github.com/google/differential-privacy/blob/main/common_docs/Secure_Noise_Generation.pdf">here</a>.
 * This approach is robust against unintentional privacy leaks due to artifacts of floating point
 * arithmetic.
 */
final class LaplaceNoise {
  /**
   * Resolution of the generated noise relative to the scale {@code l1Sensitivity / epsilon},
   * corresponding to 2^k in the secure noise generation paper. Larger values give finer noise but
   * increase the chance of overflows, which stays below 2^-1000 for 2^40 and epsilon >= 2^-50.
   * Must be a power of 2.
   */
  private static final double GRANULARITY_PARAM = (double) (1L << 40);

  private final Random random;

  /** Returns a Noise instance initialized with a secure randomness source. */
  LaplaceNoise() {
    this(new SecureRandom());
  }

  /**
   * Returns a Noise instance drawing from {@code random}. Non-secure sources should only be used
   * for testing.
   */
  LaplaceNoise(Random random) {
    this.random = checkNotNull(random);
  }

  /**
   * Adds Laplace noise of scale {@code l1Sensitivity / epsilon} to {@code x}, such that the output
   * is {@code epsilon}-differentially private with respect to the given L_1 sensitivity.
   */
  double addNoise(double x, double l1Sensitivity, double epsilon) {
    DpPreconditions.checkSensitivity(l1Sensitivity);
    DpPreconditions.checkEpsilon(epsilon);

    double granularity = getGranularity(l1Sensitivity, epsilon);
    long twoSidedGeometricSample =
        SamplingUtil.sampleTwoSidedGeometric(
            random, granularity * epsilon / (l1Sensitivity + granularity));
    return SecureNoiseMath.roundToMultipleOfPowerOfTwo(x, granularity)
        + twoSidedGeometricSample * granularity;
  }

  /** Returns the variance of the noise added by {@link #addNoise}. */
  static double getVariance(double l1Sensitivity, double epsilon) {
    double scale = l1Sensitivity / epsilon;
    return 2.0 * scale * scale;
  }

  private static double getGranularity(double l1Sensitivity, double epsilon) {
    return SecureNoiseMath.ceilPowerOfTwo((l1Sensitivity / epsilon) / GRANULARITY_PARAM);
  }
}
