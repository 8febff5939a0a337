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

import com.google.common.annotations.VisibleForTesting;
import java.security.SecureRandom;
import java.util.Random;

/**
 * Generates and adds Gaussian noise of a given standard deviation to a raw piece of numerical
 * data.
 *
 * <p>The Gaussian noise is generated according to the binomial sampling mechanism described <a
 * href="https://github.com/google/differential-privacy/blob/main/common_docs/Secure_Noise_Generation.pdf">here</a>.
 * This approach is robust against unintentional privacy leaks due to artifacts of floating point
 * arithmetic.
 */
final class GaussianNoise {
  /**
   * The square root of the maximum number n of Bernoulli trials from which a binomial sample is
   * drawn. Larger values result in more fine grained noise, but increase the chance of sampling
   * inaccuracies due to overflows. The probability of such an event will be roughly 2^-45 or less,
   * if the square root is set to 2^57.
   */
  private static final double BINOMIAL_BOUND = (double) (1L << 57);

  /**
   * The absolute bound of the two sided geometric samples k used to create a binomial sample
   * {@code m + n / 2}, where {@code m = (k + l) * (sqrt(2 * n) + 1)} for a uniform l in [0, 1).
   * Bounding k prevents m from overflowing.
   */
  private static final long GEOMETRIC_BOUND =
      (Long.MAX_VALUE / Math.round(Math.sqrt(2) * BINOMIAL_BOUND + 1.0)) - 1;

  private final Random random;

  /** Returns a Noise instance initialized with a secure randomness source. */
  GaussianNoise() {
    this(new SecureRandom());
  }

  /**
   * Returns a Noise instance drawing from {@code random}. Non-secure sources should only be used
   * for testing.
   */
  GaussianNoise(Random random) {
    this.random = checkNotNull(random);
  }

  /**
   * Returns the standard deviation of the classic Gaussian mechanism, {@code sqrt(2 * ln(1.25 /
   * delta)) * l2Sensitivity / epsilon}. The calibration is from Theorem A.1 of Dwork and Roth's
   * "The Algorithmic Foundations of Differential Privacy" and holds for {@code epsilon < 1}.
   */
  static double getSigma(double l2Sensitivity, double epsilon, double delta) {
    return Math.sqrt(2.0 * Math.log(1.25 / delta)) * l2Sensitivity / epsilon;
  }

  /** Adds zero-mean Gaussian noise of standard deviation {@code sigma} to {@code x}. */
  double addNoise(double x, double sigma) {
    checkArgument(
        Double.isFinite(sigma) && sigma > 0, "sigma must be > 0 and finite. Provided: %s", sigma);
    double granularity = getGranularity(sigma);

    // The square root of n is chosen in a way that places it in the interval between BINOMIAL_BOUND
    // and BINOMIAL_BOUND / 2. This ensures that the respective binomial distribution consists of
    // enough Bernoulli samples to closely approximate a Gaussian distribution.
    double sqrtN = 2.0 * sigma / granularity;
    long binomialSample = sampleSymmetricBinomial(sqrtN);
    return SecureNoiseMath.roundToMultipleOfPowerOfTwo(x, granularity)
        + binomialSample * granularity;
  }

  private static double getGranularity(double sigma) {
    return SecureNoiseMath.ceilPowerOfTwo(2.0 * sigma / BINOMIAL_BOUND);
  }

  /**
   * Returns a random sample m where {@code m + n / 2} is drawn from a binomial distribution of
   * {@code n} Bernoulli trials that have a success probability of 1 / 2 each. The sampling
   * technique is based on Bringmann et al.'s rejection sampling approach proposed in "Internal DLA:
   * Efficient Simulation of a Physical Growth Model", available <a
   * href="https://people.mpi-inf.mpg.de/~kbringma/paper/2014ICALP.pdf">here</a>.
   *
   * <p>The square root of {@code n} must be at least 10^6.
   */
  @VisibleForTesting
  long sampleSymmetricBinomial(double sqrtN) {
    checkArgument(sqrtN >= 1000000.0, "Input must be at least 10^6. Provided value: %s", sqrtN);
    checkArgument(Double.isFinite(sqrtN), "Input must be finite. Provided value: %s", sqrtN);

    long stepSize = Math.round(Math.sqrt(2) * sqrtN + 1.0);
    while (true) {
      long geometricSample = sampleBoundedGeometric();
      long twoSidedGeometricSample = random.nextBoolean() ? geometricSample : -geometricSample - 1;
      long result = stepSize * twoSidedGeometricSample + sampleUniform(stepSize);

      double resultProbability = approximateBinomialProbability(sqrtN, result);
      double rejectProbability = random.nextDouble();
      if (resultProbability > 0.0
          && rejectProbability > 0.0
          && rejectProbability
              < resultProbability * stepSize * Math.pow(2.0, geometricSample) / 4.0) {
        return result;
      }
    }
  }

  /** Geometric sample with success probability 1 / 2, capped at {@link #GEOMETRIC_BOUND}. */
  private long sampleBoundedGeometric() {
    long result = 0;
    while (random.nextBoolean() && result < GEOMETRIC_BOUND) {
      result++;
    }
    return result;
  }

  /** Draws a long uniformly at random from {@code [0, n)}. */
  private long sampleUniform(long n) {
    long largestMultipleOfN = (Long.MAX_VALUE / n) * n;

    while (true) {
      long uniformNonNegativeLong = 0x7fffffffffffffffL & random.nextLong();
      if (uniformNonNegativeLong < largestMultipleOfN) {
        return uniformNonNegativeLong % n;
      }
    }
  }

  /**
   * Approximates the probability of {@code m + n / 2} under a binomial distribution of n fair
   * Bernoulli trials, following Lemma 7 of the secure noise generation paper. Note that m * m might
   * not be representable as long.
   */
  private static double approximateBinomialProbability(double sqrtN, long m) {
    if (Math.abs(m) > sqrtN * Math.sqrt(Math.log(sqrtN) / 2)) {
      return 0.0;
    }
    return (Math.sqrt(2.0 / Math.PI) / sqrtN)
        * Math.exp(-2.0 * Math.pow(m / sqrtN, 2))
        * (1 - (0.4 * Math.pow(2.0 * Math.log(sqrtN), 1.5) / sqrtN));
  }
}
