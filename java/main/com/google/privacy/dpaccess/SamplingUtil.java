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
import static java.lang.Math.max;
import static java.lang.Math.min;

import java.util.Random;

/** Functions for sampling from several distributions and for subsampling records. */
final class SamplingUtil {

  private SamplingUtil() {}

  /**
   * Returns a sample drawn from the geometric distribution of parameter {@code p = 1 - e^-lambda},
   * i.e., the number of Bernoulli trials until the first success where the success probability is
   * {@code 1 - e^-lambda}. The returned sample is truncated to the max long value. To ensure that a
   * truncation happens with probability less than 10^-6, {@code lambda} must be greater than 2^-59.
   */
  static long sampleGeometric(Random random, double lambda) {
    checkArgument(
        lambda > 1.0 / (1L << 59),
        "The parameter lambda must be at least 2^-59. Provided value: %s",
        lambda);

    if (random.nextDouble() > -1.0 * Math.expm1(-1.0 * lambda * Long.MAX_VALUE)) {
      return Long.MAX_VALUE;
    }

    // Binary search for the sample in (left, right]. Each iteration keeps either the left or the
    // right half with the probability of the sample being contained in it.
    long left = 0;
    long right = Long.MAX_VALUE;

    while (left + 1 < right) {
      // Split the probability mass of the interval approximately in half.
      long mid =
          (long)
              Math.ceil(
                  (left
                      - (Math.log(0.5) + Math.log1p(Math.exp(lambda * (left - right)))) / lambda));
      mid = min(max(mid, left + 1), right - 1);

      // q = Pr[X <= mid | left < X <= right], approximately one half.
      double q = Math.expm1(lambda * (left - mid)) / Math.expm1(lambda * (left - right));
      if (random.nextDouble() <= q) {
        right = mid;
      } else {
        left = mid;
      }
    }
    return right;
  }

  /**
   * Returns a sample drawn from a geometric distribution that is mirrored at 0. The non-negative
   * part of the distribution's PDF matches the PDF of a geometric distribution of parameter {@code
   * p = 1 - e^-lambda} that is shifted to the left by 1 and scaled accordingly.
   */
  static long sampleTwoSidedGeometric(Random random, double lambda) {
    long geometricSample = 0;
    boolean sign = false;
    // Keep a sample of 0 only if the sign is positive, otherwise 0 would be twice as likely.
    while (geometricSample == 0 && !sign) {
      geometricSample = sampleGeometric(random, lambda) - 1;
      sign = random.nextBoolean();
    }
    return sign ? geometricSample : -geometricSample;
  }

  /** Returns 1 with probability {@code p} and 0 otherwise. */
  static double sampleBernoulli(Random random, double p) {
    return random.nextDouble() < p ? 1.0 : 0.0;
  }

  /**
   * Returns {@code sampleSize} distinct indices drawn uniformly at random from {@code [0,
   * populationSize)}, in the order they were drawn. Uses a partial Fisher-Yates shuffle.
   */
  static int[] sampleIndicesWithoutReplacement(Random random, int populationSize, int sampleSize) {
    checkArgument(
        sampleSize >= 0 && sampleSize <= populationSize,
        "sampleSize must be between 0 and %s. Provided value: %s",
        populationSize,
        sampleSize);
    int[] population = new int[populationSize];
    for (int i = 0; i < populationSize; i++) {
      population[i] = i;
    }
    for (int i = 0; i < sampleSize; i++) {
      int j = i + random.nextInt(populationSize - i);
      int swap = population[i];
      population[i] = population[j];
      population[j] = swap;
    }
    int[] sample = new int[sampleSize];
    System.arraycopy(population, 0, sample, 0, sampleSize);
    return sample;
  }

  /**
   * Returns {@code sampleSize} indices drawn independently and uniformly at random from {@code [0,
   * populationSize)}.
   */
  static int[] sampleIndicesWithReplacement(Random random, int populationSize, int sampleSize) {
    checkArgument(
        populationSize > 0, "populationSize must be > 0. Provided value: %s", populationSize);
    checkArgument(sampleSize >= 0, "sampleSize must be >= 0. Provided value: %s", sampleSize);
    int[] sample = new int[sampleSize];
    for (int i = 0; i < sampleSize; i++) {
      sample[i] = random.nextInt(populationSize);
    }
    return sample;
  }

  /**
   * Copies the records at {@code indices} out of {@code data}, where each record is a contiguous
   * block of {@code recordLength} values.
   */
  static double[] gatherRecords(double[] data, int recordLength, int[] indices) {
    double[] result = new double[indices.length * recordLength];
    for (int i = 0; i < indices.length; i++) {
      System.arraycopy(data, indices[i] * recordLength, result, i * recordLength, recordLength);
    }
    return result;
  }
}
