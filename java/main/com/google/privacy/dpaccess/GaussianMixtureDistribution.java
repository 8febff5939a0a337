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

import java.security.SecureRandom;
import java.util.Random;
import org.apache.commons.math3.distribution.EnumeratedIntegerDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.RandomGeneratorFactory;

/**
 * Mixture of univariate normal distributions. Each value is drawn from a component chosen with
 * probability proportional to its weight.
 */
public final class GaussianMixtureDistribution implements ProbabilityDistribution {
  private final EnumeratedIntegerDistribution componentDistribution;
  private final NormalDistribution[] components;

  public GaussianMixtureDistribution(
      double[] means, double[] standardDeviations, double[] weights) {
    this(means, standardDeviations, weights, new SecureRandom());
  }

  /**
   * @throws IllegalArgumentException if the arrays are empty or of different lengths, if a standard
   *     deviation is not positive, or if the weights are negative or sum to zero.
   */
  public GaussianMixtureDistribution(
      double[] means, double[] standardDeviations, double[] weights, Random random) {
    checkArgument(means.length > 0, "At least one component is required.");
    DpPreconditions.checkSameLength(means, standardDeviations);
    DpPreconditions.checkSameLength(means, weights);
    double weightSum = 0;
    for (double weight : weights) {
      checkArgument(
          Double.isFinite(weight) && weight >= 0,
          "Weights must be >= 0 and finite. Provided value: %s",
          weight);
      weightSum += weight;
    }
    checkArgument(weightSum > 0, "Weights must not all be zero.");

    RandomGenerator generator = RandomGeneratorFactory.createRandomGenerator(checkNotNull(random));
    int[] componentIndices = new int[means.length];
    components = new NormalDistribution[means.length];
    for (int i = 0; i < means.length; i++) {
      checkArgument(
          standardDeviations[i] > 0,
          "Standard deviations must be > 0. Provided value: %s",
          standardDeviations[i]);
      componentIndices[i] = i;
      components[i] = new NormalDistribution(generator, means[i], standardDeviations[i]);
    }
    // Weights are normalized by the distribution.
    componentDistribution = new EnumeratedIntegerDistribution(generator, componentIndices, weights);
  }

  @Override
  public double[] sample(int size) {
    checkArgument(size >= 0, "size must be >= 0. Provided value: %s", size);
    double[] result = new double[size];
    for (int i = 0; i < size; i++) {
      result[i] = components[componentDistribution.sample()].sample();
    }
    return result;
  }
}
