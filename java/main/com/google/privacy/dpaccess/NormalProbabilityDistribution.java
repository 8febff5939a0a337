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
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.RandomGeneratorFactory;

/** Univariate normal distribution. */
public final class NormalProbabilityDistribution implements ProbabilityDistribution {
  private final NormalDistribution distribution;

  public NormalProbabilityDistribution(double mean, double standardDeviation) {
    this(mean, standardDeviation, new SecureRandom());
  }

  public NormalProbabilityDistribution(double mean, double standardDeviation, Random random) {
    checkArgument(Double.isFinite(mean), "mean must be finite. Provided value: %s", mean);
    checkArgument(
        Double.isFinite(standardDeviation) && standardDeviation > 0,
        "standardDeviation must be > 0 and finite. Provided value: %s",
        standardDeviation);
    this.distribution =
        new NormalDistribution(
            RandomGeneratorFactory.createRandomGenerator(checkNotNull(random)),
            mean,
            standardDeviation);
  }

  @Override
  public double[] sample(int size) {
    checkArgument(size >= 0, "size must be >= 0. Provided value: %s", size);
    return size == 0 ? new double[0] : distribution.sample(size);
  }
}
