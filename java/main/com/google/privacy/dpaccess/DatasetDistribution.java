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

/**
 * Empirical distribution of a finite dataset. Each call draws distinct values of the dataset, so a
 * sample can never be larger than the dataset itself.
 */
public final class DatasetDistribution implements ProbabilityDistribution {
  private final double[] dataset;
  private final Random random;

  public DatasetDistribution(double[] dataset) {
    this(dataset, new SecureRandom());
  }

  public DatasetDistribution(double[] dataset, Random random) {
    this.dataset = checkNotNull(dataset).clone();
    this.random = checkNotNull(random);
  }

  /** @throws IllegalArgumentException if {@code size} exceeds the size of the dataset. */
  @Override
  public double[] sample(int size) {
    checkArgument(
        size >= 0 && size <= dataset.length,
        "Cannot draw %s values from a dataset of %s values.",
        size,
        dataset.length);
    return SamplingUtil.gatherRecords(
        dataset, 1, SamplingUtil.sampleIndicesWithoutReplacement(random, dataset.length, size));
  }
}
