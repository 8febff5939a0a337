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

import java.util.Random;

/**
 * Applies a {@link DpMechanism} to a random sample of the data instead of the data itself, which
 * reduces the privacy budget spent by the mechanism.
 *
 * <p>The data is a flat array whose shape is declared at construction. Records are taken along the
 * first dimension of that shape; the remaining dimensions are stored contiguously, in row-major
 * order, within each record. A one-dimensional shape {@code {n}} describes n scalar records.
 *
 * <p>The reported {@link #epsilonDelta()} is computed from the wrapped mechanism's budget, not
 * measured.
 */
public abstract class Sampler<R> implements DpMechanism<double[], R> {
  private final DpMechanism<double[], R> mechanism;
  private final int sampleSize;
  private final int numRecords;
  private final int recordLength;
  private final Random random;

  /**
   * @throws IllegalArgumentException if {@code sampleSize} is not positive or exceeds the first
   *     dimension of {@code dataShape}, or if {@code dataShape} is empty or not positive.
   */
  protected Sampler(
      DpMechanism<double[], R> mechanism, int sampleSize, int[] dataShape, Random random) {
    DpPreconditions.checkSampleSize(sampleSize, dataShape);
    this.mechanism = checkNotNull(mechanism);
    this.sampleSize = sampleSize;
    this.numRecords = dataShape[0];
    int length = 1;
    for (int i = 1; i < dataShape.length; i++) {
      length = Math.multiplyExact(length, dataShape[i]);
    }
    this.recordLength = length;
    this.random = checkNotNull(random);
  }

  /**
   * Draws a sample of {@code sampleSize} records from {@code data} and returns the wrapped
   * mechanism's release of the sample.
   *
   * @throws IllegalArgumentException if {@code data} does not match the declared shape.
   */
  @Override
  public R apply(double[] data) {
    checkNotNull(data, "data must not be null.");
    checkArgument(
        (long) data.length == (long) numRecords * recordLength,
        "The data must hold %s records of length %s. Provided length: %s",
        numRecords,
        recordLength,
        data.length);
    return mechanism.apply(sample(data));
  }

  @Override
  public PrivacyBudget epsilonDelta() {
    return epsilonDeltaReduction(mechanism.epsilonDelta());
  }

  /** Returns the sample of {@code data} the wrapped mechanism is applied to. */
  protected double[] sample(double[] data) {
    return SamplingUtil.gatherRecords(
        data, recordLength, sampleIndices(random, numRecords, sampleSize));
  }

  /** Returns the indices of the sampled records. */
  protected abstract int[] sampleIndices(Random random, int numRecords, int sampleSize);

  /** Returns the budget spent by the sampler given the budget of the wrapped mechanism. */
  protected abstract PrivacyBudget epsilonDeltaReduction(PrivacyBudget epsilonDelta);

  /** Number of values drawn per call, i.e. the sample size times the record length. */
  protected final long actualSampleSize() {
    return (long) sampleSize * recordLength;
  }

  /** Number of values in the data, i.e. the product of all dimensions of its shape. */
  protected final long actualDataSize() {
    return (long) numRecords * recordLength;
  }

  /** Returns {@code ln(1 + proportion * (e^epsilon - 1))}. */
  static double amplifiedEpsilon(double epsilon, double proportion) {
    return Math.log1p(proportion * Math.expm1(epsilon));
  }
}
