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

import java.security.SecureRandom;
import java.util.Random;

/**
 * {@link Sampler} drawing records independently, so the same record may be drawn more than once.
 * With n values in the data and m values sampled, let {@code p = 1 - (1 - 1/n)^m} be the
 * probability that a given value is sampled at least once. An {@code (epsilon, delta)} mechanism
 * becomes {@code (ln(1 + p * (e^epsilon - 1)), delta')} differentially private, where {@code
 * delta' = delta * sum_{k=1..m} C(m, k) (1/n)^k (1 - 1/n)^(m - k)}.
 *
 * <p>See Theorem 10 of <a href="https://arxiv.org/abs/1807.01647">Privacy Amplification by
 * Subsampling: Tight Analyses via Couplings and Divergences</a>.
 */
public class SampleWithReplacement<R> extends Sampler<R> {

  public SampleWithReplacement(
      DpMechanism<double[], R> mechanism, int sampleSize, int... dataShape) {
    this(mechanism, sampleSize, dataShape, new SecureRandom());
  }

  public SampleWithReplacement(
      DpMechanism<double[], R> mechanism, int sampleSize, int[] dataShape, Random random) {
    super(mechanism, sampleSize, dataShape, random);
  }

  @Override
  protected int[] sampleIndices(Random random, int numRecords, int sampleSize) {
    return SamplingUtil.sampleIndicesWithReplacement(random, numRecords, sampleSize);
  }

  @Override
  protected PrivacyBudget epsilonDeltaReduction(PrivacyBudget epsilonDelta) {
    double proportion = probabilitySampledAtLeastOnce(actualDataSize(), actualSampleSize());
    // The binomial sum over k = 1..m equals 1 - P[k = 0], i.e. the same proportion. Evaluating the
    // closed form avoids the overflow of C(m, k) for large m.
    return PrivacyBudget.create(
        amplifiedEpsilon(epsilonDelta.epsilon(), proportion), epsilonDelta.delta() * proportion);
  }

  /** Returns {@code 1 - (1 - 1/n)^m}. */
  static double probabilitySampledAtLeastOnce(long n, long m) {
    return -Math.expm1(m * Math.log1p(-1.0 / n));
  }
}
