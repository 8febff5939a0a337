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
 * {@link Sampler} drawing distinct records. With {@code p = m / n} the proportion of sampled
 * values, an {@code (epsilon, delta)} mechanism becomes {@code (ln(1 + p * (e^epsilon - 1)), p *
 * delta)} differentially private.
 *
 * <p>See Theorem 9 of <a href="https://arxiv.org/abs/1807.01647">Privacy Amplification by
 * Subsampling: Tight Analyses via Couplings and Divergences</a>.
 */
public class SampleWithoutReplacement<R> extends Sampler<R> {

  public SampleWithoutReplacement(
      DpMechanism<double[], R> mechanism, int sampleSize, int... dataShape) {
    this(mechanism, sampleSize, dataShape, new SecureRandom());
  }

  public SampleWithoutReplacement(
      DpMechanism<double[], R> mechanism, int sampleSize, int[] dataShape, Random random) {
    super(mechanism, sampleSize, dataShape, random);
  }

  @Override
  protected int[] sampleIndices(Random random, int numRecords, int sampleSize) {
    return SamplingUtil.sampleIndicesWithoutReplacement(random, numRecords, sampleSize);
  }

  @Override
  protected PrivacyBudget epsilonDeltaReduction(PrivacyBudget epsilonDelta) {
    double proportion = (double) actualSampleSize() / actualDataSize();
    return PrivacyBudget.create(
        amplifiedEpsilon(epsilonDelta.epsilon(), proportion), proportion * epsilonDelta.delta());
  }
}
