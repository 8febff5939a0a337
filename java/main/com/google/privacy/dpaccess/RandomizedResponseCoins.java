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
 * Randomized response with two coins for binary data. For every component, a first coin with
 * heads probability {@code probHeadFirst} is flipped: heads releases the true value, tails releases
 * the outcome (1 for heads) of a second coin with heads probability {@code probHeadSecond}.
 *
 * <p>With the default fair coins the mechanism is {@code ln(3)}-differentially private. In general
 * its epsilon is the log of the largest ratio between the probabilities of releasing the same value
 * for the two possible inputs.
 *
 * <p>For more details, see <a href="https://www.cis.upenn.edu/~aaroth/Papers/privacybook.pdf">The
 * Algorithmic Foundations of Differential Privacy</a>, Section 3.2.
 */
public class RandomizedResponseCoins extends ElementwiseMechanism {
  private static final double FAIR_COIN = 0.5;

  private final double probHeadFirst;
  private final double probHeadSecond;
  private final PrivacyBudget epsilonDelta;
  private final Random random;

  /** Creates the classic randomized response mechanism with two fair coins. */
  public RandomizedResponseCoins() {
    this(FAIR_COIN, FAIR_COIN);
  }

  public RandomizedResponseCoins(double probHeadFirst, double probHeadSecond) {
    this(probHeadFirst, probHeadSecond, new SecureRandom());
  }

  /**
   * @throws IllegalArgumentException if either probability is not strictly between 0 and 1, in
   *     which case the mechanism would either never release the true value or not be private.
   */
  public RandomizedResponseCoins(double probHeadFirst, double probHeadSecond, Random random) {
    checkArgument(
        probHeadFirst > 0 && probHeadFirst < 1,
        "probHeadFirst must be > 0 and < 1. Provided value: %s",
        probHeadFirst);
    checkArgument(
        probHeadSecond > 0 && probHeadSecond < 1,
        "probHeadSecond must be > 0 and < 1. Provided value: %s",
        probHeadSecond);
    this.probHeadFirst = probHeadFirst;
    this.probHeadSecond = probHeadSecond;
    this.epsilonDelta = PrivacyBudget.ofEpsilon(computeEpsilon(probHeadFirst, probHeadSecond));
    this.random = checkNotNull(random);
  }

  /**
   * Returns {@code ln max(P[1 | 1] / P[1 | 0], P[0 | 0] / P[0 | 1])}, where {@code P[y | x]} is the
   * probability of releasing y for the true value x.
   */
  static double computeEpsilon(double probHeadFirst, double probHeadSecond) {
    double probOneGivenZero = (1 - probHeadFirst) * probHeadSecond;
    double probOneGivenOne = probHeadFirst + probOneGivenZero;
    double probZeroGivenOne = (1 - probHeadFirst) * (1 - probHeadSecond);
    double probZeroGivenZero = 1 - probOneGivenZero;
    return Math.log(
        Math.max(probOneGivenOne / probOneGivenZero, probZeroGivenZero / probZeroGivenOne));
  }

  @Override
  protected void checkData(double[] data) {
    DpPreconditions.checkBinary(data);
  }

  @Override
  protected double randomize(double x) {
    if (random.nextDouble() < probHeadFirst) {
      return x;
    }
    return SamplingUtil.sampleBernoulli(random, probHeadSecond);
  }

  @Override
  public PrivacyBudget epsilonDelta() {
    return epsilonDelta;
  }
}
