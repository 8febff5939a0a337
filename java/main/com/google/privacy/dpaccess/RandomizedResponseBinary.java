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
 * Randomized response for binary data parametrized by the probabilities of releasing 1: {@code f0}
 * for a true value of 0 and {@code f1} for a true value of 1.
 *
 * <p>The mechanism is {@code epsilon}-differentially private iff {@code epsilon} is at least the
 * log of the largest ratio between {@code P[y | 0]} and {@code P[y | 1]} over both outcomes y.
 * Construction fails if the declared epsilon is smaller, or if the parametrization releases every
 * value deterministically.
 *
 * <p>For more details, see <a href="https://arxiv.org/abs/1407.6981">RAPPOR: Randomized
 * Aggregatable Privacy-Preserving Ordinal Response</a>.
 */
public class RandomizedResponseBinary extends ElementwiseMechanism {
  /** Relative slack granted to the declared epsilon for rounding errors in the ratio logs. */
  private static final double EPSILON_TOLERANCE = 1e-12;

  private final double f0;
  private final double f1;
  private final PrivacyBudget epsilonDelta;
  private final Random random;

  public RandomizedResponseBinary(double f0, double f1, double epsilon) {
    this(f0, f1, epsilon, new SecureRandom());
  }

  /**
   * @throws IllegalArgumentException if {@code f0} or {@code f1} is not a probability, if both are
   *     0 or 1, or if the parametrization is not {@code epsilon}-differentially private.
   */
  public RandomizedResponseBinary(double f0, double f1, double epsilon, Random random) {
    DpPreconditions.checkProbability(f0, "f0");
    DpPreconditions.checkProbability(f1, "f1");
    checkArgument(
        !(isDeterministic(f0) && isDeterministic(f1)),
        "The mechanism must randomize its output. Provided values: f0 = %s, f1 = %s",
        f0,
        f1);
    this.epsilonDelta = PrivacyBudget.ofEpsilon(epsilon);
    double requiredEpsilon = computeEpsilon(f0, f1);
    checkArgument(
        requiredEpsilon <= epsilon * (1 + EPSILON_TOLERANCE),
        "f0 = %s and f1 = %s require epsilon >= %s. Provided value: %s",
        f0,
        f1,
        requiredEpsilon,
        epsilon);
    this.f0 = f0;
    this.f1 = f1;
    this.random = checkNotNull(random);
  }

  /** Returns the smallest epsilon for which the parametrization is differentially private. */
  static double computeEpsilon(double f0, double f1) {
    return Math.max(absLogRatio(f1, f0), absLogRatio(1 - f1, 1 - f0));
  }

  private static double absLogRatio(double a, double b) {
    if (a == b) {
      return 0.0;
    }
    if (a == 0.0 || b == 0.0) {
      return Double.POSITIVE_INFINITY;
    }
    return Math.abs(Math.log(a) - Math.log(b));
  }

  private static boolean isDeterministic(double probability) {
    return probability == 0.0 || probability == 1.0;
  }

  @Override
  protected void checkData(double[] data) {
    DpPreconditions.checkBinary(data);
  }

  @Override
  protected double randomize(double x) {
    return SamplingUtil.sampleBernoulli(random, x == 1.0 ? f1 : f0);
  }

  @Override
  public PrivacyBudget epsilonDelta() {
    return epsilonDelta;
  }
}
