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

import com.google.auto.value.AutoValue;

/**
 * An (epsilon, delta) differential privacy budget. Instances are validated on creation: epsilon
 * must be positive and finite, delta must lie between 0 and 1.
 */
@AutoValue
public abstract class PrivacyBudget {
  public abstract double epsilon();

  public abstract double delta();

  public static PrivacyBudget create(double epsilon, double delta) {
    DpPreconditions.checkEpsilon(epsilon);
    DpPreconditions.checkDelta(delta);
    return new AutoValue_PrivacyBudget(epsilon, delta);
  }

  /**
   * Creates a budget from an {@code (epsilon, delta)} pair.
   *
   * @throws IllegalArgumentException if {@code epsilonDelta} does not hold exactly two values or
   *     if either of them is out of range.
   */
  public static PrivacyBudget of(double... epsilonDelta) {
    DpPreconditions.checkEpsilonDeltaArity(epsilonDelta);
    return create(epsilonDelta[0], epsilonDelta[1]);
  }

  /** Returns an epsilon-only budget, i.e. one with a delta of 0. */
  public static PrivacyBudget ofEpsilon(double epsilon) {
    return create(epsilon, 0.0);
  }

  @Override
  public final String toString() {
    return "(" + epsilon() + ", " + delta() + ")";
  }
}
