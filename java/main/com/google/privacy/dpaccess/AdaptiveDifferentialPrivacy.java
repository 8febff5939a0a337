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

import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provides adaptive differential privacy through a privacy filter: every query is answered by a
 * {@link DpMechanism} and charged against a global {@code (epsilon, delta)} budget. Queries whose
 * cumulative cost would exhaust the budget are rejected with an {@link
 * ExceededPrivacyBudgetException}, which leaves the filter exactly in the state it was in before
 * the query.
 *
 * <p>Exhaustion is checked with two composition theorems from <a
 * href="https://arxiv.org/abs/1605.08294">Privacy Odometers and Filters: Pay-as-you-Go
 * Composition</a>: basic composition (Theorem 3.6) and, when {@code 0 < delta < 1/e}, advanced
 * composition (Theorem 5.1). A query is rejected only if every theorem that applies reports the
 * budget as exhausted, i.e. it is answered as long as one of them still certifies the budget.
 *
 * <p>The mechanism answering a query is either passed with the query or, if none is passed, the
 * default mechanism given at construction.
 *
 * <p>Note: this class is not thread-safe. Concurrent queries against the same instance must be
 * serialized by the caller.
 */
public class AdaptiveDifferentialPrivacy<T, R> implements DpMechanism<T, R> {
  private static final Logger logger = LoggerFactory.getLogger(AdaptiveDifferentialPrivacy.class);

  /** Constant of the advanced composition bound of Theorem 5.1. */
  private static final double ADVANCED_COMPOSITION_CONSTANT = 28.04;

  private final PrivacyBudget epsilonDelta;
  @Nullable private final DpMechanism<T, ? extends R> defaultMechanism;
  private final List<PrivacyBudget> accessHistory = new ArrayList<>();

  /** Creates a filter without a default mechanism; every query must then pass its mechanism. */
  public AdaptiveDifferentialPrivacy(PrivacyBudget epsilonDelta) {
    this.epsilonDelta = checkNotNull(epsilonDelta, "epsilonDelta must not be null.");
    this.defaultMechanism = null;
  }

  /**
   * Creates a filter answering queries with {@code defaultMechanism} unless a query passes its own
   * mechanism.
   *
   * @throws IllegalArgumentException if {@code defaultMechanism} is not differentially private.
   */
  public AdaptiveDifferentialPrivacy(
      PrivacyBudget epsilonDelta, DataAccessDefinition<T, ? extends R> defaultMechanism) {
    this.epsilonDelta = checkNotNull(epsilonDelta, "epsilonDelta must not be null.");
    this.defaultMechanism = checkDifferentiallyPrivate(checkNotNull(defaultMechanism));
  }

  /** Returns the global privacy budget of this filter. */
  @Override
  public PrivacyBudget epsilonDelta() {
    return epsilonDelta;
  }

  /** Returns the number of queries answered so far. */
  public int accessCount() {
    return accessHistory.size();
  }

  /**
   * Answers a query with the default mechanism.
   *
   * @throws IllegalArgumentException if no default mechanism has been configured.
   * @throws ExceededPrivacyBudgetException if answering would exhaust the privacy budget.
   */
  @Override
  public R apply(T data) {
    return apply(data, null);
  }

  /**
   * Answers a query with {@code mechanism}, or with the default mechanism if {@code mechanism} is
   * null.
   *
   * @throws IllegalArgumentException if {@code mechanism} is not differentially private, or if it
   *     is null and no default mechanism has been configured.
   * @throws ExceededPrivacyBudgetException if answering would exhaust the privacy budget.
   */
  @Override
  public R apply(T data, @Nullable DataAccessDefinition<T, ? extends R> mechanism) {
    DpMechanism<T, ? extends R> mechanismToApply = resolveMechanism(mechanism);
    PrivacyBudget cost = mechanismToApply.epsilonDelta();
    accessHistory.add(cost);

    boolean budgetExceeded = basicCompositionExceeded();
    if (0 < epsilonDelta.delta() && epsilonDelta.delta() < Math.exp(-1)) {
      budgetExceeded &= advancedCompositionExceeded();
    }
    if (budgetExceeded) {
      accessHistory.remove(accessHistory.size() - 1);
      logger.warn(
          "Rejected query costing {}: privacy budget {} exhausted after {} queries",
          cost,
          epsilonDelta,
          accessHistory.size());
      throw new ExceededPrivacyBudgetException(epsilonDelta);
    }
    logger.debug(
        "Accepted query costing {} ({} of budget {})", cost, accessHistory.size(), epsilonDelta);
    return DataAccessDefinitions.applyUntyped(mechanismToApply, data);
  }

  private DpMechanism<T, ? extends R> resolveMechanism(
      @Nullable DataAccessDefinition<T, ? extends R> mechanism) {
    if (mechanism != null) {
      return checkDifferentiallyPrivate(mechanism);
    }
    checkArgument(
        defaultMechanism != null,
        "No data access definition provided and no default mechanism configured.");
    return defaultMechanism;
  }

  /**
   * Basic adaptive composition, Theorem 3.6: exhausted if the sum of epsilons or the sum of deltas
   * exceeds the budget.
   */
  private boolean basicCompositionExceeded() {
    double epsilonSum = 0;
    double deltaSum = 0;
    for (PrivacyBudget access : accessHistory) {
      epsilonSum += access.epsilon();
      deltaSum += access.delta();
    }
    return epsilonSum > epsilonDelta.epsilon() || deltaSum > epsilonDelta.delta();
  }

  /**
   * Advanced adaptive composition, Theorem 5.1. Only valid for {@code 0 < delta < 1/e}.
   *
   * <p>With {@code h = epsilon^2 / (28.04 * ln(1 / delta))}, the budget is exhausted if {@code
   * sum(e_i * (exp(e_i) - 1) / 2) + sqrt((sum(e_i^2) + h) * (2 + ln(sum(e_i^2) / h + 1)) * ln(2 /
   * delta))} exceeds epsilon, or if the sum of deltas exceeds half of delta.
   */
  private boolean advancedCompositionExceeded() {
    double globalEpsilon = epsilonDelta.epsilon();
    double globalDelta = epsilonDelta.delta();

    double deltaSum = 0;
    double epsilonSquaredSum = 0;
    double a = 0;
    for (PrivacyBudget access : accessHistory) {
      double epsilon = access.epsilon();
      deltaSum += access.delta();
      epsilonSquaredSum += epsilon * epsilon;
      a += epsilon * Math.expm1(epsilon) * 0.5;
    }

    double h =
        globalEpsilon
            * globalEpsilon
            / (ADVANCED_COMPOSITION_CONSTANT * Math.log(1 / globalDelta));
    double b = epsilonSquaredSum + h;
    double c = 2 + Math.log(epsilonSquaredSum / h + 1);
    double d = Math.log(2 / globalDelta);
    double k = a + Math.sqrt(b * c * d);

    return k > globalEpsilon || deltaSum > globalDelta * 0.5;
  }

  private static <T, R> DpMechanism<T, ? extends R> checkDifferentiallyPrivate(
      DataAccessDefinition<T, ? extends R> mechanism) {
    checkArgument(
        mechanism instanceof DpMechanism,
        "%s is not differentially private and cannot access differentially private data.",
        mechanism.getClass().getSimpleName());
    @SuppressWarnings("unchecked") // DpMechanism only narrows DataAccessDefinition.
    DpMechanism<T, ? extends R> dpMechanism = (DpMechanism<T, ? extends R>) mechanism;
    return dpMechanism;
  }
}
