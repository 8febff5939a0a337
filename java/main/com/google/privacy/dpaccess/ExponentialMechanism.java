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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Doubles;
import java.security.SecureRandom;
import java.util.Random;
import org.apache.commons.math3.distribution.EnumeratedIntegerDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.RandomGeneratorFactory;

/**
 * Implements the exponential mechanism: selects outcomes from a fixed range, each with probability
 * proportional to {@code exp(epsilon * u(data, r) / (2 * deltaU))}, where {@code u} is a utility
 * function of sensitivity {@code deltaU}. A single draw is {@code epsilon}-differentially private.
 *
 * <p>{@link #apply} returns {@code repetitions} independent draws, one per component of the
 * result. They are intended to approximate the output distribution; the reported budget covers a
 * single draw.
 *
 * <p>For more details, see <a href="https://www.cis.upenn.edu/~aaroth/Papers/privacybook.pdf">The
 * Algorithmic Foundations of Differential Privacy</a>, Section 3.4.
 *
 * @param <T> type of the private data scored by the utility function
 */
public class ExponentialMechanism<T> implements DpMechanism<T, double[]> {
  private final Params<T> params;
  private final PrivacyBudget epsilonDelta;
  private final RandomGenerator generator;

  private ExponentialMechanism(Params<T> params) {
    this.params = params;
    this.epsilonDelta = PrivacyBudget.ofEpsilon(params.epsilon());
    this.generator = RandomGeneratorFactory.createRandomGenerator(params.random());
  }

  public static <T> Params.Builder<T> builder() {
    return Params.Builder.newBuilder();
  }

  /** Scores a candidate outcome for the given private data. Higher scores are more likely. */
  @FunctionalInterface
  public interface UtilityFunction<T> {
    double utility(T data, double outcome);
  }

  /**
   * Draws {@code repetitions} outcomes from the range.
   *
   * @throws IllegalArgumentException if the utility function returns a non-finite score.
   */
  @Override
  public double[] apply(T data) {
    ImmutableList<Double> range = params.range();
    int[] indices = new int[range.size()];
    double[] logWeights = new double[range.size()];
    double maxLogWeight = Double.NEGATIVE_INFINITY;
    double factor = params.epsilon() / (2.0 * params.deltaU());
    for (int i = 0; i < range.size(); i++) {
      double utility = params.utilityFunction().utility(data, range.get(i));
      checkArgument(
          Double.isFinite(utility),
          "The utility of outcome %s must be finite. Provided value: %s",
          range.get(i),
          utility);
      indices[i] = i;
      logWeights[i] = factor * utility;
      maxLogWeight = Math.max(maxLogWeight, logWeights[i]);
    }

    // Shifted by the largest log weight so that exponentiation cannot overflow.
    double[] weights = new double[logWeights.length];
    for (int i = 0; i < logWeights.length; i++) {
      weights[i] = Math.exp(logWeights[i] - maxLogWeight);
    }
    EnumeratedIntegerDistribution outcomeDistribution =
        new EnumeratedIntegerDistribution(generator, indices, weights);

    int[] drawn = outcomeDistribution.sample(params.repetitions());
    double[] outcomes = new double[drawn.length];
    for (int i = 0; i < drawn.length; i++) {
      outcomes[i] = range.get(drawn[i]);
    }
    return outcomes;
  }

  @Override
  public PrivacyBudget epsilonDelta() {
    return epsilonDelta;
  }

  @AutoValue
  public abstract static class Params<T> {
    abstract UtilityFunction<T> utilityFunction();

    abstract ImmutableList<Double> range();

    abstract double deltaU();

    abstract double epsilon();

    abstract int repetitions();

    abstract Random random();

    @AutoValue.Builder
    public abstract static class Builder<T> {
      private static <T> Builder<T> newBuilder() {
        return new AutoValue_ExponentialMechanism_Params.Builder<T>()
            // A single draw unless more are requested.
            .repetitions(1)
            .random(new SecureRandom());
      }

      /** Utility function scoring each outcome of the range. */
      public abstract Builder<T> utilityFunction(UtilityFunction<T> value);

      /** Candidate outcomes. */
      public abstract Builder<T> range(ImmutableList<Double> value);

      public Builder<T> range(double... values) {
        return range(ImmutableList.copyOf(Doubles.asList(values)));
      }

      /** Sensitivity of the utility function. */
      public abstract Builder<T> deltaU(double value);

      /** Epsilon DP parameter of a single draw. */
      public abstract Builder<T> epsilon(double value);

      /** Number of independent draws returned by each call to apply. */
      public abstract Builder<T> repetitions(int value);

      /** Source of randomness. Seeded, non-secure sources should only be used for testing. */
      public abstract Builder<T> random(Random value);

      abstract Params<T> autoBuild();

      public ExponentialMechanism<T> build() {
        Params<T> params = autoBuild();
        checkArgument(!params.range().isEmpty(), "The range of outcomes must not be empty.");
        DpPreconditions.checkSensitivity(params.deltaU());
        DpPreconditions.checkEpsilon(params.epsilon());
        checkArgument(
            params.repetitions() > 0,
            "repetitions must be > 0. Provided value: %s",
            params.repetitions());
        return new ExponentialMechanism<>(params);
      }
    }
  }
}
