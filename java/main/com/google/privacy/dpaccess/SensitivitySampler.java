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
import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.math.Stats;
import java.util.Arrays;
import javax.annotation.Nullable;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Estimates the sensitivity of a {@link Query} empirically, for queries whose sensitivity cannot be
 * derived analytically. Pairs of databases are drawn from a {@link ProbabilityDistribution}, the
 * query is evaluated on both and the results are reduced with a {@link SensitivityNorm}. The
 * largest observed distance upper bounds the sensitivity with probability at least {@code 1 -
 * gamma}.
 *
 * <p>The number of pairs {@code m} and the confidence {@code gamma} determine each other. With
 * {@code m} configured, {@code gamma} is the minimum over {@code rho} of {@code rho +
 * sqrt(ln(1 / rho) / (2 * m))}. With {@code gamma} configured, {@code m} is the smallest number of
 * pairs achieving it, i.e. the minimum over {@code 0 < rho < gamma} of {@code ln(1 / rho) / (2 *
 * (gamma - rho)^2)}.
 *
 * <p>For more details, see <a href="https://arxiv.org/abs/1706.02562">Pain-Free Random
 * Differential Privacy with Sensitivity Sampling</a>.
 */
public class SensitivitySampler {
  private static final Logger logger = LoggerFactory.getLogger(SensitivitySampler.class);

  private static final double MIN_RHO = 1e-12;
  private static final double RELATIVE_TOLERANCE = 1e-10;
  private static final double ABSOLUTE_TOLERANCE = 1e-14;
  private static final int MAX_EVALUATIONS = 1000;

  /** How the second database of each pair is drawn. */
  public enum SamplingPolicy {
    /** The second database is the first with its last record replaced by a fresh draw. */
    NEIGHBORING,
    /** The second database is drawn independently of the first. */
    INDEPENDENT
  }

  private final Params params;
  private final int numSamples;
  private final double gamma;

  private SensitivitySampler(Params params, int numSamples, double gamma) {
    this.params = params;
    this.numSamples = numSamples;
    this.gamma = gamma;
  }

  public static Params.Builder builder() {
    return Params.Builder.newBuilder();
  }

  /** Returns the number of database pairs drawn per estimate. */
  public int getNumSamples() {
    return numSamples;
  }

  /** Returns the probability that an estimate underestimates the sensitivity. */
  public double getGamma() {
    return gamma;
  }

  /**
   * Draws {@link #getNumSamples()} pairs of databases of {@code sampleSize} values each and returns
   * the estimated sensitivity of {@code query} under {@code norm}.
   *
   * @throws IllegalArgumentException if {@code distribution} cannot produce databases of the
   *     configured size.
   */
  public <R> SensitivityEstimate sampleSensitivity(
      Query<double[], R> query, SensitivityNorm<R> norm, ProbabilityDistribution distribution) {
    checkNotNull(query, "query must not be null.");
    checkNotNull(norm, "norm must not be null.");
    checkNotNull(distribution, "distribution must not be null.");

    int sampleSize = params.sampleSize();
    double[] distances = new double[numSamples];
    for (int i = 0; i < numSamples; i++) {
      double[] first = distribution.sample(sampleSize);
      double[] second;
      if (params.samplingPolicy() == SamplingPolicy.NEIGHBORING) {
        second = first.clone();
        second[sampleSize - 1] = distribution.sample(1)[0];
      } else {
        second = distribution.sample(sampleSize);
      }
      distances[i] = norm.compute(query.get(first), query.get(second));
    }
    Arrays.sort(distances);

    SensitivityEstimate estimate =
        SensitivityEstimate.create(
            distances[numSamples - 1], Stats.meanOf(distances), numSamples, gamma);
    logger.debug("Estimated sensitivity {} from {} samples", estimate.sensitivity(), numSamples);
    return estimate;
  }

  /** Returns the confidence achieved with {@code numSamples} pairs of databases. */
  @VisibleForTesting
  static double gammaForNumSamples(int numSamples) {
    UnivariateFunction objective = rho -> rho + Math.sqrt(Math.log(1 / rho) / (2.0 * numSamples));
    return minimize(objective, MIN_RHO, 1.0).getValue();
  }

  /** Returns the number of pairs of databases needed to achieve confidence {@code gamma}. */
  @VisibleForTesting
  static int numSamplesForGamma(double gamma) {
    UnivariateFunction objective =
        rho -> Math.log(1 / rho) / (2.0 * (gamma - rho) * (gamma - rho));
    double numSamples = Math.ceil(minimize(objective, MIN_RHO, gamma * (1 - MIN_RHO)).getValue());
    checkArgument(
        numSamples <= Integer.MAX_VALUE,
        "gamma %s requires more than Integer.MAX_VALUE samples.",
        gamma);
    return (int) numSamples;
  }

  private static UnivariatePointValuePair minimize(
      UnivariateFunction objective, double lower, double upper) {
    return new BrentOptimizer(RELATIVE_TOLERANCE, ABSOLUTE_TOLERANCE)
        .optimize(
            new MaxEval(MAX_EVALUATIONS),
            new UnivariateObjectiveFunction(objective),
            GoalType.MINIMIZE,
            new SearchInterval(lower, upper));
  }

  @AutoValue
  public abstract static class Params {
    abstract int sampleSize();

    @Nullable
    abstract Integer numSamples();

    @Nullable
    abstract Double gamma();

    abstract SamplingPolicy samplingPolicy();

    @AutoValue.Builder
    public abstract static class Builder {
      private static Builder newBuilder() {
        Builder builder = new AutoValue_SensitivitySampler_Params.Builder();
        // Neighboring databases unless configured otherwise.
        builder.samplingPolicy(SamplingPolicy.NEIGHBORING);
        return builder;
      }

      /** Number of values in each drawn database. */
      public abstract Builder sampleSize(int value);

      /** Number of pairs of databases drawn. Mutually exclusive with {@link #gamma}. */
      public abstract Builder numSamples(Integer value);

      /**
       * Probability that the estimate underestimates the sensitivity. Mutually exclusive with
       * {@link #numSamples}.
       */
      public abstract Builder gamma(Double value);

      public abstract Builder samplingPolicy(SamplingPolicy value);

      abstract Params autoBuild();

      /**
       * @throws IllegalStateException if neither or both of numSamples and gamma are set.
       * @throws IllegalArgumentException if a parameter is out of range.
       */
      public SensitivitySampler build() {
        Params params = autoBuild();
        checkState(
            (params.numSamples() == null) != (params.gamma() == null),
            "Exactly one of numSamples and gamma must be set.");
        checkArgument(
            params.sampleSize() > 0,
            "sampleSize must be > 0. Provided value: %s",
            params.sampleSize());

        int numSamples;
        double gamma;
        if (params.numSamples() != null) {
          numSamples = params.numSamples();
          checkArgument(numSamples > 0, "numSamples must be > 0. Provided value: %s", numSamples);
          gamma = gammaForNumSamples(numSamples);
        } else {
          gamma = params.gamma();
          checkArgument(
              gamma > 0 && gamma < 1, "gamma must be > 0 and < 1. Provided value: %s", gamma);
          numSamples = numSamplesForGamma(gamma);
        }
        logger.debug(
            "Configured sensitivity sampling: {} samples of size {}, gamma {}, policy {}",
            numSamples,
            params.sampleSize(),
            gamma,
            params.samplingPolicy());
        return new SensitivitySampler(params, numSamples, gamma);
      }
    }
  }
}
