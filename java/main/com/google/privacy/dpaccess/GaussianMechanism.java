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
 * Implements the Gaussian mechanism: adds zero-mean Gaussian noise to each component of the data,
 * which makes the release {@code (epsilon, delta)}-differentially private for queries of the given
 * L_2 sensitivity.
 *
 * <p>The noise is calibrated with the classic analysis, {@code sigma = sqrt(2 * ln(1.25 / delta)) *
 * sensitivity / epsilon}, which only holds for {@code epsilon < 1}. Construction therefore fails
 * for larger values of epsilon.
 */
public class GaussianMechanism extends ElementwiseMechanism {
  private final double sensitivity;
  private final PrivacyBudget epsilonDelta;
  private final double sigma;
  private final GaussianNoise noise;

  public GaussianMechanism(double sensitivity, PrivacyBudget epsilonDelta) {
    this(sensitivity, epsilonDelta, new SecureRandom());
  }

  /**
   * Creates a mechanism drawing its noise from {@code random}. Seeded, non-secure sources should
   * only be used for testing.
   *
   * @throws IllegalArgumentException if the sensitivity is not positive, if epsilon is not in (0,
   *     1) or if delta is 0.
   */
  public GaussianMechanism(double sensitivity, PrivacyBudget epsilonDelta, Random random) {
    DpPreconditions.checkSensitivity(sensitivity);
    DpPreconditions.checkGaussianEpsilonDelta(epsilonDelta.epsilon(), epsilonDelta.delta());
    this.sensitivity = sensitivity;
    this.epsilonDelta = epsilonDelta;
    this.sigma = GaussianNoise.getSigma(sensitivity, epsilonDelta.epsilon(), epsilonDelta.delta());
    this.noise = new GaussianNoise(random);
  }

  @Override
  protected double randomize(double x) {
    return noise.addNoise(x, sigma);
  }

  public double getSensitivity() {
    return sensitivity;
  }

  /** Returns the standard deviation of the added noise. */
  public double getSigma() {
    return sigma;
  }

  @Override
  public PrivacyBudget epsilonDelta() {
    return epsilonDelta;
  }
}
