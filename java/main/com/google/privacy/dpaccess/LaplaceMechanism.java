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
 * Implements the Laplace mechanism: adds zero-mean Laplace noise of scale {@code sensitivity /
 * epsilon} to each component of the data, which makes the release {@code epsilon}-differentially
 * private for queries of the given L_1 sensitivity.
 *
 * <p>For more details, see <a href="https://www.cis.upenn.edu/~aaroth/Papers/privacybook.pdf">The
 * Algorithmic Foundations of Differential Privacy</a>, Definition 3.3.
 */
public class LaplaceMechanism extends ElementwiseMechanism {
  private final double sensitivity;
  private final PrivacyBudget epsilonDelta;
  private final LaplaceNoise noise;

  public LaplaceMechanism(double sensitivity, double epsilon) {
    this(sensitivity, epsilon, new SecureRandom());
  }

  /**
   * Creates a mechanism drawing its noise from {@code random}. Seeded, non-secure sources should
   * only be used for testing.
   */
  public LaplaceMechanism(double sensitivity, double epsilon, Random random) {
    DpPreconditions.checkSensitivity(sensitivity);
    this.sensitivity = sensitivity;
    this.epsilonDelta = PrivacyBudget.ofEpsilon(epsilon);
    this.noise = new LaplaceNoise(random);
  }

  @Override
  protected double randomize(double x) {
    return noise.addNoise(x, sensitivity, epsilonDelta.epsilon());
  }

  public double getSensitivity() {
    return sensitivity;
  }

  @Override
  public PrivacyBudget epsilonDelta() {
    return epsilonDelta;
  }
}
