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
 * Result of {@link SensitivitySampler#sampleSensitivity}: an empirical sensitivity that bounds the
 * true sensitivity of the query with probability at least {@code 1 - gamma}, together with the mean
 * of the observed distances.
 */
@AutoValue
public abstract class SensitivityEstimate {

  static SensitivityEstimate create(
      double sensitivity, double mean, int numSamples, double gamma) {
    return new AutoValue_SensitivityEstimate(sensitivity, mean, numSamples, gamma);
  }

  /** High probability upper bound of the sensitivity. */
  public abstract double sensitivity();

  /** Mean of the observed distances. */
  public abstract double mean();

  /** Number of database pairs the estimate is computed from. */
  public abstract int numSamples();

  /** Probability that {@link #sensitivity()} underestimates the true sensitivity. */
  public abstract double gamma();
}
