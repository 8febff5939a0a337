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

/** Utilities which validate the correctness of DP parameters and mechanism inputs. */
public class DpPreconditions {

  private DpPreconditions() {}

  static void checkEpsilonDeltaArity(double[] epsilonDelta) {
    checkNotNull(epsilonDelta, "epsilonDelta must not be null.");
    checkArgument(
        epsilonDelta.length == 2,
        "epsilonDelta must contain exactly two values (epsilon, delta). Provided length: %s",
        epsilonDelta.length);
  }

  static void checkEpsilon(double epsilon) {
    checkArgument(
        Double.isFinite(epsilon) && epsilon > 0,
        "epsilon must be > 0 and < infinity. Provided value: %s",
        epsilon);
  }

  /** Delta of a privacy budget. A delta of 1 is a valid, if vacuous, budget. */
  static void checkDelta(double delta) {
    checkArgument(
        delta >= 0 && delta <= 1, "delta must be >= 0 and <= 1. Provided value: %s", delta);
  }

  static void checkGaussianEpsilonDelta(double epsilon, double delta) {
    checkArgument(
        epsilon > 0 && epsilon < 1,
        "epsilon must be > 0 and < 1 for the Gaussian mechanism. Provided value: %s",
        epsilon);
    checkArgument(
        delta > 0, "delta must be > 0 for the Gaussian mechanism. Provided value: %s", delta);
  }

  static void checkSensitivity(double sensitivity) {
    checkArgument(
        Double.isFinite(sensitivity) && sensitivity > 0,
        "sensitivity must be > 0 and finite. Provided value: %s",
        sensitivity);
  }

  static void checkProbability(double probability, String name) {
    checkArgument(
        probability >= 0 && probability <= 1,
        "%s must be >= 0 and <= 1. Provided value: %s",
        name,
        probability);
  }

  static void checkBinary(double value) {
    checkArgument(
        value == 0.0 || value == 1.0,
        "Randomized response requires binary data, i.e. values 0 or 1. Provided value: %s",
        value);
  }

  static void checkBinary(double[] values) {
    checkNotNull(values, "data must not be null.");
    for (double value : values) {
      checkBinary(value);
    }
  }

  static void checkSampleSize(int sampleSize, int[] dataShape) {
    checkNotNull(dataShape, "dataShape must not be null.");
    checkArgument(dataShape.length > 0, "dataShape must have at least one dimension.");
    for (int dimension : dataShape) {
      checkArgument(
          dimension > 0, "All dimensions of dataShape must be > 0. Provided value: %s", dimension);
    }
    checkArgument(sampleSize > 0, "sampleSize must be > 0. Provided value: %s", sampleSize);
    checkArgument(
        sampleSize <= dataShape[0],
        "sampleSize %s must not exceed the size of the first dimension of the data: %s",
        sampleSize,
        dataShape[0]);
  }

  static void checkSameLength(double[] x1, double[] x2) {
    checkArgument(
        x1.length == x2.length,
        "Both values must have the same length. Provided lengths: %s and %s",
        x1.length,
        x2.length);
  }
}
