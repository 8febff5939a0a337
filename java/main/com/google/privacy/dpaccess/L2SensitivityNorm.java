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

/**
 * Euclidean distance between two arrays of the same length. This is the sensitivity the {@link
 * GaussianMechanism} is calibrated with.
 */
public final class L2SensitivityNorm implements SensitivityNorm<double[]> {

  @Override
  public double compute(double[] x1, double[] x2) {
    DpPreconditions.checkSameLength(x1, x2);
    double sumOfSquares = 0;
    for (int i = 0; i < x1.length; i++) {
      double difference = x1[i] - x2[i];
      sumOfSquares += difference * difference;
    }
    return Math.sqrt(sumOfSquares);
  }
}
