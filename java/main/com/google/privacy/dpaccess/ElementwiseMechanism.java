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

/**
 * Base class of mechanisms that randomize every component of a numerical value independently.
 * Arrays are randomized element-wise; scalars may be passed to {@link #apply(double)} directly.
 *
 * <p>Values read through a {@link DataNode} may be either a {@link Number} or a {@code double[]};
 * the release has the same shape as the value.
 */
public abstract class ElementwiseMechanism implements DpMechanism<double[], double[]> {

  /** Returns the randomized release of a single component. */
  protected abstract double randomize(double x);

  /** Validates {@code data} before any of its components is randomized. */
  protected void checkData(double[] data) {}

  /**
   * Returns a new array holding the randomized release of every component of {@code data}. The
   * input array is left unchanged.
   */
  @Override
  public double[] apply(double[] data) {
    checkNotNull(data, "data must not be null.");
    checkData(data);
    double[] result = new double[data.length];
    for (int i = 0; i < data.length; i++) {
      result[i] = randomize(data[i]);
    }
    return result;
  }

  /** Returns the randomized release of the scalar {@code x}. */
  public double apply(double x) {
    checkData(new double[] {x});
    return randomize(x);
  }

  /**
   * Returns the release of a value of either numerical shape: a {@link Double} for a {@link
   * Number}, a {@code double[]} for a {@code double[]}.
   *
   * @throws IllegalArgumentException if {@code data} is neither.
   */
  Object applyToValue(Object data) {
    checkNotNull(data, "data must not be null.");
    if (data instanceof Number) {
      return apply(((Number) data).doubleValue());
    }
    checkArgument(
        data instanceof double[],
        "%s applies to numbers and double arrays. Provided: %s",
        getClass().getSimpleName(),
        data.getClass().getSimpleName());
    return apply((double[]) data);
  }
}
