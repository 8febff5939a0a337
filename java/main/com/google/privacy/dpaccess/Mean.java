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

import com.google.common.math.Stats;

/**
 * {@link Query} computing the arithmetic mean of its input. The mean is returned as a single
 * component array so that it can be passed to mechanisms and sensitivity norms directly.
 */
public final class Mean implements Query<double[], double[]> {

  @Override
  public double[] get(double[] data) {
    checkArgument(data.length > 0, "Cannot compute the mean of an empty array.");
    return new double[] {Stats.meanOf(data)};
  }
}
