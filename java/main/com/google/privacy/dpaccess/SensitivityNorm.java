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
 * Distance between two outputs of a {@link Query}. The {@link SensitivitySampler} reduces every
 * pair of query results it observes with a norm.
 */
@FunctionalInterface
public interface SensitivityNorm<R> {

  /** Returns the distance between {@code x1} and {@code x2}. */
  double compute(R x1, R x2);
}
