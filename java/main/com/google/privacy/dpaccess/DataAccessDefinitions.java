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

/** Applies access definitions to values whose type is only known at runtime. */
final class DataAccessDefinitions {

  private DataAccessDefinitions() {}

  /**
   * Returns the release of {@code data} by {@code definition}. Numerical mechanisms release a
   * {@link Number} as a scalar and a {@code double[]} element-wise.
   *
   * @throws IllegalArgumentException if {@code definition} is a {@link Sampler} and {@code data}
   *     is not an array, or if {@code definition} is numerical and {@code data} is not.
   */
  @SuppressWarnings("unchecked") // The caller asserts the release type.
  static <R> R applyUntyped(DataAccessDefinition<?, ? extends R> definition, Object data) {
    if (definition instanceof ElementwiseMechanism) {
      return (R) ((ElementwiseMechanism) definition).applyToValue(data);
    }
    if (definition instanceof Sampler) {
      checkArgument(
          data instanceof double[],
          "Samples can only be drawn from double arrays. Provided: %s",
          data.getClass().getSimpleName());
    }
    return ((DataAccessDefinition<Object, ? extends R>) definition).apply(data);
  }
}
