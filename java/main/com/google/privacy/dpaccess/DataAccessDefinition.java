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

import javax.annotation.Nullable;

/**
 * Describes how a private value of type {@code T} may be read. Every read of private data held by a
 * {@link DataNode} goes through an instance of this interface.
 *
 * @param <T> type of the private value
 * @param <R> type of the released value
 */
public interface DataAccessDefinition<T, R> {

  /** Returns the value released for {@code data}. */
  R apply(T data);

  /**
   * Returns the value released for {@code data}, using {@code override} instead of the configured
   * behaviour where the definition supports it. By default, no override is accepted.
   *
   * @throws IllegalArgumentException if {@code override} is not null and this definition does not
   *     accept a per-query override.
   */
  default R apply(T data, @Nullable DataAccessDefinition<T, ? extends R> override) {
    checkArgument(
        override == null,
        "%s does not accept a per-query access definition.",
        getClass().getSimpleName());
    return apply(data);
  }
}
