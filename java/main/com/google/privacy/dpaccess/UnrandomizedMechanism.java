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

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Releases the exact result of a {@link Query} on the private data, without any randomization. Like
 * {@link UnprotectedAccess} it carries no privacy guarantee.
 */
public final class UnrandomizedMechanism<T, R> implements DataAccessDefinition<T, R> {
  private final Query<T, R> query;

  public UnrandomizedMechanism(Query<T, R> query) {
    this.query = checkNotNull(query);
  }

  @Override
  public R apply(T data) {
    return query.get(data);
  }
}
