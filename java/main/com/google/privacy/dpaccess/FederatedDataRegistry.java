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

import java.util.HashSet;
import java.util.Set;

/** Keeps track of the identifiers used by {@link FederatedData}, which must be unique. */
public class FederatedDataRegistry {
  private final Set<String> usedIdentifiers = new HashSet<>();

  /**
   * Reserves {@code identifier}.
   *
   * @throws IllegalArgumentException if {@code identifier} is already in use.
   */
  public void register(String identifier) {
    checkNotNull(identifier, "identifier must not be null.");
    checkArgument(usedIdentifiers.add(identifier), "Identifier %s is already in use.", identifier);
  }

  public boolean isRegistered(String identifier) {
    return usedIdentifiers.contains(identifier);
  }
}
