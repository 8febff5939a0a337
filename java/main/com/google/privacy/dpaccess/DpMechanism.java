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
 * A {@link DataAccessDefinition} whose releases are differentially private. Each call to {@link
 * #apply} costs the privacy budget returned by {@link #epsilonDelta()}.
 */
public interface DpMechanism<T, R> extends DataAccessDefinition<T, R> {

  PrivacyBudget epsilonDelta();
}
