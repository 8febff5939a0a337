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
 * Thrown by {@link AdaptiveDifferentialPrivacy} when a query would exceed its privacy budget. The
 * data protected by the filter cannot be accessed with the requested mechanism anymore; a cheaper
 * mechanism may still be accepted.
 */
public class ExceededPrivacyBudgetException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final PrivacyBudget epsilonDelta;

  public ExceededPrivacyBudgetException(PrivacyBudget epsilonDelta) {
    super("Privacy budget " + checkNotNull(epsilonDelta) + " has been exceeded");
    this.epsilonDelta = epsilonDelta;
  }

  /** Returns the budget that has been exhausted. */
  public PrivacyBudget getEpsilonDelta() {
    return epsilonDelta;
  }
}
