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

/** Data together with its labels. Both can be replaced independently, e.g. by a transformation. */
public class LabeledData<D, L> {
  private D data;
  private L label;

  public LabeledData(D data, L label) {
    this.data = data;
    this.label = label;
  }

  public D getData() {
    return data;
  }

  public void setData(D data) {
    this.data = data;
  }

  public L getLabel() {
    return label;
  }

  public void setLabel(L label) {
    this.label = label;
  }
}
