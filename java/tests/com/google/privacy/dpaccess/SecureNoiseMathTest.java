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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SecureNoiseMathTest {

  @Test
  public void ceilPowerOfTwo_invalidInput_throwsException() {
    assertThrows(IllegalArgumentException.class, () -> SecureNoiseMath.ceilPowerOfTwo(0.0));
    assertThrows(IllegalArgumentException.class, () -> SecureNoiseMath.ceilPowerOfTwo(-2.0));
    assertThrows(IllegalArgumentException.class, () -> SecureNoiseMath.ceilPowerOfTwo(Double.NaN));
    assertThrows(
        IllegalArgumentException.class,
        () -> SecureNoiseMath.ceilPowerOfTwo(Double.POSITIVE_INFINITY));
    assertThrows(
        IllegalArgumentException.class, () -> SecureNoiseMath.ceilPowerOfTwo(Double.MAX_VALUE));
  }

  @Test
  public void ceilPowerOfTwo_powerOfTwo_returnsInput() {
    for (int exponent = -1022; exponent <= 1023; exponent++) {
      double powerOfTwo = Math.scalb(1.0, exponent);
      assertThat(SecureNoiseMath.ceilPowerOfTwo(powerOfTwo)).isEqualTo(powerOfTwo);
    }
  }

  @Test
  public void ceilPowerOfTwo_notAPowerOfTwo_returnsNextPowerOfTwo() {
    assertThat(SecureNoiseMath.ceilPowerOfTwo(0.3)).isEqualTo(0.5);
    assertThat(SecureNoiseMath.ceilPowerOfTwo(1.0000001)).isEqualTo(2.0);
    assertThat(SecureNoiseMath.ceilPowerOfTwo(Math.log(3))).isEqualTo(2.0);
    assertThat(SecureNoiseMath.ceilPowerOfTwo(1000.0)).isEqualTo(1024.0);
  }

  @Test
  public void roundToMultipleOfPowerOfTwo_invalidGranularity_throwsException() {
    assertThrows(
        IllegalArgumentException.class,
        () -> SecureNoiseMath.roundToMultipleOfPowerOfTwo(1.0, 0.0));
    assertThrows(
        IllegalArgumentException.class,
        () -> SecureNoiseMath.roundToMultipleOfPowerOfTwo(1.0, 0.75));
    assertThrows(
        IllegalArgumentException.class,
        () -> SecureNoiseMath.roundToMultipleOfPowerOfTwo(1.0, -0.5));
  }

  @Test
  public void roundToMultipleOfPowerOfTwo_roundsToNearestMultiple() {
    assertThat(SecureNoiseMath.roundToMultipleOfPowerOfTwo(0.3, 0.25)).isEqualTo(0.25);
    assertThat(SecureNoiseMath.roundToMultipleOfPowerOfTwo(-0.4, 0.25)).isEqualTo(-0.5);
    assertThat(SecureNoiseMath.roundToMultipleOfPowerOfTwo(5.0, 4.0)).isEqualTo(4.0);
    assertThat(SecureNoiseMath.roundToMultipleOfPowerOfTwo(6.5, 4.0)).isEqualTo(8.0);
    assertThat(SecureNoiseMath.roundToMultipleOfPowerOfTwo(3.0, 1.0)).isEqualTo(3.0);
  }

  @Test
  public void roundToMultipleOfPowerOfTwo_largeInput_returnsInput() {
    double x = Math.scalb(1.0, 60) + Math.scalb(1.0, 10);
    assertThat(SecureNoiseMath.roundToMultipleOfPowerOfTwo(x, 0.5)).isEqualTo(x);
  }
}
