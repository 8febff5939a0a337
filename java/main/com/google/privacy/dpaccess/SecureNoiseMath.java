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

/** Mathematical utilities for generating secure DP noise. */
final class SecureNoiseMath {

  private static final long EXPONENT_MASK = 0x7ff0000000000000L;
  private static final long MANTISSA_MASK = 0x000fffffffffffffL;

  private SecureNoiseMath() {}

  /**
   * Returns the smallest power of 2 larger or equal to {@code x}. The value of {@code x} must be a
   * finite positive number not greater than 2^1023. The result is an exact power of 2.
   */
  static double ceilPowerOfTwo(double x) {
    checkArgument(x > 0.0, "Input must be positive. Provided value: %s", x);
    checkArgument(Double.isFinite(x), "Input must be finite. Provided value: %s", x);

    // IEEE 754 layout "1*s 11*e 52*m": a finite positive x is a power of 2 iff its mantissa is 0.
    long bits = Double.doubleToLongBits(x);
    if ((bits & MANTISSA_MASK) == 0L) {
      return x;
    }

    long exponentBits = bits & EXPONENT_MASK;
    long maxExponentBits = Double.doubleToLongBits(Double.MAX_VALUE) & EXPONENT_MASK;
    checkArgument(
        exponentBits < maxExponentBits,
        "Input must not be greater than 2^1023. Provided value: %s",
        x);

    // Adding 1 to the exponent (skipping the 52 mantissa bits) yields the next power of 2.
    return Double.longBitsToDouble(exponentBits + 0x0010000000000000L);
  }

  /**
   * Rounds {@code x} to the closest multiple of {@code granularity}, where {@code granularity} is a
   * power of 2. Because {@code granularity} must be a power of 2, the result is exact.
   */
  static double roundToMultipleOfPowerOfTwo(double x, double granularity) {
    checkArgument(
        granularity > 0.0
            && Double.isFinite(granularity)
            && (Double.doubleToLongBits(granularity) & MANTISSA_MASK) == 0L,
        "Granularity must be a power of 2. Provided value: %s",
        granularity);

    if (Math.abs(x / granularity) < 1L << 54) {
      return Math.round(x / granularity) * granularity;
    }
    // |x / granularity| >= 2^54 has no fractional bits, so x already is a multiple.
    return x;
  }
}
