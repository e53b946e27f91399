/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.passphrase.generator;

import java.util.Objects;

public final class DigitPadding {

  private final RandomSource random;

  public DigitPadding(final RandomSource random) {
    this.random = Objects.requireNonNull(random, "Random source cannot be null");
  }

  /** @return {@code count} independent uniform digits, or the empty string for zero */
  public String digits(final int count) {
    final StringBuilder sb = new StringBuilder(Math.max(count, 0));
    for (int i = 0; i < count; i++) {
      sb.append((char) ('0' + random.nextInt(10)));
    }
    return sb.toString();
  }
}
