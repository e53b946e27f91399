/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.passphrase.generator;

import java.util.Random;

/** Adapts a {@link Random}, whose methods are already thread-safe. */
record JdkRandomSource(Random random) implements RandomSource {

  @Override
  public int nextInt(final int bound) {
    return random.nextInt(bound);
  }

  @Override
  public boolean nextBoolean() {
    return random.nextBoolean();
  }
}
