/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.passphrase.generator;

import java.util.concurrent.ThreadLocalRandom;

enum ThreadLocalRandomSource implements RandomSource {
  INSTANCE;

  @Override
  @SuppressWarnings("java:S2245")
  public int nextInt(final int bound) {
    return ThreadLocalRandom.current().nextInt(bound);
  }

  @Override
  @SuppressWarnings("java:S2245")
  public boolean nextBoolean() {
    return ThreadLocalRandom.current().nextBoolean();
  }
}
