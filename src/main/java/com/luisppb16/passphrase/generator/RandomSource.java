/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.passphrase.generator;

import java.security.SecureRandom;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Uniform random capability injected into the generation pipeline.
 *
 * <p>Implementations used from several threads must either be thread-confined or synchronised;
 * the factories below satisfy that.
 */
public interface RandomSource {

  /** @return a uniform value in {@code [0, bound)} */
  int nextInt(int bound);

  boolean nextBoolean();

  /**
   * Picks one element uniformly, following the collection's iteration order.
   *
   * @throws IllegalArgumentException if {@code values} is empty
   */
  default <T> T pick(final Collection<? extends T> values) {
    if (values.isEmpty()) {
      throw new IllegalArgumentException("Cannot pick from an empty collection");
    }
    final int index = nextInt(values.size());
    if (values instanceof List<? extends T> list) {
      return list.get(index);
    }
    final Iterator<? extends T> iterator = values.iterator();
    for (int i = 0; i < index; i++) {
      iterator.next();
    }
    return iterator.next();
  }

  /** Backed by {@link java.util.concurrent.ThreadLocalRandom}; safe to share across threads. */
  static RandomSource threadLocal() {
    return ThreadLocalRandomSource.INSTANCE;
  }

  static RandomSource secure() {
    return new JdkRandomSource(new SecureRandom());
  }

  /** Reproducible sequence, for tests and demos. */
  static RandomSource seeded(final long seed) {
    return new JdkRandomSource(new Random(seed));
  }

  static RandomSource of(final Random random) {
    return new JdkRandomSource(Objects.requireNonNull(random, "Random cannot be null"));
  }
}
