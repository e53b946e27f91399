/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.passphrase.wordlist;

import java.util.List;
import java.util.Objects;
import net.datafaker.Faker;

/**
 * Word source backed by Datafaker's lorem vocabulary. Useful where no word list file is at hand;
 * each call draws a fresh sample of {@code sampleSize} words.
 */
public final class FakerWordSource implements WordSource {

  private static final int DEFAULT_SAMPLE_SIZE = 500;

  private final Faker faker;
  private final int sampleSize;

  public FakerWordSource() {
    this(new Faker(), DEFAULT_SAMPLE_SIZE);
  }

  public FakerWordSource(final Faker faker, final int sampleSize) {
    this.faker = Objects.requireNonNull(faker, "Faker cannot be null");
    if (sampleSize <= 0) {
      throw new IllegalArgumentException("Sample size must be positive but was " + sampleSize);
    }
    this.sampleSize = sampleSize;
  }

  @Override
  public List<String> words() {
    return List.copyOf(faker.lorem().words(sampleSize));
  }
}
