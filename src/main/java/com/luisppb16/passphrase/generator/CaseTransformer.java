/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.passphrase.generator;

import com.luisppb16.passphrase.model.CaseTransform;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Applies a {@link CaseTransform} to each word independently, using locale-invariant casing.
 *
 * <p>{@link CaseTransform#ALTERNATE} flips one coin per word to choose whether the even or the odd
 * positions are upper-cased. {@link CaseTransform#RANDOM} upper-cases the word and then flips one
 * coin per character, lower-casing it on heads.
 */
public final class CaseTransformer {

  private static final int ASCII_CASE_BIT = 0x20;

  private final RandomSource random;

  public CaseTransformer(final RandomSource random) {
    this.random = Objects.requireNonNull(random, "Random source cannot be null");
  }

  public List<String> transform(final List<String> words, final CaseTransform mode) {
    Objects.requireNonNull(mode, "Case transform cannot be null");
    return words.stream().map(w -> transform(w, mode)).toList();
  }

  public String transform(final String word, final CaseTransform mode) {
    if (word.isEmpty()) {
      return word;
    }
    return switch (mode) {
      case NONE -> word;
      case UPPER_CASE -> word.toUpperCase(Locale.ROOT);
      case LOWER_CASE -> word.toLowerCase(Locale.ROOT);
      case CAPITALIZE -> word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1);
      case INVERT ->
          word.substring(0, 1).toLowerCase(Locale.ROOT)
              + word.substring(1).toUpperCase(Locale.ROOT);
      case ALTERNATE -> alternate(word);
      case RANDOM -> randomize(word);
    };
  }

  private String alternate(final String word) {
    final char[] chars = word.toLowerCase(Locale.ROOT).toCharArray();
    final int start = random.nextBoolean() ? 0 : 1;
    for (int i = start; i < chars.length; i += 2) {
      chars[i] = Character.toUpperCase(chars[i]);
    }
    return new String(chars);
  }

  private String randomize(final String word) {
    final char[] chars = word.toUpperCase(Locale.ROOT).toCharArray();
    for (int i = 0; i < chars.length; i++) {
      if (random.nextBoolean()) {
        chars[i] = lower(chars[i]);
      }
    }
    return new String(chars);
  }

  private static char lower(final char c) {
    if (c >= 'A' && c <= 'Z') {
      return (char) (c ^ ASCII_CASE_BIT);
    }
    return Character.toLowerCase(c);
  }
}
