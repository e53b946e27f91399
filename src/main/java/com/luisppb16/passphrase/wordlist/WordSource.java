/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.passphrase.wordlist;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Supplier of candidate words for passphrase generation.
 *
 * <p>A generator calls {@link #words()} once per passphrase, so implementations backed by a file
 * re-read it on every call. The returned list is fully materialised, in source order.
 */
@FunctionalInterface
public interface WordSource {

  /**
   * @return every candidate word, in source order
   * @throws WordSourceUnavailableException if the underlying source cannot be read
   */
  List<String> words();

  /** In-memory source over a snapshot of {@code words}. */
  static WordSource of(final Collection<String> words) {
    final List<String> snapshot = List.copyOf(Objects.requireNonNull(words, "Words cannot be null"));
    return () -> snapshot;
  }

  /** Source that reads the word list at {@code path} on every call. */
  static WordSource fromPath(final String path) {
    Objects.requireNonNull(path, "Word list path cannot be null");
    return () -> WordListLoader.readWords(path);
  }
}
