/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.passphrase.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Draws passphrase words from a candidate list.
 *
 * <p>Only words strictly longer than the lower bound and strictly shorter than the upper bound
 * are eligible; a word whose length equals either bound is rejected. The bounds are ordered before
 * use, so swapping them makes no difference. Words are drawn uniformly and with replacement, so the
 * same word may appear more than once.
 */
@Slf4j
public final class WordSelector {

  private final RandomSource random;

  public WordSelector(final RandomSource random) {
    this.random = Objects.requireNonNull(random, "Random source cannot be null");
  }

  /**
   * @throws EmptyCandidateSetException if no candidate satisfies the bounds
   */
  public List<String> select(
      final List<String> candidates, final int minLength, final int maxLength, final int count) {
    Objects.requireNonNull(candidates, "Candidates cannot be null");
    final int lower = Math.min(minLength, maxLength);
    final int upper = Math.max(minLength, maxLength);

    final List<String> suitable =
        candidates.stream()
            .filter(Objects::nonNull)
            .filter(w -> w.length() > lower && w.length() < upper)
            .toList();
    log.debug(
        "{} of {} candidate words are longer than {} and shorter than {}",
        suitable.size(),
        candidates.size(),
        lower,
        upper);

    if (suitable.isEmpty()) {
      throw new EmptyCandidateSetException(lower, upper, candidates.size());
    }

    final List<String> selected = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      selected.add(random.pick(suitable));
    }
    return selected;
  }
}
