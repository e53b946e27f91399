/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.passphrase.generator;

import lombok.Getter;

/** Thrown when no candidate word fits strictly between the configured length bounds. */
@Getter
public class EmptyCandidateSetException extends RuntimeException {

  private final int minWordLength;
  private final int maxWordLength;
  private final int candidateCount;

  public EmptyCandidateSetException(int minWordLength, int maxWordLength, int candidateCount) {
    super(
        "No word among "
            + candidateCount
            + " candidates is longer than "
            + minWordLength
            + " and shorter than "
            + maxWordLength
            + " characters");
    this.minWordLength = minWordLength;
    this.maxWordLength = maxWordLength;
    this.candidateCount = candidateCount;
  }
}
