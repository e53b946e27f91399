/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.passphrase.wordlist;

/**
 * Exception thrown when a word list cannot be supplied, such as a missing file, a missing bundled
 * resource or unreadable compressed data.
 */
public class WordSourceUnavailableException extends RuntimeException {

  public WordSourceUnavailableException(String message) {
    super(message);
  }

  public WordSourceUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
