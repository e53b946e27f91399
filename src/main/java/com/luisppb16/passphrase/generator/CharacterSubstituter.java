/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.passphrase.generator;

import java.util.List;
import java.util.Map;

/**
 * Replaces characters in each word. Entries run in the map's iteration order and chain: a later
 * entry also rewrites characters produced by an earlier one.
 */
public final class CharacterSubstituter {

  public List<String> substitute(
      final List<String> words, final Map<Character, Character> substitutions) {
    if (substitutions == null || substitutions.isEmpty()) {
      return words;
    }
    return words.stream().map(w -> substitute(w, substitutions)).toList();
  }

  public String substitute(final String word, final Map<Character, Character> substitutions) {
    String result = word;
    for (final Map.Entry<Character, Character> entry : substitutions.entrySet()) {
      result = result.replace(entry.getKey(), entry.getValue());
    }
    return result;
  }
}
