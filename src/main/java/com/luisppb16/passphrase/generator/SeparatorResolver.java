/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.passphrase.generator;

import com.luisppb16.passphrase.config.PassphraseConfig;
import com.luisppb16.passphrase.model.CharacterChoice;
import java.util.Objects;

/** Resolves the separator for one generation call. */
public final class SeparatorResolver {

  private final RandomSource random;

  public SeparatorResolver(final RandomSource random) {
    this.random = Objects.requireNonNull(random, "Random source cannot be null");
  }

  /**
   * @return the empty string for {@link CharacterChoice.None}, the fixed character, or a character
   *     drawn from the separator alphabet (the symbol alphabet when that one is empty)
   */
  public String resolve(final PassphraseConfig config) {
    final CharacterChoice choice = config.getSeparatorCharacter();
    if (choice instanceof CharacterChoice.None) {
      return "";
    }
    if (choice instanceof CharacterChoice.Fixed fixed) {
      return String.valueOf(fixed.value());
    }
    final Character symbol =
        config.hasSeparatorAlphabet()
            ? random.pick(config.getSeparatorAlphabet())
            : random.pick(config.getSymbolAlphabet());
    return String.valueOf(symbol);
  }
}
