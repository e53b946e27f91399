/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.passphrase.generator;

import com.luisppb16.passphrase.config.PassphraseConfig;
import com.luisppb16.passphrase.model.CharacterChoice;
import com.luisppb16.passphrase.model.PaddingType;
import java.util.Objects;

/**
 * Applies symbol padding around an assembled passphrase according to {@link PaddingType}.
 *
 * <p>{@link PaddingType#FIXED} prepends {@code paddingCharactersBefore} units of padding character
 * followed by the separator, and appends {@code paddingCharactersAfter} bare padding characters.
 * Without a fixed padding character the separator's first character is used, or a random symbol
 * when there is no separator.
 *
 * <p>{@link PaddingType#ADAPTIVE} appends the padding character up to {@code padToLength}, or
 * truncates to it. Lengths count UTF-16 units; truncation never splits a surrogate pair, so the
 * result may then be one unit short. Without a fixed padding character a random symbol is drawn.
 * A target of zero or less leaves the passphrase unchanged.
 *
 * <p>The effective padding character is a per-call value; the configuration is never modified.
 */
public final class SymbolPadder {

  private final RandomSource random;

  public SymbolPadder(final RandomSource random) {
    this.random = Objects.requireNonNull(random, "Random source cannot be null");
  }

  public String pad(final String core, final String separator, final PassphraseConfig config) {
    return switch (config.getPaddingType()) {
      case NONE -> core;
      case FIXED -> padFixed(core, separator, config);
      case ADAPTIVE -> padAdaptive(core, config);
    };
  }

  private String padFixed(
      final String core, final String separator, final PassphraseConfig config) {
    final int before = config.getPaddingCharactersBefore();
    final int after = config.getPaddingCharactersAfter();
    if (before == 0 && after == 0) {
      return core;
    }
    final char padding = fixedPaddingCharacter(separator, config);
    return (padding + separator).repeat(before) + core + String.valueOf(padding).repeat(after);
  }

  private char fixedPaddingCharacter(final String separator, final PassphraseConfig config) {
    if (config.getPaddingCharacter() instanceof CharacterChoice.Fixed fixed) {
      return fixed.value();
    }
    if (!separator.isEmpty()) {
      return separator.charAt(0);
    }
    return random.pick(config.getSymbolAlphabet());
  }

  private String padAdaptive(final String core, final PassphraseConfig config) {
    final int target = config.getPadToLength();
    if (target <= 0 || core.length() == target) {
      return core;
    }
    if (core.length() > target) {
      final int end = Character.isHighSurrogate(core.charAt(target - 1)) ? target - 1 : target;
      return core.substring(0, end);
    }
    final char padding =
        config.getPaddingCharacter() instanceof CharacterChoice.Fixed fixed
            ? fixed.value()
            : random.pick(config.getSymbolAlphabet());
    return core + String.valueOf(padding).repeat(target - core.length());
  }
}
