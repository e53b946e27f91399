/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.passphrase.model;

/**
 * Tri-state choice for a single character slot of a passphrase, such as the separator or the
 * padding character.
 *
 * <ul>
 *   <li>{@link Random}: draw a character at generation time
 *   <li>{@link None}: use no character at all
 *   <li>{@link Fixed}: always use the given character
 * </ul>
 */
public sealed interface CharacterChoice
    permits CharacterChoice.Random, CharacterChoice.None, CharacterChoice.Fixed {

  Random RANDOM = new Random();
  None NONE = new None();

  static CharacterChoice random() {
    return RANDOM;
  }

  static CharacterChoice none() {
    return NONE;
  }

  /** The NUL character maps to {@link #none()}, matching the legacy sentinel convention. */
  static CharacterChoice fixed(final char value) {
    return value == '\0' ? NONE : new Fixed(value);
  }

  record Random() implements CharacterChoice {}

  record None() implements CharacterChoice {}

  record Fixed(char value) implements CharacterChoice {
    public Fixed {
      if (value == '\0') {
        throw new IllegalArgumentException("A fixed character cannot be NUL; use none() instead.");
      }
    }
  }
}
