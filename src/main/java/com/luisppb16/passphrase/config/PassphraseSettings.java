/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.passphrase.config;

import com.luisppb16.passphrase.model.CaseTransform;
import com.luisppb16.passphrase.model.CharacterChoice;
import com.luisppb16.passphrase.model.PaddingType;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import lombok.Builder;

/**
 * Immutable set of configuration overrides, as read from a JSON settings document or a bundled
 * preset.
 *
 * <p>Every component is optional: a {@code null} value leaves the corresponding {@link
 * PassphraseConfig} field untouched. Alphabets are written as plain strings ({@code "!@$%"}),
 * character slots as {@code "random"}, {@code "none"} (or the empty string) or a single
 * character, and substitutions as single-character keys and values.
 *
 * @param minWordLength Exclusive lower bound on word length
 * @param maxWordLength Exclusive upper bound on word length
 * @param wordCount Number of words per passphrase
 * @param symbolAlphabet Symbols used for separators and padding
 * @param separatorAlphabet Symbols used for separators only; empty falls back to the symbols
 * @param separatorCharacter Separator slot
 * @param paddingDigitsBefore Digits before the words
 * @param paddingDigitsAfter Digits after the words
 * @param paddingType Symbol padding strategy
 * @param paddingCharacter Padding slot
 * @param paddingCharactersBefore Fixed padding units before the digits
 * @param paddingCharactersAfter Fixed padding characters after the digits
 * @param padToLength Target length for adaptive padding
 * @param caseTransform Case transformation applied to each word
 * @param characterSubstitutions Character replacements applied to each word, in order
 * @param wordListPath Word list location
 */
@Builder(toBuilder = true)
public record PassphraseSettings(
    Integer minWordLength,
    Integer maxWordLength,
    Integer wordCount,
    String symbolAlphabet,
    String separatorAlphabet,
    String separatorCharacter,
    Integer paddingDigitsBefore,
    Integer paddingDigitsAfter,
    PaddingType paddingType,
    String paddingCharacter,
    Integer paddingCharactersBefore,
    Integer paddingCharactersAfter,
    Integer padToLength,
    CaseTransform caseTransform,
    Map<String, String> characterSubstitutions,
    String wordListPath) {

  private static final String RANDOM_KEYWORD = "random";
  private static final String NONE_KEYWORD = "none";

  /** Builds a fresh configuration from the defaults plus these overrides. */
  public PassphraseConfig toConfig() {
    return applyTo(new PassphraseConfig());
  }

  /**
   * Pushes every non-null override through the validating setters of {@code config}.
   *
   * @return the same {@code config}, for chaining
   * @throws InvalidConfigurationException on the first value the configuration rejects
   */
  public PassphraseConfig applyTo(final PassphraseConfig config) {
    Objects.requireNonNull(config, "Config cannot be null");
    apply(minWordLength, config::setMinWordLength);
    apply(maxWordLength, config::setMaxWordLength);
    apply(wordCount, config::setWordCount);
    apply(symbolAlphabet, s -> config.setSymbolAlphabet(toAlphabet(s)));
    apply(separatorAlphabet, s -> config.setSeparatorAlphabet(toAlphabet(s)));
    apply(separatorCharacter, s -> config.setSeparatorCharacter(toCharacterChoice(s)));
    apply(paddingDigitsBefore, config::setPaddingDigitsBefore);
    apply(paddingDigitsAfter, config::setPaddingDigitsAfter);
    apply(paddingType, config::setPaddingType);
    apply(paddingCharacter, s -> config.setPaddingCharacter(toCharacterChoice(s)));
    apply(paddingCharactersBefore, config::setPaddingCharactersBefore);
    apply(paddingCharactersAfter, config::setPaddingCharactersAfter);
    apply(padToLength, config::setPadToLength);
    apply(caseTransform, config::setCaseTransform);
    apply(characterSubstitutions, m -> config.setCharacterSubstitutions(toSubstitutions(m)));
    apply(wordListPath, config::setWordListPath);
    return config;
  }

  private static <T> void apply(final T value, final Consumer<T> setter) {
    if (value != null) {
      setter.accept(value);
    }
  }

  private static List<Character> toAlphabet(final String symbols) {
    return symbols.chars().mapToObj(c -> (char) c).toList();
  }

  static CharacterChoice toCharacterChoice(final String text) {
    if (text.isEmpty() || NONE_KEYWORD.equals(text.toLowerCase(Locale.ROOT))) {
      return CharacterChoice.none();
    }
    if (RANDOM_KEYWORD.equals(text.toLowerCase(Locale.ROOT))) {
      return CharacterChoice.random();
    }
    return CharacterChoice.fixed(toSingleCharacter(text, "character slot"));
  }

  private static Map<Character, Character> toSubstitutions(final Map<String, String> raw) {
    final Map<Character, Character> substitutions = new LinkedHashMap<>();
    raw.forEach(
        (from, to) ->
            substitutions.put(
                toSingleCharacter(from, "substitution key"),
                toSingleCharacter(to, "substitution value")));
    return substitutions;
  }

  private static char toSingleCharacter(final String text, final String role) {
    if (text == null || text.length() != 1) {
      throw new InvalidConfigurationException(
          "Expected a single character for " + role + " but got '" + text + "'");
    }
    return text.charAt(0);
  }
}
