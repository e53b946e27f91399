/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.passphrase.config;

import com.luisppb16.passphrase.model.BundledWordList;
import com.luisppb16.passphrase.model.CaseTransform;
import com.luisppb16.passphrase.model.CharacterChoice;
import com.luisppb16.passphrase.model.PaddingType;
import com.luisppb16.passphrase.registry.PresetRegistry;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

/**
 * Mutable set of options driving passphrase generation.
 *
 * <p>Every setter validates its argument and throws {@link InvalidConfigurationException} when
 * it is out of range, leaving the previous value in place. A generator reads the configuration
 * afresh on every call, so changes made between calls take effect immediately.
 *
 * <p>The word length bounds order themselves: {@link #getMinWordLength()} and {@link
 * #getMaxWordLength()} return the smaller and the larger of the two assigned values, whatever the
 * order they were set in.
 *
 * <p>Instances are not thread-safe.
 */
@Getter
@ToString
public class PassphraseConfig {

  public static final Set<Character> DEFAULT_SYMBOL_ALPHABET =
      Collections.unmodifiableSet(
          new LinkedHashSet<>(
              List.of('!', '@', '$', '%', '^', '&', '*', '-', '_', '+', '=', ':', '|', '~', '?')));

  public static final int DEFAULT_MIN_WORD_LENGTH = 4;
  public static final int DEFAULT_MAX_WORD_LENGTH = 8;
  public static final int DEFAULT_WORD_COUNT = 4;
  public static final int DEFAULT_PADDING_DIGITS = 2;
  public static final int DEFAULT_PADDING_CHARACTERS = 2;

  @Getter(AccessLevel.NONE)
  private int minWordLength;

  @Getter(AccessLevel.NONE)
  private int maxWordLength;

  private int wordCount;
  private Set<Character> symbolAlphabet;
  private Set<Character> separatorAlphabet;
  private CharacterChoice separatorCharacter;
  private int paddingDigitsBefore;
  private int paddingDigitsAfter;
  private PaddingType paddingType;
  private CharacterChoice paddingCharacter;
  private int paddingCharactersBefore;
  private int paddingCharactersAfter;
  private int padToLength;
  private CaseTransform caseTransform;
  private Map<Character, Character> characterSubstitutions;
  private String wordListPath;

  public PassphraseConfig() {
    this.wordListPath = BundledWordList.ENGLISH.getPath();
    this.symbolAlphabet = DEFAULT_SYMBOL_ALPHABET;
    this.separatorAlphabet = Collections.emptySet();
    this.minWordLength = DEFAULT_MIN_WORD_LENGTH;
    this.maxWordLength = DEFAULT_MAX_WORD_LENGTH;
    this.wordCount = DEFAULT_WORD_COUNT;
    this.separatorCharacter = CharacterChoice.random();
    this.paddingDigitsBefore = DEFAULT_PADDING_DIGITS;
    this.paddingDigitsAfter = DEFAULT_PADDING_DIGITS;
    this.paddingType = PaddingType.FIXED;
    this.paddingCharacter = CharacterChoice.random();
    this.paddingCharactersBefore = DEFAULT_PADDING_CHARACTERS;
    this.paddingCharactersAfter = DEFAULT_PADDING_CHARACTERS;
    this.padToLength = 0;
    this.caseTransform = CaseTransform.CAPITALIZE;
    this.characterSubstitutions = Collections.emptyMap();
  }

  /**
   * Builds a configuration from one of the bundled presets.
   *
   * @throws InvalidConfigurationException if no preset has that name
   */
  public static PassphraseConfig fromPreset(final String presetName) {
    return PresetRegistry.getPreset(presetName)
        .orElseThrow(() -> new InvalidConfigurationException("Unknown preset: " + presetName))
        .toConfig();
  }

  public int getMinWordLength() {
    return Math.min(minWordLength, maxWordLength);
  }

  public int getMaxWordLength() {
    return Math.max(minWordLength, maxWordLength);
  }

  public void setMinWordLength(final int minWordLength) {
    this.minWordLength = requireAtLeast(minWordLength, 1, "minWordLength");
  }

  public void setMaxWordLength(final int maxWordLength) {
    this.maxWordLength = requireAtLeast(maxWordLength, 1, "maxWordLength");
  }

  public void setWordCount(final int wordCount) {
    this.wordCount = requireAtLeast(wordCount, 1, "wordCount");
  }

  public void setSymbolAlphabet(final Collection<Character> symbolAlphabet) {
    if (symbolAlphabet == null || symbolAlphabet.isEmpty()) {
      throw new InvalidConfigurationException("symbolAlphabet must contain at least one symbol");
    }
    this.symbolAlphabet = copyAlphabet(symbolAlphabet, "symbolAlphabet");
  }

  /** An empty or null alphabet means separators are drawn from the symbol alphabet. */
  public void setSeparatorAlphabet(final Collection<Character> separatorAlphabet) {
    this.separatorAlphabet =
        separatorAlphabet == null
            ? Collections.emptySet()
            : copyAlphabet(separatorAlphabet, "separatorAlphabet");
  }

  public boolean hasSeparatorAlphabet() {
    return !separatorAlphabet.isEmpty();
  }

  public void setSeparatorCharacter(final CharacterChoice separatorCharacter) {
    this.separatorCharacter = requireNonNull(separatorCharacter, "separatorCharacter");
  }

  public void setPaddingDigitsBefore(final int paddingDigitsBefore) {
    this.paddingDigitsBefore = requireAtLeast(paddingDigitsBefore, 0, "paddingDigitsBefore");
  }

  public void setPaddingDigitsAfter(final int paddingDigitsAfter) {
    this.paddingDigitsAfter = requireAtLeast(paddingDigitsAfter, 0, "paddingDigitsAfter");
  }

  public void setPaddingType(final PaddingType paddingType) {
    this.paddingType = requireNonNull(paddingType, "paddingType");
  }

  public void setPaddingCharacter(final CharacterChoice paddingCharacter) {
    this.paddingCharacter = requireNonNull(paddingCharacter, "paddingCharacter");
  }

  public void setPaddingCharactersBefore(final int paddingCharactersBefore) {
    this.paddingCharactersBefore =
        requireAtLeast(paddingCharactersBefore, 0, "paddingCharactersBefore");
  }

  public void setPaddingCharactersAfter(final int paddingCharactersAfter) {
    this.paddingCharactersAfter =
        requireAtLeast(paddingCharactersAfter, 0, "paddingCharactersAfter");
  }

  /** Only read for {@link PaddingType#ADAPTIVE}; values of zero or less disable it. */
  public void setPadToLength(final int padToLength) {
    this.padToLength = padToLength;
  }

  public void setCaseTransform(final CaseTransform caseTransform) {
    this.caseTransform = requireNonNull(caseTransform, "caseTransform");
  }

  /** Entries are applied in the map's iteration order; a null map clears all substitutions. */
  public void setCharacterSubstitutions(final Map<Character, Character> characterSubstitutions) {
    if (characterSubstitutions == null) {
      this.characterSubstitutions = Collections.emptyMap();
      return;
    }
    final Map<Character, Character> copy = new LinkedHashMap<>();
    characterSubstitutions.forEach(
        (from, to) -> {
          if (from == null || to == null) {
            throw new InvalidConfigurationException(
                "characterSubstitutions cannot contain null characters");
          }
          copy.put(from, to);
        });
    this.characterSubstitutions = Collections.unmodifiableMap(copy);
  }

  /**
   * Sets the word list location. A leading {@code ?} names a gzip-compressed list bundled with
   * the library, anything else is a filesystem path.
   */
  public void setWordListPath(final String wordListPath) {
    if (wordListPath == null || wordListPath.isBlank()) {
      throw new InvalidConfigurationException("wordListPath cannot be blank");
    }
    this.wordListPath = wordListPath;
  }

  private static int requireAtLeast(final int value, final int minimum, final String field) {
    if (value < minimum) {
      throw new InvalidConfigurationException(
          field + " must be at least " + minimum + " but was " + value);
    }
    return value;
  }

  private static <T> T requireNonNull(final T value, final String field) {
    if (Objects.isNull(value)) {
      throw new InvalidConfigurationException(field + " cannot be null");
    }
    return value;
  }

  private static Set<Character> copyAlphabet(
      final Collection<Character> alphabet, final String field) {
    final Set<Character> copy = new LinkedHashSet<>();
    for (final Character symbol : alphabet) {
      copy.add(requireNonNull(symbol, field + " entry"));
    }
    return Collections.unmodifiableSet(copy);
  }
}
