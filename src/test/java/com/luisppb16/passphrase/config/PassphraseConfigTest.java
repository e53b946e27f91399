/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.passphrase.config;

import static org.assertj.core.api.Assertions.*;

import com.luisppb16.passphrase.model.CaseTransform;
import com.luisppb16.passphrase.model.CharacterChoice;
import com.luisppb16.passphrase.model.PaddingType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntConsumer;
import java.util.function.ToIntFunction;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

class PassphraseConfigTest {

  private PassphraseConfig config;

  @BeforeEach
  void setUp() {
    config = new PassphraseConfig();
  }

  @Test
  void defaults() {
    assertThat(config.getMinWordLength()).isEqualTo(4);
    assertThat(config.getMaxWordLength()).isEqualTo(8);
    assertThat(config.getWordCount()).isEqualTo(4);
    assertThat(config.getSymbolAlphabet())
        .containsExactly('!', '@', '$', '%', '^', '&', '*', '-', '_', '+', '=', ':', '|', '~', '?');
    assertThat(config.getSeparatorAlphabet()).isEmpty();
    assertThat(config.hasSeparatorAlphabet()).isFalse();
    assertThat(config.getSeparatorCharacter()).isEqualTo(CharacterChoice.random());
    assertThat(config.getPaddingDigitsBefore()).isEqualTo(2);
    assertThat(config.getPaddingDigitsAfter()).isEqualTo(2);
    assertThat(config.getPaddingType()).isEqualTo(PaddingType.FIXED);
    assertThat(config.getPaddingCharacter()).isEqualTo(CharacterChoice.random());
    assertThat(config.getPaddingCharactersBefore()).isEqualTo(2);
    assertThat(config.getPaddingCharactersAfter()).isEqualTo(2);
    assertThat(config.getPadToLength()).isZero();
    assertThat(config.getCaseTransform()).isEqualTo(CaseTransform.CAPITALIZE);
    assertThat(config.getCharacterSubstitutions()).isEmpty();
    assertThat(config.getWordListPath()).isEqualTo("?en.gz");
  }

  @Nested
  class WordLengthBounds {

    @Test
    @DisplayName("Bounds order themselves regardless of assignment order")
    void boundsSelfOrder() {
      config.setMinWordLength(8);
      config.setMaxWordLength(4);

      assertThat(config.getMinWordLength()).isEqualTo(4);
      assertThat(config.getMaxWordLength()).isEqualTo(8);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, Integer.MIN_VALUE})
    void minimumMustBePositive(int value) {
      assertThatThrownBy(() -> config.setMinWordLength(value))
          .isInstanceOf(InvalidConfigurationException.class)
          .hasMessageContaining("minWordLength");
      assertThat(config.getMinWordLength()).isEqualTo(4);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -5})
    void maximumMustBePositive(int value) {
      assertThatThrownBy(() -> config.setMaxWordLength(value))
          .isInstanceOf(InvalidConfigurationException.class)
          .hasMessageContaining("maxWordLength");
      assertThat(config.getMaxWordLength()).isEqualTo(8);
    }

    @Test
    void oneIsAccepted() {
      config.setMinWordLength(1);

      assertThat(config.getMinWordLength()).isEqualTo(1);
    }
  }

  static Stream<Arguments> countFields() {
    return Stream.of(
        Arguments.of(
            "paddingDigitsBefore",
            (Setter) PassphraseConfig::setPaddingDigitsBefore,
            (Getter) PassphraseConfig::getPaddingDigitsBefore),
        Arguments.of(
            "paddingDigitsAfter",
            (Setter) PassphraseConfig::setPaddingDigitsAfter,
            (Getter) PassphraseConfig::getPaddingDigitsAfter),
        Arguments.of(
            "paddingCharactersBefore",
            (Setter) PassphraseConfig::setPaddingCharactersBefore,
            (Getter) PassphraseConfig::getPaddingCharactersBefore),
        Arguments.of(
            "paddingCharactersAfter",
            (Setter) PassphraseConfig::setPaddingCharactersAfter,
            (Getter) PassphraseConfig::getPaddingCharactersAfter));
  }

  @ParameterizedTest
  @MethodSource("countFields")
  void negativeCountsAreRejected(String field, Setter setter, Getter getter) {
    IntConsumer set = v -> setter.set(config, v);

    assertThatThrownBy(() -> set.accept(-1))
        .isInstanceOf(InvalidConfigurationException.class)
        .hasMessageContaining(field);
    assertThat(getter.applyAsInt(config)).isEqualTo(2);

    set.accept(0);
    assertThat(getter.applyAsInt(config)).isZero();
  }

  @Test
  void wordCountMustBePositive() {
    assertThatThrownBy(() -> config.setWordCount(0))
        .isInstanceOf(InvalidConfigurationException.class);
    assertThat(config.getWordCount()).isEqualTo(4);
  }

  @Test
  void padToLengthAcceptsAnyValue() {
    config.setPadToLength(-10);

    assertThat(config.getPadToLength()).isEqualTo(-10);
  }

  @Nested
  class Alphabets {

    @Test
    void symbolAlphabetCannotBeEmpty() {
      assertThatThrownBy(() -> config.setSymbolAlphabet(List.of()))
          .isInstanceOf(InvalidConfigurationException.class);
      assertThatThrownBy(() -> config.setSymbolAlphabet(null))
          .isInstanceOf(InvalidConfigurationException.class);
      assertThat(config.getSymbolAlphabet()).hasSize(15);
    }

    @Test
    void alphabetsDropDuplicatesAndKeepOrder() {
      config.setSymbolAlphabet(List.of('#', '!', '#', '?'));

      assertThat(config.getSymbolAlphabet()).containsExactly('#', '!', '?');
    }

    @Test
    void nullSeparatorAlphabetMeansNone() {
      config.setSeparatorAlphabet(List.of('.'));
      assertThat(config.hasSeparatorAlphabet()).isTrue();

      config.setSeparatorAlphabet(null);

      assertThat(config.getSeparatorAlphabet()).isEmpty();
      assertThat(config.hasSeparatorAlphabet()).isFalse();
    }

    @Test
    void alphabetIsCopied() {
      List<Character> symbols = new ArrayList<>(List.of('#'));
      config.setSymbolAlphabet(symbols);
      symbols.add('!');

      assertThat(config.getSymbolAlphabet()).containsExactly('#');
      assertThatThrownBy(() -> config.getSymbolAlphabet().add('x'))
          .isInstanceOf(UnsupportedOperationException.class);
    }
  }

  @Test
  void substitutionsKeepInsertionOrder() {
    Map<Character, Character> substitutions = new LinkedHashMap<>();
    substitutions.put('s', '5');
    substitutions.put('a', '4');
    substitutions.put('e', '3');

    config.setCharacterSubstitutions(substitutions);

    assertThat(config.getCharacterSubstitutions().keySet()).containsExactly('s', 'a', 'e');
    config.setCharacterSubstitutions(null);
    assertThat(config.getCharacterSubstitutions()).isEmpty();
  }

  @Test
  void nullChoicesAndEnumsAreRejected() {
    assertThatThrownBy(() -> config.setSeparatorCharacter(null))
        .isInstanceOf(InvalidConfigurationException.class);
    assertThatThrownBy(() -> config.setPaddingCharacter(null))
        .isInstanceOf(InvalidConfigurationException.class);
    assertThatThrownBy(() -> config.setPaddingType(null))
        .isInstanceOf(InvalidConfigurationException.class);
    assertThatThrownBy(() -> config.setCaseTransform(null))
        .isInstanceOf(InvalidConfigurationException.class);
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "   "})
  void blankWordListPathIsRejected(String path) {
    assertThatThrownBy(() -> config.setWordListPath(path))
        .isInstanceOf(InvalidConfigurationException.class);
    assertThat(config.getWordListPath()).isEqualTo("?en.gz");
  }

  @Test
  void fromPresetAppliesOverrides() {
    PassphraseConfig xkcd = PassphraseConfig.fromPreset("xkcd");

    assertThat(xkcd.getSeparatorCharacter()).isEqualTo(CharacterChoice.fixed('-'));
    assertThat(xkcd.getPaddingType()).isEqualTo(PaddingType.NONE);
    assertThat(xkcd.getCaseTransform()).isEqualTo(CaseTransform.LOWER_CASE);
    assertThat(xkcd.getPaddingDigitsBefore()).isZero();
  }

  @Test
  void fromPresetRejectsUnknownName() {
    assertThatThrownBy(() -> PassphraseConfig.fromPreset("nope"))
        .isInstanceOf(InvalidConfigurationException.class)
        .hasMessageContaining("nope");
  }

  @FunctionalInterface
  interface Setter {
    void set(PassphraseConfig config, int value);
  }

  @FunctionalInterface
  interface Getter extends ToIntFunction<PassphraseConfig> {}
}
