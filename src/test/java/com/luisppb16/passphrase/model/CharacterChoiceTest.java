/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.passphrase.model;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

class CharacterChoiceTest {

  @Test
  void fixedCarriesItsCharacter() {
    assertThat(CharacterChoice.fixed('-'))
        .isInstanceOfSatisfying(
            CharacterChoice.Fixed.class, fixed -> assertThat(fixed.value()).isEqualTo('-'));
  }

  @Test
  void nulMapsToNone() {
    assertThat(CharacterChoice.fixed('\0')).isSameAs(CharacterChoice.none());
  }

  @Test
  void fixedRecordRejectsNul() {
    assertThatThrownBy(() -> new CharacterChoice.Fixed('\0'))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void equality() {
    assertThat(CharacterChoice.fixed('x')).isEqualTo(CharacterChoice.fixed('x'));
    assertThat(CharacterChoice.fixed('x')).isNotEqualTo(CharacterChoice.fixed('y'));
    assertThat(CharacterChoice.random()).isNotEqualTo(CharacterChoice.none());
  }

  @Test
  void bundledEnglishPath() {
    assertThat(BundledWordList.ENGLISH.getPath()).isEqualTo("?en.gz");
  }
}
