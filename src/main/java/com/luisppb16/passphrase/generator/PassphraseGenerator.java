/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.passphrase.generator;

import com.luisppb16.passphrase.config.PassphraseConfig;
import com.luisppb16.passphrase.model.CaseTransform;
import com.luisppb16.passphrase.wordlist.WordListLoader;
import com.luisppb16.passphrase.wordlist.WordSource;
import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Assembles memorable passphrases from dictionary words.
 *
 * <p>Each call to {@link #generate()} runs the full pipeline against the current state of the
 * {@link PassphraseConfig}:
 *
 * <ol>
 *   <li>resolve the separator once for the call
 *   <li>draw {@code wordCount} words from the word source, within the length bounds
 *   <li>transform their case, unless the transform is {@link CaseTransform#NONE}
 *   <li>apply character substitutions
 *   <li>join leading digits, separator, words, separator and trailing digits, where the
 *       separators around the digit groups only appear when the group is non-empty
 *   <li>apply symbol padding
 * </ol>
 *
 * <p>For example, with a fixed {@code '-'} separator, two digits and two padding characters on
 * each side and capitalised words, the result has the shape {@code
 * ----12-Correct-Horse-Battery-Staple-34--}.
 *
 * <p>The word source is read anew on every call. A generator is as thread-safe as its random
 * source and its configuration; the configuration itself is not synchronised.
 *
 * @author Luis Pepe
 * @version 1.0
 * @since 2026
 */
@Slf4j
public final class PassphraseGenerator {

  @Getter private final PassphraseConfig config;
  private final WordSource wordSource;
  private final WordSelector wordSelector;
  private final CaseTransformer caseTransformer;
  private final CharacterSubstituter characterSubstituter;
  private final SeparatorResolver separatorResolver;
  private final DigitPadding digitPadding;
  private final SymbolPadder symbolPadder;

  /** Reads the word list named by {@link PassphraseConfig#getWordListPath()} on every call. */
  public PassphraseGenerator(final PassphraseConfig config) {
    this(config, () -> WordListLoader.readWords(config.getWordListPath()));
  }

  public PassphraseGenerator(final PassphraseConfig config, final WordSource wordSource) {
    this(config, wordSource, RandomSource.threadLocal());
  }

  public PassphraseGenerator(
      final PassphraseConfig config, final WordSource wordSource, final RandomSource random) {
    this.config = Objects.requireNonNull(config, "Config cannot be null");
    this.wordSource = Objects.requireNonNull(wordSource, "Word source cannot be null");
    Objects.requireNonNull(random, "Random source cannot be null");
    this.wordSelector = new WordSelector(random);
    this.caseTransformer = new CaseTransformer(random);
    this.characterSubstituter = new CharacterSubstituter();
    this.separatorResolver = new SeparatorResolver(random);
    this.digitPadding = new DigitPadding(random);
    this.symbolPadder = new SymbolPadder(random);
  }

  /**
   * Generates one passphrase.
   *
   * @throws com.luisppb16.passphrase.wordlist.WordSourceUnavailableException if the word source
   *     cannot be read
   * @throws EmptyCandidateSetException if no word fits the length bounds
   */
  public String generate() {
    final String separator = separatorResolver.resolve(config);
    final List<String> words = selectWords();
    final int digitsBefore = config.getPaddingDigitsBefore();
    final int digitsAfter = config.getPaddingDigitsAfter();
    final String leadingDigits = digitPadding.digits(digitsBefore);
    final String trailingDigits = digitPadding.digits(digitsAfter);

    final StringBuilder core = new StringBuilder(leadingDigits);
    if (digitsBefore > 0) {
      core.append(separator);
    }
    core.append(String.join(separator, words));
    if (digitsAfter > 0) {
      core.append(separator);
    }
    core.append(trailingDigits);

    final String passphrase = symbolPadder.pad(core.toString(), separator, config);
    log.debug(
        "Assembled a {}-character passphrase from {} words with {} padding",
        passphrase.length(),
        words.size(),
        config.getPaddingType());
    return passphrase;
  }

  /**
   * Lazily generates {@code count} passphrases. Each element runs the full pipeline when it is
   * consumed, and a failure surfaces at the element that caused it.
   *
   * @throws IllegalArgumentException if {@code count} is negative
   */
  public Stream<String> generate(final int count) {
    if (count < 0) {
      throw new IllegalArgumentException("Passphrase count cannot be negative but was " + count);
    }
    return IntStream.range(0, count).mapToObj(i -> generate());
  }

  private List<String> selectWords() {
    final List<String> selected =
        wordSelector.select(
            wordSource.words(),
            config.getMinWordLength(),
            config.getMaxWordLength(),
            config.getWordCount());
    final CaseTransform caseTransform = config.getCaseTransform();
    final List<String> cased =
        caseTransform == CaseTransform.NONE
            ? selected
            : caseTransformer.transform(selected, caseTransform);
    return characterSubstituter.substitute(cased, config.getCharacterSubstitutions());
  }
}
