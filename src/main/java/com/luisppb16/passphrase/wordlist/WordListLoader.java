/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.passphrase.wordlist;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.zip.GZIPInputStream;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads word lists, one word per line, from the filesystem or from gzip-compressed resources
 * bundled with the library.
 *
 * <p>A path starting with {@value #BUNDLED_PREFIX} names a bundled resource: {@code "?en.gz"}
 * resolves to {@code /wordlists/en.gz} on the classpath and is decompressed while reading. Any
 * other path is opened as a UTF-8 text file.
 *
 * <p>Lines are returned verbatim and in order, except that a leading byte order mark is dropped.
 * Nothing is cached, so each call reads the source again. Streams are closed through try-with-resources on every exit path.
 */
@Slf4j
@UtilityClass
public class WordListLoader {

  public static final String BUNDLED_PREFIX = "?";
  private static final String BUNDLED_ROOT = "/wordlists/";
  private static final String BYTE_ORDER_MARK = "\uFEFF";

  public static List<String> readWords(final String path) {
    Objects.requireNonNull(path, "Word list path cannot be null");
    final List<String> words =
        path.startsWith(BUNDLED_PREFIX)
            ? readBundled(path.substring(BUNDLED_PREFIX.length()))
            : readFile(path);
    log.debug("Read {} lines from word list {}", words.size(), path);
    return words;
  }

  private static List<String> readBundled(final String name) {
    final String resource = BUNDLED_ROOT + name;
    try (final InputStream raw = WordListLoader.class.getResourceAsStream(resource)) {
      if (Objects.isNull(raw)) {
        log.error("Bundled word list not found: {}", resource);
        throw new WordSourceUnavailableException("Bundled word list not found: " + resource);
      }
      try (final InputStream in = new GZIPInputStream(raw)) {
        return readLines(in);
      }
    } catch (final IOException e) {
      log.error("Error reading bundled word list {}: {}", resource, e.getMessage(), e);
      throw new WordSourceUnavailableException("Could not read bundled word list " + resource, e);
    }
  }

  private static List<String> readFile(final String path) {
    final Path file;
    try {
      file = Path.of(path);
    } catch (final InvalidPathException e) {
      log.error("Invalid word list path {}: {}", path, e.getMessage(), e);
      throw new WordSourceUnavailableException("Invalid word list path " + path, e);
    }
    try (final InputStream in = Files.newInputStream(file)) {
      return readLines(in);
    } catch (final IOException e) {
      log.error("Error reading word list {}: {}", file, e.getMessage(), e);
      throw new WordSourceUnavailableException("Could not read word list " + file, e);
    }
  }

  private static List<String> readLines(final InputStream in) throws IOException {
    final BufferedReader reader =
        new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    final List<String> lines = new ArrayList<>();
    String line = reader.readLine();
    if (line != null && line.startsWith(BYTE_ORDER_MARK)) {
      line = line.substring(BYTE_ORDER_MARK.length());
    }
    while (line != null) {
      lines.add(line);
      line = reader.readLine();
    }
    return Collections.unmodifiableList(lines);
  }
}
