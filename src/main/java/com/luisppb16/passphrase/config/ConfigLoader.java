/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.passphrase.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/** Reads {@link PassphraseSettings} documents written in JSON. */
@Slf4j
@UtilityClass
public class ConfigLoader {

  private static final ObjectMapper MAPPER =
      JsonMapper.builder().enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS).build();

  /** Shared mapper, also used for the bundled preset catalogue. */
  public static ObjectMapper mapper() {
    return MAPPER;
  }

  public static PassphraseConfig load(final Path path) {
    return read(path).toConfig();
  }

  public static PassphraseSettings read(final Path path) {
    Objects.requireNonNull(path, "Settings path cannot be null");
    try (final InputStream in = Files.newInputStream(path)) {
      final PassphraseSettings settings = read(in);
      log.debug("Settings loaded from {}", path);
      return settings;
    } catch (final IOException e) {
      log.error("Error reading settings file {}: {}", path, e.getMessage(), e);
      throw new InvalidConfigurationException("Could not read settings file " + path, e);
    }
  }

  public static PassphraseSettings read(final InputStream in) {
    Objects.requireNonNull(in, "Settings stream cannot be null");
    try {
      return MAPPER.readValue(in, PassphraseSettings.class);
    } catch (final JsonProcessingException e) {
      throw new InvalidConfigurationException("Malformed settings: " + e.getOriginalMessage(), e);
    } catch (final IOException e) {
      throw new InvalidConfigurationException("Could not read settings", e);
    }
  }

  public static PassphraseSettings parse(final String json) {
    Objects.requireNonNull(json, "Settings JSON cannot be null");
    try {
      return MAPPER.readValue(json, PassphraseSettings.class);
    } catch (final JsonProcessingException e) {
      throw new InvalidConfigurationException("Malformed settings: " + e.getOriginalMessage(), e);
    }
  }
}
