/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.passphrase.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.luisppb16.passphrase.config.ConfigLoader;
import com.luisppb16.passphrase.config.PassphraseSettings;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/** Catalogue of named configuration presets bundled with the library. */
@Slf4j
@UtilityClass
public class PresetRegistry {

  private static final Map<String, PassphraseSettings> PRESETS;
  private static final String PRESETS_JSON_PATH = "/presets.json";

  static {
    Map<String, PassphraseSettings> tempPresets;
    try (final InputStream in = PresetRegistry.class.getResourceAsStream(PRESETS_JSON_PATH)) {
      if (in == null) {
        log.error("Preset catalogue not found: {}", PRESETS_JSON_PATH);
        throw new IllegalStateException("Preset catalogue not found: " + PRESETS_JSON_PATH);
      }
      final Map<String, PassphraseSettings> raw =
          ConfigLoader.mapper()
              .readValue(in, new TypeReference<LinkedHashMap<String, PassphraseSettings>>() {});
      final Map<String, PassphraseSettings> normalized = new LinkedHashMap<>();
      raw.forEach((name, settings) -> normalized.put(normalize(name), settings));
      tempPresets = normalized;
      log.info("Loaded {} presets from {}", tempPresets.size(), PRESETS_JSON_PATH);
    } catch (final JsonProcessingException e) {
      log.error("Error parsing presets.json: {}", e.getMessage(), e);
      tempPresets = Collections.emptyMap();
    } catch (final IOException e) {
      log.error("Error reading presets.json: {}", e.getMessage(), e);
      tempPresets = Collections.emptyMap();
    } catch (final IllegalStateException e) {
      log.error(e.getMessage());
      tempPresets = Collections.emptyMap();
    }
    PRESETS = Collections.unmodifiableMap(tempPresets);
  }

  /** Preset names in catalogue order. */
  public static Set<String> getPresetNames() {
    return PRESETS.keySet();
  }

  /** Looks a preset up by name, ignoring case. */
  public static Optional<PassphraseSettings> getPreset(final String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(PRESETS.get(normalize(name)));
  }

  private static String normalize(final String name) {
    return name.trim().toLowerCase(Locale.ROOT);
  }
}
