/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.passphrase.model;

public enum CaseTransform {
  NONE,
  UPPER_CASE,
  LOWER_CASE,
  /** First character upper case, remainder untouched. */
  CAPITALIZE,
  /** First character lower case, remainder upper case. */
  INVERT,
  /** Every other character upper case, starting on a per-word coin flip. */
  ALTERNATE,
  /** Every character independently lower or upper case. */
  RANDOM
}
