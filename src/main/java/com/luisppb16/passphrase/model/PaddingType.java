/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.passphrase.model;

public enum PaddingType {
  NONE,
  FIXED,
  ADAPTIVE
}
