/*
 * Copyright 2016 Google Inc. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.lispscan.parse;

/**
 * Mode bits controlling which token classes {@link Scanner#scan} recognizes.
 *
 * <p>Bits are combined with {@code |}. A rune that would start a disabled class is returned as a
 * single-character token instead. {@link #SCAN_FLOATS} implies {@link #SCAN_INTS}.
 */
public final class Mode {

  public static final int SCAN_IDENTS = Token.Kind.IDENT.modeBit();
  public static final int SCAN_INTS = Token.Kind.INT.modeBit();
  public static final int SCAN_FLOATS = Token.Kind.FLOAT.modeBit();
  public static final int SCAN_STRINGS = Token.Kind.STRING.modeBit();
  public static final int SCAN_KEYWORDS = Token.Kind.KEYWORD.modeBit();
  public static final int SCAN_RAW_STRINGS = Token.Kind.RAW_STRING.modeBit();
  public static final int SCAN_COMMENTS = Token.Kind.COMMENT.modeBit();

  /** Discards comments instead of returning them; only meaningful with {@link #SCAN_COMMENTS}. */
  public static final int SKIP_COMMENTS = 1 << 9;

  /** All token classes, with comments skipped. */
  public static final int LISP_TOKENS =
      SCAN_IDENTS
          | SCAN_FLOATS
          | SCAN_STRINGS
          | SCAN_KEYWORDS
          | SCAN_RAW_STRINGS
          | SCAN_COMMENTS
          | SKIP_COMMENTS;

  static boolean scansNumbers(int mode) {
    return (mode & (SCAN_INTS | SCAN_FLOATS)) != 0;
  }

  static boolean isSet(int mode, int bit) {
    return (mode & bit) != 0;
  }

  private Mode() {}
}
