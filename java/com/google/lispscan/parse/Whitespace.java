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

import static com.google.common.base.Preconditions.checkArgument;

/** Whitespace bitmasks: bit {@code i} set means code point {@code i} is skipped between tokens. */
public final class Whitespace {

  /** Tab, line feed, carriage return and space. */
  public static final long LISP_WHITESPACE = of('\t', '\n', '\r', ' ');

  /** No whitespace; every rune becomes part of a token. */
  public static final long NONE = 0L;

  /** Returns the mask containing the given characters, each of which must be below 64. */
  public static long of(char... chars) {
    long mask = 0;
    for (char c : chars) {
      checkArgument(c < Long.SIZE, "not representable in a whitespace mask: U+%04X", (int) c);
      mask |= 1L << c;
    }
    return mask;
  }

  /** Whether {@code ch} is in {@code mask}; code points of 64 and above never are. */
  public static boolean contains(long mask, int ch) {
    return ch >= 0 && ch < Long.SIZE && (mask & (1L << ch)) != 0;
  }

  private Whitespace() {}
}
