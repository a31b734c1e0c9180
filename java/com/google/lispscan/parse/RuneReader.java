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

import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.io.InputStream;

/**
 * Decodes UTF-8 from an {@link InputStream}, one rune at a time, with one rune of lookahead.
 *
 * <p>Malformed input never stops the reader: each bad byte decodes to {@link #REPLACEMENT} and is
 * flagged while it is the lookahead rune, see {@link #malformed}. A byte-order mark at the very
 * start of the input is skipped, and positions are counted from the byte after it.
 */
final class RuneReader {

  /** Returned by {@link #peek} and {@link #next} at the end of the input. */
  static final int EOF = -1;

  static final int REPLACEMENT = 0xFFFD;

  private static final int BYTE_ORDER_MARK = 0xFEFF;

  /** Not yet decoded. */
  private static final int UNREAD = -2;

  private static final int BUFFER_SIZE = 1024;

  private final InputStream input;
  private final PositionTracker tracker = new PositionTracker();

  private final byte[] buf = new byte[BUFFER_SIZE];
  private int pos = 0;
  private int end = 0;
  private boolean exhausted = false;

  /** The lookahead rune, or {@link #UNREAD}. */
  private int ch = UNREAD;

  /** The encoded width of the lookahead rune. */
  private int width = 0;

  /** Whether the lookahead rune was decoded from a malformed sequence. */
  private boolean malformed = false;

  private boolean started = false;

  RuneReader(InputStream input) {
    this.input = requireNonNull(input);
  }

  /** Returns the next rune without consuming it, or {@link #EOF}. */
  int peek() throws IOException {
    if (ch == UNREAD) {
      ch = decode();
      if (!started) {
        started = true;
        if (ch == BYTE_ORDER_MARK) {
          pos += width;
          ch = decode();
        }
      }
    }
    return ch;
  }

  /** Consumes and returns the next rune, or returns {@link #EOF} without consuming anything. */
  int next() throws IOException {
    int result = peek();
    if (result == EOF) {
      return EOF;
    }
    pos += width;
    tracker.advance(result, width);
    ch = UNREAD;
    return result;
  }

  /** Whether the lookahead rune was decoded from malformed input. */
  boolean malformed() {
    return malformed;
  }

  PositionTracker tracker() {
    return tracker;
  }

  private int decode() throws IOException {
    malformed = false;
    if (!buffered(1)) {
      width = 0;
      return EOF;
    }
    int b0 = buf[pos] & 0xff;
    if (b0 < 0x80) {
      width = 1;
      return b0;
    }
    int n;
    int cp;
    if (b0 >= 0xc2 && b0 <= 0xdf) {
      n = 2;
      cp = b0 & 0x1f;
    } else if (b0 >= 0xe0 && b0 <= 0xef) {
      n = 3;
      cp = b0 & 0x0f;
    } else if (b0 >= 0xf0 && b0 <= 0xf4) {
      n = 4;
      cp = b0 & 0x07;
    } else {
      return replacement();
    }
    for (int i = 1; i < n; i++) {
      if (!buffered(i + 1)) {
        return replacement();
      }
      int b = buf[pos + i] & 0xff;
      if ((b & 0xc0) != 0x80) {
        return replacement();
      }
      cp = (cp << 6) | (b & 0x3f);
    }
    switch (n) {
      case 3 -> {
        if (cp < 0x800 || Character.isSurrogate((char) cp)) {
          return replacement();
        }
      }
      case 4 -> {
        if (cp < Character.MIN_SUPPLEMENTARY_CODE_POINT || cp > Character.MAX_CODE_POINT) {
          return replacement();
        }
      }
      default -> {}
    }
    width = n;
    return cp;
  }

  private int replacement() {
    width = 1;
    malformed = true;
    return REPLACEMENT;
  }

  /**
   * Whether at least {@code count} unconsumed bytes are buffered, reading only until they are or
   * the input is exhausted.
   */
  private boolean buffered(int count) throws IOException {
    while (end - pos < count && !exhausted) {
      fill();
    }
    return end - pos >= count;
  }

  /** Compacts the buffer and reads from the input once. */
  private void fill() throws IOException {
    int remaining = end - pos;
    System.arraycopy(buf, pos, buf, 0, remaining);
    pos = 0;
    end = remaining;
    int n = input.read(buf, end, buf.length - end);
    if (n < 0) {
      exhausted = true;
    } else {
      end += n;
    }
  }
}
