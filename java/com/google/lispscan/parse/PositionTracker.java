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

import com.google.lispscan.diag.Position;

/** Tracks the position of the next unconsumed rune. */
final class PositionTracker {

  /** Bytes consumed so far. */
  private int offset = 0;

  private int line = 1;

  /** The column of the next rune. */
  private int column = 1;

  /** Advances past a rune of the given encoded width. */
  void advance(int ch, int width) {
    offset += width;
    if (ch == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
  }

  int offset() {
    return offset;
  }

  int line() {
    return line;
  }

  int column() {
    return column;
  }

  Position snapshot(String filename) {
    return new Position(filename, offset, line, column);
  }
}
