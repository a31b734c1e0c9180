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

package com.google.lispscan.diag;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A source position.
 *
 * @param filename the name of the input, possibly empty; never validated against a file system
 * @param offset the zero-indexed byte offset, counted after any leading byte-order mark
 * @param line the one-indexed line number, or {@code 0} if the position is invalid
 * @param column the one-indexed column, in runes since the last newline
 */
public record Position(String filename, int offset, int line, int column) {

  public Position {
    requireNonNull(filename, "filename");
    checkArgument(offset >= 0, "negative offset: %s", offset);
    checkArgument(line >= 0, "negative line: %s", line);
    checkArgument(column >= 0, "negative column: %s", column);
  }

  /** Returns an invalid position for the given input name. */
  public static Position invalid(String filename) {
    return new Position(filename, 0, 0, 0);
  }

  /** Whether the position refers to a line in the input. */
  public boolean isValid() {
    return line > 0;
  }

  @Override
  public String toString() {
    String name = filename.isEmpty() ? "<input>" : filename;
    if (!isValid()) {
      return name;
    }
    return name + ":" + line + ":" + column;
  }
}
