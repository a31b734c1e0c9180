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

package com.google.lispscan.main;

import com.google.common.base.Joiner;
import org.jspecify.annotations.Nullable;

/** Invalid command line arguments. */
public class UsageException extends RuntimeException {

  private static final String[] USAGE = {
    "Usage: lispscan [options] < input",
    "",
    "Options:",
    "  --filename <name>",
    "    The input name reported in positions.",
    "  --mode <class>[,<class>...]",
    "    The token classes to recognize: idents, ints, floats, strings, keywords,",
    "    raw_strings, comments, skip_comments, or lisp for all of them (the default).",
    "  --keep_comments",
    "    Report comments as tokens instead of skipping them.",
    "  --whitespace <char>[,<char>...]",
    "    The characters to skip: space, tab, lf, cr, ff, vt.",
    "  --raw_string_delimiter <char>",
    "    The raw string delimiter, by default ¬.",
    "  --help",
    "    Print this usage statement.",
  };

  UsageException() {
    super(buildMessage(null));
  }

  UsageException(String message) {
    super(buildMessage(message));
  }

  private static String buildMessage(@Nullable String message) {
    StringBuilder builder = new StringBuilder();
    if (message != null) {
      builder.append(message).append("\n\n");
    }
    Joiner.on('\n').appendTo(builder, USAGE);
    return builder.toString();
  }
}
