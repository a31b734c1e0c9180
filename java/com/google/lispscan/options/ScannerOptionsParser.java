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

package com.google.lispscan.options;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.lispscan.parse.Mode;
import java.util.ArrayDeque;
import java.util.Deque;
import org.jspecify.annotations.Nullable;

/** A command line options parser for {@link ScannerOptions}. */
public class ScannerOptionsParser {

  private static final ImmutableMap<String, Integer> MODE_BITS =
      ImmutableMap.<String, Integer>builder()
          .put("idents", Mode.SCAN_IDENTS)
          .put("ints", Mode.SCAN_INTS)
          .put("floats", Mode.SCAN_FLOATS)
          .put("strings", Mode.SCAN_STRINGS)
          .put("keywords", Mode.SCAN_KEYWORDS)
          .put("raw_strings", Mode.SCAN_RAW_STRINGS)
          .put("comments", Mode.SCAN_COMMENTS)
          .put("skip_comments", Mode.SKIP_COMMENTS)
          .put("lisp", Mode.LISP_TOKENS)
          .buildOrThrow();

  private static final ImmutableMap<String, Character> WHITESPACE_NAMES =
      ImmutableMap.<String, Character>builder()
          .put("space", ' ')
          .put("tab", '\t')
          .put("lf", '\n')
          .put("cr", '\r')
          .put("ff", '\f')
          .put("vt", '\u000b')
          .buildOrThrow();

  private static final Splitter LIST_SPLITTER = Splitter.on(',').omitEmptyStrings().trimResults();

  /** Parses command line options into {@link ScannerOptions}. */
  public static ScannerOptions parse(Iterable<String> args) {
    ScannerOptions.Builder builder = ScannerOptions.builder();
    parse(builder, args);
    return builder.build();
  }

  /** Parses command line options into a {@link ScannerOptions.Builder}. */
  public static void parse(ScannerOptions.Builder builder, Iterable<String> args) {
    Deque<String> argumentDeque = new ArrayDeque<>();
    for (String arg : args) {
      if (!arg.isEmpty()) {
        argumentDeque.addLast(arg);
      }
    }
    parse(builder, argumentDeque);
  }

  private static void parse(ScannerOptions.Builder builder, Deque<String> argumentDeque) {
    boolean keepComments = false;
    Integer mode = null;
    while (!argumentDeque.isEmpty()) {
      String next = argumentDeque.pollFirst();
      switch (next) {
        case "--filename":
          builder.setFilename(requireOne(next, argumentDeque));
          break;
        case "--mode":
          mode = parseMode(readList(argumentDeque));
          break;
        case "--keep_comments":
          keepComments = true;
          break;
        case "--whitespace":
          builder.setWhitespace(parseWhitespace(readList(argumentDeque)));
          break;
        case "--raw_string_delimiter":
          {
            String delimiter = requireOne(next, argumentDeque);
            checkArgument(
                delimiter.codePointCount(0, delimiter.length()) == 1,
                "--raw_string_delimiter expects a single character, got '%s'",
                delimiter);
            builder.setRawStringDelimiter(delimiter.codePointAt(0));
            break;
          }
        case "--help":
          builder.setHelp(true);
          break;
        default:
          throw new IllegalArgumentException("unknown option: " + next);
      }
    }
    if (keepComments) {
      mode = (mode != null ? mode : Mode.LISP_TOKENS) & ~Mode.SKIP_COMMENTS;
    }
    if (mode != null) {
      builder.setMode(mode);
    }
  }

  private static int parseMode(ImmutableList<String> values) {
    int mode = 0;
    for (String value : values) {
      for (String name : LIST_SPLITTER.split(value)) {
        Integer bit = MODE_BITS.get(name);
        checkArgument(bit != null, "unknown token class: %s", name);
        mode |= bit;
      }
    }
    return mode;
  }

  private static long parseWhitespace(ImmutableList<String> values) {
    long mask = 0;
    for (String value : values) {
      for (String name : LIST_SPLITTER.split(value)) {
        Character c = WHITESPACE_NAMES.get(name);
        checkArgument(c != null, "unknown whitespace character: %s", name);
        mask |= 1L << c;
      }
    }
    return mask;
  }

  private static String requireOne(String flag, Deque<String> argumentDeque) {
    String value = readOne(argumentDeque);
    checkArgument(value != null, "%s requires a value", flag);
    return value;
  }

  /** Returns the value of an option, or {@code null}. */
  private static @Nullable String readOne(Deque<String> argumentDeque) {
    if (argumentDeque.isEmpty() || argumentDeque.peekFirst().startsWith("--")) {
      return null;
    }
    return argumentDeque.pollFirst();
  }

  /** Returns a list of option values. */
  private static ImmutableList<String> readList(Deque<String> argumentDeque) {
    ImmutableList.Builder<String> result = ImmutableList.builder();
    while (!argumentDeque.isEmpty() && !argumentDeque.peekFirst().startsWith("--")) {
      result.add(argumentDeque.pollFirst());
    }
    return result.build();
  }

  private ScannerOptionsParser() {}
}
