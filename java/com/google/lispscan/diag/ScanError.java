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
import static java.util.stream.Collectors.joining;

import com.google.common.collect.ImmutableList;

/** A lexical error, aggregating the diagnostics recorded while scanning an input. */
public class ScanError extends Error {

  /** A diagnostic kind. */
  public enum ErrorKind {
    INVALID_UTF8("invalid UTF-8 encoding"),
    ILLEGAL_NUL("invalid character NUL"),
    LITERAL_NOT_TERMINATED("literal not terminated"),
    INVALID_ESCAPE("invalid char escape"),
    INVALID_CODE_POINT("escape sequence is invalid Unicode code point: U+%X"),
    INVALID_DIGIT("invalid digit '%c' in %s"),
    INVALID_RADIX_POINT("invalid radix point in %s"),
    LITERAL_WITHOUT_DIGITS("%s has no digits"),
    EXPONENT_MANTISSA_MISMATCH("'%c' exponent requires %s mantissa"),
    EXPONENT_WITHOUT_DIGITS("exponent has no digits"),
    HEX_MANTISSA_WITHOUT_EXPONENT("hexadecimal mantissa requires a 'p' exponent"),
    INVALID_SEPARATOR("'_' must separate successive digits");

    private final String message;

    ErrorKind(String message) {
      this.message = message;
    }

    String format(Object... args) {
      return String.format(message, args);
    }
  }

  private final ImmutableList<ScanDiagnostic> diagnostics;

  public ScanError(ImmutableList<ScanDiagnostic> diagnostics) {
    super(
        diagnostics.stream()
            .map(ScanDiagnostic::diagnostic)
            .collect(joining(System.lineSeparator())));
    checkArgument(!diagnostics.isEmpty(), "a scan error requires at least one diagnostic");
    this.diagnostics = diagnostics;
  }

  /** The diagnostics, in the order they were reported. */
  public ImmutableList<ScanDiagnostic> diagnostics() {
    return diagnostics;
  }

  /** The kind of the first diagnostic. */
  public ErrorKind kind() {
    return diagnostics.get(0).kind();
  }
}
