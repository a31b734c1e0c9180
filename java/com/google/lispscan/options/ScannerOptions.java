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

import static java.util.Objects.requireNonNull;

import com.google.auto.value.AutoBuilder;
import com.google.lispscan.diag.ScanLog;
import com.google.lispscan.parse.IdentRunePredicate;
import com.google.lispscan.parse.Mode;
import com.google.lispscan.parse.Scanner;
import com.google.lispscan.parse.Whitespace;
import java.io.InputStream;

/**
 * Scanner configuration.
 *
 * @param filename The name reported in token positions.
 * @param mode The recognized token classes, a union of {@link Mode} bits.
 * @param whitespace The characters skipped between tokens, see {@link Whitespace}.
 * @param rawStringDelimiter The code point delimiting raw strings.
 * @param help Print usage information.
 */
public record ScannerOptions(
    String filename, int mode, long whitespace, int rawStringDelimiter, boolean help) {
  public ScannerOptions {
    requireNonNull(filename, "filename");
  }

  /** Returns a scanner for {@code input}, configured with these options. */
  public Scanner newScanner(InputStream input, ScanLog log) {
    Scanner scanner = new Scanner(input, log);
    scanner.setFilename(filename);
    scanner.setMode(mode);
    scanner.setWhitespace(whitespace);
    scanner.setRawStringDelimiter(rawStringDelimiter);
    scanner.setIdentRunePredicate(IdentRunePredicate.LISP);
    return scanner;
  }

  public static Builder builder() {
    return new AutoBuilder_ScannerOptions_Builder()
        .setFilename("")
        .setMode(Mode.LISP_TOKENS)
        .setWhitespace(Whitespace.LISP_WHITESPACE)
        .setRawStringDelimiter(Scanner.DEFAULT_RAW_STRING_DELIMITER)
        .setHelp(false);
  }

  /** A {@link Builder} for {@link ScannerOptions}. */
  @AutoBuilder
  public abstract static class Builder {
    public abstract Builder setFilename(String filename);

    public abstract Builder setMode(int mode);

    public abstract Builder setWhitespace(long whitespace);

    public abstract Builder setRawStringDelimiter(int rawStringDelimiter);

    public abstract Builder setHelp(boolean help);

    public abstract ScannerOptions build();
  }
}
