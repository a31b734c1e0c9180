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

import com.google.lispscan.diag.ScanError;
import com.google.lispscan.diag.ScanLog;
import com.google.lispscan.options.ScannerOptions;
import com.google.lispscan.options.ScannerOptionsParser;
import com.google.lispscan.parse.Scanner;
import com.google.lispscan.parse.Token;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Arrays;

/**
 * Main entry point for the lispscan CLI.
 *
 * <p>Tokenizes standard input and prints one line per token: its position, its kind and its text.
 */
public class Main {

  public static void main(String[] args) throws IOException {
    boolean ok;
    try {
      ok = scan(args, System.in, System.out);
    } catch (ScanError | UsageException e) {
      System.err.println(e.getMessage());
      ok = false;
    } catch (Throwable scannerCrash) {
      scannerCrash.printStackTrace();
      ok = false;
    }
    System.exit(ok ? 0 : 1);
  }

  /**
   * Prints the tokens of {@code input} to {@code output}.
   *
   * @throws ScanError if the input contained lexical errors, after all tokens have been printed
   * @throws UsageException if the arguments are invalid, or {@code --help} was passed
   */
  public static boolean scan(String[] args, InputStream input, PrintStream output)
      throws IOException {
    ScannerOptions options = parseOptions(args);
    if (options.help()) {
      throw new UsageException();
    }
    ScanLog log = new ScanLog();
    Scanner scanner = options.newScanner(input, log);
    for (Token token = scanner.scan(); !token.equals(Token.EOF); token = scanner.scan()) {
      output.println(scanner.position() + ": (" + token + ") " + scanner.tokenText());
    }
    output.flush();
    log.maybeThrow();
    return true;
  }

  private static ScannerOptions parseOptions(String[] args) {
    try {
      return ScannerOptionsParser.parse(Arrays.asList(args));
    } catch (IllegalArgumentException e) {
      throw new UsageException(e.getMessage());
    }
  }
}
