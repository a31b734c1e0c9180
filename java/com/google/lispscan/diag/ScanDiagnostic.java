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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.lispscan.diag.ScanError.ErrorKind;
import java.util.Objects;

/** A single lexical diagnostic. */
public class ScanDiagnostic {

  private final ErrorKind kind;
  private final Position position;
  private final String diagnostic;
  private final ImmutableList<Object> args;

  private ScanDiagnostic(
      ErrorKind kind, Position position, String diagnostic, ImmutableList<Object> args) {
    this.kind = requireNonNull(kind);
    this.position = requireNonNull(position);
    this.diagnostic = requireNonNull(diagnostic);
    this.args = requireNonNull(args);
  }

  /** The diagnostic kind. */
  public ErrorKind kind() {
    return kind;
  }

  /** The position of the offending input. */
  public Position position() {
    return position;
  }

  /** The formatted diagnostic message. */
  public String diagnostic() {
    return diagnostic;
  }

  /** The diagnostic arguments. */
  public ImmutableList<Object> args() {
    return args;
  }

  /**
   * Formats a diagnostic.
   *
   * @param position the diagnostic position
   * @param kind the error kind
   * @param args format args
   */
  public static ScanDiagnostic format(Position position, ErrorKind kind, Object... args) {
    String message = kind.format(args);
    String diagnostic = position + ": error: " + message.trim();
    return new ScanDiagnostic(kind, position, diagnostic, ImmutableList.copyOf(args));
  }

  @Override
  public String toString() {
    return diagnostic;
  }

  @Override
  public int hashCode() {
    return Objects.hash(diagnostic, kind, position);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ScanDiagnostic)) {
      return false;
    }
    ScanDiagnostic that = (ScanDiagnostic) obj;
    return diagnostic.equals(that.diagnostic)
        && kind.equals(that.kind)
        && position.equals(that.position);
  }
}
