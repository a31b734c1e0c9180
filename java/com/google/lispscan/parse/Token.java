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
import static java.util.Objects.requireNonNull;

/**
 * A token returned by {@link Scanner#scan}: either a token class, or a single character.
 *
 * <p>Every token has an integer {@link #tag}. Token classes use the negative tags of {@link Kind},
 * and a single-character token uses its own code point, so the two ranges never collide.
 *
 * @param kind the token kind
 * @param codePoint the character of a {@link Kind#CHAR} token, or the class tag otherwise
 */
public record Token(Kind kind, int codePoint) {

  /** Token kinds. */
  public enum Kind {
    EOF(-1, "EOF"),
    IDENT(-2, "Ident"),
    INT(-3, "Int"),
    FLOAT(-4, "Float"),
    STRING(-5, "String"),
    KEYWORD(-6, "Keyword"),
    RAW_STRING(-7, "RawString"),
    COMMENT(-8, "Comment"),
    CHAR(0, "Char");

    private final int tag;
    private final String displayName;

    Kind(int tag, String displayName) {
      this.tag = tag;
      this.displayName = displayName;
    }

    /** The mode bit enabling recognition of this token class. */
    int modeBit() {
      checkArgument(tag < 0 && this != EOF, "%s has no mode bit", this);
      return 1 << -tag;
    }
  }

  public static final Token EOF = new Token(Kind.EOF, Kind.EOF.tag);
  public static final Token IDENT = new Token(Kind.IDENT, Kind.IDENT.tag);
  public static final Token INT = new Token(Kind.INT, Kind.INT.tag);
  public static final Token FLOAT = new Token(Kind.FLOAT, Kind.FLOAT.tag);
  public static final Token STRING = new Token(Kind.STRING, Kind.STRING.tag);
  public static final Token KEYWORD = new Token(Kind.KEYWORD, Kind.KEYWORD.tag);
  public static final Token RAW_STRING = new Token(Kind.RAW_STRING, Kind.RAW_STRING.tag);
  public static final Token COMMENT = new Token(Kind.COMMENT, Kind.COMMENT.tag);

  public Token {
    requireNonNull(kind, "kind");
    if (kind == Kind.CHAR) {
      checkArgument(Character.isValidCodePoint(codePoint), "invalid code point: %s", codePoint);
    } else {
      checkArgument(codePoint == kind.tag, "%s has tag %s, got %s", kind, kind.tag, codePoint);
    }
  }

  /** Returns the single-character token for the given code point. */
  public static Token ofChar(int codePoint) {
    return new Token(Kind.CHAR, codePoint);
  }

  /** Returns the token with the given integer tag. */
  public static Token of(int tag) {
    switch (tag) {
      case -1:
        return EOF;
      case -2:
        return IDENT;
      case -3:
        return INT;
      case -4:
        return FLOAT;
      case -5:
        return STRING;
      case -6:
        return KEYWORD;
      case -7:
        return RAW_STRING;
      case -8:
        return COMMENT;
      default:
        return ofChar(tag);
    }
  }

  /** The integer encoding of this token. */
  public int tag() {
    return codePoint;
  }

  public boolean isChar() {
    return kind == Kind.CHAR;
  }

  /** Returns a printable string for the token, e.g. {@code Ident} or {@code "("}. */
  @Override
  public String toString() {
    if (kind != Kind.CHAR) {
      return kind.displayName;
    }
    return '"' + new String(Character.toChars(codePoint)) + '"';
  }
}
