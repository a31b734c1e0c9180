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
import static com.google.lispscan.parse.Mode.SCAN_COMMENTS;
import static com.google.lispscan.parse.Mode.SCAN_FLOATS;
import static com.google.lispscan.parse.Mode.SCAN_IDENTS;
import static com.google.lispscan.parse.Mode.SCAN_KEYWORDS;
import static com.google.lispscan.parse.Mode.SCAN_RAW_STRINGS;
import static com.google.lispscan.parse.Mode.SCAN_STRINGS;
import static com.google.lispscan.parse.Mode.SKIP_COMMENTS;
import static com.google.lispscan.parse.RuneReader.EOF;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Ascii;
import com.google.lispscan.diag.Position;
import com.google.lispscan.diag.ScanError.ErrorKind;
import com.google.lispscan.diag.ScanLog;
import java.io.IOException;
import java.io.InputStream;
import org.jspecify.annotations.Nullable;

/**
 * A scanner for Lisp source text, encoded in UTF-8.
 *
 * <p>Callers pull one token at a time with {@link #scan}, then read its text with {@link
 * #tokenText} and its start with {@link #position}. By default the scanner skips whitespace and
 * comments and recognizes every literal class; {@link #setMode}, {@link #setWhitespace} and {@link
 * #setIdentRunePredicate} narrow or change that.
 *
 * <p>Malformed input never stops the scan. Each problem is counted (see {@link #errorCount}) and
 * reported to the {@link ScanLog}, and the scanner returns its best-effort token. Only failures of
 * the underlying stream are thrown, as {@link IOException}.
 *
 * <p>Instances are not thread-safe. The scanner does not close its input.
 */
public class Scanner {

  /** The default raw string delimiter, {@code ¬}. */
  public static final int DEFAULT_RAW_STRING_DELIMITER = '¬';

  private final RuneReader reader;
  private final ScanLog log;

  private int mode = Mode.LISP_TOKENS;
  private long whitespace = Whitespace.LISP_WHITESPACE;
  private IdentRunePredicate identRune = IdentRunePredicate.LISP;
  private int rawStringDelimiter = DEFAULT_RAW_STRING_DELIMITER;
  private String filename = "";

  /** The current input character. */
  private int ch;

  /** Whether consumed characters belong to the current token. */
  private boolean inToken = false;

  /** The source text of the current token. */
  private final StringBuilder text = new StringBuilder();

  /** The value of the current string or raw string token. */
  private @Nullable String value = null;

  /** The start position of the current token. */
  private Position position = Position.invalid(filename);

  private int errorCount = 0;

  /** The first digit of the current numeric literal that is invalid for its radix, or -1. */
  private int invalidDigit = -1;

  public Scanner(InputStream input) {
    this(input, new ScanLog());
  }

  public Scanner(InputStream input, ScanLog log) {
    this.reader = new RuneReader(input);
    this.log = requireNonNull(log);
  }

  public int mode() {
    return mode;
  }

  /** Sets the token classes to recognize, a union of {@link Mode} bits. */
  public void setMode(int mode) {
    this.mode = mode;
  }

  public long whitespace() {
    return whitespace;
  }

  /** Sets the characters skipped between tokens, see {@link Whitespace}. */
  public void setWhitespace(long whitespace) {
    this.whitespace = whitespace;
  }

  public IdentRunePredicate identRunePredicate() {
    return identRune;
  }

  public void setIdentRunePredicate(IdentRunePredicate identRune) {
    this.identRune = requireNonNull(identRune);
  }

  public int rawStringDelimiter() {
    return rawStringDelimiter;
  }

  public void setRawStringDelimiter(int rawStringDelimiter) {
    checkArgument(
        Character.isValidCodePoint(rawStringDelimiter),
        "invalid code point: %s",
        rawStringDelimiter);
    this.rawStringDelimiter = rawStringDelimiter;
  }

  public String filename() {
    return filename;
  }

  /** Sets the file name reported in positions. */
  public void setFilename(String filename) {
    this.filename = requireNonNull(filename);
  }

  /** The number of errors encountered so far. */
  public int errorCount() {
    return errorCount;
  }

  public ScanLog log() {
    return log;
  }

  /** The start position of the token returned by the last call to {@link #scan}. */
  public Position position() {
    return position;
  }

  /** The position immediately after the last consumed character. */
  public Position pos() {
    return reader.tracker().snapshot(filename);
  }

  /**
   * Returns the text of the most recently scanned token: the decoded value for strings and raw
   * strings, and the source text otherwise.
   */
  public String tokenText() {
    if (value != null) {
      return value;
    }
    return text.toString();
  }

  /** Returns the source text of the most recently scanned token. */
  public String rawTokenText() {
    return text.toString();
  }

  /** Returns the next character without consuming it, or {@code -1} at the end of the input. */
  public int peek() throws IOException {
    ch = reader.peek();
    return ch;
  }

  /**
   * Consumes and returns the next character, or returns {@code -1} at the end of the input.
   *
   * <p>Invalidates the current token: its text becomes empty and its position invalid.
   */
  public int nextChar() throws IOException {
    ch = reader.peek();
    inToken = false;
    text.setLength(0);
    value = null;
    position = Position.invalid(filename);
    int result = ch;
    if (ch != EOF) {
      eat();
    }
    return result;
  }

  /** Scans the next token, skipping whitespace and (if configured) comments. */
  public Token scan() throws IOException {
    ch = reader.peek();
    value = null;
    OUTER:
    while (true) {
      inToken = false;
      while (Whitespace.contains(whitespace, ch)) {
        eat();
      }
      text.setLength(0);
      position = pos();
      inToken = true;
      Token token;
      if (ch == EOF) {
        token = Token.EOF;
      } else if (isDecimal(ch)) {
        // digits never start an identifier, whatever the predicate says
        token = Mode.scansNumbers(mode) ? number(false) : single();
      } else if (ch == '.' && Mode.isSet(mode, SCAN_FLOATS)) {
        token = dot();
      } else if (isIdentRune(ch, 0)) {
        if (Mode.isSet(mode, SCAN_IDENTS)) {
          identifier();
          token = Token.IDENT;
        } else {
          token = single();
        }
      } else if (ch == rawStringDelimiter) {
        token = Mode.isSet(mode, SCAN_RAW_STRINGS) ? rawString() : single();
      } else {
        switch (ch) {
          case '-' -> token = minus();
          case '"' -> token = Mode.isSet(mode, SCAN_STRINGS) ? string() : single();
          case ':' -> token = keyword();
          case ';' -> {
            eat();
            if (!Mode.isSet(mode, SCAN_COMMENTS)) {
              token = Token.ofChar(';');
            } else {
              while (ch != '\n' && ch != EOF) {
                eat();
              }
              if (Mode.isSet(mode, SKIP_COMMENTS)) {
                continue OUTER;
              }
              token = Token.COMMENT;
            }
          }
          // unquote-splicing
          case '~' -> token = digraph('@');
          // set literal
          case '#' -> token = digraph('{');
          default -> token = single();
        }
      }
      inToken = false;
      return token;
    }
  }

  /** Consumes an input character. */
  private void eat() throws IOException {
    if (ch == RuneReader.REPLACEMENT && reader.malformed()) {
      error(ErrorKind.INVALID_UTF8);
    } else if (ch == 0) {
      error(ErrorKind.ILLEGAL_NUL);
    }
    if (inToken) {
      text.appendCodePoint(ch);
    }
    reader.next();
    ch = reader.peek();
  }

  private Token single() throws IOException {
    int c = ch;
    eat();
    return Token.ofChar(c);
  }

  private boolean isIdentRune(int ch, int index) {
    return ch != EOF && identRune.test(ch, index);
  }

  /** Consumes an identifier, whose first character has already been checked. */
  private void identifier() throws IOException {
    eat();
    identifierRest(1);
  }

  /** Consumes identifier runes, the first of which is at {@code index}. */
  private void identifierRest(int index) throws IOException {
    for (int i = index; isIdentRune(ch, i); i++) {
      eat();
    }
  }

  /** Scans a fractional float such as {@code .5}, or whatever else starts with {@code .}. */
  private Token dot() throws IOException {
    eat();
    if (isDecimal(ch)) {
      return number(true);
    }
    if (Mode.isSet(mode, SCAN_IDENTS) && identRune.test('.', 0)) {
      identifierRest(1);
      return Token.IDENT;
    }
    return Token.ofChar('.');
  }

  private Token minus() throws IOException {
    eat();
    if (isDecimal(ch)) {
      return Mode.scansNumbers(mode) ? number(false) : Token.ofChar('-');
    }
    if (isIdentRune(ch, 0)) {
      if (!Mode.isSet(mode, SCAN_IDENTS)) {
        return Token.ofChar('-');
      }
      identifier();
      return Token.IDENT;
    }
    return Mode.isSet(mode, SCAN_IDENTS) ? Token.IDENT : Token.ofChar('-');
  }

  private Token keyword() throws IOException {
    eat();
    if (Mode.isSet(mode, SCAN_KEYWORDS) && isIdentRune(ch, 0)) {
      identifier();
      return Token.KEYWORD;
    }
    return Token.ofChar(':');
  }

  /** Scans a two-character identifier, or the single character if {@code second} is missing. */
  private Token digraph(int second) throws IOException {
    int first = ch;
    eat();
    if (ch == second && Mode.isSet(mode, SCAN_IDENTS)) {
      eat();
      return Token.IDENT;
    }
    return Token.ofChar(first);
  }

  private Token string() throws IOException {
    eat();
    StringBuilder sb = new StringBuilder();
    STRING:
    while (true) {
      switch (ch) {
        case '"' -> {
          eat();
          break STRING;
        }
        case '\\' -> {
          eat();
          escape(sb);
        }
        case '\n', EOF -> {
          error(ErrorKind.LITERAL_NOT_TERMINATED);
          break STRING;
        }
        default -> {
          sb.appendCodePoint(ch);
          eat();
        }
      }
    }
    value = sb.toString();
    return Token.STRING;
  }

  /** Decodes the escape sequence following a backslash. */
  private void escape(StringBuilder sb) throws IOException {
    switch (ch) {
      case 'a' -> simpleEscape(sb, 0x07);
      case 'b' -> simpleEscape(sb, '\b');
      case 'f' -> simpleEscape(sb, '\f');
      case 'n' -> simpleEscape(sb, '\n');
      case 'r' -> simpleEscape(sb, '\r');
      case 't' -> simpleEscape(sb, '\t');
      case 'v' -> simpleEscape(sb, 0x0b);
      case '\\' -> simpleEscape(sb, '\\');
      case '"' -> simpleEscape(sb, '"');
      case '0', '1', '2', '3', '4', '5', '6', '7' -> {
        int code = 0;
        for (int i = 0; i < 3 && '0' <= ch && ch <= '7'; i++) {
          code = (code << 3) | (ch - '0');
          eat();
        }
        sb.appendCodePoint(code);
      }
      case 'x' -> {
        eat();
        hexEscape(sb, 2);
      }
      case 'u' -> {
        eat();
        hexEscape(sb, 4);
      }
      case 'U' -> {
        eat();
        hexEscape(sb, 8);
      }
      default -> {
        // the escaped character is kept, and consumed as ordinary string content
        error(ErrorKind.INVALID_ESCAPE);
        sb.append('\\');
      }
    }
  }

  private void simpleEscape(StringBuilder sb, int code) throws IOException {
    eat();
    sb.appendCodePoint(code);
  }

  private void hexEscape(StringBuilder sb, int digits) throws IOException {
    long code = 0;
    for (int i = 0; i < digits; i++) {
      int d = digitValue(ch);
      if (d >= 16) {
        error(ErrorKind.INVALID_ESCAPE);
        return;
      }
      code = (code << 4) | d;
      eat();
    }
    if (code > Character.MAX_CODE_POINT
        || (code >= Character.MIN_SURROGATE && code <= Character.MAX_SURROGATE)) {
      error(ErrorKind.INVALID_CODE_POINT, code);
      sb.appendCodePoint(RuneReader.REPLACEMENT);
      return;
    }
    sb.appendCodePoint((int) code);
  }

  private Token rawString() throws IOException {
    int delimiter = ch;
    eat();
    StringBuilder sb = new StringBuilder();
    while (true) {
      if (ch == EOF) {
        error(ErrorKind.LITERAL_NOT_TERMINATED);
        break;
      }
      if (ch == delimiter) {
        eat();
        // a doubled delimiter stands for itself
        if (ch != delimiter) {
          break;
        }
      }
      sb.appendCodePoint(ch);
      eat();
    }
    value = sb.toString();
    return Token.RAW_STRING;
  }

  /**
   * Scans a numeric literal starting at the current character, or at the first digit after a
   * radix point that has already been consumed.
   */
  private Token number(boolean seenDot) throws IOException {
    int base = 10;
    char prefix = 0;
    int digsep = 0;
    invalidDigit = -1;
    Token token = Token.INT;

    if (!seenDot) {
      if (ch == '0') {
        eat();
        switch (radixPrefix()) {
          case 'x' -> {
            eat();
            base = 16;
            prefix = 'x';
          }
          case 'o' -> {
            eat();
            base = 8;
            prefix = 'o';
          }
          case 'b' -> {
            eat();
            base = 2;
            prefix = 'b';
          }
          default -> {
            // legacy octal, unless it turns out to be a float; the leading 0 is a digit
            base = 8;
            prefix = '0';
            digsep = 1;
          }
        }
      }
      digsep |= digits(base);
      if (ch == '.' && Mode.isSet(mode, SCAN_FLOATS)) {
        eat();
        seenDot = true;
      }
    }

    if (seenDot) {
      token = Token.FLOAT;
      if (prefix == 'o' || prefix == 'b') {
        error(ErrorKind.INVALID_RADIX_POINT, literalName(prefix));
      }
      digsep |= digits(base);
    }

    if ((digsep & 1) == 0) {
      error(ErrorKind.LITERAL_WITHOUT_DIGITS, literalName(prefix));
    }

    int e = lower(ch);
    if ((e == 'e' || e == 'p') && Mode.isSet(mode, SCAN_FLOATS)) {
      if (e == 'e' && prefix != 0 && prefix != '0') {
        error(ErrorKind.EXPONENT_MANTISSA_MISMATCH, ch, "decimal");
      } else if (e == 'p' && prefix != 'x') {
        error(ErrorKind.EXPONENT_MANTISSA_MISMATCH, ch, "hexadecimal");
      }
      eat();
      token = Token.FLOAT;
      if (ch == '+' || ch == '-') {
        eat();
      }
      int ds = digits(10);
      digsep |= ds;
      if ((ds & 1) == 0) {
        error(ErrorKind.EXPONENT_WITHOUT_DIGITS);
      }
    } else if (prefix == 'x' && token == Token.FLOAT) {
      error(ErrorKind.HEX_MANTISSA_WITHOUT_EXPONENT);
    }

    if (token == Token.INT && invalidDigit >= 0) {
      error(ErrorKind.INVALID_DIGIT, invalidDigit, literalName(prefix));
    }

    if ((digsep & 2) != 0 && invalidSeparator(unsigned(text)) >= 0) {
      error(ErrorKind.INVALID_SEPARATOR);
    }
    return token;
  }

  /**
   * The lower-cased radix character after a leading {@code 0}, or 0. Radix prefixes are only
   * recognized when floats are scanned.
   */
  private int radixPrefix() {
    return Mode.isSet(mode, SCAN_FLOATS) ? lower(ch) : 0;
  }

  /**
   * Consumes digits and {@code _} separators. Returns a bit set: 1 if a digit was seen, 2 if a
   * separator was seen.
   */
  private int digits(int base) throws IOException {
    int digsep = 0;
    if (base <= 10) {
      int max = '0' + base;
      while (isDecimal(ch) || ch == '_') {
        int ds = 1;
        if (ch == '_') {
          ds = 2;
        } else if (ch >= max && invalidDigit < 0) {
          invalidDigit = ch;
        }
        digsep |= ds;
        eat();
      }
    } else {
      while (isHex(ch) || ch == '_') {
        digsep |= ch == '_' ? 2 : 1;
        eat();
      }
    }
    return digsep;
  }

  private static String unsigned(CharSequence literal) {
    String s = literal.toString();
    return s.startsWith("-") ? s.substring(1) : s;
  }

  /**
   * Returns the index of the first {@code _} in {@code x} that does not separate two digits, or -1.
   */
  static int invalidSeparator(String x) {
    char x1 = ' ';
    char d = '.';
    int i = 0;

    if (x.length() >= 2 && x.charAt(0) == '0') {
      x1 = (char) lower(x.charAt(1));
      if (x1 == 'x' || x1 == 'o' || x1 == 'b') {
        d = '0';
        i = 2;
      }
    }

    // d is the previous character class: '0' digit, '_' separator, '.' anything else
    for (; i < x.length(); i++) {
      char p = d;
      d = x.charAt(i);
      if (d == '_') {
        if (p != '0') {
          return i;
        }
      } else if (isDecimal(d) || (x1 == 'x' && isHex(d))) {
        d = '0';
      } else {
        if (p == '_') {
          return i - 1;
        }
        d = '.';
      }
    }
    if (d == '_') {
      return x.length() - 1;
    }
    return -1;
  }

  private static String literalName(char prefix) {
    return switch (prefix) {
      case 'x' -> "hexadecimal literal";
      case 'o', '0' -> "octal literal";
      case 'b' -> "binary literal";
      default -> "decimal literal";
    };
  }

  private static int lower(int ch) {
    return ch >= 0 && ch < 0x80 ? Ascii.toLowerCase((char) ch) : ch;
  }

  private static boolean isDecimal(int ch) {
    return '0' <= ch && ch <= '9';
  }

  private static boolean isHex(int ch) {
    return isDecimal(ch) || ('a' <= lower(ch) && lower(ch) <= 'f');
  }

  private static int digitValue(int ch) {
    if (isDecimal(ch)) {
      return ch - '0';
    }
    int lower = lower(ch);
    if ('a' <= lower && lower <= 'f') {
      return lower - 'a' + 10;
    }
    return 16;
  }

  private void error(ErrorKind kind, Object... args) {
    errorCount++;
    log.error(pos(), kind, args);
  }
}
