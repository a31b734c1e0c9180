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

/**
 * Decides whether a rune belongs to an identifier.
 *
 * <p>Called with the index of the rune within the identifier: {@code 0} for the first rune, then
 * {@code 1, 2, ...}. The scanner never calls it with {@link RuneReader#EOF}.
 */
@FunctionalInterface
public interface IdentRunePredicate {

  boolean test(int ch, int index);

  /**
   * Lisp identifiers: letters and {@code _ $ * + / ? ! < > =} anywhere, plus {@code -} and
   * decimal digits after the first rune.
   */
  IdentRunePredicate LISP =
      (ch, index) -> {
        switch (ch) {
          case '_', '$', '*', '+', '/', '?', '!', '<', '>', '=' -> {
            return true;
          }
          case '-' -> {
            return index > 0;
          }
          default -> {
            return Character.isAlphabetic(ch) || (index > 0 && Character.isDigit(ch));
          }
        }
      };
}
