/*
 * Copyright 2016 The Trustees of the University of Pennsylvania
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0

 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package edu.upenn.library.biotokenizer;

import java.util.ArrayList;
import java.util.List;

/**
 * The sets of break points at which a raw token is split into sub-tokens.
 * Characters that are not part of any sub-token are dropped.
 */
public enum BreakPointPolicy {

  /** No break points; the token is its only sub-token. */
  NONE("0") {
    @Override
    void split(String token, List<String> out) {
      out.add(token);
    }
  },
  /** Break at runs of {@code ( ) [ ] - _ /}. */
  DELIMITER("1") {
    @Override
    void split(String token, List<String> out) {
      int n = token.length();
      int i = 0;
      while (i < n) {
        while (i < n && isDelimiter(token.charAt(i))) {
          i++;
        }
        int start = i;
        while (i < n && !isDelimiter(token.charAt(i))) {
          i++;
        }
        if (i > start) {
          out.add(token.substring(start, i));
        }
      }
    }
  },
  /** Keep only runs of ASCII letters and digits. */
  ALNUM("2") {
    @Override
    void split(String token, List<String> out) {
      int n = token.length();
      int i = 0;
      while (i < n) {
        while (i < n && !isAlnum(token.charAt(i))) {
          i++;
        }
        int start = i;
        while (i < n && isAlnum(token.charAt(i))) {
          i++;
        }
        if (i > start) {
          out.add(token.substring(start, i));
        }
      }
    }
  },
  /**
   * Break wherever the character class changes: a capitalized word, an
   * uppercase run, a lowercase run or a digit run, tried in that order at
   * each position. "TNF-alpha2" gives TNF, alpha, 2.
   */
  WORD_CLASS("3") {
    @Override
    void split(String token, List<String> out) {
      int n = token.length();
      int i = 0;
      while (i < n) {
        char c = token.charAt(i);
        int start = i;
        if (isUpper(c)) {
          if (i + 1 < n && isLower(token.charAt(i + 1))) {
            i = skipLower(token, i + 1);
          } else {
            while (i < n && isUpper(token.charAt(i))) {
              i++;
            }
          }
        } else if (isLower(c)) {
          i = skipLower(token, i);
        } else if (isDigit(c)) {
          while (i < n && isDigit(token.charAt(i))) {
            i++;
          }
        } else {
          i++;
          continue;
        }
        out.add(token.substring(start, i));
      }
    }
  };

  private final String code;

  private BreakPointPolicy(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  abstract void split(String token, List<String> out);

  /**
   *
   * @param token a raw, whitespace-free token
   * @return the sub-tokens in order; empty only if nothing survives the split
   */
  public List<String> split(String token) {
    List<String> out = new ArrayList<>();
    split(token, out);
    return out;
  }

  /**
   *
   * @param code "0", "1", "2" or "3"
   * @return the matching policy
   * @throws IllegalArgumentException for any other code
   */
  public static BreakPointPolicy forCode(String code) {
    for (BreakPointPolicy p : values()) {
      if (p.code.equals(code)) {
        return p;
      }
    }
    throw new IllegalArgumentException("The break point set must be 0, 1, 2 or 3, got: " + code);
  }

  static boolean isDelimiter(char c) {
    switch (c) {
      case '(':
      case ')':
      case '[':
      case ']':
      case '-':
      case '_':
      case '/':
        return true;
      default:
        return false;
    }
  }

  private static int skipLower(String token, int i) {
    while (i < token.length() && isLower(token.charAt(i))) {
      i++;
    }
    return i;
  }

  private static boolean isUpper(char c) {
    return c >= 'A' && c <= 'Z';
  }

  private static boolean isLower(char c) {
    return c >= 'a' && c <= 'z';
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isAlnum(char c) {
    return isUpper(c) || isLower(c) || isDigit(c);
  }

}
