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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Replaces spelled-out Greek letter names with their short codes, so that
 * "tnfalpha" and "tnf-alpha" can meet "tnfa" once break points are
 * normalized. Only a complete run of lowercase ASCII letters is looked up:
 * in "alpha2" the run "alpha" becomes "a", while "alphabeta" is left alone.
 */
public final class GreekNormalizer {

  private static final Map<String, String> LETTERS;

  static {
    Map<String, String> m = new HashMap<>();
    m.put("alpha", "a");
    m.put("beta", "b");
    m.put("gamma", "g");
    m.put("delta", "d");
    m.put("epsilon", "e");
    m.put("zeta", "z");
    m.put("eta", "e");
    m.put("theta", "th");
    m.put("iota", "i");
    m.put("kappa", "k");
    m.put("lambda", "l");
    m.put("mu", "m");
    m.put("nu", "n");
    m.put("xi", "x");
    m.put("omicron", "o");
    m.put("pi", "p");
    m.put("rho", "r");
    m.put("sigma", "s");
    m.put("tau", "t");
    m.put("upsilon", "u");
    m.put("phi", "ph");
    m.put("chi", "ch");
    m.put("psi", "ps");
    m.put("omega", "o");
    LETTERS = Collections.unmodifiableMap(m);
  }

  private GreekNormalizer() {
  }

  /**
   *
   * @param letterName a candidate letter name
   * @return the short code, or null if the input is not a Greek letter name
   */
  public static String codeFor(String letterName) {
    return LETTERS.get(letterName);
  }

  public static String normalize(String subToken) {
    StringBuilder sb = null;
    int n = subToken.length();
    int i = 0;
    while (i < n) {
      if (!isLowerAscii(subToken.charAt(i))) {
        if (sb != null) {
          sb.append(subToken.charAt(i));
        }
        i++;
        continue;
      }
      int start = i;
      while (i < n && isLowerAscii(subToken.charAt(i))) {
        i++;
      }
      String code = LETTERS.get(subToken.substring(start, i));
      if (code != null) {
        if (sb == null) {
          sb = new StringBuilder(n);
          sb.append(subToken, 0, start);
        }
        sb.append(code);
      } else if (sb != null) {
        sb.append(subToken, start, i);
      }
    }
    return sb == null ? subToken : sb.toString();
  }

  private static boolean isLowerAscii(char c) {
    return c >= 'a' && c <= 'z';
  }

}
