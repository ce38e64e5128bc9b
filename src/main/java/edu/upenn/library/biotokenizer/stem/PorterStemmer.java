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
package edu.upenn.library.biotokenizer.stem;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The Porter suffix-stripping algorithm, in the variant whose consonant
 * sequences are {@code [^aeiou][^aeiouy]*} and whose vowel sequences are
 * {@code [aeiouy][aeiou]*}.
 * <p>
 * A word-initial {@code y} is never a vowel. Rather than rewriting it, the
 * stemmer carries a flag through the measure predicates and leaves the
 * word's characters untouched. Words shorter than three characters are
 * returned unchanged.
 */
public final class PorterStemmer implements Stemmer {

  public static final PorterStemmer INSTANCE = new PorterStemmer();

  private static final int MIN_LENGTH = 3;

  private static final Map<String, String> STEP2;
  private static final Map<String, String> STEP3;
  private static final List<String> STEP4 = Arrays.asList("al", "ance", "ence", "er", "ic", "able", "ible",
      "ant", "ement", "ment", "ent", "ou", "ism", "ate", "iti", "ous", "ive", "ize");

  static {
    Map<String, String> m = new LinkedHashMap<>();
    m.put("ational", "ate");
    m.put("tional", "tion");
    m.put("enci", "ence");
    m.put("anci", "ance");
    m.put("izer", "ize");
    m.put("bli", "ble");
    m.put("alli", "al");
    m.put("entli", "ent");
    m.put("eli", "e");
    m.put("ousli", "ous");
    m.put("ization", "ize");
    m.put("ation", "ate");
    m.put("ator", "ate");
    m.put("alism", "al");
    m.put("iveness", "ive");
    m.put("fulness", "ful");
    m.put("ousness", "ous");
    m.put("aliti", "al");
    m.put("iviti", "ive");
    m.put("biliti", "ble");
    m.put("logi", "log");
    STEP2 = Collections.unmodifiableMap(m);

    m = new LinkedHashMap<>();
    m.put("icate", "ic");
    m.put("ative", "");
    m.put("alize", "al");
    m.put("iciti", "ic");
    m.put("ical", "ic");
    m.put("ful", "");
    m.put("ness", "");
    STEP3 = Collections.unmodifiableMap(m);
  }

  private PorterStemmer() {
  }

  @Override
  public String stem(String word) {
    if (word.length() < MIN_LENGTH) {
      return word;
    }
    final boolean y = word.charAt(0) == 'y';
    String w = word;
    String stem;

    // step 1a
    if (w.endsWith("sses") || w.endsWith("ies")) {
      w = cut(w, 2);
    } else if (w.endsWith("s") && w.length() > 1 && w.charAt(w.length() - 2) != 's') {
      w = cut(w, 1);
    }

    // step 1b
    if (w.endsWith("eed")) {
      if (measure(cut(w, 3), y) > 0) {
        w = cut(w, 1);
      }
    } else if (w.endsWith("ed") || w.endsWith("ing")) {
      stem = cut(w, w.endsWith("ed") ? 2 : 3);
      if (containsVowel(stem, y)) {
        w = stem;
        if (w.endsWith("at") || w.endsWith("bl") || w.endsWith("iz")) {
          w = w.concat("e");
        } else if (endsWithDoubleConsonant(w)) {
          w = cut(w, 1);
        } else if (isShortSyllable(w, y)) {
          w = w.concat("e");
        }
      }
    }

    // step 1c
    if (w.endsWith("y")) {
      stem = cut(w, 1);
      if (containsVowel(stem, y)) {
        w = stem.concat("i");
      }
    }

    w = replaceSuffix(w, STEP2, y);
    w = replaceSuffix(w, STEP3, y);

    // step 4
    String suffix = longestSuffix(w, STEP4);
    if (suffix != null) {
      stem = cut(w, suffix.length());
      if (measure(stem, y) > 1) {
        w = stem;
      }
    } else if (w.endsWith("sion") || w.endsWith("tion")) {
      stem = cut(w, 3);
      if (measure(stem, y) > 1) {
        w = stem;
      }
    }

    // step 5
    if (w.endsWith("e")) {
      stem = cut(w, 1);
      int m = measure(stem, y);
      if (m > 1 || (m == 1 && !isShortSyllable(stem, y))) {
        w = stem;
      }
    }
    if (w.endsWith("ll") && measure(w, y) > 1) {
      w = cut(w, 1);
    }
    return w;
  }

  private static String replaceSuffix(String w, Map<String, String> table, boolean y) {
    String suffix = longestSuffix(w, table.keySet());
    if (suffix != null) {
      String stem = cut(w, suffix.length());
      if (measure(stem, y) > 0) {
        return stem.concat(table.get(suffix));
      }
    }
    return w;
  }

  private static String longestSuffix(String w, Iterable<String> suffixes) {
    String longest = null;
    for (String s : suffixes) {
      if (w.endsWith(s) && (longest == null || s.length() > longest.length())) {
        longest = s;
      }
    }
    return longest;
  }

  private static String cut(String w, int n) {
    return w.substring(0, w.length() - n);
  }

  /**
   * Opens a consonant sequence: any character outside {@code aeiou}, which
   * includes a flagged leading {@code y}.
   */
  private static boolean opensConsonants(CharSequence s, int i, boolean leadingY) {
    return (i == 0 && leadingY) || "aeiou".indexOf(s.charAt(i)) < 0;
  }

  private static int skipConsonants(CharSequence s, int i) {
    while (i < s.length() && "aeiouy".indexOf(s.charAt(i)) < 0) {
      i++;
    }
    return i;
  }

  private static int skipVowels(CharSequence s, int i) {
    while (i < s.length() && "aeiou".indexOf(s.charAt(i)) >= 0) {
      i++;
    }
    return i;
  }

  /**
   * The number of vowel-sequence/consonant-sequence pairs in
   * {@code [C](VC)^m[V]}.
   */
  static int measure(CharSequence s, boolean leadingY) {
    int n = s.length();
    int i = 0;
    if (n > 0 && opensConsonants(s, 0, leadingY)) {
      i = skipConsonants(s, 1);
    }
    int m = 0;
    while (i < n) {
      i = skipVowels(s, i + 1);
      if (i >= n) {
        break;
      }
      i = skipConsonants(s, i + 1);
      m++;
    }
    return m;
  }

  static boolean containsVowel(CharSequence s, boolean leadingY) {
    int n = s.length();
    if (n == 0) {
      return false;
    } else if (!opensConsonants(s, 0, leadingY)) {
      return true;
    } else {
      return skipConsonants(s, 1) < n;
    }
  }

  /**
   * True for a whole word of the form consonant-sequence, single vowel,
   * final consonant other than {@code w}, {@code x} or {@code y}.
   */
  static boolean isShortSyllable(CharSequence s, boolean leadingY) {
    int n = s.length();
    if (n < 3 || !opensConsonants(s, 0, leadingY)) {
      return false;
    }
    for (int i = 1; i < n - 2; i++) {
      if ("aeiouy".indexOf(s.charAt(i)) >= 0) {
        return false;
      }
    }
    return "aeiouy".indexOf(s.charAt(n - 2)) >= 0 && "aeiouwxy".indexOf(s.charAt(n - 1)) < 0;
  }

  private static boolean endsWithDoubleConsonant(CharSequence s) {
    int n = s.length();
    if (n < 2) {
      return false;
    }
    char last = s.charAt(n - 1);
    return last == s.charAt(n - 2) && "aeiouylsz".indexOf(last) < 0;
  }

}
