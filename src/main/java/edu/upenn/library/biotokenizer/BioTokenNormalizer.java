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

import edu.upenn.library.biotokenizer.stem.Stemmer;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw tokens into index terms under one {@link TokenizerConfig}:
 * split at break points, lowercase, normalize Greek letter names, then
 * recombine and stem.
 * <p>
 * Instances hold no mutable state and can be shared.
 */
public final class BioTokenNormalizer {

  private final TokenizerConfig config;
  private final Stemmer stemmer;

  public BioTokenNormalizer(TokenizerConfig config) {
    this.config = config;
    this.stemmer = config.getStemmerType().stemmer();
  }

  public TokenizerConfig getConfig() {
    return config;
  }

  /**
   * Cleans a line of content and normalizes each of its tokens. A token
   * that normalizes to nothing keeps its slot as an empty field, so the
   * output has as many fields as the cleaned line has tokens.
   *
   * @return the normalized tokens separated by single spaces
   */
  public String normalizeLine(String line) {
    List<String> tokens = LineCleaner.tokenize(line);
    List<String> normalized = new ArrayList<>(tokens.size());
    for (String token : tokens) {
      normalized.add(normalizeToken(token));
    }
    return String.join(" ", normalized);
  }

  public String normalizeToken(String rawToken) {
    return recombine(subTokens(rawToken));
  }

  /**
   * Splits a raw token at the configured break points and lowercases the
   * pieces, normalizing Greek letter names if configured.
   */
  public List<String> subTokens(String rawToken) {
    List<String> split = config.getBreakPoints().split(rawToken);
    List<String> out = new ArrayList<>(split.size());
    for (String s : split) {
      String lower = toLowerAscii(s);
      out.add(config.isGreekNormalize() ? GreekNormalizer.normalize(lower) : lower);
    }
    return out;
  }

  /**
   * Joins sub-tokens into the final token text.
   * <ul>
   * <li>no break points: the first sub-token, stemmed;</li>
   * <li>hyphen or concatenation: joined, then stemmed as a whole;</li>
   * <li>space: each sub-token stemmed, then joined.</li>
   * </ul>
   */
  public String recombine(List<String> subTokens) {
    String token;
    if (config.getBreakPoints() == BreakPointPolicy.NONE) {
      token = subTokens.isEmpty() ? "" : subTokens.get(0);
    } else {
      RecombineMode mode = config.getRecombineMode();
      if (mode.stemsSubTokens()) {
        List<String> stemmed = new ArrayList<>(subTokens.size());
        for (String s : subTokens) {
          stemmed.add(stemmer.stem(s));
        }
        return String.join(mode.separator(), stemmed);
      }
      token = String.join(mode.separator(), subTokens);
    }
    return stemmer.stem(token);
  }

  static String toLowerAscii(String s) {
    char[] chars = null;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c >= 'A' && c <= 'Z') {
        if (chars == null) {
          chars = s.toCharArray();
        }
        chars[i] = (char) (c + ('a' - 'A'));
      }
    }
    return chars == null ? s : new String(chars);
  }

}
