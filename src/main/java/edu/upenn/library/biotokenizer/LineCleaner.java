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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes characters that carry no meaning for retrieval from a line of
 * text before it is split into raw tokens: stray symbols, trailing
 * punctuation, parentheses and brackets around whole words, quotes, the
 * possessive {@code 's} and trailing slashes.
 * <p>
 * The rules run in order over the line padded with one space on each side,
 * so that rules anchored on spaces also fire at the line's ends.
 */
public final class LineCleaner {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private static final Rule TRAILING_PUNCT = new Rule("[.:;,] ", " ", false, "");
  private static final Rule PARENS = new Rule(" \\(([^)]*)\\) ", " ", true, " ");
  private static final Rule BRACKETS = new Rule(" \\[([^)]*)\\] ", " ", true, " ");

  private static final List<Rule> RULES = Collections.unmodifiableList(Arrays.asList(
      new Rule("[!\"#$%&*<=>?@\\\\|~]", "", false, ""),
      TRAILING_PUNCT,
      PARENS,
      BRACKETS,
      // once more for one level of nesting
      PARENS,
      BRACKETS,
      new Rule("(?<= )'(?= )", "", false, ""),
      new Rule("` ", " ", false, ""),
      new Rule("'[st] ", " ", false, ""),
      // parentheses may have hidden punctuation from the first pass
      TRAILING_PUNCT,
      new Rule("/+ ", " ", false, "")));

  private LineCleaner() {
  }

  /**
   *
   * @param line one line of content, without its line terminator
   * @return the cleaned line, trimmed
   */
  public static String clean(String line) {
    String cleaned = cleanTracked(line).toString();
    int start = 0;
    int end = cleaned.length();
    while (start < end && isSpace(cleaned.charAt(start))) {
      start++;
    }
    while (end > start && isSpace(cleaned.charAt(end - 1))) {
      end--;
    }
    return cleaned.substring(start, end);
  }

  /**
   * Cleans {@code line} and splits it on whitespace.
   *
   * @return the raw tokens in order; empty for a blank line
   */
  public static List<String> tokenize(String line) {
    String cleaned = clean(line);
    if (cleaned.isEmpty()) {
      return Collections.emptyList();
    }
    return Arrays.asList(WHITESPACE.split(cleaned));
  }

  /** The characters matched by the regex class {@code \s}. */
  static boolean isSpace(char c) {
    switch (c) {
      case ' ':
      case '\t':
      case '\n':
      case '\013':
      case '\f':
      case '\r':
        return true;
      default:
        return false;
    }
  }

  /**
   * Cleans {@code line}, keeping for every output character the index in
   * {@code line} it came from. The result is not trimmed.
   */
  static TrackedText cleanTracked(CharSequence line) {
    int n = line.length();
    TrackedText text = new TrackedText(n + 2);
    text.append(' ', 0);
    for (int i = 0; i < n; i++) {
      text.append(line.charAt(i), i);
    }
    text.append(' ', n);
    for (Rule rule : RULES) {
      text = rule.apply(text);
    }
    // the padding spaces always survive: every rule that consumes a space puts one back
    return text.slice(1, text.length() - 1);
  }

  /**
   * A global regex substitution whose replacement is a literal prefix,
   * optionally the first capture group, then a literal suffix.
   */
  private static final class Rule {

    private final Pattern pattern;
    private final String prefix;
    private final boolean keepGroup;
    private final String suffix;

    Rule(String regex, String prefix, boolean keepGroup, String suffix) {
      this.pattern = Pattern.compile(regex);
      this.prefix = prefix;
      this.keepGroup = keepGroup;
      this.suffix = suffix;
    }

    TrackedText apply(TrackedText in) {
      Matcher m = pattern.matcher(in);
      if (!m.find()) {
        return in;
      }
      TrackedText out = new TrackedText(in.length());
      int last = 0;
      do {
        out.appendRange(in, last, m.start());
        for (int i = 0; i < prefix.length(); i++) {
          out.append(prefix.charAt(i), in.origin(m.start()));
        }
        if (keepGroup) {
          out.appendRange(in, m.start(1), m.end(1));
        }
        for (int i = 0; i < suffix.length(); i++) {
          out.append(suffix.charAt(i), in.origin(m.end() - 1));
        }
        last = m.end();
      } while (m.find());
      out.appendRange(in, last, in.length());
      return out;
    }
  }

  /**
   * Character buffer that remembers, for each character, its offset in the
   * original line.
   */
  static final class TrackedText implements CharSequence {

    private char[] chars;
    private int[] origins;
    private int length;

    TrackedText(int capacity) {
      chars = new char[Math.max(capacity, 16)];
      origins = new int[chars.length];
    }

    void append(char c, int origin) {
      if (length == chars.length) {
        chars = Arrays.copyOf(chars, length * 2);
        origins = Arrays.copyOf(origins, length * 2);
      }
      chars[length] = c;
      origins[length++] = origin;
    }

    void appendRange(TrackedText other, int start, int end) {
      for (int i = start; i < end; i++) {
        append(other.chars[i], other.origins[i]);
      }
    }

    TrackedText slice(int start, int end) {
      TrackedText t = new TrackedText(end - start);
      t.appendRange(this, start, end);
      return t;
    }

    int origin(int index) {
      if (index >= length) {
        throw new IndexOutOfBoundsException("index " + index + ", length " + length);
      }
      return origins[index];
    }

    @Override
    public int length() {
      return length;
    }

    @Override
    public char charAt(int index) {
      if (index >= length) {
        throw new IndexOutOfBoundsException("index " + index + ", length " + length);
      }
      return chars[index];
    }

    @Override
    public CharSequence subSequence(int start, int end) {
      return new String(chars, start, end - start);
    }

    @Override
    public String toString() {
      return new String(chars, 0, length);
    }
  }

}
