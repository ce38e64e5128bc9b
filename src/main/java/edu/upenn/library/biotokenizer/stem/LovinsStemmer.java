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

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lovins' longest-match stemmer.
 * <p>
 * Phase one removes the longest ending from the ending table whose
 * condition accepts the remaining stem; at least two characters are always
 * kept. Phase two respells the end of the result (e.g. {@code -istr} to
 * {@code -ister}) using the first rule, for the word's final character,
 * that matches. The ending table is read once from
 * {@code lovins-endings.json}, which maps each ending to its condition code.
 */
public final class LovinsStemmer implements Stemmer {

  private static final Logger log = LoggerFactory.getLogger(LovinsStemmer.class);

  static final String ENDINGS_RESOURCE = "lovins-endings.json";
  private static final int MAX_ENDING_LENGTH = 11;
  private static final int MIN_STEM_LENGTH = 2;

  private static final JsonFactory jsonFactory = new JsonFactory();
  private static final Map<String, LovinsCondition> ENDINGS = loadEndings();
  private static final Map<Character, List<Respelling>> RESPELLINGS = buildRespellings();

  public static final LovinsStemmer INSTANCE = new LovinsStemmer();

  private LovinsStemmer() {
  }

  @Override
  public String stem(String word) {
    int length = word.length();
    if (length <= MIN_STEM_LENGTH) {
      return word;
    }
    String stemmed = word;
    int start = Math.max(MIN_STEM_LENGTH, length - MAX_ENDING_LENGTH);
    for (int i = start; i < length; i++) {
      LovinsCondition condition = ENDINGS.get(word.substring(i));
      if (condition != null) {
        String stem = word.substring(0, i);
        if (condition.accepts(stem)) {
          stemmed = stem;
          break;
        }
      }
    }
    return respell(stemmed);
  }

  static String respell(String word) {
    List<Respelling> rules = RESPELLINGS.get(word.charAt(word.length() - 1));
    if (rules != null) {
      for (Respelling r : rules) {
        if (r.matches(word)) {
          return r.apply(word);
        }
      }
    }
    return word;
  }

  static int endingCount() {
    return ENDINGS.size();
  }

  static LovinsCondition conditionFor(String ending) {
    return ENDINGS.get(ending);
  }

  private static Map<String, LovinsCondition> loadEndings() {
    Map<String, LovinsCondition> endings = new HashMap<>();
    try (InputStream in = LovinsStemmer.class.getResourceAsStream(ENDINGS_RESOURCE)) {
      if (in == null) {
        throw new IOException("resource not found: " + ENDINGS_RESOURCE);
      }
      try (JsonParser parser = jsonFactory.createParser(in)) {
        if (parser.nextToken() != JsonToken.START_OBJECT) {
          throw new IOException("Expected endings to start with a START_OBJECT token, but found this instead: " + parser.getCurrentToken());
        }
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
          String ending = parser.getCurrentName();
          if (parser.nextToken() != JsonToken.VALUE_STRING) {
            throw new IOException("Expected a condition code for ending \"" + ending + "\", but got " + parser.getCurrentToken());
          }
          if (ending.isEmpty() || ending.length() > MAX_ENDING_LENGTH) {
            throw new IOException("Ending length out of range: \"" + ending + "\"");
          }
          endings.put(ending, LovinsCondition.valueOf(parser.getText()));
        }
      }
    } catch (IOException | IllegalArgumentException ex) {
      throw new IllegalStateException("could not load Lovins endings from " + ENDINGS_RESOURCE, ex);
    }
    log.debug("loaded {} Lovins endings", endings.size());
    return Collections.unmodifiableMap(endings);
  }

  private static Map<Character, List<Respelling>> buildRespellings() {
    Map<Character, List<Respelling>> rules = new HashMap<>();
    add(rules, "tt", "t");
    add(rules, "uct", "uc");
    add(rules, "umpt", "um");
    add(rules, "rpt", "rb");
    add(rules, "mit", "mis");
    add(rules, "ert", "ers");
    addWholeWord(rules, "et", "es");
    addNotAfter(rules, "n", "et", "es");
    add(rules, "yt", "ys");

    add(rules, "rr", "r");
    add(rules, "istr", "ister");
    add(rules, "metr", "meter");
    addWholeWord(rules, "her", "hes");
    addNotAfter(rules, "pt", "her", "hes");

    add(rules, "dd", "d");
    add(rules, "uad", "uas");
    add(rules, "vad", "vas");
    add(rules, "cid", "cis");
    add(rules, "lid", "lis");
    add(rules, "erid", "eris");
    add(rules, "pand", "pans");
    addWholeWord(rules, "end", "ens");
    addNotAfter(rules, "sm", "end", "ens");
    add(rules, "ond", "ons");
    add(rules, "lud", "lus");
    add(rules, "rud", "rus");

    add(rules, "nn", "n");

    add(rules, "ll", "l");
    addNotAfter(rules, "aio", "ul", "l");

    add(rules, "mm", "m");

    add(rules, "ss", "s");
    add(rules, "urs", "ur");

    add(rules, "gg", "g");

    add(rules, "iev", "ief");
    add(rules, "olv", "olut");

    add(rules, "pp", "p");

    add(rules, "bb", "b");

    add(rules, "bex", "bic");
    add(rules, "dex", "dic");
    add(rules, "pex", "pic");
    add(rules, "tex", "tic");
    add(rules, "ax", "ac");
    add(rules, "ex", "ec");
    add(rules, "ix", "ic");
    add(rules, "lux", "luc");

    add(rules, "yz", "ys");
    return Collections.unmodifiableMap(rules);
  }

  private static void add(Map<Character, List<Respelling>> rules, String ending, String replacement) {
    put(rules, new Respelling(ending, replacement, null, false));
  }

  private static void addWholeWord(Map<Character, List<Respelling>> rules, String word, String replacement) {
    put(rules, new Respelling(word, replacement, null, true));
  }

  private static void addNotAfter(Map<Character, List<Respelling>> rules, String notAfter, String ending, String replacement) {
    put(rules, new Respelling(ending, replacement, notAfter, false));
  }

  private static void put(Map<Character, List<Respelling>> rules, Respelling r) {
    rules.computeIfAbsent(r.ending.charAt(r.ending.length() - 1), k -> new ArrayList<>()).add(r);
  }

  /**
   * Rewrites a word ending. With {@code notAfter} set, the ending must be
   * preceded by a character outside that set; with {@code wholeWord} set,
   * the ending must be the entire word.
   */
  private static final class Respelling {

    private final String ending;
    private final String replacement;
    private final String notAfter;
    private final boolean wholeWord;

    Respelling(String ending, String replacement, String notAfter, boolean wholeWord) {
      this.ending = ending;
      this.replacement = replacement;
      this.notAfter = notAfter;
      this.wholeWord = wholeWord;
    }

    boolean matches(String word) {
      if (wholeWord) {
        return word.equals(ending);
      } else if (!word.endsWith(ending)) {
        return false;
      } else if (notAfter == null) {
        return true;
      } else {
        int before = word.length() - ending.length() - 1;
        return before >= 0 && notAfter.indexOf(word.charAt(before)) < 0;
      }
    }

    String apply(String word) {
      return word.substring(0, word.length() - ending.length()).concat(replacement);
    }
  }

}
