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

import java.util.Locale;

/**
 * The selectable stemming algorithms, keyed by the single-letter codes used
 * in analysis configuration.
 */
public enum StemmerType {

  NONE(null) {
    @Override
    public Stemmer stemmer() {
      return IDENTITY;
    }
  },
  PORTER("p") {
    @Override
    public Stemmer stemmer() {
      return PorterStemmer.INSTANCE;
    }
  },
  LOVINS("l") {
    @Override
    public Stemmer stemmer() {
      return LovinsStemmer.INSTANCE;
    }
  },
  S_STEMMER("s") {
    @Override
    public Stemmer stemmer() {
      return SStemmer.INSTANCE;
    }
  };

  private static final Stemmer IDENTITY = word -> word;

  private final String code;

  private StemmerType(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public abstract Stemmer stemmer();

  /**
   *
   * @param code one of "p", "l" or "s"
   * @return the matching type
   * @throws IllegalArgumentException for any other code
   */
  public static StemmerType forCode(String code) {
    for (StemmerType t : values()) {
      if (t.code != null && t.code.equals(code)) {
        return t;
      }
    }
    throw new IllegalArgumentException("The stemming method must be 'p', 'l' or 's', got: " + code);
  }

  @Override
  public String toString() {
    return name().toLowerCase(Locale.ROOT);
  }

}
