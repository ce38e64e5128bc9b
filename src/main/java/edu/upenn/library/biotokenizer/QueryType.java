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

/**
 * Preset strategies by query type. Symbolic queries (gene and protein
 * symbols only) join sub-tokens and normalize Greek letters; verbose
 * queries (full names mixed with English) split on break points and stem
 * each part.
 */
public enum QueryType {

  SYMBOLIC("S"),
  VERBOSE("V");

  private final String code;

  private QueryType(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public TokenizerConfig config() {
    return this == SYMBOLIC ? TokenizerConfig.SYMBOLIC : TokenizerConfig.VERBOSE;
  }

  public static QueryType forCode(String code) {
    for (QueryType t : values()) {
      if (t.code.equals(code)) {
        return t;
      }
    }
    throw new IllegalArgumentException("The query type must be S(Symbolic) or V(Verbose), got: " + code);
  }

}
