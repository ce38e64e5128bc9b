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
 * How sub-tokens are put back together once break points have been
 * removed. Only {@link #SPACE} stems each sub-token on its own; the other
 * modes stem the joined token as a whole.
 */
public enum RecombineMode {

  HYPHEN("h", "-"),
  SPACE("s", " "),
  /** Also selected by the reserved "j" normalization code. */
  CONCAT("j", "");

  private final String code;
  private final String separator;

  private RecombineMode(String code, String separator) {
    this.code = code;
    this.separator = separator;
  }

  public String code() {
    return code;
  }

  public String separator() {
    return separator;
  }

  public boolean stemsSubTokens() {
    return this == SPACE;
  }

  public static RecombineMode forCode(String code) {
    for (RecombineMode m : values()) {
      if (m.code.equals(code)) {
        return m;
      }
    }
    throw new IllegalArgumentException("The normalization method must be 'h', 's' or 'j', got: " + code);
  }

}
