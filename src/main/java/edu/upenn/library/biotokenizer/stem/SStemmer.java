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

/**
 * Harman's S stemmer: strips English plural endings only. There is no
 * minimum word length.
 */
public final class SStemmer implements Stemmer {

  public static final SStemmer INSTANCE = new SStemmer();

  private SStemmer() {
  }

  @Override
  public String stem(String word) {
    int n = word.length();
    if (word.endsWith("ies")) {
      if (n == 3) {
        return "y";
      } else if ("ae".indexOf(word.charAt(n - 4)) < 0) {
        return word.substring(0, n - 3).concat("y");
      }
    } else if (word.endsWith("es")) {
      if (n == 2) {
        return "e";
      } else if ("aeo".indexOf(word.charAt(n - 3)) < 0) {
        return word.substring(0, n - 1);
      }
    } else if (word.endsWith("s")) {
      if (n > 1 && "us".indexOf(word.charAt(n - 2)) < 0) {
        return word.substring(0, n - 1);
      }
    }
    return word;
  }

}
