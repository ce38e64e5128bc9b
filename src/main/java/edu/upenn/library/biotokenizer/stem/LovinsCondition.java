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
 * Context conditions attached to Lovins endings. An ending may only be
 * removed when its condition accepts the stem that would remain.
 */
enum LovinsCondition {

  A {
    @Override
    boolean accepts(String stem) {
      return true;
    }
  },
  B {
    @Override
    boolean accepts(String stem) {
      return stem.length() >= 3;
    }
  },
  C {
    @Override
    boolean accepts(String stem) {
      return stem.length() >= 4;
    }
  },
  D {
    @Override
    boolean accepts(String stem) {
      return stem.length() >= 5;
    }
  },
  E {
    @Override
    boolean accepts(String stem) {
      return !endsWithAny(stem, "e");
    }
  },
  F {
    @Override
    boolean accepts(String stem) {
      return stem.length() >= 3 && !endsWithAny(stem, "e");
    }
  },
  G {
    @Override
    boolean accepts(String stem) {
      return stem.length() >= 3 && endsWithAny(stem, "f");
    }
  },
  H {
    @Override
    boolean accepts(String stem) {
      return endsWithAny(stem, "t", "ll");
    }
  },
  I {
    @Override
    boolean accepts(String stem) {
      return !endsWithAny(stem, "o", "e");
    }
  },
  J {
    @Override
    boolean accepts(String stem) {
      return !endsWithAny(stem, "a", "e");
    }
  },
  K {
    @Override
    boolean accepts(String stem) {
      return stem.length() >= 3 && X.accepts(stem);
    }
  },
  L {
    @Override
    boolean accepts(String stem) {
      return !endsWithAny(stem, "u", "x") && !endsWithUnless(stem, 's', 'o');
    }
  },
  M {
    @Override
    boolean accepts(String stem) {
      return !endsWithAny(stem, "a", "c", "e", "m");
    }
  },
  /** Not after a lone {@code s} two places from the end. */
  N {
    @Override
    boolean accepts(String stem) {
      int n = stem.length();
      return n >= 3 && (stem.charAt(n - 3) != 's' || n >= 4);
    }
  },
  O {
    @Override
    boolean accepts(String stem) {
      return endsWithAny(stem, "l", "i");
    }
  },
  P {
    @Override
    boolean accepts(String stem) {
      return !endsWithAny(stem, "c");
    }
  },
  Q {
    @Override
    boolean accepts(String stem) {
      return stem.length() >= 3 && !endsWithAny(stem, "l", "n");
    }
  },
  R {
    @Override
    boolean accepts(String stem) {
      return endsWithAny(stem, "n", "r");
    }
  },
  S {
    @Override
    boolean accepts(String stem) {
      return endsWithAny(stem, "dr") || endsWithUnless(stem, 't', 't');
    }
  },
  T {
    @Override
    boolean accepts(String stem) {
      return endsWithAny(stem, "s") || endsWithUnless(stem, 't', 'o');
    }
  },
  U {
    @Override
    boolean accepts(String stem) {
      return endsWithAny(stem, "l", "m", "n", "r");
    }
  },
  V {
    @Override
    boolean accepts(String stem) {
      return endsWithAny(stem, "c");
    }
  },
  W {
    @Override
    boolean accepts(String stem) {
      return !endsWithAny(stem, "s", "u");
    }
  },
  X {
    @Override
    boolean accepts(String stem) {
      int n = stem.length();
      return endsWithAny(stem, "l", "i") || (n >= 3 && stem.charAt(n - 3) == 'u' && stem.charAt(n - 1) == 'e');
    }
  },
  Y {
    @Override
    boolean accepts(String stem) {
      return endsWithAny(stem, "in");
    }
  },
  Z {
    @Override
    boolean accepts(String stem) {
      return !endsWithAny(stem, "f");
    }
  },
  AA {
    @Override
    boolean accepts(String stem) {
      return endsWithAny(stem, "d", "f", "ph", "th", "l", "er", "or", "es", "t");
    }
  },
  BB {
    @Override
    boolean accepts(String stem) {
      return stem.length() >= 3 && !endsWithAny(stem, "met", "ryst");
    }
  },
  CC {
    @Override
    boolean accepts(String stem) {
      return endsWithAny(stem, "l");
    }
  };

  abstract boolean accepts(String stem);

  private static boolean endsWithAny(String stem, String... endings) {
    for (String e : endings) {
      if (stem.endsWith(e)) {
        return true;
      }
    }
    return false;
  }

  /**
   * True when the stem ends in {@code last} and the character before it
   * exists and is not {@code notBefore}.
   */
  private static boolean endsWithUnless(String stem, char last, char notBefore) {
    int n = stem.length();
    return n >= 2 && stem.charAt(n - 1) == last && stem.charAt(n - 2) != notBefore;
  }

}
