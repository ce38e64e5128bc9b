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

import edu.upenn.library.biotokenizer.stem.StemmerType;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable choice of tokenization strategies: break points, how the
 * pieces are recombined, Greek letter normalization, and stemmer.
 * <p>
 * With {@link BreakPointPolicy#NONE} the recombination mode is ignored and
 * may be null.
 */
public final class TokenizerConfig {

  private static final Logger log = LoggerFactory.getLogger(TokenizerConfig.class);

  public static final String QUERY_TYPE_ARGNAME = "queryType";
  public static final String BREAK_POINT_ARGNAME = "breakPoint";
  public static final String NORMALIZATION_ARGNAME = "normalization";
  public static final String GREEK_ARGNAME = "greek";
  public static final String STEMMER_ARGNAME = "stemmer";

  public static final TokenizerConfig DEFAULT = new TokenizerConfig(BreakPointPolicy.DELIMITER, RecombineMode.SPACE, false, StemmerType.PORTER);
  public static final TokenizerConfig VERBOSE = DEFAULT;
  public static final TokenizerConfig SYMBOLIC = new TokenizerConfig(BreakPointPolicy.DELIMITER, RecombineMode.CONCAT, true, StemmerType.NONE);

  private final BreakPointPolicy breakPoints;
  private final RecombineMode recombineMode;
  private final boolean greekNormalize;
  private final StemmerType stemmerType;

  public TokenizerConfig(BreakPointPolicy breakPoints, RecombineMode recombineMode, boolean greekNormalize, StemmerType stemmerType) {
    this.breakPoints = Objects.requireNonNull(breakPoints, "breakPoints");
    if (recombineMode == null && breakPoints != BreakPointPolicy.NONE) {
      throw new IllegalArgumentException("a recombination mode is required with break points " + breakPoints);
    }
    this.recombineMode = recombineMode;
    this.greekNormalize = greekNormalize;
    this.stemmerType = stemmerType == null ? StemmerType.NONE : stemmerType;
  }

  public BreakPointPolicy getBreakPoints() {
    return breakPoints;
  }

  public RecombineMode getRecombineMode() {
    return recombineMode;
  }

  public boolean isGreekNormalize() {
    return greekNormalize;
  }

  public StemmerType getStemmerType() {
    return stemmerType;
  }

  /**
   * Builds a configuration from analysis factory arguments, removing the
   * arguments it understands from {@code args}.
   * <ul>
   * <li>{@code queryType}: S or V selects a preset; all other arguments
   * are then ignored.</li>
   * <li>{@code breakPoint}: 0, 1, 2 or 3. 0 turns everything else off.
   * Otherwise {@code normalization} (h, s or j) is required and
   * {@code greek} (boolean) and {@code stemmer} (p, l or s) are
   * optional.</li>
   * <li>neither: {@link #DEFAULT}.</li>
   * </ul>
   *
   * @throws IllegalArgumentException on an unknown value or a missing
   * {@code normalization}
   */
  public static TokenizerConfig parse(Map<String, String> args) {
    String queryType = args.remove(QUERY_TYPE_ARGNAME);
    String breakPoint = args.remove(BREAK_POINT_ARGNAME);
    String normalization = args.remove(NORMALIZATION_ARGNAME);
    String greek = args.remove(GREEK_ARGNAME);
    String stemmer = args.remove(STEMMER_ARGNAME);
    if (queryType != null) {
      if (breakPoint != null || normalization != null || greek != null || stemmer != null) {
        log.warn("{} is set; ignoring the other tokenization arguments", QUERY_TYPE_ARGNAME);
      }
      return QueryType.forCode(queryType.trim()).config();
    } else if (breakPoint == null) {
      if (normalization != null || greek != null || stemmer != null) {
        log.warn("{} is not set; ignoring the other tokenization arguments", BREAK_POINT_ARGNAME);
      }
      return DEFAULT;
    }
    BreakPointPolicy policy = BreakPointPolicy.forCode(breakPoint.trim());
    if (policy == BreakPointPolicy.NONE) {
      return new TokenizerConfig(policy, null, false, StemmerType.NONE);
    } else if (normalization == null) {
      throw new IllegalArgumentException("If the break point set is not 0, a normalization method must be specified (\"" + NORMALIZATION_ARGNAME + "\" arg)");
    }
    RecombineMode mode = RecombineMode.forCode(normalization.trim());
    boolean greekNormalize = parseBoolean(GREEK_ARGNAME, greek);
    StemmerType stemmerType = stemmer == null ? StemmerType.NONE : StemmerType.forCode(stemmer.trim());
    return new TokenizerConfig(policy, mode, greekNormalize, stemmerType);
  }

  private static boolean parseBoolean(String argname, String value) {
    if (value == null) {
      return false;
    }
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "true":
        return true;
      case "false":
        return false;
      default:
        throw new IllegalArgumentException("\"" + argname + "\" must be true or false, got: " + value);
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof TokenizerConfig)) {
      return false;
    }
    TokenizerConfig other = (TokenizerConfig) obj;
    return breakPoints == other.breakPoints && recombineMode == other.recombineMode
        && greekNormalize == other.greekNormalize && stemmerType == other.stemmerType;
  }

  @Override
  public int hashCode() {
    return Objects.hash(breakPoints, recombineMode, greekNormalize, stemmerType);
  }

  @Override
  public String toString() {
    return "TokenizerConfig[breakPoints=" + breakPoints + ", recombine=" + recombineMode
        + ", greek=" + greekNormalize + ", stemmer=" + stemmerType + "]";
  }

}
