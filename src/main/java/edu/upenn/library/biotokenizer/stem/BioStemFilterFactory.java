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

import java.util.Map;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.util.TokenFilterFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for {@link BioStemFilter}.
 * <pre class="prettyprint">
 * &lt;filter class="edu.upenn.library.biotokenizer.stem.BioStemFilterFactory" stemmer="l"/&gt;
 * </pre>
 * The {@code stemmer} argument is required: {@code p} (Porter),
 * {@code l} (Lovins) or {@code s} (S stemmer).
 */
public class BioStemFilterFactory extends TokenFilterFactory {

  public static final String NAME = "bioStem";

  private static final Logger log = LoggerFactory.getLogger(BioStemFilterFactory.class);
  private static final String STEMMER_ARGNAME = "stemmer";

  private final StemmerType stemmerType;

  public BioStemFilterFactory(Map<String, String> args) {
    super(args);
    stemmerType = StemmerType.forCode(require(args, STEMMER_ARGNAME));
    if (!args.isEmpty()) {
      throw new IllegalArgumentException("Unknown parameters: " + args);
    }
    log.debug("created {} with stemmer {}", NAME, stemmerType);
  }

  public StemmerType getStemmerType() {
    return stemmerType;
  }

  @Override
  public TokenStream create(TokenStream input) {
    return new BioStemFilter(input, stemmerType.stemmer());
  }

}
