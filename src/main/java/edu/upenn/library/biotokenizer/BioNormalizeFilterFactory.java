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

import java.util.Map;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.util.TokenFilterFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for {@link BioNormalizeFilter}.
 * <pre class="prettyprint">
 * &lt;fieldType name="text_bio" class="solr.TextField"&gt;
 *   &lt;analyzer&gt;
 *     &lt;charFilter class="edu.upenn.library.biotokenizer.BioCleanupCharFilterFactory"/&gt;
 *     &lt;tokenizer class="solr.WhitespaceTokenizerFactory"/&gt;
 *     &lt;filter class="edu.upenn.library.biotokenizer.BioNormalizeFilterFactory"
 *             breakPoint="1" normalization="h" greek="true" stemmer="p"/&gt;
 *   &lt;/analyzer&gt;
 * &lt;/fieldType&gt;
 * </pre>
 * See {@link TokenizerConfig#parse(Map)} for the arguments.
 */
public class BioNormalizeFilterFactory extends TokenFilterFactory {

  public static final String NAME = "bioNormalize";

  private static final Logger log = LoggerFactory.getLogger(BioNormalizeFilterFactory.class);

  private final TokenizerConfig config;
  private final BioTokenNormalizer normalizer;

  public BioNormalizeFilterFactory(Map<String, String> args) {
    super(args);
    config = TokenizerConfig.parse(args);
    if (!args.isEmpty()) {
      throw new IllegalArgumentException("Unknown parameters: " + args);
    }
    normalizer = new BioTokenNormalizer(config);
    log.debug("created {} with {}", NAME, config);
  }

  public TokenizerConfig getConfig() {
    return config;
  }

  @Override
  public TokenStream create(TokenStream input) {
    return new BioNormalizeFilter(input, normalizer);
  }

}
