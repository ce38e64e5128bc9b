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

import java.io.Reader;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.core.WhitespaceTokenizer;

/**
 * Cleanup, whitespace tokenization and normalization under one
 * {@link TokenizerConfig}.
 */
public final class BioAnalyzer extends Analyzer {

  private final BioTokenNormalizer normalizer;

  public BioAnalyzer() {
    this(TokenizerConfig.DEFAULT);
  }

  public BioAnalyzer(TokenizerConfig config) {
    this.normalizer = new BioTokenNormalizer(config);
  }

  public BioAnalyzer(QueryType queryType) {
    this(queryType.config());
  }

  @Override
  protected Reader initReader(String fieldName, Reader reader) {
    return new BioCleanupCharFilter(reader);
  }

  @Override
  protected TokenStreamComponents createComponents(String fieldName) {
    Tokenizer source = new WhitespaceTokenizer();
    return new TokenStreamComponents(source, new BioNormalizeFilter(source, normalizer));
  }

}
