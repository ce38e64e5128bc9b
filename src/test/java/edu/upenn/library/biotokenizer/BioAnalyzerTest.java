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
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.BaseTokenStreamTestCase;
import org.apache.lucene.analysis.custom.CustomAnalyzer;
import org.apache.lucene.analysis.util.TokenFilterFactory;

public class BioAnalyzerTest extends BaseTokenStreamTestCase {

  public void testVerbose() throws IOException {
    Analyzer a = new BioAnalyzer(QueryType.VERBOSE);
    assertAnalyzesTo(a, "Expression of NF-kappaB/p65 in cells,",
        new String[] {"express", "of", "nf", "kappab", "p65", "in", "cell"},
        new int[] {0, 11, 14, 14, 14, 28, 31},
        new int[] {10, 13, 27, 27, 27, 30, 37},
        new int[] {1, 1, 1, 1, 1, 1, 1});
    a.close();
  }

  public void testSymbolic() throws IOException {
    Analyzer a = new BioAnalyzer(QueryType.SYMBOLIC);
    assertAnalyzesTo(a, "The (IL-2) receptor [beta] chain",
        new String[] {"the", "il2", "receptor", "b", "chain"});
    assertAnalyzesTo(a, "TNF-alpha2 induces apoptosis.",
        new String[] {"tnfa2", "induces", "apoptosis"});
    a.close();
  }

  public void testDefaultIsVerbose() throws IOException {
    Analyzer a = new BioAnalyzer();
    assertAnalyzesTo(a, "p53's role isn't clear", new String[] {"p53", "role", "isn", "clear"});
    a.close();
  }

  public void testLovinsWordClassConcat() throws IOException {
    Analyzer a = new BioAnalyzer(new TokenizerConfig(BreakPointPolicy.WORD_CLASS, RecombineMode.CONCAT, false,
        StemmerType.LOVINS));
    assertAnalyzesTo(a, "Ca2+-dependent (PKC)-alpha", new String[] {"ca2depens", "pkcalph"});
    a.close();
  }

  public void testMultipleLines() throws IOException {
    Analyzer a = new BioAnalyzer(QueryType.SYMBOLIC);
    assertAnalyzesTo(a, "(IL-2)\n[TNF-alpha]", new String[] {"il2", "tnfa"},
        new int[] {1, 8}, new int[] {6, 18});
    a.close();
  }

  public void testRandomStrings() throws IOException {
    for (QueryType queryType : QueryType.values()) {
      Analyzer a = new BioAnalyzer(queryType);
      checkRandomData(random(), a, 200 * RANDOM_MULTIPLIER);
      a.close();
    }
  }

  public void testCustomAnalyzerByName() throws IOException {
    Analyzer a = CustomAnalyzer.builder()
        .addCharFilter(BioCleanupCharFilterFactory.NAME)
        .withTokenizer("whitespace")
        .addTokenFilter(BioNormalizeFilterFactory.NAME, "breakPoint", "1", "normalization", "h", "greek", "true")
        .build();
    assertAnalyzesTo(a, "TNF-alpha2 (IL-2)", new String[] {"tnf-a2", "il-2"});
    a.close();
  }

  public void testNormalizeFactory() {
    Map<String, String> args = new HashMap<>();
    args.put("queryType", "S");
    TokenFilterFactory factory = TokenFilterFactory.forName(BioNormalizeFilterFactory.NAME, args);
    assertTrue(factory instanceof BioNormalizeFilterFactory);
    assertSame(TokenizerConfig.SYMBOLIC, ((BioNormalizeFilterFactory) factory).getConfig());
  }

  public void testNormalizeFactoryRejectsUnknownArgs() {
    Map<String, String> args = new HashMap<>();
    args.put("queryType", "V");
    args.put("bogus", "x");
    IllegalArgumentException expected = expectThrows(IllegalArgumentException.class,
        () -> new BioNormalizeFilterFactory(args));
    assertTrue(expected.getMessage().contains("Unknown parameters"));
  }

}
