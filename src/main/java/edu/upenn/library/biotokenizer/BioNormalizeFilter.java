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

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import org.apache.lucene.analysis.TokenFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.PositionIncrementAttribute;

/**
 * Normalizes each incoming token as a raw token with a
 * {@link BioTokenNormalizer}.
 * <p>
 * In {@link RecombineMode#SPACE} mode the space-separated parts become
 * separate terms, one position apart, all carrying the offsets of the raw
 * token. Tokens that normalize to nothing are dropped and their position
 * increments carried over to the next term.
 */
public final class BioNormalizeFilter extends TokenFilter {

  private final CharTermAttribute termAtt = addAttribute(CharTermAttribute.class);
  private final PositionIncrementAttribute posIncrAtt = addAttribute(PositionIncrementAttribute.class);

  private final BioTokenNormalizer normalizer;
  private final boolean splitParts;
  private final Deque<String> pending = new ArrayDeque<>();
  private State state;
  private int skippedPositions;

  public BioNormalizeFilter(TokenStream input, BioTokenNormalizer normalizer) {
    super(input);
    this.normalizer = normalizer;
    TokenizerConfig config = normalizer.getConfig();
    this.splitParts = config.getBreakPoints() != BreakPointPolicy.NONE && config.getRecombineMode() == RecombineMode.SPACE;
  }

  public BioNormalizeFilter(TokenStream input, TokenizerConfig config) {
    this(input, new BioTokenNormalizer(config));
  }

  @Override
  public boolean incrementToken() throws IOException {
    if (!pending.isEmpty()) {
      restoreState(state);
      termAtt.setEmpty().append(pending.removeFirst());
      posIncrAtt.setPositionIncrement(1);
      return true;
    }
    while (input.incrementToken()) {
      String normalized = normalizer.normalizeToken(termAtt.toString());
      String first = splitParts ? queueParts(normalized) : normalized;
      if (first.isEmpty()) {
        skippedPositions += posIncrAtt.getPositionIncrement();
        continue;
      }
      if (!pending.isEmpty()) {
        state = captureState();
      }
      termAtt.setEmpty().append(first);
      if (skippedPositions != 0) {
        posIncrAtt.setPositionIncrement(posIncrAtt.getPositionIncrement() + skippedPositions);
        skippedPositions = 0;
      }
      return true;
    }
    return false;
  }

  /**
   * Queues all space-separated parts after the first.
   *
   * @return the first part, or the empty string if there is none
   */
  private String queueParts(String normalized) {
    String first = "";
    for (String part : normalized.split(" ")) {
      if (part.isEmpty()) {
        continue;
      } else if (first.isEmpty()) {
        first = part;
      } else {
        pending.add(part);
      }
    }
    return first;
  }

  @Override
  public void end() throws IOException {
    super.end();
    posIncrAtt.setPositionIncrement(posIncrAtt.getPositionIncrement() + skippedPositions);
  }

  @Override
  public void reset() throws IOException {
    super.reset();
    pending.clear();
    state = null;
    skippedPositions = 0;
  }

}
