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
import java.io.Reader;
import java.io.StringReader;
import org.apache.lucene.analysis.charfilter.BaseCharFilter;

/**
 * Applies {@link LineCleaner} to every line of the input. Offsets of
 * tokens read from this filter are corrected back to the input text.
 * <p>
 * The whole input is buffered on the first read.
 */
public final class BioCleanupCharFilter extends BaseCharFilter {

  private Reader transformedInput;

  public BioCleanupCharFilter(Reader in) {
    super(in);
  }

  @Override
  public int read(char[] cbuf, int off, int len) throws IOException {
    if (transformedInput == null) {
      fill();
    }
    return transformedInput.read(cbuf, off, len);
  }

  @Override
  public int read() throws IOException {
    if (transformedInput == null) {
      fill();
    }
    return transformedInput.read();
  }

  private void fill() throws IOException {
    StringBuilder buffered = new StringBuilder();
    char[] temp = new char[1024];
    for (int cnt = input.read(temp); cnt > 0; cnt = input.read(temp)) {
      buffered.append(temp, 0, cnt);
    }
    transformedInput = new StringReader(clean(buffered).toString());
  }

  private CharSequence clean(CharSequence in) {
    StringBuilder out = new StringBuilder(in.length());
    int lastDiff = 0;
    int lineStart = 0;
    int n = in.length();
    while (lineStart <= n) {
      int lineEnd = lineStart;
      while (lineEnd < n && in.charAt(lineEnd) != '\n') {
        lineEnd++;
      }
      LineCleaner.TrackedText line = LineCleaner.cleanTracked(in.subSequence(lineStart, lineEnd));
      for (int i = 0; i < line.length(); i++) {
        lastDiff = record(out.length(), lineStart + line.origin(i), lastDiff);
        out.append(line.charAt(i));
      }
      if (lineEnd < n) {
        lastDiff = record(out.length(), lineEnd, lastDiff);
        out.append('\n');
      }
      lineStart = lineEnd + 1;
    }
    record(out.length(), n, lastDiff);
    return out;
  }

  private int record(int outputOffset, int inputOffset, int lastDiff) {
    int diff = inputOffset - outputOffset;
    if (diff != lastDiff) {
      addOffCorrectMap(outputOffset, diff);
    }
    return diff;
  }

}
