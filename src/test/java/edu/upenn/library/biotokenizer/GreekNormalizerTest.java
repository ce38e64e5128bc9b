package edu.upenn.library.biotokenizer;

import static junit.framework.Assert.assertEquals;
import static junit.framework.Assert.assertNull;
import static junit.framework.Assert.assertSame;
import org.junit.Test;

public class GreekNormalizerTest {

  @Test
  public void testWholeRunsOnly() {
    assertEquals("a", GreekNormalizer.normalize("alpha"));
    assertEquals("alphabeta", GreekNormalizer.normalize("alphabeta"));
    assertEquals("tnfalpha", GreekNormalizer.normalize("tnfalpha"));
    assertEquals("kappab", GreekNormalizer.normalize("kappab"));
  }

  @Test
  public void testDigitsSeparateRuns() {
    assertEquals("a2", GreekNormalizer.normalize("alpha2"));
    assertEquals("2b", GreekNormalizer.normalize("2beta"));
    assertEquals("a1b2", GreekNormalizer.normalize("alpha1beta2"));
    assertEquals("il-2", GreekNormalizer.normalize("il-2"));
    assertEquals("tnf-a", GreekNormalizer.normalize("tnf-alpha"));
  }

  @Test
  public void testLowercaseOnly() {
    assertEquals("Alpha", GreekNormalizer.normalize("Alpha"));
    assertEquals("ALPHA", GreekNormalizer.normalize("ALPHA"));
  }

  @Test
  public void testUnchangedInstanceReturned() {
    String s = "receptor";
    assertSame(s, GreekNormalizer.normalize(s));
    assertEquals("", GreekNormalizer.normalize(""));
  }

  @Test
  public void testCodeFor() {
    assertEquals("th", GreekNormalizer.codeFor("theta"));
    assertEquals("e", GreekNormalizer.codeFor("eta"));
    assertEquals("e", GreekNormalizer.codeFor("epsilon"));
    assertEquals("o", GreekNormalizer.codeFor("omega"));
    assertEquals("o", GreekNormalizer.codeFor("omicron"));
    assertEquals("ps", GreekNormalizer.codeFor("psi"));
    assertNull(GreekNormalizer.codeFor("digamma"));
  }

}
