package edu.upenn.library.biotokenizer.stem;

import junit.framework.TestCase;

public class StemmerTypeTest extends TestCase {

    public void testForCode() {
        assertEquals(StemmerType.PORTER, StemmerType.forCode("p"));
        assertEquals(StemmerType.LOVINS, StemmerType.forCode("l"));
        assertEquals(StemmerType.S_STEMMER, StemmerType.forCode("s"));
    }

    public void testUnknownCode() {
        for (String code : new String[] {"x", "P", "", null}) {
            try {
                StemmerType.forCode(code);
                fail("expected IllegalArgumentException for " + code);
            } catch (IllegalArgumentException ex) {
                assertTrue(ex.getMessage().contains("stemming method"));
            }
        }
    }

    public void testStemmers() {
        assertSame(PorterStemmer.INSTANCE, StemmerType.PORTER.stemmer());
        assertSame(LovinsStemmer.INSTANCE, StemmerType.LOVINS.stemmer());
        assertSame(SStemmer.INSTANCE, StemmerType.S_STEMMER.stemmer());
        assertEquals("running", StemmerType.NONE.stemmer().stem("running"));
        assertEquals("porter", StemmerType.PORTER.toString());
    }

}
