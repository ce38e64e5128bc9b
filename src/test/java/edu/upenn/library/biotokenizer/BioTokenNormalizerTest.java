package edu.upenn.library.biotokenizer;

import edu.upenn.library.biotokenizer.stem.StemmerType;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import junit.framework.TestCase;

public class BioTokenNormalizerTest extends TestCase {

    private static final Pattern TAB_SPLIT = Pattern.compile("\t", Pattern.LITERAL);
    private static final Pattern SPACE_SPLIT = Pattern.compile(" ", Pattern.LITERAL);
    private static final List<String[]> testCases = new ArrayList<>();

    static {
        String classname = BioTokenNormalizerTest.class.getSimpleName();
        InputStream in = BioTokenNormalizerTest.class.getClassLoader().getResourceAsStream(classname.substring(0, classname.length() - 4).concat(".test"));
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                String[] entry = TAB_SPLIT.split(line, -1);
                if (entry.length == 3) {
                    testCases.add(entry);
                }
            }
        } catch (IOException ex) {
            throw new RuntimeException(ex);
        }
    }

    private static TokenizerConfig config(String args) {
        Map<String, String> map = new HashMap<>();
        for (String arg : SPACE_SPLIT.split(args)) {
            int eq = arg.indexOf('=');
            map.put(arg.substring(0, eq), arg.substring(eq + 1));
        }
        return TokenizerConfig.parse(map);
    }

    public void testNormalizeLine() {
        for (String[] e : testCases) {
            BioTokenNormalizer instance = new BioTokenNormalizer(config(e[0]));
            assertEquals(e[0] + " [" + e[1] + "]", e[2], instance.normalizeLine(e[1]));
        }
        System.out.println("\t" + testCases.size() + " lines normalized");
    }

    public void testSubTokens() {
        BioTokenNormalizer instance = new BioTokenNormalizer(
            new TokenizerConfig(BreakPointPolicy.WORD_CLASS, RecombineMode.SPACE, true, StemmerType.NONE));
        assertEquals(Arrays.asList("tnf", "a", "2"), instance.subTokens("TNF-alpha2"));
        assertEquals(Collections.emptyList(), instance.subTokens("+-+"));
    }

    public void testNoBreakPoints() {
        BioTokenNormalizer instance = new BioTokenNormalizer(
            new TokenizerConfig(BreakPointPolicy.NONE, null, false, StemmerType.PORTER));
        assertEquals("tnf-alpha2", instance.normalizeToken("TNF-alpha2"));
        assertEquals("bind", instance.normalizeToken("Binding"));
    }

    public void testHyphenStemsWholeToken() {
        BioTokenNormalizer instance = new BioTokenNormalizer(
            new TokenizerConfig(BreakPointPolicy.DELIMITER, RecombineMode.HYPHEN, true, StemmerType.PORTER));
        assertEquals("tnf-a2", instance.normalizeToken("TNF-alpha2"));
        // the joined token is one word to the stemmer
        assertEquals("running-cel", instance.normalizeToken("running-cells"));
    }

    public void testSpaceStemsEachSubToken() {
        BioTokenNormalizer instance = new BioTokenNormalizer(
            new TokenizerConfig(BreakPointPolicy.DELIMITER, RecombineMode.SPACE, false, StemmerType.PORTER));
        assertEquals("run cell", instance.normalizeToken("running-cells"));
        assertEquals("", instance.normalizeToken("--"));
    }

    public void testConcatStemsWholeToken() {
        BioTokenNormalizer instance = new BioTokenNormalizer(
            new TokenizerConfig(BreakPointPolicy.DELIMITER, RecombineMode.CONCAT, false, StemmerType.S_STEMMER));
        assertEquals("il2receptor", instance.normalizeToken("IL-2_receptors"));
        assertEquals("cellsline", instance.normalizeToken("cells/lines"));
    }

    public void testSymbolicPreset() {
        BioTokenNormalizer instance = new BioTokenNormalizer(QueryType.SYMBOLIC.config());
        assertEquals("tnfa2", instance.normalizeToken("TNF-alpha2"));
        assertEquals("nfkbp65", instance.normalizeLine("NF-kappa-B/p65."));
    }

    public void testNormalizeLineKeepsEmptyTokens() {
        BioTokenNormalizer instance = new BioTokenNormalizer(TokenizerConfig.DEFAULT);
        assertEquals("a  b", instance.normalizeLine("a -- b"));
        assertEquals("", instance.normalizeLine("  "));
    }

    public void testNormalizeLineKeepsLeadingEmptyTokens() {
        BioTokenNormalizer instance = new BioTokenNormalizer(
            new TokenizerConfig(BreakPointPolicy.ALNUM, RecombineMode.HYPHEN, false, StemmerType.NONE));
        assertEquals(" x", instance.normalizeLine("} x"));
        assertEquals("  x ", instance.normalizeLine("} { x +"));
        assertEquals(" ", instance.normalizeLine("} {"));
    }

    public void testLowercaseAsciiOnly() {
        assertEquals("abcÉ", BioTokenNormalizer.toLowerAscii("ABCÉ"));
        String s = "lower";
        assertSame(s, BioTokenNormalizer.toLowerAscii(s));
    }

}
