package edu.upenn.library.biotokenizer.stem;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map.Entry;
import java.util.Map;
import java.util.regex.Pattern;
import junit.framework.TestCase;

public class SStemmerTest extends TestCase {

    private static final Pattern TAB_SPLIT = Pattern.compile("\t", Pattern.LITERAL);
    private static final Map<String, String> testCases = new LinkedHashMap<>();

    static {
        InputStream in = SStemmerTest.class.getClassLoader().getResourceAsStream("SStemmer.test");
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                String[] entry = TAB_SPLIT.split(line);
                if (entry.length == 2) {
                    testCases.put(entry[1], entry[0]);
                }
            }
        } catch (IOException ex) {
            throw new RuntimeException(ex);
        }
    }

    public void testStem() {
        for (Entry<String, String> e : testCases.entrySet()) {
            assertEquals(e.getKey(), e.getValue(), SStemmer.INSTANCE.stem(e.getKey()));
        }
    }

    public void testStemmingTwice() {
        List<String> words = new ArrayList<>(testCases.keySet());
        // one word down each path: ies, es, s, and no ending
        words.addAll(Arrays.asList("studies", "genes", "kinases", "receptors", "caress", "virus", "ies", "es", "s"));
        for (String word : words) {
            String once = SStemmer.INSTANCE.stem(word);
            assertEquals(word, once, SStemmer.INSTANCE.stem(once));
        }
    }

    public void testWholeWordEndings() {
        assertEquals("y", SStemmer.INSTANCE.stem("ies"));
        assertEquals("e", SStemmer.INSTANCE.stem("es"));
        assertEquals("s", SStemmer.INSTANCE.stem("s"));
        assertEquals("", SStemmer.INSTANCE.stem(""));
    }

    public void testPlurals() {
        assertEquals("pony", SStemmer.INSTANCE.stem("ponies"));
        assertEquals("cat", SStemmer.INSTANCE.stem("cats"));
        assertEquals("aies", SStemmer.INSTANCE.stem("aies"));
        assertEquals("heroes", SStemmer.INSTANCE.stem("heroes"));
        assertEquals("glass", SStemmer.INSTANCE.stem("glass"));
        assertEquals("status", SStemmer.INSTANCE.stem("status"));
    }

}
