package cl.leychile.structure.metadata;

import cl.leychile.structure.classify.ArticleNumbers;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeMap;

/**
 * Controlled subject vocabulary: trigger phrases mapped to canonical subjects.
 *
 * <p>Matching ignores case and accents. Text that hits no trigger yields no subject.
 */
public class SubjectVocabulary {

    public static final String DEFAULT_RESOURCE = "vocabulary/materias.properties";

    private final Map<String, String> subjectsByTrigger;

    public SubjectVocabulary(Map<String, String> subjectsByTrigger) {
        Map<String, String> normalized = new TreeMap<>();
        subjectsByTrigger.forEach((trigger, subject) -> normalized.put(fold(trigger), subject.strip()));
        this.subjectsByTrigger = normalized;
    }

    public static SubjectVocabulary loadDefault() {
        return load(DEFAULT_RESOURCE);
    }

    public static SubjectVocabulary load(String resource) {
        ClassLoader loader = SubjectVocabulary.class.getClassLoader();
        try (InputStream stream = loader.getResourceAsStream(resource)) {
            if (stream == null) {
                throw new UncheckedIOException(new IOException("Subject vocabulary not found on classpath: " + resource));
            }
            Properties properties = new Properties();
            try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
                properties.load(reader);
            }
            Map<String, String> entries = new TreeMap<>();
            for (String key : properties.stringPropertyNames()) {
                entries.put(key, properties.getProperty(key));
            }
            return new SubjectVocabulary(entries);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read subject vocabulary " + resource, ex);
        }
    }

    public int size() {
        return subjectsByTrigger.size();
    }

    /**
     * Canonical subjects whose triggers occur in the given texts, ordered by first occurrence.
     */
    public List<String> match(List<String> texts) {
        List<Hit> hits = new ArrayList<>();
        int offset = 0;
        for (String text : texts) {
            String folded = fold(text);
            for (Map.Entry<String, String> entry : subjectsByTrigger.entrySet()) {
                int index = indexOfWord(folded, entry.getKey());
                if (index >= 0) {
                    hits.add(new Hit(offset + index, entry.getKey(), entry.getValue()));
                }
            }
            offset += folded.length() + 1;
        }
        hits.sort(Comparator.comparingInt(Hit::position).thenComparing(Hit::trigger));
        Set<String> subjects = new LinkedHashSet<>();
        for (Hit hit : hits) {
            subjects.add(hit.subject());
        }
        return List.copyOf(subjects);
    }

    private static int indexOfWord(String text, String phrase) {
        int from = 0;
        while (true) {
            int index = text.indexOf(phrase, from);
            if (index < 0) {
                return -1;
            }
            int end = index + phrase.length();
            boolean startsWord = index == 0 || !Character.isLetterOrDigit(text.charAt(index - 1));
            boolean endsWord = end == text.length() || !Character.isLetterOrDigit(text.charAt(end));
            if (startsWord && endsWord) {
                return index;
            }
            from = index + 1;
        }
    }

    private static String fold(String value) {
        return ArticleNumbers.stripAccents(value == null ? "" : value).toLowerCase(Locale.ROOT).strip();
    }

    private record Hit(int position, String trigger, String subject) {
    }
}
