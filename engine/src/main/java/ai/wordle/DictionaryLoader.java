package ai.wordle;

import ai.wordle.config.DictionaryProperties;
import ai.wordle.game.Dictionary;
import ai.wordle.game.Word;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Loads the word list named by {@link DictionaryProperties}.
 * <p>
 * One word per line. Lines are trimmed and upper-cased; blank lines, lines of the wrong length
 * and lines with anything but letters are skipped. The remaining order is kept, since the
 * guess selector depends on it.
 */
@Component
public class DictionaryLoader {
    private static final Logger log = LoggerFactory.getLogger(DictionaryLoader.class);

    private final DictionaryProperties properties;
    private final ResourceLoader resourceLoader;

    public DictionaryLoader(DictionaryProperties properties, ResourceLoader resourceLoader) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
    }

    /**
     * Loads the configured word list.
     *
     * @throws IllegalStateException if the resource is missing, unreadable or holds no valid words
     */
    public Dictionary load() {
        String location = properties.getLocation();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Word list not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            Dictionary dictionary = read(in, location);
            if (dictionary.isEmpty()) {
                throw new IllegalStateException("Word list has no valid " + Word.LENGTH + "-letter words: " + location);
            }
            return dictionary;
        } catch (IOException e) {
            throw new IllegalStateException("Could not read word list " + location, e);
        }
    }

    /**
     * Reads words from a stream; the caller closes it.
     *
     * @param source name used in log messages
     */
    public static Dictionary read(InputStream in, String source) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        List<Word> words = new ArrayList<>();
        int skipped = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (!Word.isValid(trimmed)) {
                skipped++;
                if (log.isDebugEnabled()) {
                    log.debug("Skipping invalid word '{}' in {}", trimmed, source);
                }
                continue;
            }
            words.add(Word.of(trimmed));
        }
        Dictionary dictionary = new Dictionary(words);
        int duplicates = words.size() - dictionary.size();
        if (skipped > 0 || duplicates > 0) {
            log.warn("Word list {}: skipped {} invalid and {} duplicate lines", source, skipped, duplicates);
        }
        log.info("Loaded {} words from {}", dictionary.size(), source);
        return dictionary;
    }
}
