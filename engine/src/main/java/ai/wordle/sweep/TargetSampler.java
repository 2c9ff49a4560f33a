package ai.wordle.sweep;

import ai.wordle.game.Dictionary;
import ai.wordle.game.Word;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Draws the secret targets a sweep plays against.
 * <p>
 * The dictionary is shuffled with a seeded {@link Random} and the first {@code count} words are
 * taken, so the same seed and word list always give the same targets, and every starter in a
 * sweep faces exactly the same games.
 */
public final class TargetSampler {
    private static final Logger log = LoggerFactory.getLogger(TargetSampler.class);

    private TargetSampler() {}

    /**
     * @param count wanted targets; clamped to the dictionary size
     * @param seed  random seed
     * @return distinct targets in draw order
     */
    public static List<Word> sample(Dictionary dictionary, int count, long seed) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0 but was " + count);
        }
        int available = dictionary.size();
        int actual = count;
        if (count > available) {
            log.warn("Requested {} targets but the word list only has {}; using all of them", count, available);
            actual = available;
        }
        List<Word> shuffled = new ArrayList<>(dictionary.words());
        Collections.shuffle(shuffled, new Random(seed));
        return new ArrayList<>(shuffled.subList(0, actual));
    }
}
