package ai.wordle.game;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The ordered, read-only list of every word the game knows.
 * <p>
 * Order matters: the guess selector only scans a prefix of this list for probe words
 * ("the first 800 non-candidates", and so on), so a frequency-ranked list plays differently
 * from an alphabetical one. Duplicates are dropped keeping the first occurrence.
 * <p>
 * Instances are safe to share between threads.
 */
public final class Dictionary {
    private final List<Word> words;
    private final Set<Word> lookup;

    public Dictionary(Collection<Word> words) {
        LinkedHashSet<Word> unique = new LinkedHashSet<>(words);
        this.words = Collections.unmodifiableList(new ArrayList<>(unique));
        this.lookup = Collections.unmodifiableSet(unique);
    }

    public static Dictionary of(String... words) {
        List<Word> list = new ArrayList<>(words.length);
        for (String w : words) {
            list.add(Word.of(w));
        }
        return new Dictionary(list);
    }

    public List<Word> words() {
        return words;
    }

    public boolean contains(Word word) {
        return lookup.contains(word);
    }

    public int size() {
        return words.size();
    }

    public boolean isEmpty() {
        return words.isEmpty();
    }

    /**
     * Starting candidate set for a new game: every word, in dictionary order.
     */
    public CandidateSet toCandidateSet() {
        return new CandidateSet(words);
    }

    @Override
    public String toString() {
        return "Dictionary(size=" + words.size() + ")";
    }
}
