package ai.wordle.game;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * The words still consistent with every piece of feedback seen in one game.
 * <p>
 * Order follows the dictionary the game started from. A set of the same words backs
 * {@link #contains(Word)}, which the guess selector calls for every word it scans.
 * Instances are immutable; {@link CandidateFilter} produces the next, smaller set.
 */
public final class CandidateSet implements Iterable<Word> {
    private final List<Word> words;
    private final Set<Word> lookup;

    public CandidateSet(Collection<Word> words) {
        this.words = Collections.unmodifiableList(new ArrayList<>(words));
        this.lookup = new HashSet<>(this.words);
    }

    public static CandidateSet of(String... words) {
        List<Word> list = new ArrayList<>(words.length);
        for (String w : words) {
            list.add(Word.of(w));
        }
        return new CandidateSet(list);
    }

    public List<Word> words() {
        return words;
    }

    public Word get(int index) {
        return words.get(index);
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

    @Override
    public Iterator<Word> iterator() {
        return words.iterator();
    }

    @Override
    public String toString() {
        if (words.size() <= 10) {
            return words.toString();
        }
        return words.subList(0, 10) + " ... (" + words.size() + " words)";
    }
}
