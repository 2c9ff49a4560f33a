package ai.wordle.game;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * What a game has learned about the secret word so far.
 * <p>
 * Instances are immutable and threaded from turn to turn by {@link KnowledgeTracker}:
 * <ul>
 *     <li><b>known letters</b> - letters confirmed to occur somewhere (green or yellow).</li>
 *     <li><b>known positions</b> - the letter fixed at each position by a green, if any.</li>
 *     <li><b>excluded letters</b> - letters confirmed not to occur.</li>
 *     <li><b>wrong positions</b> - for each yellow letter, the positions it is known not to hold.</li>
 * </ul>
 * Known and excluded letters never overlap.
 */
public final class KnowledgeState {
    private static final KnowledgeState EMPTY =
            new KnowledgeState(new TreeSet<>(), new Character[Word.LENGTH], new TreeSet<>(), new TreeMap<>());

    private final Set<Character> knownLetters;
    private final Character[] knownPositions;
    private final Set<Character> excludedLetters;
    private final Map<Character, Set<Integer>> wrongPositions;
    private final int knownMask;
    private final int excludedMask;

    KnowledgeState(
            Set<Character> knownLetters,
            Character[] knownPositions,
            Set<Character> excludedLetters,
            Map<Character, Set<Integer>> wrongPositions) {
        if (!Collections.disjoint(knownLetters, excludedLetters)) {
            throw new IllegalStateException(
                    "Letters cannot be both known and excluded: known=" + knownLetters + " excluded=" + excludedLetters);
        }
        this.knownLetters = Collections.unmodifiableSet(new TreeSet<>(knownLetters));
        this.knownPositions = Arrays.copyOf(knownPositions, Word.LENGTH);
        this.excludedLetters = Collections.unmodifiableSet(new TreeSet<>(excludedLetters));
        Map<Character, Set<Integer>> copy = new TreeMap<>();
        wrongPositions.forEach((letter, positions) ->
                copy.put(letter, Collections.unmodifiableSet(new TreeSet<>(positions))));
        this.wrongPositions = Collections.unmodifiableMap(copy);
        this.knownMask = mask(this.knownLetters);
        this.excludedMask = mask(this.excludedLetters);
    }

    /**
     * State at the start of a game: nothing known.
     */
    public static KnowledgeState empty() {
        return EMPTY;
    }

    public Set<Character> getKnownLetters() {
        return knownLetters;
    }

    public Set<Character> getExcludedLetters() {
        return excludedLetters;
    }

    public Map<Character, Set<Integer>> getWrongPositions() {
        return wrongPositions;
    }

    /**
     * Returns the letter confirmed at a position (0-based), if a green has been seen there.
     */
    public Optional<Character> getKnownPosition(int position) {
        return Optional.ofNullable(knownPositions[position]);
    }

    /** Bit mask of known letters, bit 0 is 'A'. */
    public int knownMask() {
        return knownMask;
    }

    /** Bit mask of excluded letters, bit 0 is 'A'. */
    public int excludedMask() {
        return excludedMask;
    }

    /**
     * Counts the distinct letters of a word that are neither known nor excluded,
     * i.e. the letters a guess of that word would teach us something new about.
     */
    public int unknownLetterCount(Word word) {
        return Integer.bitCount(word.letterMask() & ~(knownMask | excludedMask));
    }

    /**
     * Counts the distinct letters of a word that are already known to be present.
     */
    public int knownLetterCount(Word word) {
        return Integer.bitCount(word.letterMask() & knownMask);
    }

    /**
     * Renders known positions, e.g. {@code C_A__}.
     */
    public String pattern() {
        StringBuilder sb = new StringBuilder(Word.LENGTH);
        for (Character c : knownPositions) {
            sb.append(c == null ? '_' : c);
        }
        return sb.toString();
    }

    Character[] knownPositionsCopy() {
        return Arrays.copyOf(knownPositions, Word.LENGTH);
    }

    private static int mask(Set<Character> letters) {
        int mask = 0;
        for (char c : letters) {
            mask |= Word.bit(c);
        }
        return mask;
    }

    @Override
    public String toString() {
        return "KnowledgeState[pattern=" + pattern()
                + ", known=" + knownLetters
                + ", excluded=" + excludedLetters
                + ", wrongPositions=" + wrongPositions + "]";
    }
}
