package ai.wordle.game;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Folds one guess and its feedback into a {@link KnowledgeState}.
 * <p>
 * Per position:
 * <ul>
 *     <li>{@code CORRECT} fixes the letter at that position and marks it known.</li>
 *     <li>{@code PRESENT} marks the letter known and records that it is not at this position.</li>
 *     <li>{@code ABSENT} excludes the letter unless it is already known. A grey on a repeated
 *         letter only says there are no <em>more</em> copies, so it must not exclude a letter
 *         that another position showed to be present.</li>
 * </ul>
 * A letter that turns out to be present is taken out of the excluded set, so known and
 * excluded stay disjoint whatever order the positions arrive in.
 */
public final class KnowledgeTracker {
    private KnowledgeTracker() {}

    public static KnowledgeState update(KnowledgeState knowledge, Word guess, FeedbackPattern feedback) {
        Set<Character> known = new TreeSet<>(knowledge.getKnownLetters());
        Set<Character> excluded = new TreeSet<>(knowledge.getExcludedLetters());
        Character[] positions = knowledge.knownPositionsCopy();
        Map<Character, Set<Integer>> wrong = new TreeMap<>();
        knowledge.getWrongPositions().forEach((letter, set) -> wrong.put(letter, new HashSet<>(set)));

        for (int i = 0; i < Word.LENGTH; i++) {
            char letter = guess.charAt(i);
            switch (feedback.get(i)) {
                case CORRECT -> {
                    positions[i] = letter;
                    markKnown(letter, known, excluded);
                }
                case PRESENT -> {
                    markKnown(letter, known, excluded);
                    wrong.computeIfAbsent(letter, k -> new HashSet<>()).add(i);
                }
                case ABSENT -> {
                    if (!known.contains(letter)) {
                        excluded.add(letter);
                    }
                }
            }
        }
        return new KnowledgeState(known, positions, excluded, wrong);
    }

    private static void markKnown(char letter, Set<Character> known, Set<Character> excluded) {
        known.add(letter);
        excluded.remove(letter);
    }
}
