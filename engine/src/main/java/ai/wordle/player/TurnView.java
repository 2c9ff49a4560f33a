package ai.wordle.player;

import ai.wordle.game.CandidateSet;
import ai.wordle.game.Dictionary;
import ai.wordle.game.KnowledgeState;
import ai.wordle.game.Word;
import java.util.Objects;

/**
 * Snapshot handed to a {@link Player} at the start of a turn.
 *
 * @param candidates words still consistent with all feedback so far
 * @param dictionary every word the game knows, in its fixed order
 * @param turn       1-based turn number
 * @param knowledge  letters learned so far
 * @param starter    fixed opening word being benchmarked, or {@code null}
 */
public record TurnView(CandidateSet candidates, Dictionary dictionary, int turn, KnowledgeState knowledge, Word starter) {
    public TurnView {
        Objects.requireNonNull(candidates, "candidates");
        Objects.requireNonNull(dictionary, "dictionary");
        Objects.requireNonNull(knowledge, "knowledge");
        if (turn < 1) {
            throw new IllegalArgumentException("turn must be >= 1 but was " + turn);
        }
    }
}
