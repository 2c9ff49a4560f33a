package ai.wordle.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Summary of one finished game: the opening word, every guess made, and how it ended.
 */
public final class GameResult {

    /**
     * How a game ended. Only {@link #SOLVED} counts as a win; the others are the
     * different ways of failing.
     */
    public enum Outcome {
        /** The last guess received all-green feedback. */
        SOLVED,
        /** Six guesses were used without solving. */
        EXHAUSTED,
        /** No candidate was consistent with the feedback received. */
        CONTRADICTION,
        /** The feedback source stopped answering (e.g. the user quit). */
        ABANDONED;

        public boolean isFailure() {
            return this != SOLVED;
        }
    }

    private final Word starter;
    private final List<Word> guesses;
    private final Outcome outcome;
    private final long durationNanos;

    public GameResult(Word starter, List<Word> guesses, Outcome outcome, long durationNanos) {
        this.starter = starter;
        this.guesses = Collections.unmodifiableList(new ArrayList<>(guesses));
        this.outcome = Objects.requireNonNull(outcome, "outcome");
        this.durationNanos = durationNanos;
    }

    /**
     * The fixed opening word this game benchmarked, or {@code null} if the selector chose freely.
     */
    public Word getStarter() {
        return starter;
    }

    public List<Word> getGuesses() {
        return guesses;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isSolved() {
        return outcome == Outcome.SOLVED;
    }

    /**
     * Number of guesses made. For a solved game this is the winning turn (1-6).
     */
    public int getTurns() {
        return guesses.size();
    }

    public long getDurationNanos() {
        return durationNanos;
    }

    @Override
    public String toString() {
        return "GameResult[starter=" + starter + ", guesses=" + guesses + ", outcome=" + outcome + "]";
    }
}
