package ai.wordle.player;

import ai.wordle.game.FeedbackPattern;
import ai.wordle.game.Word;

/**
 * Whoever knows the secret word and answers guesses: a simulated target during sweeps,
 * or a person reading the colours off a real game.
 */
public interface FeedbackSource {

    /**
     * @param guess the word just guessed
     * @param turn  1-based turn number
     * @return the feedback for that guess, or {@code null} if no more feedback will come
     */
    FeedbackPattern feedbackFor(Word guess, int turn);
}
