package ai.wordle.player;

import ai.wordle.game.CandidateSet;
import ai.wordle.game.FeedbackPattern;
import ai.wordle.game.KnowledgeState;
import ai.wordle.game.Word;

/**
 * Callback fired by the game loop after each answered guess, e.g. to show progress to a
 * person using the assist mode.
 */
@FunctionalInterface
public interface TurnListener {

    /**
     * @param turn       1-based turn number
     * @param guess      the word guessed
     * @param feedback   the feedback it received
     * @param knowledge  knowledge after folding in this feedback
     * @param candidates candidates left after filtering (unfiltered when the guess solved the game)
     */
    void onTurn(int turn, Word guess, FeedbackPattern feedback, KnowledgeState knowledge, CandidateSet candidates);
}
