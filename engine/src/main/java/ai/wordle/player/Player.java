package ai.wordle.player;

import ai.wordle.game.Word;

/**
 * Represents a player capable of choosing the next guess for the game loop.
 */
public interface Player {

    /**
     * Choose the next guess.
     *
     * @param view everything known at the start of this turn
     * @return the word to guess, or {@code null} to abandon the game
     */
    Word nextGuess(TurnView view);
}
