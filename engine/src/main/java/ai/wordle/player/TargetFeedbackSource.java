package ai.wordle.player;

import ai.wordle.game.FeedbackEngine;
import ai.wordle.game.FeedbackPattern;
import ai.wordle.game.Word;
import java.util.Objects;

/**
 * Simulated game that knows the secret target and scores guesses against it.
 */
public class TargetFeedbackSource implements FeedbackSource {
    private final Word target;

    public TargetFeedbackSource(Word target) {
        this.target = Objects.requireNonNull(target, "target");
    }

    public Word getTarget() {
        return target;
    }

    @Override
    public FeedbackPattern feedbackFor(Word guess, int turn) {
        return FeedbackEngine.computeFeedback(guess, target);
    }
}
