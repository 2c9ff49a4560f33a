package ai.wordle.game;

import java.util.ArrayList;
import java.util.List;

/**
 * Narrows a candidate set to the words that would have produced the observed feedback.
 */
public final class CandidateFilter {
    private CandidateFilter() {}

    /**
     * Keeps, in order, every candidate {@code w} for which
     * {@code computeFeedback(guess, w)} equals {@code feedback}.
     *
     * @return a set no larger than {@code candidates}; empty if the feedback contradicts all of them
     */
    public static CandidateSet filter(CandidateSet candidates, Word guess, FeedbackPattern feedback) {
        int expected = feedback.code();
        List<Word> kept = new ArrayList<>();
        for (Word candidate : candidates) {
            if (FeedbackEngine.computeCode(guess, candidate) == expected) {
                kept.add(candidate);
            }
        }
        return new CandidateSet(kept);
    }
}
