package ai.wordle.player.ai;

import ai.wordle.game.Word;
import java.util.Comparator;

/**
 * A probe word and its final selector score; lower is better.
 *
 * @param word           the probe
 * @param stats          partition metrics against the current candidates
 * @param unknownLetters distinct letters in the word that are neither known nor excluded
 * @param knownLetters   distinct letters in the word already known to be present
 * @param finalScore     {@code maxBucket + avgBucket/1000 + answerBonus + explorationBonus}
 */
public record ScoredGuess(Word word, PartitionStats stats, int unknownLetters, int knownLetters, double finalScore) {

    /** Best first: lowest score, then smallest worst case, smallest mean, then alphabetical. */
    public static final Comparator<ScoredGuess> BEST_FIRST = Comparator
            .comparingDouble(ScoredGuess::finalScore)
            .thenComparingInt((ScoredGuess s) -> s.stats().maxBucket())
            .thenComparingDouble(s -> s.stats().avgBucket())
            .thenComparing(ScoredGuess::word);

    @Override
    public String toString() {
        return String.format("%s: max=%d, avg=%.1f, new=%d, known=%d, score=%.3f%s",
                word, stats.maxBucket(), stats.avgBucket(), unknownLetters, knownLetters, finalScore,
                stats.candidateAnswer() ? " [ANSWER]" : " [ELIMINATE]");
    }
}
