package ai.wordle.player.ai;

import ai.wordle.game.CandidateSet;
import ai.wordle.game.FeedbackEngine;
import ai.wordle.game.FeedbackPattern;
import ai.wordle.game.Word;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups candidates by the feedback a guess would get against each of them.
 * <p>
 * Each group is what would be left if that feedback came back, so the largest group is the
 * minimax cost of the guess. Partitions only live for one evaluation.
 */
public final class PartitionEvaluator {
    private PartitionEvaluator() {}

    /**
     * Builds the partition itself, groups in first-seen order.
     */
    public static Map<FeedbackPattern, List<Word>> partition(Word guess, CandidateSet candidates) {
        Map<FeedbackPattern, List<Word>> buckets = new LinkedHashMap<>();
        for (Word candidate : candidates) {
            FeedbackPattern pattern = FeedbackEngine.computeFeedback(guess, candidate);
            buckets.computeIfAbsent(pattern, p -> new ArrayList<>()).add(candidate);
        }
        return buckets;
    }

    /**
     * Scores a guess against the candidates without materialising the groups.
     *
     * @return the partition metrics; {@link PartitionStats#EMPTY} when there are no candidates
     */
    public static PartitionStats evaluate(Word guess, CandidateSet candidates) {
        if (candidates.isEmpty()) {
            return PartitionStats.EMPTY;
        }
        int[] counts = new int[FeedbackPattern.PATTERN_COUNT];
        int buckets = 0;
        int max = 0;
        for (Word candidate : candidates) {
            int code = FeedbackEngine.computeCode(guess, candidate);
            int size = ++counts[code];
            if (size == 1) {
                buckets++;
            }
            if (size > max) {
                max = size;
            }
        }
        int total = candidates.size();
        double avg = total / (double) buckets;
        return new PartitionStats(max, avg, buckets, candidates.contains(guess), total - avg);
    }
}
