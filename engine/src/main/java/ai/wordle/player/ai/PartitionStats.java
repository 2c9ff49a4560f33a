package ai.wordle.player.ai;

/**
 * How well one guess splits a candidate set.
 *
 * @param maxBucket        size of the largest feedback group, i.e. candidates left in the worst case
 * @param avgBucket        mean size of the feedback groups
 * @param bucketCount      number of distinct feedback patterns the guess can produce
 * @param candidateAnswer  whether the guess is itself one of the candidates
 * @param eliminationScore candidate count minus {@code avgBucket}
 */
public record PartitionStats(int maxBucket, double avgBucket, int bucketCount, boolean candidateAnswer, double eliminationScore) {

    /** Stats for an empty candidate set. */
    public static final PartitionStats EMPTY = new PartitionStats(0, 0.0, 0, false, 0.0);
}
