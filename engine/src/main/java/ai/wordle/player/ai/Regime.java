package ai.wordle.player.ai;

/**
 * The strategies {@link GuessSelector} switches between, in order of precedence.
 */
public enum Regime {
    /** One candidate left: guess it. */
    FORCED,
    /** Turn one with a fixed opening word: play it unscored. */
    STARTER,
    /** Two candidates: find any word whose feedback tells them apart. */
    DISAMBIGUATION,
    /** Many candidates: probe with non-candidates carrying lots of untested letters. */
    ELIMINATION,
    /** A handful of candidates: probe with non-candidates ranked by untested letters. */
    EXPLORATION,
    /** Very few candidates: score the candidates themselves plus some padding words. */
    ANSWER_FOCUSED
}
