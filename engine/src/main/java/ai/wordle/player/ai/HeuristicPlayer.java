package ai.wordle.player.ai;

import ai.wordle.config.SelectorProperties;
import ai.wordle.game.Word;
import ai.wordle.player.Player;
import ai.wordle.player.TurnView;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * AI player backed by {@link GuessSelector}. Active unless the {@code ai-human} profile is on.
 * <p>
 * Stateless between turns: everything it needs arrives in the {@link TurnView}, so one
 * instance can serve many concurrent games.
 */
@Component
@Profile("!ai-human")
public class HeuristicPlayer implements Player {
    private final GuessSelector selector;

    public HeuristicPlayer(SelectorProperties properties) {
        this.selector = new GuessSelector(properties);
    }

    public GuessSelector getSelector() {
        return selector;
    }

    @Override
    public Word nextGuess(TurnView view) {
        return selector.selectGuess(view.candidates(), view.dictionary(), view.turn(), view.knowledge(), view.starter());
    }
}
