package pokeai.cli.selfplay;

import pokeai.engine.BattleEngine;
import pokeai.engine.action.BattleAction;
import pokeai.model.BattleState;
import pokeai.model.SideId;

import java.util.List;
import java.util.Random;

/**
 * One side's choice point: the state it sees and the legal candidates. The random source
 * belongs to the side, so seeded runs pick the same actions.
 */
public final class Decision {
    private final BattleEngine engine;
    private final String format;
    private final BattleState state;
    private final SideId side;
    private final List<BattleAction> candidates;
    private final Random random;

    public Decision(BattleEngine engine, String format, BattleState state, SideId side,
                    List<BattleAction> candidates, Random random) {
        this.engine = engine;
        this.format = format;
        this.state = state;
        this.side = side;
        this.candidates = candidates;
        this.random = random;
    }

    public BattleEngine getEngine() {
        return engine;
    }

    public String getFormat() {
        return format;
    }

    public BattleState getState() {
        return state;
    }

    public SideId getSide() {
        return side;
    }

    public List<BattleAction> getCandidates() {
        return candidates;
    }

    public Random getRandom() {
        return random;
    }
}
