package pokeai.cli.selfplay;

import com.google.common.collect.ImmutableList;
import pokeai.data.FormatRules;
import pokeai.engine.BattleEngine;
import pokeai.engine.BattleFactory;
import pokeai.io.TeamLoader;
import pokeai.model.BattleState;
import pokeai.model.Pokemon;

import java.util.List;

/**
 * Two resolved teams in one format. Teams are built once; every battle gets its own copies.
 */
public final class Matchup {
    private final BattleEngine engine;
    private final FormatRules format;
    private final String p1Name;
    private final ImmutableList<Pokemon> p1Team;
    private final String p2Name;
    private final ImmutableList<Pokemon> p2Team;

    public Matchup(BattleEngine engine, FormatRules format, TeamLoader.Team p1, TeamLoader.Team p2) {
        this.engine = engine;
        this.format = format;
        TeamLoader loader = new TeamLoader(engine.getDex());
        this.p1Name = p1.getName();
        this.p1Team = ImmutableList.copyOf(loader.build(p1.getMembers(), format.getLevel()));
        this.p2Name = p2.getName();
        this.p2Team = ImmutableList.copyOf(loader.build(p2.getMembers(), format.getLevel()));
    }

    public FormatRules getFormat() {
        return format;
    }

    public String getP1Name() {
        return p1Name;
    }

    public String getP2Name() {
        return p2Name;
    }

    public List<Pokemon> getP1Team() {
        return p1Team;
    }

    public List<Pokemon> getP2Team() {
        return p2Team;
    }

    /** A battle at team preview, leads not yet sent out. */
    public BattleState prepare(String battleId, long seed) {
        return BattleFactory.create(battleId, format, p1Name, p1Team, p2Name, p2Team, seed);
    }

    /** A battle with both leads on the field, ready for the first turn. */
    public BattleState start(String battleId, long seed) {
        return engine.start(prepare(battleId, seed)).getNextState();
    }
}
