package pokeai.engine;

import pokeai.data.Stat;
import pokeai.io.TeamLoader;
import pokeai.io.TeamSpec;
import pokeai.model.BattleState;
import pokeai.model.Pokemon;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Teams and battles shared by the engine tests. All battles use gen9ou at level 100.
 */
public final class BattleFixtures {
    public static final String FORMAT = "gen9ou";
    public static final BattleEngine ENGINE = new BattleEngine();

    private BattleFixtures() {
    }

    public static TeamSpec spec(String species, String item, String ability, String... moves) {
        return new TeamSpec(species, item, ability, Arrays.asList(moves));
    }

    public static List<Pokemon> team(TeamSpec... members) {
        return new TeamLoader(ENGINE.getDex()).build(new ArrayList<>(Arrays.asList(members)), 100);
    }

    public static TeamSpec dragapult() {
        return spec("Dragapult", null, "Clear Body", "Shadow Ball", "Draco Meteor", "Brave Bird", "U-turn");
    }

    public static TeamSpec garchomp() {
        return spec("Garchomp", null, "Rough Skin", "Earthquake", "Dragon Claw", "Stone Edge", "Swords Dance");
    }

    public static TeamSpec corviknight() {
        return spec("Corviknight", "Leftovers", "Pressure", "Roost", "Defog", "Brave Bird", "U-turn");
    }

    public static TeamSpec greatTusk() {
        return spec("Great Tusk", null, null, "Earthquake", "Close Combat", "Rapid Spin", "Stealth Rock");
    }

    public static BattleState prepared(List<Pokemon> p1, List<Pokemon> p2, long seed) {
        return BattleFactory.create("test-" + seed, ENGINE.format(FORMAT), "p1", p1, "p2", p2, seed);
    }

    /** Leads are out and turn 1 is next. */
    public static BattleState started(List<Pokemon> p1, List<Pokemon> p2, long seed) {
        return ENGINE.start(prepared(p1, p2, seed)).getNextState();
    }

    /** Dragapult vs Garchomp with bench partners, speeds fixed at 333 and 280. */
    public static BattleState dragapultVsGarchomp(long seed) {
        BattleState state = started(team(dragapult(), greatTusk()), team(garchomp(), corviknight()), seed);
        state.getP1().getActive().setStat(Stat.SPE, 333);
        state.getP2().getActive().setStat(Stat.SPE, 280);
        return state;
    }
}
