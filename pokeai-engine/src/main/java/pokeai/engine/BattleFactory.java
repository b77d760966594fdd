package pokeai.engine;

import org.apache.commons.lang3.Validate;
import pokeai.data.FormatRules;
import pokeai.model.BattleState;
import pokeai.model.Pokemon;
import pokeai.model.Side;
import pokeai.model.SideId;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds fresh battle states. The first member of each team leads.
 */
public final class BattleFactory {

    private BattleFactory() {}

    public static BattleState create(String battleId, FormatRules format, String p1Name, List<Pokemon> p1Team,
                                     String p2Name, List<Pokemon> p2Team, long seed) {
        Validate.notNull(format, "format is required");
        Side p1 = side(SideId.P1, p1Name, p1Team);
        Side p2 = side(SideId.P2, p2Name, p2Team);
        BattleState state = new BattleState(battleId, format.getId(), p1, p2, seed);
        Invariants.check(state);
        return state;
    }

    private static Side side(SideId id, String name, List<Pokemon> team) {
        Validate.isTrue(team != null && !team.isEmpty() && team.size() <= 6,
                "%s needs 1 to 6 team members", id);
        List<Pokemon> copies = new ArrayList<>(team.size());
        for (Pokemon p : team) {
            copies.add(p.copy());
        }
        return new Side(id, name == null ? id.name().toLowerCase() : name, copies);
    }
}
