package pokeai.cli.selfplay;

import pokeai.data.HazardKind;
import pokeai.data.ScreenKind;
import pokeai.data.SideConditionKind;
import pokeai.data.Stat;
import pokeai.data.StatusCondition;
import pokeai.data.Terrain;
import pokeai.data.Weather;
import pokeai.engine.action.ActionVisitor;
import pokeai.engine.action.BattleAction;
import pokeai.engine.action.DynamaxAction;
import pokeai.engine.action.MegaAction;
import pokeai.engine.action.MoveAction;
import pokeai.engine.action.MoveBasedAction;
import pokeai.engine.action.PassAction;
import pokeai.engine.action.SwitchAction;
import pokeai.engine.action.TeraAction;
import pokeai.engine.action.ZMoveAction;
import pokeai.model.BattleState;
import pokeai.model.MoveSlot;
import pokeai.model.Pokemon;
import pokeai.model.Side;
import pokeai.model.SideId;

import java.util.List;

/**
 * Encodes a battle state into a fixed-size float vector from one side's point of view, for the
 * decision traces.
 *
 * Layout (total STATE_SIZE = 224):
 *   [0..15]    Global features (turn, weather, terrain, trick room, one-time flags)
 *   [16..23]   My side conditions
 *   [24..31]   Foe side conditions
 *   [32..127]  My team (6 slots x 16 features)
 *   [128..223] Foe team (6 slots x 16 features)
 */
public final class FeatureEncoder {

    public static final int GLOBAL_FEATURES = 16;
    public static final int SIDE_FEATURES = 8;
    public static final int TEAM_SLOTS = 6;
    public static final int POKEMON_FEATURES = 16;
    public static final int STATE_SIZE = GLOBAL_FEATURES + 2 * SIDE_FEATURES + 2 * TEAM_SLOTS * POKEMON_FEATURES;
    public static final int OPTION_FEATURES = 8;

    private static final int MY_SIDE_OFFSET = GLOBAL_FEATURES;
    private static final int FOE_SIDE_OFFSET = MY_SIDE_OFFSET + SIDE_FEATURES;
    private static final int MY_TEAM_OFFSET = FOE_SIDE_OFFSET + SIDE_FEATURES;
    private static final int FOE_TEAM_OFFSET = MY_TEAM_OFFSET + TEAM_SLOTS * POKEMON_FEATURES;

    private static final Stat[] BOOSTED = {Stat.ATK, Stat.DEF, Stat.SPA, Stat.SPD, Stat.SPE};
    private static final StatusCondition[] AILMENTS = {StatusCondition.BURN, StatusCondition.POISON,
            StatusCondition.TOXIC, StatusCondition.PARALYSIS, StatusCondition.SLEEP, StatusCondition.FREEZE};

    private FeatureEncoder() {
    }

    public static float[] encode(BattleState state, SideId perspective) {
        float[] features = new float[STATE_SIZE];
        Side me = state.getSide(perspective);
        Side foe = state.getSide(perspective.opponent());

        features[0] = Math.min(state.getTurn() / 50.0f, 1.0f);
        Weather weather = state.getField().getWeather();
        features[1 + (weather == null ? 0 : weather.ordinal())] = 1.0f;     // [1..6]
        Terrain terrain = state.getField().getTerrain();
        features[7 + (terrain == null ? 0 : terrain.ordinal())] = 1.0f;     // [7..11]
        features[12] = state.isTrickRoom() ? 1.0f : 0.0f;
        features[13] = me.isTeraUsed() ? 1.0f : 0.0f;
        features[14] = foe.isTeraUsed() ? 1.0f : 0.0f;
        features[15] = state.isAwaitingReplacement() ? 1.0f : 0.0f;

        encodeSide(features, MY_SIDE_OFFSET, me);
        encodeSide(features, FOE_SIDE_OFFSET, foe);
        encodeTeam(features, MY_TEAM_OFFSET, me, true);
        encodeTeam(features, FOE_TEAM_OFFSET, foe, false);
        return features;
    }

    private static void encodeSide(float[] features, int offset, Side side) {
        features[offset] = side.getHazards().layers(HazardKind.SPIKES) / 3.0f;
        features[offset + 1] = side.getHazards().layers(HazardKind.TOXIC_SPIKES) / 2.0f;
        features[offset + 2] = side.getHazards().has(HazardKind.STEALTH_ROCK) ? 1.0f : 0.0f;
        features[offset + 3] = side.getHazards().has(HazardKind.STICKY_WEB) ? 1.0f : 0.0f;
        features[offset + 4] = side.hasScreen(ScreenKind.REFLECT) ? 1.0f : 0.0f;
        features[offset + 5] = side.hasScreen(ScreenKind.LIGHT_SCREEN) ? 1.0f : 0.0f;
        features[offset + 6] = side.hasScreen(ScreenKind.AURORA_VEIL) ? 1.0f : 0.0f;
        features[offset + 7] = side.hasCondition(SideConditionKind.TAILWIND) ? 1.0f : 0.0f;
    }

    /** Unrevealed foe slots stay zero apart from the presence flag. */
    private static void encodeTeam(float[] features, int offset, Side side, boolean own) {
        List<Pokemon> team = side.getTeam();
        for (int slot = 0; slot < Math.min(team.size(), TEAM_SLOTS); slot++) {
            int base = offset + slot * POKEMON_FEATURES;
            Pokemon p = team.get(slot);
            features[base] = 1.0f;
            if (!own && !p.isRevealed() && slot != side.getActiveIndex()) {
                continue;
            }
            features[base + 1] = slot == side.getActiveIndex() ? 1.0f : 0.0f;
            features[base + 2] = (float) p.getHpFraction();
            features[base + 3] = p.isFainted() ? 1.0f : 0.0f;
            for (int i = 0; i < AILMENTS.length; i++) {
                features[base + 4 + i] = p.getStatus() == AILMENTS[i] ? 1.0f : 0.0f;   // [4..9]
            }
            for (int i = 0; i < BOOSTED.length; i++) {
                features[base + 10 + i] = p.getBoosts().get(BOOSTED[i]) / 6.0f;         // [10..14]
            }
            features[base + 15] = p.isTerastallized() ? 1.0f : 0.0f;
        }
    }

    /**
     * Encodes one candidate: the action kind one-hot in [0..6] and a kind-specific value in [7],
     * the remaining PP fraction of the move or the HP fraction of the switch target.
     */
    public static float[] encodeOption(BattleAction action, BattleState state, SideId side) {
        float[] features = new float[OPTION_FEATURES];
        features[action.accept(KIND)] = 1.0f;
        Side own = state.getSide(side);
        if (action instanceof SwitchAction) {
            int slot = ((SwitchAction) action).getSlot();
            if (slot >= 0 && slot < own.getTeam().size()) {
                features[7] = (float) own.getTeam().get(slot).getHpFraction();
            }
        } else if (action instanceof MoveBasedAction && own.getActive() != null) {
            MoveSlot move = own.getActive().findMove(((MoveBasedAction) action).getMoveId());
            if (move != null && move.getMaxPp() > 0) {
                features[7] = move.getPp() / (float) move.getMaxPp();
            }
        }
        return features;
    }

    private static final ActionVisitor<Integer> KIND = new ActionVisitor<Integer>() {
        @Override
        public Integer visitMove(MoveAction action) {
            return 0;
        }

        @Override
        public Integer visitSwitch(SwitchAction action) {
            return 1;
        }

        @Override
        public Integer visitTera(TeraAction action) {
            return 2;
        }

        @Override
        public Integer visitMega(MegaAction action) {
            return 3;
        }

        @Override
        public Integer visitZMove(ZMoveAction action) {
            return 4;
        }

        @Override
        public Integer visitDynamax(DynamaxAction action) {
            return 5;
        }

        @Override
        public Integer visitPass(PassAction action) {
            return 6;
        }
    };
}
