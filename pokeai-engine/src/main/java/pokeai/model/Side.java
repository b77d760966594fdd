package pokeai.model;

import pokeai.data.ScreenKind;
import pokeai.data.SideConditionKind;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;

/**
 * One player's half of the battle: team, active slot, hazards laid against it, its screens and
 * its side conditions.
 */
public class Side {
    private SideId id;
    private String name;
    private List<Pokemon> team = new ArrayList<>();
    private int activeIndex;
    private Hazards hazards = new Hazards();
    private EnumMap<ScreenKind, Integer> screens = new EnumMap<>(ScreenKind.class);
    private EnumMap<SideConditionKind, Integer> conditions = new EnumMap<>(SideConditionKind.class);
    private boolean teraUsed;
    private boolean megaUsed;
    private boolean zMoveUsed;
    private boolean dynamaxUsed;

    private Side() {
    }

    public Side(SideId id, String name, List<Pokemon> team) {
        this.id = id;
        this.name = name;
        this.team = new ArrayList<>(team);
    }

    public Side copy() {
        Side copy = new Side();
        copy.id = id;
        copy.name = name;
        copy.team = new ArrayList<>();
        for (Pokemon p : team) {
            copy.team.add(p.copy());
        }
        copy.activeIndex = activeIndex;
        copy.hazards = hazards.copy();
        copy.screens = new EnumMap<>(ScreenKind.class);
        copy.screens.putAll(screens);
        copy.conditions = new EnumMap<>(SideConditionKind.class);
        copy.conditions.putAll(conditions);
        copy.teraUsed = teraUsed;
        copy.megaUsed = megaUsed;
        copy.zMoveUsed = zMoveUsed;
        copy.dynamaxUsed = dynamaxUsed;
        return copy;
    }

    public SideId getId() {
        return id;
    }

    public String getName() {
        return name == null ? id.name().toLowerCase() : name;
    }

    public List<Pokemon> getTeam() {
        return team;
    }

    /** The active Pokemon, or null when the team is empty. It may be fainted during a forced switch. */
    public Pokemon getActive() {
        if (activeIndex < 0 || activeIndex >= team.size()) {
            return null;
        }
        return team.get(activeIndex);
    }

    public int getActiveIndex() {
        return activeIndex;
    }

    public void setActiveIndex(int activeIndex) {
        this.activeIndex = activeIndex;
    }

    /** Team slots other than the active one. */
    public List<Integer> benchSlots() {
        List<Integer> slots = new ArrayList<>();
        for (int i = 0; i < team.size(); i++) {
            if (i != activeIndex) {
                slots.add(i);
            }
        }
        return slots;
    }

    public boolean hasHealthyBench() {
        for (int slot : benchSlots()) {
            if (!team.get(slot).isFainted()) {
                return true;
            }
        }
        return false;
    }

    public boolean allFainted() {
        for (Pokemon p : team) {
            if (!p.isFainted()) {
                return false;
            }
        }
        return true;
    }

    /** The active has fainted and a replacement is available. */
    public boolean needsReplacement() {
        Pokemon active = getActive();
        return active != null && active.isFainted() && hasHealthyBench();
    }

    public Hazards getHazards() {
        return hazards;
    }

    public int screenTurns(ScreenKind kind) {
        Integer turns = screens.get(kind);
        return turns == null ? 0 : turns;
    }

    public boolean hasScreen(ScreenKind kind) {
        return screenTurns(kind) > 0;
    }

    public void setScreen(ScreenKind kind, int turns) {
        if (turns <= 0) {
            screens.remove(kind);
        } else {
            screens.put(kind, turns);
        }
    }

    public EnumMap<ScreenKind, Integer> getScreens() {
        return screens;
    }

    public int conditionTurns(SideConditionKind kind) {
        Integer turns = conditions.get(kind);
        return turns == null ? 0 : turns;
    }

    public boolean hasCondition(SideConditionKind kind) {
        return conditionTurns(kind) > 0;
    }

    public void setCondition(SideConditionKind kind, int turns) {
        if (turns <= 0) {
            conditions.remove(kind);
        } else {
            conditions.put(kind, turns);
        }
    }

    public EnumMap<SideConditionKind, Integer> getConditions() {
        return conditions;
    }

    public boolean isTeraUsed() {
        return teraUsed;
    }

    public void setTeraUsed(boolean teraUsed) {
        this.teraUsed = teraUsed;
    }

    public boolean isMegaUsed() {
        return megaUsed;
    }

    public void setMegaUsed(boolean megaUsed) {
        this.megaUsed = megaUsed;
    }

    public boolean isZMoveUsed() {
        return zMoveUsed;
    }

    public void setZMoveUsed(boolean zMoveUsed) {
        this.zMoveUsed = zMoveUsed;
    }

    public boolean isDynamaxUsed() {
        return dynamaxUsed;
    }

    public void setDynamaxUsed(boolean dynamaxUsed) {
        this.dynamaxUsed = dynamaxUsed;
    }

    @Override
    public String toString() {
        return getName() + ": " + getActive();
    }
}
