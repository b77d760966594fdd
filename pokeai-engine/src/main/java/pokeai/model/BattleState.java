package pokeai.model;

import pokeai.data.SideConditionKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;

/**
 * Complete state of one battle. The engine never mutates a state it was handed; advancing works on
 * {@link #copy()}.
 */
public class BattleState {
    private String id;
    private String format;
    private int turn;
    private BattlePhase phase = BattlePhase.PREPARATION;
    private Side p1;
    private Side p2;
    private Field field = new Field();
    private List<BattleEvent> log = new ArrayList<>();
    private EnumMap<SideId, String> lastActions = new EnumMap<>(SideId.class);
    private SideId winner;
    private long rngState;

    private BattleState() {
    }

    public BattleState(String id, String format, Side p1, Side p2, long seed) {
        this.id = id;
        this.format = format;
        this.p1 = p1;
        this.p2 = p2;
        this.rngState = seed;
    }

    public BattleState copy() {
        BattleState copy = new BattleState();
        copy.id = id;
        copy.format = format;
        copy.turn = turn;
        copy.phase = phase;
        copy.p1 = p1.copy();
        copy.p2 = p2.copy();
        copy.field = field.copy();
        copy.log = new ArrayList<>(log);
        copy.lastActions = new EnumMap<>(SideId.class);
        copy.lastActions.putAll(lastActions);
        copy.winner = winner;
        copy.rngState = rngState;
        return copy;
    }

    public String getId() {
        return id;
    }

    public String getFormat() {
        return format;
    }

    public int getTurn() {
        return turn;
    }

    public void setTurn(int turn) {
        this.turn = turn;
    }

    public BattlePhase getPhase() {
        return phase;
    }

    public void setPhase(BattlePhase phase) {
        this.phase = phase;
    }

    public boolean isFinished() {
        return phase == BattlePhase.FINISHED;
    }

    public Side getSide(SideId sideId) {
        return sideId == SideId.P1 ? p1 : p2;
    }

    public Side getP1() {
        return p1;
    }

    public Side getP2() {
        return p2;
    }

    public Field getField() {
        return field;
    }

    /** Room effects are stored on the side that set them and act on both sides. */
    public boolean isFieldConditionActive(SideConditionKind kind) {
        return p1.hasCondition(kind) || p2.hasCondition(kind);
    }

    public boolean isTrickRoom() {
        return isFieldConditionActive(SideConditionKind.TRICK_ROOM);
    }

    public List<BattleEvent> getLog() {
        return Collections.unmodifiableList(log);
    }

    public void appendLog(List<BattleEvent> events) {
        log.addAll(events);
    }

    public String getLastAction(SideId side) {
        return lastActions.get(side);
    }

    public void setLastAction(SideId side, String action) {
        lastActions.put(side, action);
    }

    public SideId getWinner() {
        return winner;
    }

    public void setWinner(SideId winner) {
        this.winner = winner;
    }

    public long getRngState() {
        return rngState;
    }

    public void setRngState(long rngState) {
        this.rngState = rngState;
    }

    /** Either active is fainted with a replacement available. */
    public boolean isAwaitingReplacement() {
        return p1.needsReplacement() || p2.needsReplacement();
    }

    @Override
    public String toString() {
        return "Battle " + id + " turn " + turn + " " + phase + " | " + p1 + " | " + p2;
    }
}
