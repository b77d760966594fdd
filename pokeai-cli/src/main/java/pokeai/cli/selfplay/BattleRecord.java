package pokeai.cli.selfplay;

import pokeai.model.SideId;

/**
 * How one self-play battle ended.
 */
public class BattleRecord {

    public enum EndReason {
        WIN,
        TIE,
        TURN_LIMIT,
        ERROR
    }

    private final int battleNumber;
    private final long seed;
    private final SideId winner;
    private final EndReason endReason;
    private final int turns;
    private final long durationMs;
    private final int decisions;
    private final int fallbacks;
    private final String error;

    public BattleRecord(int battleNumber, long seed, SideId winner, EndReason endReason, int turns,
                        long durationMs, int decisions, int fallbacks, String error) {
        this.battleNumber = battleNumber;
        this.seed = seed;
        this.winner = winner;
        this.endReason = endReason;
        this.turns = turns;
        this.durationMs = durationMs;
        this.decisions = decisions;
        this.fallbacks = fallbacks;
        this.error = error;
    }

    public int getBattleNumber() {
        return battleNumber;
    }

    public long getSeed() {
        return seed;
    }

    /** Null unless a side won. */
    public SideId getWinner() {
        return winner;
    }

    public EndReason getEndReason() {
        return endReason;
    }

    public int getTurns() {
        return turns;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public int getDecisions() {
        return decisions;
    }

    /** Decisions that timed out or failed and took the safe default. */
    public int getFallbacks() {
        return fallbacks;
    }

    public String getError() {
        return error;
    }

    /** The outcome from p1's point of view: 1 win, 0 loss, 0.5 otherwise. */
    public double p1Result() {
        if (winner == SideId.P1) {
            return 1.0;
        }
        return winner == SideId.P2 ? 0.0 : 0.5;
    }
}
