package pokeai.model;

public class MoveSlot {
    private String moveId;
    private int pp;
    private int maxPp;

    private MoveSlot() {
    }

    public MoveSlot(String moveId, int maxPp) {
        this(moveId, maxPp, maxPp);
    }

    public MoveSlot(String moveId, int pp, int maxPp) {
        this.moveId = moveId;
        this.pp = pp;
        this.maxPp = maxPp;
    }

    public MoveSlot copy() {
        return new MoveSlot(moveId, pp, maxPp);
    }

    public String getMoveId() {
        return moveId;
    }

    public int getPp() {
        return pp;
    }

    public int getMaxPp() {
        return maxPp;
    }

    public boolean hasPp() {
        return pp > 0;
    }

    public void deductPp(int amount) {
        pp = Math.max(0, pp - amount);
    }
}
