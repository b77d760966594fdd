package pokeai.model;

/**
 * One sub-effect applied while advancing a battle. Events are appended to the battle log and
 * returned from each advance.
 */
public class BattleEvent {
    private int turn;
    private EventType type;
    private SideId side;
    private String pokemon;
    private String detail;
    private int amount;

    private BattleEvent() {
    }

    public BattleEvent(int turn, EventType type, SideId side, String pokemon, String detail, int amount) {
        this.turn = turn;
        this.type = type;
        this.side = side;
        this.pokemon = pokemon;
        this.detail = detail;
        this.amount = amount;
    }

    public int getTurn() {
        return turn;
    }

    public EventType getType() {
        return type;
    }

    public SideId getSide() {
        return side;
    }

    public String getPokemon() {
        return pokemon;
    }

    public String getDetail() {
        return detail;
    }

    /** HP delta, stage delta or layer count, depending on the type. */
    public int getAmount() {
        return amount;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(turn).append("] ").append(type);
        if (side != null) {
            sb.append(' ').append(side.name().toLowerCase());
        }
        if (pokemon != null) {
            sb.append(' ').append(pokemon);
        }
        if (detail != null) {
            sb.append(": ").append(detail);
        }
        if (amount != 0) {
            sb.append(" (").append(amount).append(')');
        }
        return sb.toString();
    }
}
