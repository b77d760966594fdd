package pokeai.model;

public enum SideId {
    P1,
    P2;

    public SideId opponent() {
        return this == P1 ? P2 : P1;
    }

    public static SideId parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Side must be p1 or p2");
        }
        switch (value.trim().toLowerCase()) {
            case "p1":
                return P1;
            case "p2":
                return P2;
            default:
                throw new IllegalArgumentException("Side must be p1 or p2, got: " + value);
        }
    }
}
