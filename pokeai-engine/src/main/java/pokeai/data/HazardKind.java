package pokeai.data;

public enum HazardKind {
    STEALTH_ROCK(1),
    SPIKES(3),
    TOXIC_SPIKES(2),
    STICKY_WEB(1);

    private final int maxLayers;

    HazardKind(int maxLayers) {
        this.maxLayers = maxLayers;
    }

    public int getMaxLayers() {
        return maxLayers;
    }
}
