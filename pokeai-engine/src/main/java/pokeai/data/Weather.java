package pokeai.data;

public enum Weather {
    NONE,
    SUN,
    RAIN,
    SAND,
    HAIL,
    SNOW;

    public boolean isHailOrSnow() {
        return this == HAIL || this == SNOW;
    }
}
