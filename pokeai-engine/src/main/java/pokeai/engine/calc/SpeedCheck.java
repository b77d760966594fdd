package pokeai.engine.calc;

/**
 * Who acts first between two Pokemon using moves of equal priority. {@code speedDiff} is the
 * ordering advantage: positive means "acts first", and under Trick Room the raw difference is
 * negated. Exact ties have no winner and are resolved by a random draw at resolution time.
 */
public final class SpeedCheck {
    private final int mySpeed;
    private final int theirSpeed;
    private final int speedDiff;
    private final boolean trickRoom;

    private SpeedCheck(int mySpeed, int theirSpeed, boolean trickRoom) {
        this.mySpeed = mySpeed;
        this.theirSpeed = theirSpeed;
        this.trickRoom = trickRoom;
        this.speedDiff = trickRoom ? theirSpeed - mySpeed : mySpeed - theirSpeed;
    }

    public static SpeedCheck compare(int mySpeed, int theirSpeed, boolean trickRoom) {
        return new SpeedCheck(mySpeed, theirSpeed, trickRoom);
    }

    public static SpeedCheck none() {
        return new SpeedCheck(0, 0, false);
    }

    public boolean isFaster() {
        return speedDiff > 0;
    }

    public boolean isSpeedTie() {
        return speedDiff == 0;
    }

    public int getSpeedDiff() {
        return speedDiff;
    }

    public int getMySpeed() {
        return mySpeed;
    }

    public int getTheirSpeed() {
        return theirSpeed;
    }

    public boolean isTrickRoom() {
        return trickRoom;
    }

    @Override
    public String toString() {
        return (isSpeedTie() ? "tie" : isFaster() ? "faster" : "slower") + " (" + mySpeed + " vs " + theirSpeed
                + (trickRoom ? ", trick room" : "") + ")";
    }
}
