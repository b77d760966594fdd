package pokeai.data;

import com.google.common.base.Joiner;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Mechanics switches of one battle format.
 */
public class FormatRules {
    private String id;
    private String name;
    private int generation;
    private int level = 100;
    private boolean tera;
    private boolean mega;
    private boolean zMove;
    private boolean dynamax;
    private boolean sleepClause = true;

    public FormatRules() {
    }

    void assignId(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name == null ? id : name;
    }

    public int getGeneration() {
        return generation;
    }

    public int getLevel() {
        return level;
    }

    public boolean allowsTera() {
        return tera;
    }

    public boolean allowsMega() {
        return mega;
    }

    public boolean allowsZMove() {
        return zMove;
    }

    public boolean allowsDynamax() {
        return dynamax;
    }

    public boolean hasSleepClause() {
        return sleepClause;
    }

    /** Stable hash of the rule switches; recorded in traces so runs under changed rules are told apart. */
    public String fingerprint() {
        String canonical = Joiner.on('|').join(id, generation, level, tera, mega, zMove, dynamax, sleepClause);
        return Hashing.sha256().hashString(canonical, StandardCharsets.UTF_8).toString().substring(0, 16);
    }

    @Override
    public String toString() {
        return getId();
    }
}
