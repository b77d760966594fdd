package pokeai.cli.json;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON output model for self-play runs, serialized with Gson.
 */
public class SelfPlayResult {
    /** PokeAI version string */
    public String version;

    public SelfPlayConfig config;

    public SelfPlaySummary summary;

    public List<BattleResult> battles = new ArrayList<>();

    public static class SelfPlayConfig {
        public String format;
        public List<String> teams = new ArrayList<>();
        public List<String> policies = new ArrayList<>();
        public int battlesRequested;
        public int threads;
        public long seed;
        public long decisionTimeoutMs;
        public int maxTurns;
        public String traceDir;
    }

    public static class SelfPlaySummary {
        public int totalBattles;
        public int completedBattles;
        public int ties;
        public int turnLimits;
        public int errors;
        public long totalTimeMs;
        public double averageBattleTimeMs;
        public double averageTurns;
        public int fallbackDecisions;
        public List<SideSummary> sides = new ArrayList<>();
    }

    public static class SideSummary {
        public String side;
        public String team;
        public String policy;
        public int wins;
        public int losses;
        public double winRate;
        public double winRateLower;
        public double winRateUpper;
    }

    public static class BattleResult {
        public int battleNumber;
        public long seed;
        public String winner;
        public String endReason;
        public int turns;
        public long durationMs;
        public int decisions;
        public int fallbacks;
        public String error;
    }
}
