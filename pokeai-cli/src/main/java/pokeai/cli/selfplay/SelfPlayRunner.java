package pokeai.cli.selfplay;

import org.apache.commons.lang3.time.StopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pokeai.engine.AdvanceRequest;
import pokeai.engine.BattleEngine;
import pokeai.engine.action.BattleAction;
import pokeai.model.BattleState;
import pokeai.model.SideId;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Plays seeded battles between two policies on a fixed thread pool, one battle per task. Each
 * battle owns its state and random sources; the engine and matchup are shared read-only.
 * <p>
 * With a decision timeout, every policy call runs against the clock and an overdue or failing
 * policy is replaced by {@link SafeDefault} for that decision.
 */
public class SelfPlayRunner {
    private static final Logger log = LoggerFactory.getLogger(SelfPlayRunner.class);

    private final BattleEngine engine;
    private final Matchup matchup;
    private final ActionPolicy p1Policy;
    private final ActionPolicy p2Policy;
    private long decisionTimeoutMs;
    private int maxTurns = 500;
    private Path traceDir;

    public SelfPlayRunner(BattleEngine engine, Matchup matchup, ActionPolicy p1Policy, ActionPolicy p2Policy) {
        this.engine = engine;
        this.matchup = matchup;
        this.p1Policy = p1Policy;
        this.p2Policy = p2Policy;
    }

    /** Zero or less disables the clock. */
    public SelfPlayRunner withDecisionTimeout(long millis) {
        this.decisionTimeoutMs = millis;
        return this;
    }

    public SelfPlayRunner withMaxTurns(int maxTurns) {
        this.maxTurns = maxTurns;
        return this;
    }

    /** Null disables traces. */
    public SelfPlayRunner withTraceDir(Path traceDir) {
        this.traceDir = traceDir;
        return this;
    }

    /**
     * Battle {@code i} is seeded with {@code seed + i}, so a run is reproducible whatever the
     * thread count, as long as no decision times out.
     *
     * @param onFinished called from worker threads as battles complete
     * @return one record per battle, ordered by battle number
     */
    public List<BattleRecord> run(int battles, int threads, long seed, Consumer<BattleRecord> onFinished)
            throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, threads));
        ExecutorService decisionPool = decisionTimeoutMs > 0 ? Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "pokeai-decision");
            t.setDaemon(true);
            return t;
        }) : null;
        List<BattleRecord> records = Collections.synchronizedList(new ArrayList<>());
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < battles; i++) {
                final int battleNumber = i + 1;
                final long battleSeed = seed + i;
                futures.add(executor.submit(() -> {
                    BattleRecord record = playBattle(battleNumber, battleSeed, decisionPool);
                    records.add(record);
                    if (onFinished != null) {
                        onFinished.accept(record);
                    }
                }));
            }
            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    log.error("Self-play task failed", e.getCause());
                }
            }
        } finally {
            executor.shutdownNow();
            if (decisionPool != null) {
                decisionPool.shutdownNow();
            }
        }
        List<BattleRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparingInt(BattleRecord::getBattleNumber));
        return sorted;
    }

    /**
     * Plays one battle to the end, the turn limit, or the first engine error.
     */
    public BattleRecord playBattle(int battleNumber, long seed, ExecutorService decisionPool) {
        String battleId = "selfplay-" + seed;
        StopWatch sw = StopWatch.createStarted();
        Random p1Random = new Random(seed * 31);
        Random p2Random = new Random(seed * 31 + 1);
        int decisions = 0;
        int fallbacks = 0;
        int turns = 0;
        TraceWriter trace = traceDir == null ? null : new TraceWriter(traceDir, battleId);
        String format = matchup.getFormat().getId();
        try {
            BattleState state = matchup.start(battleId, seed);
            int steps = 0;
            while (!state.isFinished() && state.getTurn() < maxTurns && steps < 2 * maxTurns) {
                Choice c1 = decide(p1Policy, new Decision(engine, format, state, SideId.P1,
                        engine.enabledActions(format, state, SideId.P1), p1Random), decisionPool, trace);
                Choice c2 = decide(p2Policy, new Decision(engine, format, state, SideId.P2,
                        engine.enabledActions(format, state, SideId.P2), p2Random), decisionPool, trace);
                decisions += 2;
                fallbacks += (c1.fallback ? 1 : 0) + (c2.fallback ? 1 : 0);
                state = engine.advance(new AdvanceRequest(format, state, c1.action, c2.action)).getNextState();
                steps++;
            }
            turns = state.getTurn();
            BattleRecord.EndReason reason;
            if (!state.isFinished()) {
                reason = BattleRecord.EndReason.TURN_LIMIT;
            } else {
                reason = state.getWinner() == null ? BattleRecord.EndReason.TIE : BattleRecord.EndReason.WIN;
            }
            BattleRecord record = new BattleRecord(battleNumber, seed, state.getWinner(), reason, turns,
                    sw.getTime(), decisions, fallbacks, null);
            if (trace != null) {
                trace.recordOutcome(record.p1Result(), turns, reason.name());
            }
            log.debug("Battle {} ended: {} {} after {} turns", battleId, reason, state.getWinner(), turns);
            return record;
        } catch (RuntimeException e) {
            log.warn("Battle {} aborted: {}", battleId, e.getMessage());
            if (trace != null) {
                trace.recordOutcome(0.5, turns, BattleRecord.EndReason.ERROR.name());
            }
            return new BattleRecord(battleNumber, seed, null, BattleRecord.EndReason.ERROR, turns, sw.getTime(),
                    decisions, fallbacks, e.getMessage());
        } finally {
            if (trace != null) {
                trace.close();
            }
        }
    }

    private Choice decide(ActionPolicy policy, Decision decision, ExecutorService decisionPool, TraceWriter trace) {
        List<BattleAction> candidates = decision.getCandidates();
        BattleAction action = null;
        if (decisionPool == null) {
            try {
                action = policy.choose(decision);
            } catch (RuntimeException e) {
                log.warn("Policy {} failed for {}: {}", policy.getName(), decision.getSide(), e.getMessage());
            }
        } else {
            Future<BattleAction> future = decisionPool.submit(() -> policy.choose(decision));
            try {
                action = future.get(decisionTimeoutMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                log.debug("Policy {} exceeded {} ms for {}", policy.getName(), decisionTimeoutMs, decision.getSide());
            } catch (ExecutionException e) {
                log.warn("Policy {} failed for {}: {}", policy.getName(), decision.getSide(),
                        e.getCause().getMessage());
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
            }
        }
        boolean fallback = action == null || !candidates.contains(action);
        if (fallback) {
            action = SafeDefault.choose(candidates);
        }
        if (trace != null) {
            record(trace, policy, decision, action, fallback);
        }
        return new Choice(action, fallback);
    }

    private static void record(TraceWriter trace, ActionPolicy policy, Decision decision, BattleAction chosen,
                               boolean fallback) {
        List<BattleAction> candidates = decision.getCandidates();
        List<String> options = new ArrayList<>(candidates.size());
        float[][] optionFeatures = new float[candidates.size()][];
        for (int i = 0; i < candidates.size(); i++) {
            options.add(candidates.get(i).notation());
            optionFeatures[i] = FeatureEncoder.encodeOption(candidates.get(i), decision.getState(), decision.getSide());
        }
        trace.recordDecision(decision.getState().getTurn(), decision.getSide().name(), policy.getName(),
                FeatureEncoder.encode(decision.getState(), decision.getSide()), options, optionFeatures,
                candidates.indexOf(chosen), fallback);
    }

    private static final class Choice {
        final BattleAction action;
        final boolean fallback;

        Choice(BattleAction action, boolean fallback) {
            this.action = action;
            this.fallback = fallback;
        }
    }
}
