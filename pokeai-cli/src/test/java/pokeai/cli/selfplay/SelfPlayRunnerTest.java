package pokeai.cli.selfplay;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import pokeai.cli.TestFiles;
import pokeai.engine.BattleEngine;
import pokeai.engine.action.BattleAction;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

public class SelfPlayRunnerTest {
    private static final BattleEngine ENGINE = new BattleEngine();

    private Path dir;

    @BeforeMethod
    public void setUp() throws IOException {
        dir = Files.createTempDirectory("pokeai-selfplay");
    }

    @AfterMethod(alwaysRun = true)
    public void tearDown() {
        TestFiles.deleteTree(dir);
    }

    private static SelfPlayRunner runner(ActionPolicy p1, ActionPolicy p2) {
        return new SelfPlayRunner(ENGINE, SelfPlayFixtures.matchup(ENGINE), p1, p2).withMaxTurns(30);
    }

    private static ActionPolicy failing() {
        return new ActionPolicy() {
            @Override
            public BattleAction choose(Decision decision) {
                throw new IllegalStateException("no model loaded");
            }

            @Override
            public String getName() {
                return "failing";
            }
        };
    }

    @Test
    public void testRunsAreReproducibleAcrossThreadCounts() throws InterruptedException {
        List<BattleRecord> single = runner(new GreedyPolicy(), new RandomPolicy()).run(3, 1, 11, null);
        List<BattleRecord> parallel = runner(new GreedyPolicy(), new RandomPolicy()).run(3, 3, 11, null);
        Assert.assertEquals(single.size(), 3);
        for (int i = 0; i < single.size(); i++) {
            BattleRecord a = single.get(i);
            BattleRecord b = parallel.get(i);
            Assert.assertEquals(a.getBattleNumber(), i + 1);
            Assert.assertEquals(a.getSeed(), 11L + i);
            Assert.assertEquals(b.getWinner(), a.getWinner());
            Assert.assertEquals(b.getTurns(), a.getTurns());
            Assert.assertEquals(b.getEndReason(), a.getEndReason());
            Assert.assertNotEquals(a.getEndReason(), BattleRecord.EndReason.ERROR, a.getError());
        }
    }

    @Test
    public void testCallbackSeesEveryBattle() throws InterruptedException {
        AtomicInteger finished = new AtomicInteger();
        runner(new RandomPolicy(), new RandomPolicy()).run(4, 2, 1, record -> finished.incrementAndGet());
        Assert.assertEquals(finished.get(), 4);
    }

    @Test
    public void testFailingPolicyFallsBackToSafeDefault() {
        BattleRecord record = runner(failing(), new GreedyPolicy()).playBattle(1, 5, null);
        Assert.assertNotEquals(record.getEndReason(), BattleRecord.EndReason.ERROR, record.getError());
        Assert.assertTrue(record.getDecisions() > 0);
        Assert.assertEquals(record.getFallbacks(), record.getDecisions() / 2);
    }

    @Test
    public void testSlowPolicyTimesOut() {
        ActionPolicy slow = new ActionPolicy() {
            @Override
            public BattleAction choose(Decision decision) {
                try {
                    Thread.sleep(2_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return decision.getCandidates().get(0);
            }

            @Override
            public String getName() {
                return "slow";
            }
        };
        ExecutorService pool = Executors.newCachedThreadPool();
        try {
            BattleRecord record = runner(slow, new RandomPolicy()).withMaxTurns(2).withDecisionTimeout(20)
                    .playBattle(1, 9, pool);
            Assert.assertEquals(record.getFallbacks(), record.getDecisions() / 2,
                    "Every p1 decision is replaced by the safe default");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void testTurnLimit() {
        BattleRecord record = runner(new RandomPolicy(), new RandomPolicy()).withMaxTurns(1).playBattle(1, 2, null);
        Assert.assertEquals(record.getEndReason(), BattleRecord.EndReason.TURN_LIMIT);
        Assert.assertEquals(record.p1Result(), 0.5);
    }

    @Test
    public void testTraceRecordsDecisionsAndOutcome() throws IOException {
        BattleRecord record = runner(new GreedyPolicy(), new GreedyPolicy()).withMaxTurns(3).withTraceDir(dir)
                .playBattle(1, 21, null);
        List<String> lines = Files.readAllLines(dir.resolve("battle_selfplay-21.jsonl"), StandardCharsets.UTF_8);
        Assert.assertEquals(lines.size(), record.getDecisions() + 1);

        JsonObject decision = JsonParser.parseString(lines.get(0)).getAsJsonObject();
        Assert.assertEquals(decision.get("type").getAsString(), "decision");
        Assert.assertEquals(decision.getAsJsonArray("state").size(), FeatureEncoder.STATE_SIZE);
        int options = decision.getAsJsonArray("options").size();
        Assert.assertEquals(decision.getAsJsonArray("optionFeatures").size(), options);
        int chosen = decision.get("chosenIndex").getAsInt();
        Assert.assertTrue(chosen >= 0 && chosen < options);

        JsonObject outcome = JsonParser.parseString(lines.get(lines.size() - 1)).getAsJsonObject();
        Assert.assertEquals(outcome.get("type").getAsString(), "outcome");
        Assert.assertEquals(outcome.get("reason").getAsString(), record.getEndReason().name());
    }
}
