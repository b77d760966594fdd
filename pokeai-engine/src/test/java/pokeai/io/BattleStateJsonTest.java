package pokeai.io;

import com.google.gson.JsonParseException;
import org.testng.Assert;
import org.testng.annotations.Test;
import pokeai.data.VolatileKind;
import pokeai.engine.AdvanceRequest;
import pokeai.engine.AdvanceResult;
import pokeai.engine.BattleFixtures;
import pokeai.engine.action.BattleAction;
import pokeai.model.BattleState;
import pokeai.model.VolatileState;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static pokeai.engine.BattleFixtures.ENGINE;
import static pokeai.engine.BattleFixtures.FORMAT;

public class BattleStateJsonTest {

    private static AdvanceResult turn(BattleState state) {
        return ENGINE.advance(new AdvanceRequest(FORMAT, state,
                BattleAction.parse("move dracometeor"), BattleAction.parse("move stoneedge")));
    }

    @Test
    public void testPersistedStateResumesIdentically() {
        BattleState state = BattleFixtures.dragapultVsGarchomp(31);
        state = turn(state).getNextState();

        BattleState restored = BattleStateJson.fromJson(BattleStateJson.toJson(state));
        Assert.assertEquals(restored.getRngState(), state.getRngState());
        Assert.assertEquals(restored.getTurn(), state.getTurn());
        Assert.assertEquals(BattleStateJson.toCompactJson(restored), BattleStateJson.toCompactJson(state));

        AdvanceResult fromOriginal = turn(state);
        AdvanceResult fromRestored = turn(restored);
        Assert.assertEquals(fromRestored.getEvents().toString(), fromOriginal.getEvents().toString());
        Assert.assertEquals(BattleStateJson.toCompactJson(fromRestored.getNextState()),
                BattleStateJson.toCompactJson(fromOriginal.getNextState()));
    }

    @Test
    public void testVolatilesAndFieldSurvive() throws IOException {
        BattleState state = BattleFixtures.dragapultVsGarchomp(32);
        state.getP1().getActive().getVolatiles().add(new VolatileState(VolatileKind.ENCORE, 2).withMove("shadowball"));
        state.getP2().getActive().getVolatiles().add(new VolatileState(VolatileKind.SUBSTITUTE, -1).withCounter(40));

        Path file = Files.createTempFile("battle", ".json");
        try {
            BattleStateJson.write(state, file);
            BattleState restored = BattleStateJson.read(file);
            VolatileState encore = restored.getP1().getActive().getVolatiles().get(VolatileKind.ENCORE);
            Assert.assertEquals(encore.getTurnsLeft(), 2);
            Assert.assertEquals(encore.getMoveId(), "shadowball");
            Assert.assertEquals(restored.getP2().getActive().getVolatiles().get(VolatileKind.SUBSTITUTE).getCounter(), 40);
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test(expectedExceptions = JsonParseException.class)
    public void testDocumentWithoutSidesIsRejected() {
        BattleStateJson.fromJson("{\"id\": \"x\", \"format\": \"gen9ou\"}");
    }
}
