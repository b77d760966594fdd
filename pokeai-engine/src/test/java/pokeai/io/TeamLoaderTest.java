package pokeai.io;

import com.google.gson.JsonParseException;
import org.testng.Assert;
import org.testng.annotations.Test;
import pokeai.data.Dex;
import pokeai.data.PokemonType;
import pokeai.data.Stat;
import pokeai.engine.error.MissingEntityException;
import pokeai.model.Pokemon;

import java.io.StringReader;
import java.util.Arrays;
import java.util.Collections;

public class TeamLoaderTest {
    private final TeamLoader loader = new TeamLoader(Dex.standard());

    @Test
    public void testReadArrayDocument() {
        TeamLoader.Team team = TeamLoader.read(new StringReader(
                "[{\"species\": \"Garchomp\", \"moves\": [\"Earthquake\"]}]"), "fallback");
        Assert.assertEquals(team.getName(), "fallback");
        Assert.assertEquals(team.getMembers().size(), 1);
        Assert.assertEquals(team.getMembers().get(0).getSpecies(), "Garchomp");
    }

    @Test
    public void testReadObjectDocument() {
        TeamLoader.Team team = TeamLoader.read(new StringReader(
                "{\"name\": \"Sand\", \"team\": [{\"species\": \"Tyranitar\", \"moves\": [\"Stone Edge\"]}]}"), "x");
        Assert.assertEquals(team.getName(), "Sand");
    }

    @Test(expectedExceptions = JsonParseException.class)
    public void testRejectsOtherDocuments() {
        TeamLoader.read(new StringReader("{\"species\": \"Garchomp\"}"), "x");
    }

    @Test
    public void testDefaultsFillTheGaps() {
        Pokemon garchomp = loader.build(new TeamSpec("Garchomp", null, null, Arrays.asList("Earthquake")), 100);
        Assert.assertEquals(garchomp.getSpecies(), "garchomp");
        Assert.assertEquals(garchomp.getLevel(), 100);
        Assert.assertEquals(garchomp.getAbility(), "sandveil", "First listed ability is the default");
        Assert.assertNull(garchomp.getItem());
        Assert.assertEquals(garchomp.getTera().getType(), PokemonType.DRAGON);
        Assert.assertTrue(garchomp.isFullHp());
        Assert.assertEquals(garchomp.getMoves().get(0).getMoveId(), "earthquake");
    }

    @Test
    public void testSpreadChangesStats() {
        Pokemon plain = loader.build(new TeamSpec("Garchomp", null, null, Arrays.asList("Earthquake")), 100);
        Pokemon invested = loader.build(new TeamSpec("Garchomp", null, null, Arrays.asList("Earthquake"))
                .withEvs(Collections.singletonMap("spe", 252)).withNature("Jolly"), 100);
        Assert.assertTrue(invested.getStat(Stat.SPE) > plain.getStat(Stat.SPE));
        Assert.assertTrue(invested.getStat(Stat.SPA) < plain.getStat(Stat.SPA), "Jolly lowers special attack");
    }

    @Test(expectedExceptions = MissingEntityException.class)
    public void testUnknownSpecies() {
        loader.build(new TeamSpec("Missingno", null, null, Arrays.asList("Earthquake")), 100);
    }

    @Test(expectedExceptions = MissingEntityException.class)
    public void testUnknownMove() {
        loader.build(new TeamSpec("Garchomp", null, null, Arrays.asList("Hyper Beam Deluxe")), 100);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testEvOutOfRange() {
        loader.build(new TeamSpec("Garchomp", null, null, Arrays.asList("Earthquake"))
                .withEvs(Collections.singletonMap("atk", 300)), 100);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testTooManyMembers() {
        TeamSpec spec = new TeamSpec("Garchomp", null, null, Arrays.asList("Earthquake"));
        loader.build(Arrays.asList(spec, spec, spec, spec, spec, spec, spec), 100);
    }
}
