package pokeai.data;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;

public class TypeChartTest {

    @Test
    public void testSingleTypes() {
        Assert.assertEquals(TypeChart.effectiveness(PokemonType.WATER, PokemonType.FIRE), 2.0);
        Assert.assertEquals(TypeChart.effectiveness(PokemonType.FIRE, PokemonType.WATER), 0.5);
        Assert.assertEquals(TypeChart.effectiveness(PokemonType.NORMAL, PokemonType.GHOST), 0.0);
        Assert.assertEquals(TypeChart.effectiveness(PokemonType.DRAGON, PokemonType.FAIRY), 0.0);
        Assert.assertEquals(TypeChart.effectiveness(PokemonType.NORMAL, PokemonType.NORMAL), 1.0);
    }

    @Test
    public void testDualTypesMultiply() {
        Assert.assertEquals(TypeChart.effectiveness(PokemonType.ICE,
                Arrays.asList(PokemonType.DRAGON, PokemonType.GROUND)), 4.0);
        Assert.assertEquals(TypeChart.effectiveness(PokemonType.ROCK,
                Arrays.asList(PokemonType.GROUND, PokemonType.FIGHTING)), 0.25);
        Assert.assertEquals(TypeChart.effectiveness(PokemonType.GROUND,
                Arrays.asList(PokemonType.STEEL, PokemonType.FLYING)), 0.0);
    }

    @Test
    public void testMissingTypeIsNeutral() {
        Assert.assertEquals(TypeChart.effectiveness(null, PokemonType.STEEL), 1.0);
    }
}
