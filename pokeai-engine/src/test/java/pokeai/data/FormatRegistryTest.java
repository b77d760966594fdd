package pokeai.data;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

public class FormatRegistryTest {

    @Test
    public void testStandardFormats() {
        FormatRegistry formats = FormatRegistry.standard();
        FormatRules gen9 = formats.find("gen9ou");
        Assert.assertTrue(gen9.allowsTera());
        Assert.assertFalse(gen9.allowsMega());
        Assert.assertTrue(gen9.hasSleepClause());
        Assert.assertEquals(gen9.getLevel(), 100);

        FormatRules gen7 = formats.find("gen7ou");
        Assert.assertTrue(gen7.allowsMega());
        Assert.assertTrue(gen7.allowsZMove());
        Assert.assertFalse(gen7.allowsTera());

        Assert.assertTrue(formats.find("gen8anythinggoes").allowsDynamax());
        Assert.assertFalse(formats.find("gen8anythinggoes").hasSleepClause());
        Assert.assertNull(formats.find("gen3ou"));
        Assert.assertFalse(formats.isSupported(null));
    }

    @Test
    public void testLoadAssignsNormalizedIds() throws IOException {
        String json = "{\"Gen9 Custom\": {\"name\": \"Custom\", \"generation\": 9, \"tera\": true}}";
        FormatRegistry formats = FormatRegistry.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
        FormatRules custom = formats.find("gen9custom");
        Assert.assertEquals(custom.getId(), "gen9custom");
        Assert.assertEquals(custom.getGeneration(), 9);
        Assert.assertTrue(custom.hasSleepClause(), "Sleep clause is on unless a format turns it off");
    }
}
