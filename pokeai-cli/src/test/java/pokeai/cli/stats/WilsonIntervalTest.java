package pokeai.cli.stats;

import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class WilsonIntervalTest {

    @DataProvider
    public Object[][] samples() {
        return new Object[][]{
                {0, 10},
                {10, 10},
                {5, 10},
                {1, 1},
                {523, 1000},
        };
    }

    @Test(dataProvider = "samples")
    public void testIntervalContainsRateAndStaysInBounds(int wins, int total) {
        double[] ci = WilsonInterval.calculate95(wins, total);
        double rate = 100.0 * wins / total;
        Assert.assertTrue(ci[0] >= 0.0 && ci[1] <= 100.0, ci[0] + ", " + ci[1]);
        Assert.assertTrue(ci[0] <= rate + 1e-9 && rate <= ci[1] + 1e-9, rate + " outside " + ci[0] + ", " + ci[1]);
    }

    @Test
    public void testKnownValue() {
        double[] ci = WilsonInterval.calculate95(50, 100);
        Assert.assertEquals(ci[0], 40.38, 0.01);
        Assert.assertEquals(ci[1], 59.62, 0.01);
    }

    @Test
    public void testNarrowsWithMoreBattles() {
        double[] small = WilsonInterval.calculate95(5, 10);
        double[] large = WilsonInterval.calculate95(500, 1000);
        Assert.assertTrue(large[1] - large[0] < small[1] - small[0]);
    }

    @Test
    public void testNoBattlesIsUninformative() {
        Assert.assertEquals(WilsonInterval.calculate95(0, 0), new double[]{0.0, 100.0});
    }

    @Test
    public void testFormat() {
        Assert.assertEquals(WilsonInterval.format(52.3, new double[]{45.1, 59.4}), "52.3% [45.1%, 59.4%]");
    }
}
