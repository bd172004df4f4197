package sampling.util;

import gnu.trove.list.array.TIntArrayList;
import java.util.Random;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class StirlingTableTest {

    private static final double EPS = 1e-9;

    private static void assertLogEquals(double expected, double actual, String msg) {
        if (Double.isInfinite(expected)) {
            assertEquals(expected, actual, msg);
        } else {
            assertEquals(expected, actual, EPS * Math.max(1.0, Math.abs(expected)), msg);
        }
    }

    @Test
    public void testUnsignedStirlingNumbersOfTheFirstKind() {
        StirlingTable table = new StirlingTable(0.0);
        assertEquals(0.0, table.getLog(0, 0), EPS);
        assertEquals(Math.log(1), table.getLog(1, 1), EPS);
        assertEquals(Math.log(2), table.getLog(3, 1), EPS);
        assertEquals(Math.log(3), table.getLog(3, 2), EPS);
        assertEquals(Math.log(11), table.getLog(4, 2), EPS);
        assertEquals(Math.log(35), table.getLog(5, 3), EPS);
        assertEquals(Math.log(120), table.getLog(6, 1), EPS);
        assertEquals(0.0, table.getLog(7, 7), EPS);
    }

    @Test
    public void testDiscountedValues() {
        StirlingTable table = new StirlingTable(0.5);
        assertEquals(Math.log(0.5), table.getLog(2, 1), EPS);
        assertEquals(Math.log(0.75), table.getLog(3, 1), EPS);
        assertEquals(Math.log(1.5), table.getLog(3, 2), EPS);
        assertEquals(0.0, table.getLog(3, 3), EPS);
    }

    @Test
    public void testZeroEntries() {
        StirlingTable table = new StirlingTable(0.3);
        assertEquals(Double.NEGATIVE_INFINITY, table.getLog(3, 0));
        assertEquals(Double.NEGATIVE_INFINITY, table.getLog(2, 3));
        assertEquals(Double.NEGATIVE_INFINITY, table.getLog(-1, 0));
    }

    @Test
    public void testGrowthKeepsEarlierRows() {
        StirlingTable table = new StirlingTable(0.0);
        double small = table.getLog(4, 2);
        double large = table.getLog(500, 250);
        assertTrue(Double.isFinite(large));
        assertEquals(small, table.getLog(4, 2), 0.0);
    }

    @Test
    public void testNewTableRatio() {
        StirlingTable table = new StirlingTable(0.0);
        // S(3, 1) / S(4, 2) = 2 / 11
        assertEquals(Math.log(2.0 / 11.0), table.getLogNewTableRatio(4, 2), EPS);
        assertEquals(0.0, table.getLogNewTableRatio(3, 3), EPS);
    }

    @Test
    public void testSharedTables() {
        assertSame(StirlingTable.getShared(0.25), StirlingTable.getShared(0.25));
        assertEquals(0.25, StirlingTable.getShared(0.25).getDiscount(), 0.0);
    }

    @Test
    public void testInvalidDiscount() {
        assertThrows(IllegalArgumentException.class, () -> new StirlingTable(1.0));
        assertThrows(IllegalArgumentException.class, () -> new StirlingTable(-0.1));
    }

    @Test
    public void testSampledTableSizesAreConsistent() {
        StirlingTable table = new StirlingTable(0.6);
        Random rand = new Random(11);
        for (int c = 1; c <= 12; c++) {
            for (int t = 1; t <= c; t++) {
                TIntArrayList sizes = table.sampleTableSizes(c, t, rand);
                assertEquals(t, sizes.size());
                assertEquals(c, sizes.sum());
                for (int k = 0; k < sizes.size(); k++) {
                    assertTrue(sizes.get(k) > 0);
                }
            }
        }
    }

    @Test
    public void testSampledTableSizesFollowConditionalDistribution() {
        // with d = 0, 4 customers at 2 tables: 8 arrangements of sizes {3, 1}
        // and 3 of sizes {2, 2}
        StirlingTable table = new StirlingTable(0.0);
        Random rand = new Random(123);
        int numSamples = 20000;
        int numEven = 0;
        for (int s = 0; s < numSamples; s++) {
            TIntArrayList sizes = table.sampleTableSizes(4, 2, rand);
            if (sizes.get(0) == 2) {
                numEven++;
            }
        }
        assertEquals(3.0 / 11.0, (double) numEven / numSamples, 0.02);
    }

    @Test
    public void testRowsPastTheCacheAgreeWithCachedRows() {
        StirlingTable cached = new StirlingTable(0.4);
        StirlingTable small = new StirlingTable(0.4, 8);
        assertEquals(8, small.getMaxCachedRows());
        for (int n = 0; n <= 40; n++) {
            for (int t = 0; t <= n + 1; t++) {
                assertLogEquals(cached.getLog(n, t), small.getLog(n, t), "S(" + n + ", " + t + ")");
            }
        }
        for (int c = 1; c <= 40; c++) {
            for (int t = 1; t <= c; t++) {
                assertEquals(cached.getLogNewTableRatio(c, t), small.getLogNewTableRatio(c, t), 1e-9);
            }
        }

        double[] row = small.getLogRow(30, 5);
        assertEquals(6, row.length);
        for (int t = 0; t <= 5; t++) {
            assertLogEquals(cached.getLog(30, t), row[t], "S(30, " + t + ")");
        }
        double[] column = small.getLogColumn(3, 2, 25);
        assertEquals(24, column.length);
        for (int n = 2; n <= 25; n++) {
            assertLogEquals(cached.getLog(n, 3), column[n - 2], "S(" + n + ", 3)");
        }
    }

    @Test
    public void testValuesInOnePass() {
        StirlingTable cached = new StirlingTable(0.7);
        StirlingTable uncached = new StirlingTable(0.7, 2);
        int[] cs = {30, 3, 0, 12, 30, 5, 4};
        int[] ts = {4, 1, 0, 12, 30, 6, 0};
        double[] values = uncached.getLogValues(cs, ts);
        for (int i = 0; i < cs.length; i++) {
            assertLogEquals(cached.getLog(cs[i], ts[i]), values[i],
                    "S(" + cs[i] + ", " + ts[i] + ")");
        }
        assertThrows(IllegalArgumentException.class,
                () -> uncached.getLogValues(new int[]{1}, new int[]{1, 1}));
    }

    @Test
    public void testLargeCountsStayWithinMemory() {
        StirlingTable table = new StirlingTable(0.62);
        // far more customers than cached rows, with few tables
        double value = table.getLog(20000, 400);
        assertTrue(Double.isFinite(value));
        double ratio = table.getLogNewTableRatio(20000, 400);
        assertTrue(ratio < 0 && Double.isFinite(ratio));
        assertEquals(Double.NEGATIVE_INFINITY, table.getLog(20000, 20001));
    }

    @Test
    public void testSampledTableSizesPastTheCache() {
        // same distribution as with a full cache: {2, 2} with probability 3/11
        StirlingTable table = new StirlingTable(0.0, 2);
        Random rand = new Random(321);
        int numSamples = 20000;
        int numEven = 0;
        for (int s = 0; s < numSamples; s++) {
            TIntArrayList sizes = table.sampleTableSizes(4, 2, rand);
            assertEquals(4, sizes.sum());
            if (sizes.get(0) == 2) {
                numEven++;
            }
        }
        assertEquals(3.0 / 11.0, (double) numEven / numSamples, 0.02);

        TIntArrayList sizes = new StirlingTable(0.5, 16).sampleTableSizes(300, 20, rand);
        assertEquals(20, sizes.size());
        assertEquals(300, sizes.sum());
    }
}
