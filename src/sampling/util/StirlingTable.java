package sampling.util;

import gnu.trove.list.array.TIntArrayList;
import java.util.Arrays;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import util.StatisticsUtils;

/**
 * Log generalized Stirling numbers S_d(n, t) for a fixed discount d, defined by
 * <pre>
 * S_d(0, 0) = 1, S_d(n, 0) = 0 for n > 0, S_d(n, t) = 0 for t > n,
 * S_d(n + 1, t) = S_d(n, t - 1) + (n - d t) S_d(n, t).
 * </pre>
 * S_d(c, t) is the total weight of all seatings of c customers at t tables of
 * a Pitman-Yor restaurant with discount d.
 * <p>
 * Rows up to a fixed number of customers are computed lazily and cached; they
 * never change once computed. Growing the cache is synchronized, reading rows
 * that already exist is not. Rows past the cache are computed on demand from
 * the last cached row, truncated to the largest number of tables asked for.
 */
public class StirlingTable {

    public static final int MAX_CACHED_ROWS = 1024;
    private static final int INIT_ROWS = 64;
    private static final int MAX_SHARED_TABLES = 256;
    private static final ConcurrentHashMap<Double, StirlingTable> shared =
            new ConcurrentHashMap<Double, StirlingTable>();

    private final double discount;
    private final int maxCachedRows;
    private volatile double[][] rows;
    private volatile int numRows;

    public StirlingTable(double discount) {
        this(discount, MAX_CACHED_ROWS);
    }

    /**
     * @param discount Discount d in [0, 1)
     * @param maxCachedRows Number of rows S_d(0..maxCachedRows - 1, .) kept
     * in memory
     */
    public StirlingTable(double discount, int maxCachedRows) {
        if (discount < 0 || discount >= 1) {
            throw new IllegalArgumentException("Discount out of range " + discount);
        }
        if (maxCachedRows < 2) {
            throw new IllegalArgumentException("At least 2 cached rows are needed. Got "
                    + maxCachedRows);
        }
        this.discount = discount;
        this.maxCachedRows = maxCachedRows;
        this.rows = new double[Math.min(INIT_ROWS, maxCachedRows)][];
        this.rows[0] = new double[]{0.0};
        this.numRows = 1;
    }

    /**
     * Process-wide table for the given discount, created on first request.
     */
    public static StirlingTable getShared(double discount) {
        StirlingTable table = shared.get(discount);
        if (table != null) {
            return table;
        }
        if (shared.size() > MAX_SHARED_TABLES) {
            // stale discounts from earlier hyperparameter samples
            shared.clear();
        }
        table = new StirlingTable(discount);
        StirlingTable existing = shared.putIfAbsent(discount, table);
        return existing == null ? table : existing;
    }

    public double getDiscount() {
        return this.discount;
    }

    public int getMaxCachedRows() {
        return this.maxCachedRows;
    }

    /**
     * @return log S_d(n, t), negative infinity where S_d(n, t) = 0
     */
    public double getLog(int n, int t) {
        if (n < 0 || t < 0 || t > n) {
            return StatisticsUtils.LOG_ZERO;
        }
        if (t == 0) {
            return n == 0 ? 0.0 : StatisticsUtils.LOG_ZERO;
        }
        if (n < this.maxCachedRows) {
            return getCachedRow(n)[t];
        }
        return getLogRow(n, t)[t];
    }

    /**
     * log S_d(n, 0..maxT). Entries with more tables than customers are
     * negative infinity.
     */
    public double[] getLogRow(int n, int maxT) {
        if (n < 0 || maxT < 0) {
            throw new IllegalArgumentException("Invalid row " + n + " up to " + maxT);
        }
        double[] row = new double[maxT + 1];
        if (n < this.maxCachedRows) {
            double[] cached = getCachedRow(n);
            for (int t = 0; t <= maxT; t++) {
                row[t] = t <= n ? cached[t] : StatisticsUtils.LOG_ZERO;
            }
            return row;
        }
        row = getLogRow(this.maxCachedRows - 1, maxT);
        double[] next = new double[maxT + 1];
        for (int m = this.maxCachedRows; m <= n; m++) {
            fillRow(row, m, next);
            double[] tmp = row;
            row = next;
            next = tmp;
        }
        return row;
    }

    /**
     * log S_d(n, t) for n = fromN..toN and a fixed t.
     */
    public double[] getLogColumn(int t, int fromN, int toN) {
        if (fromN < 0 || toN < fromN) {
            throw new IllegalArgumentException("Invalid range [" + fromN + ", " + toN + "]");
        }
        double[] column = new double[toN - fromN + 1];
        int n = fromN;
        for (; n <= toN && n < this.maxCachedRows; n++) {
            column[n - fromN] = getLog(n, t);
        }
        if (n <= toN) {
            double[] row = getLogRow(n - 1, t);
            double[] next = new double[t + 1];
            for (; n <= toN; n++) {
                fillRow(row, n, next);
                column[n - fromN] = next[t];
                double[] tmp = row;
                row = next;
                next = tmp;
            }
        }
        return column;
    }

    /**
     * log S_d(cs[i], ts[i]) for every i, computed in a single pass over the
     * rows. Rows past the cache are only kept up to the largest t.
     */
    public double[] getLogValues(int[] cs, int[] ts) {
        if (cs.length != ts.length) {
            throw new IllegalArgumentException("Got " + cs.length + " customer counts and "
                    + ts.length + " table counts");
        }
        int maxT = 0;
        long[] order = new long[cs.length]; // (c, index), sorted by c
        for (int i = 0; i < cs.length; i++) {
            maxT = Math.max(maxT, ts[i]);
            order[i] = ((long) Math.max(cs[i], 0) << 32) | i;
        }
        Arrays.sort(order);

        double[] values = new double[cs.length];
        double[] row = null;
        double[] next = null;
        int rowN = -1;
        for (long key : order) {
            int i = (int) (key & 0xffffffffL);
            int c = cs[i];
            int t = ts[i];
            if (c < this.maxCachedRows || t < 0 || t > c) {
                values[i] = getLog(c, t);
                continue;
            }
            if (row == null) {
                rowN = this.maxCachedRows - 1;
                row = getLogRow(rowN, maxT);
                next = new double[maxT + 1];
            }
            while (rowN < c) {
                rowN++;
                fillRow(row, rowN, next);
                double[] tmp = row;
                row = next;
                next = tmp;
            }
            values[i] = row[t];
        }
        return values;
    }

    /**
     * Log probability that, in a restaurant with c customers at t tables, the
     * last customer to arrive sits alone.
     */
    public double getLogNewTableRatio(int c, int t) {
        if (c < this.maxCachedRows) {
            return getLog(c - 1, t - 1) - getLog(c, t);
        }
        return logNewTableRatio(getLogRow(c - 1, t), c, t);
    }

    /**
     * log S_d(c - 1, t - 1) - log S_d(c, t) from row c - 1.
     */
    private double logNewTableRatio(double[] prev, int c, int t) {
        double joined = t <= c - 1
                ? Math.log((c - 1) - discount * t) + prev[t] : StatisticsUtils.LOG_ZERO;
        return prev[t - 1] - StatisticsUtils.logAdd(prev[t - 1], joined);
    }

    /**
     * Row m of the recurrence from row m - 1, up to the length of row.
     */
    private void fillRow(double[] prev, int m, double[] row) {
        row[0] = StatisticsUtils.LOG_ZERO;
        for (int t = 1; t < row.length; t++) {
            if (t > m) {
                row[t] = StatisticsUtils.LOG_ZERO;
                continue;
            }
            double alone = t - 1 < prev.length ? prev[t - 1] : StatisticsUtils.LOG_ZERO;
            double joined = StatisticsUtils.LOG_ZERO;
            if (t <= m - 1 && t < prev.length) {
                joined = Math.log((m - 1) - discount * t) + prev[t];
            }
            row[t] = StatisticsUtils.logAdd(alone, joined);
        }
    }

    private double[] getCachedRow(int n) {
        if (n >= this.numRows) {
            grow(n);
        }
        return this.rows[n];
    }

    private synchronized void grow(int n) {
        int curNumRows = this.numRows;
        if (n < curNumRows) {
            return;
        }
        double[][] curRows = this.rows;
        if (n >= curRows.length) {
            int capacity = curRows.length;
            while (capacity <= n) {
                capacity *= 2;
            }
            double[][] newRows = new double[Math.min(capacity, maxCachedRows)][];
            System.arraycopy(curRows, 0, newRows, 0, curNumRows);
            curRows = newRows;
        }
        for (int m = curNumRows; m <= n; m++) {
            double[] row = new double[m + 1];
            fillRow(curRows[m - 1], m, row);
            curRows[m] = row;
        }
        this.rows = curRows;
        this.numRows = n + 1;
    }

    /**
     * Draws table sizes for c customers at exactly t tables from their
     * conditional distribution given (c, t). Customers are peeled off in
     * reverse arrival order to decide which of them opened a table, then the
     * arrivals are replayed with joins weighted by (size - d).
     *
     * @param c Number of customers
     * @param t Number of tables
     * @param rand Random source
     * @return Table sizes, one entry per table
     */
    public TIntArrayList sampleTableSizes(int c, int t, Random rand) {
        if (t < 1 || t > c) {
            throw new IllegalArgumentException("Cannot seat " + c + " customers at "
                    + t + " tables");
        }
        // rows c - 1 down to the last cached one, truncated to t tables
        int blockStart = this.maxCachedRows - 1;
        double[][] block = null;
        if (c > blockStart) {
            block = new double[c - blockStart][];
            block[0] = getLogRow(blockStart, t);
            for (int m = blockStart + 1; m < c; m++) {
                block[m - blockStart] = new double[t + 1];
                fillRow(block[m - blockStart - 1], m, block[m - blockStart]);
            }
        }

        boolean[] opensTable = new boolean[c];
        int n = c;
        int k = t;
        while (n > 0) {
            if (k == n) {
                for (int i = 0; i < n; i++) {
                    opensTable[i] = true;
                }
                break;
            }
            double logRatio = n - 1 >= blockStart && block != null
                    ? logNewTableRatio(block[n - 1 - blockStart], n, k)
                    : getLogNewTableRatio(n, k);
            double probNew = Math.exp(logRatio);
            if (rand.nextDouble() < probNew) {
                opensTable[n - 1] = true;
                k--;
            }
            n--;
        }

        TIntArrayList sizes = new TIntArrayList(t);
        int seated = 0;
        for (int i = 0; i < c; i++) {
            if (opensTable[i]) {
                sizes.add(1);
            } else {
                double u = rand.nextDouble() * (seated - discount * sizes.size());
                int idx = 0;
                double cumm = sizes.get(0) - discount;
                while (cumm <= u && idx < sizes.size() - 1) {
                    idx++;
                    cumm += sizes.get(idx) - discount;
                }
                sizes.set(idx, sizes.get(idx) + 1);
            }
            seated++;
        }
        return sizes;
    }
}
