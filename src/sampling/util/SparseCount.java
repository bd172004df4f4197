/*
 * To change this template, choose Tools | Templates
 * and open the template in the editor.
 */
package sampling.util;

import gnu.trove.map.hash.TIntIntHashMap;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Arrays;
import util.StructuralInconsistencyException;

/**
 * Sparse non-negative integer counts indexed by int keys, with a running sum.
 * Keys whose count drops to zero are removed.
 */
public class SparseCount implements Cloneable {

    private TIntIntHashMap counts;
    private int countSum;

    public SparseCount() {
        this.counts = new TIntIntHashMap();
        this.countSum = 0;
    }

    @Override
    public SparseCount clone() throws CloneNotSupportedException {
        SparseCount sc = (SparseCount) super.clone();
        sc.counts = new TIntIntHashMap(this.counts);
        return sc;
    }

    public void setCount(int observation, int count) {
        if (count < 0) {
            throw new StructuralInconsistencyException("Setting a negative count. "
                    + observation + ": " + count);
        }
        int curCount = this.getCount(observation);
        if (count == 0) {
            this.counts.remove(observation);
        } else {
            this.counts.put(observation, count);
        }
        this.countSum += count - curCount;
    }

    /**
     * Indices with positive counts, in ascending order.
     */
    public int[] getIndices() {
        int[] indices = this.counts.keys();
        Arrays.sort(indices);
        return indices;
    }

    public boolean containsIndex(int observation) {
        return this.counts.containsKey(observation);
    }

    public int size() {
        return this.counts.size();
    }

    public int getCountSum() {
        return this.countSum;
    }

    public int getCount(int observation) {
        // trove returns 0 for missing keys
        return this.counts.get(observation);
    }

    public void changeCount(int observation, int delta) {
        int count = getCount(observation);
        this.setCount(observation, count + delta);
    }

    public void increment(int observation) {
        this.counts.adjustOrPutValue(observation, 1, 1);
        this.countSum++;
    }

    public void decrement(int observation) {
        int count = this.counts.get(observation);
        if (count <= 0) {
            throw new StructuralInconsistencyException(
                    "Removing observation that does not exist " + observation);
        }
        if (count == 1) {
            this.counts.remove(observation);
        } else {
            this.counts.put(observation, count - 1);
        }
        this.countSum--;
    }

    public boolean isEmpty() {
        return this.countSum == 0;
    }

    @Override
    public String toString() {
        StringBuilder str = new StringBuilder();
        for (int obs : this.getIndices()) {
            str.append(obs).append(":").append(getCount(obs)).append(" ");
        }
        return str.toString().trim();
    }

    public void validate(String msg) {
        if (this.countSum < 0) {
            throw new StructuralInconsistencyException(msg + ". Negative countSum");
        }

        int totalCount = 0;
        for (int obs : this.counts.keys()) {
            int count = this.counts.get(obs);
            if (count <= 0) {
                throw new StructuralInconsistencyException(msg
                        + ". Non-positive count stored for " + obs);
            }
            totalCount += count;
        }
        if (totalCount != this.countSum) {
            throw new StructuralInconsistencyException(msg + ". Total counts mismatched. "
                    + totalCount + " vs. " + countSum);
        }
    }

    /**
     * Writes the number of entries followed by (index, count) pairs in
     * ascending index order.
     */
    public static void output(SparseCount sc, DataOutputStream out) throws IOException {
        int[] indices = sc.getIndices();
        out.writeInt(indices.length);
        for (int obs : indices) {
            out.writeInt(obs);
            out.writeInt(sc.getCount(obs));
        }
    }

    public static SparseCount input(DataInputStream in) throws IOException {
        SparseCount sc = new SparseCount();
        int size = in.readInt();
        if (size < 0) {
            throw new IOException("Negative number of entries " + size);
        }
        for (int i = 0; i < size; i++) {
            int obs = in.readInt();
            int count = in.readInt();
            if (count <= 0 || sc.containsIndex(obs)) {
                throw new IOException("Invalid entry " + obs + ":" + count);
            }
            sc.setCount(obs, count);
        }
        return sc;
    }
}
