package sampling.util;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import org.junit.jupiter.api.Test;
import util.StructuralInconsistencyException;

import static org.junit.jupiter.api.Assertions.*;

public class SparseCountTest {

    @Test
    public void testCounts() {
        SparseCount sc = new SparseCount();
        assertTrue(sc.isEmpty());
        sc.increment(3);
        sc.increment(3);
        sc.increment(1);
        sc.changeCount(7, 4);
        assertEquals(2, sc.getCount(3));
        assertEquals(0, sc.getCount(2));
        assertEquals(7, sc.getCountSum());
        assertArrayEquals(new int[]{1, 3, 7}, sc.getIndices());

        sc.decrement(1);
        assertFalse(sc.containsIndex(1));
        sc.setCount(7, 0);
        assertEquals(1, sc.size());
        assertEquals(2, sc.getCountSum());
        sc.validate("Counts");
        assertEquals("3:2", sc.toString());
    }

    @Test
    public void testInvalidChanges() {
        SparseCount sc = new SparseCount();
        assertThrows(StructuralInconsistencyException.class, () -> sc.decrement(0));
        assertThrows(StructuralInconsistencyException.class, () -> sc.setCount(0, -1));
    }

    @Test
    public void testCloneIsIndependent() throws Exception {
        SparseCount sc = new SparseCount();
        sc.increment(2);
        SparseCount copy = sc.clone();
        copy.increment(2);
        assertEquals(1, sc.getCount(2));
        assertEquals(2, copy.getCount(2));
    }

    @Test
    public void testInputRejectsRepeatedIndices() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        out.writeInt(2);
        out.writeInt(5);
        out.writeInt(1);
        out.writeInt(5);
        out.writeInt(2);
        out.flush();
        DataInputStream in = new DataInputStream(new ByteArrayInputStream(bytes.toByteArray()));
        assertThrows(IOException.class, () -> SparseCount.input(in));
    }

    @Test
    public void testOutputInput() throws IOException {
        SparseCount sc = new SparseCount();
        sc.changeCount(9, 3);
        sc.changeCount(0, 1);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        SparseCount.output(sc, new DataOutputStream(bytes));
        SparseCount copy = SparseCount.input(
                new DataInputStream(new ByteArrayInputStream(bytes.toByteArray())));
        assertEquals(sc.toString(), copy.toString());
        assertEquals(4, copy.getCountSum());
    }
}
