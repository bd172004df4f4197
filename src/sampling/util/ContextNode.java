package sampling.util;

import gnu.trove.map.hash.TIntIntHashMap;
import java.util.Arrays;
import sampling.restaurant.AbstractRestaurant;
import util.StructuralInconsistencyException;

/**
 * Node of the context tree. A node at depth k stands for a context of k
 * symbols; its key is the symbol that extends the parent's context one step
 * further back in time.
 * <p>
 * Nodes are owned by a {@link NodeManager} and refer to their parent and
 * children by arena id only.
 */
public class ContextNode {

    public static final int NO_PARENT = -1;
    public static final int ROOT_KEY = -1;
    private final int id;
    private final int parentId;
    private final int depth;
    private final int key;
    private final TIntIntHashMap children; // context symbol -> child id
    private AbstractRestaurant restaurant;

    ContextNode(int id, int parentId, int depth, int key, AbstractRestaurant restaurant) {
        this.id = id;
        this.parentId = parentId;
        this.depth = depth;
        this.key = key;
        this.children = new TIntIntHashMap();
        this.restaurant = restaurant;
    }

    public int getId() {
        return this.id;
    }

    public int getParentId() {
        return this.parentId;
    }

    public int getDepth() {
        return this.depth;
    }

    public int getKey() {
        return this.key;
    }

    public boolean isRoot() {
        return this.parentId == NO_PARENT;
    }

    public AbstractRestaurant getRestaurant() {
        return this.restaurant;
    }

    void setRestaurant(AbstractRestaurant restaurant) {
        this.restaurant = restaurant;
    }

    public int getNumChildren() {
        return this.children.size();
    }

    public boolean isLeaf() {
        return this.children.isEmpty();
    }

    public boolean hasChild(int symbol) {
        return this.children.containsKey(symbol);
    }

    /**
     * @return Id of the child for the given symbol, or -1 if there is none
     */
    public int getChildId(int symbol) {
        if (!this.children.containsKey(symbol)) {
            return -1;
        }
        return this.children.get(symbol);
    }

    /**
     * Symbols of the children, in ascending order.
     */
    public int[] getChildKeys() {
        int[] keys = this.children.keys();
        Arrays.sort(keys);
        return keys;
    }

    void addChild(int symbol, int childId) {
        if (this.children.containsKey(symbol)) {
            throw new StructuralInconsistencyException("Node " + id
                    + " already has a child for symbol " + symbol);
        }
        this.children.put(symbol, childId);
    }

    void removeChild(int symbol) {
        this.children.remove(symbol);
    }

    @Override
    public String toString() {
        return "[" + id + ", depth " + depth + ", key " + key
                + ", #children " + children.size() + "]";
    }
}
