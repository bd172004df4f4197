package sampling.util;

import gnu.trove.list.array.TIntArrayList;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import sampling.restaurant.AbstractRestaurant;
import sampling.restaurant.RestaurantFactory;
import util.ConfigurationException;
import util.MismatchRuntimeException;
import util.StructuralInconsistencyException;

/**
 * Owns the context tree. Nodes live in an arena indexed by their id; ids of
 * pruned nodes are reused for new nodes. Every node holds one restaurant
 * created by the manager's factory.
 * <p>
 * The context of position i of a sequence starting at s is seq[s, i), read
 * backwards: the child of the root is keyed by seq[i - 1], its child by
 * seq[i - 2] and so on, down to depth min(maxDepth, i - s).
 */
public class NodeManager {

    private final RestaurantFactory factory;
    private final int maxDepth;
    private ArrayList<ContextNode> arena;
    private TIntArrayList freeIds;
    private int numNodes;

    public NodeManager(RestaurantFactory factory, int maxDepth) {
        if (factory == null) {
            throw new ConfigurationException("Restaurant factory must be specified");
        }
        if (maxDepth < 0) {
            throw new ConfigurationException("Negative maximum depth " + maxDepth);
        }
        this.factory = factory;
        this.maxDepth = maxDepth;
        this.clear();
    }

    public RestaurantFactory getFactory() {
        return this.factory;
    }

    public int getMaxDepth() {
        return this.maxDepth;
    }

    /**
     * Drop all nodes and start over with an empty root.
     */
    public final void clear() {
        this.arena = new ArrayList<ContextNode>();
        this.freeIds = new TIntArrayList();
        ContextNode root = new ContextNode(0, ContextNode.NO_PARENT, 0,
                ContextNode.ROOT_KEY, factory.create());
        this.arena.add(root);
        this.numNodes = 1;
    }

    public ContextNode getRoot() {
        return this.arena.get(0);
    }

    /**
     * @return The node with the given id, or null if the id is not in use
     */
    public ContextNode getNode(int id) {
        if (id < 0 || id >= this.arena.size()) {
            return null;
        }
        return this.arena.get(id);
    }

    public ContextNode getParent(ContextNode node) {
        if (node.isRoot()) {
            return null;
        }
        return this.arena.get(node.getParentId());
    }

    /**
     * Children of a node in ascending order of their keys.
     */
    public List<ContextNode> getChildren(ContextNode node) {
        ArrayList<ContextNode> children = new ArrayList<ContextNode>(node.getNumChildren());
        for (int key : node.getChildKeys()) {
            children.add(this.arena.get(node.getChildId(key)));
        }
        return children;
    }

    public int getNumNodes() {
        return this.numNodes;
    }

    /**
     * Depth of the node for the context seq[contextStart, contextEnd).
     */
    public int getContextDepth(int contextStart, int contextEnd) {
        if (contextEnd < contextStart) {
            throw new ConfigurationException("Invalid context [" + contextStart
                    + ", " + contextEnd + ")");
        }
        return Math.min(maxDepth, contextEnd - contextStart);
    }

    /**
     * Nodes from the root down to the node of the context seq[contextStart,
     * contextEnd). Missing nodes are created.
     */
    public List<ContextNode> resolvePath(int[] seq, int contextStart, int contextEnd) {
        int depth = getContextDepth(contextStart, contextEnd);
        ArrayList<ContextNode> path = new ArrayList<ContextNode>(depth + 1);
        ContextNode node = getRoot();
        path.add(node);
        for (int k = 1; k <= depth; k++) {
            int symbol = seq[contextEnd - k];
            int childId = node.getChildId(symbol);
            if (childId < 0) {
                node = createNode(node, symbol);
            } else {
                node = this.arena.get(childId);
            }
            path.add(node);
        }
        return path;
    }

    /**
     * Nodes from the root down to the deepest existing node on the path of
     * the context seq[contextStart, contextEnd). Nothing is created.
     */
    public List<ContextNode> findLongestSuffix(int[] seq, int contextStart, int contextEnd) {
        int depth = getContextDepth(contextStart, contextEnd);
        ArrayList<ContextNode> path = new ArrayList<ContextNode>(depth + 1);
        ContextNode node = getRoot();
        path.add(node);
        for (int k = 1; k <= depth; k++) {
            int childId = node.getChildId(seq[contextEnd - k]);
            if (childId < 0) {
                break;
            }
            node = this.arena.get(childId);
            path.add(node);
        }
        return path;
    }

    /**
     * @return The node of the context seq[contextStart, contextEnd), or null
     * if it has not been created
     */
    public ContextNode getNode(int[] seq, int contextStart, int contextEnd) {
        List<ContextNode> path = findLongestSuffix(seq, contextStart, contextEnd);
        if (path.size() - 1 != getContextDepth(contextStart, contextEnd)) {
            return null;
        }
        return path.get(path.size() - 1);
    }

    /**
     * Nodes from the root down to the given node.
     */
    public List<ContextNode> getPathToRoot(ContextNode node) {
        LinkedList<ContextNode> path = new LinkedList<ContextNode>();
        ContextNode curNode = node;
        while (curNode != null) {
            path.addFirst(curNode);
            curNode = getParent(curNode);
        }
        return new ArrayList<ContextNode>(path);
    }

    /**
     * All nodes in pre-order, visiting children in ascending order of their
     * keys.
     */
    public List<ContextNode> getNodesDFS() {
        ArrayList<ContextNode> nodes = new ArrayList<ContextNode>(numNodes);
        LinkedList<ContextNode> stack = new LinkedList<ContextNode>();
        stack.push(getRoot());
        while (!stack.isEmpty()) {
            ContextNode node = stack.pop();
            nodes.add(node);
            int[] keys = node.getChildKeys();
            for (int i = keys.length - 1; i >= 0; i--) {
                stack.push(this.arena.get(node.getChildId(keys[i])));
            }
        }
        return nodes;
    }

    /**
     * Remove, from the bottom of the path up, nodes whose restaurant is empty
     * and which have no children. The root is never removed.
     *
     * @return Number of nodes removed
     */
    public int pruneEmptyLeaves(List<ContextNode> path) {
        int numRemoved = 0;
        for (int i = path.size() - 1; i > 0; i--) {
            ContextNode node = path.get(i);
            if (!node.isLeaf() || !node.getRestaurant().isEmpty()) {
                break;
            }
            removeNode(node);
            numRemoved++;
        }
        return numRemoved;
    }

    private ContextNode createNode(ContextNode parent, int symbol) {
        return addNode(parent, symbol, factory.create());
    }

    private ContextNode addNode(ContextNode parent, int symbol, AbstractRestaurant restaurant) {
        if (parent.getDepth() >= maxDepth) {
            throw new StructuralInconsistencyException("Cannot add a child below node "
                    + parent.getId() + " at maximum depth " + maxDepth);
        }
        if (parent.hasChild(symbol)) {
            throw new StructuralInconsistencyException("Node " + parent.getId()
                    + " already has a child for symbol " + symbol);
        }
        int id;
        ContextNode node;
        if (this.freeIds.isEmpty()) {
            id = this.arena.size();
            node = new ContextNode(id, parent.getId(), parent.getDepth() + 1, symbol, restaurant);
            this.arena.add(node);
        } else {
            id = this.freeIds.removeAt(this.freeIds.size() - 1);
            node = new ContextNode(id, parent.getId(), parent.getDepth() + 1, symbol, restaurant);
            this.arena.set(id, node);
        }
        parent.addChild(symbol, id);
        this.numNodes++;
        return node;
    }

    private void removeNode(ContextNode node) {
        ContextNode parent = getParent(node);
        parent.removeChild(node.getKey());
        this.arena.set(node.getId(), null);
        this.freeIds.add(node.getId());
        this.numNodes--;
    }

    /**
     * Start rebuilding a tree: drop everything and make the given restaurant
     * the root's.
     */
    public ContextNode restoreRoot(AbstractRestaurant restaurant) {
        checkRestaurant(restaurant);
        clear();
        getRoot().setRestaurant(restaurant);
        return getRoot();
    }

    /**
     * Attach a node with the given restaurant under an existing node while
     * rebuilding a tree.
     */
    public ContextNode restoreNode(int parentId, int key, AbstractRestaurant restaurant) {
        checkRestaurant(restaurant);
        ContextNode parent = getNode(parentId);
        if (parent == null) {
            throw new StructuralInconsistencyException("Parent node " + parentId
                    + " does not exist");
        }
        if (key < 0) {
            throw new StructuralInconsistencyException("Invalid context symbol " + key);
        }
        return addNode(parent, key, restaurant);
    }

    private void checkRestaurant(AbstractRestaurant restaurant) {
        if (restaurant.getType() != factory.getType()) {
            throw new ConfigurationException("Expected a " + factory.getType()
                    + " restaurant. Got " + restaurant.getType());
        }
    }

    /**
     * Take over the nodes of another manager with the same configuration.
     * The other manager is left with an empty root.
     */
    public void adopt(NodeManager other) {
        if (other.factory.getType() != this.factory.getType()
                || other.maxDepth != this.maxDepth) {
            throw new ConfigurationException("Cannot adopt nodes of a differently "
                    + "configured node manager");
        }
        this.arena = other.arena;
        this.freeIds = other.freeIds;
        this.numNodes = other.numNodes;
        other.clear();
    }

    /**
     * Check the tree structure: parent links, depths and child maps agree.
     */
    public void validate(String msg) {
        int count = 0;
        for (ContextNode node : getNodesDFS()) {
            count++;
            if (node.isRoot()) {
                if (node.getId() != 0 || node.getDepth() != 0) {
                    throw new StructuralInconsistencyException(msg + ". Invalid root " + node);
                }
                continue;
            }
            ContextNode parent = getNode(node.getParentId());
            if (parent == null || parent.getChildId(node.getKey()) != node.getId()) {
                throw new StructuralInconsistencyException(msg
                        + ". Broken parent link at " + node);
            }
            if (node.getDepth() != parent.getDepth() + 1 || node.getDepth() > maxDepth) {
                throw new StructuralInconsistencyException(msg
                        + ". Invalid depth at " + node);
            }
        }
        if (count != numNodes) {
            throw new MismatchRuntimeException(msg + ". Number of nodes", count, numNodes);
        }
    }
}
