package sampling.util;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import sampling.restaurant.AbstractRestaurant;
import sampling.restaurant.RestaurantFactory;
import sampling.restaurant.RestaurantType;
import util.ConfigurationException;
import util.StructuralInconsistencyException;

import static org.junit.jupiter.api.Assertions.*;

public class NodeManagerTest {

    private static final int[] SEQ = {0, 1, 2, 1, 2, 0};
    private RestaurantFactory factory;
    private NodeManager nodeManager;

    @BeforeEach
    public void setUp() {
        factory = new RestaurantFactory(RestaurantType.FULL);
        nodeManager = new NodeManager(factory, 2);
    }

    @Test
    public void testFreshTreeHasOnlyRoot() {
        assertEquals(1, nodeManager.getNumNodes());
        ContextNode root = nodeManager.getRoot();
        assertTrue(root.isRoot());
        assertTrue(root.isLeaf());
        assertEquals(0, root.getDepth());
        assertNull(nodeManager.getParent(root));
        assertTrue(root.getRestaurant().isEmpty());
        assertSame(RestaurantType.FULL, root.getRestaurant().getType());
    }

    @Test
    public void testInvalidConfiguration() {
        assertThrows(ConfigurationException.class, () -> new NodeManager(factory, -1));
        assertThrows(ConfigurationException.class, () -> new NodeManager(null, 2));
        assertThrows(ConfigurationException.class, () -> new RestaurantFactory(null));
    }

    @Test
    public void testResolvePathReadsContextBackwards() {
        // context of position 4 is [0, 1, 2, 1], so the path is 1 then 2
        List<ContextNode> path = nodeManager.resolvePath(SEQ, 0, 4);
        assertEquals(3, path.size());
        assertTrue(path.get(0).isRoot());
        assertEquals(1, path.get(1).getKey());
        assertEquals(2, path.get(2).getKey());
        assertEquals(2, path.get(2).getDepth());
        assertEquals(3, nodeManager.getNumNodes());

        // shorter contexts stop early
        assertEquals(1, nodeManager.resolvePath(SEQ, 0, 0).size());
        assertEquals(2, nodeManager.resolvePath(SEQ, 3, 4).size());
        assertEquals(3, nodeManager.getNumNodes());

        // resolving again creates nothing
        List<ContextNode> again = nodeManager.resolvePath(SEQ, 0, 4);
        assertSame(path.get(2), again.get(2));
        nodeManager.validate("Resolved");
    }

    @Test
    public void testContextDepth() {
        assertEquals(0, nodeManager.getContextDepth(3, 3));
        assertEquals(1, nodeManager.getContextDepth(2, 3));
        assertEquals(2, nodeManager.getContextDepth(0, 5));
        assertThrows(ConfigurationException.class, () -> nodeManager.getContextDepth(4, 3));
    }

    @Test
    public void testLongestSuffixCreatesNothing() {
        nodeManager.resolvePath(SEQ, 2, 3);
        List<ContextNode> path = nodeManager.findLongestSuffix(SEQ, 0, 3);
        // node [2] exists, node [2, 1] does not
        assertEquals(2, path.size());
        assertEquals(2, path.get(1).getKey());
        assertEquals(2, nodeManager.getNumNodes());

        assertNull(nodeManager.getNode(SEQ, 0, 3));
        assertSame(path.get(1), nodeManager.getNode(SEQ, 2, 3));
        assertSame(nodeManager.getRoot(), nodeManager.getNode(SEQ, 0, 0));
    }

    @Test
    public void testDepthFirstOrder() {
        nodeManager.resolvePath(SEQ, 0, 4);
        nodeManager.resolvePath(SEQ, 0, 2);
        nodeManager.resolvePath(SEQ, 0, 3);
        nodeManager.resolvePath(SEQ, 0, 1);
        List<ContextNode> nodes = nodeManager.getNodesDFS();
        assertEquals(nodeManager.getNumNodes(), nodes.size());
        assertTrue(nodes.get(0).isRoot());
        // children of the root in key order, each followed by its subtree
        int[] expectedKeys = {ContextNode.ROOT_KEY, 0, 1, 0, 2, 2, 1};
        int[] expectedDepths = {0, 1, 1, 2, 2, 1, 2};
        assertEquals(expectedKeys.length, nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            assertEquals(expectedKeys[i], nodes.get(i).getKey(), "Node " + i);
            assertEquals(expectedDepths[i], nodes.get(i).getDepth(), "Node " + i);
        }
        assertArrayEquals(new int[]{0, 1, 2}, nodeManager.getRoot().getChildKeys());
    }

    @Test
    public void testPathToRoot() {
        List<ContextNode> path = nodeManager.resolvePath(SEQ, 0, 5);
        assertEquals(path, nodeManager.getPathToRoot(path.get(path.size() - 1)));
    }

    @Test
    public void testPruneRemovesOnlyEmptyLeaves() {
        List<ContextNode> longPath = nodeManager.resolvePath(SEQ, 0, 4);
        List<ContextNode> shortPath = nodeManager.resolvePath(SEQ, 3, 4);
        AbstractRestaurant middle = shortPath.get(1).getRestaurant();
        middle.addCustomer(0, 0.5, 0.5, 1.0, 1.0);

        // the leaf [1, 2] is empty and goes; [1] has a customer and stays
        assertEquals(1, nodeManager.pruneEmptyLeaves(longPath));
        assertEquals(2, nodeManager.getNumNodes());
        assertSame(shortPath.get(1), nodeManager.getNode(SEQ, 3, 4));

        middle.removeCustomer(0, 0.5, 1.0);
        assertEquals(1, nodeManager.pruneEmptyLeaves(shortPath));
        assertEquals(1, nodeManager.getNumNodes());

        // the root stays even when empty
        assertEquals(0, nodeManager.pruneEmptyLeaves(nodeManager.findLongestSuffix(SEQ, 0, 4)));
        assertEquals(1, nodeManager.getNumNodes());
        nodeManager.validate("Pruned");
    }

    @Test
    public void testPruneKeepsInnerNodes() {
        nodeManager.resolvePath(SEQ, 0, 4);
        List<ContextNode> shortPath = nodeManager.resolvePath(SEQ, 3, 4);
        // [1] is empty but still has the child [1, 2]
        assertEquals(0, nodeManager.pruneEmptyLeaves(shortPath));
        assertEquals(3, nodeManager.getNumNodes());
    }

    @Test
    public void testIdsOfPrunedNodesAreReused() {
        List<ContextNode> path = nodeManager.resolvePath(SEQ, 0, 4);
        int leafId = path.get(2).getId();
        nodeManager.pruneEmptyLeaves(path);
        assertNull(nodeManager.getNode(leafId));
        List<ContextNode> other = nodeManager.resolvePath(SEQ, 0, 1);
        assertEquals(2, nodeManager.getNumNodes());
        assertTrue(other.get(1).getId() <= leafId);
        nodeManager.validate("Reused");
    }

    @Test
    public void testRestore() {
        AbstractRestaurant rootRestaurant = factory.create();
        rootRestaurant.addCustomer(1, 0.5, 0.5, 1.0, 1.0);
        ContextNode root = nodeManager.restoreRoot(rootRestaurant);
        ContextNode child = nodeManager.restoreNode(root.getId(), 2, factory.create());
        nodeManager.restoreNode(child.getId(), 0, factory.create());
        assertEquals(3, nodeManager.getNumNodes());
        assertSame(rootRestaurant, nodeManager.getRoot().getRestaurant());
        assertEquals(child.getId(), nodeManager.getRoot().getChildId(2));

        ContextNode leaf = nodeManager.getNode(new int[]{0, 2}, 0, 2);
        assertNotNull(leaf);
        assertThrows(StructuralInconsistencyException.class,
                () -> nodeManager.restoreNode(leaf.getId(), 1, factory.create()));
        assertThrows(StructuralInconsistencyException.class,
                () -> nodeManager.restoreNode(child.getId(), 0, factory.create()));
        assertThrows(StructuralInconsistencyException.class,
                () -> nodeManager.restoreNode(42, 0, factory.create()));
        RestaurantFactory other = new RestaurantFactory(RestaurantType.KNESER_NEY);
        assertThrows(ConfigurationException.class,
                () -> nodeManager.restoreNode(root.getId(), 1, other.create()));
    }

    @Test
    public void testClear() {
        nodeManager.resolvePath(SEQ, 0, 5);
        nodeManager.getRoot().getRestaurant().addCustomer(0, 0.5, 0.5, 1.0, 1.0);
        nodeManager.clear();
        assertEquals(1, nodeManager.getNumNodes());
        assertTrue(nodeManager.getRoot().getRestaurant().isEmpty());
    }
}
