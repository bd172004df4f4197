package sampling.util;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import sampler.HPYPModel;
import sampler.HPYPParameters;
import sampling.restaurant.RestaurantFactory;
import sampling.restaurant.RestaurantType;
import util.SerializationException;

import static org.junit.jupiter.api.Assertions.*;

public class HPYPSerializerTest {

    private static final int[] SEQ = {0, 1, 2, 1, 2, 0, 1, 2, 2, 1, 0, 1};
    private static final int NUM_TYPES = 3;
    private static final int MAX_DEPTH = 3;
    @TempDir
    File tempDir;

    @BeforeEach
    public void setUp() {
        HPYPModel.setRandomSeed(42);
    }

    private static HPYPModel trainedModel(RestaurantType type) {
        RestaurantFactory factory = new RestaurantFactory(type);
        HPYPModel model = new HPYPModel(SEQ, new NodeManager(factory, MAX_DEPTH), factory,
                new HPYPParameters(), NUM_TYPES);
        model.initialize();
        for (int i = 0; i < 5; i++) {
            model.runGibbsSampler(false);
        }
        return model;
    }

    @Test
    public void testSavedModelPredictsTheSame() throws IOException {
        for (RestaurantType type : RestaurantType.values()) {
            HPYPModel model = trainedModel(type);
            File file = new File(tempDir, type + ".zip");
            new HPYPSerializer(file).saveNodesAndPayloads(model.getNodeManager(),
                    model.getFactory(), model.getParameters());

            RestaurantFactory factory = new RestaurantFactory(type);
            NodeManager nodeManager = new NodeManager(factory, MAX_DEPTH);
            HPYPParameters params = new HPYPParameters(new double[]{0.1}, new double[]{2.0});
            new HPYPSerializer(file).loadNodesAndPayloads(nodeManager, factory, params);

            assertEquals(model.getNodeManager().getNumNodes(), nodeManager.getNumNodes());
            assertEquals(model.getParameters().toString(), params.toString());
            nodeManager.validate("Loaded " + type);

            HPYPModel loaded = new HPYPModel(SEQ, nodeManager, factory, params, NUM_TYPES);
            loaded.setVerbose(false);
            for (int end = 0; end <= SEQ.length; end++) {
                assertArrayEquals(model.predictiveDistribution(0, end),
                        loaded.predictiveDistribution(0, end), 1e-12, type + " context " + end);
            }
            assertEquals(model.toString(), loaded.toString());
        }
    }

    @Test
    public void testModelStateRoundTrip() throws IOException {
        HPYPModel model = trainedModel(RestaurantType.HISTOGRAM);
        File file = new File(tempDir, "model.zip");
        model.outputState(file);

        RestaurantFactory factory = new RestaurantFactory(RestaurantType.HISTOGRAM);
        HPYPModel loaded = new HPYPModel(SEQ, new NodeManager(factory, MAX_DEPTH), factory,
                new HPYPParameters(), NUM_TYPES);
        loaded.inputState(file);
        assertEquals(HPYPModel.ModelState.READY, loaded.getState());
        assertEquals(SEQ.length, loaded.getNumSeated());
        loaded.checkConsistency();
        assertEquals(model.computeLosses(0, SEQ.length), loaded.computeLosses(0, SEQ.length), 1e-9);

        // a loaded model can be trained further
        loaded.runGibbsSampler(false);
        loaded.checkConsistency();
    }

    @Test
    public void testStateOfPartlySeatedModelRejected() throws IOException {
        RestaurantFactory factory = new RestaurantFactory(RestaurantType.HISTOGRAM);
        HPYPModel partial = new HPYPModel(SEQ, new NodeManager(factory, MAX_DEPTH), factory,
                new HPYPParameters(), NUM_TYPES);
        partial.computeLossesWithDeletion(0, SEQ.length, 4);
        assertEquals(4, partial.getNumSeated());
        File file = new File(tempDir, "partial.zip");
        partial.outputState(file);

        HPYPModel model = trainedModel(RestaurantType.HISTOGRAM);
        String before = model.toString();
        double[] predictive = model.predictiveDistribution(0, SEQ.length);
        assertThrows(SerializationException.class, () -> model.inputState(file));
        assertEquals(before, model.toString());
        assertEquals(HPYPModel.ModelState.TRAINING, model.getState());
        assertEquals(SEQ.length, model.getNumSeated());
        assertArrayEquals(predictive, model.predictiveDistribution(0, SEQ.length), 1e-12);
        model.checkConsistency();
    }

    @Test
    public void testStateOfOtherSequenceRejected() throws IOException {
        HPYPModel model = trainedModel(RestaurantType.STIRLING_COMPACT);
        File file = new File(tempDir, "other.zip");
        model.outputState(file);

        RestaurantFactory factory = new RestaurantFactory(RestaurantType.STIRLING_COMPACT);
        HPYPModel other = new HPYPModel(new int[SEQ.length], new NodeManager(factory, MAX_DEPTH),
                factory, new HPYPParameters(), NUM_TYPES);
        assertThrows(SerializationException.class, () -> other.inputState(file));
        assertEquals(HPYPModel.ModelState.SEEDED, other.getState());
        assertEquals(0, other.getNumSeated());
        assertEquals(1, other.getNodeManager().getNumNodes());
        assertTrue(other.getNodeManager().getRoot().getRestaurant().isEmpty());
    }

    @Test
    public void testOtherRepresentationRejected() throws IOException {
        HPYPModel model = trainedModel(RestaurantType.STIRLING_COMPACT);
        File file = new File(tempDir, "stirling.zip");
        new HPYPSerializer(file).saveNodesAndPayloads(model.getNodeManager(), model.getFactory());

        RestaurantFactory factory = new RestaurantFactory(RestaurantType.REINSTANTIATING_COMPACT);
        NodeManager nodeManager = new NodeManager(factory, MAX_DEPTH);
        nodeManager.resolvePath(SEQ, 0, 3);
        nodeManager.getRoot().getRestaurant().addCustomer(1, 0.5, 0.5, 1.0, 1.0);
        String before = dump(nodeManager);

        assertThrows(SerializationException.class,
                () -> new HPYPSerializer(file).loadNodesAndPayloads(nodeManager, factory));
        assertEquals(before, dump(nodeManager));
        assertEquals(4, nodeManager.getNumNodes());
    }

    @Test
    public void testOtherDepthRejected() throws IOException {
        HPYPModel model = trainedModel(RestaurantType.FULL);
        File file = new File(tempDir, "full.zip");
        new HPYPSerializer(file).saveNodesAndPayloads(model.getNodeManager(), model.getFactory());

        RestaurantFactory factory = new RestaurantFactory(RestaurantType.FULL);
        NodeManager nodeManager = new NodeManager(factory, MAX_DEPTH + 1);
        assertThrows(SerializationException.class,
                () -> new HPYPSerializer(file).loadNodesAndPayloads(nodeManager, factory));
        assertEquals(1, nodeManager.getNumNodes());
    }

    @Test
    public void testMissingParametersRejected() throws IOException {
        HPYPModel model = trainedModel(RestaurantType.KNESER_NEY);
        File file = new File(tempDir, "kn.zip");
        new HPYPSerializer(file).saveNodesAndPayloads(model.getNodeManager(), model.getFactory());

        RestaurantFactory factory = new RestaurantFactory(RestaurantType.KNESER_NEY);
        NodeManager nodeManager = new NodeManager(factory, MAX_DEPTH);
        assertThrows(SerializationException.class, () -> new HPYPSerializer(file)
                .loadNodesAndPayloads(nodeManager, factory, new HPYPParameters()));

        // without parameters the same file loads
        new HPYPSerializer(file).loadNodesAndPayloads(nodeManager, factory);
        assertEquals(model.getNodeManager().getNumNodes(), nodeManager.getNumNodes());
    }

    @Test
    public void testMissingFileRejected() {
        RestaurantFactory factory = new RestaurantFactory(RestaurantType.FULL);
        NodeManager nodeManager = new NodeManager(factory, 2);
        File file = new File(tempDir, "missing.zip");
        assertThrows(SerializationException.class,
                () -> new HPYPSerializer(file).loadNodesAndPayloads(nodeManager, factory));
    }

    @Test
    public void testCorruptFilesRejected() throws IOException {
        RestaurantFactory factory = new RestaurantFactory(RestaurantType.FULL);
        NodeManager nodeManager = new NodeManager(factory, MAX_DEPTH);

        File notZip = new File(tempDir, "garbage.zip");
        Files.write(notZip.toPath(), "not a model".getBytes(StandardCharsets.US_ASCII));
        assertThrows(SerializationException.class,
                () -> new HPYPSerializer(notZip).loadNodesAndPayloads(nodeManager, factory));

        File badMagic = new File(tempDir, "magic.zip");
        writeZip(badMagic, "header", "XXXX".getBytes(StandardCharsets.US_ASCII));
        assertThrows(SerializationException.class,
                () -> new HPYPSerializer(badMagic).loadNodesAndPayloads(nodeManager, factory));

        // a valid file with its node records cut short
        HPYPModel model = trainedModel(RestaurantType.FULL);
        File valid = new File(tempDir, "valid.zip");
        new HPYPSerializer(valid).saveNodesAndPayloads(model.getNodeManager(), model.getFactory());
        File truncated = new File(tempDir, "truncated.zip");
        copyWithTruncatedNodes(valid, truncated);
        assertThrows(SerializationException.class,
                () -> new HPYPSerializer(truncated).loadNodesAndPayloads(nodeManager, factory));
        assertEquals(1, nodeManager.getNumNodes());
    }

    @Test
    public void testFactoryMustMatchNodeManager() {
        NodeManager nodeManager = new NodeManager(new RestaurantFactory(RestaurantType.FULL), 2);
        RestaurantFactory other = new RestaurantFactory(RestaurantType.HISTOGRAM);
        File file = new File(tempDir, "mismatch.zip");
        assertThrows(SerializationException.class,
                () -> new HPYPSerializer(file).saveNodesAndPayloads(nodeManager, other));
        assertFalse(file.exists());
    }

    private static String dump(NodeManager nodeManager) {
        StringBuilder str = new StringBuilder();
        for (ContextNode node : nodeManager.getNodesDFS()) {
            str.append(node.getId()).append(" ").append(node.getKey()).append(" ")
                    .append(node.getRestaurant()).append("\n");
        }
        return str.toString();
    }

    private static void writeZip(File file, String entry, byte[] data) throws IOException {
        ZipOutputStream out = new ZipOutputStream(new FileOutputStream(file));
        try {
            out.putNextEntry(new ZipEntry(entry));
            out.write(data);
            out.closeEntry();
            out.putNextEntry(new ZipEntry(HPYPSerializer.NODES_ENTRY));
            out.closeEntry();
        } finally {
            out.close();
        }
    }

    private static void copyWithTruncatedNodes(File source, File target) throws IOException {
        ZipFile zip = new ZipFile(source);
        try {
            byte[] header = zip.getInputStream(zip.getEntry(HPYPSerializer.HEADER_ENTRY)).readAllBytes();
            byte[] nodes = zip.getInputStream(zip.getEntry(HPYPSerializer.NODES_ENTRY)).readAllBytes();
            OutputStream raw = new FileOutputStream(target);
            ZipOutputStream out = new ZipOutputStream(raw);
            try {
                out.putNextEntry(new ZipEntry(HPYPSerializer.HEADER_ENTRY));
                out.write(header);
                out.closeEntry();
                out.putNextEntry(new ZipEntry(HPYPSerializer.NODES_ENTRY));
                out.write(nodes, 0, nodes.length / 2);
                out.closeEntry();
            } finally {
                out.close();
            }
        } finally {
            zip.close();
        }
    }
}
