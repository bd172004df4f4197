package sampling.util;

import gnu.trove.map.hash.TIntIntHashMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;
import sampler.HPYPParameters;
import sampling.restaurant.AbstractRestaurant;
import sampling.restaurant.RestaurantFactory;
import sampling.restaurant.RestaurantType;
import util.ConfigurationException;
import util.IOUtils;
import util.SerializationException;
import util.StructuralInconsistencyException;

/**
 * Saves and restores a context tree together with the seating of every node,
 * and optionally the hyperparameters, as a zip file with the entries
 * <pre>
 * header      magic "HPYP", format version, restaurant type name and tag,
 *             maximum depth, number of nodes, whether parameters follow
 * nodes       one record per node in pre-order: id, parent id, context
 *             symbol, depth, payload length, payload
 * parameters  discounts and concentrations (optional)
 * </pre>
 * All numbers are big-endian as written by {@link DataOutputStream}. The
 * sequence the model was trained on is not stored.
 * <p>
 * Loading decodes the whole file before the target node manager is touched,
 * so a failed load leaves the caller's tree as it was.
 */
public class HPYPSerializer {

    public static final byte[] MAGIC = "HPYP".getBytes(StandardCharsets.US_ASCII);
    public static final int FORMAT_VERSION = 1;
    public static final String HEADER_ENTRY = "header";
    public static final String NODES_ENTRY = "nodes";
    public static final String PARAMETERS_ENTRY = "parameters";
    private final File file;

    public HPYPSerializer(File file) {
        this.file = file;
    }

    public void saveNodesAndPayloads(NodeManager nodeManager, RestaurantFactory factory)
            throws SerializationException {
        saveNodesAndPayloads(nodeManager, factory, null);
    }

    public void saveNodesAndPayloads(NodeManager nodeManager, RestaurantFactory factory,
            HPYPParameters parameters) throws SerializationException {
        if (nodeManager.getFactory().getType() != factory.getType()) {
            throw new SerializationException("Node manager uses " + nodeManager.getFactory().getType()
                    + " restaurants but the factory encodes " + factory.getType());
        }
        List<ContextNode> nodes = nodeManager.getNodesDFS();

        try {
            ByteArrayOutputStream headerBytes = new ByteArrayOutputStream();
            DataOutputStream header = new DataOutputStream(headerBytes);
            header.write(MAGIC);
            header.writeInt(FORMAT_VERSION);
            header.writeUTF(factory.getType().name());
            header.writeByte(factory.getType().getTag());
            header.writeInt(nodeManager.getMaxDepth());
            header.writeInt(nodes.size());
            header.writeBoolean(parameters != null);
            header.flush();

            ByteArrayOutputStream nodeBytes = new ByteArrayOutputStream();
            DataOutputStream nodeOut = new DataOutputStream(nodeBytes);
            for (ContextNode node : nodes) {
                byte[] payload = factory.encode(node.getRestaurant());
                nodeOut.writeInt(node.getId());
                nodeOut.writeInt(node.getParentId());
                nodeOut.writeInt(node.getKey());
                nodeOut.writeInt(node.getDepth());
                nodeOut.writeInt(payload.length);
                nodeOut.write(payload);
            }
            nodeOut.flush();

            ZipOutputStream writer = IOUtils.getZipOutputStream(file.getPath());
            try {
                writeEntry(writer, HEADER_ENTRY, headerBytes.toByteArray());
                writeEntry(writer, NODES_ENTRY, nodeBytes.toByteArray());
                if (parameters != null) {
                    ByteArrayOutputStream paramBytes = new ByteArrayOutputStream();
                    DataOutputStream paramOut = new DataOutputStream(paramBytes);
                    parameters.output(paramOut);
                    paramOut.flush();
                    writeEntry(writer, PARAMETERS_ENTRY, paramBytes.toByteArray());
                }
            } finally {
                writer.close();
            }
        } catch (SerializationException e) {
            throw e;
        } catch (IOException e) {
            throw new SerializationException("Error writing model to " + file, e);
        }
    }

    private static void writeEntry(ZipOutputStream writer, String name, byte[] data)
            throws IOException {
        writer.putNextEntry(new ZipEntry(name));
        writer.write(data, 0, data.length);
        writer.closeEntry();
    }

    public void loadNodesAndPayloads(NodeManager nodeManager, RestaurantFactory factory)
            throws SerializationException {
        loadNodesAndPayloads(nodeManager, factory, null);
    }

    /**
     * Replace the tree of the node manager with the one stored in the file.
     *
     * @param nodeManager Target node manager, configured with the same
     * restaurant type and maximum depth as the saved one
     * @param factory Factory used to decode the restaurants
     * @param parameters If not null, receives the stored hyperparameters. The
     * file must contain them.
     */
    public void loadNodesAndPayloads(NodeManager nodeManager, RestaurantFactory factory,
            HPYPParameters parameters) throws SerializationException {
        if (nodeManager.getFactory().getType() != factory.getType()) {
            throw new SerializationException("Node manager uses " + nodeManager.getFactory().getType()
                    + " restaurants but the factory decodes " + factory.getType());
        }
        if (!file.exists()) {
            throw new SerializationException("Model file " + file + " does not exist");
        }

        byte[] headerData;
        byte[] nodeData;
        byte[] paramData;
        try {
            ZipFile zipFile = new ZipFile(file);
            try {
                headerData = readEntry(zipFile, HEADER_ENTRY, true);
                nodeData = readEntry(zipFile, NODES_ENTRY, true);
                paramData = readEntry(zipFile, PARAMETERS_ENTRY, false);
            } finally {
                zipFile.close();
            }
        } catch (SerializationException e) {
            throw e;
        } catch (IOException e) {
            throw new SerializationException("Cannot read model file " + file, e);
        }

        try {
            DataInputStream header = new DataInputStream(new ByteArrayInputStream(headerData));
            byte[] magic = new byte[MAGIC.length];
            header.readFully(magic);
            if (!Arrays.equals(magic, MAGIC)) {
                throw new SerializationException(file + " is not a saved HPYP model");
            }
            int version = header.readInt();
            if (version != FORMAT_VERSION) {
                throw new SerializationException("Unsupported format version " + version);
            }
            String typeName = header.readUTF();
            byte tag = header.readByte();
            RestaurantType savedType = RestaurantType.fromTag(tag);
            if (savedType == null || !savedType.name().equals(typeName)) {
                throw new SerializationException("Unknown restaurant type " + typeName
                        + " (tag " + tag + ")");
            }
            if (savedType != factory.getType()) {
                throw new SerializationException("File holds " + savedType
                        + " restaurants but " + factory.getType() + " was requested");
            }
            int maxDepth = header.readInt();
            if (maxDepth != nodeManager.getMaxDepth()) {
                throw new SerializationException("File was saved with maximum depth "
                        + maxDepth + " but the node manager uses " + nodeManager.getMaxDepth());
            }
            int numNodes = header.readInt();
            if (numNodes < 1) {
                throw new SerializationException("Invalid number of nodes " + numNodes);
            }
            boolean hasParameters = header.readBoolean();
            if (hasParameters != (paramData != null)) {
                throw new SerializationException("Header and parameter entry disagree");
            }
            if (parameters != null && !hasParameters) {
                throw new SerializationException("File contains no parameters");
            }

            NodeManager staged = new NodeManager(factory, maxDepth);
            readNodes(new DataInputStream(new ByteArrayInputStream(nodeData)),
                    numNodes, staged, factory);

            HPYPParameters stagedParams = null;
            if (parameters != null) {
                DataInputStream paramIn = new DataInputStream(
                        new ByteArrayInputStream(paramData));
                stagedParams = HPYPParameters.input(paramIn);
                if (paramIn.available() > 0) {
                    throw new SerializationException("Trailing bytes after parameters");
                }
            }

            nodeManager.adopt(staged);
            if (stagedParams != null) {
                parameters.copyFrom(stagedParams);
            }
        } catch (SerializationException e) {
            throw e;
        } catch (EOFException e) {
            throw new SerializationException("Truncated model file " + file, e);
        } catch (IOException e) {
            throw new SerializationException("Corrupt model file " + file, e);
        } catch (StructuralInconsistencyException e) {
            throw new SerializationException("Inconsistent tree in " + file + ". "
                    + e.getMessage(), e);
        } catch (ConfigurationException e) {
            throw new SerializationException("Invalid content in " + file + ". "
                    + e.getMessage(), e);
        }
    }

    private void readNodes(DataInputStream in, int numNodes, NodeManager staged,
            RestaurantFactory factory) throws IOException {
        TIntIntHashMap savedToNew = new TIntIntHashMap(); // saved id -> staged id
        TIntObjectHashMap<ContextNode> savedNodes = new TIntObjectHashMap<ContextNode>();
        for (int i = 0; i < numNodes; i++) {
            int id = in.readInt();
            int parentId = in.readInt();
            int key = in.readInt();
            int depth = in.readInt();
            int length = in.readInt();
            if (length < 0 || length > in.available()) {
                throw new SerializationException("Invalid payload length " + length
                        + " for node " + id);
            }
            byte[] payload = new byte[length];
            in.readFully(payload);
            AbstractRestaurant restaurant = factory.decode(payload);

            if (savedNodes.containsKey(id)) {
                throw new SerializationException("Duplicate node id " + id);
            }
            ContextNode node;
            if (i == 0) {
                if (parentId != ContextNode.NO_PARENT || depth != 0) {
                    throw new SerializationException("First node is not a root");
                }
                node = staged.restoreRoot(restaurant);
            } else {
                ContextNode parent = savedNodes.get(parentId);
                if (parentId == ContextNode.NO_PARENT || parent == null) {
                    throw new SerializationException("Node " + id + " refers to unknown parent "
                            + parentId);
                }
                if (depth != parent.getDepth() + 1) {
                    throw new SerializationException("Node " + id + " has depth " + depth
                            + " below a node of depth " + parent.getDepth());
                }
                if (parent.hasChild(key)) {
                    throw new SerializationException("Duplicate context symbol " + key
                            + " under node " + parentId);
                }
                node = staged.restoreNode(savedToNew.get(parentId), key, restaurant);
            }
            savedToNew.put(id, node.getId());
            savedNodes.put(id, node);
        }
        if (in.available() > 0) {
            throw new SerializationException("Trailing bytes after " + numNodes + " nodes");
        }
    }

    private static byte[] readEntry(ZipFile zipFile, String name, boolean required)
            throws IOException {
        ZipEntry entry = zipFile.getEntry(name);
        if (entry == null) {
            if (required) {
                throw new SerializationException("Missing entry " + name);
            }
            return null;
        }
        InputStream in = zipFile.getInputStream(entry);
        try {
            ByteArrayOutputStream data = new ByteArrayOutputStream();
            byte[] buffer = new byte[8192];
            int read;
            while ((read = in.read(buffer)) != -1) {
                data.write(buffer, 0, read);
            }
            return data.toByteArray();
        } finally {
            in.close();
        }
    }
}
