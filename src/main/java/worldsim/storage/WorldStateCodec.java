package worldsim.storage;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import worldsim.simulation.PersistenceException;
import worldsim.simulation.WorldConfig;
import worldsim.simulation.WorldState;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;
import java.util.logging.Logger;

/**
 * JSON form of world snapshots and authored configurations.
 * <p>
 * Decoding checks the snapshot shape before binding: {@code time} must be a finite,
 * non-negative number, {@code nodes} and {@code entities} must be arrays and
 * {@code resources} an object. Entities that point at a node the snapshot does not
 * contain are moved to the first node; a snapshot without nodes is rejected.
 */
public final class WorldStateCodec {

    private static final Logger logger = Logger.getLogger(WorldStateCodec.class.getName());

    private final ObjectMapper objectMapper;

    public WorldStateCodec() {
        this.objectMapper = createConfiguredObjectMapper();
    }

    public static ObjectMapper createConfiguredObjectMapper() {
        return JsonMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .build();
    }

    public byte[] encode(WorldState state) {
        if (state == null) {
            throw new PersistenceException("Cannot encode null state");
        }
        try {
            return objectMapper.writeValueAsBytes(state);
        } catch (IOException e) {
            throw new PersistenceException("Failed to encode world state", e);
        }
    }

    public WorldState decode(byte[] data) {
        if (data == null || data.length == 0) {
            throw new PersistenceException("No snapshot data");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(data);
        } catch (IOException e) {
            throw new PersistenceException("Snapshot is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new PersistenceException("Snapshot must be a JSON object");
        }
        ObjectNode snapshot = (ObjectNode) root;
        checkShape(snapshot);
        reassignOrphans(snapshot);
        try {
            return objectMapper.treeToValue(snapshot, WorldState.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new PersistenceException("Snapshot does not describe a world state", e);
        }
    }

    public WorldConfig decodeConfig(byte[] data) {
        try {
            WorldConfig config = objectMapper.readValue(data, WorldConfig.class);
            if (config == null) {
                throw new PersistenceException("World configuration is empty");
            }
            return config;
        } catch (IOException | IllegalArgumentException e) {
            throw new PersistenceException("Failed to read world configuration", e);
        }
    }

    public WorldConfig readConfig(Path path) {
        try {
            return decodeConfig(Files.readAllBytes(path));
        } catch (IOException e) {
            throw new PersistenceException("Failed to read " + path, e);
        }
    }

    private static void checkShape(ObjectNode snapshot) {
        JsonNode time = snapshot.get("time");
        if (time == null || !time.isNumber()) {
            throw new PersistenceException("Snapshot time must be a number");
        }
        double value = time.asDouble();
        if (!Double.isFinite(value) || value < 0) {
            throw new PersistenceException("Snapshot time must be finite and non-negative: " + time);
        }
        if (!isArray(snapshot, "nodes")) {
            throw new PersistenceException("Snapshot nodes must be an array");
        }
        if (!isArray(snapshot, "entities")) {
            throw new PersistenceException("Snapshot entities must be an array");
        }
        JsonNode resources = snapshot.get("resources");
        if (resources == null || !resources.isObject()) {
            throw new PersistenceException("Snapshot resources must be an object");
        }
        if (snapshot.get("nodes").isEmpty()) {
            throw new PersistenceException("Snapshot has no nodes");
        }
    }

    private static boolean isArray(ObjectNode snapshot, String field) {
        JsonNode node = snapshot.get(field);
        return node != null && node.isArray();
    }

    private static void reassignOrphans(ObjectNode snapshot) {
        ArrayNode nodes = (ArrayNode) snapshot.get("nodes");
        Set<String> nodeIds = new HashSet<>();
        for (JsonNode node : nodes) {
            nodeIds.add(node.path("id").asText());
        }
        String fallback = nodes.get(0).path("id").asText();
        for (JsonNode entity : snapshot.get("entities")) {
            if (!entity.isObject()) {
                continue;
            }
            String nodeId = entity.path("nodeId").asText(null);
            if (nodeId == null || !nodeIds.contains(nodeId)) {
                logger.warning("Entity " + entity.path("id").asText() + " referenced unknown node "
                        + nodeId + ", moved to " + fallback);
                ((ObjectNode) entity).put("nodeId", fallback);
            }
        }
    }
}
