package homelab.orchestrator.directory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import homelab.orchestrator.model.NodeDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * Node directory backed by a JSON file.
 *
 * Accepts either a top-level array of nodes or an object with a {@code nodes} array.
 * The file is re-read on every call so edits are picked up on the next registration.
 */
public class JsonNodeDirectory implements NodeDirectory {

    private static final Logger log = LoggerFactory.getLogger(JsonNodeDirectory.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final TypeReference<List<NodeDescriptor>> NODE_LIST = new TypeReference<>() {
    };

    private final Path file;

    public JsonNodeDirectory(Path file) {
        this.file = file;
    }

    @Override
    public List<NodeDescriptor> listNodes() throws IOException {
        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString(), null, "node directory file not found");
        }

        JsonNode root = MAPPER.readTree(file.toFile());
        JsonNode array = root.isArray() ? root : root.get("nodes");
        if (array == null || !array.isArray()) {
            throw new IOException("node directory " + file + " must contain a nodes array");
        }

        List<NodeDescriptor> nodes = MAPPER.convertValue(array, NODE_LIST);
        for (NodeDescriptor node : nodes) {
            if (node.id() == null || node.id().isBlank()) {
                throw new IOException("node directory " + file + " contains a node without id");
            }
        }
        log.debug("Loaded {} node descriptors from {}", nodes.size(), file);
        return nodes;
    }

    public Path file() {
        return file;
    }
}
