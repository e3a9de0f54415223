package homelab.orchestrator.directory;

import homelab.orchestrator.model.NodeDescriptor;

import java.io.IOException;
import java.util.List;

/**
 * Read-only source of node descriptors.
 */
public interface NodeDirectory {

    /**
     * @return every configured node, in directory order
     * @throws IOException if the directory cannot be read
     */
    List<NodeDescriptor> listNodes() throws IOException;
}
