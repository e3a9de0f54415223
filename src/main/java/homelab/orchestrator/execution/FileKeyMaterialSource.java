package homelab.orchestrator.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads the SSH key from a file on every call; a missing or unreadable file means no key.
 */
public class FileKeyMaterialSource implements KeyMaterialSource {

    private static final Logger log = LoggerFactory.getLogger(FileKeyMaterialSource.class);

    private final Path keyFile;

    public FileKeyMaterialSource(Path keyFile) {
        this.keyFile = keyFile;
    }

    @Override
    public Optional<byte[]> privateKey() {
        if (keyFile == null || !Files.isRegularFile(keyFile)) {
            return Optional.empty();
        }
        try {
            byte[] key = Files.readAllBytes(keyFile);
            return key.length == 0 ? Optional.empty() : Optional.of(key);
        } catch (IOException e) {
            log.warn("Cannot read SSH key {}: {}", keyFile, e.getMessage());
            return Optional.empty();
        }
    }
}
