package work.mkly.kit;

import java.nio.file.Path;

/**
 * Raised when a kit manifest cannot be read or does not describe a kit.
 */
public final class KitManifestException extends RuntimeException {
    private final transient Path manifest;

    public KitManifestException(Path manifest, String message) {
        super(manifest + ": " + message);
        this.manifest = manifest;
    }

    public KitManifestException(Path manifest, String message, Throwable cause) {
        super(manifest + ": " + message, cause);
        this.manifest = manifest;
    }

    public Path manifest() {
        return manifest;
    }
}
