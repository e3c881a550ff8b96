package work.mkly.parse;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves the {@code version} meta property.
 */
public final class DocumentVersion {
    public static final int DEFAULT = 1;

    private DocumentVersion() {}

    /**
     * @param version   effective version
     * @param declared  whether a numeric version was written
     * @param error     message for a non-numeric value
     */
    public record Resolution(int version, boolean declared, Optional<String> error) {}

    public static Resolution resolve(Map<String, String> meta) {
        String raw = meta.get("version");
        if (raw == null || raw.isBlank()) {
            return new Resolution(DEFAULT, false, Optional.empty());
        }
        try {
            return new Resolution(Integer.parseInt(raw.strip()), true, Optional.empty());
        } catch (NumberFormatException ex) {
            return new Resolution(DEFAULT, false, Optional.of("Invalid version: \"" + raw + "\""));
        }
    }
}
