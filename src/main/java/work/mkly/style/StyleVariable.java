package work.mkly.style;

import java.util.Objects;

/** Document-level design variable ({@code accent: #e2725b}). */
public record StyleVariable(String name, String value) {
    public StyleVariable {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }
}
