package work.mkly.kit;

import java.util.List;

/**
 * Document versions a kit understands.
 */
public record KitVersions(List<Integer> supported, int current) {
    public static final KitVersions DEFAULT = new KitVersions(List.of(1), 1);

    public KitVersions {
        supported = supported == null || supported.isEmpty() ? List.of(current) : List.copyOf(supported);
    }

    public boolean supports(int version) {
        return version == current || supported.contains(version);
    }
}
