package work.mkly.cli;

import java.util.stream.Collectors;
import picocli.CommandLine;
import work.mkly.core.CoreKit;
import work.mkly.kit.Kit;
import work.mkly.kit.KitVersions;

/**
 * Reports the build version together with the document versions the bundled core kit accepts.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        String version = implementationVersion != null ? implementationVersion : "development";
        Kit core = CoreKit.kit();
        KitVersions versions = core.versions().orElse(KitVersions.DEFAULT);
        String supported = versions.supported().stream().map(String::valueOf).collect(Collectors.joining(", "));
        return new String[] {
            "mkly " + version,
            "document versions: " + supported + " (current " + versions.current() + ")",
            "core kit: " + core.blocks().size() + " blocks"
        };
    }
}
