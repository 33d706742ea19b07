package work.lcod.manifest.cli;

import picocli.CommandLine;
import work.lcod.manifest.api.ResolverConfiguration;

/**
 * Prints the tool version and the manifest versions it accepts unless configured otherwise.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        return new String[] {
            "manifest-resolve " + (implementationVersion != null ? implementationVersion : "development"),
            "manifest versions: " + String.join(", ", ResolverConfiguration.DEFAULT_SUPPORTED_VERSIONS)
        };
    }
}
