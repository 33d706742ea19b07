package work.lcod.manifest.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class ManifestResolveCommandTest {
    private static final String MANIFESTS = Path.of("src", "test", "resources", "manifests").toAbsolutePath().toString();
    private static final ObjectMapper JSON = new ObjectMapper();

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine commandLine = Main.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    @Test
    void resolvePrintsJson() throws Exception {
        int exit = run("resolve", "-b", MANIFESTS, "pages/home.yaml");

        assertEquals(0, exit, err.toString());
        JsonNode manifest = JSON.readTree(out.toString());
        assertEquals("Home Page", manifest.path("metadata").path("title").asText());
        assertEquals("loaded", manifest.path("resolvedModules").path("nav").path("state").asText());
        assertTrue(manifest.path("metadata").path("extends").isMissingNode());
    }

    @Test
    void resolvePrintsYaml() {
        int exit = run("resolve", "--base-dir", MANIFESTS, "--format", "yaml", "about.yaml");

        assertEquals(0, exit, err.toString());
        assertTrue(out.toString().contains("title: \"About\""));
    }

    @Test
    void slotOptionFillsSlot() throws Exception {
        int exit = run("resolve", "-b", MANIFESTS, "--slot", "content=widgets/latest.yaml", "about.yaml");

        assertEquals(0, exit, err.toString());
        JsonNode body = JSON.readTree(out.toString()).path("structure").path("body");
        assertEquals("news", body.path("children").get(0).path("section").path("class").asText());
    }

    @Test
    void failureIsReportedWithItsKind() {
        int exit = run("resolve", "-b", MANIFESTS, "cycle-a.yaml");

        assertEquals(1, exit);
        assertTrue(err.toString().contains("circular_reference"), err.toString());
        assertEquals("", out.toString());
    }

    @Test
    void unknownFormatIsUsageError() {
        int exit = run("resolve", "-b", MANIFESTS, "-f", "xml", "about.yaml");

        assertEquals(2, exit);
        assertTrue(err.toString().contains("Unsupported format: xml"));
    }

    @Test
    void depsPrintsModuleTree() throws Exception {
        int exit = run("deps", "-b", MANIFESTS, "pages/home.yaml");

        assertEquals(0, exit, err.toString());
        JsonNode tree = JSON.readTree(out.toString());
        assertEquals("site", tree.path("name").asText());
        assertEquals("nav", tree.path("children").get(0).path("name").asText());
        assertEquals("failed", tree.path("children").get(1).path("state").asText());
    }

    @Test
    void bundleCombinesManifests() throws Exception {
        int exit = run("bundle", "-b", MANIFESTS, "-n", "site", "about.yaml", "pages/home.yaml");

        assertEquals(0, exit, err.toString());
        JsonNode bundle = JSON.readTree(out.toString());
        assertEquals("site", bundle.path("metadata").path("title").asText());
        assertTrue(bundle.path("styles").has("about-text"));
        assertTrue(bundle.path("styles").has("home-menu"));
        assertEquals(2, bundle.path("structure").path("div").path("children").size());
    }

    @Test
    void bundleKeyIsTheFileStem() {
        assertEquals("home", ManifestResolveCommand.Bundle.bundleKey("pages/home.yaml"));
        assertEquals("README", ManifestResolveCommand.Bundle.bundleKey("README"));
    }

    @Test
    void missingConfigFileIsConfigurationError(@TempDir Path dir) {
        int exit = run("resolve", "--config", dir.resolve("absent.toml").toString(), "-b", MANIFESTS, "about.yaml");

        assertEquals(Main.EXIT_CONFIGURATION, exit);
        assertTrue(err.toString().contains("configuration: Configuration file not found"), err.toString());
        assertEquals("", out.toString());
    }

    @Test
    void invalidConfigFileIsConfigurationError(@TempDir Path dir) throws IOException {
        Path config = Files.writeString(dir.resolve("manifest-resolver.toml"), "[resolver\nmaxDepth = \n");

        int exit = run("deps", "--config", config.toString(), "-b", MANIFESTS, "about.yaml");

        assertEquals(Main.EXIT_CONFIGURATION, exit);
        assertTrue(err.toString().contains("configuration: Invalid configuration"), err.toString());
    }

    @Test
    void versionIsPrinted() {
        int exit = run("--version");

        assertEquals(0, exit);
        assertTrue(out.toString().startsWith("manifest-resolve "));
        assertTrue(out.toString().contains("manifest versions: 1.0, 2.0"));
    }
}
