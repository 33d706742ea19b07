package work.lcod.manifest.emit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.manifest.support.Manifests.yaml;

import org.junit.jupiter.api.Test;
import work.lcod.manifest.error.StructuralException;
import work.lcod.manifest.model.Manifest;
import work.lcod.manifest.support.Manifests;

class ManifestEmitterTest {
    private static final Manifest RESOLVED = yaml("""
        metadata: {title: "Home Page!", version: "2.0"}
        styles:
          box: {padding: 4px}
        structure:
          div: {class: box, text: Hello}
        """);

    @Test
    void jsonOutputIsNamedAfterTheTitle() {
        EmittedFile file = new JsonManifestEmitter().emit(RESOLVED);

        assertEquals("home-page.json", file.filename());
        assertTrue(file.content().contains("\"padding\" : \"4px\""));
        assertEquals(RESOLVED, Manifests.PARSER.parse(file.filename(), file.content()));
    }

    @Test
    void yamlOutputParsesBack() {
        EmittedFile file = new YamlManifestEmitter().emit(RESOLVED);

        assertEquals("home-page.yaml", file.filename());
        assertEquals(RESOLVED, Manifests.PARSER.parse(file.filename(), file.content()));
    }

    @Test
    void untitledManifestsGetADefaultName() {
        assertEquals("manifest", ManifestEmitter.baseName(yaml("styles: {}\n")));
        assertEquals("manifest", ManifestEmitter.baseName(yaml("metadata: {title: \"!!!\"}\n")));
    }

    @Test
    void refusesUnresolvedManifests() {
        Manifest unresolved = yaml("metadata: {extends: base.yaml}\n");

        assertThrows(StructuralException.class, () -> new JsonManifestEmitter().emit(unresolved));
        assertThrows(StructuralException.class, () -> new YamlManifestEmitter().emit(unresolved));
    }
}
