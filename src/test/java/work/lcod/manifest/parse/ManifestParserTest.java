package work.lcod.manifest.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.manifest.error.ErrorKind;
import work.lcod.manifest.error.StructuralException;
import work.lcod.manifest.model.ImportDeclaration;
import work.lcod.manifest.model.ImportType;
import work.lcod.manifest.model.Manifest;
import work.lcod.manifest.model.ModuleDescriptor;
import work.lcod.manifest.model.Node;

class ManifestParserTest {
    private final ManifestParser parser = new ManifestParser(List.of("1.0", "2.0"), 8);

    @Test
    void parsesAllSections() {
        Manifest manifest = parser.parse("page.yaml", """
            metadata:
              title: Page
              version: "2.0.1"
              extends: base.yaml
              owner: web-team
              inheritance:
                mergeStyles: false
                preserveSlots: [structure.body.header]
            styles:
              box: {padding: 4px}
              raw: "margin: 0; color: red"
              fancy: {extends: box, border: 1px}
            modules:
              - {alias: nav, url: nav.yaml, version: "^2.0", optional: true}
            imports:
              scripts: [app.js]
              slots:
                content: {url: widget.yaml, optional: true}
            templateSlots:
              content: {target: main, required: true}
            exports:
              card: {div: {class: card}}
            structure:
              body:
                children:
                  - main: {id: main}
            interactions:
              open: {on: click}
            """);

        assertEquals("Page", manifest.metadata().title());
        assertEquals("base.yaml", manifest.metadata().extendsLocator());
        assertEquals(Map.of("owner", "web-team"), manifest.metadata().attributes());
        assertFalse(manifest.metadata().policy().mergeStyles());
        assertTrue(manifest.metadata().policy().preserves("structure.body.header"));

        assertEquals("margin: 0; color: red", manifest.styles().get("raw").declaration());
        assertEquals("box", manifest.styles().get("fancy").parent());
        assertEquals(Map.of("border", "1px"), manifest.styles().get("fancy").properties());

        assertEquals(List.of(new ModuleDescriptor("nav", "nav.yaml", "^2.0", true)), manifest.modules());
        assertEquals(
            List.of(ImportDeclaration.asset(ImportType.SCRIPT, "app.js"), ImportDeclaration.slot("content", "widget.yaml", true)),
            manifest.imports()
        );
        assertTrue(manifest.templateSlots().get("content").required());
        assertEquals("card", manifest.exports().get("card").props().attributes().get("class"));
        assertEquals("main", manifest.structure().props().children().get(0).tag());
        assertTrue(manifest.extras().containsKey("interactions"));
    }

    @Test
    void acceptsLegacyHeaderAndFlatPolicyKeys() {
        Manifest manifest = parser.parse("legacy.yaml", """
            manifest:
              title: Legacy
              overrideStructure: true
            """);

        assertEquals("Legacy", manifest.metadata().title());
        assertTrue(manifest.metadata().policy().overrideStructure());
        assertTrue(manifest.metadata().attributes().isEmpty());
    }

    @Test
    void readsJsonAsWell() {
        Manifest manifest = parser.parse("page.json", """
            {"metadata": {"title": "Json"}, "structure": {"div": {"text": "hi"}}}
            """);

        assertEquals("Json", manifest.metadata().title());
        assertEquals("hi", manifest.structure().props().text());
    }

    @Test
    void stringChildrenBecomeTextNodes() {
        Manifest manifest = parser.parse("text.yaml", """
            structure:
              p:
                children:
                  - Hello
                  - b: world
            """);

        List<Node> children = manifest.structure().props().children();
        assertEquals("span", children.get(0).tag());
        assertEquals("Hello", children.get(0).props().text());
        assertEquals("world", children.get(1).props().text());
    }

    @Test
    void singleChildFormIsKept() {
        Manifest manifest = parser.parse("single.yaml", """
            structure:
              div:
                children:
                  span: {text: only}
            """);

        assertTrue(manifest.structure().props().singleChild());
        assertEquals(
            Map.of("div", Map.of("children", Map.of("span", Map.of("text", "only")))),
            ManifestWriter.nodeMap(manifest.structure())
        );
    }

    @Test
    void modulesMayBeKeyedByAlias() {
        Manifest manifest = parser.parse("modules.yaml", """
            modules:
              nav: nav.yaml
              footer: {url: footer.yaml, version: latest}
            """);

        assertEquals(
            List.of(new ModuleDescriptor("nav", "nav.yaml", null, false), new ModuleDescriptor("footer", "footer.yaml", null, false)),
            manifest.modules()
        );
    }

    @Test
    void importListFormIsAccepted() {
        Manifest manifest = parser.parse("imports.yaml", """
            imports:
              - {type: stylesheet, url: site.css}
              - {type: slot, slot: hero, content: {h1: {text: Hi}}}
            """);

        assertEquals(ImportType.STYLESHEET, manifest.imports().get(0).type());
        ImportDeclaration hero = manifest.imports().get(1);
        assertTrue(hero.isSlotImport());
        assertFalse(hero.needsLoading());
        assertEquals("Hi", hero.content().props().text());
    }

    @Test
    void rejectsDuplicateAliases() {
        var failure = assertThrows(StructuralException.class, () -> parser.parse("dup.yaml", """
            modules:
              - {alias: nav, url: a.yaml}
              - {alias: nav, url: b.yaml}
            """));

        assertEquals(ErrorKind.STRUCTURAL, failure.kind());
        assertTrue(failure.getMessage().contains("nav"));
    }

    @Test
    void rejectsSlotsSharingTarget() {
        var failure = assertThrows(StructuralException.class, () -> parser.parse("slots.yaml", """
            templateSlots:
              content: {target: main}
              sidebar: {target: main, required: true}
            """));

        assertTrue(failure.getMessage().contains("'content' and 'sidebar' both target 'main'"), failure.getMessage());
    }

    @Test
    void rejectsUnsupportedVersion() {
        assertThrows(StructuralException.class, () -> parser.parse("v3.yaml", "metadata: {version: \"3.0\"}\n"));
        assertTrue(parser.isVersionSupported("2.0.7"));
        assertFalse(parser.isVersionSupported("2.1"));
        assertFalse(parser.isVersionSupported("next"));
        assertTrue(parser.isVersionSupported(null));
    }

    @Test
    void rejectsTooDeepStructure() {
        var deep = new StringBuilder("structure:\n");
        String indent = "  ";
        for (int level = 0; level < 10; level++) {
            deep.append(indent).append("div:\n");
            indent += "  ";
            deep.append(indent).append("children:\n");
            indent += "  ";
        }
        deep.append(indent).append("span: {text: bottom}\n");

        var failure = assertThrows(StructuralException.class, () -> parser.parse("deep.yaml", deep.toString()));
        assertTrue(failure.getMessage().contains("maximum depth"));
    }

    @Test
    void rejectsMalformedDocuments() {
        assertThrows(StructuralException.class, () -> parser.parse("empty.yaml", "  "));
        assertThrows(StructuralException.class, () -> parser.parse("list.yaml", "- a\n- b\n"));
        assertThrows(StructuralException.class, () -> parser.parse("bad.yaml", "metadata: {title: [unclosed\n"));
        assertThrows(StructuralException.class, () -> parser.parse("roots.yaml", "structure: {div: {}, span: {}}\n"));
        assertThrows(StructuralException.class, () -> parser.parse("slot.yaml", "templateSlots: {main: {required: true}}\n"));
    }

    @Test
    void writerOutputParsesBackToTheSameManifest() {
        Manifest original = parser.parse("page.yaml", """
            metadata: {title: Round, version: "2.0"}
            styles:
              box: {padding: 4px}
            templateSlots:
              content: {target: main, default: {p: {text: Empty}}}
            structure:
              div: {class: wrap, children: [{main: {id: main}}]}
            """);

        Manifest reparsed = parser.parse("page.json", ManifestWriter.toJson(original));

        assertEquals(original, reparsed);
        assertNull(reparsed.metadata().extendsLocator());
    }
}
