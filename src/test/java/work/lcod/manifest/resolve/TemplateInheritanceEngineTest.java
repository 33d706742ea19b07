package work.lcod.manifest.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.manifest.support.Manifests.yaml;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.manifest.model.ImportType;
import work.lcod.manifest.model.Manifest;
import work.lcod.manifest.parse.ManifestWriter;

class TemplateInheritanceEngineTest {
    private final TemplateInheritanceEngine engine = new TemplateInheritanceEngine();

    @Test
    void childChildrenAreAddedToAncestorNode() {
        Manifest base = yaml("""
            structure:
              div: {id: app}
            """);
        Manifest child = yaml("""
            metadata:
              extends: base
              overrideStructure: false
            structure:
              div:
                id: app
                children:
                  - h1: {text: Hi}
            """);

        Manifest merged = engine.merge(base, child);

        assertEquals(
            Map.of("div", Map.of("id", "app", "children", List.of(Map.of("h1", Map.of("text", "Hi"))))),
            ManifestWriter.nodeMap(merged.structure())
        );
    }

    @Test
    void preservedPathKeepsAncestorValue() {
        Manifest base = yaml("""
            structure:
              header: {id: h}
            """);
        Manifest child = yaml("""
            metadata:
              extends: base
              inheritance:
                preserveSlots: [structure.header]
            structure:
              header: {id: h2}
            """);

        Manifest merged = engine.merge(base, child);

        assertEquals("h", merged.structure().id().orElseThrow());
    }

    @Test
    void preservedAttributePathOnlyProtectsThatAttribute() {
        Manifest base = yaml("""
            structure:
              nav: {id: main-nav, class: dark}
            """);
        Manifest child = yaml("""
            metadata:
              preserveSlots: [structure.nav.id]
            structure:
              nav: {id: other, class: light}
            """);

        Manifest merged = engine.merge(base, child);

        assertEquals("main-nav", merged.structure().id().orElseThrow());
        assertEquals("light", merged.structure().props().attributes().get("class"));
    }

    @Test
    void nestedAttributeMapsAreDeepMerged() {
        Manifest base = yaml("""
            structure:
              div:
                data: {theme: dark, lang: en}
            """);
        Manifest child = yaml("""
            structure:
              div:
                data: {lang: fr}
            """);

        Manifest merged = engine.merge(base, child);

        assertEquals(Map.of("theme", "dark", "lang", "fr"), merged.structure().props().attributes().get("data"));
    }

    @Test
    void singleChildNodesMergeRecursively() {
        Manifest base = yaml("""
            structure:
              main:
                children:
                  section: {id: body, class: wide}
            """);
        Manifest child = yaml("""
            structure:
              main:
                children:
                  section: {text: Welcome}
            """);

        Manifest merged = engine.merge(base, child);

        var section = merged.structure().props().children().get(0);
        assertTrue(merged.structure().props().singleChild());
        assertEquals("body", section.id().orElseThrow());
        assertEquals("Welcome", section.props().text());
    }

    @Test
    void overrideStructureReplacesAncestorTree() {
        Manifest base = yaml("""
            structure:
              div: {id: app, children: [{footer: {text: base}}]}
            """);
        Manifest child = yaml("""
            metadata:
              overrideStructure: true
            structure:
              div: {id: replaced}
            """);

        Manifest merged = engine.merge(base, child);

        assertEquals("replaced", merged.structure().id().orElseThrow());
        assertTrue(merged.structure().props().children().isEmpty());
    }

    @Test
    void stylesOverlayByNameUnlessMergeIsDisabled() {
        Manifest base = yaml("""
            styles:
              card: {color: red}
              shared: {margin: 0}
            """);
        Manifest child = yaml("""
            styles:
              card: {color: blue}
            """);
        Manifest replacing = yaml("""
            metadata:
              mergeStyles: false
            styles:
              card: {color: blue}
            """);

        assertEquals(List.of("card", "shared"), List.copyOf(engine.merge(base, child).styles().keySet()));
        assertEquals("blue", engine.merge(base, child).styles().get("card").properties().get("color"));
        assertEquals(List.of("card"), List.copyOf(engine.merge(base, replacing).styles().keySet()));
    }

    @Test
    void metadataIsOverlaidAndExtendsIsDropped() {
        Manifest base = yaml("""
            metadata: {title: Base, description: Shared chrome, version: "2.0"}
            """);
        Manifest child = yaml("""
            metadata: {title: Home, extends: base.yaml, author: me}
            """);

        Manifest merged = engine.merge(base, child);

        assertEquals("Home", merged.metadata().title());
        assertEquals("Shared chrome", merged.metadata().description());
        assertEquals("2.0", merged.metadata().version());
        assertEquals("me", merged.metadata().attributes().get("author"));
        assertNull(merged.metadata().extendsLocator());
        assertFalse(merged.metadata().hasAncestor());
    }

    @Test
    void importsSlotsAndModulesAreCombined() {
        Manifest base = yaml("""
            modules:
              - {alias: nav, url: nav-v1.yaml}
            imports:
              styles: [base.css]
              slots:
                sidebar: sidebar-default.yaml
            templateSlots:
              sidebar: {target: side}
              content: {target: main}
            """);
        Manifest child = yaml("""
            modules:
              - {alias: nav, url: nav-v2.yaml}
              - {alias: footer, url: footer.yaml}
            imports:
              styles: [base.css, page.css]
              slots:
                sidebar: sidebar-page.yaml
            templateSlots:
              content: {target: page-main, required: true}
            """);

        Manifest merged = engine.merge(base, child);

        assertEquals("nav-v2.yaml", merged.modules().get(0).locator());
        assertEquals(2, merged.modules().size());
        var stylesheets = new ArrayList<String>();
        var slotLocators = new ArrayList<String>();
        for (var declaration : merged.imports()) {
            if (declaration.type() == ImportType.STYLESHEET) {
                stylesheets.add(declaration.locator());
            } else if (declaration.isSlotImport()) {
                slotLocators.add(declaration.locator());
            }
        }
        assertEquals(List.of("base.css", "page.css"), stylesheets);
        assertEquals(List.of("sidebar-page.yaml"), slotLocators);
        assertEquals("side", merged.templateSlots().get("sidebar").target());
        assertEquals("page-main", merged.templateSlots().get("content").target());
    }

    @Test
    void chainOfAnyDepthFlattensAncestorFirst() {
        List<Manifest> chain = new ArrayList<>();
        chain.add(yaml("""
            styles:
              level: {depth: "0", root: "yes"}
            structure:
              div: {id: app, data-level: "0"}
            """));
        for (int level = 1; level <= 5; level++) {
            chain.add(yaml("metadata: {extends: level" + (level - 1) + "}\n"
                + "styles:\n  level: {depth: \"" + level + "\"}\n"
                + "structure:\n  div: {data-level: \"" + level + "\"}\n"));
        }

        Manifest flattened = engine.mergeChain(chain);

        Manifest stepwise = chain.get(0).toBuilder().metadata(chain.get(0).metadata().withoutAncestor()).build();
        for (Manifest child : chain.subList(1, chain.size())) {
            stepwise = engine.merge(stepwise, child);
        }
        assertEquals(stepwise, flattened);
        assertEquals(Map.of("depth", "5", "root", "yes"), flattened.styles().get("level").properties());
        assertEquals("5", flattened.structure().props().attributes().get("data-level"));
        assertEquals("app", flattened.structure().id().orElseThrow());
    }
}
