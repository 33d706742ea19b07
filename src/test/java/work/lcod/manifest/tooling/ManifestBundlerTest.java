package work.lcod.manifest.tooling;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static work.lcod.manifest.support.Manifests.yaml;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.manifest.model.ImportType;
import work.lcod.manifest.model.Manifest;
import work.lcod.manifest.model.Node;

class ManifestBundlerTest {
    private final ManifestBundler bundler = new ManifestBundler();

    @Test
    void combinesStylesStructuresAndImports() {
        var manifests = new LinkedHashMap<String, Manifest>();
        manifests.put("home", yaml("""
            styles:
              title: {size: 20px}
            imports:
              styles: [site.css]
              slots:
                hero: {content: {h1: {text: Hi}}}
            structure:
              main: {text: Home}
            interactions:
              open: {on: click}
            """));
        manifests.put("about", yaml("""
            styles:
              title: {size: 16px}
            imports:
              styles: [site.css, about.css]
            structure:
              section: {text: About}
            interactions:
              close: {on: click}
            """));

        Manifest bundle = bundler.bundle("site", manifests);

        assertEquals("site", bundle.metadata().title());
        assertEquals(ManifestBundler.BUNDLE_VERSION, bundle.metadata().version());
        assertEquals(List.of("home", "about"), bundle.metadata().attributes().get("bundledFrom"));
        assertEquals(List.of("home-title", "about-title"), List.copyOf(bundle.styles().keySet()));
        assertEquals("div", bundle.structure().tag());
        assertEquals(List.of("main", "section"), bundle.structure().props().children().stream().map(Node::tag).toList());
        assertEquals(
            List.of("site.css", "about.css"),
            bundle.imports().stream().filter(i -> i.type() == ImportType.STYLESHEET).map(i -> i.locator()).toList()
        );
        assertEquals(2, bundle.imports().size());
        assertEquals(
            Map.of("home-open", Map.of("on", "click"), "about-close", Map.of("on", "click")),
            bundle.extras().get("interactions")
        );
    }

    @Test
    void blankNameFallsBackToDefault() {
        Manifest bundle = bundler.bundle(" ", Map.of("one", yaml("structure: {p: {text: x}}\n")));

        assertEquals("bundled-manifest", bundle.metadata().attributes().get("name"));
    }

    @Test
    void rejectsEmptyInput() {
        assertThrows(IllegalArgumentException.class, () -> bundler.bundle("site", Map.of()));
    }
}
