package work.lcod.manifest.load;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LocatorsTest {
    @Test
    void relativeReferencesFollowTheirParent() {
        assertEquals("base.yaml", Locators.resolve("../base.yaml", "pages/home.yaml"));
        assertEquals("pages/parts/nav.yaml", Locators.resolve("parts/nav.yaml", "pages/home.yaml"));
        assertEquals("nav.yaml", Locators.resolve("nav.yaml", "home.yaml"));
        assertEquals("/srv/ui/base.yaml", Locators.resolve("/srv/ui/base.yaml", "pages/home.yaml"));
    }

    @Test
    void topLevelLocatorsAreNormalized() {
        assertEquals("pages/home.yaml", Locators.canonical("./pages/../pages/home.yaml"));
        assertEquals("home.yaml", Locators.canonical("  home.yaml "));
    }

    @Test
    void remoteParentsResolveAsUrls() {
        assertEquals(
            "https://cdn.example.com/ui/base.yaml",
            Locators.resolve("../base.yaml", "https://cdn.example.com/ui/pages/home.yaml")
        );
        assertEquals(
            "http://example.com/a/c.yaml",
            Locators.canonical("http://example.com/a/b/../c.yaml")
        );
    }

    @Test
    void detectsRemoteLocators() {
        assertTrue(Locators.isRemote("HTTPS://example.com/x.yaml"));
        assertFalse(Locators.isRemote("file.yaml"));
        assertFalse(Locators.isRemote(null));
    }

    @Test
    void rejectsBlankLocators() {
        assertThrows(IllegalArgumentException.class, () -> Locators.canonical(" "));
        assertThrows(IllegalArgumentException.class, () -> Locators.canonical(null));
    }
}
