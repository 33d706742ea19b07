package work.lcod.manifest.model;

import java.util.Locale;
import java.util.Optional;

public enum ImportType {
    STYLESHEET("styles"),
    SCRIPT("scripts"),
    FONT("fonts"),
    MODULE_FOR_SLOT("slots");

    private final String sectionKey;

    ImportType(String sectionKey) {
        this.sectionKey = sectionKey;
    }

    /**
     * Key used by the grouped {@code imports: {scripts: [...], ...}} form.
     */
    public String sectionKey() {
        return sectionKey;
    }

    public static Optional<ImportType> from(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "styles", "style", "stylesheet", "stylesheets", "css" -> Optional.of(STYLESHEET);
            case "scripts", "script", "js" -> Optional.of(SCRIPT);
            case "fonts", "font" -> Optional.of(FONT);
            case "slots", "slot", "module", "module-for-slot" -> Optional.of(MODULE_FOR_SLOT);
            default -> Optional.empty();
        };
    }
}
