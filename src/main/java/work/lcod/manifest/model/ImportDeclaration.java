package work.lcod.manifest.model;

import java.util.Objects;

/**
 * A typed import. Slot imports name the slot they fill and carry either a locator or inline content.
 */
public record ImportDeclaration(ImportType type, String locator, String slot, boolean optional, Node content) {
    public ImportDeclaration {
        Objects.requireNonNull(type, "type");
        if (type == ImportType.MODULE_FOR_SLOT) {
            if (slot == null || slot.isBlank()) {
                throw new IllegalArgumentException("Slot import requires a slot name");
            }
            if (locator == null && content == null) {
                throw new IllegalArgumentException("Slot import '" + slot + "' needs a locator or inline content");
            }
        } else if (locator == null || locator.isBlank()) {
            throw new IllegalArgumentException("Import of type " + type + " requires a locator");
        }
    }

    public static ImportDeclaration asset(ImportType type, String locator) {
        return new ImportDeclaration(type, locator, null, false, null);
    }

    public static ImportDeclaration slot(String slot, String locator, boolean optional) {
        return new ImportDeclaration(ImportType.MODULE_FOR_SLOT, locator, slot, optional, null);
    }

    public static ImportDeclaration inlineSlot(String slot, Node content) {
        return new ImportDeclaration(ImportType.MODULE_FOR_SLOT, null, slot, false, content);
    }

    public boolean isSlotImport() {
        return type == ImportType.MODULE_FOR_SLOT;
    }

    public boolean needsLoading() {
        return isSlotImport() && content == null;
    }

    public ImportDeclaration withLocator(String newLocator) {
        return new ImportDeclaration(type, newLocator, slot, optional, content);
    }

    public ImportDeclaration withContent(Node newContent) {
        return new ImportDeclaration(type, locator, slot, optional, newContent);
    }
}
