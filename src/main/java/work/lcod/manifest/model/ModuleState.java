package work.lcod.manifest.model;

/**
 * Lifecycle of a referenced manifest during one resolution call.
 */
public enum ModuleState {
    UNRESOLVED,
    LOADING,
    LOADED,
    FAILED;

    public boolean canMoveTo(ModuleState next) {
        return switch (this) {
            case UNRESOLVED -> next == LOADING;
            case LOADING -> next == LOADED || next == FAILED;
            case LOADED, FAILED -> false;
        };
    }
}
