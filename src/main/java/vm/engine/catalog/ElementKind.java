package vm.engine.catalog;

/**
 * Supported element kinds of a virtual array
 */
public enum ElementKind {
    INT,
    FIXED_TEXT,
    // declared only; needs a secondary offsets file that does not exist yet
    VAR_TEXT;

    public boolean isText() { return this != INT; }
}
