package io.github.flameyossnowy.datamapper.api.property;

import javax.lang.model.element.Modifier;

/**
 * Visibility of a generated reader or writer.
 */
public enum Visibility {
    PUBLIC,
    PROTECTED,
    PACKAGE_PRIVATE,
    PRIVATE;

    /** The source modifier for this visibility, or {@code null} for package-private. */
    public Modifier modifier() {
        return switch (this) {
            case PUBLIC -> Modifier.PUBLIC;
            case PROTECTED -> Modifier.PROTECTED;
            case PRIVATE -> Modifier.PRIVATE;
            case PACKAGE_PRIVATE -> null;
        };
    }
}
