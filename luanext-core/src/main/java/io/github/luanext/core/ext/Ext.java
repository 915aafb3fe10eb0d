package io.github.luanext.core.ext;

import org.jetbrains.annotations.Nullable;

/**
 * A typed key for a value attached to an {@link ExtContainer}.
 * <p>
 * Exts are compared by identity, so each should be created once and kept in a constant.
 *
 * @param <T> The type of the attached value.
 */
public final class Ext<T> {
    private final String name;
    private final Class<T> type;

    private Ext(String name, Class<T> type) {
        this.name = name;
        this.type = type;
    }

    /**
     * Create an ext.
     *
     * @param name The name of the ext, for diagnostics.
     * @param type The type of the attached value.
     * @param <T>  The type of the attached value.
     * @return The ext.
     */
    public static <T> Ext<T> of(String name, Class<T> type) {
        return new Ext<>(name, type);
    }

    public String getName() {
        return name;
    }

    public Class<T> getType() {
        return type;
    }

    /**
     * Check that a value may be attached with this ext.
     *
     * @param value The value.
     * @return The value.
     * @throws ClassCastException If the value is not of this ext's type.
     */
    @Nullable
    T cast(@Nullable Object value) {
        return type.cast(value);
    }

    @Override
    public String toString() {
        return name + ": " + type.getSimpleName();
    }
}
