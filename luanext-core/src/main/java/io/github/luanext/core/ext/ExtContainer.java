package io.github.luanext.core.ext;

import org.jetbrains.annotations.Nullable;

import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Something analysis results can be attached to, keyed by {@link Ext}.
 * <p>
 * Passes find the results of the passes they depend on this way.
 */
public interface ExtContainer {
    /**
     * Attach a value, replacing any value already attached with the same ext.
     *
     * @param ext   The ext.
     * @param value The value.
     * @param <T>   The type of the value.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Get the value attached with an ext.
     *
     * @param ext The ext.
     * @param <T> The type of the value.
     * @return The value, or null if none is attached.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    default <T> Optional<T> getExt(Ext<T> ext) {
        return Optional.ofNullable(getNullable(ext));
    }

    /**
     * Get the value attached with an ext, which must be present.
     *
     * @param ext The ext.
     * @param <T> The type of the value.
     * @return The value.
     * @throws NoSuchElementException If no value is attached with the ext.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T value = getNullable(ext);
        if (value == null) {
            throw new NoSuchElementException("ext " + ext.getName() + " is not attached to " + this);
        }
        return value;
    }
}
