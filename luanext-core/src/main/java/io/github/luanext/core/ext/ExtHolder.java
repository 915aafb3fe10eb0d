package io.github.luanext.core.ext;

import org.jetbrains.annotations.Nullable;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * An {@link ExtContainer} backed by an identity map.
 * <p>
 * Not thread-safe; a holder is expected to be used by one thread at a time.
 */
public class ExtHolder implements ExtContainer {
    private final Map<Ext<?>, Object> exts = new IdentityHashMap<>();

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        exts.put(ext, ext.cast(value));
    }

    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        return ext.cast(exts.get(ext));
    }
}
