package io.github.luanext.core.ssa;

import java.util.Objects;

/**
 * A version of a source-level variable.
 * <p>
 * Version {@code 0} is the initial value, which callers should treat as undefined;
 * versions from {@code 1} onward are successive definitions of the same name.
 */
public final class SsaVar {
    public final String name;
    public final int version;

    public SsaVar(String name, int version) {
        this.name = name;
        this.version = version;
    }

    /**
     * Whether this is the initial version, with no definition reaching it.
     *
     * @return Whether the version is {@code 0}.
     */
    public boolean isUndefined() {
        return version == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SsaVar)) return false;
        SsaVar that = (SsaVar) o;
        return version == that.version && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, version);
    }

    @Override
    public String toString() {
        return name + "_" + version;
    }
}
