package io.github.eutro.phpir.ext;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * An implementation of {@link ExtContainer} backed by a lazily allocated map.
 */
public class ExtHolder implements ExtContainer {
    @Nullable
    private Map<Ext<?>, Object> map = null; // most bound nodes carry nothing, so don't allocate

    @NotNull
    private Map<Ext<?>, Object> getMap() {
        if (map == null) {
            map = new IdentityHashMap<>(4);
        }
        return map;
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        getMap().put(ext, value);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (map == null) return null;
        return (T) map.get(ext);
    }

    /**
     * Copy every ext held directly by {@code other} into this holder.
     * Exts {@code other} only sees through delegation are not copied.
     *
     * @param other The holder to copy from.
     */
    protected void copyExtsFrom(ExtHolder other) {
        if (other.map == null) return;
        getMap().putAll(other.map);
    }
}
