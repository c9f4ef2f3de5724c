package io.github.eutro.phpir.ext;

import org.jetbrains.annotations.Nullable;

/**
 * Something that {@link Ext}s can be attached to. See the
 * {@link io.github.eutro.phpir.ext package documentation}.
 */
public interface ExtContainer {
    /**
     * Attach {@code value} to this container under {@code ext}, replacing any previous value.
     *
     * @param ext   The ext.
     * @param value The value.
     * @param <T>   The type of the ext.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Get the value of {@code ext} in this container, or null if it is absent.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value, or null.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    /**
     * Get the value of {@code ext} in this container, throwing if it is absent.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value.
     * @throws IllegalStateException If the ext is absent.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T nullable = getNullable(ext);
        if (nullable != null) return nullable;
        throw new IllegalStateException("Ext not present: " + ext);
    }
}
