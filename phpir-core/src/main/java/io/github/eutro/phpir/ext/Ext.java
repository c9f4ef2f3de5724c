package io.github.eutro.phpir.ext;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A key under which a value (of type {@code T}) can be attached
 * to an {@link ExtContainer}.
 * <p>
 * Exts are compared by identity, so each one should be created once and
 * kept in a constant, see {@link CommonExts}.
 *
 * @param <T> The type of the attached value.
 */
public final class Ext<T> {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger(0);

    private final Class<? super T> type;
    private final int id = ID_COUNTER.getAndIncrement();
    private final String name;

    private Ext(Class<? super T> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Creates a new ext for values of (a subtype of) the given class.
     * <p>
     * The class only serves debugging, since generic types such as
     * {@code Set<String>} have no class object of their own.
     *
     * @param type The most specific superclass of the values.
     * @param name The name of the ext, for debugging.
     * @param <T>  The type of the class.
     * @param <R>  The type of the ext.
     * @return The new ext.
     */
    @SuppressWarnings("unchecked")
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return new Ext<>((Class<? super R>) type, name);
    }

    /**
     * Get the name this ext was created with.
     *
     * @return The name.
     */
    public String getName() {
        return name;
    }

    /**
     * Get the value of this ext in the given container, or a default.
     *
     * @param ec  The container.
     * @param def The value to return if the ext is absent.
     * @return The attached value, or {@code def}.
     */
    public T getOrDefault(ExtContainer ec, T def) {
        T value = ec.getNullable(this);
        return value == null ? def : value;
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + ": " + type.getSimpleName();
    }
}
