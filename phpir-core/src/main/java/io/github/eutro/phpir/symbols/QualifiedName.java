package io.github.eutro.phpir.symbols;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A possibly namespaced PHP name, such as {@code Foo\bar}.
 * <p>
 * Names of functions and types are case-insensitive in PHP, and so is equality here.
 */
public final class QualifiedName {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_\\x80-\\uffff][A-Za-z0-9_\\x80-\\uffff]*");

    private final ImmutableList<String> namespaces;
    private final String name;
    private final boolean fullyQualified;

    public QualifiedName(List<String> namespaces, String name, boolean fullyQualified) {
        this.namespaces = ImmutableList.copyOf(namespaces);
        this.name = Preconditions.checkNotNull(name, "name");
        this.fullyQualified = fullyQualified;
    }

    /**
     * Create a name without a namespace.
     *
     * @param name The name.
     * @return The qualified name.
     */
    public static QualifiedName of(String name) {
        return new QualifiedName(ImmutableList.of(), name, false);
    }

    /**
     * Parse a name as it appears in source, {@code \}-separated.
     *
     * @param text           The text.
     * @param fullyQualified Whether the name is fully qualified even without a leading {@code \}.
     * @return The name.
     * @throws IllegalArgumentException If the text is not a valid name.
     */
    public static QualifiedName parse(String text, boolean fullyQualified) {
        QualifiedName parsed = tryParse(text, fullyQualified);
        if (parsed == null) throw new IllegalArgumentException("Not a valid name: " + text);
        return parsed;
    }

    /**
     * Parse a name as it appears in source, {@code \}-separated.
     *
     * @param text           The text.
     * @param fullyQualified Whether the name is fully qualified even without a leading {@code \}.
     * @return The name, or null if the text is not a valid name.
     */
    public static @Nullable QualifiedName tryParse(String text, boolean fullyQualified) {
        String rest = text;
        if (rest.startsWith("\\")) {
            rest = rest.substring(1);
            fullyQualified = true;
        }
        String[] segments = rest.split("\\\\", -1);
        for (String segment : segments) {
            if (!IDENTIFIER.matcher(segment).matches()) return null;
        }
        int last = segments.length - 1;
        return new QualifiedName(
                ImmutableList.copyOf(segments).subList(0, last),
                segments[last],
                fullyQualified
        );
    }

    public List<String> getNamespaces() {
        return namespaces;
    }

    public String getName() {
        return name;
    }

    public boolean isFullyQualified() {
        return fullyQualified;
    }

    /**
     * Get this name without its namespaces.
     *
     * @return The unqualified name.
     */
    public QualifiedName unqualified() {
        return namespaces.isEmpty() ? this : of(name);
    }

    private String lowerKey() {
        return toString().toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return lowerKey().equals(((QualifiedName) o).lowerKey());
    }

    @Override
    public int hashCode() {
        return lowerKey().hashCode();
    }

    @Override
    public String toString() {
        if (namespaces.isEmpty()) return name;
        return String.join("\\", namespaces) + "\\" + name;
    }
}
