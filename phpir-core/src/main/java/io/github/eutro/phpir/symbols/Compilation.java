package io.github.eutro.phpir.symbols;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;

/**
 * The state shared by every routine of a compilation: the declared PHP extensions
 * and the symbols to resolve names against.
 */
public class Compilation {
    private final ImmutableSet<String> extensions;
    private final SymbolProvider symbols;

    /**
     * @param extensions The names of the PHP extensions the compiled code will run with.
     * @param symbols    The symbols of the compilation.
     */
    public Compilation(Collection<String> extensions, SymbolProvider symbols) {
        ImmutableSet.Builder<String> builder = ImmutableSet.builder();
        for (String extension : extensions) {
            builder.add(extension.toLowerCase(Locale.ROOT));
        }
        this.extensions = builder.build();
        this.symbols = Preconditions.checkNotNull(symbols, "symbols");
    }

    /**
     * Get the declared extensions, lower case.
     *
     * @return The extensions.
     */
    public Set<String> getExtensions() {
        return extensions;
    }

    /**
     * Whether an extension is declared, ignoring case.
     *
     * @param name The name of the extension.
     * @return Whether it is declared.
     */
    public boolean hasExtension(String name) {
        return extensions.contains(name.toLowerCase(Locale.ROOT));
    }

    public SymbolProvider getSymbols() {
        return symbols;
    }
}
