package io.github.eutro.phpir.symbols;

import com.google.common.base.Preconditions;
import org.jetbrains.annotations.Nullable;

/**
 * A class, interface or trait.
 */
public class TypeSymbol {
    /**
     * The root of the class hierarchy, which user classes without
     * an {@code extends} clause implicitly derive from.
     */
    public static final TypeSymbol OBJECT = new TypeSymbol(QualifiedName.of("stdClass"), null, false);

    private final QualifiedName name;
    @Nullable
    private final TypeSymbol baseType;
    private final boolean isTrait;

    public TypeSymbol(QualifiedName name, @Nullable TypeSymbol baseType, boolean isTrait) {
        this.name = Preconditions.checkNotNull(name, "name");
        this.baseType = baseType;
        this.isTrait = isTrait;
    }

    /**
     * Create a class.
     *
     * @param name     The name.
     * @param baseType The class it extends, or null.
     * @return The class.
     */
    public static TypeSymbol ofClass(QualifiedName name, @Nullable TypeSymbol baseType) {
        return new TypeSymbol(name, baseType == null ? OBJECT : baseType, false);
    }

    public static TypeSymbol ofTrait(QualifiedName name) {
        return new TypeSymbol(name, null, true);
    }

    public QualifiedName getQualifiedName() {
        return name;
    }

    public @Nullable TypeSymbol getBaseType() {
        return baseType;
    }

    public boolean isTrait() {
        return isTrait;
    }

    public boolean isObjectType() {
        return this == OBJECT;
    }

    @Override
    public String toString() {
        return (isTrait ? "trait " : "class ") + name;
    }
}
