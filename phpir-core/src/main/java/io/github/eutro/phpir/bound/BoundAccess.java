package io.github.eutro.phpir.bound;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * How the context of an expression uses it: whether its value is read,
 * whether it is written to, and what type a read value is converted to.
 * <p>
 * An access of {@link #NONE} means the expression is only evaluated for its effects.
 */
public final class BoundAccess {
    private static final int READ_FLAG = 1;
    private static final int WRITE_FLAG = 2;

    public static final BoundAccess NONE = new BoundAccess(0, null);
    public static final BoundAccess READ = new BoundAccess(READ_FLAG, null);
    public static final BoundAccess WRITE = new BoundAccess(WRITE_FLAG, null);
    public static final BoundAccess READ_WRITE = new BoundAccess(READ_FLAG | WRITE_FLAG, null);

    private final int flags;
    @Nullable
    private final TypeRef targetType;

    private BoundAccess(int flags, @Nullable TypeRef targetType) {
        this.flags = flags;
        this.targetType = targetType;
    }

    public boolean isNone() {
        return flags == 0;
    }

    public boolean isRead() {
        return (flags & READ_FLAG) != 0;
    }

    public boolean isWrite() {
        return (flags & WRITE_FLAG) != 0;
    }

    /**
     * Get the type the read value is converted to, if the context requires one.
     *
     * @return The target type, or null.
     */
    public @Nullable TypeRef getTargetType() {
        return targetType;
    }

    /**
     * Get this access, additionally reading the value.
     *
     * @return The new access.
     */
    public BoundAccess withRead() {
        return isRead() ? this : new BoundAccess(flags | READ_FLAG, targetType);
    }

    /**
     * Get this access, additionally reading the value, converted to {@code targetType}.
     *
     * @param targetType The type the value is read as.
     * @return The new access.
     */
    public BoundAccess withRead(TypeRef targetType) {
        return new BoundAccess(flags | READ_FLAG, targetType);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BoundAccess that = (BoundAccess) o;
        return flags == that.flags && targetType == that.targetType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(flags, targetType);
    }

    @Override
    public String toString() {
        String s;
        switch (flags) {
            case 0:
                s = "none";
                break;
            case READ_FLAG:
                s = "read";
                break;
            case WRITE_FLAG:
                s = "write";
                break;
            default:
                s = "readwrite";
                break;
        }
        return targetType == null ? s : s + ":" + targetType;
    }
}
