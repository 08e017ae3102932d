package io.github.tmarsteel.flags;

import org.jetbrains.annotations.NotNull;

/**
 * The underlying integer type of a flag enum.
 */
public enum FlagWidth {
    I8(Byte.SIZE, byte.class),
    I16(Short.SIZE, short.class),
    I32(Integer.SIZE, int.class),
    I64(Long.SIZE, long.class),
    ;

    private final int bitCount;
    private final Class<?> primitiveType;

    FlagWidth(int bitCount, Class<?> primitiveType) {
        this.bitCount = bitCount;
        this.primitiveType = primitiveType;
    }

    public int bitCount() {
        return bitCount;
    }

    /**
     * @return the java primitive type of the same width, e.g. {@code byte.class} for {@link #I8}
     */
    public @NotNull Class<?> primitiveType() {
        return primitiveType;
    }

    /**
     * @return all bits a value of this width can hold
     */
    public long mask() {
        return bitCount == Long.SIZE ? -1L : (1L << bitCount) - 1L;
    }

    public boolean fits(long bits) {
        return (bits & ~mask()) == 0;
    }

    /**
     * Truncates the given bits to this width and boxes them in the wrapper of {@link #primitiveType()}.
     */
    public @NotNull Number box(long bits) {
        switch (this) {
            case I8: return (byte) bits;
            case I16: return (short) bits;
            case I32: return (int) bits;
            case I64: return bits;
        }
        throw new IllegalStateException("Unhandled width " + this);
    }

    /**
     * Inverse of {@link #box(long)}: reads the value as unsigned, so {@code (byte) 0x80} becomes {@code 0x80}.
     */
    public long unbox(@NotNull Number value) {
        return value.longValue() & mask();
    }
}
