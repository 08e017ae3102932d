package io.github.tmarsteel.flags;

import org.jetbrains.annotations.NotNull;

import java.util.Optional;

/**
 * An immutable combination of flags of one enum, as produced by {@link Flags#or} and {@link Flags#and}.
 * Every {@link FlagSet} operation that takes a single flag also takes a mask.
 * @param <E> the flag enum
 */
public final class FlagMask<E extends Enum<E> & FlagValue> {
    private final FlagType<E> flagType;
    private final long bits;

    FlagMask(@NotNull FlagType<E> flagType, long bits) {
        this.flagType = flagType;
        this.bits = bits & flagType.mask();
    }

    public @NotNull FlagType<E> getFlagType() {
        return flagType;
    }

    public long bits() {
        return bits;
    }

    public boolean isEmpty() {
        return bits == 0;
    }

    public @NotNull FlagMask<E> or(@NotNull E flag) {
        return new FlagMask<>(flagType, bits | flagType.requireMember(flag).flagValue());
    }

    public @NotNull FlagMask<E> or(@NotNull FlagMask<E> other) {
        flagType.requireSame(other.flagType);
        return new FlagMask<>(flagType, bits | other.bits);
    }

    public @NotNull FlagMask<E> and(@NotNull E flag) {
        return new FlagMask<>(flagType, bits & flagType.requireMember(flag).flagValue());
    }

    public @NotNull FlagMask<E> and(@NotNull FlagMask<E> other) {
        flagType.requireSame(other.flagType);
        return new FlagMask<>(flagType, bits & other.bits);
    }

    /**
     * @return the declared constant with exactly the bits of this mask, e.g. an {@code ALL} constant for
     * the union of all single-bit constants
     */
    public @NotNull Optional<E> asFlag() {
        return flagType.constantOf(bits);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FlagMask)) return false;
        var other = (FlagMask<?>) o;
        return flagType == other.flagType && bits == other.bits;
    }

    @Override
    public int hashCode() {
        return 31 * flagType.enumClass().hashCode() + Long.hashCode(bits);
    }

    @Override
    public String toString() {
        return "FlagMask<" + flagType.enumClass().getSimpleName() + ">" + flagType.describe(bits);
    }
}
