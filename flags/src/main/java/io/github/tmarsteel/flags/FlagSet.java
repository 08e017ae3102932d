package io.github.tmarsteel.flags;

import org.jetbrains.annotations.NotNull;

import java.util.EnumSet;

/**
 * Models a flag field, where each possible flag is represented by an enum entry in {@link E}. The bits are
 * stored with the width declared on {@link E} (see {@link FlagStorage}).
 * <p>
 * {@link #hasFlag} tests for overlap: given a combination of flags it is true if <em>any</em> of them is set.
 * Use {@link #hasAllFlags} to test for all of them.
 * <p>
 * Instances are not thread-safe.
 * @param <E> the enum type that holds the flag options
 */
public final class FlagSet<E extends Enum<E> & FlagValue> {
    private final FlagType<E> flagType;
    private long value;

    public FlagSet(@NotNull Class<E> enumClass) {
        this(FlagType.of(enumClass), 0);
    }

    private FlagSet(@NotNull FlagType<E> flagType, long value) {
        this.flagType = flagType;
        this.value = value & flagType.mask();
    }

    public static <E extends Enum<E> & FlagValue> @NotNull FlagSet<E> noneOf(@NotNull Class<E> enumClass) {
        return new FlagSet<>(enumClass);
    }

    public static <E extends Enum<E> & FlagValue> @NotNull FlagSet<E> of(@NotNull E flag) {
        return new FlagSet<>(FlagType.ofConstant(flag), flag.flagValue());
    }

    @SafeVarargs
    public static <E extends Enum<E> & FlagValue> @NotNull FlagSet<E> of(@NotNull E first, @NotNull E... rest) {
        var flagType = FlagType.ofConstant(first);
        return new FlagSet<>(flagType, bitsOf(flagType, first, rest));
    }

    public static <E extends Enum<E> & FlagValue> @NotNull FlagSet<E> of(@NotNull FlagMask<E> mask) {
        return new FlagSet<>(mask.getFlagType(), mask.bits());
    }

    public static <E extends Enum<E> & FlagValue> @NotNull FlagSet<E> copyOf(@NotNull FlagSet<E> other) {
        return new FlagSet<>(other.flagType, other.value);
    }

    /**
     * Bits beyond the width of {@link E} are discarded; bits within it are kept even if no constant declares them.
     */
    public static <E extends Enum<E> & FlagValue> @NotNull FlagSet<E> fromBits(@NotNull Class<E> enumClass, long bits) {
        return new FlagSet<>(FlagType.of(enumClass), bits);
    }

    public @NotNull FlagType<E> getFlagType() {
        return flagType;
    }

    /**
     * @return the raw bits, as they would be stored in the underlying integer of {@link E} (but unsigned)
     */
    public long bits() {
        return value;
    }

    public void set(@NotNull E flag) {
        this.value |= flagType.requireMember(flag).flagValue();
    }

    @SafeVarargs
    public final void set(@NotNull E first, @NotNull E... rest) {
        this.value |= bitsOf(flagType, first, rest);
    }

    public void set(@NotNull FlagMask<E> mask) {
        flagType.requireSame(mask.getFlagType());
        this.value |= mask.bits();
    }

    /**
     * Clears all bits of {@code flag}.
     */
    public void reset(@NotNull E flag) {
        this.value &= ~flagType.requireMember(flag).flagValue();
    }

    @SafeVarargs
    public final void reset(@NotNull E first, @NotNull E... rest) {
        this.value &= ~bitsOf(flagType, first, rest);
    }

    /**
     * Clears all bits of {@code mask}, e.g. {@code reset(Flags.or(READ, WRITE))} clears both flags.
     */
    public void reset(@NotNull FlagMask<E> mask) {
        flagType.requireSame(mask.getFlagType());
        this.value &= ~mask.bits();
    }

    public void clear() {
        this.value = 0;
    }

    /**
     * @return whether any bit of {@code flag} is set
     */
    public boolean hasFlag(@NotNull E flag) {
        return (this.value & flagType.requireMember(flag).flagValue()) != 0;
    }

    /**
     * @return whether any bit of {@code mask} is set. This is an overlap test, so {@code hasFlag(Flags.or(A, B))}
     * is true when only {@code A} is set.
     */
    public boolean hasFlag(@NotNull FlagMask<E> mask) {
        flagType.requireSame(mask.getFlagType());
        return (this.value & mask.bits()) != 0;
    }

    /**
     * @return whether every bit of every given flag is set
     */
    @SafeVarargs
    public final boolean hasAllFlags(@NotNull E first, @NotNull E... rest) {
        long required = bitsOf(flagType, first, rest);
        return (this.value & required) == required;
    }

    public boolean hasAllFlags(@NotNull FlagMask<E> mask) {
        flagType.requireSame(mask.getFlagType());
        return (this.value & mask.bits()) == mask.bits();
    }

    /**
     * @return whether any flag at all is set
     */
    public boolean isAnySet() {
        return this.value != 0;
    }

    public boolean isEmpty() {
        return this.value == 0;
    }

    public @NotNull FlagMask<E> toMask() {
        return new FlagMask<>(flagType, value);
    }

    /**
     * @return the declared constants all of whose bits are set. Composite constants are included when all of
     * their bits are set; bits no constant declares are not represented.
     */
    public @NotNull EnumSet<E> toEnumSet() {
        return flagType.constantsIn(value);
    }

    /**
     * Checks all flags before any bits are combined, so a rejected call leaves the set unchanged.
     */
    private static <E extends Enum<E> & FlagValue> long bitsOf(@NotNull FlagType<E> flagType, @NotNull E first, @NotNull E[] rest) {
        long bits = flagType.requireMember(first).flagValue();
        for (E flag : rest) {
            bits |= flagType.requireMember(flag).flagValue();
        }
        return bits;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FlagSet)) return false;
        var other = (FlagSet<?>) o;
        return flagType == other.flagType && value == other.value;
    }

    @Override
    public int hashCode() {
        return 31 * flagType.enumClass().hashCode() + Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "FlagSet<" + flagType.enumClass().getSimpleName() + ">" + flagType.describe(value);
    }
}
