package io.github.tmarsteel.flags;

import org.jetbrains.annotations.NotNull;

/**
 * Bitwise combinators for {@link FlagValue} enum constants. Only enums implementing {@link FlagValue} are accepted,
 * so {@code Flags.or(ElementType.FIELD, ElementType.METHOD)} does not compile.
 */
public final class Flags {
    private Flags() {
    }

    /**
     * @return a mask with the bits of both {@code a} and {@code b}
     */
    public static <E extends Enum<E> & FlagValue> @NotNull FlagMask<E> or(@NotNull E a, @NotNull E b) {
        var flagType = FlagType.ofConstant(a);
        return new FlagMask<>(flagType, a.flagValue() | flagType.requireMember(b).flagValue());
    }

    public static <E extends Enum<E> & FlagValue> @NotNull FlagMask<E> or(@NotNull FlagMask<E> a, @NotNull E b) {
        return a.or(b);
    }

    public static <E extends Enum<E> & FlagValue> @NotNull FlagMask<E> or(@NotNull E a, @NotNull FlagMask<E> b) {
        return b.or(a);
    }

    public static <E extends Enum<E> & FlagValue> @NotNull FlagMask<E> or(@NotNull FlagMask<E> a, @NotNull FlagMask<E> b) {
        return a.or(b);
    }

    /**
     * @return a mask with the bits {@code a} and {@code b} have in common; empty for two distinct single-bit flags
     */
    public static <E extends Enum<E> & FlagValue> @NotNull FlagMask<E> and(@NotNull E a, @NotNull E b) {
        var flagType = FlagType.ofConstant(a);
        return new FlagMask<>(flagType, a.flagValue() & flagType.requireMember(b).flagValue());
    }

    public static <E extends Enum<E> & FlagValue> @NotNull FlagMask<E> and(@NotNull FlagMask<E> a, @NotNull E b) {
        return a.and(b);
    }

    public static <E extends Enum<E> & FlagValue> @NotNull FlagMask<E> and(@NotNull E a, @NotNull FlagMask<E> b) {
        return b.and(a);
    }

    public static <E extends Enum<E> & FlagValue> @NotNull FlagMask<E> and(@NotNull FlagMask<E> a, @NotNull FlagMask<E> b) {
        return a.and(b);
    }

    public static <E extends Enum<E> & FlagValue> @NotNull FlagMask<E> maskOf(@NotNull E flag) {
        return new FlagMask<>(FlagType.ofConstant(flag), flag.flagValue());
    }

    public static <E extends Enum<E> & FlagValue> @NotNull FlagMask<E> noneOf(@NotNull Class<E> enumClass) {
        return new FlagMask<>(FlagType.of(enumClass), 0);
    }

    /**
     * @return the union of all constants declared in {@code enumClass}
     */
    public static <E extends Enum<E> & FlagValue> @NotNull FlagMask<E> allOf(@NotNull Class<E> enumClass) {
        var flagType = FlagType.of(enumClass);
        return new FlagMask<>(flagType, flagType.declaredBits());
    }
}
