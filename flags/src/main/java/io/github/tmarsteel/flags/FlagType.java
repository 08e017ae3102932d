package io.github.tmarsteel.flags;

import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * Metadata about a {@link FlagValue} enum: its width and its constants. Computed and validated once
 * per enum class.
 * @param <E> the flag enum
 */
public final class FlagType<E extends Enum<E> & FlagValue> {
    private static final ClassValue<FlagType<?>> CACHE = new ClassValue<>() {
        @Override
        @SuppressWarnings({"unchecked", "rawtypes"})
        protected FlagType<?> computeValue(Class<?> type) {
            if (!type.isEnum()) {
                throw new IllegalArgumentException(type.getName() + " cannot be used as a flag type; it is not a java enum");
            }
            if (!FlagValue.class.isAssignableFrom(type)) {
                throw new IllegalArgumentException(type.getName() + " cannot be used as a flag type; it does not implement " + FlagValue.class.getName());
            }
            return new FlagType(type);
        }
    };

    private final Class<E> enumClass;
    private final FlagWidth width;
    private final List<E> constants;
    private final long declaredBits;

    private FlagType(Class<E> enumClass) {
        this.enumClass = enumClass;
        var storage = enumClass.getAnnotation(FlagStorage.class);
        this.width = storage == null ? FlagWidth.I32 : storage.value();
        this.constants = List.of(enumClass.getEnumConstants());

        long declared = 0;
        for (E constant : constants) {
            long value = constant.flagValue();
            if (!width.fits(value)) {
                throw new IllegalArgumentException(String.format(
                        "Flag %s.%s has value 0x%x, which does not fit into the %d-bit storage of %s",
                        enumClass.getSimpleName(), constant.name(), value, width.bitCount(), enumClass.getName()
                ));
            }
            declared |= value;
        }
        this.declaredBits = declared;
    }

    /**
     * @throws IllegalArgumentException if the enum declares a constant that doesn't fit into its {@link FlagStorage width}
     */
    @SuppressWarnings("unchecked")
    public static <E extends Enum<E> & FlagValue> @NotNull FlagType<E> of(@NotNull Class<E> enumClass) {
        return (FlagType<E>) CACHE.get(enumClass);
    }

    /**
     * Like {@link #of(Class)}, for classes only known at runtime (e.g. from reflection).
     * @throws IllegalArgumentException if the class is not an enum implementing {@link FlagValue}
     */
    public static @NotNull FlagType<?> ofUnchecked(@NotNull Class<?> type) {
        return CACHE.get(type);
    }

    static <E extends Enum<E> & FlagValue> @NotNull FlagType<E> ofConstant(@NotNull E flag) {
        return of(flag.getDeclaringClass());
    }

    public @NotNull Class<E> enumClass() {
        return enumClass;
    }

    public @NotNull FlagWidth width() {
        return width;
    }

    /**
     * @return all bits a value of this type can hold, see {@link FlagWidth#mask()}
     */
    public long mask() {
        return width.mask();
    }

    /**
     * @return the union of the values of all declared constants
     */
    public long declaredBits() {
        return declaredBits;
    }

    public @NotNull List<E> constants() {
        return constants;
    }

    /**
     * Generics keep flags of different enums apart at compile time; this catches what gets past them
     * through raw types and unchecked casts.
     * @return {@code flag}
     * @throws IllegalArgumentException if {@code flag} is not a constant of this enum
     */
    public @NotNull E requireMember(@NotNull Object flag) {
        if (!(flag instanceof Enum) || ((Enum<?>) flag).getDeclaringClass() != enumClass) {
            throw new IllegalArgumentException("Cannot use " + describe(flag) + " as a flag of " + enumClass.getName());
        }
        return enumClass.cast(flag);
    }

    /**
     * @throws IllegalArgumentException if {@code other} is the type of a different enum
     */
    void requireSame(@NotNull FlagType<?> other) {
        if (other != this) {
            throw new IllegalArgumentException("Cannot combine flags of " + other.enumClass.getName() + " with flags of " + enumClass.getName());
        }
    }

    /**
     * @return the declared constant whose value is exactly {@code bits}; the first one if several constants share the value
     */
    public @NotNull Optional<E> constantOf(long bits) {
        return constants.stream()
                .filter(c -> c.flagValue() == bits)
                .findFirst();
    }

    /**
     * @return the nonzero constants whose bits are all contained in {@code bits}
     */
    public @NotNull EnumSet<E> constantsIn(long bits) {
        var result = EnumSet.noneOf(enumClass);
        for (E constant : constants) {
            long value = constant.flagValue();
            if (value != 0 && (bits & value) == value) {
                result.add(constant);
            }
        }
        return result;
    }

    /**
     * Renders {@code bits} as the names of the constants contained in it, followed by the bits no constant covers.
     */
    @NotNull String describe(long bits) {
        var parts = new StringJoiner(", ", "[", "]");
        long covered = 0;
        for (E constant : constantsIn(bits)) {
            parts.add(constant.name());
            covered |= constant.flagValue();
        }
        long unknown = bits & ~covered;
        if (unknown != 0) {
            parts.add("0x" + Long.toHexString(unknown));
        }
        return parts.toString();
    }

    private static String describe(Object flag) {
        if (flag instanceof Enum) {
            return ((Enum<?>) flag).getDeclaringClass().getName() + "." + ((Enum<?>) flag).name();
        }
        return String.valueOf(flag);
    }

    @Override
    public String toString() {
        return "FlagType<" + enumClass.getSimpleName() + ", " + width + ">";
    }
}
