package io.github.tmarsteel.flags.jna;

import com.sun.jna.*;
import io.github.tmarsteel.flags.FlagType;
import io.github.tmarsteel.flags.FlagValue;
import io.github.tmarsteel.flags.FlagWidth;
import org.jetbrains.annotations.NotNull;

/**
 * Passes a single {@link FlagValue} enum constant to native code as its {@link FlagValue#flagValue() value}.
 */
public class FlagValueTypeConverter implements TypeConverter {
    private final FlagWidth nativeWidth;

    public FlagValueTypeConverter() {
        this(FlagWidth.I32);
    }

    public FlagValueTypeConverter(@NotNull FlagWidth nativeWidth) {
        this.nativeWidth = nativeWidth;
    }

    @Override
    public Object fromNative(Object nativeValue, FromNativeContext context) {
        long value = nativeValue == null ? 0 : nativeWidth.unbox((Number) nativeValue);
        Class<?> targetClass = context.getTargetType();
        FlagType<?> flagType = FlagType.ofUnchecked(targetClass);

        return flagType.constantOf(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown flag value 0x" + Long.toHexString(value) + " for enum " + targetClass.getName()));
    }

    @Override
    public Class<?> nativeType() {
        return nativeWidth.primitiveType();
    }

    @Override
    public Object toNative(Object value, ToNativeContext context) {
        if (value == null) {
            return nativeWidth.box(0);
        }
        long flagValue = ((FlagValue) value).flagValue();
        if (!nativeWidth.fits(flagValue)) {
            throw new IllegalArgumentException(value + " does not fit into a native " + nativeWidth.bitCount() + "-bit integer");
        }
        return nativeWidth.box(flagValue);
    }
}
