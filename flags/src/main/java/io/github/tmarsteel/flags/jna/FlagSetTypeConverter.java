package io.github.tmarsteel.flags.jna;

import com.sun.jna.*;
import io.github.tmarsteel.flags.FlagSet;
import io.github.tmarsteel.flags.FlagType;
import io.github.tmarsteel.flags.FlagValue;
import io.github.tmarsteel.flags.FlagWidth;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;

/**
 * Passes a {@link FlagSet} to native code as an integer of a fixed width. The enum of the {@link FlagSet}
 * created from a native value is taken from the generic type of the structure field, method return type or
 * callback parameter being converted; a raw {@code FlagSet} there cannot be converted.
 */
public class FlagSetTypeConverter implements TypeConverter {
    private final FlagWidth nativeWidth;

    public FlagSetTypeConverter() {
        this(FlagWidth.I32);
    }

    public FlagSetTypeConverter(@NotNull FlagWidth nativeWidth) {
        this.nativeWidth = nativeWidth;
    }

    @Override
    @SuppressWarnings({"unchecked", "rawtypes"})
    public Object fromNative(Object nativeValue, FromNativeContext context) {
        FlagType<?> flagType = resolveFlagType(context);
        long bits = nativeValue == null ? 0 : nativeWidth.unbox((Number) nativeValue);
        return FlagSet.fromBits((Class) flagType.enumClass(), bits);
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
        var flagSet = (FlagSet<?>) value;
        if (!nativeWidth.fits(flagSet.bits())) {
            throw new IllegalArgumentException(flagSet + " does not fit into a native " + nativeWidth.bitCount() + "-bit integer");
        }
        return nativeWidth.box(flagSet.bits());
    }

    private static @NotNull FlagType<?> resolveFlagType(FromNativeContext context) {
        Type genericType;
        if (context instanceof StructureReadContext) {
            genericType = ((StructureReadContext) context).getField().getGenericType();
        } else if (context instanceof MethodResultContext) {
            genericType = ((MethodResultContext) context).getMethod().getGenericReturnType();
        } else if (context instanceof CallbackParameterContext) {
            var callbackContext = (CallbackParameterContext) context;
            genericType = callbackContext.getMethod().getGenericParameterTypes()[callbackContext.getIndex()];
        } else {
            throw new IllegalStateException("Cannot determine the flag type of a native value converted in a " + (context == null ? "null" : context.getClass().getName()));
        }

        if (!(genericType instanceof ParameterizedType)) {
            throw new IllegalStateException("Cannot convert to a raw " + FlagSet.class.getName() + "; the flag type must be given as a type argument");
        }
        var typeArgument = ((ParameterizedType) genericType).getActualTypeArguments()[0];
        if (!(typeArgument instanceof Class) || !FlagValue.class.isAssignableFrom((Class<?>) typeArgument)) {
            throw new IllegalStateException("Cannot convert to " + genericType.getTypeName() + "; the flag type must be a concrete enum");
        }

        return FlagType.ofUnchecked((Class<?>) typeArgument);
    }
}
