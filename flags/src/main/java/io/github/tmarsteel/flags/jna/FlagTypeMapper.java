package io.github.tmarsteel.flags.jna;

import com.sun.jna.DefaultTypeMapper;
import io.github.tmarsteel.flags.FlagSet;
import io.github.tmarsteel.flags.FlagValue;
import io.github.tmarsteel.flags.FlagWidth;

public class FlagTypeMapper extends DefaultTypeMapper {
    public FlagTypeMapper() {
        this(FlagWidth.I32);
    }

    /**
     * @param nativeWidth the width of the native integer flag sets and single flags are passed as
     */
    public FlagTypeMapper(FlagWidth nativeWidth) {
        addTypeConverter(FlagSet.class, new FlagSetTypeConverter(nativeWidth));
        addTypeConverter(FlagValue.class, new FlagValueTypeConverter(nativeWidth));
    }
}
