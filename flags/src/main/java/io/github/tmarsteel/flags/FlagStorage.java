package io.github.tmarsteel.flags;

import java.lang.annotation.*;

/**
 * Declares the underlying integer width of a {@link FlagValue} enum. Enums without this annotation
 * are {@link FlagWidth#I32} wide, like a C enum.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface FlagStorage {
    FlagWidth value();
}
