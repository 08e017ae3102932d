/**
 * JNA type conversions for flags, for native functions and structures that take C flag words. Register a
 * {@link io.github.tmarsteel.flags.jna.FlagTypeMapper} as {@link com.sun.jna.Library#OPTION_TYPE_MAPPER} or pass it to
 * a {@link com.sun.jna.Structure}; the native width must match the C type of the parameter or field, which is not
 * necessarily the {@link io.github.tmarsteel.flags.FlagStorage} width of the enum.
 */
package io.github.tmarsteel.flags.jna;
