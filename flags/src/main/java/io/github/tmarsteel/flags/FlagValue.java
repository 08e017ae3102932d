package io.github.tmarsteel.flags;

/**
 * Implemented by enums whose constants are flags that can be combined in a {@link FlagSet}.
 * The width of the underlying integer is declared with {@link FlagStorage}.
 */
public interface FlagValue {
    /**
     * @return the bit representation of this value. Only one bit should be set; constants that combine
     * other constants (e.g. an {@code ALL} constant) are allowed and behave like a {@link FlagMask} of their bits.
     */
    long flagValue();
}
