package com.questrail.vcd.config;

/**
 * Policy for values written with fewer digits than the declared width.
 *
 * <p>Given a 4-bit signal and the change {@code b1 !}:</p>
 * <ul>
 *   <li>{@link #ZERO} yields {@code 0001}</li>
 *   <li>{@link #IEEE} yields {@code 0001} as well, but {@code bz !} yields
 *       {@code zzzz} and {@code bx0 !} yields {@code xxx0}</li>
 * </ul>
 */
public enum VectorExtension
{
    /**
     * Missing leading digits are always {@code 0}.
     */
    ZERO,

    /**
     * Missing leading digits copy a leading {@code x} or {@code z}, otherwise {@code 0}.
     */
    IEEE;

    /**
     * Returns the digit used to pad a value whose leftmost written digit is {@code leading}.
     */
    public char padFor(char leading) {
        if (this == IEEE && (leading == 'x' || leading == 'z')) {
            return leading;
        }
        return '0';
    }
}
