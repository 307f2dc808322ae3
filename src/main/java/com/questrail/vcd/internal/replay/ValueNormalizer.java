package com.questrail.vcd.internal.replay;

import com.questrail.vcd.config.VectorExtension;

import java.util.Objects;
import java.util.Optional;

/**
 * Brings recorded digits to exactly the declared width of a signal.
 *
 * <ul>
 *   <li>Digits must be {@code 0 1 x z}; upper-case {@code X}/{@code Z} are lower-cased</li>
 *   <li>Short values are left-padded according to the {@link VectorExtension} policy</li>
 *   <li>Long values keep their rightmost (least significant) {@code width} digits</li>
 * </ul>
 */
public final class ValueNormalizer
{
    private final VectorExtension extension;

    public ValueNormalizer(VectorExtension extension) {
        this.extension = Objects.requireNonNull(extension, "extension");
    }

    /**
     * @return the normalized value, or empty if {@code digits} contains an
     *         illegal character or is empty
     */
    public Optional<String> normalize(String digits, int width) {
        Objects.requireNonNull(digits, "digits");
        if (digits.isEmpty() || width < 1) {
            return Optional.empty();
        }

        StringBuilder out = new StringBuilder(Math.max(width, digits.length()));
        for (int i = 0; i < digits.length(); i++) {
            char c = Character.toLowerCase(digits.charAt(i));
            if (c != '0' && c != '1' && c != 'x' && c != 'z') {
                return Optional.empty();
            }
            out.append(c);
        }

        if (out.length() > width) {
            return Optional.of(out.substring(out.length() - width));
        }
        if (out.length() < width) {
            char pad = extension.padFor(out.charAt(0));
            out.insert(0, String.valueOf(pad).repeat(width - out.length()));
        }
        return Optional.of(out.toString());
    }
}
