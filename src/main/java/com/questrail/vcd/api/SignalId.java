package com.questrail.vcd.api;

import java.util.Objects;

/**
 * SignalId
 * -----------------------------------------------------------------------------
 * Strongly typed wrapper around a VCD identifier token.
 *
 * <p>A VCD dump refers to every declared variable through a short identifier
 * code made of printable ASCII characters ({@code !} through {@code ~}), for
 * example {@code !}, {@code "} or {@code %a}. The token is opaque: it carries
 * no ordering, no width and no hierarchy. Those live on the
 * {@code Signal} that the token resolves to.</p>
 *
 * <h2>Identity</h2>
 * <ul>
 *   <li>Equality and hash code are based on the exact token text</li>
 *   <li>Tokens are unique within one document</li>
 *   <li>Tokens are case-sensitive ({@code a} and {@code A} differ)</li>
 * </ul>
 *
 * <p>Keeping the token in its own type stops it from being mixed up with the
 * hierarchical signal name, which is also a {@code String} and is what humans
 * usually type.</p>
 */
public final class SignalId
{
    private static final char MIN_CHAR = '!';
    private static final char MAX_CHAR = '~';

    private final String token;

    private SignalId(String token) {
        this.token = token;
    }

    /**
     * Creates a {@code SignalId} for the given identifier token.
     *
     * @param token the identifier code exactly as written in the dump
     * @return a {@code SignalId} instance
     * @throws IllegalArgumentException if the token is empty or contains
     *         characters outside {@code !}..{@code ~}
     */
    public static SignalId of(String token) {
        Objects.requireNonNull(token, "token");
        if (!isValidToken(token)) {
            throw new IllegalArgumentException(
                    "VCD identifier must be one or more printable ASCII characters (was '"
                            + token + "')");
        }
        return new SignalId(token);
    }

    /**
     * Returns {@code true} if the text is a syntactically valid identifier token.
     */
    public static boolean isValidToken(String token) {
        if (token == null || token.isEmpty()) {
            return false;
        }
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c < MIN_CHAR || c > MAX_CHAR) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the identifier token as written in the dump.
     */
    public String token() {
        return token;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SignalId that)) return false;
        return token.equals(that.token);
    }

    @Override
    public int hashCode() {
        return token.hashCode();
    }

    @Override
    public String toString() {
        return "SignalId[" + token + "]";
    }
}
