package com.questrail.vcd.codec;

/**
 * Thrown from a token iterator when the input has more physical lines than
 * the classifier was configured to read.
 *
 * <p>The check runs per physical line, so an unterminated block cannot pull
 * the rest of an oversized input into memory before the limit trips.</p>
 */
public final class LineLimitExceededException extends RuntimeException
{
    private final int limit;

    public LineLimitExceededException(int limit) {
        super("input exceeds " + limit + " lines");
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
