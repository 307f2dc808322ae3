package com.questrail.vcd.codec;

import java.io.Reader;
import java.util.Iterator;

/**
 * VcdLineClassifier
 * -----------------------------------------------------------------------------
 * Lexical boundary between raw dump text and classified {@link VcdToken}s.
 *
 * <p>The classifier is responsible only for:</p>
 * <ul>
 *   <li>Splitting the input into physical lines</li>
 *   <li>Joining header blocks that span several lines</li>
 *   <li>Recognising the shape of each line</li>
 *   <li>Skipping blank lines and {@code $comment} blocks</li>
 * </ul>
 *
 * <p>The classifier is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Scope tracking or symbol registration</li>
 *   <li>Time ordering</li>
 *   <li>Resolving identifiers</li>
 *   <li>Validating value digits against a declared width</li>
 * </ul>
 *
 * <p>A line that cannot be classified becomes a {@link VcdToken.Malformed}
 * token. Lexing never aborts because of bad input.</p>
 */
public interface VcdLineClassifier
{
    /**
     * Returns a lazy sequence of tokens read from {@code input}.
     *
     * <p>Lines are read on demand as the iterator advances. The caller owns
     * {@code input} and is responsible for closing it. I/O failures surface
     * from the iterator as {@link java.io.UncheckedIOException}; an
     * implementation bounded by a line limit throws
     * {@link LineLimitExceededException} once it is passed.</p>
     *
     * @param input dump text
     * @return tokens in file order
     */
    Iterator<VcdToken> classify(Reader input);
}
