/**
 * VCD Lexer
 * =============================================================================
 *
 * <p>This package defines the <strong>lexical layer</strong> of the dump
 * reader. It turns text into {@link com.questrail.vcd.codec.VcdToken}s and
 * nothing more.</p>
 *
 * <pre>
 *   Reader (dump text)
 *        → VcdLineClassifier      (line shapes recognised here)
 *            → VcdToken           (header, scope, var, time, change, malformed)
 *                → SymbolTableBuilder / ChangeLogReplayer
 *                    → VcdDocument
 * </pre>
 *
 * <h2>Supported subset</h2>
 * <ul>
 *   <li>{@code $date}, {@code $version}, {@code $timescale}, {@code $comment}</li>
 *   <li>{@code $scope}, {@code $upscope}, {@code $var}, {@code $enddefinitions}</li>
 *   <li>{@code $dumpvars}, {@code $dumpall}, {@code $dumpon}, {@code $dumpoff}</li>
 *   <li>{@code #<time>}, scalar changes {@code 1!} and vector changes {@code b1010 !}</li>
 * </ul>
 *
 * <p>Real-valued changes ({@code r1.5 !}) are recognised but reported as
 * malformed; they are not interpreted.</p>
 */
package com.questrail.vcd.codec;
