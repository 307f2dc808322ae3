/**
 * VCD Lexer Implementation
 * =============================================================================
 *
 * <p>Concrete line classifier for IEEE 1364 value change dumps as written by
 * common simulators (Icarus Verilog, Verilator, GHDL).</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   Reader
 *        → DefaultVcdLineClassifier   (words, $keyword ... $end blocks)
 *        → VcdToken stream
 *        → SymbolTableBuilder / ChangeLogReplayer
 * </pre>
 *
 * <p>This layer is strictly syntactic. It knows nothing about declared
 * signals or the time cursor. Text it cannot classify becomes a
 * {@link com.questrail.vcd.codec.VcdToken.Malformed} token and lexing
 * continues.</p>
 */
package com.questrail.vcd.codec.impl;
