package com.questrail.vcd.codec;

import java.util.Objects;

/**
 * VcdToken
 * -----------------------------------------------------------------------------
 * A classified line (or multi-line header block) of a Value-Change Dump.
 *
 * <p>Tokens are purely lexical. A {@link VarDecl} says that a line declares a
 * variable, not that the declaration is legal. Whether it is legal (duplicate
 * identifiers, declarations after {@code $enddefinitions}, etc.) is decided by
 * the symbol table and the replayer above this layer.</p>
 *
 * <p>Every token carries the 1-based number of the line it came from and the
 * raw text of that line, so that diagnostics raised further up can point back
 * at the source.</p>
 */
public sealed interface VcdToken
        permits VcdToken.Header, VcdToken.ScopeEnter, VcdToken.ScopeExit, VcdToken.VarDecl,
                VcdToken.EndDefinitions, VcdToken.DumpSection, VcdToken.SectionEnd,
                VcdToken.TimeMarker, VcdToken.ScalarChange, VcdToken.VectorChange,
                VcdToken.Malformed
{
    /**
     * 1-based line number where the token starts.
     */
    int line();

    /**
     * Raw source text of the token's first line.
     */
    String raw();

    /**
     * Header metadata: {@code $date}, {@code $version} or {@code $timescale}.
     *
     * @param key  keyword without the {@code $}
     * @param body text between the keyword and {@code $end}, trimmed
     */
    record Header(int line, String raw, String key, String body) implements VcdToken {
        public Header {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(body, "body");
        }
    }

    /**
     * {@code $scope <kind> <name> $end}.
     */
    record ScopeEnter(int line, String raw, String kind, String name) implements VcdToken {
        public ScopeEnter {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * {@code $upscope $end}.
     */
    record ScopeExit(int line, String raw) implements VcdToken {}

    /**
     * {@code $var <kind> <width> <id> <name> [range] $end}.
     *
     * @param width declared width as written; validated by the symbol table
     */
    record VarDecl(int line, String raw, String kind, int width, String id, String name) implements VcdToken {
        public VarDecl {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * {@code $enddefinitions $end}.
     */
    record EndDefinitions(int line, String raw) implements VcdToken {}

    /**
     * Opening of a {@code $dumpvars}, {@code $dumpall}, {@code $dumpon} or
     * {@code $dumpoff} block.
     */
    record DumpSection(int line, String raw, String kind) implements VcdToken {
        public DumpSection {
            Objects.requireNonNull(kind, "kind");
        }
    }

    /**
     * A lone {@code $end} closing a dump section.
     */
    record SectionEnd(int line, String raw) implements VcdToken {}

    /**
     * {@code #<integer>}.
     */
    record TimeMarker(int line, String raw, long time) implements VcdToken {}

    /**
     * {@code <value><id>} with no separator, value one of {@code 0 1 x z}.
     */
    record ScalarChange(int line, String raw, char value, String id) implements VcdToken {
        public ScalarChange {
            Objects.requireNonNull(id, "id");
        }
    }

    /**
     * {@code b<digits> <id>}. Digits are passed through unvalidated.
     */
    record VectorChange(int line, String raw, String bits, String id) implements VcdToken {
        public VectorChange {
            Objects.requireNonNull(bits, "bits");
            Objects.requireNonNull(id, "id");
        }
    }

    /**
     * A line that could not be classified.
     *
     * @param reason short human-readable explanation
     */
    record Malformed(int line, String raw, String reason) implements VcdToken {
        public Malformed {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
