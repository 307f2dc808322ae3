package com.questrail.vcd.parse;

import com.questrail.vcd.codec.LineLimitExceededException;
import com.questrail.vcd.codec.VcdLineClassifier;
import com.questrail.vcd.codec.VcdToken;
import com.questrail.vcd.codec.impl.DefaultVcdLineClassifier;
import com.questrail.vcd.config.VcdParserConfig;
import com.questrail.vcd.core.DefaultVcdDocument;
import com.questrail.vcd.internal.DiagnosticLog;
import com.questrail.vcd.internal.replay.ChangeLogReplayer;
import com.questrail.vcd.internal.replay.ValueNormalizer;
import com.questrail.vcd.internal.symbols.SymbolTable;
import com.questrail.vcd.internal.symbols.SymbolTableBuilder;
import com.questrail.vcd.model.Timescale;
import com.questrail.vcd.observability.DiagnosticKind;
import com.questrail.vcd.observability.ParseCompletedEvent;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * VcdParser
 * =============================================================================
 * Single entry point that turns dump text into a {@link ParseResult}.
 *
 * <pre>
 *   Reader
 *     → VcdLineClassifier        (tokens)
 *       → SymbolTableBuilder     (declarations, until $enddefinitions)
 *       → ChangeLogReplayer      (time markers and value changes, after it)
 *         → DefaultVcdDocument + diagnostics
 * </pre>
 *
 * <h2>Failure policy</h2>
 * <p>Per-line anomalies become diagnostics and parsing continues. Only three
 * conditions abort with {@link VcdParseException}:</p>
 * <ul>
 *   <li>the input is missing or holds no tokens</li>
 *   <li>the input never reaches {@code $enddefinitions}</li>
 *   <li>the input exceeds {@link VcdParserConfig#maxLines()}</li>
 * </ul>
 *
 * <p>A parser instance holds only configuration and may be shared; every call
 * builds its own document.</p>
 */
public final class VcdParser
{
    private final VcdParserConfig config;
    private final VcdLineClassifier classifier;

    public VcdParser() {
        this(VcdParserConfig.defaults());
    }

    /**
     * Creates a parser whose lexer enforces {@link VcdParserConfig#maxLines()}
     * on every physical line it reads.
     */
    public VcdParser(VcdParserConfig config) {
        this(config, new DefaultVcdLineClassifier(Objects.requireNonNull(config, "config").maxLines()));
    }

    public VcdParser(VcdParserConfig config, VcdLineClassifier classifier) {
        this.config = Objects.requireNonNull(config, "config");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    public VcdParserConfig config() {
        return config;
    }

    /**
     * Parses a dump file.
     *
     * <p>The file is decoded as ISO-8859-1 so that stray non-ASCII bytes in
     * comments or names can never fail decoding.</p>
     */
    public ParseResult parse(Path file) {
        Objects.requireNonNull(file, "file");
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.ISO_8859_1)) {
            return parse(reader, file.toString());
        } catch (NoSuchFileException e) {
            throw new VcdParseException(VcdParseException.Reason.EMPTY_OR_MISSING_INPUT,
                    "VCD file not found: " + file, e);
        } catch (IOException e) {
            throw new VcdParseException(VcdParseException.Reason.EMPTY_OR_MISSING_INPUT,
                    "Failed to read VCD file: " + file, e);
        }
    }

    public ParseResult parse(String text) {
        Objects.requireNonNull(text, "text");
        return parse(new StringReader(text), "<string>");
    }

    public ParseResult parse(Reader input) {
        return parse(input, "<reader>");
    }

    /**
     * Parses dump text read from {@code input}. The caller owns and closes the reader.
     *
     * @param source label used in completion events and error messages
     */
    public ParseResult parse(Reader input, String source) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(source, "source");
        final long started = System.nanoTime();

        DiagnosticLog diagnostics = new DiagnosticLog(config.observabilitySink());
        SymbolTableBuilder symbols = new SymbolTableBuilder(diagnostics);
        ValueNormalizer normalizer = new ValueNormalizer(config.vectorExtension());
        Map<String, String> headers = new LinkedHashMap<>();
        Timescale timescale = null;
        ChangeLogReplayer replayer = null;
        int lastLine = 0;
        boolean sawToken = false;

        final Iterator<VcdToken> tokens;
        try {
            tokens = classifier.classify(input);
            while (tokens.hasNext()) {
                VcdToken token = tokens.next();
                sawToken = true;
                lastLine = token.line();
                if (config.isLineLimited() && token.line() > config.maxLines()) {
                    throw new VcdParseException(VcdParseException.Reason.INPUT_TOO_LARGE,
                            source + " exceeds " + config.maxLines() + " lines");
                }

                // Dispatch based on token type. Declarations go to the symbol
                // table; everything in the value section goes to the replayer.
                if (token instanceof VcdToken.Header h) {
                    timescale = onHeader(h, headers, timescale, symbols.isFrozen(), diagnostics);
                } else if (token instanceof VcdToken.ScopeEnter s) {
                    symbols.onScopeEnter(s);
                } else if (token instanceof VcdToken.ScopeExit s) {
                    symbols.onScopeExit(s);
                } else if (token instanceof VcdToken.VarDecl v) {
                    symbols.onVarDecl(v);
                } else if (token instanceof VcdToken.EndDefinitions e) {
                    symbols.onEndDefinitions(e);
                    if (replayer == null && symbols.isFrozen()) {
                        replayer = new ChangeLogReplayer(symbols.table(), normalizer, diagnostics);
                    }
                } else if (token instanceof VcdToken.Malformed m) {
                    diagnostics.report(DiagnosticKind.MALFORMED_LINE, m, m.reason());
                } else if (replayer == null) {
                    diagnostics.report(DiagnosticKind.MALFORMED_LINE, token,
                            "value section content before $enddefinitions");
                } else if (token instanceof VcdToken.TimeMarker t) {
                    replayer.onTimeMarker(t);
                } else if (token instanceof VcdToken.ScalarChange c) {
                    replayer.onScalarChange(c);
                } else if (token instanceof VcdToken.VectorChange c) {
                    replayer.onVectorChange(c);
                }
                // DumpSection / SectionEnd only delimit the initial burst;
                // the time cursor already places it correctly.
            }
        } catch (LineLimitExceededException e) {
            throw new VcdParseException(VcdParseException.Reason.INPUT_TOO_LARGE,
                    source + " exceeds " + e.limit() + " lines", e);
        } catch (UncheckedIOException e) {
            throw new VcdParseException(VcdParseException.Reason.EMPTY_OR_MISSING_INPUT,
                    "Failed to read VCD input " + source, e);
        }

        if (!sawToken) {
            throw new VcdParseException(VcdParseException.Reason.EMPTY_OR_MISSING_INPUT,
                    "VCD input " + source + " is empty");
        }
        if (replayer == null) {
            throw new VcdParseException(VcdParseException.Reason.MISSING_END_DEFINITIONS,
                    "VCD input " + source + " has no $enddefinitions");
        }

        SymbolTable table = symbols.table();
        ChangeLogReplayer.Result replay = replayer.finish();
        DefaultVcdDocument document = new DefaultVcdDocument(
                timescale != null ? timescale : config.defaultTimescale(),
                headers,
                table.signals(),
                replay.logs(),
                replay.maxTime());

        config.observabilitySink().onParseCompleted(new ParseCompletedEvent(
                source,
                lastLine,
                table.size(),
                replay.changes(),
                replay.maxTime(),
                diagnostics.size(),
                Duration.ofNanos(System.nanoTime() - started)));

        return new ParseResult(document, diagnostics.snapshot());
    }

    private static Timescale onHeader(VcdToken.Header header,
                                      Map<String, String> headers,
                                      Timescale current,
                                      boolean frozen,
                                      DiagnosticLog diagnostics) {
        if (!header.key().equals("timescale")) {
            headers.putIfAbsent(header.key(), header.body());
            return current;
        }
        if (frozen) {
            diagnostics.report(DiagnosticKind.DECLARATION_AFTER_FREEZE, header,
                    "$timescale after $enddefinitions ignored");
            return current;
        }
        var parsed = Timescale.parse(header.body());
        if (parsed.isEmpty()) {
            diagnostics.report(DiagnosticKind.MALFORMED_LINE, header,
                    "invalid timescale '" + header.body() + "'");
            return current;
        }
        headers.put(header.key(), parsed.get().toString());
        return parsed.get();
    }
}
