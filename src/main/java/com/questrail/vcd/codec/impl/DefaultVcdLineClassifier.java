package com.questrail.vcd.codec.impl;

import com.questrail.vcd.codec.LineLimitExceededException;
import com.questrail.vcd.codec.VcdLineClassifier;
import com.questrail.vcd.codec.VcdToken;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * DefaultVcdLineClassifier
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link VcdLineClassifier}.
 *
 * <p>Each physical line is handled as follows:</p>
 * <ol>
 *   <li>Blank lines are skipped</li>
 *   <li>Lines opening with a declaration or header command ({@code $scope},
 *       {@code $var}, {@code $timescale}, ...) are joined with the following
 *       lines up to the closing {@code $end} and classified as one token</li>
 *   <li>{@code $comment} blocks are consumed without producing a token</li>
 *   <li>A block interrupted by another command before its {@code $end} is
 *       reported as malformed and lexing resumes at that command</li>
 *   <li>All other lines are split into words and each word (or
 *       {@code b<digits> <id>} pair) becomes a time marker, a value change or a
 *       dump-section marker</li>
 * </ol>
 *
 * <p>Splitting value lines into words lets the classifier accept the compact
 * layouts some tools produce ({@code #10 1! 0"}) as well as the usual
 * one-change-per-line form.</p>
 */
public final class DefaultVcdLineClassifier implements VcdLineClassifier
{
    private static final String END = "$end";

    private static final Set<String> COMMANDS = Set.of(
            "$comment", "$date", "$version", "$timescale",
            "$scope", "$upscope", "$var", "$enddefinitions",
            "$dumpvars", "$dumpall", "$dumpon", "$dumpoff");

    private final int maxLines;

    /**
     * Creates a classifier that reads input of any length.
     */
    public DefaultVcdLineClassifier() {
        this(0);
    }

    /**
     * Creates a classifier that stops with {@link LineLimitExceededException}
     * when asked to read past physical line {@code maxLines}.
     *
     * @param maxLines line limit; 0 means unbounded
     */
    public DefaultVcdLineClassifier(int maxLines) {
        if (maxLines < 0) {
            throw new IllegalArgumentException("maxLines must be non-negative");
        }
        this.maxLines = maxLines;
    }

    @Override
    public Iterator<VcdToken> classify(Reader input) {
        Objects.requireNonNull(input, "input");
        BufferedReader reader = input instanceof BufferedReader br ? br : new BufferedReader(input);
        return new TokenIterator(reader, maxLines);
    }

    /**
     * Words of one physical line still waiting to be classified.
     */
    private record LineWords(int line, String raw, List<String> words) {}

    private static final class TokenIterator implements Iterator<VcdToken> {
        private final BufferedReader reader;
        private final int maxLines;
        private final Deque<VcdToken> pending = new ArrayDeque<>();
        private int lineNumber;
        private boolean exhausted;

        TokenIterator(BufferedReader reader, int maxLines) {
            this.reader = reader;
            this.maxLines = maxLines;
        }

        @Override
        public boolean hasNext() {
            while (pending.isEmpty() && !exhausted) {
                String line = readLine();
                if (line == null) {
                    exhausted = true;
                } else {
                    classifyLine(line);
                }
            }
            return !pending.isEmpty();
        }

        @Override
        public VcdToken next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return pending.removeFirst();
        }

        private String readLine() {
            final String line;
            try {
                line = reader.readLine();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed reading VCD input at line " + (lineNumber + 1), e);
            }
            if (line != null) {
                lineNumber++;
                if (maxLines > 0 && lineNumber > maxLines) {
                    throw new LineLimitExceededException(maxLines);
                }
            }
            return line;
        }

        private void classifyLine(String raw) {
            LineWords rest = new LineWords(lineNumber, raw, words(raw));
            while (rest != null && !rest.words().isEmpty()) {
                String first = rest.words().get(0);
                if (first.startsWith("$") && !first.equals(END) && !isDumpKeyword(first)) {
                    rest = classifyCommand(rest);
                } else {
                    classifyWords(rest.line(), rest.raw(), rest.words());
                    rest = null;
                }
            }
        }

        // ---------------------------------------------------------------------
        // $command ... $end blocks
        // ---------------------------------------------------------------------

        /**
         * Collects one block up to its {@code $end} and queues its token.
         *
         * <p>Outside {@code $comment}, a known command keyword inside the body
         * means the block lost its {@code $end}: the block is reported as
         * malformed and the words from that keyword on are handed back to be
         * classified as a fresh line.</p>
         *
         * @return words left on the last line read, or {@code null} if none
         */
        private LineWords classifyCommand(LineWords start) {
            final int startLine = start.line();
            final String raw = start.raw();
            final String keyword = start.words().get(0).substring(1);
            final boolean comment = keyword.equals("comment");

            List<String> body = new ArrayList<>();
            LineWords current = new LineWords(startLine, raw, start.words().subList(1, start.words().size()));

            while (true) {
                List<String> words = current.words();
                int end = words.indexOf(END);
                int interrupt = comment ? -1 : indexOfCommand(words);

                if (interrupt >= 0 && (end < 0 || interrupt < end)) {
                    pending.add(new VcdToken.Malformed(startLine, raw, "missing $end for $" + keyword));
                    return new LineWords(current.line(), current.raw(), words.subList(interrupt, words.size()));
                }
                if (end >= 0) {
                    body.addAll(words.subList(0, end));
                    VcdToken token = commandToken(startLine, raw, keyword, body);
                    if (token != null) {
                        pending.add(token);
                    }
                    return new LineWords(current.line(), current.raw(), words.subList(end + 1, words.size()));
                }
                body.addAll(words);

                String next = readLine();
                if (next == null) {
                    pending.add(new VcdToken.Malformed(startLine, raw, "unterminated $" + keyword + " block"));
                    return null;
                }
                current = new LineWords(lineNumber, next, words(next));
            }
        }

        private static int indexOfCommand(List<String> words) {
            for (int i = 0; i < words.size(); i++) {
                if (COMMANDS.contains(words.get(i))) {
                    return i;
                }
            }
            return -1;
        }

        private static VcdToken commandToken(int line, String raw, String keyword, List<String> body) {
            switch (keyword) {
                case "comment":
                    return null;
                case "date":
                case "version":
                case "timescale":
                    return new VcdToken.Header(line, raw, keyword, String.join(" ", body));
                case "scope":
                    if (body.size() < 2) {
                        return new VcdToken.Malformed(line, raw, "$scope requires a kind and a name");
                    }
                    if (body.size() > 2) {
                        return new VcdToken.Malformed(line, raw, "unexpected words after $scope name: "
                                + String.join(" ", body.subList(2, body.size())));
                    }
                    return new VcdToken.ScopeEnter(line, raw, body.get(0), body.get(1));
                case "upscope":
                    return new VcdToken.ScopeExit(line, raw);
                case "enddefinitions":
                    return new VcdToken.EndDefinitions(line, raw);
                case "var":
                    return varToken(line, raw, body);
                default:
                    return new VcdToken.Malformed(line, raw, "unsupported command $" + keyword);
            }
        }

        private static VcdToken varToken(int line, String raw, List<String> body) {
            // kind width id name [range]
            if (body.size() < 4) {
                return new VcdToken.Malformed(line, raw, "$var requires kind, width, identifier and name");
            }
            final int width;
            try {
                width = Integer.parseInt(body.get(1));
            } catch (NumberFormatException e) {
                return new VcdToken.Malformed(line, raw, "$var width is not an integer: " + body.get(1));
            }
            if (body.size() > 4 && !isRange(body.subList(4, body.size()))) {
                return new VcdToken.Malformed(line, raw, "unexpected words after $var name: "
                        + String.join(" ", body.subList(4, body.size())));
            }
            return new VcdToken.VarDecl(line, raw, body.get(0), width, body.get(2), body.get(3));
        }

        // ---------------------------------------------------------------------
        // Value section words
        // ---------------------------------------------------------------------

        private void classifyWords(int line, String raw, List<String> words) {
            for (int i = 0; i < words.size(); i++) {
                String word = words.get(i);
                char c = word.charAt(0);

                if (word.equals(END)) {
                    pending.add(new VcdToken.SectionEnd(line, raw));
                } else if (isDumpKeyword(word)) {
                    pending.add(new VcdToken.DumpSection(line, raw, word.substring(1)));
                } else if (c == '#') {
                    pending.add(timeMarker(line, raw, word));
                } else if (c == 'b' || c == 'B') {
                    if (i + 1 >= words.size()) {
                        pending.add(new VcdToken.Malformed(line, raw, "vector change without identifier"));
                    } else if (word.length() == 1) {
                        pending.add(new VcdToken.Malformed(line, raw, "vector change without digits"));
                        i++;
                    } else {
                        pending.add(new VcdToken.VectorChange(line, raw, word.substring(1), words.get(++i)));
                    }
                } else if (c == 'r' || c == 'R') {
                    pending.add(new VcdToken.Malformed(line, raw, "real value changes are not supported"));
                    i++;
                } else if (isScalarDigit(c) && word.length() > 1) {
                    pending.add(new VcdToken.ScalarChange(line, raw, Character.toLowerCase(c), word.substring(1)));
                } else {
                    pending.add(new VcdToken.Malformed(line, raw, "unrecognised value change: " + word));
                }
            }
        }

        // Bit-select written as one word ([7:0]) or spread over several ([7 : 0]).
        private static boolean isRange(List<String> words) {
            String range = String.join("", words);
            return range.startsWith("[") && range.endsWith("]");
        }

        private static VcdToken timeMarker(int line, String raw, String word) {
            String digits = word.substring(1);
            if (!isUnsignedDecimal(digits)) {
                return new VcdToken.Malformed(line, raw, "time marker is not an unsigned integer: " + word);
            }
            try {
                return new VcdToken.TimeMarker(line, raw, Long.parseLong(digits));
            } catch (NumberFormatException e) {
                return new VcdToken.Malformed(line, raw, "time marker out of range: " + word);
            }
        }
    }

    static boolean isScalarDigit(char c) {
        return c == '0' || c == '1' || c == 'x' || c == 'X' || c == 'z' || c == 'Z';
    }

    static boolean isDumpKeyword(String word) {
        return word.equals("$dumpvars") || word.equals("$dumpall")
                || word.equals("$dumpon") || word.equals("$dumpoff");
    }

    static boolean isUnsignedDecimal(String text) {
        if (text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    static List<String> words(String line) {
        String stripped = line.strip();
        if (stripped.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(stripped.split("\\s+"));
    }
}
