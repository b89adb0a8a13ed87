package org.py2smt.translator.frontend.preprocessor;

import org.py2smt.translator.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes comments from Python source text before it is tokenized.
 * <p>
 * Two kinds of comments are removed: {@code #} comments up to the end of the
 * line, and triple-quoted blocks ({@code """..."""} or {@code '''...'''}), which
 * is how docstrings and block comments are written. Newlines inside a removed
 * block are kept so that line numbers reported later still match the
 * original file. A {@code #} inside an ordinary string literal is left alone.
 * <p>
 * Removal is best effort and never fails. An unterminated triple quote is
 * passed through unchanged and reported as a warning; whatever the lexer
 * makes of it afterwards is reported by the lexer.
 * <p>
 * The transformation is idempotent.
 */
public class PreProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(PreProcessor.class);

    private final DiagnosticsEngine diagnostics;
    private final String logicalFileName;

    /**
     * Creates a preprocessor that reports to the given engine.
     * @param diagnostics The engine for reporting ambiguities.
     * @param logicalFileName The source name used in diagnostics.
     */
    public PreProcessor(DiagnosticsEngine diagnostics, String logicalFileName) {
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Creates a preprocessor with its own, private diagnostics engine.
     */
    public PreProcessor() {
        this(new DiagnosticsEngine(), "<memory>");
    }

    /**
     * Removes all comments and docstrings from the given source.
     *
     * @param source The raw source text.
     * @return The source without comments, with its line structure intact.
     */
    public String stripComments(String source) {
        StringBuilder out = new StringBuilder(source.length());
        int line = 1;
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);

            if (isTripleQuote(source, i)) {
                String delimiter = source.substring(i, i + 3);
                int close = source.indexOf(delimiter, i + 3);
                if (close < 0) {
                    String message = "Unterminated " + delimiter + " block; left in place";
                    diagnostics.reportWarning(message, logicalFileName, line);
                    LOG.warn("{}:{}: {}", logicalFileName, line, message);
                    out.append(source, i, source.length());
                    break;
                }
                for (int k = i + 3; k < close; k++) {
                    if (source.charAt(k) == '\n') {
                        out.append('\n');
                        line++;
                    }
                }
                i = close + 3;
            } else if (c == '#') {
                while (i < source.length() && source.charAt(i) != '\n') i++;
            } else if (c == '"' || c == '\'') {
                i = copyStringLiteral(source, i, out);
            } else {
                if (c == '\n') line++;
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /**
     * Copies a single-line string literal starting at {@code start}, including
     * its quotes, and returns the index after it. An unterminated literal is
     * copied up to (excluding) the end of the line.
     */
    private int copyStringLiteral(String source, int start, StringBuilder out) {
        char quote = source.charAt(start);
        int i = start + 1;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\' && i + 1 < source.length() && source.charAt(i + 1) != '\n') {
                i += 2;
                continue;
            }
            if (c == '\n') break;
            i++;
            if (c == quote) break;
        }
        out.append(source, start, i);
        return i;
    }

    private boolean isTripleQuote(String source, int i) {
        if (i + 3 > source.length()) return false;
        char c = source.charAt(i);
        return (c == '"' || c == '\'') && source.charAt(i + 1) == c && source.charAt(i + 2) == c;
    }
}
