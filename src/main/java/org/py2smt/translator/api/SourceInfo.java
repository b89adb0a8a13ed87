package org.py2smt.translator.api;

/**
 * A position in the translated source.
 *
 * @param fileName The logical source name.
 * @param lineNumber The 1-based line number.
 */
public record SourceInfo(String fileName, int lineNumber) {

    @Override
    public String toString() {
        return fileName + ":" + lineNumber;
    }
}
