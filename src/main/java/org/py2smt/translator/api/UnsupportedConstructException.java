package org.py2smt.translator.api;

/**
 * The syntax tree contains a statement or expression kind that has no
 * SMT-LIB2 encoding, e.g. a loop, a call or a string literal.
 */
public class UnsupportedConstructException extends TranslationException {

    private final String construct;

    /**
     * @param construct A short name of the rejected construct, e.g. {@code "for loop"}.
     * @param sourceInfo Where the construct starts.
     */
    public UnsupportedConstructException(String construct, SourceInfo sourceInfo) {
        super(TranslatorErrorCode.UNSUPPORTED_CONSTRUCT, "Unsupported construct: " + construct, sourceInfo);
        this.construct = construct;
    }

    public String getConstruct() {
        return construct;
    }
}
