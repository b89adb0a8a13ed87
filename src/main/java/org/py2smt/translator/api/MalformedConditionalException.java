package org.py2smt.translator.api;

/**
 * A conditional chain reached the translator without any guarded branch.
 */
public class MalformedConditionalException extends TranslationException {

    /**
     * @param sourceInfo Where the conditional starts.
     */
    public MalformedConditionalException(SourceInfo sourceInfo) {
        super(TranslatorErrorCode.MALFORMED_CONDITIONAL, "Conditional has no branches", sourceInfo);
    }
}
