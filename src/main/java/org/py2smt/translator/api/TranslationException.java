package org.py2smt.translator.api;

/**
 * Thrown when a source file or a single function cannot be translated.
 * <p>
 * Translation is all-or-nothing: whenever this exception escapes, no partial
 * output of the affected function is valid.
 */
public class TranslationException extends Exception {

    private final TranslatorErrorCode errorCode;
    private final SourceInfo sourceInfo;

    /**
     * @param errorCode The error category.
     * @param message The detail message.
     */
    public TranslationException(TranslatorErrorCode errorCode, String message) {
        this(errorCode, message, (SourceInfo) null);
    }

    /**
     * @param errorCode The error category.
     * @param message The detail message.
     * @param sourceInfo Where the error was found, or {@code null} if unknown.
     */
    public TranslationException(TranslatorErrorCode errorCode, String message, SourceInfo sourceInfo) {
        super(sourceInfo == null ? message : String.format("%s at %s", message, sourceInfo));
        this.errorCode = errorCode;
        this.sourceInfo = sourceInfo;
    }

    /**
     * @param errorCode The error category.
     * @param message The detail message.
     * @param cause The cause.
     */
    public TranslationException(TranslatorErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.sourceInfo = null;
    }

    public TranslatorErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return The source position, or {@code null} if the error is not tied to one.
     */
    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }
}
