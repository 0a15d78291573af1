package org.tensorscript.compiler.api;

/**
 * Thrown when the number of arguments or return values does not match the declaration.
 */
public class ArityException extends TranslationException {

    public ArityException(String message, SourceInfo sourceInfo) {
        super(TranslationErrorCode.ARITY_MISMATCH, message, sourceInfo, null);
    }

    public ArityException(String message, SourceInfo sourceInfo, Throwable cause) {
        super(TranslationErrorCode.ARITY_MISMATCH, message, sourceInfo, cause);
    }
}
