package org.tensorscript.compiler.api;

/**
 * Thrown when a literal or attribute value cannot take the required type.
 */
public class TypeMismatchException extends TranslationException {

    public TypeMismatchException(String message, SourceInfo sourceInfo) {
        super(TranslationErrorCode.TYPE_MISMATCH, message, sourceInfo, null);
    }

    public TypeMismatchException(String message, SourceInfo sourceInfo, Throwable cause) {
        super(TranslationErrorCode.TYPE_MISMATCH, message, sourceInfo, cause);
    }
}
