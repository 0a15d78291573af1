package org.tensorscript.compiler.api;

/**
 * Thrown when an empty list literal would have to become a tensor.
 */
public class EmptyListException extends TranslationException {

    public EmptyListException(String message, SourceInfo sourceInfo) {
        super(TranslationErrorCode.EMPTY_LIST, message, sourceInfo, null);
    }

    public EmptyListException(String message, SourceInfo sourceInfo, Throwable cause) {
        super(TranslationErrorCode.EMPTY_LIST, message, sourceInfo, cause);
    }
}
