package org.tensorscript.compiler.api;

/**
 * Thrown when an outer variable captured by a nested function is rebound before the function is used.
 */
public class CapturedVariableMutationException extends TranslationException {

    public CapturedVariableMutationException(String message, SourceInfo sourceInfo) {
        super(TranslationErrorCode.CAPTURED_VARIABLE_MUTATION, message, sourceInfo, null);
    }

    public CapturedVariableMutationException(String message, SourceInfo sourceInfo, Throwable cause) {
        super(TranslationErrorCode.CAPTURED_VARIABLE_MUTATION, message, sourceInfo, cause);
    }
}
