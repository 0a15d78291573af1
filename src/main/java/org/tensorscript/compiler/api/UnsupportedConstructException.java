package org.tensorscript.compiler.api;

/**
 * Thrown for a statement, expression or operator shape outside the accepted script subset.
 */
public class UnsupportedConstructException extends TranslationException {

    public UnsupportedConstructException(String message, SourceInfo sourceInfo) {
        super(TranslationErrorCode.UNSUPPORTED_CONSTRUCT, message, sourceInfo, null);
    }

    public UnsupportedConstructException(String message, SourceInfo sourceInfo, Throwable cause) {
        super(TranslationErrorCode.UNSUPPORTED_CONSTRUCT, message, sourceInfo, cause);
    }
}
