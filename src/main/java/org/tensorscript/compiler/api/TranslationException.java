package org.tensorscript.compiler.api;

/**
 * Base class of all errors raised while lowering a script into a graph.
 * <p>
 * Every lowering error is fatal for the whole translation. The public
 * {@link ICompiler} API converts it into a checked {@link CompilationException}.
 */
public abstract class TranslationException extends RuntimeException {

    private final TranslationErrorCode code;
    private final transient SourceInfo sourceInfo;

    protected TranslationException(TranslationErrorCode code, String message, SourceInfo sourceInfo, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.sourceInfo = sourceInfo;
    }

    /**
     * @return The error category.
     */
    public TranslationErrorCode code() {
        return code;
    }

    /**
     * @return The position of the offending construct, or {@code null} if not known.
     */
    public SourceInfo sourceInfo() {
        return sourceInfo;
    }
}
