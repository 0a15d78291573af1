package org.tensorscript.compiler.api;

/**
 * Thrown when a name is read but not bound in any enclosing scope.
 */
public class UnboundNameException extends TranslationException {

    private final String name;

    public UnboundNameException(String name, String message, SourceInfo sourceInfo) {
        super(TranslationErrorCode.UNBOUND_NAME, message, sourceInfo, null);
        this.name = name;
    }

    /**
     * @return The name that could not be resolved.
     */
    public String name() {
        return name;
    }
}
