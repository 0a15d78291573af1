package org.tensorscript.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur while lowering a script.
 * This decouples the test logic from the wording of error messages.
 */
public enum TranslationErrorCode {
    // region Lowering Errors
    /** A construct outside the accepted script subset. */
    UNSUPPORTED_CONSTRUCT,
    /** A name that is not bound in any enclosing scope. */
    UNBOUND_NAME,
    /** Actual arguments or return values do not match the declared arity. */
    ARITY_MISMATCH,
    /** A literal or attribute value has an incompatible type. */
    TYPE_MISMATCH,
    /** An empty list literal cannot be promoted to a tensor. */
    EMPTY_LIST,
    /** An outer variable captured by a nested function changed between definition and use. */
    CAPTURED_VARIABLE_MUTATION
    // endregion
}
