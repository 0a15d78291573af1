package org.tensorscript.compiler.schema;

/**
 * A versioned operator namespace, e.g. the default domain {@code ""} at version 18.
 *
 * @param domain The domain name; the empty string is the default domain.
 * @param version The opset version.
 */
public record Opset(String domain, int version) {

    /**
     * @return {@code true} for the default operator domain.
     */
    public boolean isDefaultDomain() {
        return domain.isEmpty();
    }

    @Override
    public String toString() {
        return (domain.isEmpty() ? "<default>" : domain) + "@" + version;
    }
}
