package org.tensorscript.compiler.api;

/**
 * A pure data class representing a position in the script source.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param fileName The file where the code is located.
 * @param lineNumber The line number, starting at 1.
 * @param columnNumber The column number, starting at 1.
 * @param lineContent The content of the line, or an empty string if unknown.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber, String lineContent) {

    /** Placeholder for values that are synthesized and have no source position. */
    public static final SourceInfo UNKNOWN = new SourceInfo("<unknown>", -1, -1, "");

    @Override
    public String toString() {
        return fileName + ":" + lineNumber + ":" + columnNumber;
    }
}
