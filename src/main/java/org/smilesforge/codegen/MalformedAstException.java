package org.smilesforge.codegen;

/**
 * Thrown for inconsistent node metadata when strict metadata checking is enabled,
 * and by the JSON reader for documents that do not describe a valid tree.
 */
public class MalformedAstException extends SmilesCodegenException {

    public MalformedAstException(String message) {
        super(message);
    }

    public MalformedAstException(String message, Throwable cause) {
        super(message, cause);
    }
}
