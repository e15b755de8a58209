package org.smilesforge.codegen;

/**
 * Base class of all failures raised while turning an AST into line notation.
 * <p>
 * Unchecked: a failed render means the input tree or the generator setup is wrong, and the
 * caller cannot retry with the same input.
 */
public class SmilesCodegenException extends RuntimeException {

    public SmilesCodegenException(String message) {
        super(message);
    }

    public SmilesCodegenException(String message, Throwable cause) {
        super(message, cause);
    }
}
