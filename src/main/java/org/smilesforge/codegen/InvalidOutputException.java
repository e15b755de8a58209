package org.smilesforge.codegen;

/**
 * Thrown when output verification is enabled and the rendered text has unbalanced branches
 * or unpaired ring-closure labels.
 */
public class InvalidOutputException extends SmilesCodegenException {

    private final String output;

    public InvalidOutputException(String output, String reason) {
        super("Generated notation '" + output + "' is invalid: " + reason);
        this.output = output;
    }

    public String getOutput() {
        return output;
    }
}
