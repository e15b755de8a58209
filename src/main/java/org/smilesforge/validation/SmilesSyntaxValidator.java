package org.smilesforge.validation;

import java.util.HashSet;
import java.util.Set;

/**
 * Structural check of generated line notation.
 * <p>
 * Verifies that branch parentheses balance and that every ring-closure label is opened and closed
 * again. Labels are single digits or {@code %} followed by two digits; digits inside a bracket
 * atom such as {@code [13CH3]} or {@code [NH4+]} are isotopes or counts, not labels. A bracket atom
 * left open is an error. The check
 * knows nothing about valence or aromaticity.
 */
public class SmilesSyntaxValidator {

    static final String UNMATCHED_CLOSING_BRANCH = "Unmatched closing branch";
    static final String UNCLOSED_BRANCH = "Unclosed branch";
    static final String INVALID_RING_CLOSURE = "Invalid ring closure";
    static final String UNCLOSED_BRACKET_ATOM = "Unclosed bracket atom";

    /**
     * Checks a SMILES string.
     *
     * @param smiles The text to check.
     * @return The result, carrying the first problem found.
     */
    public ValidationResult validate(String smiles) {
        int branchDepth = 0;
        boolean inBracketAtom = false;
        Set<String> openLabels = new HashSet<>();

        for (int i = 0; i < smiles.length(); i++) {
            char c = smiles.charAt(i);
            if (inBracketAtom) {
                inBracketAtom = c != ']';
                continue;
            }
            if (c == '[') {
                inBracketAtom = true;
            } else if (c == '(') {
                branchDepth++;
            } else if (c == ')') {
                branchDepth--;
                if (branchDepth < 0) {
                    return ValidationResult.failure(UNMATCHED_CLOSING_BRANCH);
                }
            } else if (c >= '0' && c <= '9') {
                toggle(openLabels, String.valueOf(c));
            } else if (c == '%') {
                if (i + 2 >= smiles.length()
                        || !Character.isDigit(smiles.charAt(i + 1))
                        || !Character.isDigit(smiles.charAt(i + 2))) {
                    return ValidationResult.failure(INVALID_RING_CLOSURE);
                }
                toggle(openLabels, smiles.substring(i, i + 3));
                i += 2;
            }
        }

        if (inBracketAtom) {
            return ValidationResult.failure(UNCLOSED_BRACKET_ATOM);
        }
        if (branchDepth > 0) {
            return ValidationResult.failure(UNCLOSED_BRANCH);
        }
        if (!openLabels.isEmpty()) {
            return ValidationResult.failure(INVALID_RING_CLOSURE);
        }
        return ValidationResult.ok();
    }

    private static void toggle(Set<String> openLabels, String label) {
        if (!openLabels.remove(label)) {
            openLabels.add(label);
        }
    }
}
