package org.smilesforge.codegen;

import com.typesafe.config.Config;

/**
 * Options of a {@link SmilesGenerator}.
 *
 * @param maxNestingDepth Maximum number of nested renders (attachments inside attachments).
 * @param strictMetadata  Fail on malformed metadata instead of falling back to defaults.
 * @param verifyOutput    Check the syntax of every top-level rendering.
 */
public record CodegenOptions(int maxNestingDepth, boolean strictMetadata, boolean verifyOutput) {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 512;

    public CodegenOptions {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got " + maxNestingDepth);
        }
    }

    public static CodegenOptions defaults() {
        return new CodegenOptions(DEFAULT_MAX_NESTING_DEPTH, false, false);
    }

    /**
     * Reads options from the {@code smilesforge.codegen} section of a configuration.
     * Missing keys keep their default values.
     *
     * @param config The application configuration.
     * @return The options.
     */
    public static CodegenOptions fromConfig(Config config) {
        CodegenOptions defaults = defaults();
        if (!config.hasPath("smilesforge.codegen")) {
            return defaults;
        }
        Config codegen = config.getConfig("smilesforge.codegen");
        return new CodegenOptions(
                codegen.hasPath("max-nesting-depth") ? codegen.getInt("max-nesting-depth") : defaults.maxNestingDepth(),
                codegen.hasPath("strict-metadata") ? codegen.getBoolean("strict-metadata") : defaults.strictMetadata(),
                codegen.hasPath("verify-output") ? codegen.getBoolean("verify-output") : defaults.verifyOutput()
        );
    }

    public CodegenOptions withStrictMetadata(boolean strict) {
        return new CodegenOptions(maxNestingDepth, strict, verifyOutput);
    }

    public CodegenOptions withVerifyOutput(boolean verify) {
        return new CodegenOptions(maxNestingDepth, strictMetadata, verify);
    }

    public CodegenOptions withMaxNestingDepth(int depth) {
        return new CodegenOptions(depth, strictMetadata, verifyOutput);
    }
}
