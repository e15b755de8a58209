package org.smilesforge.codegen;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class CodegenOptionsTest {

    @Test
    void readsCodegenSection() {
        CodegenOptions options = CodegenOptions.fromConfig(ConfigFactory.parseString("""
                smilesforge.codegen {
                  max-nesting-depth = 32
                  strict-metadata = true
                  verify-output = true
                }
                """));

        assertThat(options).isEqualTo(new CodegenOptions(32, true, true));
    }

    @Test
    void missingKeysKeepDefaults() {
        CodegenOptions options = CodegenOptions.fromConfig(
                ConfigFactory.parseString("smilesforge.codegen.strict-metadata = true"));

        assertThat(options.maxNestingDepth()).isEqualTo(CodegenOptions.DEFAULT_MAX_NESTING_DEPTH);
        assertThat(options.strictMetadata()).isTrue();
        assertThat(options.verifyOutput()).isFalse();
    }

    @Test
    void missingSectionYieldsDefaults() {
        assertThat(CodegenOptions.fromConfig(ConfigFactory.empty())).isEqualTo(CodegenOptions.defaults());
    }

    @Test
    void rejectsNonPositiveDepthLimit() {
        assertThatThrownBy(() -> new CodegenOptions(0, false, false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
