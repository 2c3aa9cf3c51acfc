package com.errlens.core.plugin;

import com.errlens.core.extractor.DetectionResult;
import com.errlens.core.extractor.ExtractorMetadata;
import com.errlens.core.extractor.ExtractorPlugin;
import com.errlens.core.extractor.ExtractorSample;
import com.errlens.core.extractor.StubExtractor;
import com.errlens.core.model.ErrorExtractorResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PluginValidator}.
 */
class PluginValidatorTest {

    @Test
    void validate_acceptsWellFormedPlugin() {
        assertThatCode(() -> PluginValidator.validate(new StubExtractor("rspec", 70, 80), "rspec.jar", Set.of("jest")))
            .doesNotThrowAnyException();
    }

    @Test
    void validate_rejectsNullPlugin() {
        assertThatThrownBy(() -> PluginValidator.validate(null, "x.jar", Set.of()))
            .isInstanceOf(PluginValidationException.class)
            .hasMessage("Plugin must not be null");
    }

    @Test
    void validate_rejectsMissingMetadataFields() {
        assertThatThrownBy(() -> PluginValidator.validate(withMetadata(null), "x.jar", Set.of()))
            .hasMessage("Plugin missing required metadata");
        assertThatThrownBy(() -> PluginValidator.validate(
            withMetadata(new ExtractorMetadata(" ", "1.0", "me", "d", null)), "x.jar", Set.of()))
            .hasMessage("Plugin metadata missing name");
        assertThatThrownBy(() -> PluginValidator.validate(
            withMetadata(new ExtractorMetadata("x", null, "me", "d", null)), "x.jar", Set.of()))
            .hasMessage("Plugin metadata missing version");
        assertThatThrownBy(() -> PluginValidator.validate(
            withMetadata(new ExtractorMetadata("x", "1.0", "me", "", null)), "x.jar", Set.of()))
            .hasMessage("Plugin metadata missing description");
    }

    @Test
    void validate_rejectsPriorityOutOfRange() {
        assertThatThrownBy(() -> PluginValidator.validate(new StubExtractor("x", 101, 70), "x.jar", Set.of()))
            .isInstanceOf(PluginValidationException.class)
            .hasMessageContaining("Priority must be between 0 and 100");
        assertThatThrownBy(() -> PluginValidator.validate(new StubExtractor("x", -1, 70), "x.jar", Set.of()))
            .hasMessageContaining("Priority must be between 0 and 100");
    }

    @Test
    void validate_rejectsNullSamples() {
        StubExtractor plugin = new StubExtractor("x", 50, 70).withSamples(null);

        assertThatThrownBy(() -> PluginValidator.validate(plugin, "x.jar", Set.of()))
            .hasMessage("Plugin missing required samples list");
    }

    @Test
    void validate_rejectsNameCollision() {
        assertThatThrownBy(() -> PluginValidator.validate(new StubExtractor("jest", 50, 70), "jest.jar", Set.of("jest")))
            .hasMessage("Plugin name 'jest' is already registered")
            .isInstanceOfSatisfying(PluginValidationException.class,
                e -> assertThat(e.getSource()).isEqualTo("jest.jar"));
    }

    @Test
    void validate_pluginThrowingFromGetter_isRejected() {
        ExtractorPlugin plugin = new StubExtractor("x", 50, 70) {
            @Override
            public ExtractorMetadata getMetadata() {
                throw new UnsupportedOperationException("not ready");
            }
        };

        assertThatThrownBy(() -> PluginValidator.validate(plugin, "x.jar", Set.of()))
            .hasMessage("Plugin failed while describing itself: not ready");
    }

    private static ExtractorPlugin withMetadata(ExtractorMetadata metadata) {
        return new ExtractorPlugin() {
            @Override
            public ExtractorMetadata getMetadata() {
                return metadata;
            }

            @Override
            public int getPriority() {
                return 50;
            }

            @Override
            public DetectionResult detect(String output) {
                return DetectionResult.none();
            }

            @Override
            public ErrorExtractorResult extract(String output, String context) {
                return null;
            }

            @Override
            public List<ExtractorSample> getSamples() {
                return List.of();
            }
        };
    }
}
