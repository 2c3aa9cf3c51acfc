package com.errlens.cli;

import com.errlens.core.config.EngineConfig.OutputFormat;
import com.errlens.core.model.ErrorExtractorResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

/**
 * Serializes extraction results for the terminal.
 */
final class ResultWriter {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(
        YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .enable(YAMLGenerator.Feature.LITERAL_BLOCK_STYLE)
            .build());

    private ResultWriter() {
        // Utility class
    }

    /**
     * Renders a result in the requested format.
     *
     * @param result result to render
     * @param format output format
     * @return serialized text
     * @throws JsonProcessingException if serialization fails
     */
    static String write(ErrorExtractorResult result, OutputFormat format) throws JsonProcessingException {
        return switch (format) {
            case JSON -> JSON_MAPPER.writeValueAsString(result);
            case YAML -> YAML_MAPPER.writeValueAsString(result);
        };
    }
}
