package com.errlens.cli;

import com.errlens.ErrLensCLI;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("extract command")
class ExtractCommandTest {

    private static final String TSC_OUTPUT =
        "src/index.ts:10:5 - error TS2322: Type 'string' is not assignable to type 'number'.\n";

    @TempDir
    Path tempDir;

    private StringWriter out;
    private CommandLine commandLine;
    private String absentConfig;

    @BeforeEach
    void setUpCommandLine() {
        out = new StringWriter();
        commandLine = ErrLensCLI.commandLine();
        commandLine.setOut(new PrintWriter(out));
        absentConfig = tempDir.resolve("absent.yaml").toString();
    }

    @Test
    @DisplayName("Should print YAML by default")
    void extract_defaultFormat_printsYaml() throws IOException {
        // Given
        Path log = Files.writeString(tempDir.resolve("build.log"), TSC_OUTPUT);

        // When
        int exitCode = commandLine.execute("extract", log.toString(), "-c", absentConfig);

        // Then
        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("totalErrors: 1")
            .contains("file: src/index.ts")
            .contains("code: TS2322");
    }

    @Test
    @DisplayName("Should print JSON when asked")
    void extract_jsonFormat_printsParseableJson() throws IOException {
        // Given
        Path log = Files.writeString(tempDir.resolve("build.log"), TSC_OUTPUT);

        // When
        int exitCode = commandLine.execute("extract", log.toString(), "-f", "json", "-c", absentConfig);

        // Then
        assertThat(exitCode).isZero();
        JsonNode result = new ObjectMapper().readTree(out.toString());
        assertThat(result.get("totalErrors").asInt()).isEqualTo(1);
        assertThat(result.get("errors").get(0).get("line").asInt()).isEqualTo(10);
        assertThat(result.get("metadata").get("detection").get("extractor").asText()).isEqualTo("typescript");
    }

    @Test
    @DisplayName("Should honour maxDisplayErrors from the config file")
    void extract_configuredDisplayLimit_truncatesListButKeepsTotal() throws IOException {
        // Given
        StringBuilder output = new StringBuilder();
        for (int i = 1; i <= 15; i++) {
            output.append("src/file").append(i).append(".ts:").append(i).append(":5 - error TS2322: Problem ")
                .append(i).append('\n');
        }
        Path log = Files.writeString(tempDir.resolve("build.log"), output.toString());
        Path config = Files.writeString(tempDir.resolve("errlens.yaml"), """
            output:
              format: json
              maxDisplayErrors: 2
            """);

        // When
        int exitCode = commandLine.execute("extract", log.toString(), "-c", config.toString());

        // Then
        assertThat(exitCode).isZero();
        JsonNode result = new ObjectMapper().readTree(out.toString());
        assertThat(result.get("errors")).hasSize(2);
        assertThat(result.get("totalErrors").asInt()).isEqualTo(15);
    }

    @Test
    @DisplayName("Should run the named extractor")
    void extract_namedExtractor_skipsDetection() throws IOException {
        // Given
        Path log = Files.writeString(tempDir.resolve("build.log"), TSC_OUTPUT);

        // When
        int exitCode = commandLine.execute("extract", log.toString(), "-e", "mocha", "-f", "json", "-c", absentConfig);

        // Then
        assertThat(exitCode).isZero();
        JsonNode result = new ObjectMapper().readTree(out.toString());
        assertThat(result.get("metadata").get("detection").get("extractor").asText()).isEqualTo("mocha");
        assertThat(result.get("totalErrors").asInt()).isZero();
    }

    @Test
    @DisplayName("Should fail on an unknown extractor")
    void extract_unknownExtractor_exitsWithOne() throws IOException {
        // Given
        Path log = Files.writeString(tempDir.resolve("build.log"), TSC_OUTPUT);

        // When
        int exitCode = commandLine.execute("extract", log.toString(), "-e", "nope", "-c", absentConfig);

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    @DisplayName("Should fail on a missing input file")
    void extract_missingFile_exitsWithOne() {
        // When
        int exitCode = commandLine.execute("extract", tempDir.resolve("missing.log").toString(), "-c", absentConfig);

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).isEmpty();
    }
}
