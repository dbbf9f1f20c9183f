package com.qualitylens.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qualitylens.core.model.Finding;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ReportWriter}.
 */
class ReportWriterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    private final ReportWriter writer = new ReportWriter();

    @Test
    void toJson_findings_useLintStyleFieldNames() throws IOException {
        List<Finding> findings = new AnalysisEngine().analyzeContent("a.js", "javascript", "var a = 1;");

        JsonNode json = MAPPER.readTree(writer.toJson(findings));

        assertThat(json.isArray()).isTrue();
        JsonNode first = json.get(0);
        assertThat(first.get("type").asText()).isEqualTo("deprecated-declaration");
        assertThat(first.get("severity").asText()).isEqualTo("warning");
        assertThat(first.get("rule").asText()).isEqualTo("no-var");
        assertThat(first.get("line").asInt()).isEqualTo(1);
    }

    @Test
    void write_projectResult_createsParentDirectoriesAndOmitsNulls() throws IOException {
        Path project = tempDir.resolve("project");
        Files.createDirectories(project);
        Files.writeString(project.resolve("user.js"), """
            function createUser(name, email, age, role, team, manager, startDate, location) {
              return { name, email };
            }
            """);
        ProjectAnalysisResult result = new AnalysisEngine().analyzeProject(project, "javascript");
        Path target = tempDir.resolve("reports/nested/report.json");

        writer.write(result, target);

        JsonNode json = MAPPER.readTree(Files.readString(target));
        assertThat(json.get("statistics").get("filesAnalyzed").asInt()).isEqualTo(1);
        assertThat(json.get("principles").get("overallScore").asInt()).isEqualTo(94);
        JsonNode violation = json.get("violations").get(0);
        assertThat(violation.get("principle").asText()).isEqualTo("SRP");
        assertThat(violation.get("severity").asText()).isEqualTo("high");
        assertThat(violation.get("method").asText()).isEqualTo("createUser");
        assertThat(violation.has("class")).isFalse();
        assertThat(violation.get("metrics").get("parameters").asInt()).isEqualTo(8);
        assertThat(json.get("findings").get("user.js").size()).isEqualTo(1);
    }
}
