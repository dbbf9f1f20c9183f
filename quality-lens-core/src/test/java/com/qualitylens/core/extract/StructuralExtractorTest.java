package com.qualitylens.core.extract;

import com.qualitylens.core.config.AnalyzerConfig;
import com.qualitylens.core.model.SourceUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link StructuralExtractor}.
 */
class StructuralExtractorTest {

    private StructuralExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new StructuralExtractor(AnalyzerConfig.Limits.defaults());
    }

    // ==================== Declaration forms ====================

    @Test
    void extract_namedFunction_returnsUnitWithSpanAndParameters() {
        // Given
        String content = """
            function add(a, b) {
              return a + b;
            }
            """;

        // When
        List<SourceUnit> units = extractor.extract(content);

        // Then
        assertThat(units).hasSize(1);
        SourceUnit unit = units.get(0);
        assertThat(unit.name()).isEqualTo("add");
        assertThat(unit.parameters()).containsExactly("a", "b");
        assertThat(unit.startLine()).isEqualTo(1);
        assertThat(unit.startColumn()).isEqualTo(1);
        assertThat(unit.endLine()).isEqualTo(3);
        assertThat(unit.body()).startsWith("function add").endsWith("}");
    }

    @Test
    void extract_expressionBodiedArrow_endsOnDeclarationLine() {
        List<SourceUnit> units = extractor.extract("const mul = (x, y) => x * y;");

        assertThat(units).singleElement().satisfies(unit -> {
            assertThat(unit.name()).isEqualTo("mul");
            assertThat(unit.parameters()).containsExactly("x", "y");
            assertThat(unit.startColumn()).isEqualTo(7);
            assertThat(unit.endLine()).isEqualTo(1);
        });
    }

    @Test
    void extract_classMethod_isRecognizedAsBareDeclaration() {
        String content = """
            class Greeter {
              greet(name) {
                return 'hi ' + name;
              }
            }
            """;

        List<SourceUnit> units = extractor.extract(content);

        assertThat(units).singleElement().satisfies(unit -> {
            assertThat(unit.name()).isEqualTo("greet");
            assertThat(unit.startLine()).isEqualTo(2);
            assertThat(unit.startColumn()).isEqualTo(3);
            assertThat(unit.endLine()).isEqualTo(4);
        });
    }

    @Test
    void extract_objectPropertyFunction_usesPropertyName() {
        List<SourceUnit> units = extractor.extract("const api = {\n  load: function (id) {\n    return id;\n  }\n};");

        assertThat(units).extracting(SourceUnit::name).containsExactly("load");
        assertThat(units.get(0).endLine()).isEqualTo(4);
    }

    @Test
    void extract_anonymousCallback_isNamedAnonymous() {
        String content = """
            items.forEach(function (item) {
              console.log(item);
            });
            """;

        List<SourceUnit> units = extractor.extract(content);

        assertThat(units).singleElement().satisfies(unit -> {
            assertThat(unit.name()).isEqualTo(SourceUnit.ANONYMOUS);
            assertThat(unit.parameters()).containsExactly("item");
            assertThat(unit.lineCount()).isEqualTo(3);
        });
    }

    @Test
    void extract_braceOnNextLine_isFollowed() {
        List<SourceUnit> units = extractor.extract("function wrapped(a)\n{\n  return a;\n}");

        assertThat(units).singleElement().satisfies(unit -> assertThat(unit.endLine()).isEqualTo(4));
    }

    // ==================== Things that are not units ====================

    @Test
    void extract_controlStatements_areNotUnits() {
        String content = """
            if (a) {
            }
            while (b) {
            }
            for (;;) {}
            switch (c) {}
            """;

        assertThat(extractor.extract(content)).isEmpty();
    }

    @Test
    void extract_declarationsInCommentsAndStrings_areIgnored() {
        String content = """
            // function hidden() {}
            /* function alsoHidden() {} */
            const s = "function inString() {}";
            """;

        assertThat(extractor.extract(content)).isEmpty();
    }

    // ==================== Parameters ====================

    @Test
    void parseParameters_dropsDefaultsTypesAndRestMarkers() {
        List<String> parameters = extractor.parseParameters("a = 1, ...rest, {x, y}, b: string");

        assertThat(parameters).containsExactly("a", "rest", "x", "y", "b");
    }

    @Test
    void parseParameters_emptyOrOverlongText_yieldsNoParameters() {
        assertThat(extractor.parseParameters("")).isEmpty();
        assertThat(extractor.parseParameters("  ")).isEmpty();
        assertThat(extractor.parseParameters("a".repeat(501))).isEmpty();
    }

    @Test
    void parseParameters_capsParameterCount() {
        String text = IntStream.range(0, 30).mapToObj(i -> "p" + i).collect(Collectors.joining(", "));

        assertThat(extractor.parseParameters(text)).hasSize(20);
    }

    // ==================== Limits ====================

    @Test
    void extract_manyDeclarations_areCappedAtUnitLimit() {
        String content = IntStream.range(0, 150)
            .mapToObj(i -> "function f" + i + "() {}")
            .collect(Collectors.joining("\n"));

        List<SourceUnit> units = extractor.extract(content);

        assertThat(units).hasSize(100);
        assertThat(units.get(99).name()).isEqualTo("f99");
    }

    @Test
    void extract_oversizedBody_isOmitted() {
        AnalyzerConfig.Limits limits = new AnalyzerConfig.Limits(null, null, null, null, null,
            20, null, null, null, null, null, null, null, null);
        StructuralExtractor small = new StructuralExtractor(limits);
        String content = """
            function big() {
              const value = computeSomething();
            }
            function tiny() {}
            """;

        List<SourceUnit> units = small.extract(content);

        assertThat(units).extracting(SourceUnit::name).containsExactly("tiny");
    }

    @Test
    void extract_unbalancedBraces_stopAtEndOfFile() {
        List<SourceUnit> units = extractor.extract("function open() {\n  if (x) {\n    y();");

        assertThat(units).singleElement().satisfies(unit -> {
            assertThat(unit.name()).isEqualTo("open");
            assertThat(unit.endLine()).isEqualTo(3);
        });
    }

    @Test
    void extract_overlongLine_isSkipped() {
        String content = "function hidden() {} // " + "x".repeat(1000);

        assertThat(extractor.extract(content)).isEmpty();
    }

    @Test
    void extract_sanitizesIdentifiers() {
        List<SourceUnit> units = extractor.extract("function $load_2(a) {}");

        assertThat(units).extracting(SourceUnit::name).containsExactly("$load_2");
    }

    @Test
    void extract_pathologicalInput_completesQuickly() {
        String content = "a(" + "(".repeat(5_000) + "\n" + "x = (".repeat(150);

        long started = System.nanoTime();
        extractor.extract(content);

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(2));
    }
}
