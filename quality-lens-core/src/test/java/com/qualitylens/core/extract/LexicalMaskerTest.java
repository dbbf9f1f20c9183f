package com.qualitylens.core.extract;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link LexicalMasker}.
 */
class LexicalMaskerTest {

    @Test
    void mask_lineComment_isBlankedToEndOfLine() {
        assertThat(LexicalMasker.mask("a = 1; // note")).isEqualTo("a = 1;        ");
    }

    @Test
    void mask_blockCommentAcrossLines_isBlankedOnBothLines() {
        List<String> masked = LexicalMasker.mask(List.of("a /* b", "c */ d"));

        assertThat(masked).containsExactly("a     ", "     d");
    }

    @Test
    void mask_stringContents_areBlankedButQuotesKept() {
        assertThat(LexicalMasker.mask("x = \"var y\";")).isEqualTo("x = \"     \";");
    }

    @Test
    void mask_escapedQuote_doesNotEndTheString() {
        assertThat(LexicalMasker.mask("'it\\'s'")).isEqualTo("'     '");
    }

    @Test
    void mask_templateLiteral_spansLinesUntilClosingBacktick() {
        List<String> masked = LexicalMasker.mask(List.of("const t = `a", "b ${x}`;", "var z;"));

        assertThat(masked).containsExactly("const t = ` ", "      `;", "var z;");
    }

    @Test
    void mask_unterminatedQuote_resetsAtEndOfLine() {
        List<String> masked = LexicalMasker.mask(List.of("x = 'abc", "y = 1"));

        assertThat(masked).containsExactly("x = '   ", "y = 1");
    }

    @Test
    void mask_preservesLineLengths() {
        String raw = "if (a == 'b') { /* c */ console.log(`d`); } // e";

        assertThat(LexicalMasker.mask(raw)).hasSameSizeAs(raw);
    }

    @Test
    void sourceText_splitsOnNewlinesAndDropsCarriageReturns() {
        SourceText source = SourceText.of("a\r\nb\n");

        assertThat(source.rawLines()).containsExactly("a", "b", "");
        assertThat(source.rawSpan(1, 2)).isEqualTo("a\nb");
        assertThat(source.maskedSpan(5, 9)).isEmpty();
        assertThat(SourceText.of(null).lineCount()).isEqualTo(1);
    }
}
