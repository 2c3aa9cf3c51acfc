package com.errlens.core.router;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link AnsiStripper}.
 */
class AnsiStripperTest {

    @Test
    void strip_removesColorCodes() {
        String colored = "\u001B[31m\u001B[1mFAIL\u001B[22m\u001B[39m src/a.test.ts";

        assertThat(AnsiStripper.strip(colored)).isEqualTo("FAIL src/a.test.ts");
    }

    @Test
    void strip_removesCursorControlAndHyperlinks() {
        String text = "\u001B[2K\u001B[1Gline\u001B]8;;https://example.com\u0007link\u001B]8;;\u0007";

        assertThat(AnsiStripper.strip(text)).isEqualTo("linelink");
    }

    @Test
    void strip_normalizesLineEndings() {
        assertThat(AnsiStripper.strip("a\r\nb\rc\n")).isEqualTo("a\nb\nc\n");
    }

    @Test
    void strip_nullAndEmpty_returnEmpty() {
        assertThat(AnsiStripper.strip(null)).isEmpty();
        assertThat(AnsiStripper.strip("")).isEmpty();
    }

    @Test
    void strip_plainText_isUnchanged() {
        String text = "src/index.ts(10,5): error TS2322: Type 'string' is not assignable to type 'number'.";

        assertThat(AnsiStripper.strip(text)).isEqualTo(text);
    }
}
