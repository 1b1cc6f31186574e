package eu.virtualparadox.asciimatch.ingest.tokenizer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WhitespaceTokenizerTest {

    private final WhitespaceTokenizer tokenizer = new WhitespaceTokenizer();

    @Test
    void testSplitsOnAnyWhitespaceRun() {
        assertThat(tokenizer.apply(List.of("  a happy\t\tcat \n"))).containsExactly("a", "happy", "cat");
    }

    @Test
    void testKeepsOrderAcrossInputTokens() {
        assertThat(tokenizer.apply(List.of("a b", "c"))).containsExactly("a", "b", "c");
    }

    @Test
    void testBlankInputYieldsNothing() {
        assertThat(tokenizer.apply(List.of("", "   "))).isEmpty();
        assertThat(tokenizer.apply(List.of())).isEmpty();
    }
}
