package dev.cvevaluator.rag;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextChunkerTest {

    private TextChunker chunker;

    @BeforeEach
    void setUp() {
        chunker = new TextChunker();
    }

    @Test
    @DisplayName("Should return no chunks for blank text")
    void shouldReturnNothingForBlankText() {
        assertThat(chunker.chunk("   ")).isEmpty();
        assertThat(chunker.chunk(null)).isEmpty();
    }

    @Test
    @DisplayName("Should keep short text in a single chunk")
    void shouldKeepShortTextTogether() {
        List<Chunk> chunks = chunker.chunk("Backend engineer  with\nJava experience");

        assertThat(chunks).containsExactly(new Chunk("Backend engineer with Java experience", 0));
    }

    @Test
    @DisplayName("Should respect the size limit and overlap consecutive chunks")
    void shouldSplitWithOverlap() {
        String text = IntStream.range(0, 40).mapToObj(i -> "word" + i).collect(Collectors.joining(" "));

        List<Chunk> chunks = chunker.chunk(text, 50, 15);

        assertThat(chunks).hasSizeGreaterThan(1);
        assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.content().length()).isLessThanOrEqualTo(50));
        assertThat(chunks).extracting(Chunk::index)
                .containsExactlyElementsOf(IntStream.range(0, chunks.size()).boxed().toList());

        for (int i = 1; i < chunks.size(); i++) {
            String previous = chunks.get(i - 1).content();
            String[] previousWords = previous.split(" ");
            String overlap = previousWords[previousWords.length - 2] + " " + previousWords[previousWords.length - 1];
            assertThat(chunks.get(i).content()).startsWith(overlap);
        }
        assertThat(chunks.get(chunks.size() - 1).content()).endsWith("word39");
    }

    @Test
    @DisplayName("Should reject an overlap that is not smaller than the chunk size")
    void shouldRejectInvalidParameters() {
        assertThatThrownBy(() -> chunker.chunk("text", 100, 100))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> chunker.chunk("text", 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
