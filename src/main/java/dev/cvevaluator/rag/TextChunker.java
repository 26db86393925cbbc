package dev.cvevaluator.rag;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text on whitespace into chunks of at most {@code chunkSize} characters. Each new chunk
 * starts with the trailing words of the previous one, up to {@code overlap} characters.
 * A single word longer than {@code chunkSize} becomes its own chunk.
 */
@Component
public class TextChunker {

    public static final int DEFAULT_CHUNK_SIZE = 500;
    public static final int DEFAULT_OVERLAP = 100;

    public List<Chunk> chunk(String text) {
        return chunk(text, DEFAULT_CHUNK_SIZE, DEFAULT_OVERLAP);
    }

    public List<Chunk> chunk(String text, int chunkSize, int overlap) {
        if (chunkSize <= 0 || overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException("Invalid chunking parameters: size=" + chunkSize + ", overlap=" + overlap);
        }
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<Chunk> chunks = new ArrayList<>();
        List<String> current = new ArrayList<>();
        int currentLength = 0;

        for (String word : text.trim().split("\\s+")) {
            int wordLength = word.length() + 1;
            if (currentLength + wordLength > chunkSize && !current.isEmpty()) {
                chunks.add(new Chunk(String.join(" ", current), chunks.size()));
                current = tail(current, overlap);
                currentLength = current.isEmpty() ? 0 : String.join(" ", current).length() + 1;
            }
            current.add(word);
            currentLength += wordLength;
        }

        if (!current.isEmpty()) {
            chunks.add(new Chunk(String.join(" ", current), chunks.size()));
        }
        return chunks;
    }

    private List<String> tail(List<String> words, int maxChars) {
        List<String> tail = new ArrayList<>();
        int length = 0;
        for (int i = words.size() - 1; i >= 0; i--) {
            int next = length + words.get(i).length() + (tail.isEmpty() ? 0 : 1);
            if (next > maxChars) {
                break;
            }
            tail.add(0, words.get(i));
            length = next;
        }
        return tail;
    }
}
