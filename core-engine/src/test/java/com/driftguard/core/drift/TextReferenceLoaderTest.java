package com.driftguard.core.drift;

import com.driftguard.core.semantic.HashingTextEmbedder;
import com.driftguard.core.semantic.VectorSimilarity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link TextReferenceLoader} against real CSV files.
 */
class TextReferenceLoaderTest {

    @TempDir
    Path dir;

    private final HashingTextEmbedder embedder = new HashingTextEmbedder(4);

    @Test
    @DisplayName("Should average reference texts per model")
    void shouldLoadTexts() throws Exception {
        Path file = write("model_id,text\n"
                + "m1,the invoice was paid\n"
                + "m1,the invoice was paid\n"
                + ",generic fallback answer\n");

        TextReferenceSet references = TextReferenceLoader.load(file, embedder);

        assertThat(references.models()).containsExactlyInAnyOrder("m1", TextReferenceSet.DEFAULT_MODEL);
        double[] expected = embedder.embed("the invoice was paid");
        assertThat(VectorSimilarity.cosine(references.find("m1").orElseThrow(), expected))
                .isCloseTo(1.0, within(1e-9));
        assertThat(references.find("unknown-model")).isPresent();
    }

    @Test
    @DisplayName("Should parse precomputed embeddings")
    void shouldLoadEmbeddings() throws Exception {
        Path file = write("model_id,embedding\n"
                + "m1,1 0 0 0\n"
                + "m1,0;1;0;0\n");

        double[] centroid = TextReferenceLoader.load(file, embedder).find("m1").orElseThrow();

        assertThat(centroid).containsExactly(0.5, 0.5, 0.0, 0.0);
    }

    @Test
    @DisplayName("Should reject embeddings of the wrong dimension")
    void shouldRejectWrongDimension() throws Exception {
        Path file = write("model_id,embedding\nm1,1 0\n");

        assertThatThrownBy(() -> TextReferenceLoader.load(file, embedder))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should reject a missing file")
    void shouldRejectMissingFile() {
        assertThatThrownBy(() -> TextReferenceLoader.load(dir.resolve("nope.csv"), embedder))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private Path write(String content) throws Exception {
        Path file = dir.resolve("references.csv");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
