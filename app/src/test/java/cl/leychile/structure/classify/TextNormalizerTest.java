package cl.leychile.structure.classify;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TextNormalizerTest {

    private final TextNormalizer normalizer = new TextNormalizer();

    @Test
    void unifiesLineBreaksAndCollapsesWhitespace() {
        assertThat(normalizer.normalize("Artículo 1.-\r\n  Texto con\t\tespacios  \rFin\n\n\n"))
                .containsExactly("Artículo 1.-", "Texto con espacios", "Fin");
    }

    @Test
    void removesControlCharacters() {
        assertThat(normalizer.normalizeLine("Ley\u0007 N° 20.720\u200B")).isEqualTo("Ley N° 20.720");
    }

    @Test
    void unwrapsMarkdownMarkers() {
        assertThat(normalizer.normalize("## TÍTULO I\n**Artículo 1.-** texto\n**Artículo 2.-**\n> cita"))
                .containsExactly("TÍTULO I", "**Artículo 1.-** texto", "Artículo 2.-", "cita");
    }

    @Test
    void emptyInputGivesNoLines() {
        assertThat(normalizer.normalize("")).isEmpty();
        assertThat(normalizer.normalize(null)).isEmpty();
    }
}
