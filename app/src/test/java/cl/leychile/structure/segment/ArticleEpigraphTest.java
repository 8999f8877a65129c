package cl.leychile.structure.segment;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class ArticleEpigraphTest {

    @Test
    void epigraphFollowedByTextOnSameLine() {
        assertThat(ArticleEpigraph.extract(List.of("Objeto. El presente instructivo regula la designación.")))
                .hasValueSatisfying(epigraph -> {
                    assertThat(epigraph.text()).isEqualTo("Objeto");
                    assertThat(epigraph.bodyLines()).containsExactly("El presente instructivo regula la designación.");
                });
    }

    @Test
    void epigraphFollowedByLaterLines() {
        assertThat(ArticleEpigraph.extract(List.of("Ámbito de aplicación.", "", "Esta ley regula los procedimientos.")))
                .hasValueSatisfying(epigraph -> {
                    assertThat(epigraph.text()).isEqualTo("Ámbito de aplicación");
                    assertThat(epigraph.bodyLines()).containsExactly("Esta ley regula los procedimientos.");
                });
    }

    @Test
    void lonePhraseIsArticleText() {
        assertThat(ArticleEpigraph.extract(List.of("Derógase."))).isEmpty();
        assertThat(ArticleEpigraph.extract(List.of("Derógase.", ""))).isEmpty();
    }

    @Test
    void sentenceOpeningIsNotEpigraph() {
        assertThat(ArticleEpigraph.extract(List.of("Esta ley regula. Los procedimientos."))).isEmpty();
        assertThat(ArticleEpigraph.extract(List.of("Se deroga. El artículo 4."))).isEmpty();
    }

    @Test
    void longPhraseIsNotEpigraph() {
        assertThat(ArticleEpigraph.extract(
                List.of("Modifícase el artículo 1545 del Código Civil.", "Otro inciso."))).isEmpty();
    }

    @Test
    void emptyArticleHasNoEpigraph() {
        assertThat(ArticleEpigraph.extract(List.of())).isEmpty();
    }
}
