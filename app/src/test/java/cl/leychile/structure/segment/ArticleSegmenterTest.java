package cl.leychile.structure.segment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.tuple;

import cl.leychile.structure.model.ContentItem;
import cl.leychile.structure.model.ContentItemType;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ArticleSegmenterTest {

    private final ArticleSegmenter segmenter = new ArticleSegmenter();

    @Test
    void numberedLinesBecomeIncisosWithoutParagraph() {
        List<ContentItem> items = segmenter.segment(List.of("1) Primero.", "2) Segundo."));

        assertThat(items)
                .extracting(ContentItem::type, ContentItem::marker, ContentItem::text)
                .containsExactly(
                        tuple(ContentItemType.INCISO, Optional.of("1"), "Primero."),
                        tuple(ContentItemType.INCISO, Optional.of("2"), "Segundo."));
    }

    @Test
    void blankLinesSeparateParagraphs() {
        List<ContentItem> items = segmenter.segment(List.of(
                "El deudor deberá", "presentar la solicitud.", "", "El tribunal resolverá."));

        assertThat(items).containsExactly(
                ContentItem.paragraph("El deudor deberá presentar la solicitud."),
                ContentItem.paragraph("El tribunal resolverá."));
    }

    @Test
    void introParagraphThenLettersContinuingAcrossLines() {
        List<ContentItem> items = segmenter.segment(List.of(
                "Para efectos de esta ley se entenderá por:",
                "a) Deudor: toda persona",
                "",
                "que sea sujeto de un procedimiento.",
                "b) Acreedor: el titular de un crédito."));

        assertThat(items).containsExactly(
                ContentItem.paragraph("Para efectos de esta ley se entenderá por:"),
                ContentItem.letter("a", "Deudor: toda persona que sea sujeto de un procedimiento."),
                ContentItem.letter("b", "Acreedor: el titular de un crédito."));
    }

    @Test
    void markerWithoutTextStillOpensItem() {
        List<ContentItem> items = segmenter.segment(List.of("1.", "Texto del numeral."));

        assertThat(items).containsExactly(ContentItem.inciso("1", "Texto del numeral."));
    }

    @Test
    void singleParagraphPolicyKeepsWholeArticle() {
        ArticleSegmenter single = new ArticleSegmenter(SegmentationPolicy.SINGLE_PARAGRAPH);

        List<ContentItem> items = single.segment(List.of("Introducción:", "1) Primero.", "", "2) Segundo."));

        assertThat(items).containsExactly(ContentItem.paragraph("Introducción: 1) Primero. 2) Segundo."));
    }

    @Test
    void emptyArticleHasNoContent() {
        assertThat(segmenter.segment(List.of())).isEmpty();
        assertThat(new ArticleSegmenter(SegmentationPolicy.SINGLE_PARAGRAPH).segment(List.of("", " "))).isEmpty();
    }

    @Test
    void parsesPolicyNames() {
        assertThat(SegmentationPolicy.from("structured")).isEqualTo(SegmentationPolicy.STRUCTURED);
        assertThat(SegmentationPolicy.from("SINGLE_PARAGRAPH")).isEqualTo(SegmentationPolicy.SINGLE_PARAGRAPH);
        assertThat(SegmentationPolicy.from("single")).isEqualTo(SegmentationPolicy.SINGLE_PARAGRAPH);
        assertThat(SegmentationPolicy.from(" ")).isEqualTo(SegmentationPolicy.STRUCTURED);

        Throwable thrown = catchThrowable(() -> SegmentationPolicy.from("sentences"));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("sentences");
    }
}
