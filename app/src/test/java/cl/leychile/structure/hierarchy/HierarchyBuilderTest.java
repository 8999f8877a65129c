package cl.leychile.structure.hierarchy;

import static org.assertj.core.api.Assertions.assertThat;

import cl.leychile.structure.classify.ClassifiedLine;
import cl.leychile.structure.classify.DefaultLineClassifier;
import cl.leychile.structure.classify.LineType;
import cl.leychile.structure.model.Diagnostic;
import cl.leychile.structure.model.NodeKind;
import cl.leychile.structure.model.Severity;
import cl.leychile.structure.model.StructuralNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class HierarchyBuilderTest {

    private final DefaultLineClassifier classifier = new DefaultLineClassifier();
    private final HierarchyBuilder builder = new HierarchyBuilder();

    @Test
    void nestsDivisionsAndArticlesByPrecedence() {
        HierarchyResult result = build(
                "LIBRO I",
                "TÍTULO I",
                "CAPÍTULO 1",
                "Artículo 1.- Primero.",
                "Artículo 2.- Segundo.",
                "TÍTULO II",
                "Artículo 3.- Tercero.",
                "LIBRO II",
                "Artículo 4.- Cuarto.");

        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.roots()).extracting(StructuralNode::originalLabel).containsExactly("LIBRO I", "LIBRO II");
        StructuralNode book = result.roots().get(0);
        assertThat(book.children()).extracting(StructuralNode::originalLabel).containsExactly("TÍTULO I", "TÍTULO II");
        StructuralNode chapter = book.children().get(0).children().get(0);
        assertThat(chapter.kind()).isEqualTo(NodeKind.CHAPTER);
        assertThat(chapter.children()).extracting(node -> node.number().orElseThrow()).containsExactly("1", "2");
        assertThat(chapter.children().get(0).contextPath()).containsExactly("LIBRO I", "TÍTULO I", "CAPÍTULO 1");
        assertThat(chapter.children().get(0).rawLines()).containsExactly("Primero.");
        assertThat(result.roots().get(1).children().get(0).contextLabel()).isEqualTo("LIBRO II");
    }

    @Test
    void assignsIdsInDocumentOrder() {
        HierarchyResult result = build("TÍTULO I", "Artículo 1.- Uno.", "TÍTULO II", "Artículo 2.- Dos.");

        List<String> ids = new ArrayList<>();
        result.roots().forEach(root -> root.flatten().forEach(node -> ids.add(node.id())));
        assertThat(ids).containsExactly("1", "2", "3", "4");
    }

    @Test
    void skippedLevelsAndRootArticlesAreValid() {
        HierarchyResult result = build(
                "Artículo 1.- Antes de toda división.",
                "LIBRO PRIMERO",
                "Párrafo 1°",
                "Artículo 2.- Dentro del párrafo.",
                "SECCIÓN 1");

        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.roots()).extracting(StructuralNode::kind).containsExactly(NodeKind.ARTICLE, NodeKind.BOOK);
        StructuralNode paragraph = result.roots().get(1).children().get(0);
        assertThat(paragraph.kind()).isEqualTo(NodeKind.PARAGRAPH_DIVISION);
        assertThat(paragraph.children()).extracting(StructuralNode::kind)
                .containsExactly(NodeKind.ARTICLE, NodeKind.SECTION);
        assertThat(paragraph.children().get(1).children()).isEmpty();
    }

    @Test
    void appendsNameLineToBareDivisionHeader() {
        HierarchyResult result = build("TÍTULO I", "NORMAS GENERALES", "Disposiciones comunes.", "Artículo 1.- Texto.");

        StructuralNode title = result.roots().get(0);
        assertThat(title.originalLabel()).isEqualTo("TÍTULO I NORMAS GENERALES");
        assertThat(title.description()).containsExactly("Disposiciones comunes.");
        assertThat(title.children().get(0).contextPath()).containsExactly("TÍTULO I NORMAS GENERALES");
    }

    @Test
    void articleKeepsBlankLinesBetweenParagraphsButNotAtEdges() {
        HierarchyResult result = build("Artículo 1.-", "", "Primer inciso.", "", "Segundo inciso.", "", "");

        assertThat(result.roots().get(0).rawLines()).containsExactly("Primer inciso.", "", "Segundo inciso.");
    }

    @Test
    void warnsWhenHigherDivisionFollowsLowerSibling() {
        HierarchyResult result = build("TÍTULO I", "Artículo 1.- Texto.", "LIBRO I", "Artículo 2.- Texto.");

        assertThat(result.roots()).extracting(StructuralNode::kind).containsExactly(NodeKind.TITLE, NodeKind.BOOK);
        assertThat(result.diagnostics()).singleElement().satisfies(diagnostic -> {
            assertThat(diagnostic.rule()).isEqualTo(Diagnostic.STRUCTURE_INVERSION);
            assertThat(diagnostic.severity()).isEqualTo(Severity.WARNING);
            assertThat(diagnostic.nodeId()).contains("3");
        });
    }

    @Test
    void warnsOnDuplicateArticleNumberInSameContext() {
        HierarchyResult result = build(
                "TÍTULO I", "Artículo 1.- Uno.", "Artículo 1.- Otra vez.",
                "TÍTULO II", "Artículo 1.- Distinto contexto.");

        assertThat(result.diagnostics()).extracting(Diagnostic::rule)
                .containsExactly(Diagnostic.DUPLICATE_ARTICLE_NUMBER);
        assertThat(result.diagnostics().get(0).nodeId()).contains("3");
    }

    @Test
    void inlineArticleMentionDoesNotOpenArticle() {
        HierarchyResult result = build("Artículo 1.- Texto.", "Según el artículo 10 de la presente ley.");

        assertThat(result.roots()).hasSize(1);
        assertThat(result.roots().get(0).rawLines())
                .containsExactly("Texto.", "Según el artículo 10 de la presente ley.");
    }

    @Test
    void emptyBodyGivesEmptyResult() {
        assertThat(builder.build(List.of())).isEqualTo(HierarchyResult.empty());
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 7L, 42L, 2024L, 987654321L})
    void randomHeaderSequencesNeverViolatePrecedence(long seed) {
        Random random = new Random(seed);
        String[] keywords = {"LIBRO", "TÍTULO", "CAPÍTULO", "Párrafo", "SECCIÓN"};
        List<String> lines = new ArrayList<>();
        int articleNumber = 1;
        for (int i = 0; i < 200; i++) {
            int pick = random.nextInt(keywords.length + 3);
            if (pick < keywords.length) {
                lines.add(keywords[pick] + " " + (i + 1));
            } else {
                lines.add("Artículo " + articleNumber++ + ".- Texto " + i + ".");
                if (random.nextBoolean()) {
                    lines.add("Continuación del texto.");
                }
            }
        }
        List<ClassifiedLine> classified = classifier.classifyAll(lines);
        long articleHeaders = classified.stream().filter(line -> line.type() == LineType.ARTICLE_HEADER).count();

        HierarchyResult result = builder.build(classified);

        List<StructuralNode> all = new ArrayList<>();
        result.roots().forEach(root -> all.addAll(root.flatten()));
        assertThat(all.stream().filter(StructuralNode::isArticle).count()).isEqualTo(articleHeaders);
        for (StructuralNode node : all) {
            for (StructuralNode child : node.children()) {
                assertThat(node.kind().mayContain(child.kind()))
                        .as("%s contains %s", node.originalLabel(), child.originalLabel())
                        .isTrue();
            }
        }
    }

    private HierarchyResult build(String... lines) {
        return builder.build(classifier.classifyAll(List.of(lines)));
    }
}
