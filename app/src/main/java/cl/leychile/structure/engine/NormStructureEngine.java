package cl.leychile.structure.engine;

import cl.leychile.structure.classify.ClassifiedLine;
import cl.leychile.structure.classify.DefaultLineClassifier;
import cl.leychile.structure.classify.LineClassifier;
import cl.leychile.structure.classify.TextNormalizer;
import cl.leychile.structure.config.EngineConfig;
import cl.leychile.structure.hierarchy.HierarchyBuilder;
import cl.leychile.structure.hierarchy.HierarchyResult;
import cl.leychile.structure.metadata.MetadataExtractor;
import cl.leychile.structure.metadata.NormHeading;
import cl.leychile.structure.metadata.SubjectVocabulary;
import cl.leychile.structure.model.Diagnostic;
import cl.leychile.structure.model.DocumentInput;
import cl.leychile.structure.model.DocumentMetadata;
import cl.leychile.structure.model.DocumentStatistics;
import cl.leychile.structure.model.NormType;
import cl.leychile.structure.model.Severity;
import cl.leychile.structure.model.StructuralNode;
import cl.leychile.structure.reference.ReferenceResolver;
import cl.leychile.structure.relation.RelationshipReport;
import cl.leychile.structure.relation.RelationshipTracker;
import cl.leychile.structure.sections.DocumentSectionSplitter;
import cl.leychile.structure.sections.DocumentSections;
import cl.leychile.structure.segment.ArticleEpigraph;
import cl.leychile.structure.segment.ArticleSegmenter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every stage over one document: normalization, classification, section split, hierarchy,
 * metadata, article segmentation, references and relationships.
 *
 * <p>The engine holds no mutable state; the same instance may parse documents on several threads.
 */
public class NormStructureEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(NormStructureEngine.class);

    private final TextNormalizer normalizer;
    private final LineClassifier classifier;
    private final DocumentSectionSplitter splitter;
    private final HierarchyBuilder hierarchyBuilder;
    private final MetadataExtractor metadataExtractor;
    private final ArticleSegmenter segmenter;
    private final ReferenceResolver referenceResolver;
    private final RelationshipTracker relationshipTracker;

    public NormStructureEngine(TextNormalizer normalizer,
                               LineClassifier classifier,
                               DocumentSectionSplitter splitter,
                               HierarchyBuilder hierarchyBuilder,
                               MetadataExtractor metadataExtractor,
                               ArticleSegmenter segmenter,
                               ReferenceResolver referenceResolver,
                               RelationshipTracker relationshipTracker) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.splitter = Objects.requireNonNull(splitter, "splitter");
        this.hierarchyBuilder = Objects.requireNonNull(hierarchyBuilder, "hierarchyBuilder");
        this.metadataExtractor = Objects.requireNonNull(metadataExtractor, "metadataExtractor");
        this.segmenter = Objects.requireNonNull(segmenter, "segmenter");
        this.referenceResolver = Objects.requireNonNull(referenceResolver, "referenceResolver");
        this.relationshipTracker = Objects.requireNonNull(relationshipTracker, "relationshipTracker");
    }

    public static NormStructureEngine create(EngineConfig config) {
        Objects.requireNonNull(config, "config");
        return new NormStructureEngine(
                new TextNormalizer(),
                new DefaultLineClassifier(),
                new DocumentSectionSplitter(),
                new HierarchyBuilder(),
                new MetadataExtractor(SubjectVocabulary.loadDefault(), config.defaultSource()),
                new ArticleSegmenter(config.segmentationPolicy()),
                new ReferenceResolver(),
                new RelationshipTracker());
    }

    public ParsedDocument parse(DocumentInput input) {
        return parse(input, documentId -> false);
    }

    /**
     * Parses a document.
     *
     * @param knownDocuments tells whether a relationship target exists in the corpus
     */
    public ParsedDocument parse(DocumentInput input, Predicate<String> knownDocuments) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(knownDocuments, "knownDocuments");

        List<String> lines = normalizer.normalize(input.text());
        List<ClassifiedLine> classified = classifier.classifyAll(lines);
        DocumentSections sections = splitter.split(classified);

        HierarchyResult hierarchy = hierarchyBuilder.build(sections.body());
        List<StructuralNode> nodes = new ArrayList<>(hierarchy.roots().size());
        for (StructuralNode root : hierarchy.roots()) {
            nodes.add(enrich(root));
        }

        DocumentMetadata metadata = metadataExtractor.extract(sections.preamble(), input.declaredNormType(),
                input.source());
        Set<String> canonicalIds = canonicalIds(input.documentId(), sections, metadata);
        RelationshipReport relationships = relationshipTracker.track(input.documentId(), canonicalIds,
                sections.preamble(), sections.closing(), knownDocuments);

        List<Diagnostic> diagnostics = new ArrayList<>(hierarchy.diagnostics());
        if (!sections.hasBody()) {
            diagnostics.add(Diagnostic.forDocument(Diagnostic.EMPTY_BODY, Severity.INFO,
                    "No division or article header found; the whole text is preamble"));
        }
        diagnostics.addAll(relationships.diagnostics());

        ParsedDocument document = new ParsedDocument(input.documentId(), canonicalIds, input.declaredNormType(),
                metadata, sections.preamble(), sections.closing(), sections.signatory(), nodes,
                relationships.edges(), relationships.vigencyUpdates(), diagnostics);
        DocumentStatistics statistics = document.statistics();
        LOGGER.info("Parsed {}: {} articles, {} divisions, {} edges, {} diagnostics",
                input.documentId(), statistics.articles(), statistics.divisions(), document.edges().size(),
                diagnostics.size());
        return document;
    }

    private StructuralNode enrich(StructuralNode node) {
        if (node.isArticle()) {
            Optional<ArticleEpigraph> epigraph = ArticleEpigraph.extract(node.rawLines());
            List<String> bodyLines = epigraph.map(ArticleEpigraph::bodyLines).orElse(node.rawLines());
            return node.withArticleContent(epigraph.map(ArticleEpigraph::text), segmenter.segment(bodyLines),
                    referenceResolver.resolve(String.join("\n", node.rawLines())));
        }
        if (node.children().isEmpty()) {
            return node;
        }
        List<StructuralNode> children = new ArrayList<>(node.children().size());
        for (StructuralNode child : node.children()) {
            children.add(enrich(child));
        }
        return node.withChildren(children);
    }

    private Set<String> canonicalIds(String documentId, DocumentSections sections, DocumentMetadata metadata) {
        Set<String> ids = new LinkedHashSet<>();
        ids.add(documentId);
        Optional<NormHeading> heading = metadataExtractor.findHeading(sections.preamble().header());
        if (heading.isEmpty()) {
            heading = metadataExtractor.findHeading(sections.preamble().resuelvo());
        }
        heading.ifPresent(found -> {
            NormType type = found.type();
            ids.add(type.documentId(found.number(), null));
            if (type != NormType.LEY) {
                metadata.dates().promulgation().ifPresent(date ->
                        ids.add(type.documentId(found.number(), String.valueOf(date.getYear()))));
            }
        });
        return ids;
    }
}
