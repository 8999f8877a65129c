package cl.leychile.structure.relation;

import cl.leychile.structure.model.Diagnostic;
import cl.leychile.structure.model.RelationKind;
import cl.leychile.structure.model.RelationshipEdge;
import cl.leychile.structure.model.VigencyState;
import cl.leychile.structure.model.VigencyUpdate;
import cl.leychile.structure.reference.NormCitations;
import cl.leychile.structure.reference.NormMention;
import cl.leychile.structure.sections.PreambleSection;
import cl.leychile.structure.sections.PreambleSections;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the relationships a document declares towards other norms from its preamble and closing.
 *
 * <p>Each sentence is matched against the {@link ResolutiveVerb} table. Derogations produce a
 * {@link RelationKind#DEROGATES} edge and a vigency update for every norm the sentence names;
 * modifying verbs produce {@link RelationKind#MODIFIES} edges; sentences of VISTOS and CONSIDERANDO
 * without a resolutive verb cite the norms they name. Nothing is written anywhere: callers apply
 * the returned report to a {@link RelationshipStore}.
 */
public class RelationshipTracker {

    private static final Logger LOGGER = LoggerFactory.getLogger(RelationshipTracker.class);

    private static final Pattern ARTICLE_SCOPE = Pattern.compile(
            "(?<!\\p{L})(?:art[íi]culos?|arts?\\.|numerales?|incisos?)\\s*\\d",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern RESIDUAL_VIGENCY = Pattern.compile(
            "continuar[áa]n?\\s+(?:vigentes?|rigiendo|aplic[áa]ndose)|seguir[áa]n?\\s+(?:vigentes?|rigiendo)"
                    + "|mantendr[áa]n?\\s+su\\s+vigencia|subsistir[áa]n?",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    /**
     * Builds the report of {@code documentId}.
     *
     * @param documentId id of the document being ingested
     * @param ownIds additional ids that designate the same document (its canonical norm id)
     * @param preamble preamble sections of the document
     * @param closing closing lines of the document
     * @param knownDocuments tells whether a target id exists in the corpus
     */
    public RelationshipReport track(String documentId,
                                    Set<String> ownIds,
                                    PreambleSections preamble,
                                    List<String> closing,
                                    Predicate<String> knownDocuments) {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(preamble, "preamble");
        Objects.requireNonNull(knownDocuments, "knownDocuments");
        Set<String> self = new LinkedHashSet<>(ownIds == null ? Set.of() : ownIds);
        self.add(documentId);

        Collector collector = new Collector(documentId, self);
        collector.scan(PreambleSection.VISTOS, preamble.vistos());
        collector.scan(PreambleSection.CONSIDERANDO, preamble.considerando());
        collector.scan(PreambleSection.RESUELVO, preamble.resuelvo());
        collector.scan(null, closing == null ? List.of() : closing);

        List<RelationshipEdge> edges = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (RelationshipEdge edge : collector.edges) {
            boolean resolved = knownDocuments.test(edge.targetDocumentId());
            edges.add(edge.resolved(resolved));
            if (!resolved) {
                diagnostics.add(Diagnostic.unresolvedTarget(edge));
            }
        }
        List<VigencyUpdate> updates = new ArrayList<>(collector.updates.values());
        LOGGER.debug("Document {} declares {} edges and {} vigency updates", documentId, edges.size(), updates.size());
        return new RelationshipReport(edges, updates, diagnostics);
    }

    private static final class Collector {

        private final String documentId;
        private final Set<String> self;
        private final Set<RelationshipEdge> edges = new LinkedHashSet<>();
        private final Map<String, VigencyUpdate> updates = new LinkedHashMap<>();

        Collector(String documentId, Set<String> self) {
            this.documentId = documentId;
            this.self = self;
        }

        void scan(PreambleSection section, List<String> lines) {
            List<String> sentences = Sentences.split(lines);
            for (int i = 0; i < sentences.size(); i++) {
                String sentence = sentences.get(i);
                List<NormMention> mentions = NormCitations.findAll(sentence);
                if (mentions.isEmpty()) {
                    continue;
                }
                Optional<ResolutiveVerb> verb = ResolutiveVerb.find(sentence);
                if (verb.isPresent()) {
                    Optional<RelationKind> relation = verb.get().relation();
                    if (relation.isPresent()) {
                        String next = i + 1 < sentences.size() ? sentences.get(i + 1) : "";
                        record(relation.get(), sentence, next, mentions);
                    }
                } else if (section != null && section.citesByDefault()) {
                    for (NormMention mention : mentions) {
                        addEdge(mention.documentId(), RelationKind.CITES);
                    }
                }
            }
        }

        private void record(RelationKind relation, String sentence, String next, List<NormMention> mentions) {
            int scopeStart = 0;
            for (NormMention mention : mentions) {
                String target = mention.documentId();
                boolean added = addEdge(target, relation);
                if (added && relation == RelationKind.DEROGATES) {
                    boolean partial = ARTICLE_SCOPE.matcher(sentence.substring(scopeStart, mention.start())).find();
                    Optional<String> note = residualNote(sentence, next);
                    VigencyUpdate update = new VigencyUpdate(target,
                            partial ? VigencyState.PARCIAL : VigencyState.DEROGADO, documentId, note);
                    updates.merge(target, update, Collector::mergeUpdates);
                }
                scopeStart = mention.end();
            }
        }

        private boolean addEdge(String target, RelationKind kind) {
            if (self.contains(target)) {
                return false;
            }
            edges.add(new RelationshipEdge(documentId, target, kind, false));
            return true;
        }

        private static Optional<String> residualNote(String sentence, String next) {
            if (RESIDUAL_VIGENCY.matcher(sentence).find()) {
                return Optional.of(sentence);
            }
            if (!next.isEmpty() && RESIDUAL_VIGENCY.matcher(next).find()) {
                return Optional.of(next);
            }
            return Optional.empty();
        }

        private static VigencyUpdate mergeUpdates(VigencyUpdate first, VigencyUpdate second) {
            return new VigencyUpdate(first.targetDocumentId(), first.newState().merge(second.newState()),
                    first.sourceDocumentId(), first.note().or(second::note));
        }
    }
}
