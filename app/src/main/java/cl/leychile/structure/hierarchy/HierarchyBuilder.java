package cl.leychile.structure.hierarchy;

import cl.leychile.structure.classify.ClassifiedLine;
import cl.leychile.structure.classify.LineType;
import cl.leychile.structure.model.Diagnostic;
import cl.leychile.structure.model.NodeKind;
import cl.leychile.structure.model.Severity;
import cl.leychile.structure.model.StructuralNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stack machine that turns the classified body lines into a tree of divisions and articles.
 *
 * <p>A division header closes every open division of the same or a lower precedence and opens
 * itself under whatever remains on the stack. An article header closes the pending article and
 * buffers the lines that follow it. Node ids are assigned in document order.
 */
public class HierarchyBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(HierarchyBuilder.class);

    public HierarchyResult build(List<ClassifiedLine> body) {
        if (body == null || body.isEmpty()) {
            return HierarchyResult.empty();
        }
        Run run = new Run();
        for (ClassifiedLine line : body) {
            switch (line.type()) {
                case DIVISION_HEADER -> run.openDivision(line);
                case ARTICLE_HEADER -> run.openArticle(line);
                default -> run.accept(line);
            }
        }
        List<StructuralNode> roots = new ArrayList<>(run.roots.size());
        for (Draft root : run.roots) {
            roots.add(root.freeze());
        }
        LOGGER.debug("Built {} root nodes from {} body lines ({} nodes, {} diagnostics)",
                roots.size(), body.size(), run.nextId - 1, run.diagnostics.size());
        return new HierarchyResult(roots, run.diagnostics);
    }

    private static final class Run {

        private final List<Draft> roots = new ArrayList<>();
        private final Deque<Draft> stack = new ArrayDeque<>();
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private final Set<String> articleKeys = new HashSet<>();
        private Draft article;
        private int nextId = 1;

        void openDivision(ClassifiedLine line) {
            NodeKind kind = line.kind().orElseThrow();
            article = null;
            while (!stack.isEmpty() && stack.peek().kind.level() <= kind.level()) {
                stack.pop();
            }
            Draft division = new Draft(String.valueOf(nextId++), kind, line.text(),
                    line.number().orElse(null), contextPath());
            division.awaitingName = line.remainder().isBlank();
            List<Draft> siblings = stack.isEmpty() ? roots : stack.peek().children;
            checkInversion(division, siblings);
            siblings.add(division);
            stack.push(division);
        }

        void openArticle(ClassifiedLine line) {
            String number = line.number().orElseThrow();
            List<String> context = contextPath();
            Draft draft = new Draft(String.valueOf(nextId++), NodeKind.ARTICLE, line.text(), number, context);
            if (!line.remainder().isBlank()) {
                draft.rawLines.add(line.remainder());
            }
            if (!articleKeys.add(String.join("\u0000", context) + "\u0000" + number)) {
                diagnostics.add(Diagnostic.forNode(draft.id, Diagnostic.DUPLICATE_ARTICLE_NUMBER, Severity.WARNING,
                        "Article " + number + " appears more than once under the same context"));
                LOGGER.warn("Duplicate article number {} (node {})", number, draft.id);
            }
            if (!stack.isEmpty()) {
                stack.peek().awaitingName = false;
                stack.peek().children.add(draft);
            } else {
                roots.add(draft);
            }
            article = draft;
        }

        void accept(ClassifiedLine line) {
            if (article != null) {
                article.rawLines.add(line.type() == LineType.BLANK ? "" : line.text());
                return;
            }
            if (stack.isEmpty() || line.type() == LineType.BLANK) {
                return;
            }
            Draft division = stack.peek();
            if (division.awaitingName) {
                division.label = division.label + " " + line.text();
                division.awaitingName = false;
            } else {
                division.description.add(line.text());
            }
        }

        private void checkInversion(Draft division, List<Draft> siblings) {
            for (int i = siblings.size() - 1; i >= 0; i--) {
                Draft previous = siblings.get(i);
                if (previous.kind.isDivision()) {
                    if (previous.kind.level() < division.kind.level()) {
                        diagnostics.add(Diagnostic.forNode(division.id, Diagnostic.STRUCTURE_INVERSION,
                                Severity.WARNING, division.kind.displayName() + " '" + division.label
                                        + "' follows lower-level " + previous.kind.displayName() + " '"
                                        + previous.label + "'"));
                        LOGGER.warn("Structure inversion at node {}: {} after {}",
                                division.id, division.kind, previous.kind);
                    }
                    return;
                }
            }
        }

        private List<String> contextPath() {
            List<String> labels = new ArrayList<>(stack.size());
            Iterator<Draft> fromBottom = stack.descendingIterator();
            while (fromBottom.hasNext()) {
                labels.add(fromBottom.next().label);
            }
            return labels;
        }
    }

    private static final class Draft {

        private final String id;
        private final NodeKind kind;
        private final String number;
        private final List<String> contextPath;
        private final List<Draft> children = new ArrayList<>();
        private final List<String> description = new ArrayList<>();
        private final List<String> rawLines = new ArrayList<>();
        private String label;
        private boolean awaitingName;

        Draft(String id, NodeKind kind, String label, String number, List<String> contextPath) {
            this.id = id;
            this.kind = kind;
            this.label = label;
            this.number = number;
            this.contextPath = contextPath;
        }

        StructuralNode freeze() {
            if (kind == NodeKind.ARTICLE) {
                return StructuralNode.article(id, label, number, contextPath, trimTrailingBlanks(rawLines));
            }
            List<StructuralNode> frozen = new ArrayList<>(children.size());
            for (Draft child : children) {
                frozen.add(child.freeze());
            }
            return StructuralNode.division(id, kind, label, number, contextPath, frozen, description);
        }

        private static List<String> trimTrailingBlanks(List<String> lines) {
            int end = lines.size();
            while (end > 0 && lines.get(end - 1).isBlank()) {
                end--;
            }
            int start = 0;
            while (start < end && lines.get(start).isBlank()) {
                start++;
            }
            return lines.subList(start, end);
        }
    }
}
