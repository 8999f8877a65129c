package cl.leychile.structure.hierarchy;

import cl.leychile.structure.model.Diagnostic;
import cl.leychile.structure.model.StructuralNode;
import java.util.List;

/**
 * Roots of a built tree plus the structural warnings raised while building it.
 */
public record HierarchyResult(List<StructuralNode> roots, List<Diagnostic> diagnostics) {

    public HierarchyResult {
        roots = roots == null ? List.of() : List.copyOf(roots);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public static HierarchyResult empty() {
        return new HierarchyResult(List.of(), List.of());
    }
}
