package cl.leychile.structure.classify;

import java.util.ArrayList;
import java.util.List;

/**
 * Assigns a structural role to each normalized line of a legal text.
 */
public interface LineClassifier {

    ClassifiedLine classify(int lineNumber, String line);

    default List<ClassifiedLine> classifyAll(List<String> lines) {
        if (lines == null || lines.isEmpty()) {
            return List.of();
        }
        List<ClassifiedLine> classified = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            classified.add(classify(i, lines.get(i)));
        }
        return classified;
    }
}
