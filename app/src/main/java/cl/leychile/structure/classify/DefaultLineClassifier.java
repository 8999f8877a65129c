package cl.leychile.structure.classify;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Rule-table classifier: blank check, then the first matching {@link LineRule}, otherwise content.
 */
public class DefaultLineClassifier implements LineClassifier {

    private final List<LineRule> rules;

    public DefaultLineClassifier() {
        this(LineRules.defaultRules());
    }

    public DefaultLineClassifier(List<LineRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    @Override
    public ClassifiedLine classify(int lineNumber, String line) {
        String text = line == null ? "" : line;
        if (text.isBlank()) {
            return ClassifiedLine.blank(lineNumber, text);
        }
        for (LineRule rule : rules) {
            Optional<RuleMatch> match = rule.apply(text);
            if (match.isPresent()) {
                return new ClassifiedLine(lineNumber, text, rule.type(), rule.name(), rule.kind(),
                        Optional.of(match.get().number()), match.get().remainder());
            }
        }
        return ClassifiedLine.content(lineNumber, text);
    }
}
