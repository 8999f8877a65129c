package cl.leychile.structure.relation;

import cl.leychile.structure.classify.ArticleNumbers;
import cl.leychile.structure.model.RelationKind;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Ordered table of resolutive verb forms. The first verb found in a sentence decides its effect.
 */
public enum ResolutiveVerb {
    APPROVES(null, "\\bAPRUEB(?:ASE|ESE|ANSE|ENSE)\\b"),
    DEROGATES(RelationKind.DEROGATES,
            "\\bDEROG(?:ASE|UESE|ANSE|UENSE)\\b|\\bDEJ(?:ASE|ESE|ANSE|ENSE)\\s+SIN\\s+EFECTO\\b"),
    MODIFIES(RelationKind.MODIFIES,
            "\\b(?:SUSTITUY(?:ASE|ESE|ANSE|ENSE)|REEMPLAZ(?:ASE|ESE|ANSE|ENSE)|ELIMIN(?:ASE|ESE|ANSE|ENSE)"
                    + "|AGREG(?:ASE|UESE|ANSE|UENSE)|MODIFIC(?:ASE|ANSE)|MODIFIQU(?:ESE|ENSE)|INTERCAL(?:ASE|ESE))\\b");

    private final RelationKind relation;
    private final Pattern pattern;

    ResolutiveVerb(RelationKind relation, String regex) {
        this.relation = relation;
        this.pattern = Pattern.compile(regex);
    }

    /**
     * Relation declared towards the norms a sentence names; empty for approvals of the document's own content.
     */
    public Optional<RelationKind> relation() {
        return Optional.ofNullable(relation);
    }

    /**
     * First verb of the table that occurs in the sentence, ignoring case and accents.
     */
    public static Optional<ResolutiveVerb> find(String sentence) {
        String folded = ArticleNumbers.stripAccents(sentence).toUpperCase(Locale.ROOT);
        for (ResolutiveVerb verb : values()) {
            if (verb.pattern.matcher(folded).find()) {
                return Optional.of(verb);
            }
        }
        return Optional.empty();
    }
}
