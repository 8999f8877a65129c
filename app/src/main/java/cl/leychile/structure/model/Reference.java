package cl.leychile.structure.model;

import java.util.Objects;

/**
 * Explicit mention of an article, either of the same norm or of an external one.
 */
public record Reference(String targetArticle, String targetNorm) {

    public static final String SELF = "SELF";

    public Reference {
        Objects.requireNonNull(targetArticle, "targetArticle");
        Objects.requireNonNull(targetNorm, "targetNorm");
        if (targetArticle.isBlank()) {
            throw new IllegalArgumentException("targetArticle must not be blank");
        }
    }

    public static Reference toSelf(String article) {
        return new Reference(article, SELF);
    }

    public boolean isSelf() {
        return SELF.equals(targetNorm);
    }
}
