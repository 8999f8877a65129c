package cl.leychile.structure.metadata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SubjectVocabularyTest {

    @Test
    void loadsDefaultVocabulary() {
        SubjectVocabulary vocabulary = SubjectVocabulary.loadDefault();

        assertThat(vocabulary.size()).isGreaterThan(10);
        assertThat(vocabulary.match(List.of("PROCEDIMIENTO DE LIQUIDACION"))).containsExactly("Liquidación concursal");
    }

    @Test
    void matchesWholeWordsIgnoringCaseAndAccents() {
        SubjectVocabulary vocabulary = new SubjectVocabulary(Map.of(
                "trabajo", "Derecho laboral",
                "seguridad social", "Seguridad social"));

        assertThat(vocabulary.match(List.of("Normas de SEGURIDAD SOCIAL", "CÓDIGO DEL TRABAJO")))
                .containsExactly("Seguridad social", "Derecho laboral");
        assertThat(vocabulary.match(List.of("trabajo y seguridad social", "trabajo")))
                .containsExactly("Derecho laboral", "Seguridad social");
        assertThat(vocabulary.match(List.of("trabajos temporales"))).isEmpty();
    }

    @Test
    void missingResourceFailsWithUncheckedIoException() {
        Throwable thrown = catchThrowable(() -> SubjectVocabulary.load("vocabulary/missing.properties"));

        assertThat(thrown).isInstanceOf(UncheckedIOException.class).hasMessageContaining("missing.properties");
    }
}
