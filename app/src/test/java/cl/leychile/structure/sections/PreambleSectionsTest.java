package cl.leychile.structure.sections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import java.util.List;
import org.junit.jupiter.api.Test;

class PreambleSectionsTest {

    @Test
    void numberedConsiderandosBecomeItems() {
        PreambleSections preamble = considerando(
                "1° Que, el artículo 54 de la Ley N° 20.720 encomienda a esta Superintendencia",
                "dictar normas de carácter general.",
                "2. Que es necesario actualizar las instrucciones vigentes.",
                "3.° Asimismo, corresponde fijar un texto refundido.");

        assertThat(preamble.considerandoItems())
                .extracting(ConsiderandoItem::number, ConsiderandoItem::text)
                .containsExactly(
                        tuple(1, "Que, el artículo 54 de la Ley N° 20.720 encomienda a esta Superintendencia"
                                + " dictar normas de carácter general."),
                        tuple(2, "Que es necesario actualizar las instrucciones vigentes."),
                        tuple(3, "Asimismo, corresponde fijar un texto refundido."));
    }

    @Test
    void unnumberedConsiderandoIsSingleItem() {
        PreambleSections preamble = considerando("Que es necesario actualizar", "las instrucciones.");

        assertThat(preamble.considerandoItems())
                .containsExactly(new ConsiderandoItem(1, "Que es necesario actualizar las instrucciones."));
    }

    @Test
    void noConsiderandoGivesNoItems() {
        assertThat(PreambleSections.empty().considerandoItems()).isEmpty();
    }

    private static PreambleSections considerando(String... lines) {
        return new PreambleSections(List.of(), List.of(), List.of(lines), List.of());
    }
}
