package cl.leychile.structure.reference;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class NormCitationsTest {

    @Test
    void buildsCanonicalIds() {
        List<NormMention> mentions = NormCitations.findAll(
                "Derógase el Instructivo N° 3 de 2018 y la Ley N° 20.720 de 2014, así como el D.F.L. N° 1 de 2005.");

        assertThat(mentions).extracting(NormMention::documentId)
                .containsExactly("Instructivo-3-2018", "Ley-20720", "DFL-1-2005");
    }

    @Test
    void longestMentionWinsAtSamePosition() {
        List<NormMention> mentions = NormCitations.findAll("el Decreto Supremo N° 50 y el Decreto Ley 3.500");

        assertThat(mentions).extracting(NormMention::documentId).containsExactly("DS-50", "DL-3500");
    }

    @Test
    void readsFullDateAndSlashYear() {
        assertThat(NormCitations.findAll("la NCG N° 14, de 3 de marzo de 2019"))
                .extracting(NormMention::documentId).containsExactly("NCG-14-2019");
        assertThat(NormCitations.findAll("Circular N° 7/2021"))
                .extracting(NormMention::documentId).containsExactly("Circular-7-2021");
    }

    @Test
    void instructivoSuperirAndResolucionExenta() {
        assertThat(NormCitations.findAll("Instructivo SUPERIR N° 2, de 2019 y la Resolución Exenta N° 6597"))
                .extracting(NormMention::documentId).containsExactly("Instructivo-2-2019", "ResEx-6597");
    }

    @Test
    void ignoresUnnumberedNames() {
        assertThat(NormCitations.findAll("la ley de quiebras y el decreto respectivo")).isEmpty();
    }

    @Test
    void findsMentionAtOffset() {
        String text = "según la Ley N° 18.046";

        assertThat(NormCitations.at(text, text.indexOf("Ley"))).map(NormMention::label).contains("Ley 18046");
        assertThat(NormCitations.at(text, 0)).isEmpty();
    }
}
