package cl.leychile.structure.cli;

import static org.assertj.core.api.Assertions.assertThat;

import cl.leychile.structure.config.ConfigLoader;
import cl.leychile.structure.relation.InMemoryRelationshipStore;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    void printsSummaryForEachDocument() throws IOException {
        Path instructivo = write("instructivo-3.txt", String.join("\n",
                "INSTRUCTIVO SUPERIR N° 3",
                "Santiago, 15 de marzo de 2018",
                "",
                "TÍTULO I",
                "Artículo 1.- Texto.",
                "Artículo 2.- Texto."));
        Path resolucion = write("resex-6597.md", String.join("\n",
                "RESOLUCIÓN EXENTA N° 6597",
                "CONSIDERANDO:",
                "Derógase el Instructivo N° 3 de 2018 y la Circular N° 7 de 2015.",
                "Artículo 1.- Texto."));

        int exitCode = application().run(new String[] {"--threads", "2", instructivo.toString(), resolucion.toString()});

        assertThat(exitCode).isZero();
        String summary = out.toString();
        assertThat(summary).contains("instructivo-3: type=Instructivo number=3 articles=2 books=0 titles=1"
                + " chapters=0 paragraphs=0 sections=0 vigency=DEROGADO");
        assertThat(summary).contains("resex-6597: type=Resolución Exenta number=6597 articles=1");
        assertThat(summary).contains("  deroga Instructivo-3-2018" + System.lineSeparator());
        assertThat(summary).contains("  deroga Circular-7-2015 (unresolved)");
        assertThat(summary).contains("INFO UNRESOLVED_TARGET: deroga Circular-7-2015");
        assertThat(summary).doesNotContain("UNRESOLVED_TARGET: deroga Instructivo-3-2018");
    }

    @Test
    void missingInputFileFailsRun() {
        int exitCode = application().run(new String[] {tempDir.resolve("no-existe.txt").toString()});

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void missingArgumentsPrintUsage() {
        int exitCode = application().run(new String[0]);

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Usage: norm-structure");
    }

    @Test
    void invalidConfigurationIsReported() throws IOException {
        Path file = write("ley.txt", "Artículo 1.- Texto.");

        int exitCode = application().run(new String[] {"--threads", "0", file.toString()});

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Invalid configuration: --threads must be at least 1");
    }

    @Test
    void derivesDocumentIdFromFileName() {
        assertThat(CliApplication.documentIdOf(Path.of("corpus", "ley-20720.txt"))).isEqualTo("ley-20720");
        assertThat(CliApplication.documentIdOf(Path.of("README"))).isEqualTo("README");
    }

    private CliApplication application() {
        return new CliApplication(new ConfigLoader(key -> Optional.empty()), InMemoryRelationshipStore::new,
                new PrintWriter(out, true), new PrintWriter(err, true));
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content, StandardCharsets.UTF_8);
    }
}
