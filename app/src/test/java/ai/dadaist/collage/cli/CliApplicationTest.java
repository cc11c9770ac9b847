package ai.dadaist.collage.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.dadaist.collage.config.ConfigLoader;
import ai.dadaist.collage.project.ProjectLayout;
import ai.dadaist.collage.support.TestImages;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    @TempDir
    Path projectRoot;

    private final CliApplication application = new CliApplication(new ConfigLoader(key -> Optional.empty()));

    @Test
    void runsFullPipelineFromBaseImageToRestoredCanvas() throws Exception {
        ProjectLayout layout = new ProjectLayout(projectRoot);
        TestImages.write(TestImages.gradient(100, 100), layout.baseImageDir().resolve("still.png"));

        int sliced = application.run(new String[] {
                "--operation", "slice", "--project", projectRoot.toString(), "--grid-size", "4", "--workers", "1"});
        assertThat(sliced).isEqualTo(CliApplication.EXIT_OK);
        copyDirectory(layout.baseTilesDir(), layout.renderedVariationDir("v1"));

        int subdivided = application.run(new String[] {
                "--operation", "subdivide", "--project", projectRoot.toString(), "--scales", "5"});
        int assembled = application.run(new String[] {
                "--project", projectRoot.toString(), "--strategy", "multi-scale", "--scales", "5", "--runs", "2"});

        assertThat(subdivided).isEqualTo(CliApplication.EXIT_OK);
        assertThat(assembled).isEqualTo(CliApplication.EXIT_OK);
        try (Stream<Path> outputs = Files.list(layout.randomizedDir())) {
            assertThat(outputs.filter(path -> path.toString().endsWith(".json"))).hasSize(2);
        }
    }

    @Test
    void assemblyWithoutVariationsFails() {
        int exitCode = application.run(new String[] {"--project", projectRoot.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURE);
    }

    @Test
    void invalidArgumentsUsePicocliExitCode() {
        int unknownOption = application.run(new String[] {"--bogus"});
        int badStrategy = application.run(new String[] {"--project", projectRoot.toString(), "--strategy", "sideways"});
        int missingProject = application.run(new String[] {});

        assertThat(unknownOption).isEqualTo(2);
        assertThat(badStrategy).isEqualTo(2);
        assertThat(missingProject).isEqualTo(2);
    }

    @Test
    void helpExitsCleanly() {
        assertThat(application.run(new String[] {"--help"})).isZero();
    }

    private static void copyDirectory(Path source, Path target) throws Exception {
        Files.createDirectories(target);
        try (Stream<Path> files = Files.list(source)) {
            for (Path file : files.toList()) {
                Files.copy(file, target.resolve(file.getFileName()));
            }
        }
    }
}
