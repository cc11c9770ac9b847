package ai.dadaist.collage.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.dadaist.collage.cli.CliArguments;
import ai.dadaist.collage.select.PlacementStrategy;
import ai.dadaist.collage.subdivide.SubdivisionScale;
import ai.dadaist.collage.work.WorkerPool;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--operation", "subdivide",
                "--project", "/data/projects/harbour",
                "--project-name", "Harbour",
                "--strategy", "multi-scale",
                "--runs", "4",
                "--grid-size", "12",
                "--scales", "5,15",
                "--allow-large-canvas",
                "--chunk-size", "256",
                "--workers", "3",
                "--log-format", "json");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.operation()).isEqualTo(Operation.SUBDIVIDE);
        assertThat(config.projectRoot()).isEqualTo(Path.of("/data/projects/harbour").toAbsolutePath());
        assertThat(config.projectName()).isEqualTo("Harbour");
        assertThat(config.strategy()).isEqualTo(PlacementStrategy.MULTI_SCALE);
        assertThat(config.runs()).isEqualTo(4);
        assertThat(config.gridSize()).isEqualTo(12);
        assertThat(config.scales()).containsExactly(new SubdivisionScale(5), new SubdivisionScale(15));
        assertThat(config.allowLargeCanvas()).isTrue();
        assertThat(config.chunkSize()).hasValue(256);
        assertThat(config.workerThreads()).isEqualTo(3);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_OPERATION, "slice");
        envValues.put(ConfigLoader.ENV_PROJECT_ROOT, "/srv/collage/coast");
        envValues.put(ConfigLoader.ENV_STRATEGY, "random");
        envValues.put(ConfigLoader.ENV_RUNS, "2");
        envValues.put(ConfigLoader.ENV_GRID_SIZE, "8");
        envValues.put(ConfigLoader.ENV_SUBDIVISION_SCALES, "10x10");
        envValues.put(ConfigLoader.ENV_MEMORY_CEILING_GB, "4.5");
        envValues.put(ConfigLoader.ENV_ALLOW_LARGE_CANVAS, "true");
        envValues.put(ConfigLoader.ENV_WORKER_THREADS, "6");
        envValues.put(ConfigLoader.ENV_RENDERED_TILE_SIZE, "600");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "text");

        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(envValues);
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.operation()).isEqualTo(Operation.SLICE);
        assertThat(config.projectName()).isEqualTo("coast");
        assertThat(config.strategy()).isEqualTo(PlacementStrategy.RANDOM);
        assertThat(config.runs()).isEqualTo(2);
        assertThat(config.gridSize()).isEqualTo(8);
        assertThat(config.scales()).containsExactly(new SubdivisionScale(10));
        assertThat(config.memoryCeilingGb()).isEqualTo(4.5);
        assertThat(config.allowLargeCanvas()).isTrue();
        assertThat(config.chunkSize()).isEmpty();
        assertThat(config.workerThreads()).isEqualTo(6);
        assertThat(config.renderedTileSize()).isEqualTo(600);
        assertThat(environmentReader.requestedKeys()).contains(ConfigLoader.ENV_CHUNK_SIZE);
    }

    @Test
    void appliesDefaults() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--project", "demo");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.operation()).isEqualTo(Operation.ASSEMBLE);
        assertThat(config.projectName()).isEqualTo("demo");
        assertThat(config.strategy()).isEqualTo(PlacementStrategy.EXACT);
        assertThat(config.runs()).isEqualTo(1);
        assertThat(config.gridSize()).isEqualTo(10);
        assertThat(config.scales()).containsExactly(new SubdivisionScale(5), new SubdivisionScale(10));
        assertThat(config.memoryCeilingGb()).isEqualTo(32.0);
        assertThat(config.allowLargeCanvas()).isFalse();
        assertThat(config.workerThreads()).isEqualTo(WorkerPool.defaultThreadCount());
        assertThat(config.renderedTileSize()).isZero();
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
    }

    @Test
    void missingProjectRootIsRejected() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_PROJECT_ROOT);
    }

    @Test
    void invalidValuesNameTheSetting() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_PROJECT_ROOT, "demo",
                ConfigLoader.ENV_RUNS, "many"));

        Throwable thrown = catchThrowable(() -> new ConfigLoader(environmentReader)
                .load(CommandLine.populateCommand(new CliArguments())));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_RUNS);
    }

    @Test
    void unsupportedScaleIsRejected() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--project", "demo", "--scales", "7");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported subdivision scale 7");
    }

    @Test
    void emptyScaleListIsRejected() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--project", "demo", "--scales", ",");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_SUBDIVISION_SCALES);
    }

    private static final class RecordingEnvironmentReader implements EnvironmentReader {

        private final Map<String, String> values;
        private final List<String> requestedKeys = new ArrayList<>();

        private RecordingEnvironmentReader(Map<String, String> values) {
            this.values = values;
        }

        @Override
        public Optional<String> get(String key) {
            requestedKeys.add(key);
            return Optional.ofNullable(values.get(key));
        }

        List<String> requestedKeys() {
            return requestedKeys;
        }
    }
}
