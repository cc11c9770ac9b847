package ai.dadaist.collage.config;

import ai.dadaist.collage.cli.CliArguments;
import ai.dadaist.collage.select.PlacementStrategy;
import ai.dadaist.collage.subdivide.SubdivisionScale;
import ai.dadaist.collage.work.WorkerPool;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_OPERATION = "COLLAGE_OPERATION";
    static final String ENV_PROJECT_ROOT = "COLLAGE_PROJECT_ROOT";
    static final String ENV_PROJECT_NAME = "COLLAGE_PROJECT_NAME";
    static final String ENV_STRATEGY = "COLLAGE_STRATEGY";
    static final String ENV_RUNS = "COLLAGE_RUNS";
    static final String ENV_GRID_SIZE = "COLLAGE_GRID_SIZE";
    static final String ENV_SUBDIVISION_SCALES = "COLLAGE_SUBDIVISION_SCALES";
    static final String ENV_MEMORY_CEILING_GB = "COLLAGE_MEMORY_CEILING_GB";
    static final String ENV_ALLOW_LARGE_CANVAS = "COLLAGE_ALLOW_LARGE_CANVAS";
    static final String ENV_CHUNK_SIZE = "COLLAGE_CHUNK_SIZE";
    static final String ENV_WORKER_THREADS = "COLLAGE_WORKER_THREADS";
    static final String ENV_RENDERED_TILE_SIZE = "COLLAGE_RENDERED_TILE_SIZE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private static final int DEFAULT_RUNS = 1;
    private static final int DEFAULT_GRID_SIZE = 10;
    private static final String DEFAULT_SCALES = "5,10";
    private static final double DEFAULT_MEMORY_CEILING_GB = 32;
    private static final int DEFAULT_RENDERED_TILE_SIZE = 0;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Operation operation = Optional.ofNullable(arguments.operation())
                .orElseGet(() -> env(ENV_OPERATION).map(Operation::from).orElse(Operation.ASSEMBLE));

        Path projectRoot = Optional.ofNullable(arguments.projectRoot())
                .or(() -> env(ENV_PROJECT_ROOT).map(Path::of))
                .orElseThrow(() -> new IllegalArgumentException("project root must be provided via --project or " + ENV_PROJECT_ROOT));
        Path normalizedRoot = projectRoot.toAbsolutePath().normalize();
        String projectName = firstNonBlank(arguments.projectName(), ENV_PROJECT_NAME,
                normalizedRoot.getFileName() == null ? normalizedRoot.toString() : normalizedRoot.getFileName().toString());

        PlacementStrategy strategy = Optional.ofNullable(arguments.strategy())
                .orElseGet(() -> env(ENV_STRATEGY).map(PlacementStrategy::from).orElse(PlacementStrategy.EXACT));

        int runs = resolveInt(arguments.runs(), ENV_RUNS, "runs", 1).orElse(DEFAULT_RUNS);
        int gridSize = resolveInt(arguments.gridSize(), ENV_GRID_SIZE, "grid size", 1).orElse(DEFAULT_GRID_SIZE);

        List<SubdivisionScale> scales = SubdivisionScale.parseList(
                firstNonBlank(arguments.scales(), ENV_SUBDIVISION_SCALES, DEFAULT_SCALES));
        if (scales.isEmpty()) {
            throw new IllegalArgumentException(ENV_SUBDIVISION_SCALES + " must list at least one scale");
        }

        double memoryCeilingGb = env(ENV_MEMORY_CEILING_GB)
                .map(value -> parseDouble(value, ENV_MEMORY_CEILING_GB))
                .orElse(DEFAULT_MEMORY_CEILING_GB);

        boolean allowLargeCanvas = arguments.allowLargeCanvas()
                || env(ENV_ALLOW_LARGE_CANVAS).map(ConfigLoader::parseBoolean).orElse(false);

        OptionalInt chunkSize = resolveInt(arguments.chunkSize(), ENV_CHUNK_SIZE, "chunk size", 1);
        int workerThreads = resolveInt(arguments.workerThreads(), ENV_WORKER_THREADS, "worker threads", 1)
                .orElse(WorkerPool.defaultThreadCount());
        int renderedTileSize = resolveInt(null, ENV_RENDERED_TILE_SIZE, "rendered tile size", 0)
                .orElse(DEFAULT_RENDERED_TILE_SIZE);

        LogFormat logFormat = Optional.ofNullable(arguments.logFormat())
                .orElseGet(() -> env(ENV_LOG_FORMAT).map(LogFormat::from).orElse(LogFormat.TEXT));

        return new Config(operation, normalizedRoot, projectName, strategy, runs, gridSize, scales,
                memoryCeilingGb, allowLargeCanvas, chunkSize, workerThreads, renderedTileSize, logFormat);
    }

    private Optional<String> env(String key) {
        return environmentReader.get(key)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim);
    }

    private OptionalInt resolveInt(Integer cliValue, String envKey, String setting, int minimum) {
        Integer value = cliValue;
        if (value == null) {
            value = env(envKey).map(raw -> parseInteger(raw, envKey)).orElse(null);
        }
        if (value == null) {
            return OptionalInt.empty();
        }
        if (value < minimum) {
            throw new IllegalArgumentException(setting + " must be at least " + minimum + " but was " + value);
        }
        return OptionalInt.of(value);
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return env(envKey).orElse(defaultValue);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static int parseInteger(String raw, String setting) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(setting + " must be an integer", ex);
        }
    }

    private static double parseDouble(String raw, String setting) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(setting + " must be a number: " + raw, ex);
        }
    }

    private static boolean parseBoolean(String raw) {
        String normalized = raw.toLowerCase(Locale.ROOT);
        return normalized.equals("true") || normalized.equals("1") || normalized.equals("yes");
    }
}
