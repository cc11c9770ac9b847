package ai.dadaist.collage.cli;

import ai.dadaist.collage.config.LogFormat;
import ai.dadaist.collage.config.Operation;
import ai.dadaist.collage.select.PlacementStrategy;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "dadaist-collage", mixinStandardHelpOptions = true,
        description = "Slice images into tile grids, subdivide tiles and reassemble them into collages")
public class CliArguments {

    @CommandLine.Option(names = "--operation", converter = OperationConverter.class,
            description = "Operation to run: slice, subdivide or assemble", paramLabel = "OPERATION")
    private Operation operation;

    @CommandLine.Option(names = "--project", description = "Project root directory", paramLabel = "DIR")
    private Path projectRoot;

    @CommandLine.Option(names = "--project-name", description = "Project name recorded in manifests", paramLabel = "NAME")
    private String projectName;

    @CommandLine.Option(names = "--strategy", converter = PlacementStrategyConverter.class,
            description = "Assembly strategy: exact, random or multi-scale", paramLabel = "STRATEGY")
    private PlacementStrategy strategy;

    @CommandLine.Option(names = "--runs", description = "Number of remixed canvases to produce", paramLabel = "COUNT")
    private Integer runs;

    @CommandLine.Option(names = "--grid-size", description = "Rows and columns used when slicing", paramLabel = "N")
    private Integer gridSize;

    @CommandLine.Option(names = "--scales", description = "Comma separated subdivision scales, e.g. 5,10", paramLabel = "SCALES")
    private String scales;

    @CommandLine.Option(names = "--allow-large-canvas", description = "Allocate canvases above the memory ceiling")
    private boolean allowLargeCanvas;

    @CommandLine.Option(names = "--chunk-size", description = "Rows decoded per band for large images", paramLabel = "ROWS")
    private Integer chunkSize;

    @CommandLine.Option(names = "--workers", description = "Worker threads for slicing and subdivision", paramLabel = "COUNT")
    private Integer workerThreads;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Operation operation() {
        return operation;
    }

    public Path projectRoot() {
        return projectRoot;
    }

    public String projectName() {
        return projectName;
    }

    public PlacementStrategy strategy() {
        return strategy;
    }

    public Integer runs() {
        return runs;
    }

    public Integer gridSize() {
        return gridSize;
    }

    public String scales() {
        return scales;
    }

    public boolean allowLargeCanvas() {
        return allowLargeCanvas;
    }

    public Integer chunkSize() {
        return chunkSize;
    }

    public Integer workerThreads() {
        return workerThreads;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
