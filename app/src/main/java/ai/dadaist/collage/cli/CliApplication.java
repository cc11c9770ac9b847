package ai.dadaist.collage.cli;

import ai.dadaist.collage.assemble.Assembler;
import ai.dadaist.collage.assemble.AssemblyRequest;
import ai.dadaist.collage.assemble.AssemblyResult;
import ai.dadaist.collage.assemble.NoValidVariationsException;
import ai.dadaist.collage.assemble.OutputManager;
import ai.dadaist.collage.collaborator.PngPreprocessor;
import ai.dadaist.collage.collaborator.ResamplingUpscaler;
import ai.dadaist.collage.config.Config;
import ai.dadaist.collage.config.ConfigLoader;
import ai.dadaist.collage.config.SystemEnvironmentReader;
import ai.dadaist.collage.grid.CanvasBudget;
import ai.dadaist.collage.grid.GridManager;
import ai.dadaist.collage.grid.OverridePrompt;
import ai.dadaist.collage.logging.LoggingConfigurator;
import ai.dadaist.collage.select.PieceSelectorFactory;
import ai.dadaist.collage.slice.GridSlicer;
import ai.dadaist.collage.slice.LargeImageProcessor;
import ai.dadaist.collage.slice.MaskGenerator;
import ai.dadaist.collage.slice.SliceOutcome;
import ai.dadaist.collage.slice.SliceService;
import ai.dadaist.collage.subdivide.SubdivisionSummary;
import ai.dadaist.collage.subdivide.TileSubdivider;
import ai.dadaist.collage.work.CancellationToken;
import ai.dadaist.collage.work.WorkerPool;
import java.util.Map;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and the pipeline stages.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final ConfigLoader configLoader;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()));
    }

    CliApplication(ConfigLoader configLoader) {
        this.configLoader = configLoader;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Running {} on project {} at {}", config.operation(), config.projectName(), config.projectRoot());

        return switch (config.operation()) {
            case SLICE -> slice(config);
            case SUBDIVIDE -> subdivide(config);
            case ASSEMBLE -> assemble(config);
        };
    }

    private int slice(Config config) {
        SliceService service = new SliceService(
                new PngPreprocessor(),
                new GridSlicer(new ResamplingUpscaler(), config.renderedTileSize()),
                new LargeImageProcessor(),
                new MaskGenerator(),
                new WorkerPool(config.workerThreads()),
                SliceService.DEFAULT_LARGE_IMAGE_THRESHOLD_BYTES,
                config.chunkSize());
        SliceOutcome outcome = service.sliceProject(config.layout(), config.gridSize());
        if (outcome.hasFailures()) {
            LOGGER.warn("Slicing failed for images: {}", String.join(", ", outcome.failedImages()));
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }

    private int subdivide(Config config) {
        TileSubdivider subdivider = new TileSubdivider(new WorkerPool(config.workerThreads()));
        Map<String, SubdivisionSummary> summaries =
                subdivider.subdivideProject(config.layout(), config.scales(), CancellationToken.none());
        boolean failed = summaries.values().stream().anyMatch(SubdivisionSummary::hasFailures);
        return failed ? EXIT_FAILURE : EXIT_OK;
    }

    private int assemble(Config config) {
        OverridePrompt prompt = config.allowLargeCanvas() ? OverridePrompt.ALLOW : OverridePrompt.DENY;
        Assembler assembler = new Assembler(
                new GridManager(),
                PieceSelectorFactory.create(new Random(), config.scales()),
                new OutputManager(),
                CanvasBudget.ofGigabytes(config.memoryCeilingGb(), prompt));
        AssemblyRequest request = AssemblyRequest.forProject(config.projectName(), config.layout(), config.strategy(), config.runs());
        try {
            AssemblyResult result = assembler.assemble(request);
            if (result.hasFailures()) {
                LOGGER.warn("Assembly failed for variations {} and runs {}", result.failedVariations(), result.failedRuns());
                return EXIT_FAILURE;
            }
            return result.outputs().isEmpty() ? EXIT_FAILURE : EXIT_OK;
        } catch (NoValidVariationsException ex) {
            LOGGER.error(ex.getMessage());
            return EXIT_FAILURE;
        }
    }
}
