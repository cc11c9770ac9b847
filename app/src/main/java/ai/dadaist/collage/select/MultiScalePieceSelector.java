package ai.dadaist.collage.select;

import ai.dadaist.collage.naming.TileCoordinate;
import ai.dadaist.collage.naming.TileNaming;
import ai.dadaist.collage.project.ProjectLayout;
import ai.dadaist.collage.subdivide.SubdivisionScale;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks one subdivision scale per parent tile, then sources each sub-cell independently
 * from any variation that has that scale. Falls back to a random whole tile when no
 * variation has the scale on disk.
 *
 * <p>A scale qualifies for a variation as soon as its {@code NxN} directory exists; individual
 * sub-tile files are checked only when the sub-cell is chosen.
 */
public class MultiScalePieceSelector implements PieceSelector {

    private static final Logger LOGGER = LoggerFactory.getLogger(MultiScalePieceSelector.class);

    private final Random random;
    private final List<SubdivisionScale> scales;
    private final RandomPieceSelector fallback;

    public MultiScalePieceSelector(Random random, List<SubdivisionScale> scales) {
        this.random = Objects.requireNonNull(random, "random");
        Objects.requireNonNull(scales, "scales");
        if (scales.isEmpty()) {
            throw new IllegalArgumentException("at least one subdivision scale must be enabled");
        }
        this.scales = List.copyOf(scales);
        this.fallback = new RandomPieceSelector(random);
    }

    public List<SubdivisionScale> scales() {
        return scales;
    }

    @Override
    public PlacementRecord select(String pieceName, Path currentVariationPath, List<String> allVariationNames, Path projectRoot) {
        TileCoordinate coordinate = TileNaming.parseParent(pieceName);
        SubdivisionScale scale = scales.get(random.nextInt(scales.size()));
        ProjectLayout layout = new ProjectLayout(projectRoot);

        List<QualifyingSource> qualifying = findQualifyingSources(layout, allVariationNames, scale);
        if (qualifying.isEmpty()) {
            LOGGER.info("No {} subdivisions found for {}; using whole tile", scale, pieceName);
            return fallback.select(pieceName, currentVariationPath, allVariationNames, projectRoot);
        }
        LOGGER.debug("Using {} for parent tile {} from {} variation(s)", scale, pieceName, qualifying.size());

        List<SubcellSource> subcells = new ArrayList<>(scale.size() * scale.size());
        for (int childRow = 0; childRow < scale.size(); childRow++) {
            for (int childCol = 0; childCol < scale.size(); childCol++) {
                QualifyingSource source = qualifying.get(random.nextInt(qualifying.size()));
                String subTileName = TileNaming.encodeChild(coordinate.parentRow(), coordinate.parentCol(), childRow, childCol);
                Path subTilePath = source.scaleDirectory().resolve(subTileName);
                if (!Files.isRegularFile(subTilePath)) {
                    LOGGER.warn("Subtile not found: {}", subTilePath);
                    continue;
                }
                subcells.add(new SubcellSource(childRow, childCol, source.variation(), subTilePath));
            }
        }
        return new SubdividedPlacement(scale, subcells);
    }

    private List<QualifyingSource> findQualifyingSources(ProjectLayout layout, List<String> variations, SubdivisionScale scale) {
        List<QualifyingSource> available = new ArrayList<>();
        for (String variation : variations) {
            Path scaleDirectory = layout.subdivisionScaleDir(variation, scale.size());
            if (Files.isDirectory(scaleDirectory)) {
                available.add(new QualifyingSource(variation, scaleDirectory));
            }
        }
        return available;
    }

    private record QualifyingSource(String variation, Path scaleDirectory) {
    }
}
