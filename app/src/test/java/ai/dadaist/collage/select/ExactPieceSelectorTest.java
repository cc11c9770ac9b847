package ai.dadaist.collage.select;

import static org.assertj.core.api.Assertions.assertThat;

import ai.dadaist.collage.subdivide.SubdivisionScale;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class ExactPieceSelectorTest {

    @Test
    void returnsSamePositionOfCurrentVariation() {
        Path project = Path.of("project");
        Path variation = project.resolve("rendered_tiles").resolve("v2");

        PlacementRecord record = new ExactPieceSelector()
                .select("tile-1_3.png", variation, List.of("v1", "v2", "v3"), project);

        assertThat(record.scheme()).isEqualTo(PlacementRecord.ORIGINAL_SCHEME);
        assertThat(record).isEqualTo(new OriginalPlacement("v2", "tile-1_3.png", variation.resolve("tile-1_3.png")));
    }

    @Test
    void factoryMapsEveryStrategy() {
        PieceSelectorFactory factory = PieceSelectorFactory.create(new Random(1), List.of(new SubdivisionScale(5)));

        assertThat(factory.select(PlacementStrategy.EXACT)).isInstanceOf(ExactPieceSelector.class);
        assertThat(factory.select(PlacementStrategy.RANDOM)).isInstanceOf(RandomPieceSelector.class);
        assertThat(factory.select(PlacementStrategy.MULTI_SCALE)).isInstanceOf(MultiScalePieceSelector.class);
        assertThat(PlacementStrategy.from("multi_scale")).isEqualTo(PlacementStrategy.MULTI_SCALE);
        assertThat(PlacementStrategy.from("restore")).isEqualTo(PlacementStrategy.EXACT);
    }
}
