package ai.dadaist.collage.assemble;

import static org.assertj.core.api.Assertions.assertThat;

import ai.dadaist.collage.grid.GridSpec;
import ai.dadaist.collage.project.ProjectLayout;
import ai.dadaist.collage.select.OriginalPlacement;
import ai.dadaist.collage.select.PlacementRecord;
import ai.dadaist.collage.select.SubcellSource;
import ai.dadaist.collage.select.SubdividedPlacement;
import ai.dadaist.collage.subdivide.SubdivisionScale;
import com.google.gson.JsonObject;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ManifestWriterTest {

    private final ProjectLayout layout = new ProjectLayout(Path.of("work", "project"));

    @Test
    void writesSubdividedPlacementsAsPerSubcellVariations() {
        Path scaleDir = layout.subdivisionScaleDir("v2", 5);
        SubdividedPlacement subdivided = new SubdividedPlacement(new SubdivisionScale(5), List.of(
                new SubcellSource(0, 0, "v2", scaleDir.resolve("1-0_0-0.png")),
                new SubcellSource(4, 3, "v2", scaleDir.resolve("1-0_4-3.png"))));
        Map<String, PlacementRecord> positions = new LinkedHashMap<>();
        positions.put("0_0", new OriginalPlacement("v1", "tile-0_0.png", layout.renderedVariationDir("v1").resolve("tile-0_0.png")));
        positions.put("1_0", subdivided);
        AssemblyManifest manifest = new AssemblyManifest(
                new AssemblyManifest.Metadata("demo", "multi-scale", Optional.of(2), "rendered_tiles/v1"),
                new GridSpec(2, 1, 50, 60),
                positions);

        JsonObject json = new ManifestWriter().toJsonTree(manifest, layout);

        assertThat(json.getAsJsonObject("metadata").get("run_number").getAsInt()).isEqualTo(2);
        JsonObject grid = json.getAsJsonObject("grid_specs");
        assertThat(grid.get("piece_height").getAsInt()).isEqualTo(50);
        assertThat(grid.get("piece_width").getAsInt()).isEqualTo(60);
        JsonObject first = json.getAsJsonObject("positions").getAsJsonObject("0_0");
        assertThat(first.get("source_path").getAsString()).isEqualTo("rendered_tiles/v1/tile-0_0.png");
        JsonObject second = json.getAsJsonObject("positions").getAsJsonObject("1_0");
        assertThat(second.get("scheme").getAsString()).isEqualTo("5x5");
        assertThat(second.getAsJsonObject("per_subcell").keySet()).containsExactly("0_0", "4_3");
        assertThat(second.getAsJsonObject("per_subcell").get("4_3").getAsString()).isEqualTo("v2");
    }

    @Test
    void keepsPositionOrder() {
        Map<String, PlacementRecord> positions = new LinkedHashMap<>();
        for (String key : List.of("0_0", "0_1", "1_0", "1_1")) {
            positions.put(key, new OriginalPlacement("v1", "tile-" + key + ".png", Path.of("x.png")));
        }
        AssemblyManifest manifest = new AssemblyManifest(
                new AssemblyManifest.Metadata("demo", "exact", Optional.empty(), "rendered_tiles/v1"),
                new GridSpec(2, 2, 10, 10),
                positions);

        String json = new ManifestWriter().toJson(manifest, layout);

        assertThat(json.indexOf("\"0_1\"")).isLessThan(json.indexOf("\"1_0\""));
        assertThat(json).doesNotContain("run_number");
    }
}
