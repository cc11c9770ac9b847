package ai.dadaist.collage.assemble;

import ai.dadaist.collage.grid.GridSpec;
import ai.dadaist.collage.image.TileImages;
import ai.dadaist.collage.project.ProjectLayout;
import ai.dadaist.collage.select.OriginalPlacement;
import ai.dadaist.collage.select.PlacementRecord;
import ai.dadaist.collage.select.SubcellSource;
import ai.dadaist.collage.select.SubdividedPlacement;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Serialises {@link AssemblyManifest} to JSON. Every path is rewritten relative to the project
 * root so manifests stay valid when a project directory is moved.
 */
public class ManifestWriter {

    private final Gson gson;

    public ManifestWriter() {
        this.gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
    }

    public JsonObject toJsonTree(AssemblyManifest manifest, ProjectLayout layout) {
        Objects.requireNonNull(manifest, "manifest");
        Objects.requireNonNull(layout, "layout");
        JsonObject root = new JsonObject();

        JsonObject metadata = new JsonObject();
        metadata.addProperty("project", manifest.metadata().project());
        metadata.addProperty("strategy", manifest.metadata().strategy());
        manifest.metadata().runNumber().ifPresent(run -> metadata.addProperty("run_number", run));
        metadata.addProperty("base_directory", manifest.metadata().baseDirectory());
        root.add("metadata", metadata);

        GridSpec spec = manifest.gridSpec();
        JsonObject gridSpecs = new JsonObject();
        gridSpecs.addProperty("rows", spec.rows());
        gridSpecs.addProperty("cols", spec.cols());
        gridSpecs.addProperty("piece_height", spec.pieceHeight());
        gridSpecs.addProperty("piece_width", spec.pieceWidth());
        root.add("grid_specs", gridSpecs);

        JsonObject positions = new JsonObject();
        for (Map.Entry<String, PlacementRecord> entry : manifest.positions().entrySet()) {
            positions.add(entry.getKey(), toJson(entry.getValue(), layout));
        }
        root.add("positions", positions);
        return root;
    }

    public String toJson(AssemblyManifest manifest, ProjectLayout layout) {
        return gson.toJson(toJsonTree(manifest, layout));
    }

    public void write(AssemblyManifest manifest, ProjectLayout layout, Path target) {
        String json = toJson(manifest, layout);
        TileImages.writeAtomically(target, temp -> Files.writeString(temp, json, StandardCharsets.UTF_8));
    }

    private JsonObject toJson(PlacementRecord record, ProjectLayout layout) {
        JsonObject json = new JsonObject();
        json.addProperty("scheme", record.scheme());
        if (record instanceof OriginalPlacement original) {
            json.addProperty("source_variation", original.sourceVariation());
            json.addProperty("source_filename", original.sourceFilename());
            json.addProperty("source_path", layout.relativize(original.sourcePath()));
        } else if (record instanceof SubdividedPlacement subdivided) {
            JsonObject perSubcell = new JsonObject();
            for (SubcellSource subcell : subdivided.subcells()) {
                perSubcell.addProperty(subcell.key(), subcell.sourceVariation());
            }
            json.add("per_subcell", perSubcell);
        } else {
            throw new IllegalArgumentException("Unsupported placement record: " + record.getClass().getName());
        }
        return json;
    }
}
