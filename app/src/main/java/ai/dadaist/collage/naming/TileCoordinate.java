package ai.dadaist.collage.naming;

import java.util.Objects;
import java.util.Optional;

/**
 * Grid position decoded from a tile filename. Child fields are only present for subdivided tiles.
 */
public record TileCoordinate(int parentRow, int parentCol, Integer childRow, Integer childCol) {

    public TileCoordinate {
        requireNonNegative(parentRow, "parentRow");
        requireNonNegative(parentCol, "parentCol");
        if ((childRow == null) != (childCol == null)) {
            throw new IllegalArgumentException("childRow and childCol must both be present or both be absent");
        }
        if (childRow != null) {
            requireNonNegative(childRow, "childRow");
            requireNonNegative(childCol, "childCol");
        }
    }

    public static TileCoordinate parent(int row, int col) {
        return new TileCoordinate(row, col, null, null);
    }

    public static TileCoordinate child(int parentRow, int parentCol, int childRow, int childCol) {
        return new TileCoordinate(parentRow, parentCol, childRow, childCol);
    }

    public boolean isSubdivided() {
        return childRow != null;
    }

    public Optional<TileCoordinate> parentCoordinate() {
        return isSubdivided() ? Optional.of(parent(parentRow, parentCol)) : Optional.empty();
    }

    /**
     * Key used by assembly manifests, {@code row_col} of the parent cell.
     */
    public String positionKey() {
        return parentRow + "_" + parentCol;
    }

    @Override
    public String toString() {
        if (!isSubdivided()) {
            return "(" + parentRow + "," + parentCol + ")";
        }
        return "(" + parentRow + "," + parentCol + ")/(" + childRow + "," + childCol + ")";
    }

    private static void requireNonNegative(Integer value, String field) {
        Objects.requireNonNull(value, field);
        if (value < 0) {
            throw new IllegalArgumentException(field + " must not be negative");
        }
    }
}
