package ai.dadaist.collage.naming;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Encodes and decodes the filenames that carry a tile's grid position.
 *
 * <p>Parent tiles are named {@code <prefix>-<row>_<col>.png}; subdivided tiles are named
 * {@code <parentRow>-<parentCol>_<childRow>-<childCol>.png}, optionally behind a prefix.
 */
public final class TileNaming {

    public static final String DEFAULT_PREFIX = "tile";
    public static final String EXTENSION = ".png";

    // A prefix may not end with '-' so that "x--1_2.png" cannot be read as row 1.
    private static final Pattern PARENT_PATTERN = Pattern.compile("^(.*[^-])-(\\d+)_(\\d+)\\.png$");
    private static final Pattern CHILD_PATTERN = Pattern.compile("^(?:.*[^\\d-])?(\\d+)-(\\d+)_(\\d+)-(\\d+)\\.png$");

    private TileNaming() {
    }

    public static String encodeParent(int row, int col) {
        return encodeParent(DEFAULT_PREFIX, row, col);
    }

    public static String encodeParent(String prefix, int row, int col) {
        Objects.requireNonNull(prefix, "prefix");
        if (prefix.isEmpty() || prefix.endsWith("-")) {
            throw new IllegalArgumentException("prefix must be non-empty and must not end with '-': " + prefix);
        }
        requireNonNegative(row, "row");
        requireNonNegative(col, "col");
        return prefix + "-" + row + "_" + col + EXTENSION;
    }

    public static String encodeChild(int parentRow, int parentCol, int childRow, int childCol) {
        requireNonNegative(parentRow, "parentRow");
        requireNonNegative(parentCol, "parentCol");
        requireNonNegative(childRow, "childRow");
        requireNonNegative(childCol, "childCol");
        return parentRow + "-" + parentCol + "_" + childRow + "-" + childCol + EXTENSION;
    }

    public static TileCoordinate parseParent(String name) {
        Matcher matcher = match(PARENT_PATTERN, name, "<prefix>-<row>_<col>.png");
        return TileCoordinate.parent(parseCoordinate(name, matcher.group(2)), parseCoordinate(name, matcher.group(3)));
    }

    public static TileCoordinate parseChild(String name) {
        Matcher matcher = match(CHILD_PATTERN, name, "<parentRow>-<parentCol>_<childRow>-<childCol>.png");
        return TileCoordinate.child(
                parseCoordinate(name, matcher.group(1)),
                parseCoordinate(name, matcher.group(2)),
                parseCoordinate(name, matcher.group(3)),
                parseCoordinate(name, matcher.group(4)));
    }

    /**
     * Returns the prefix of a parent tile name, e.g. {@code v} for {@code v-0_1.png}.
     */
    public static String parentPrefix(String name) {
        return match(PARENT_PATTERN, name, "<prefix>-<row>_<col>.png").group(1);
    }

    public static boolean isParentName(String name) {
        return name != null && PARENT_PATTERN.matcher(name).matches();
    }

    public static boolean isChildName(String name) {
        return name != null && CHILD_PATTERN.matcher(name).matches();
    }

    private static Matcher match(Pattern pattern, String name, String expectedShape) {
        if (name == null) {
            throw new InvalidNameException(null, "Tile name must not be null");
        }
        Matcher matcher = pattern.matcher(name);
        if (!matcher.matches()) {
            throw new InvalidNameException(name, "Invalid tile name '" + name + "', expected " + expectedShape);
        }
        return matcher;
    }

    private static int parseCoordinate(String name, String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException ex) {
            throw new InvalidNameException(name, "Coordinate out of range in tile name '" + name + "'", ex);
        }
    }

    private static void requireNonNegative(int value, String field) {
        if (value < 0) {
            throw new IllegalArgumentException(field + " must not be negative: " + value);
        }
    }
}
