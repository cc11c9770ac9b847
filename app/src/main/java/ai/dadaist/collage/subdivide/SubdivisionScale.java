package ai.dadaist.collage.subdivide;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Number of rows and columns each parent tile is cut into.
 */
public record SubdivisionScale(int size) {

    public static final Set<Integer> SUPPORTED = Set.of(5, 10, 15, 20);
    public static final List<SubdivisionScale> ALL = List.of(
            new SubdivisionScale(5), new SubdivisionScale(10), new SubdivisionScale(15), new SubdivisionScale(20));

    public SubdivisionScale {
        if (!SUPPORTED.contains(size)) {
            throw new IllegalArgumentException("Unsupported subdivision scale " + size + ", expected one of 5, 10, 15, 20");
        }
    }

    /**
     * Accepts {@code 5} or {@code 5x5}.
     */
    public static SubdivisionScale parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Subdivision scale must be provided");
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        int separator = value.indexOf('x');
        try {
            if (separator < 0) {
                return new SubdivisionScale(Integer.parseInt(value));
            }
            int rows = Integer.parseInt(value.substring(0, separator));
            int cols = Integer.parseInt(value.substring(separator + 1));
            if (rows != cols) {
                throw new IllegalArgumentException("Subdivision scale must be square: " + raw);
            }
            return new SubdivisionScale(rows);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid subdivision scale: " + raw, ex);
        }
    }

    public static List<SubdivisionScale> parseList(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .map(SubdivisionScale::parse)
                .distinct()
                .collect(Collectors.toUnmodifiableList());
    }

    public String directoryName() {
        return size + "x" + size;
    }

    @Override
    public String toString() {
        return directoryName();
    }
}
