package ai.dadaist.collage.image;

/**
 * Pixel size of an encoded image, read from its header.
 */
public record ImageDimensions(int width, int height) {

    public ImageDimensions {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("dimensions must not be negative: " + width + "x" + height);
        }
    }

    public long pixelCount() {
        return (long) width * height;
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
