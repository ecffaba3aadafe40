package fr.lapetina.imagebatch.domain.model;

/**
 * Target width and height of a resize, in pixels.
 * Range checks happen in {@link TransformParameters#validate()}, not here.
 */
public record Dimensions(int width, int height) {

    public static Dimensions of(int width, int height) {
        return new Dimensions(width, height);
    }

    public boolean isPositive() {
        return width > 0 && height > 0;
    }

    public boolean matches(int otherWidth, int otherHeight) {
        return width == otherWidth && height == otherHeight;
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
