package nl.bytesoflife.deltakicad.schema.model;

/**
 * An {@code (at X Y ANGLE)} anchor. The angle is in degrees, counter-clockwise.
 */
public record Position(double x, double y, double angle) {

    public Position(double x, double y) {
        this(x, y, 0);
    }

    public Point point() {
        return new Point(x, y);
    }
}
