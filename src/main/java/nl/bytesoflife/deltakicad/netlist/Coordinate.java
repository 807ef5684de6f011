package nl.bytesoflife.deltakicad.netlist;

import nl.bytesoflife.deltakicad.schema.model.Point;
import nl.bytesoflife.deltakicad.schema.model.Position;
import nl.bytesoflife.deltakicad.sexp.Decimals;

/**
 * Connectivity key of a sheet position, in fixed-point units of 10^-4 mm. All
 * coordinates are made by {@link #of(double, double)} so that the same physical
 * point hashes the same whichever primitive produced it.
 */
public record Coordinate(long x, long y) {

    public static Coordinate of(double x, double y) {
        return new Coordinate(Decimals.toFixed(x), Decimals.toFixed(y));
    }

    public static Coordinate of(Point point) {
        return of(point.x(), point.y());
    }

    public static Coordinate of(Position position) {
        return of(position.x(), position.y());
    }

    public double getX() {
        return x / 10_000.0;
    }

    public double getY() {
        return y / 10_000.0;
    }

    @Override
    public String toString() {
        return "(" + Decimals.formatFixed(x) + ", " + Decimals.formatFixed(y) + ")";
    }
}
