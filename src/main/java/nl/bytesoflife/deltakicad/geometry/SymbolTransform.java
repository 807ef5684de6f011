package nl.bytesoflife.deltakicad.geometry;

import nl.bytesoflife.deltakicad.schema.model.Point;
import nl.bytesoflife.deltakicad.schema.model.Symbol;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.util.AffineTransformation;

/**
 * Maps library coordinates (y up) of a symbol's items onto the schematic sheet (y down).
 * Order: flip y, mirror, rotate counter-clockwise as seen on the sheet, translate.
 */
public class SymbolTransform {

    private final AffineTransformation transformation;

    public SymbolTransform(double x, double y, double angle, String mirror) {
        AffineTransformation t = new AffineTransformation();
        t.scale(1, -1);
        if ("x".equals(mirror)) {
            t.scale(1, -1);
        } else if ("y".equals(mirror)) {
            t.scale(-1, 1);
        }
        if (angle % 360 != 0) {
            // the sheet's y axis points down, so a visual CCW turn is a negative math angle
            t.rotate(-Math.toRadians(angle));
        }
        t.translate(x, y);
        this.transformation = t;
    }

    public static SymbolTransform of(Symbol symbol) {
        return new SymbolTransform(
                symbol.position().x(), symbol.position().y(), symbol.position().angle(), symbol.mirror());
    }

    public Point apply(double x, double y) {
        Coordinate result = transformation.transform(new Coordinate(x, y), new Coordinate());
        return new Point(result.x, result.y);
    }

    public Point apply(Point local) {
        return apply(local.x(), local.y());
    }
}
