package nl.bytesoflife.deltakicad.schema.model;

public record Point(double x, double y) {
}
