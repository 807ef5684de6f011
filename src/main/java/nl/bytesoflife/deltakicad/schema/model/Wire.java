package nl.bytesoflife.deltakicad.schema.model;

public record Wire(Point start, Point end, String uuid) {
}
