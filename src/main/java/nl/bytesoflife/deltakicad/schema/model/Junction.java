package nl.bytesoflife.deltakicad.schema.model;

public record Junction(Position position, double diameter, String uuid) {
}
