package nl.bytesoflife.deltakicad.schema.model;

public record LocalLabel(String text, Position position, String uuid) {
}
