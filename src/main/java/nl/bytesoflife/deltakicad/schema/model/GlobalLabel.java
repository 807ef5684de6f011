package nl.bytesoflife.deltakicad.schema.model;

public record GlobalLabel(String text, String shape, Position position, String uuid) {
}
