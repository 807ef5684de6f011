package nl.bytesoflife.deltakicad.schema.model;

public record NoConnect(Position position, String uuid) {
}
