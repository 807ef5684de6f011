package nl.bytesoflife.deltakicad.schema.model;

public record Property(String key, String value, Position position) {
}
