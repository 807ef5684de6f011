package nl.bytesoflife.deltakicad.schema.model;

/**
 * Pin of a library symbol. {@code position} is the connection point in library
 * coordinates (y up) relative to the symbol origin.
 */
public record Pin(String electricalType, String graphicalStyle, Position position, double length,
                  String name, String number, boolean hidden) {
}
