package nl.bytesoflife.deltakicad.schema.model;

import java.util.List;

/**
 * Sub-symbol of a library symbol, named {@code LIB_UNIT_STYLE}. Unit 0 holds
 * the items shared by all units.
 */
public record SymbolUnit(String name, int unit, int style, List<Pin> pins) {

    public SymbolUnit {
        pins = List.copyOf(pins);
    }
}
