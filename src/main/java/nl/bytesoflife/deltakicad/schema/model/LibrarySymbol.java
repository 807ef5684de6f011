package nl.bytesoflife.deltakicad.schema.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Symbol definition from the {@code lib_symbols} section of a schematic.
 */
public record LibrarySymbol(String libId, String extendsId, boolean power, boolean inBom, boolean onBoard,
                            List<Property> properties, List<SymbolUnit> units) {

    public LibrarySymbol {
        properties = List.copyOf(properties);
        units = List.copyOf(units);
    }

    /**
     * Pins placed for the given unit and body style: those of sub-symbols whose
     * unit is 0 or {@code unit} and whose style is 0 or {@code bodyStyle}.
     */
    public List<Pin> pins(int unit, int bodyStyle) {
        List<Pin> pins = new ArrayList<>();
        for (SymbolUnit u : units) {
            if ((u.unit() == 0 || u.unit() == unit) && (u.style() == 0 || u.style() == bodyStyle)) {
                pins.addAll(u.pins());
            }
        }
        return pins;
    }

    public Optional<String> property(String key) {
        return properties.stream()
                .filter(p -> p.key().equals(key))
                .map(Property::value)
                .findFirst();
    }
}
