package nl.bytesoflife.deltakicad.schema.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Placed instance of a library symbol.
 *
 * @param bodyStyle 1 for the normal body, 2 for the De Morgan alternate
 * @param mirror {@code x}, {@code y} or null
 * @param pinUuids pin number to pin uuid, in file order
 */
public record Symbol(String libId, Position position, int unit, int bodyStyle, String mirror, boolean inBom, boolean onBoard,
                     boolean dnp, String uuid, List<Property> properties, Map<String, String> pinUuids) {

    public static final String REFERENCE = "Reference";
    public static final String VALUE = "Value";

    public Symbol {
        properties = List.copyOf(properties);
        pinUuids = Collections.unmodifiableMap(new LinkedHashMap<>(pinUuids));
    }

    public Optional<String> property(String key) {
        return properties.stream()
                .filter(p -> p.key().equals(key))
                .map(Property::value)
                .findFirst();
    }

    public String reference() {
        return property(REFERENCE).orElse("?");
    }
}
