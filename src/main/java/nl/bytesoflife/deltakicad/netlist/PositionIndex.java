package nl.bytesoflife.deltakicad.netlist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Coordinate to the primitives anchored there, in insertion order.
 */
public class PositionIndex {

    private final Map<Coordinate, List<Occupant>> entries = new LinkedHashMap<>();

    public void insert(Occupant occupant) {
        entries.computeIfAbsent(occupant.at(), k -> new ArrayList<>()).add(occupant);
    }

    public List<Occupant> at(Coordinate coordinate) {
        List<Occupant> occupants = entries.get(coordinate);
        return occupants != null ? Collections.unmodifiableList(occupants) : List.of();
    }

    public boolean contains(Coordinate coordinate) {
        return entries.containsKey(coordinate);
    }

    public Set<Coordinate> coordinates() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public Map<Coordinate, List<Occupant>> entries() {
        return Collections.unmodifiableMap(entries);
    }

    public int size() {
        return entries.size();
    }
}
