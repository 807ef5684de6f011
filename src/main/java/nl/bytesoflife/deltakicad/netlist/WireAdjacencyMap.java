package nl.bytesoflife.deltakicad.netlist;

import nl.bytesoflife.deltakicad.schema.model.Wire;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Wire endpoint to the endpoints it is wired to. Every wire is stored in both
 * directions.
 */
public class WireAdjacencyMap {

    private static final Logger log = LoggerFactory.getLogger(WireAdjacencyMap.class);

    private final Map<Coordinate, List<Coordinate>> neighbors = new LinkedHashMap<>();

    public void insert(Wire wire) {
        connect(Coordinate.of(wire.start()), Coordinate.of(wire.end()));
    }

    public void connect(Coordinate a, Coordinate b) {
        if (a.equals(b)) {
            log.debug("Ignoring zero-length wire at {}", a);
            return;
        }
        List<Coordinate> fromA = neighbors.computeIfAbsent(a, k -> new ArrayList<>());
        if (fromA.contains(b)) {
            log.warn("Duplicate wire {} - {}", a, b);
            return;
        }
        fromA.add(b);
        neighbors.computeIfAbsent(b, k -> new ArrayList<>()).add(a);
    }

    public List<Coordinate> neighbors(Coordinate coordinate) {
        List<Coordinate> list = neighbors.get(coordinate);
        return list != null ? Collections.unmodifiableList(list) : List.of();
    }

    public Set<Coordinate> endpoints() {
        return Collections.unmodifiableSet(neighbors.keySet());
    }
}
