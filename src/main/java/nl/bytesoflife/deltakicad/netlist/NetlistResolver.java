package nl.bytesoflife.deltakicad.netlist;

import nl.bytesoflife.deltakicad.UnresolvedReferenceException;
import nl.bytesoflife.deltakicad.geometry.SymbolTransform;
import nl.bytesoflife.deltakicad.schema.model.GlobalLabel;
import nl.bytesoflife.deltakicad.schema.model.Junction;
import nl.bytesoflife.deltakicad.schema.model.LibrarySymbol;
import nl.bytesoflife.deltakicad.schema.model.LocalLabel;
import nl.bytesoflife.deltakicad.schema.model.NoConnect;
import nl.bytesoflife.deltakicad.schema.model.Pin;
import nl.bytesoflife.deltakicad.schema.model.Schema;
import nl.bytesoflife.deltakicad.schema.model.Symbol;
import nl.bytesoflife.deltakicad.schema.model.Wire;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups the pins, labels, junctions and no-connects of one schematic sheet into
 * nets by following wires between coordinates.
 */
public class NetlistResolver {

    private static final Logger log = LoggerFactory.getLogger(NetlistResolver.class);

    private static final String POWER_INPUT = "power_in";

    private final ResolverSettings settings;

    public NetlistResolver() {
        this(ResolverSettings.defaults());
    }

    public NetlistResolver(ResolverSettings settings) {
        this.settings = settings;
    }

    /**
     * @throws UnresolvedReferenceException if a placed symbol has no library symbol
     */
    public Netlist resolve(Schema schema) {
        long start = System.currentTimeMillis();
        PositionIndex index = buildIndex(schema);
        WireAdjacencyMap wires = buildAdjacency(schema);

        Set<Coordinate> claimed = new HashSet<>();
        List<Net> nets = new ArrayList<>();
        for (Map.Entry<Coordinate, List<Occupant>> entry : index.entries().entrySet()) {
            if (claimed.contains(entry.getKey())) continue;
            if (entry.getValue().stream().noneMatch(o -> o instanceof Occupant.PinAt)) continue;
            nets.add(new Traversal(index, wires, claimed).run(entry.getKey()));
        }
        // labels, junctions and markers that no pin reached
        for (Coordinate coordinate : index.coordinates()) {
            if (!claimed.contains(coordinate)) {
                nets.add(new Traversal(index, wires, claimed).run(coordinate));
            }
        }

        name(nets);
        log.info("Resolved {} nets from {} positions and {} wire endpoints in {}ms",
                nets.size(), index.size(), wires.endpoints().size(), System.currentTimeMillis() - start);
        return new Netlist(nets);
    }

    PositionIndex buildIndex(Schema schema) {
        PositionIndex index = new PositionIndex();
        for (Symbol symbol : schema.getSymbols()) {
            if (settings.isNonElectrical(symbol.libId())) {
                log.debug("Skipping non-electrical symbol {} ({})", symbol.reference(), symbol.libId());
                continue;
            }
            LibrarySymbol library = schema.librarySymbol(symbol.libId())
                    .orElseThrow(() -> new UnresolvedReferenceException(symbol.libId(),
                            "Symbol " + symbol.reference() + " refers to missing library symbol " + symbol.libId()));
            SymbolTransform transform = SymbolTransform.of(symbol);
            for (Pin pin : library.pins(symbol.unit(), symbol.bodyStyle())) {
                Coordinate at = Coordinate.of(transform.apply(pin.position().point()));
                index.insert(new Occupant.PinAt(at, symbol, pin));
            }
        }
        for (Junction junction : schema.getJunctions()) {
            index.insert(new Occupant.JunctionAt(Coordinate.of(junction.position()), junction));
        }
        for (NoConnect noConnect : schema.getNoConnects()) {
            index.insert(new Occupant.NoConnectAt(Coordinate.of(noConnect.position()), noConnect));
        }
        for (LocalLabel label : schema.getLocalLabels()) {
            index.insert(new Occupant.LabelAt(Coordinate.of(label.position()), label));
        }
        for (GlobalLabel label : schema.getGlobalLabels()) {
            index.insert(new Occupant.GlobalLabelAt(Coordinate.of(label.position()), label));
        }
        return index;
    }

    WireAdjacencyMap buildAdjacency(Schema schema) {
        WireAdjacencyMap wires = new WireAdjacencyMap();
        for (Wire wire : schema.getWires()) {
            wires.insert(wire);
        }
        return wires;
    }

    private void name(List<Net> nets) {
        Set<String> taken = new HashSet<>();
        List<Net> unnamed = new ArrayList<>();
        for (Net net : nets) {
            String power = null;
            String global = null;
            String local = null;
            boolean noConnect = false;
            for (Occupant occupant : net.getOccupants()) {
                if (occupant instanceof Occupant.PinAt pin) {
                    if (power == null && isSupply(pin)) {
                        power = powerName(pin.symbol());
                    }
                } else if (occupant instanceof Occupant.GlobalLabelAt label) {
                    if (global == null) global = label.label().text();
                } else if (occupant instanceof Occupant.LabelAt label) {
                    if (local == null) local = label.label().text();
                } else if (occupant instanceof Occupant.NoConnectAt) {
                    noConnect = true;
                }
            }

            if (power != null) {
                net.assign(power, power, Net.NameSource.POWER);
            } else if (global != null) {
                net.assign(global, global, Net.NameSource.LABEL);
            } else if (local != null) {
                net.assign(local, local, Net.NameSource.LABEL);
            } else if (noConnect) {
                net.assign(settings.noConnectName(), settings.noConnectName(), Net.NameSource.NO_CONNECT);
            } else {
                unnamed.add(net);
                continue;
            }
            taken.add(net.getIdentifier());
        }

        // numbers already used as a label or power name are skipped
        int counter = 0;
        for (Net net : unnamed) {
            String identifier;
            do {
                identifier = Integer.toString(++counter);
            } while (taken.contains(identifier));
            List<String> pins = net.getPins().stream()
                    .filter(p -> !settings.isPower(p.symbol().libId()))
                    .map(Occupant.PinAt::designator)
                    .toList();
            net.assign(identifier, pins.isEmpty() ? identifier : String.join("__", pins), Net.NameSource.AUTO);
        }

        for (Net net : nets) {
            log.debug("Net {}: {}", net.getName(), net.getOccupants());
        }
    }

    /**
     * A power-namespace pin that draws from the net, as on {@code power:+15V}.
     * Driver pins such as the one of {@code power:PWR_FLAG} do not name nets.
     */
    private boolean isSupply(Occupant.PinAt pin) {
        return settings.isPower(pin.symbol().libId()) && POWER_INPUT.equals(pin.pin().electricalType());
    }

    private String powerName(Symbol symbol) {
        String namespace = settings.powerNamespace();
        return symbol.property(Symbol.VALUE)
                .map(v -> v.startsWith(namespace) ? v.substring(namespace.length()) : v)
                .orElse(symbol.libId().substring(namespace.length()));
    }

    /**
     * One depth-first walk from a start coordinate. Coordinates it enters are
     * claimed for the net it builds. Open coordinates are kept on an explicit
     * stack, so the length of a wire chain is not limited by the call stack.
     */
    private static final class Traversal {

        private final PositionIndex index;
        private final WireAdjacencyMap wires;
        private final Set<Coordinate> claimed;
        private final Set<Occupant> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        private final Deque<Iterator<Coordinate>> stack = new ArrayDeque<>();
        private final Net net = new Net();

        Traversal(PositionIndex index, WireAdjacencyMap wires, Set<Coordinate> claimed) {
            this.index = index;
            this.wires = wires;
            this.claimed = claimed;
        }

        Net run(Coordinate start) {
            enter(start);
            while (!stack.isEmpty()) {
                Iterator<Coordinate> neighbors = stack.peek();
                if (neighbors.hasNext()) {
                    enter(neighbors.next());
                } else {
                    stack.pop();
                }
            }
            return net;
        }

        private void enter(Coordinate coordinate) {
            if (!claimed.add(coordinate)) return;
            if (index.contains(coordinate)) {
                net.addMember(coordinate);
            } else {
                net.addWirePoint(coordinate);
            }
            for (Occupant occupant : index.at(coordinate)) {
                if (seen.add(occupant)) {
                    net.addOccupant(occupant);
                }
            }
            stack.push(wires.neighbors(coordinate).iterator());
        }
    }
}
