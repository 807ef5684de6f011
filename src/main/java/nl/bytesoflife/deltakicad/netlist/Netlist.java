package nl.bytesoflife.deltakicad.netlist;

import nl.bytesoflife.deltakicad.schema.model.Symbol;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of resolving a schematic: its nets in discovery order.
 */
public class Netlist {

    private final List<Net> nets;
    private final Map<Coordinate, Net> byCoordinate = new HashMap<>();

    Netlist(List<Net> nets) {
        this.nets = List.copyOf(nets);
        for (Net net : this.nets) {
            for (Coordinate c : net.getMembers()) {
                byCoordinate.put(c, net);
            }
            for (Coordinate c : net.getWirePoints()) {
                byCoordinate.put(c, net);
            }
        }
    }

    public List<Net> getNets() {
        return Collections.unmodifiableList(nets);
    }

    public Optional<Net> netAt(Coordinate coordinate) {
        return Optional.ofNullable(byCoordinate.get(coordinate));
    }

    public Optional<String> netName(Coordinate coordinate) {
        return netAt(coordinate).map(Net::getName);
    }

    /**
     * The net a pin of a placed symbol is connected to. Empty for pins of
     * symbols the resolver skips.
     */
    public Optional<Net> netOf(Symbol symbol, String pinNumber) {
        for (Net net : nets) {
            for (Occupant.PinAt pin : net.getPins()) {
                if (pin.symbol() == symbol && pin.pin().number().equals(pinNumber)) {
                    return Optional.of(net);
                }
            }
        }
        return Optional.empty();
    }

    public int size() {
        return nets.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Netlist:\n");
        sb.append("  Nets: ").append(nets.size()).append("\n");
        for (Net net : nets) {
            sb.append("  - ").append(net.getIdentifier());
            if (!net.getName().equals(net.getIdentifier())) {
                sb.append(" (").append(net.getName()).append(")");
            }
            sb.append(": ");
            List<Occupant> occupants = net.getOccupants();
            for (int i = 0; i < occupants.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(occupants.get(i));
            }
            sb.append("\n");
        }
        return sb.toString();
    }
}
