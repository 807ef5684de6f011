package nl.bytesoflife.deltakicad.netlist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A maximal group of electrically connected points.
 */
public class Net {

    public enum NameSource {
        POWER,
        LABEL,
        NO_CONNECT,
        AUTO
    }

    private final Set<Coordinate> members = new LinkedHashSet<>();
    private final Set<Coordinate> wirePoints = new LinkedHashSet<>();
    private final List<Occupant> occupants = new ArrayList<>();
    private String identifier;
    private String name;
    private NameSource nameSource;

    void addMember(Coordinate coordinate) {
        members.add(coordinate);
    }

    void addWirePoint(Coordinate coordinate) {
        wirePoints.add(coordinate);
    }

    void addOccupant(Occupant occupant) {
        occupants.add(occupant);
    }

    void assign(String identifier, String name, NameSource source) {
        this.identifier = identifier;
        this.name = name;
        this.nameSource = source;
    }

    /**
     * Power value, label text, the no-connect name, or a decimal number unique in
     * the document.
     */
    public String getIdentifier() {
        return identifier;
    }

    public NameSource getNameSource() {
        return nameSource;
    }

    /**
     * The identifier, unless the net was numbered automatically; then the
     * connected signal pins as {@code REF_NUMBER} joined by {@code __} in
     * discovery order.
     */
    public String getName() {
        return name;
    }

    /**
     * Coordinates of the position index that belong to this net.
     */
    public Set<Coordinate> getMembers() {
        return Collections.unmodifiableSet(members);
    }

    /**
     * Bare wire endpoints crossed by this net, not in the position index.
     */
    public Set<Coordinate> getWirePoints() {
        return Collections.unmodifiableSet(wirePoints);
    }

    public List<Occupant> getOccupants() {
        return Collections.unmodifiableList(occupants);
    }

    public List<Occupant.PinAt> getPins() {
        return occupants.stream()
                .filter(o -> o instanceof Occupant.PinAt)
                .map(o -> (Occupant.PinAt) o)
                .toList();
    }

    @Override
    public String toString() {
        return "Net{" + getName() + ", members=" + members.size() + ", occupants="
                + occupants.stream().map(Object::toString).collect(Collectors.joining(", ", "[", "]")) + "}";
    }
}
