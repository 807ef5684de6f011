package nl.bytesoflife.deltakicad.schema.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed view of a {@code kicad_sch} file, limited to what connectivity needs.
 */
public class Schema {

    private String version;
    private String generator;
    private String generatorVersion;
    private String uuid;
    private String paper;

    private final List<LibrarySymbol> librarySymbols = new ArrayList<>();
    private final List<Symbol> symbols = new ArrayList<>();
    private final List<Wire> wires = new ArrayList<>();
    private final List<Junction> junctions = new ArrayList<>();
    private final List<NoConnect> noConnects = new ArrayList<>();
    private final List<LocalLabel> localLabels = new ArrayList<>();
    private final List<GlobalLabel> globalLabels = new ArrayList<>();

    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }
    public String getGenerator() { return generator; }
    public void setGenerator(String generator) { this.generator = generator; }
    public String getGeneratorVersion() { return generatorVersion; }
    public void setGeneratorVersion(String generatorVersion) { this.generatorVersion = generatorVersion; }
    public String getUuid() { return uuid; }
    public void setUuid(String uuid) { this.uuid = uuid; }
    public String getPaper() { return paper; }
    public void setPaper(String paper) { this.paper = paper; }

    public Schema addLibrarySymbol(LibrarySymbol symbol) {
        librarySymbols.add(symbol);
        return this;
    }

    public Schema addSymbol(Symbol symbol) {
        symbols.add(symbol);
        return this;
    }

    public Schema addWire(Wire wire) {
        wires.add(wire);
        return this;
    }

    public Schema addJunction(Junction junction) {
        junctions.add(junction);
        return this;
    }

    public Schema addNoConnect(NoConnect noConnect) {
        noConnects.add(noConnect);
        return this;
    }

    public Schema addLocalLabel(LocalLabel label) {
        localLabels.add(label);
        return this;
    }

    public Schema addGlobalLabel(GlobalLabel label) {
        globalLabels.add(label);
        return this;
    }

    public Optional<LibrarySymbol> librarySymbol(String libId) {
        return librarySymbols.stream()
                .filter(s -> s.libId().equals(libId))
                .findFirst();
    }

    public List<LibrarySymbol> getLibrarySymbols() {
        return Collections.unmodifiableList(librarySymbols);
    }

    public List<Symbol> getSymbols() {
        return Collections.unmodifiableList(symbols);
    }

    public List<Wire> getWires() {
        return Collections.unmodifiableList(wires);
    }

    public List<Junction> getJunctions() {
        return Collections.unmodifiableList(junctions);
    }

    public List<NoConnect> getNoConnects() {
        return Collections.unmodifiableList(noConnects);
    }

    public List<LocalLabel> getLocalLabels() {
        return Collections.unmodifiableList(localLabels);
    }

    public List<GlobalLabel> getGlobalLabels() {
        return Collections.unmodifiableList(globalLabels);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Schema other)) return false;
        return Objects.equals(version, other.version)
                && Objects.equals(generator, other.generator)
                && Objects.equals(generatorVersion, other.generatorVersion)
                && Objects.equals(uuid, other.uuid)
                && Objects.equals(paper, other.paper)
                && librarySymbols.equals(other.librarySymbols)
                && symbols.equals(other.symbols)
                && wires.equals(other.wires)
                && junctions.equals(other.junctions)
                && noConnects.equals(other.noConnects)
                && localLabels.equals(other.localLabels)
                && globalLabels.equals(other.globalLabels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, generator, generatorVersion, uuid, paper,
                librarySymbols, symbols, wires, junctions, noConnects, localLabels, globalLabels);
    }

    @Override
    public String toString() {
        return "Schema{version='" + version + "', symbols=" + symbols.size() + ", wires=" + wires.size() +
                ", labels=" + (localLabels.size() + globalLabels.size()) + "}";
    }
}
