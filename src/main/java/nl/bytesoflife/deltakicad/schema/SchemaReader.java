package nl.bytesoflife.deltakicad.schema;

import nl.bytesoflife.deltakicad.MalformedDocumentException;
import nl.bytesoflife.deltakicad.MissingFieldException;
import nl.bytesoflife.deltakicad.schema.model.*;
import nl.bytesoflife.deltakicad.sexp.SDocument;
import nl.bytesoflife.deltakicad.sexp.SNode;
import nl.bytesoflife.deltakicad.sexp.SValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps a {@code kicad_sch} document tree onto the {@link Schema} model.
 * Any missing mandatory field rejects the whole document.
 */
public class SchemaReader {

    private static final Logger log = LoggerFactory.getLogger(SchemaReader.class);

    public Schema parse(String content) {
        return read(SDocument.parse(content));
    }

    public Schema read(SDocument document) {
        SNode.SList root = document.getRoot();
        if (!"kicad_sch".equals(root.name())) {
            throw new MalformedDocumentException("Expected (kicad_sch ...) but found (" + root.name() + " ...)", -1);
        }

        Schema schema = new Schema();
        for (SNode.SList node : root.lists()) {
            switch (node.name()) {
                case "version" -> schema.setVersion(node.requireAt(0, SValueType.STRING, "version"));
                case "generator" -> schema.setGenerator(node.requireAt(0, SValueType.STRING, "generator"));
                case "generator_version" -> schema.setGeneratorVersion(node.optionalAt(0, SValueType.STRING).orElse(null));
                case "uuid" -> schema.setUuid(node.requireAt(0, SValueType.STRING, "uuid"));
                case "paper" -> schema.setPaper(node.requireAt(0, SValueType.STRING, "paper"));
                case "lib_symbols" -> {
                    for (SNode.SList symbol : node.query("symbol")) {
                        schema.addLibrarySymbol(parseLibrarySymbol(symbol));
                    }
                }
                case "symbol" -> schema.addSymbol(parseSymbol(node));
                case "wire" -> schema.addWire(parseWire(node));
                case "junction" -> schema.addJunction(new Junction(
                        parsePosition(node),
                        node.optional("diameter", SValueType.FLOAT).orElse(0.0),
                        node.require("uuid", SValueType.STRING)));
                case "no_connect" -> schema.addNoConnect(new NoConnect(
                        parsePosition(node),
                        node.require("uuid", SValueType.STRING)));
                case "label" -> schema.addLocalLabel(new LocalLabel(
                        node.requireAt(0, SValueType.STRING, "text"),
                        parsePosition(node),
                        node.require("uuid", SValueType.STRING)));
                case "global_label" -> schema.addGlobalLabel(new GlobalLabel(
                        node.requireAt(0, SValueType.STRING, "text"),
                        node.optional("shape", SValueType.STRING).orElse(null),
                        parsePosition(node),
                        node.require("uuid", SValueType.STRING)));
                default -> log.debug("Skipping root node ({})", node.name());
            }
        }

        log.debug("Read {}", schema);
        return schema;
    }

    private LibrarySymbol parseLibrarySymbol(SNode.SList node) {
        String libId = node.requireAt(0, SValueType.STRING, "lib_id");
        List<SymbolUnit> units = new ArrayList<>();
        for (SNode.SList unit : node.query("symbol")) {
            units.add(parseUnit(unit));
        }
        return new LibrarySymbol(
                libId,
                node.optional("extends", SValueType.STRING).orElse(null),
                node.child("power").isPresent(),
                node.optional("in_bom", SValueType.BOOLEAN).orElse(true),
                node.optional("on_board", SValueType.BOOLEAN).orElse(true),
                parseProperties(node),
                units);
    }

    private SymbolUnit parseUnit(SNode.SList node) {
        String name = node.requireAt(0, SValueType.STRING, "name");
        // LIB_UNIT_STYLE
        String[] parts = name.split("_");
        int unit;
        int style;
        try {
            unit = Integer.parseInt(parts[parts.length - 2]);
            style = Integer.parseInt(parts[parts.length - 1]);
        } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
            throw new MissingFieldException("symbol " + name, "unit");
        }

        List<Pin> pins = new ArrayList<>();
        for (SNode.SList pin : node.query("pin")) {
            pins.add(parsePin(pin));
        }
        return new SymbolUnit(name, unit, style, pins);
    }

    private Pin parsePin(SNode.SList node) {
        boolean hidden = node.hasValue("hide") || node.optional("hide", SValueType.BOOLEAN).orElse(false);
        return new Pin(
                node.requireAt(0, SValueType.STRING, "electrical_type"),
                node.optionalAt(1, SValueType.STRING).orElse("line"),
                parsePosition(node),
                node.optional("length", SValueType.FLOAT).orElse(0.0),
                node.optional("name", SValueType.STRING).orElse("~"),
                node.require("number", SValueType.STRING),
                hidden);
    }

    private Symbol parseSymbol(SNode.SList node) {
        Map<String, String> pinUuids = new LinkedHashMap<>();
        for (SNode.SList pin : node.query("pin")) {
            pinUuids.put(
                    pin.requireAt(0, SValueType.STRING, "number"),
                    pin.optional("uuid", SValueType.STRING).orElse(""));
        }
        return new Symbol(
                node.require("lib_id", SValueType.STRING),
                parsePosition(node),
                node.optional("unit", SValueType.INTEGER).orElse(1),
                node.optional("body_style", SValueType.INTEGER)
                        .or(() -> node.optional("convert", SValueType.INTEGER))
                        .orElse(1),
                node.optional("mirror", SValueType.STRING).orElse(null),
                node.optional("in_bom", SValueType.BOOLEAN).orElse(true),
                node.optional("on_board", SValueType.BOOLEAN).orElse(true),
                node.optional("dnp", SValueType.BOOLEAN).orElse(false),
                node.optional("uuid", SValueType.STRING).orElse(null),
                parseProperties(node),
                pinUuids);
    }

    private Wire parseWire(SNode.SList node) {
        List<SNode.SList> xy = node.requireChild("pts").query("xy");
        if (xy.size() < 2) {
            throw new MissingFieldException(node.name(), "xy");
        }
        return new Wire(parsePoint(xy.get(0)), parsePoint(xy.get(1)), node.require("uuid", SValueType.STRING));
    }

    private List<Property> parseProperties(SNode.SList node) {
        List<Property> properties = new ArrayList<>();
        for (SNode.SList property : node.query("property")) {
            properties.add(new Property(
                    property.requireAt(0, SValueType.STRING, "key"),
                    property.requireAt(1, SValueType.STRING, "value"),
                    property.child("at").isPresent() ? parsePosition(property) : null));
        }
        return properties;
    }

    private Position parsePosition(SNode.SList node) {
        SNode.SList at = node.requireChild("at");
        return new Position(
                at.requireAt(0, SValueType.FLOAT, "x"),
                at.requireAt(1, SValueType.FLOAT, "y"),
                at.optionalAt(2, SValueType.FLOAT).orElse(0.0));
    }

    private Point parsePoint(SNode.SList xy) {
        return new Point(
                xy.requireAt(0, SValueType.FLOAT, "x"),
                xy.requireAt(1, SValueType.FLOAT, "y"));
    }
}
