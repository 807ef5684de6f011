package nl.bytesoflife.deltakicad.schema;

import nl.bytesoflife.deltakicad.schema.model.*;
import nl.bytesoflife.deltakicad.sexp.Decimals;
import nl.bytesoflife.deltakicad.sexp.SDocument;
import nl.bytesoflife.deltakicad.sexp.SExpressionBuilder;

import java.util.List;
import java.util.Map;

/**
 * Writes the {@link Schema} model into a new {@code kicad_sch} document tree.
 * Only the fields the model carries are written; {@link SchemaReader} reads the
 * result back into an equal model.
 */
public class SchemaWriter {

    public SDocument write(Schema schema) {
        SExpressionBuilder b = new SExpressionBuilder();
        b.push("kicad_sch");
        if (schema.getVersion() != null) b.push("version").value(schema.getVersion()).end();
        if (schema.getGenerator() != null) b.push("generator").text(schema.getGenerator()).end();
        if (schema.getGeneratorVersion() != null) b.push("generator_version").text(schema.getGeneratorVersion()).end();
        if (schema.getUuid() != null) b.push("uuid").text(schema.getUuid()).end();
        if (schema.getPaper() != null) b.push("paper").text(schema.getPaper()).end();

        b.push("lib_symbols");
        for (LibrarySymbol symbol : schema.getLibrarySymbols()) {
            writeLibrarySymbol(b, symbol);
        }
        b.end();

        for (Junction junction : schema.getJunctions()) {
            b.push("junction");
            writePosition(b, junction.position(), false);
            b.push("diameter").value(Decimals.format(junction.diameter())).end();
            b.push("uuid").text(junction.uuid()).end();
            b.end();
        }
        for (NoConnect noConnect : schema.getNoConnects()) {
            b.push("no_connect");
            writePosition(b, noConnect.position(), false);
            b.push("uuid").text(noConnect.uuid()).end();
            b.end();
        }
        for (Wire wire : schema.getWires()) {
            b.push("wire");
            b.push("pts");
            writePoint(b, wire.start());
            writePoint(b, wire.end());
            b.end();
            b.push("uuid").text(wire.uuid()).end();
            b.end();
        }
        for (LocalLabel label : schema.getLocalLabels()) {
            b.push("label").text(label.text());
            writePosition(b, label.position(), true);
            b.push("uuid").text(label.uuid()).end();
            b.end();
        }
        for (GlobalLabel label : schema.getGlobalLabels()) {
            b.push("global_label").text(label.text());
            if (label.shape() != null) b.push("shape").value(label.shape()).end();
            writePosition(b, label.position(), true);
            b.push("uuid").text(label.uuid()).end();
            b.end();
        }
        for (Symbol symbol : schema.getSymbols()) {
            writeSymbol(b, symbol);
        }

        b.end();
        return b.build();
    }

    private void writeLibrarySymbol(SExpressionBuilder b, LibrarySymbol symbol) {
        b.push("symbol").text(symbol.libId());
        if (symbol.extendsId() != null) b.push("extends").text(symbol.extendsId()).end();
        if (symbol.power()) b.push("power").end();
        b.push("in_bom").value(yesNo(symbol.inBom())).end();
        b.push("on_board").value(yesNo(symbol.onBoard())).end();
        writeProperties(b, symbol.properties());
        for (SymbolUnit unit : symbol.units()) {
            b.push("symbol").text(unit.name());
            for (Pin pin : unit.pins()) {
                b.push("pin").value(pin.electricalType()).value(pin.graphicalStyle());
                writePosition(b, pin.position(), true);
                b.push("length").value(Decimals.format(pin.length())).end();
                if (pin.hidden()) b.push("hide").value("yes").end();
                b.push("name").text(pin.name()).end();
                b.push("number").text(pin.number()).end();
                b.end();
            }
            b.end();
        }
        b.end();
    }

    private void writeSymbol(SExpressionBuilder b, Symbol symbol) {
        b.push("symbol");
        b.push("lib_id").text(symbol.libId()).end();
        writePosition(b, symbol.position(), true);
        if (symbol.mirror() != null) b.push("mirror").value(symbol.mirror()).end();
        b.push("unit").value(Integer.toString(symbol.unit())).end();
        if (symbol.bodyStyle() != 1) b.push("convert").value(Integer.toString(symbol.bodyStyle())).end();
        b.push("in_bom").value(yesNo(symbol.inBom())).end();
        b.push("on_board").value(yesNo(symbol.onBoard())).end();
        b.push("dnp").value(yesNo(symbol.dnp())).end();
        if (symbol.uuid() != null) b.push("uuid").text(symbol.uuid()).end();
        writeProperties(b, symbol.properties());
        for (Map.Entry<String, String> pin : symbol.pinUuids().entrySet()) {
            b.push("pin").text(pin.getKey());
            b.push("uuid").text(pin.getValue()).end();
            b.end();
        }
        b.end();
    }

    private void writeProperties(SExpressionBuilder b, List<Property> properties) {
        for (Property property : properties) {
            b.push("property").text(property.key()).text(property.value());
            if (property.position() != null) writePosition(b, property.position(), true);
            b.end();
        }
    }

    private void writePosition(SExpressionBuilder b, Position position, boolean withAngle) {
        b.push("at").value(Decimals.format(position.x())).value(Decimals.format(position.y()));
        if (withAngle) b.value(Decimals.format(position.angle()));
        b.end();
    }

    private void writePoint(SExpressionBuilder b, Point point) {
        b.push("xy").value(Decimals.format(point.x())).value(Decimals.format(point.y())).end();
    }

    private static String yesNo(boolean value) {
        return value ? "yes" : "no";
    }
}
