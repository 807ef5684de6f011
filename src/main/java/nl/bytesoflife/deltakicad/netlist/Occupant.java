package nl.bytesoflife.deltakicad.netlist;

import nl.bytesoflife.deltakicad.schema.model.GlobalLabel;
import nl.bytesoflife.deltakicad.schema.model.Junction;
import nl.bytesoflife.deltakicad.schema.model.LocalLabel;
import nl.bytesoflife.deltakicad.schema.model.NoConnect;
import nl.bytesoflife.deltakicad.schema.model.Pin;
import nl.bytesoflife.deltakicad.schema.model.Symbol;

/**
 * A schematic primitive anchored at a coordinate of the position index.
 */
public sealed interface Occupant permits Occupant.PinAt, Occupant.LabelAt, Occupant.GlobalLabelAt,
        Occupant.NoConnectAt, Occupant.JunctionAt {

    Coordinate at();

    record PinAt(Coordinate at, Symbol symbol, Pin pin) implements Occupant {
        /** {@code REF_NUMBER}, e.g. {@code R33_2}. */
        public String designator() {
            return symbol.reference() + "_" + pin.number();
        }

        @Override
        public String toString() {
            return "Pin(" + symbol.reference() + ":" + pin.number() + ")";
        }
    }

    record LabelAt(Coordinate at, LocalLabel label) implements Occupant {
        @Override
        public String toString() {
            return "LocalLabel(" + label.text() + ")";
        }
    }

    record GlobalLabelAt(Coordinate at, GlobalLabel label) implements Occupant {
        @Override
        public String toString() {
            return "GlobalLabel(" + label.text() + ")";
        }
    }

    record NoConnectAt(Coordinate at, NoConnect noConnect) implements Occupant {
        @Override
        public String toString() {
            return "NoConnect()";
        }
    }

    record JunctionAt(Coordinate at, Junction junction) implements Occupant {
        @Override
        public String toString() {
            return "Junction()";
        }
    }
}
