package nl.bytesoflife.deltakicad.sexp;

import nl.bytesoflife.deltakicad.MalformedDocumentException;
import nl.bytesoflife.deltakicad.MissingFieldException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Element of the document tree: a nested list, a bare value or quoted text.
 */
public sealed interface SNode permits SNode.SList, SNode.SValue, SNode.SText {

    record SValue(String value) implements SNode {
        public SValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toString() {
            return value;
        }
    }

    /**
     * Quoted text in its written form: escapes such as {@code \"} are kept as
     * two characters, so every {@code "} must be escaped and a backslash must
     * be followed by the character it escapes.
     *
     * @throws MalformedDocumentException if the text could not be written back
     */
    record SText(String text) implements SNode {
        public SText {
            Objects.requireNonNull(text, "text");
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c == '\\') {
                    if (++i == text.length()) {
                        throw new MalformedDocumentException("Dangling backslash at end of text: " + text, -1);
                    }
                } else if (c == '"') {
                    throw new MalformedDocumentException("Unescaped quote at offset " + i + " of text: " + text, -1);
                }
            }
        }

        @Override
        public String toString() {
            return "\"" + text + "\"";
        }
    }

    /**
     * A named list. The order of {@code children} follows the positional grammar
     * of the file format and is kept as read.
     */
    record SList(String name, List<SNode> children) implements SNode {

        private static final Logger log = LoggerFactory.getLogger(SList.class);

        public SList {
            Objects.requireNonNull(name, "name");
            children = List.copyOf(children);
        }

        public SList(String name) {
            this(name, List.of());
        }

        /**
         * Immediate child lists named {@code name}, in document order.
         */
        public List<SList> query(String name) {
            return children.stream()
                    .filter(c -> c instanceof SList list && list.name().equals(name))
                    .map(c -> (SList) c)
                    .toList();
        }

        /**
         * All immediate child lists, in document order.
         */
        public List<SList> lists() {
            return children.stream()
                    .filter(c -> c instanceof SList)
                    .map(c -> (SList) c)
                    .toList();
        }

        public Optional<SList> child(String name) {
            for (SNode c : children) {
                if (c instanceof SList list && list.name().equals(name)) {
                    return Optional.of(list);
                }
            }
            return Optional.empty();
        }

        /**
         * The node's own values and texts, in order, without nested lists.
         */
        public List<String> values() {
            List<String> values = new ArrayList<>();
            for (SNode c : children) {
                if (c instanceof SValue v) {
                    values.add(v.value());
                } else if (c instanceof SText t) {
                    values.add(t.text());
                }
            }
            return values;
        }

        /**
         * True if one of the node's own atoms equals {@code flag}, e.g. {@code hide}.
         */
        public boolean hasValue(String flag) {
            return values().contains(flag);
        }

        /**
         * Decodes the first atom of the first child list named {@code name}.
         *
         * @return empty if there is no such child or it has no atom
         * @throws ValueDecodeException if the atom is present but malformed
         */
        public <T> Optional<T> first(String name, SValueType<T> type) {
            Optional<SList> node = child(name);
            if (node.isEmpty()) return Optional.empty();
            List<String> values = node.get().values();
            if (values.isEmpty()) return Optional.empty();
            return Optional.of(decode(name, values.get(0), type));
        }

        /**
         * Decodes the {@code index}-th own atom of this node.
         *
         * @throws ValueDecodeException if the atom is present but malformed
         */
        public <T> Optional<T> get(int index, SValueType<T> type) {
            List<String> values = values();
            if (index < 0 || index >= values.size()) return Optional.empty();
            return Optional.of(decode("#" + index, values.get(index), type));
        }

        /**
         * Like {@link #first} but a malformed value degrades to empty.
         */
        public <T> Optional<T> optional(String name, SValueType<T> type) {
            try {
                return first(name, type);
            } catch (ValueDecodeException e) {
                log.debug("Ignoring optional field: {}", e.getMessage());
                return Optional.empty();
            }
        }

        public <T> Optional<T> optionalAt(int index, SValueType<T> type) {
            try {
                return get(index, type);
            } catch (ValueDecodeException e) {
                log.debug("Ignoring optional value: {}", e.getMessage());
                return Optional.empty();
            }
        }

        /**
         * @throws MissingFieldException if the field is absent or malformed
         */
        public <T> T require(String name, SValueType<T> type) {
            return first(name, type).orElseThrow(() -> new MissingFieldException(this.name, name));
        }

        public <T> T requireAt(int index, SValueType<T> type, String field) {
            List<String> values = values();
            if (index < 0 || index >= values.size()) {
                throw new MissingFieldException(name, field);
            }
            return decode(field, values.get(index), type);
        }

        public SList requireChild(String name) {
            return child(name).orElseThrow(() -> new MissingFieldException(this.name, name));
        }

        private <T> T decode(String field, String raw, SValueType<T> type) {
            try {
                return type.decode(raw);
            } catch (IllegalArgumentException e) {
                throw new ValueDecodeException(name, field, raw, type);
            }
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(").append(name);
            for (SNode child : children) {
                sb.append(' ').append(child);
            }
            sb.append(')');
            return sb.toString();
        }
    }
}
