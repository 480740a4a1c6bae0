package nl.bytesoflife.deltackd.ckd.parser;

import java.util.List;

public sealed interface SNode permits SNode.SAtom, SNode.SList {

    record SAtom(String value) implements SNode {
        @Override
        public String toString() {
            return value;
        }
    }

    record SList(List<SNode> children) implements SNode {

        public SList {
            children = List.copyOf(children);
        }

        /**
         * Value of the leading atom, or an empty string for an empty list or a list head.
         */
        public String tag() {
            if (children.isEmpty()) return "";
            return children.get(0) instanceof SAtom atom ? atom.value() : "";
        }

        /**
         * Value of the atom at {@code index}, or null if there is none.
         */
        public String atomAt(int index) {
            if (index >= children.size()) return null;
            return children.get(index) instanceof SAtom atom ? atom.value() : null;
        }

        /**
         * Children after the tag.
         */
        public List<SNode> arguments() {
            return children.isEmpty() ? List.of() : children.subList(1, children.size());
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(children.get(i));
            }
            sb.append(')');
            return sb.toString();
        }
    }
}
