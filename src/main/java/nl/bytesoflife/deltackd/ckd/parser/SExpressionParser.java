package nl.bytesoflife.deltackd.ckd.parser;

import nl.bytesoflife.deltackd.ckd.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Reader for the S-expression text used by bin set definition files and spectral
 * configuration. {@code #} starts a comment running to the end of the line.
 */
public class SExpressionParser {

    private String input;
    private int pos;

    public List<SNode> parse(String text) {
        this.input = text;
        this.pos = 0;
        List<SNode> nodes = new ArrayList<>();
        while (pos < input.length()) {
            skipWhitespaceAndComments();
            if (pos >= input.length()) break;
            nodes.add(parseNode());
        }
        return nodes;
    }

    private SNode parseNode() {
        char c = input.charAt(pos);
        if (c == '(') {
            return parseList();
        } else if (c == '"') {
            return parseQuotedString();
        } else if (c == ')') {
            throw new ParseException("Unexpected ')' at position " + pos, pos);
        }
        return parseAtom();
    }

    private SNode.SList parseList() {
        expect('(');
        List<SNode> children = new ArrayList<>();
        while (pos < input.length()) {
            skipWhitespaceAndComments();
            if (pos >= input.length()) {
                throw new ParseException("Unexpected end of input, expected ')'", pos);
            }
            if (input.charAt(pos) == ')') {
                pos++;
                return new SNode.SList(children);
            }
            children.add(parseNode());
        }
        throw new ParseException("Unexpected end of input, expected ')'", pos);
    }

    private SNode.SAtom parseQuotedString() {
        expect('"');
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '"') {
                pos++;
                return new SNode.SAtom(sb.toString());
            }
            if (c == '\\' && pos + 1 < input.length()) {
                pos++;
                sb.append(input.charAt(pos));
            } else {
                sb.append(c);
            }
            pos++;
        }
        throw new ParseException("Unterminated quoted string", pos);
    }

    private SNode.SAtom parseAtom() {
        int start = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '(' || c == ')' || c == '"' || c == '#' || Character.isWhitespace(c)) {
                break;
            }
            pos++;
        }
        if (pos == start) {
            throw new ParseException("Expected atom at position " + pos, pos);
        }
        return new SNode.SAtom(input.substring(start, pos));
    }

    private void skipWhitespaceAndComments() {
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '#') {
                while (pos < input.length() && input.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                break;
            }
        }
    }

    private void expect(char expected) {
        if (pos >= input.length() || input.charAt(pos) != expected) {
            throw new ParseException("Expected '" + expected + "' at position " + pos, pos);
        }
        pos++;
    }

    public static class ParseException extends ConfigurationException {
        private final int position;

        public ParseException(String message, int position) {
            super(message);
            this.position = position;
        }

        public int getPosition() {
            return position;
        }
    }
}
