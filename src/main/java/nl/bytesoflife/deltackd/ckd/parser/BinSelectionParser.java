package nl.bytesoflife.deltackd.ckd.parser;

import nl.bytesoflife.deltackd.ckd.ConfigurationException;
import nl.bytesoflife.deltackd.ckd.model.Wavelength;
import nl.bytesoflife.deltackd.ckd.select.BinFilters;
import nl.bytesoflife.deltackd.ckd.select.BinSelector;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads bin selection specs written as S-expressions:
 * <pre>
 * 550                                   # bin id, quoted or not
 * (all)
 * (ids 550 560 570)
 * (interval (wmin 500nm) (wmax 0.6um) (endpoints false))
 * </pre>
 * Specs are checked while parsing, so a reversed interval or an unknown filter fails here.
 */
public class BinSelectionParser {

    public List<BinSelector> parse(String text) {
        List<SNode> nodes = new SExpressionParser().parse(text);
        List<BinSelector> selectors = new ArrayList<>(nodes.size());
        for (SNode node : nodes) {
            selectors.add(toSelector(node));
        }
        return selectors;
    }

    public BinSelector toSelector(SNode node) {
        if (node instanceof SNode.SAtom atom) {
            return BinSelector.id(atom.value());
        }

        SNode.SList list = (SNode.SList) node;
        String type = list.tag();
        if (type.isEmpty()) {
            throw new ConfigurationException("bin selector must start with a filter type: " + list);
        }

        Map<String, Object> kwargs = switch (type) {
            case BinFilters.ALL -> allKwargs(list);
            case BinFilters.IDS -> idsKwargs(list);
            case BinFilters.INTERVAL -> intervalKwargs(list);
            default -> throw new ConfigurationException("unknown bin filter type " + type);
        };

        return BinSelector.type(type, kwargs);
    }

    private Map<String, Object> allKwargs(SNode.SList list) {
        if (!list.arguments().isEmpty()) {
            throw new ConfigurationException("all filter takes no arguments: " + list);
        }
        return Map.of();
    }

    private Map<String, Object> idsKwargs(SNode.SList list) {
        List<String> ids = new ArrayList<>();
        for (SNode arg : list.arguments()) {
            if (!(arg instanceof SNode.SAtom atom)) {
                throw new ConfigurationException("ids filter expects bin ids, got " + arg);
            }
            ids.add(atom.value());
        }
        return Map.of("ids", ids);
    }

    private Map<String, Object> intervalKwargs(SNode.SList list) {
        Map<String, Object> kwargs = new LinkedHashMap<>();
        for (SNode arg : list.arguments()) {
            if (!(arg instanceof SNode.SList entry) || entry.children().size() != 2 || entry.atomAt(1) == null) {
                throw new ConfigurationException("interval filter expects (key value) entries, got " + arg);
            }
            String key = entry.tag();
            String value = entry.atomAt(1);
            switch (key) {
                case "wmin", "wmax" -> kwargs.put(key, Wavelength.parse(value));
                case "endpoints" -> kwargs.put(key, parseBoolean(value));
                default -> kwargs.put(key, value);
            }
        }
        return kwargs;
    }

    private static Boolean parseBoolean(String value) {
        if ("true".equalsIgnoreCase(value)) return Boolean.TRUE;
        if ("false".equalsIgnoreCase(value)) return Boolean.FALSE;
        throw new ConfigurationException("expected true or false, got '" + value + "'");
    }
}
