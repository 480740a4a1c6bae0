package nl.bytesoflife.deltackd.ckd.parser;

import nl.bytesoflife.deltackd.ckd.data.DatasetException;
import nl.bytesoflife.deltackd.ckd.data.SimpleLabeledDataset;
import nl.bytesoflife.deltackd.ckd.model.BinSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses bin set definition files into labeled datasets:
 * <pre>
 * (version 1)
 * (attr quadrature_type gauss_legendre)
 * (attr quadrature_n 16)
 * (units wmin nm)
 * (units wmax nm)
 * (bin "550" 545 555)
 * </pre>
 * A file holding only {@code (attr bin_set <id>)} refers to another bin set.
 */
public class CkdDatasetParser {

    private static final Logger log = LoggerFactory.getLogger(CkdDatasetParser.class);

    public SimpleLabeledDataset parse(String name, InputStream is) throws IOException {
        String content = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        return parse(name, content);
    }

    public SimpleLabeledDataset parse(String name, String content) {
        SExpressionParser sexprParser = new SExpressionParser();
        List<SNode> nodes = sexprParser.parse(content);
        return buildDataset(name, nodes);
    }

    private SimpleLabeledDataset buildDataset(String name, List<SNode> nodes) {
        SimpleLabeledDataset.Builder builder = SimpleLabeledDataset.builder(name);
        Map<String, String> units = new LinkedHashMap<>();
        List<String> ids = new ArrayList<>();
        List<Double> wmins = new ArrayList<>();
        List<Double> wmaxs = new ArrayList<>();

        for (SNode node : nodes) {
            if (!(node instanceof SNode.SList list)) {
                throw new DatasetException("Dataset '" + name + "': unexpected top-level atom '" + node + "'");
            }
            switch (list.tag()) {
                case "version" -> builder.attribute("version", require(name, list, 1));
                case "attr" -> builder.attribute(require(name, list, 1), require(name, list, 2));
                case "units" -> units.put(require(name, list, 1), require(name, list, 2));
                case "bin" -> {
                    ids.add(require(name, list, 1));
                    wmins.add(parseNumber(name, list, 2));
                    wmaxs.add(parseNumber(name, list, 3));
                }
                default -> log.warn("Dataset '{}': ignoring unknown entry {}", name, list);
            }
        }

        builder.binIds(ids);
        if (!ids.isEmpty() || units.containsKey(BinSet.COLUMN_WMIN)) {
            builder.column(BinSet.COLUMN_WMIN, toArray(wmins), units.get(BinSet.COLUMN_WMIN));
        }
        if (!ids.isEmpty() || units.containsKey(BinSet.COLUMN_WMAX)) {
            builder.column(BinSet.COLUMN_WMAX, toArray(wmaxs), units.get(BinSet.COLUMN_WMAX));
        }

        log.debug("Parsed dataset '{}': {} bins", name, ids.size());
        return builder.build();
    }

    private static String require(String name, SNode.SList list, int index) {
        String value = list.atomAt(index);
        if (value == null) {
            throw new DatasetException("Dataset '" + name + "': malformed entry " + list);
        }
        return value;
    }

    private static double parseNumber(String name, SNode.SList list, int index) {
        String value = require(name, list, index);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new DatasetException("Dataset '" + name + "': not a number '" + value + "' in " + list, e);
        }
    }

    private static double[] toArray(List<Double> values) {
        double[] result = new double[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = values.get(i);
        }
        return result;
    }
}
