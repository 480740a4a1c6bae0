package nl.bytesoflife.deltackd.ckd.parser;

import nl.bytesoflife.deltackd.ckd.ConfigurationException;
import nl.bytesoflife.deltackd.ckd.select.BinSelector;
import nl.bytesoflife.deltackd.ckd.spectral.SpectralConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses a CKD spectral configuration:
 * <pre>
 * (spectral
 *   (bin_set 10nm)
 *   (bins "550" (interval (wmin 500nm) (wmax 600nm))))
 * </pre>
 * Without a {@code bins} entry every bin of the bin set is selected.
 */
public class SpectralConfigParser {

    private final BinSelectionParser selectionParser = new BinSelectionParser();

    public SpectralConfig parse(InputStream is) throws IOException {
        return parse(new String(is.readAllBytes(), StandardCharsets.UTF_8));
    }

    public SpectralConfig parse(String content) {
        List<SNode> nodes = new SExpressionParser().parse(content);
        if (nodes.size() != 1 || !(nodes.get(0) instanceof SNode.SList root) || !"spectral".equals(root.tag())) {
            throw new ConfigurationException("expected a single (spectral ...) expression");
        }

        String binSetId = null;
        List<BinSelector> bins = null;

        for (SNode child : root.arguments()) {
            if (!(child instanceof SNode.SList entry)) {
                throw new ConfigurationException("unexpected atom in spectral configuration: " + child);
            }
            switch (entry.tag()) {
                case "bin_set" -> {
                    binSetId = entry.atomAt(1);
                    if (binSetId == null || entry.children().size() != 2) {
                        throw new ConfigurationException("bin_set expects a single identifier: " + entry);
                    }
                }
                case "bins" -> {
                    bins = new ArrayList<>();
                    for (SNode spec : entry.arguments()) {
                        bins.add(selectionParser.toSelector(spec));
                    }
                }
                default -> throw new ConfigurationException("unknown spectral configuration entry " + entry);
            }
        }

        if (binSetId == null) {
            throw new ConfigurationException("spectral configuration is missing bin_set");
        }
        return bins == null ? new SpectralConfig(binSetId) : new SpectralConfig(binSetId, bins);
    }
}
