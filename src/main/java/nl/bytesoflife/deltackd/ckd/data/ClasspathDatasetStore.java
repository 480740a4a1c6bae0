package nl.bytesoflife.deltackd.ckd.data;

import nl.bytesoflife.deltackd.ckd.parser.CkdDatasetParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * {@link DatasetStore} reading bin set definition files bundled as classpath resources:
 * logical path {@code ckd/bin_sets/10nm} maps to resource {@code /ckd/bin_sets/10nm.ckd}.
 */
public class ClasspathDatasetStore implements DatasetStore {

    private static final Logger log = LoggerFactory.getLogger(ClasspathDatasetStore.class);

    public static final String EXTENSION = ".ckd";

    private final String root;
    private final CkdDatasetParser parser = new CkdDatasetParser();

    public ClasspathDatasetStore() {
        this("");
    }

    /**
     * @param root resource directory prepended to every logical path, e.g. {@code testdata}
     */
    public ClasspathDatasetStore(String root) {
        String trimmed = root.replaceAll("^/+|/+$", "");
        this.root = trimmed.isEmpty() ? "/" : "/" + trimmed + "/";
    }

    String resourceName(String logicalPath) {
        return root + logicalPath + EXTENSION;
    }

    @Override
    public LabeledDataset open(String logicalPath) {
        String resource = resourceName(logicalPath);
        log.debug("Opening dataset resource {}", resource);
        try (InputStream is = ClasspathDatasetStore.class.getResourceAsStream(resource)) {
            if (is == null) {
                throw new DatasetNotFoundException(logicalPath);
            }
            return parser.parse(logicalPath, is);
        } catch (IOException e) {
            throw new DatasetException("Failed to read dataset resource " + resource, e);
        }
    }
}
