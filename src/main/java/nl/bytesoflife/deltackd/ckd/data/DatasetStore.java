package nl.bytesoflife.deltackd.ckd.data;

/**
 * Source of labeled datasets addressed by logical path, e.g. {@code ckd/bin_sets/10nm}.
 */
public interface DatasetStore {

    /**
     * Opens the dataset stored under {@code logicalPath}. The caller owns the returned handle
     * and must close it.
     *
     * @throws DatasetNotFoundException if nothing is stored under that path
     */
    LabeledDataset open(String logicalPath);
}
