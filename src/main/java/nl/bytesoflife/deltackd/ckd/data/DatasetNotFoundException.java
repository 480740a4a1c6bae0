package nl.bytesoflife.deltackd.ckd.data;

public class DatasetNotFoundException extends DatasetException {

    private final String path;

    public DatasetNotFoundException(String path) {
        super("Dataset not found: " + path);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
