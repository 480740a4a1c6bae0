package nl.bytesoflife.deltackd.ckd.spectral;

public enum SpectralMode {
    MONOCHROMATIC("monochromatic"),
    CKD("ckd");

    private final String id;

    SpectralMode(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
