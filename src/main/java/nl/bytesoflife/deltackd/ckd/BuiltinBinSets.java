package nl.bytesoflife.deltackd.ckd;

import nl.bytesoflife.deltackd.ckd.data.ClasspathDatasetStore;
import nl.bytesoflife.deltackd.ckd.model.BinSet;

/**
 * Provides the bin sets bundled as classpath resources through a process-wide registry.
 */
public class BuiltinBinSets {

    public static final String TEN_NM = "10nm";
    public static final String ONE_NM = "1nm";

    private static volatile BinSetRegistry registry;

    public static BinSetRegistry registry() {
        if (registry == null) {
            synchronized (BuiltinBinSets.class) {
                if (registry == null) {
                    registry = new BinSetRegistry(new ClasspathDatasetStore());
                }
            }
        }
        return registry;
    }

    public static BinSet get(String id) {
        return registry().fromDb(id);
    }

    public static BinSet tenNm() {
        return get(TEN_NM);
    }

    public static BinSet oneNm() {
        return get(ONE_NM);
    }
}
