package nl.bytesoflife.deltackd.ckd.parser;

import nl.bytesoflife.deltackd.ckd.data.DatasetException;
import nl.bytesoflife.deltackd.ckd.data.SimpleLabeledDataset;
import nl.bytesoflife.deltackd.ckd.model.BinSet;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CkdDatasetParserTest {

    private final CkdDatasetParser parser = new CkdDatasetParser();

    private static final String BIN_SET = """
            # test bin set
            (version 1)
            (attr quadrature_type gauss_legendre)
            (attr quadrature_n 4)
            (units wmin nm)
            (units wmax nm)
            (bin "550" 545 555)
            (bin "560" 555 565)
            """;

    @Test
    void parseBinSetDefinition() {
        SimpleLabeledDataset ds = parser.parse("ckd/bin_sets/test", BIN_SET);

        assertEquals("ckd/bin_sets/test", ds.getName());
        assertEquals("1", ds.getAttribute("version"));
        assertEquals("gauss_legendre", ds.getStringAttribute(BinSet.ATTR_QUADRATURE_TYPE));
        assertEquals(4, ds.getIntAttribute(BinSet.ATTR_QUADRATURE_N));
        assertEquals(List.of("550", "560"), ds.getBinIds());
        assertArrayEquals(new double[]{545, 555}, ds.getColumn(BinSet.COLUMN_WMIN).values());
        assertArrayEquals(new double[]{555, 565}, ds.getColumn(BinSet.COLUMN_WMAX).values());
        assertEquals("nm", ds.getColumn(BinSet.COLUMN_WMAX).units());
    }

    @Test
    void parsedDatasetBuildsBinSet() {
        BinSet binSet = BinSet.fromDataset("test", parser.parse("test", BIN_SET));
        assertEquals(2, binSet.size());
        assertEquals(4, binSet.getQuad().size());
    }

    @Test
    void parseFromStream() throws IOException {
        SimpleLabeledDataset ds = parser.parse("test",
                new ByteArrayInputStream(BIN_SET.getBytes(StandardCharsets.UTF_8)));
        assertEquals(2, ds.getBinIds().size());
    }

    @Test
    void aliasDefinitionHasNoColumns() {
        SimpleLabeledDataset ds = parser.parse("alias", "(version 1)\n(attr bin_set 10nm)\n");
        assertTrue(ds.hasAttribute("bin_set"));
        assertEquals("10nm", ds.getStringAttribute("bin_set"));
        assertTrue(ds.getBinIds().isEmpty());
        assertThrows(DatasetException.class, () -> ds.getColumn(BinSet.COLUMN_WMIN));
    }

    @Test
    void columnsWithoutUnitsDeclaration() {
        SimpleLabeledDataset ds = parser.parse("test", "(bin a 1 2)");
        assertNull(ds.getColumn(BinSet.COLUMN_WMIN).units());
    }

    @Test
    void unknownEntriesAreIgnored() {
        SimpleLabeledDataset ds = parser.parse("test", "(history \"created by hand\")\n(bin a 1 2)");
        assertEquals(List.of("a"), ds.getBinIds());
        assertFalse(ds.hasAttribute("history"));
    }

    @Test
    void malformedEntriesFail() {
        assertThrows(DatasetException.class, () -> parser.parse("test", "(bin a 1)"));
        assertThrows(DatasetException.class, () -> parser.parse("test", "(bin a 1 two)"));
        assertThrows(DatasetException.class, () -> parser.parse("test", "(attr quadrature_n)"));
        assertThrows(DatasetException.class, () -> parser.parse("test", "version 1"));
    }

    @Test
    void missingAttributeFails() {
        SimpleLabeledDataset ds = parser.parse("test", "(bin a 1 2)");
        DatasetException e = assertThrows(DatasetException.class,
                () -> ds.getStringAttribute(BinSet.ATTR_QUADRATURE_TYPE));
        assertTrue(e.getMessage().contains("quadrature_type"));
    }

    @Test
    void nonIntegerAttributeFails() {
        SimpleLabeledDataset ds = parser.parse("test", "(attr quadrature_n sixteen)");
        assertThrows(DatasetException.class, () -> ds.getIntAttribute(BinSet.ATTR_QUADRATURE_N));
    }
}
