package in.signalbridge.service.execution;

import in.signalbridge.domain.market.InstrumentSpec;
import in.signalbridge.domain.market.InstrumentType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class InstrumentCatalogTest {

    private final InstrumentCatalog catalog = new InstrumentCatalog();

    @Test
    void testNormalize() {
        assertEquals("EURUSD", InstrumentCatalog.normalize("fx:eurusd"));
        assertEquals("US100", InstrumentCatalog.normalize(" CAPITALCOM:US100 "));
        assertEquals("GBPUSD", InstrumentCatalog.normalize("gbpusd"));
        assertEquals("", InstrumentCatalog.normalize(null));
    }

    @Test
    void testIndexSpec() {
        InstrumentSpec spec = catalog.resolve("us100");

        assertEquals(InstrumentType.INDEX, spec.type());
        assertEquals(0, BigDecimal.ONE.compareTo(spec.pipSize()));
        assertEquals(1, spec.decimals());
        assertEquals(0, new BigDecimal("20").compareTo(spec.minTakeProfitDistance()));
        assertEquals(0, new BigDecimal("0.1").compareTo(spec.minLotSize()));
    }

    @Test
    void testForexSpecs() {
        InstrumentSpec eurusd = catalog.resolve("EURUSD");
        assertEquals(InstrumentType.FOREX, eurusd.type());
        assertEquals(0, new BigDecimal("0.0001").compareTo(eurusd.pipSize()));
        assertEquals(5, eurusd.decimals());
        assertEquals(0, new BigDecimal("10").compareTo(eurusd.minStopLossDistance()));

        InstrumentSpec usdjpy = catalog.resolve("USDJPY");
        assertEquals(0, new BigDecimal("0.01").compareTo(usdjpy.pipSize()), "JPY pairs quote to 2 places per pip");
        assertEquals(3, usdjpy.decimals());
    }

    @Test
    void testUnknownSymbolDefaultsToForex() {
        assertFalse(catalog.isKnown("CADCHF"));

        InstrumentSpec spec = catalog.resolve("oanda:cadchf");

        assertEquals("CADCHF", spec.symbol());
        assertEquals(InstrumentType.FOREX, spec.type());
        assertEquals(0, new BigDecimal("0.0001").compareTo(spec.pipSize()));
        assertTrue(catalog.isKnown("fx:EURJPY"));
        assertTrue(catalog.symbols().contains("GER40"));
    }

    @Test
    void testUnlistedJpyCrossUsesStandardDefaults() {
        assertFalse(catalog.isKnown("CHFJPY"));

        InstrumentSpec spec = catalog.resolve("CHFJPY");

        assertEquals(0, new BigDecimal("0.0001").compareTo(spec.pipSize()), "Unlisted symbols get the standard pip");
        assertEquals(5, spec.decimals());
        assertEquals(0, new BigDecimal("10").compareTo(spec.minTakeProfitDistance()));
    }
}
