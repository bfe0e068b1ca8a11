package io.clientportal.sdk.portfolio;

import io.clientportal.sdk.GatewayStub;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PortfolioAdapterTest {

    private GatewayStub gateway;
    private PortfolioAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        gateway = new GatewayStub();
        adapter = new PortfolioAdapter(GatewayStub.ALWAYS_LIVE, gateway.transport());
    }

    @AfterEach
    void tearDown() {
        gateway.close();
    }

    @Test
    void parsesPositionsAndSkipsIncompleteEntries() throws Exception {
        gateway.on("GET", "/portfolio/U1/positions/0",
            "[{'acctId':'U1','conid':265598,'contractDesc':'AAPL','position':10,'mktPrice':'C190.5',"
                + "'mktValue':1905,'currency':'USD','avgCost':150.25,'unrealizedPnl':'1,000.50','assetClass':'STK'},"
                + "{'conid':null,'position':5},"
                + "{'conid':8314,'contractDesc':'IBM'}]");

        List<Position> positions = adapter.positions("U1", 0);

        assertEquals(1, positions.size());
        Position aapl = positions.get(0);
        assertEquals(265598L, aapl.conid());
        assertEquals("AAPL", aapl.contractDescription());
        assertEquals(0, new BigDecimal("10").compareTo(aapl.position()));
        assertEquals(0, new BigDecimal("190.5").compareTo(aapl.marketPrice()));
        assertEquals(0, new BigDecimal("1000.50").compareTo(aapl.unrealizedPnl()));
        assertEquals("STK", aapl.assetClass());
        assertNull(aapl.strike());
    }

    @Test
    void walksPagesUntilEmpty() throws Exception {
        gateway.on("GET", "/portfolio/U1/positions/0", "[{'conid':1,'position':1}]");
        gateway.on("GET", "/portfolio/U1/positions/1", "[{'conid':2,'position':2}]");
        gateway.on("GET", "/portfolio/U1/positions/2", "[]");

        List<Position> positions = adapter.allPositions("U1");

        assertEquals(List.of(1L, 2L), positions.stream().map(Position::conid).collect(Collectors.toList()));
        assertEquals(3, gateway.requests().size());
    }

    @Test
    void unwrapsSummaryValues() throws Exception {
        gateway.on("GET", "/portfolio/U1/summary",
            "{'accountcode':{'value':'U1'},'accounttype':{'value':'INDIVIDUAL'},"
                + "'netliquidation':{'amount':100000.5,'currency':'USD'},"
                + "'buyingpower':{'amount':400000},'cushion':{'amount':0.45},"
                + "'daytradesremaining':{'amount':3},'nlvandmargininreview':{'value':'false'}}");

        AccountSummary summary = adapter.summary("U1");

        assertEquals("U1", summary.accountCode());
        assertEquals("INDIVIDUAL", summary.accountType());
        assertEquals(0, new BigDecimal("100000.5").compareTo(summary.netLiquidation()));
        assertEquals(0, new BigDecimal("400000").compareTo(summary.buyingPower()));
        assertEquals(3, summary.dayTradesRemaining());
        assertEquals(Boolean.FALSE, summary.marginInReview());
        assertNull(summary.availableFunds());
        assertTrue(summary.raw().containsKey("cushion"));
    }

    @Test
    void readsLedgerKeyedByCurrency() throws Exception {
        gateway.on("GET", "/portfolio/U1/ledger",
            "{'USD':{'currency':'USD','acctcode':'U1','cashbalance':1000,'settledcash':900},"
                + "'BASE':{'cashbalance':1500.25,'timestamp':1700000000}}");

        List<LedgerLine> ledger = adapter.ledger("U1");

        assertEquals(2, ledger.size());
        assertEquals("USD", ledger.get(0).currency());
        assertEquals("U1", ledger.get(0).accountCode());
        assertEquals(0, new BigDecimal("900").compareTo(ledger.get(0).settledCash()));
        assertEquals("BASE", ledger.get(1).currency());
        assertEquals(1700000000L, ledger.get(1).timestamp());
    }

    @Test
    void acceptsSingleLedgerLine() throws Exception {
        gateway.on("GET", "/portfolio/U1/ledger", "{'currency':'EUR','cashbalance':12}");

        List<LedgerLine> ledger = adapter.ledger("U1");

        assertEquals(1, ledger.size());
        assertEquals("EUR", ledger.get(0).currency());
    }

    @Test
    void rejectsNegativePage() {
        assertThrows(IllegalArgumentException.class, () -> adapter.positions("U1", -1));
    }
}
