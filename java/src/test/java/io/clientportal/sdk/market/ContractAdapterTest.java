package io.clientportal.sdk.market;

import io.clientportal.sdk.ClientPortalException;
import io.clientportal.sdk.GatewayStub;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class ContractAdapterTest {

    private GatewayStub gateway;
    private ContractAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        gateway = new GatewayStub();
        adapter = new ContractAdapter(GatewayStub.ALWAYS_LIVE, gateway.transport());
    }

    @AfterEach
    void tearDown() {
        gateway.close();
    }

    @Test
    void prefersNasdaqOrSmartListing() throws Exception {
        gateway.on("GET", "/iserver/secdef/search",
            "[{'conid':38708077,'symbol':'AAPL','description':'MEXI','companyName':'APPLE INC'},"
                + "{'conid':265598,'symbol':'AAPL','description':'NASDAQ','companyName':'APPLE INC'}]");

        Contract contract = adapter.search(" aapl ");

        assertEquals(265598L, contract.conid());
        assertEquals("NASDAQ", contract.exchange());
        assertEquals("APPLE INC", contract.companyName());
        assertEquals("symbol=AAPL&secType=STK", gateway.last("GET", "/iserver/secdef/search").query());
    }

    @Test
    void fallsBackToFirstMatch() throws Exception {
        gateway.on("GET", "/iserver/secdef/search", "[{'conid':'12087792','symbol':'EUR'}]");

        Contract contract = adapter.search("EUR", "CASH");

        assertEquals(12087792L, contract.conid());
        assertEquals("UNKNOWN", contract.exchange());
    }

    @Test
    void noMatchIsAnError() {
        gateway.on("GET", "/iserver/secdef/search", "{}");

        ClientPortalException ex = assertThrows(ClientPortalException.class, () -> adapter.search("ZZZZ"));
        assertTrue(ex.getMessage().contains("ZZZZ"));
    }
}
