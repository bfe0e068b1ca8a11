package io.clientportal.sdk;

import io.clientportal.sdk.market.ContractAdapter;
import io.clientportal.sdk.market.MarketDataAdapter;
import io.clientportal.sdk.portfolio.Account;
import io.clientportal.sdk.portfolio.AccountsAdapter;
import io.clientportal.sdk.portfolio.PnlAdapter;
import io.clientportal.sdk.portfolio.PortfolioAdapter;
import io.clientportal.sdk.scanner.ScannerAdapter;
import io.clientportal.sdk.session.SessionManager;
import io.clientportal.sdk.trading.OrderAdapter;
import io.clientportal.sdk.transport.GatewayTransport;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * <p>
 * Primary entry point for talking to a Client Portal gateway. The client is thread-safe: create a single instance per
 * process and reuse it. The gateway session itself is established out of band (browser login); this client only
 * validates, renews and keeps that session alive.
 * </p>
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>All adapters share one {@link GatewayTransport} and one {@link SessionManager}, so authentication status is
 *       checked at most once per configured interval regardless of how many adapters are in use.</li>
 *   <li>Transient gateway failures are retried with exponential backoff; authentication failures are never retried
 *       at the transport level.</li>
 *   <li>{@link #close()} logs out and stops the keep-alive task.</li>
 * </ul>
 */
public final class ClientPortalClient implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(ClientPortalClient.class.getName());

    private final Config config;
    private final GatewayTransport transport;
    private final SessionManager session;
    private final AccountsAdapter accounts;
    private final PortfolioAdapter portfolio;
    private final PnlAdapter pnl;
    private final MarketDataAdapter marketData;
    private final ContractAdapter contracts;
    private final OrderAdapter orders;
    private final ScannerAdapter scanner;

    private final Object accountLock = new Object();
    private String primaryAccount;

    /**
     * @param config caller-supplied configuration; defaults are applied to a copy, so later builder changes have no
     *               effect on this client.
     */
    public ClientPortalClient(Config config) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        this.transport = new GatewayTransport(this.config);
        this.session = new SessionManager(transport, this.config);
        this.accounts = new AccountsAdapter(session, transport);
        this.portfolio = new PortfolioAdapter(session, transport);
        this.pnl = new PnlAdapter(session, transport);
        this.marketData = new MarketDataAdapter(session, transport);
        this.contracts = new ContractAdapter(session, transport);
        this.orders = new OrderAdapter(session, transport);
        this.scanner = new ScannerAdapter(session, transport);
    }

    /**
     * Builds a client from {@code IB_*} environment variables.
     */
    public static ClientPortalClient fromEnvironment() {
        return new ClientPortalClient(Config.fromEnvironment().build());
    }

    public Config getConfig() {
        return config;
    }

    public SessionManager session() {
        return session;
    }

    public AccountsAdapter accounts() {
        return accounts;
    }

    public PortfolioAdapter portfolio() {
        return portfolio;
    }

    public PnlAdapter pnl() {
        return pnl;
    }

    public MarketDataAdapter marketData() {
        return marketData;
    }

    public ContractAdapter contracts() {
        return contracts;
    }

    public OrderAdapter orders() {
        return orders;
    }

    public ScannerAdapter scanner() {
        return scanner;
    }

    /**
     * Returns the raw authentication status reported by the gateway, or an empty map when no status has been cached.
     */
    public Map<String, Object> sessionInfo() throws ClientPortalException {
        return session.sessionInfo();
    }

    /**
     * Returns the account used when a caller does not name one. Defaults to the first account the gateway lists and is
     * cached after the first lookup.
     *
     * @throws ClientPortalException when the gateway lists no accounts.
     */
    public String primaryAccount() throws ClientPortalException {
        synchronized (accountLock) {
            if (primaryAccount != null) {
                return primaryAccount;
            }
            List<Account> available = accounts.accounts();
            if (available.isEmpty()) {
                throw new ClientPortalException("No accounts found");
            }
            primaryAccount = available.get(0).id();
            LOGGER.info(() -> "[clientportal-sdk] using primary account " + primaryAccount);
            return primaryAccount;
        }
    }

    public void setPrimaryAccount(String accountId) {
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("accountId is required");
        }
        synchronized (accountLock) {
            primaryAccount = accountId;
        }
    }

    @Override
    public void close() {
        session.logout();
    }
}
