package io.clientportal.sdk.scanner;

import com.fasterxml.jackson.databind.JsonNode;
import io.clientportal.sdk.ClientPortalException;
import io.clientportal.sdk.internal.Json;
import io.clientportal.sdk.internal.Numbers;
import io.clientportal.sdk.session.SessionGuard;
import io.clientportal.sdk.transport.GatewayTransport;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * <p>
 * Market scanners.
 * </p>
 *
 * <p>
 * The scanner parameter catalogue is large and static for the lifetime of a gateway session, so it is fetched once and
 * kept in memory.
 * </p>
 */
public final class ScannerAdapter {

    public static final String TOP_PERC_GAIN = "TOP_PERC_GAIN";
    public static final String TOP_PERC_LOSE = "TOP_PERC_LOSE";
    public static final String MOST_ACTIVE = "MOST_ACTIVE";
    public static final String MOST_ACTIVE_USD = "MOST_ACTIVE_USD";
    public static final String HOT_BY_VOLUME = "HOT_BY_VOLUME";
    public static final String TOP_TRADE_COUNT = "TOP_TRADE_COUNT";
    public static final String HIGH_OPT_VOLUME_PUT_CALL_RATIO = "HIGH_OPT_VOLUME_PUT_CALL_RATIO";

    private static final Logger LOGGER = Logger.getLogger(ScannerAdapter.class.getName());

    private final SessionGuard session;
    private final GatewayTransport transport;
    private final ReentrantLock paramsLock = new ReentrantLock();
    private volatile JsonNode cachedParams;

    public ScannerAdapter(SessionGuard session, GatewayTransport transport) {
        this.session = Objects.requireNonNull(session, "session");
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    /**
     * Returns the raw scanner parameter catalogue, loading it on first use.
     */
    public Map<String, Object> scannerParams() throws ClientPortalException {
        return Json.toMap(params());
    }

    public List<String> availableScanCodes() throws ClientPortalException {
        List<String> codes = new ArrayList<>();
        for (JsonNode scanType : params().path("scan_type_list")) {
            String code = Json.text(scanType, "code", null);
            if (code != null) {
                codes.add(code);
            }
        }
        return codes;
    }

    public List<String> availableLocations() throws ClientPortalException {
        List<String> locations = new ArrayList<>();
        for (JsonNode group : params().path("location_tree")) {
            for (JsonNode location : group.path("locations")) {
                String type = Json.text(location, "type", null);
                if (type != null) {
                    locations.add(type);
                }
            }
        }
        return locations;
    }

    /**
     * Runs a scan. Results without a contract id are skipped.
     */
    public List<ScanResult> runScan(ScanRequest request) throws ClientPortalException {
        Objects.requireNonNull(request, "request");
        session.ensureLive();

        ScanPayload payload = new ScanPayload(
            request.getInstrument(),
            request.getLocation(),
            request.getType(),
            request.getSize(),
            request.getFilters()
        );
        JsonNode data = transport.post("/iserver/scanner/run", payload);
        LOGGER.fine(() -> "[clientportal-sdk] scan results: " + data);

        JsonNode contracts = data.isArray() ? data : data.path("contracts");
        List<ScanResult> results = new ArrayList<>();
        for (JsonNode node : contracts) {
            Long conid = node.isObject() ? Numbers.integer(Json.firstPresent(node, "con_id", "conid")) : null;
            if (conid == null) {
                LOGGER.warning(() -> "[clientportal-sdk] skipping scan result without conid: " + node);
                continue;
            }
            results.add(new ScanResult(
                conid,
                Json.text(node, "symbol", ""),
                Json.text(node, "contract_description_1", Json.text(node, "contractDesc", "")),
                Json.text(node, "sec_type", Json.text(node, "secType", "")),
                Json.text(node, "listing_exchange", Json.text(node, "exchange", null)),
                Json.text(node, "currency", null),
                Numbers.decimal(node.get("price")),
                Numbers.decimal(node.get("change")),
                Numbers.decimal(node.get("changePercent")),
                Numbers.integer(node.get("volume")),
                Numbers.decimal(node.get("marketCap")),
                Numbers.decimal(node.get("pe")),
                Numbers.decimal(node.get("dividend"))
            ));
        }
        LOGGER.info(() -> String.format(Locale.ROOT, "[clientportal-sdk] scan '%s' returned %d results",
            request.getType(), results.size()));
        return results;
    }

    public List<ScanResult> topGainers(int maxResults, String location) throws ClientPortalException {
        return preset(TOP_PERC_GAIN, maxResults, location);
    }

    public List<ScanResult> topLosers(int maxResults, String location) throws ClientPortalException {
        return preset(TOP_PERC_LOSE, maxResults, location);
    }

    public List<ScanResult> mostActive(int maxResults, String location) throws ClientPortalException {
        return preset(MOST_ACTIVE, maxResults, location);
    }

    public List<ScanResult> mostActiveUsd(int maxResults, String location) throws ClientPortalException {
        return preset(MOST_ACTIVE_USD, maxResults, location);
    }

    public List<ScanResult> hotByVolume(int maxResults, String location) throws ClientPortalException {
        return preset(HOT_BY_VOLUME, maxResults, location);
    }

    public List<ScanResult> topTradeCount(int maxResults, String location) throws ClientPortalException {
        return preset(TOP_TRADE_COUNT, maxResults, location);
    }

    public List<ScanResult> highOptionVolumePutCallRatio(int maxResults, String location) throws ClientPortalException {
        return preset(HIGH_OPT_VOLUME_PUT_CALL_RATIO, maxResults, location);
    }

    /**
     * Runs {@code scanType} with the given filters.
     *
     * @param filters {@code code}/{@code value} pairs; may be null.
     * @param location scan location, {@link ScanRequest#DEFAULT_LOCATION} when null.
     */
    public List<ScanResult> customScan(String scanType, List<Map<String, Object>> filters, int maxResults, String location)
        throws ClientPortalException {
        return runScan(ScanRequest.builder()
            .type(scanType)
            .filters(filters)
            .size(maxResults)
            .location(location == null ? ScanRequest.DEFAULT_LOCATION : location)
            .build());
    }

    private List<ScanResult> preset(String scanType, int maxResults, String location) throws ClientPortalException {
        return customScan(scanType, null, maxResults, location);
    }

    private JsonNode params() throws ClientPortalException {
        session.ensureLive();
        JsonNode current = cachedParams;
        if (current != null) {
            return current;
        }
        paramsLock.lock();
        try {
            if (cachedParams == null) {
                JsonNode data = transport.get("/iserver/scanner/params");
                LOGGER.fine(() -> "[clientportal-sdk] loaded scanner params");
                cachedParams = data;
            }
            return cachedParams;
        } finally {
            paramsLock.unlock();
        }
    }

    private record ScanPayload(String instrument, String location, String type, int size, List<Map<String, Object>> filter) {
    }
}
