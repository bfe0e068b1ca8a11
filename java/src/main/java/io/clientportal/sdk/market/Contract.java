package io.clientportal.sdk.market;

public record Contract(long conid, String symbol, String exchange, String companyName) {
}
