package io.clientportal.sdk.portfolio;

public record Account(String id, String type, String description, boolean covestor) {
}
