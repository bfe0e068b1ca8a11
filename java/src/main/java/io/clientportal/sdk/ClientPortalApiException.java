package io.clientportal.sdk;

/**
 * Exception representing a non-2xx response from the gateway. Callers can inspect both the HTTP status and,
 * when the gateway supplied one, its error code.
 */
public class ClientPortalApiException extends ClientPortalException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String code;

    public ClientPortalApiException(int statusCode, String code, String message) {
        super(message == null || message.isBlank() ? defaultMessage(statusCode, code) : message);
        this.statusCode = statusCode;
        this.code = code;
    }

    /**
     * @return HTTP status code returned by the gateway.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return gateway-specific error code (nullable when the response body did not include one).
     */
    public String getCode() {
        return code;
    }

    private static String defaultMessage(int status, String code) {
        if (code == null || code.isBlank()) {
            return "Gateway request failed with status " + status;
        }
        return "Gateway request failed with status " + status + " (" + code + ")";
    }
}
