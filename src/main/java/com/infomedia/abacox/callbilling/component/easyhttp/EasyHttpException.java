package com.infomedia.abacox.callbilling.component.easyhttp;

/**
 * HTTP and network errors raised by EasyHttp.
 */
public class EasyHttpException extends RuntimeException {
    private final int statusCode;
    private final String responseBody;

    /**
     * HTTP errors (e.g., 404, 500) that include a response body.
     */
    public EasyHttpException(String message, int statusCode, String responseBody) {
        super(message);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    /**
     * Network or parsing errors.
     */
    public EasyHttpException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1; // Indicates a non-HTTP error
        this.responseBody = null;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    public boolean isServerError() {
        return statusCode >= 500;
    }

    public boolean isNetworkError() {
        return statusCode < 0;
    }

    @Override
    public String getMessage() {
        if (statusCode > 0) {
            return String.format("HTTP Error: %d %s Response: %s", statusCode, super.getMessage(), responseBody);
        }
        return super.getMessage();
    }
}
