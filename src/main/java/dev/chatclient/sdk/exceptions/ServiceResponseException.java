package dev.chatclient.sdk.exceptions;

/**
 * Raised when the service answers with a non-success HTTP status.
 */
public class ServiceResponseException extends ChatClientException {

    private final int status;
    private final String responseBody;

    public ServiceResponseException(int status, String responseBody) {
        super("Service request failed with status " + status
                + (responseBody == null || responseBody.isEmpty() ? "" : ": " + responseBody));
        this.status = status;
        this.responseBody = responseBody;
    }

    public int getStatus() {
        return status;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
