package fun.fengwk.stay.core.facade.listing;

/**
 * Transient failure of a provider call, counted by the breaker and retried.
 *
 * @author fengwk
 */
public class ListingProviderException extends RuntimeException {

    private final int statusCode;

    public ListingProviderException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ListingProviderException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    /**
     * HTTP status, 0 when the request did not complete.
     */
    public int getStatusCode() {
        return statusCode;
    }

}
