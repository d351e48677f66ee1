package fun.fengwk.stay.core.facade.listing.rapidapi;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Raw response from the RapidAPI provider.
 *
 * @author fengwk
 */
@Data
@Builder
public class RapidApiClientResponse {

    private int statusCode;
    private Map<String, List<String>> headers;
    private String body;
    private Throwable error;

    public boolean hasError() {
        return error != null;
    }

    public boolean isSuccessful() {
        return error == null && statusCode >= 200 && statusCode < 300;
    }

}
