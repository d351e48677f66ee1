package fun.fengwk.stay.core.facade.listing.rapidapi;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;

/**
 * RapidAPI listings HTTP client.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RapidApiClient {

    private static final HttpClient HTTP_CLIENT = HttpClient.newBuilder()
        .followRedirects(HttpClient.Redirect.NORMAL)
        .connectTimeout(Duration.ofSeconds(10))
        .build();

    private final RapidApiProperties properties;

    /**
     * Send one search request. Transport failures are reported on the response, interruption of the
     * calling thread is propagated.
     */
    public RapidApiClientResponse search(Map<String, String> params) throws InterruptedException {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                .uri(buildSearchUri(buildQueryString(params)))
                .timeout(Duration.ofMillis(properties.getTimeoutMs()))
                .header("Accept", "application/json")
                .header("User-Agent", properties.getUserAgent())
                .header("X-RapidAPI-Key", StringUtils.defaultString(properties.getApiKey()))
                .header("X-RapidAPI-Host", StringUtils.defaultString(properties.getHost()))
                .GET()
                .build();
        } catch (IllegalArgumentException ex) {
            log.warn("build provider request failed, baseUrl={}, error={}", properties.getBaseUrl(), ex.getMessage());
            return RapidApiClientResponse.builder().error(ex).build();
        }

        try {
            HttpResponse<String> response = HTTP_CLIENT.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            return RapidApiClientResponse.builder()
                .statusCode(response.statusCode())
                .headers(response.headers().map())
                .body(response.body())
                .build();
        } catch (IOException ex) {
            return RapidApiClientResponse.builder().error(ex).build();
        }
    }

    private URI buildSearchUri(String queryString) {
        String baseUrl = StringUtils.isBlank(properties.getBaseUrl())
            ? ""
            : properties.getBaseUrl().trim();
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }

        String path = StringUtils.defaultString(properties.getSearchPath());
        if (StringUtils.isBlank(queryString)) {
            return URI.create(baseUrl + path);
        }
        return URI.create(baseUrl + path + "?" + queryString);
    }

    private String buildQueryString(Map<String, String> params) {
        StringJoiner joiner = new StringJoiner("&");
        if (params == null) {
            return "";
        }
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            String key = URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8);
            String value = URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8);
            joiner.add(key + "=" + value);
        }
        return joiner.toString();
    }

}
