package org.carball.cinebot.tool;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.cinebot.config.AgentSettings;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * OMDb API client (http://www.omdbapi.com/) over java.net.http. Every failure, including OMDb's
 * own {@code "Response":"False"} answers, is raised as an {@link ExternalLookupException}.
 */
@Slf4j
public class HttpOmdbClient implements MovieInfoLookup {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;

    public HttpOmdbClient(String baseUrl, String apiKey, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), baseUrl, apiKey, timeout);
    }

    HttpOmdbClient(HttpClient httpClient, String baseUrl, String apiKey, Duration timeout) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.timeout = timeout;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public static HttpOmdbClient fromSettings(AgentSettings settings) {
        return new HttpOmdbClient(settings.getOmdbUrl(), settings.getOmdbApiKey(),
                Duration.ofSeconds(settings.getOmdbTimeoutSeconds()));
    }

    @Override
    public OmdbMovie lookup(String title, boolean fullPlot) {
        String body = fullPlot
                ? get(Map.of("t", title, "plot", "full"))
                : get(Map.of("t", title));
        return parseMovie(body);
    }

    @Override
    public List<OmdbSearchHit> search(String keyword) {
        return parseSearch(get(Map.of("s", keyword)));
    }

    OmdbMovie parseMovie(String body) {
        JsonNode root = readChecked(body);
        return objectMapper.convertValue(root, OmdbMovie.class);
    }

    List<OmdbSearchHit> parseSearch(String body) {
        JsonNode root = readChecked(body);
        JsonNode hits = root.path("Search");
        if (!hits.isArray()) {
            throw new ExternalLookupException("OMDb search response has no results list");
        }
        return objectMapper.convertValue(hits, new TypeReference<List<OmdbSearchHit>>() { });
    }

    private String get(Map<String, String> parameters) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ExternalLookupException("OMDb API key is not configured. Set OMDB_API_KEY.");
        }

        String query = parameters.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
        URI uri = URI.create(baseUrl + "?" + query + "&apikey=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8));
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        log.debug("OMDb request: {}", parameters);
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new ExternalLookupException("OMDb returned HTTP " + response.statusCode());
            }
            return response.body();
        } catch (IOException e) {
            throw new ExternalLookupException("OMDb request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalLookupException("OMDb request interrupted", e);
        }
    }

    private JsonNode readChecked(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new ExternalLookupException("Malformed OMDb response: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ExternalLookupException("Malformed OMDb response: expected a JSON object");
        }
        if ("False".equalsIgnoreCase(root.path("Response").asText())) {
            throw new ExternalLookupException("OMDb: " + root.path("Error").asText("not found"));
        }
        return root;
    }
}
