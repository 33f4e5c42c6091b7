package org.rostilos.reviewpilot.vcsclient.gitlab.actions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Request plumbing shared by the GitLab actions.
 */
final class GitLabRequests {

    private static final Logger log = LoggerFactory.getLogger(GitLabRequests.class);
    static final MediaType JSON = MediaType.parse("application/json");
    static final ObjectMapper objectMapper = new ObjectMapper();

    private GitLabRequests() {
    }

    static Request get(String apiUrl) {
        return new Request.Builder()
                .url(apiUrl)
                .header("Accept", "application/json")
                .get()
                .build();
    }

    static Request post(String apiUrl, Map<String, ?> payload) throws IOException {
        return new Request.Builder()
                .url(apiUrl)
                .header("Accept", "application/json")
                .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                .build();
    }

    static Request put(String apiUrl, Map<String, ?> payload) throws IOException {
        return new Request.Builder()
                .url(apiUrl)
                .header("Accept", "application/json")
                .put(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                .build();
    }

    /**
     * Execute a request and parse the JSON body.
     *
     * @throws IOException on transport failure or a non-2xx status
     */
    static JsonNode executeForJson(OkHttpClient client, Request req, String emptyBody) throws IOException {
        try (Response resp = client.newCall(req).execute()) {
            ensureSuccess(resp, req.url().toString());
            String responseBody = resp.body() != null ? resp.body().string() : emptyBody;
            return objectMapper.readTree(responseBody.isBlank() ? emptyBody : responseBody);
        }
    }

    static void ensureSuccess(Response resp, String apiUrl) throws IOException {
        if (!resp.isSuccessful()) {
            String body = resp.body() != null ? resp.body().string() : "";
            String msg = String.format("GitLab returned non-success response %d for URL %s: %s",
                    resp.code(), apiUrl, body);
            log.warn(msg);
            throw new IOException(msg);
        }
    }

    /**
     * Fetch every page of a JSON array endpoint. {@code baseUrl} must not carry a query string.
     * Stops on an empty page, on the {@code X-Total-Pages} header, or on a short page when the
     * header is absent.
     */
    static List<JsonNode> fetchAllPages(OkHttpClient client, String baseUrl, int perPage) throws IOException {
        List<JsonNode> items = new ArrayList<>();
        int page = 1;
        boolean hasMore = true;

        while (hasMore) {
            String apiUrl = String.format("%s?page=%d&per_page=%d", baseUrl, page, perPage);
            try (Response resp = client.newCall(get(apiUrl)).execute()) {
                ensureSuccess(resp, apiUrl);
                String responseBody = resp.body() != null ? resp.body().string() : "[]";
                JsonNode array = objectMapper.readTree(responseBody.isBlank() ? "[]" : responseBody);

                if (!array.isArray() || array.isEmpty()) {
                    hasMore = false;
                } else {
                    array.forEach(items::add);
                    String totalPages = resp.header("X-Total-Pages");
                    if (totalPages != null && !totalPages.isBlank()) {
                        hasMore = page < Integer.parseInt(totalPages.trim());
                    } else {
                        hasMore = array.size() >= perPage;
                    }
                    page++;
                }
            }
        }
        return items;
    }
}
