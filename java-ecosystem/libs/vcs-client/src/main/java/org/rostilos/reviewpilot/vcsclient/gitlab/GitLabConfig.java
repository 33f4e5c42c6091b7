package org.rostilos.reviewpilot.vcsclient.gitlab;

import java.net.URI;

/**
 * Configuration constants for GitLab API access.
 */
public final class GitLabConfig {

    public static final String DEFAULT_HOST = "https://gitlab.com";
    public static final String API_PATH = "/api/v4";
    public static final String API_BASE = DEFAULT_HOST + API_PATH;
    public static final int DEFAULT_PAGE_SIZE = 100;

    private GitLabConfig() {
    }

    /**
     * Reduce an account URL (which may include a path such as a group page) to
     * {@code <scheme>://<host>[:port]/api/v4}.
     */
    public static String normalizeApiBase(String hostUrl) {
        return webOrigin(hostUrl) + API_PATH;
    }

    /**
     * Scheme, host and port of an account URL, without trailing slash.
     */
    public static String webOrigin(String hostUrl) {
        if (hostUrl == null || hostUrl.isBlank()) {
            return DEFAULT_HOST;
        }
        URI uri = URI.create(hostUrl.trim());
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new IllegalArgumentException("Invalid GitLab URL: " + hostUrl);
        }
        String port = uri.getPort() > 0 ? ":" + uri.getPort() : "";
        return uri.getScheme() + "://" + uri.getHost() + port;
    }
}
