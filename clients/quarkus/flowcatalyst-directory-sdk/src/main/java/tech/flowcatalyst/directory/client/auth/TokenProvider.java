package tech.flowcatalyst.directory.client.auth;

/**
 * Source of bearer tokens for directory requests.
 */
public interface TokenProvider {

    /**
     * Get a valid access token, fetching a new one if necessary.
     */
    String getAccessToken();

    /**
     * Discard any cached token and fetch a new one. Called after the directory answers 401.
     */
    default String refreshToken() {
        return getAccessToken();
    }
}
