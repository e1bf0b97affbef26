package tech.flowcatalyst.directory.client;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.flowcatalyst.directory.client.resources.Applications;

/**
 * Main client for the directory API.
 *
 * <p>Example usage:
 * <pre>{@code
 * @Inject
 * DirectoryClient client;
 *
 * // Create an application and make a user its owner
 * var app = client.applications().create(Application.named("billing")).value();
 * client.applications().addOwners(app.id(), List.of(DirectoryObjectRef.of(userId)));
 * }</pre>
 */
@ApplicationScoped
public class DirectoryClient {

    private final Applications applications;

    @Inject
    public DirectoryClient(DirectoryHttpClient httpClient) {
        this.applications = new Applications(httpClient);
    }

    /**
     * Get the Applications resource.
     */
    public Applications applications() {
        return applications;
    }
}
