package fr.lapetina.analytics.connector.worker;

import fr.lapetina.analytics.connector.domain.model.Endpoint;

import java.util.concurrent.CompletableFuture;

/**
 * Performs the interactive login for a gateway and stores the resulting
 * {@link GatewayClient} in the shared authenticated-client store.
 *
 * The future completes once the login flow is over, whether or not it produced a client.
 */
@FunctionalInterface
public interface CredentialProvider {

    CompletableFuture<Void> provision(Endpoint endpoint, boolean operateAsAnotherUser);
}
