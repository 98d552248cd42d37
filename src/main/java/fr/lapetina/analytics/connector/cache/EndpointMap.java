package fr.lapetina.analytics.connector.cache;

import fr.lapetina.analytics.connector.domain.model.Endpoint;

/**
 * {@link KeyedStore} keyed by server endpoints, compared by their origin string.
 *
 * @param <V> value type
 */
public class EndpointMap<V> extends KeyedStore<Endpoint, V> {

    @Override
    protected String serializeKey(Endpoint key) {
        return key.toString();
    }

    @Override
    protected Endpoint deserializeKey(String serialized) {
        return Endpoint.parse(serialized);
    }
}
