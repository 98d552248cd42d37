package fr.lapetina.analytics.connector.domain.model;

import java.net.URI;
import java.util.Objects;

/**
 * A running ephemeral worker provisioned on a gateway server.
 * Created only once the server reports the query as RUNNING.
 */
public record WorkerDescriptor(
        String tagId,
        QuerySerial serial,
        String workerName,
        String processInfoId,
        Endpoint grpcEndpoint,
        URI ideUrl
) {
    public WorkerDescriptor {
        Objects.requireNonNull(serial, "Serial is required");
        Objects.requireNonNull(grpcEndpoint, "gRPC endpoint is required");
    }
}
