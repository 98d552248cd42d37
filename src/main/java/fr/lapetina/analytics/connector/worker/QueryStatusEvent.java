package fr.lapetina.analytics.connector.worker;

import fr.lapetina.analytics.connector.domain.model.QuerySerial;
import fr.lapetina.analytics.connector.domain.model.QueryStatus;

import java.util.Objects;

/**
 * A status update pushed by the gateway for one query.
 *
 * The designated worker fields are only filled once a worker has been assigned,
 * which is always the case for RUNNING updates of healthy queries.
 */
public record QueryStatusEvent(
        QuerySerial serial,
        QueryStatus status,
        String workerName,
        String processInfoId,
        String grpcUrl,
        String ideUrl
) {
    public QueryStatusEvent {
        Objects.requireNonNull(serial, "Serial is required");
        status = status == null ? QueryStatus.UNKNOWN : status;
    }

    public static QueryStatusEvent of(QuerySerial serial, QueryStatus status) {
        return new QueryStatusEvent(serial, status, null, null, null, null);
    }

    public boolean hasDesignatedWorker() {
        return grpcUrl != null && !grpcUrl.isBlank();
    }
}
