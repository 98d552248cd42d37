package fr.lapetina.analytics.connector.domain.model;

/**
 * Capabilities advertised by a gateway server. Fetched once per endpoint, best effort.
 *
 * @param createQueryUi             the server offers a UI-driven query creation flow
 * @param embedDashboardsAndWidgets the server can embed result widgets by query serial
 */
public record FeatureFlags(boolean createQueryUi, boolean embedDashboardsAndWidgets) {

    /** Used when the server advertises nothing or the fetch failed. */
    public static final FeatureFlags NONE = new FeatureFlags(false, false);
}
