package fr.lapetina.analytics.connector.worker;

/**
 * Query defaults published by a gateway.
 *
 * @param pqDefaultHeap default heap for a persistent query, in gigabytes
 */
public record QueryConstants(double pqDefaultHeap) {
}
