/**
 * Application layer for HELM: the controller/receiver contract and the pieces built on it.
 * <p><strong>Role:</strong> Hosts the ports, the group aggregators in {@code control}, session players in
 * {@code session} and command-driven entities in {@code entity}.</p>
 * <p><strong>Concurrency:</strong> Update passes are synchronous and run on the caller's thread.</p>
 * <p><strong>Metrics:</strong> Emits namespaces {@code multireceiver.*} and {@code session.*}.</p>
 */
package ca.gc.cra.helm.application;
