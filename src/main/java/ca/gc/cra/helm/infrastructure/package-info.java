/**
 * Infrastructure adapters binding HELM ports to external systems; currently OpenTelemetry metrics.
 */
package ca.gc.cra.helm.infrastructure;
