/**
 * Configuration record, YAML loading and composition root wiring for HELM.
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 */
package ca.gc.cra.helm.config;
