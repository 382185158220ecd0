/**
 * Value types shared across HELM layers: session ids and outbound messages.
 * <p><strong>Concurrency:</strong> Records are immutable; safe to share across threads.</p>
 */
package ca.gc.cra.helm.domain;
