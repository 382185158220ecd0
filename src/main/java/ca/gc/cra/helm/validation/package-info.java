/**
 * <strong>Purpose:</strong> Validation helpers for names, tokens and session ids.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.helm.validation;
