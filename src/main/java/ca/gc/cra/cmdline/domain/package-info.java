/**
 * <strong>Purpose:</strong> Domain model for declared commands and flags.
 * <p><strong>Concurrency:</strong> Immutable value types; no shared mutable state.
 * <p><strong>Observability:</strong> Only {@link ca.gc.cra.cmdline.domain.command.Context} logs, at DEBUG, when
 * it drops undeclared flag occurrences.
 *
 * @since 0.1.0
 */
package ca.gc.cra.cmdline.domain;
