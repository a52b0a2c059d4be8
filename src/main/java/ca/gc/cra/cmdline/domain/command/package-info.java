/**
 * Command tree model: descriptors, the application root, action contracts, and the per-invocation
 * {@link ca.gc.cra.cmdline.domain.command.Context}.
 * <p><strong>Concurrency:</strong> Descriptors are immutable once built and may be shared across dispatches;
 * contexts are created per invocation.
 *
 * @since 0.1.0
 */
package ca.gc.cra.cmdline.domain.command;
