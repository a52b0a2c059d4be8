/**
 * Token extraction and command resolution.
 * <p><strong>Role:</strong> Pure functions over the immutable command tree and a transient token list; no I/O.
 * <p><strong>Concurrency:</strong> Stateless; safe for concurrent invocation.
 *
 * @since 0.1.0
 */
package ca.gc.cra.cmdline.application;
