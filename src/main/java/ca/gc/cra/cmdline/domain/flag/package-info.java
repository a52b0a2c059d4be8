/**
 * Flag declarations, raw flag occurrences, and the flag lookup error taxonomy.
 * <p><strong>Concurrency:</strong> All types are immutable and thread-safe.
 *
 * @since 0.1.0
 */
package ca.gc.cra.cmdline.domain.flag;
