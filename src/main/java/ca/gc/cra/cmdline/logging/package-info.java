/**
 * <strong>Purpose:</strong> Runtime logging level control for the dispatch library.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.cmdline.logging;
