/**
 * Console-facing helpers: help rendering, ANSI decoration, and the stdout printer.
 * <p><strong>Role:</strong> Adapter layer between the dispatcher and the terminal; contains no resolution
 * logic.
 * <p><strong>Concurrency:</strong> Stateless or immutable, except for the test writer override in
 * {@link ca.gc.cra.cmdline.api.CliPrinter}.
 */
package ca.gc.cra.cmdline.api;
