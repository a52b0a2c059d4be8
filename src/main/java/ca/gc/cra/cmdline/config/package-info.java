/**
 * Dispatch policy and YAML loading.
 * <p><strong>Concurrency:</strong> Loaders are stateless; {@link ca.gc.cra.cmdline.config.DispatchConfig} is
 * immutable.
 *
 * @since 0.1.0
 */
package ca.gc.cra.cmdline.config;
