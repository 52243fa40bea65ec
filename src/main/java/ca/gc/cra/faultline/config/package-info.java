/**
 * Configuration loading and application wiring.
 *
 * <p>{@link ca.gc.cra.faultline.config.YamlConfigLoader} flattens YAML into dotted keys,
 * {@link ca.gc.cra.faultline.config.ClientConfig#fromMap(java.util.Map)} validates them, and
 * {@link ca.gc.cra.faultline.config.CompositionRoot} builds the running client.</p>
 */
package ca.gc.cra.faultline.config;
