/**
 * YAML configuration loading.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code lookup} - Concurrency ceiling and per-operation timeout</li>
 *   <li>{@code rdap} - Bootstrap registry URL and fetch timeout</li>
 *   <li>{@code whois} - Port and extra TLD to server entries</li>
 *   <li>{@code output} - Text or JSON rendering, verbosity</li>
 *   <li>{@code metrics} - Meter name prefix and JVM binders</li>
 * </ul>
 *
 * @see fr.lapetina.domainlookup.infrastructure.config.LookupConfig
 */
package fr.lapetina.domainlookup.infrastructure.config;
