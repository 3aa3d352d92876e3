/**
 * Configuration loading.
 *
 * <p>This package handles YAML configuration parsing into a validated
 * {@link fr.lapetina.admission.infrastructure.config.AdmissionConfig}.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.admission.infrastructure.config.AdmissionConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.admission.infrastructure.config.ConfigLoader} - YAML loading from file system or classpath</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code cluster} - Rank of this process and cluster size</li>
 *   <li>{@code scheduler} - Capacity, balancing mode and placement strategy</li>
 *   <li>{@code validation} - Beam width limit and serving mode</li>
 *   <li>{@code ingress} - Ring buffer size</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.admission.infrastructure.config.AdmissionConfig
 * @see fr.lapetina.admission.infrastructure.config.ConfigLoader
 */
package fr.lapetina.admission.infrastructure.config;
