/**
 * Placement strategies for requests without a usable target rank.
 *
 * <p>A strategy receives the unhinted requests of a tick, plus the relaxed requests whose
 * preferred rank was full, and spreads them over the ranks that still have room.
 *
 * <h2>Available Strategies</h2>
 * <table border="1">
 *   <tr><th>Strategy</th><th>Description</th><th>Best For</th></tr>
 *   <tr><td>{@code least-loaded}</td><td>Arrival order, least loaded rank first</td><td>Default</td></tr>
 *   <tr><td>{@code longest-prompt-first}</td><td>Longest prompts placed first</td><td>Highly variable prompt lengths</td></tr>
 * </table>
 *
 * <h2>Custom Strategies</h2>
 * <p>Implement {@link fr.lapetina.admission.domain.strategy.PlacementStrategy} and register it
 * with a {@link fr.lapetina.admission.domain.strategy.PlacementStrategyRegistry} before the
 * controller is built.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * PlacementStrategyRegistry registry = PlacementStrategyRegistry.withDefaults();
 * PlacementStrategy strategy = registry.get("least-loaded");
 * }</pre>
 *
 * @see fr.lapetina.admission.domain.strategy.PlacementStrategy
 * @see fr.lapetina.admission.domain.strategy.PlacementStrategyRegistry
 */
package fr.lapetina.admission.domain.strategy;
