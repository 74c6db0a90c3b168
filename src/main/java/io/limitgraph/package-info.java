/**
 * LIMIT-Graph governance core.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.limitgraph.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.limitgraph.governance.Orchestrator} flags traces and gates merges.</li>
 *   <li>{@code io.limitgraph.rd.RdComputation} builds the rate-distortion curve and finds its knee.</li>
 *   <li>{@code io.limitgraph.storage.Storage} is the persistence contract behind both.</li>
 * </ul>
 */
package io.limitgraph;
