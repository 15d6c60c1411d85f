/**
 * Gear Ledger LAN sync source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.gearledger.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.gearledger.server.SyncServer} serves the ledger, the catalog and the event stream.</li>
 *   <li>{@code io.gearledger.storage.ResultStore} is the authoritative persistence layer.</li>
 *   <li>{@code io.gearledger.discovery.ServerBroadcaster} and {@code ServerDiscovery} find servers on the LAN.</li>
 *   <li>{@code io.gearledger.client.SyncApiClient} and {@code SseClient} are the consumer side.</li>
 * </ul>
 */
package io.gearledger;
