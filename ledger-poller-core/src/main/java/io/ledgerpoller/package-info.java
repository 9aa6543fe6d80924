/**
 * Root API for the ledger event poller: a dependency-free library that turns a stateless,
 * snapshot-style event query into a stream of newly observed events.
 *
 * <h2>Core Design</h2>
 * <p>A ledger's event-query endpoint keeps no subscription state and returns overlapping
 * windows on repeated calls. The {@linkplain io.ledgerpoller.poller.EventPoller poller} queries
 * it on a fixed cadence, every {@linkplain io.ledgerpoller.EventFilter filter} in
 * parallel, and uses a per-filter {@linkplain io.ledgerpoller.cursor.CursorStore cursor}
 * (an event-time watermark plus a bounded set of recently seen ids) to deliver each
 * {@link io.ledgerpoller.LedgerEvent} at most once while the process lives. Cursor state is
 * never persisted: a restart forgets it.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>ledger-poller-core</b>: model, SPIs, cursor store and poller (zero external deps)</li>
 *   <li><b>ledger-poller-micrometer</b>: optional Micrometer metrics bridge</li>
 *   <li><b>ledger-poller-spring-boot-starter</b>: Spring Boot auto-configuration driven by
 *       {@code ledger-poller.*} properties</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * EventQueryClient client = ...; // adapter over the ledger's RPC endpoint
 *
 * try (EventPoller poller = EventPoller.builder()
 *     .client(client)
 *     .filters(EventFilter.of("MoveEventType", "0x2::coin::CoinEvent"))
 *     .intervalMs(5000)
 *     .onNewEvents(events -> events.forEach(e -> System.out.println(e.id())))
 *     .build()) {
 *   poller.start();
 *   // ...
 * }
 * }</pre>
 *
 * @see io.ledgerpoller.poller.EventPoller
 * @see io.ledgerpoller.cursor.CursorStore
 * @see io.ledgerpoller.spi.EventQueryClient
 */
package io.ledgerpoller;
