/**
 * Call relay services.
 *
 * <ul>
 *   <li>{@code connection} - live transport connections and best-effort delivery</li>
 *   <li>{@code call} - call sessions, state machine and audio buffers</li>
 *   <li>{@code audio} - audio ingest and transcription batching</li>
 *   <li>{@code response} - ordered response generation and end-of-call summaries</li>
 *   <li>{@code observer} - per-call observer fan-out</li>
 *   <li>{@code routing} - inbound socket message dispatch</li>
 *   <li>{@code capability} - external capability seams and the timeout-bounded invoker</li>
 *   <li>{@code command} - operator commands to devices</li>
 *   <li>{@code notify} - chat-channel notifications</li>
 *   <li>{@code metrics} - Micrometer instrumentation</li>
 * </ul>
 */
package com.phillippitts.callrelay.service;
