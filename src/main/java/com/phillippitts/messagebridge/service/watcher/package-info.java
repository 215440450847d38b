/**
 * Incoming-call detection.
 *
 * <p>Flow per line: {@link com.phillippitts.messagebridge.service.watcher.EventStreamReader} →
 * keyword filter → {@link com.phillippitts.messagebridge.service.watcher.CallIdentityExtractor} →
 * {@link com.phillippitts.messagebridge.service.watcher.CooldownDeduplicator} →
 * {@link com.phillippitts.messagebridge.service.orchestration.CallActionOrchestrator}.
 * Everything runs on the single {@code call-watcher} thread owned by
 * {@link com.phillippitts.messagebridge.service.watcher.CallWatcher}.
 */
package com.phillippitts.messagebridge.service.watcher;
