/**
 * macOS automation through {@code osascript}.
 *
 * <p>{@link com.phillippitts.messagebridge.service.automation.OsaScriptRunner} is the only place a
 * script process is started. Every run is bounded by {@code bridge.automation.timeout}, so a hung
 * UI script cannot stall the watcher or the delivery worker indefinitely.
 */
package com.phillippitts.messagebridge.service.automation;
