/**
 * Application-wide configuration beans and properties.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code bridge.*} properties (watcher, automation, reply, api)</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filter)</li>
 * </ul>
 *
 * @see com.phillippitts.messagebridge.config.BridgeConfig
 */
package com.phillippitts.messagebridge.config;
