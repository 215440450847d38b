/**
 * Core value types: {@link com.phillippitts.messagebridge.domain.OutboundMessage} and
 * {@link com.phillippitts.messagebridge.domain.CallEvent}.
 */
package com.phillippitts.messagebridge.domain;
