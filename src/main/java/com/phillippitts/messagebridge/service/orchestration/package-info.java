/**
 * Action sequence run for each incoming call that passes the cooldown.
 */
package com.phillippitts.messagebridge.service.orchestration;
