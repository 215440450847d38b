/**
 * Unchecked exception hierarchy rooted at {@link com.phillippitts.messagebridge.exception.MessageBridgeException}.
 *
 * <p>Only {@link com.phillippitts.messagebridge.exception.InvalidMessageException} is ever surfaced
 * to a client; automation and send failures are logged and absorbed where they occur.
 */
package com.phillippitts.messagebridge.exception;
