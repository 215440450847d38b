/**
 * Subprocess plumbing shared by the log-stream reader and the AppleScript runner.
 */
package com.phillippitts.messagebridge.service.process;
