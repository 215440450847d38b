package com.phillippitts.messagebridge.service.watcher;

import com.phillippitts.messagebridge.exception.EventStreamException;

/** Acquires the external event source from scratch; there is no seek or resume. */
public interface EventStreamReader {

    /**
     * @return a fresh stream positioned at "now"
     * @throws EventStreamException if the source cannot be started
     */
    EventStream open();
}
