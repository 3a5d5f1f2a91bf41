package com.confidentialpayroll.infrastructure.audit;

import com.confidentialpayroll.domain.model.ProtocolEvent;

/**
 * Append-only sink for emitted protocol events.
 *
 * <p>Called inside the state transition that produced the event; a failure to record
 * fails the transition.
 */
public interface ProtocolEventRecorder {

    void record(ProtocolEvent event);
}
