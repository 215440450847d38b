package com.phillippitts.messagebridge.service.orchestration;

import com.phillippitts.messagebridge.config.properties.AutoReplyProperties;
import com.phillippitts.messagebridge.domain.CallEvent;
import com.phillippitts.messagebridge.domain.OutboundMessage;
import com.phillippitts.messagebridge.service.delivery.OutboundDeliveryQueue;
import org.springframework.stereotype.Component;

/** Step 3: queue the fixed reply to the configured recipient. Delivery happens later, in order. */
@Component
class AutoReplyAction implements TriggerAction {

    static final String NAME = "auto-reply";
    static final String SOURCE = "auto-reply";

    private final OutboundDeliveryQueue queue;
    private final AutoReplyProperties props;

    AutoReplyAction(OutboundDeliveryQueue queue, AutoReplyProperties props) {
        this.queue = queue;
        this.props = props;
    }

    @Override
    public boolean isEnabled() {
        return props.isEnabled();
    }

    @Override
    public void execute(CallEvent event) {
        queue.enqueue(new OutboundMessage(props.getRecipient(), props.getTemplate()), SOURCE);
    }

    @Override
    public String name() {
        return NAME;
    }
}
