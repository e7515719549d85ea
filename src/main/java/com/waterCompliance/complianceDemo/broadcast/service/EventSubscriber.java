package com.waterCompliance.complianceDemo.broadcast.service;

import com.waterCompliance.complianceDemo.broadcast.model.AnalysisEvent;

import java.io.IOException;

/**
 * Receiving end of a session's event stream. Delivery failures cause the hub to drop the subscriber.
 */
public interface EventSubscriber {

    String getSubscriberId();

    void deliver(AnalysisEvent event) throws IOException;
}
