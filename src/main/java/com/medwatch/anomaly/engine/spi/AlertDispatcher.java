package com.medwatch.anomaly.engine.spi;

import com.medwatch.anomaly.exception.AlertDispatchException;
import com.medwatch.anomaly.model.Anomaly;

public interface AlertDispatcher {

    /**
     * Deliver a notification for an anomaly that cleared the alert threshold.
     *
     * @throws AlertDispatchException if the alert cannot be handed to the transport
     */
    void sendAlert(Anomaly anomaly);

    /**
     * Channel name used to tag alert metrics, e.g. {@code sms} or {@code whatsapp}.
     */
    String getChannel();
}
