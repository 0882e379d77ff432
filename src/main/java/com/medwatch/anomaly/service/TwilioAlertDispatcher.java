package com.medwatch.anomaly.service;

import com.medwatch.anomaly.config.MetricsConfig;
import com.medwatch.anomaly.config.TwilioNotificationConfig;
import com.medwatch.anomaly.engine.spi.AlertDispatcher;
import com.medwatch.anomaly.model.Anomaly;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Sends anomaly alerts to the supply-chain duty desk by SMS or WhatsApp.
 * Delivery runs on the async executor; failures are logged and counted, never returned to the batch.
 */
@Service
public class TwilioAlertDispatcher implements AlertDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TwilioAlertDispatcher.class);

    private final TwilioNotificationConfig config;
    private final MetricsConfig metricsConfig;

    public TwilioAlertDispatcher(TwilioNotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio alert dispatcher initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Twilio alert dispatcher is DISABLED. Alerts will only be logged.");
        }
    }

    @Async
    @Override
    @Observed(name = "alert.send", contextualName = "send-alert")
    public void sendAlert(Anomaly anomaly) {
        if (!config.isEnabled()) {
            log.info("Alert (not sent, Twilio disabled) for anomaly {}: {}",
                    anomaly.getAnomalyId(), anomaly.getMessage());
            metricsConfig.recordAlert(getChannel(), "skipped");
            return;
        }

        try {
            Message message = Message.creator(
                    new PhoneNumber(resolveNumber(config.getToNumber())),
                    new PhoneNumber(resolveNumber(config.getFromNumber())),
                    buildMessageBody(anomaly)
            ).create();

            metricsConfig.recordAlert(getChannel(), "success");
            log.info("Twilio alert sent for anomaly={}, sid={}", anomaly.getAnomalyId(), message.getSid());
        } catch (Exception e) {
            metricsConfig.recordAlert(getChannel(), "error");
            log.error("Failed to send Twilio alert for anomaly={}: {}", anomaly.getAnomalyId(), e.getMessage(), e);
        }
    }

    @Override
    public String getChannel() {
        return config.getChannel();
    }

    String buildMessageBody(Anomaly anomaly) {
        return String.format(
                "[MEDWATCH ALERT] %s anomaly\n" +
                "Medicine: %s\n" +
                "Disease: %s\n" +
                "%s\n" +
                "Confidence: %.2f (%s)",
                anomaly.getSeverity().toUpperCase(),
                anomaly.getMedicineDataId(),
                anomaly.getDisease() != null ? anomaly.getDisease() : "N/A",
                anomaly.getMessage(),
                anomaly.getConfidence(),
                anomaly.getDetectionType()
        );
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
