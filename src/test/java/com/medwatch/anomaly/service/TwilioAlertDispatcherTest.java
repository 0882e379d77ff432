package com.medwatch.anomaly.service;

import com.medwatch.anomaly.config.MetricsConfig;
import com.medwatch.anomaly.config.TwilioNotificationConfig;
import com.medwatch.anomaly.model.Anomaly;
import com.medwatch.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class TwilioAlertDispatcherTest {

    @Mock private MetricsConfig metricsConfig;

    private TwilioNotificationConfig config;
    private TwilioAlertDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        config = new TwilioNotificationConfig();
        config.setEnabled(false);
        config.setChannel("whatsapp");
        dispatcher = new TwilioAlertDispatcher(config, metricsConfig);
        dispatcher.init();
    }

    @Test
    void sendAlert_disabled_onlyLogsAndCounts() {
        dispatcher.sendAlert(TestDataFactory.createAnomaly("A-1", 0.9));

        verify(metricsConfig).recordAlert("whatsapp", "skipped");
    }

    @Test
    void buildMessageBody_summarizesAnomaly() {
        Anomaly anomaly = TestDataFactory.createAnomaly("A-1", 0.9);

        String body = dispatcher.buildMessageBody(anomaly);

        assertThat(body)
                .startsWith("[MEDWATCH ALERT] HIGH anomaly")
                .contains("Medicine: MED-0001")
                .contains("Disease: Bacterial infection")
                .contains("below the critical threshold")
                .contains("Confidence: 0.90 (rule-based)");
    }

    @Test
    void buildMessageBody_missingDisease_showsPlaceholder() {
        Anomaly anomaly = TestDataFactory.createAnomaly("A-1", 0.75);
        anomaly.setDisease(null);

        assertThat(dispatcher.buildMessageBody(anomaly)).contains("Disease: N/A");
    }
}
