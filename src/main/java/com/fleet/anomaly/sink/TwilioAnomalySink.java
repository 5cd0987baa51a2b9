package com.fleet.anomaly.sink;

import com.fleet.anomaly.config.TwilioNotificationConfig;
import com.fleet.anomaly.model.Anomaly;
import com.fleet.anomaly.model.Severity;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sends an SMS or WhatsApp alert for critical anomalies. Warnings are ignored.
 */
@Component
public class TwilioAnomalySink implements AnomalySink {

    private static final Logger log = LoggerFactory.getLogger(TwilioAnomalySink.class);

    private final TwilioNotificationConfig config;

    public TwilioAnomalySink(TwilioNotificationConfig config) {
        this.config = config;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio anomaly alerts initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Twilio anomaly alerts are DISABLED.");
        }
    }

    @Override
    public String getName() {
        return "twilio";
    }

    @Override
    public void write(Anomaly anomaly) {
        if (!config.isEnabled() || anomaly.getSeverity() != Severity.CRITICAL) {
            return;
        }

        Message message = Message.creator(
                new PhoneNumber(resolveNumber(config.getToNumber())),
                new PhoneNumber(resolveNumber(config.getFromNumber())),
                buildMessageBody(anomaly)
        ).create();

        log.info("Twilio alert sent for vehicle={}, anomaly={}, sid={}",
                anomaly.getVehicleId(), anomaly.getAnomalyType().getTag(), message.getSid());
    }

    String buildMessageBody(Anomaly anomaly) {
        return String.format(
                "[VEHICLE ALERT] %s\n" +
                "Vehicle: %s\n" +
                "Message: %s\n" +
                "Geography: %s\n" +
                "Detail: %s",
                anomaly.getAnomalyType().getTag(),
                anomaly.getVehicleId(),
                anomaly.getMessageType().getWireName(),
                anomaly.getGeography().getValue(),
                anomaly.getDetail());
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
