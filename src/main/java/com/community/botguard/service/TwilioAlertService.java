package com.community.botguard.service;

import com.community.botguard.config.MetricsConfig;
import com.community.botguard.config.TwilioAlertConfig;
import com.community.botguard.model.PendingApproval;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Out-of-band operator alerts for situations reviewers may never see on the platform:
 * a bot that could not be removed, or a review request nobody received.
 */
@Service
public class TwilioAlertService {

    private static final Logger log = LoggerFactory.getLogger(TwilioAlertService.class);

    private final TwilioAlertConfig config;
    private final MetricsConfig metricsConfig;

    public TwilioAlertService(TwilioAlertConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio operator alerts initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Twilio operator alerts are DISABLED.");
        }
    }

    @Async
    public void alertRemovalFailed(PendingApproval approval, String error) {
        if (!config.isEnabled()) {
            return;
        }
        send(String.format(
                "[BOT GUARD] Removal FAILED\n" +
                "Community: %s\n" +
                "Bot ID: %s\n" +
                "Outcome: %s\n" +
                "Error: %s",
                approval.getCommunityId(), approval.getParticipantId(), approval.getStatus(), error),
                approval.getParticipantId());
    }

    @Async
    public void alertNoReviewersReached(PendingApproval approval) {
        if (!config.isEnabled()) {
            return;
        }
        send(String.format(
                "[BOT GUARD] Review request undelivered\n" +
                "Community: %s\n" +
                "Bot ID: %s\n" +
                "No reviewer received the request; the bot will be removed when the timeout expires.",
                approval.getCommunityId(), approval.getParticipantId()),
                approval.getParticipantId());
    }

    private void send(String body, String participantId) {
        try {
            Message message = Message.creator(
                    new PhoneNumber(resolveNumber(config.getToNumber())),
                    new PhoneNumber(resolveNumber(config.getFromNumber())),
                    body
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Twilio alert sent for participant={}, sid={}", participantId, message.getSid());
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to send Twilio alert for participant={}: {}", participantId, e.getMessage(), e);
        }
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
