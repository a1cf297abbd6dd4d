package com.example.jobsync.service.alert;

import com.example.jobsync.config.SlackProperties;
import com.slack.api.Slack;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * {@link Notifier} posting to a Slack incoming webhook.
 * <p>
 * Runs asynchronously so webhook callbacks from the scheduler are never held up by
 * Slack. Delivery failures are logged and dropped.
 */
@Slf4j
@Service
public class SlackAlertService implements Notifier {

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:job-sync}")
    private String applicationName;

    @Autowired
    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    @Async
    @Override
    public void notify(String eventName, String message) {
        if (!slackProperties.canSend()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Event {} not sent: {}", eventName, message);
            return;
        }

        try {
            var payload = Payload.builder()
                    .channel(slackProperties.getChannel())
                    .username(StringUtils.hasText(slackProperties.getUsername()) ? slackProperties.getUsername() : applicationName)
                    .text(message)
                    .build();
            var response = slack.send(slackProperties.getWebhookUrl(), payload);

            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert for {}. Response code: {}, body: {}", eventName, response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for {}", eventName);
            }
        } catch (Exception e) {
            log.error("Error sending Slack alert for {}: {}", eventName, e.getMessage(), e);
        }
    }
}
