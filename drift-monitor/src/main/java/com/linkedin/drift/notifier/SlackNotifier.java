/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.notifier;

import com.linkedin.drift.exception.NotificationException;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.drift.DriftUtils.utcDateFor;

/**
 * Posts drift events to a Slack channel through an incoming webhook.
 */
public class SlackNotifier implements MetricNotifier {

    private static final Logger LOG = LoggerFactory.getLogger(SlackNotifier.class);
    public static final String SLACK_NOTIFIER_WEBHOOK = "slack.notifier.webhook";
    public static final String SLACK_NOTIFIER_ICON = "slack.notifier.icon";
    public static final String SLACK_NOTIFIER_USER = "slack.notifier.user";
    public static final String SLACK_NOTIFIER_CHANNEL = "slack.notifier.channel";

    public static final String DEFAULT_SLACK_NOTIFIER_ICON = ":chart_with_upwards_trend:";
    public static final String DEFAULT_SLACK_NOTIFIER_USER = "Drift Monitor";

    protected String _slackWebhook;
    protected String _slackIcon;
    protected String _slackChannel;
    protected String _slackUser;

    @Override
    public void configure(Map<String, ?> config) {
        _slackWebhook = (String) config.get(SLACK_NOTIFIER_WEBHOOK);
        _slackIcon = (String) config.get(SLACK_NOTIFIER_ICON);
        _slackChannel = (String) config.get(SLACK_NOTIFIER_CHANNEL);
        _slackUser = (String) config.get(SLACK_NOTIFIER_USER);
        _slackIcon = _slackIcon == null ? DEFAULT_SLACK_NOTIFIER_ICON : _slackIcon;
        _slackUser = _slackUser == null ? DEFAULT_SLACK_NOTIFIER_USER : _slackUser;
    }

    @Override
    public boolean notify(DriftEvent event) throws NotificationException {
        if (_slackWebhook == null) {
            LOG.warn("Slack webhook is null, can't send Slack drift notification");
            return false;
        }

        if (_slackChannel == null) {
            LOG.warn("Slack channel name is null, can't send Slack drift notification");
            return false;
        }

        String text = String.format("%s.%nValue: %.2f, score: %.2f (%s), severity: %s, duration: %d checks, time: %s",
                                    NotifierUtils.headline(event), event.value(), event.score(), event.algorithm(),
                                    event.severity(), event.duration(), utcDateFor(event.timestampMs()));
        try {
            return sendSlackMessage(new SlackMessage(_slackUser, text, _slackIcon, _slackChannel), _slackWebhook);
        } catch (IOException e) {
            throw new NotificationException("ERROR sending alert to Slack", e);
        }
    }

    protected boolean sendSlackMessage(SlackMessage slackMessage, String slackWebhookUrl) throws IOException {
        return NotifierUtils.isSuccess(NotifierUtils.sendMessage(slackMessage.toString(), slackWebhookUrl));
    }
}
