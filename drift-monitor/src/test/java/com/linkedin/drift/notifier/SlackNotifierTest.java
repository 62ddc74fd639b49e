/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.notifier;

import com.linkedin.drift.detector.AnomalySeverity;
import com.linkedin.drift.detector.DetectionAlgorithm;
import com.linkedin.drift.exception.NotificationException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SlackNotifierTest {
    private static final DriftEvent EVENT = new DriftEvent(DriftEvent.Type.ANOMALY, "cpu_percent", 90.0, 55.0,
                                                           DetectionAlgorithm.CUMULATIVE, AnomalySeverity.HIGH, 3, 0L);

    @Test
    public void testSlackAlertWithNoWebhook() throws NotificationException {
        MockSlackNotifier notifier = new MockSlackNotifier();
        notifier.configure(Map.of(SlackNotifier.SLACK_NOTIFIER_CHANNEL, "#dummy-channel"));
        assertFalse(notifier.notify(EVENT));
        assertEquals(0, notifier.getSlackMessageList().size());
    }

    @Test
    public void testSlackAlertWithNoChannel() throws NotificationException {
        MockSlackNotifier notifier = new MockSlackNotifier();
        notifier.configure(Map.of(SlackNotifier.SLACK_NOTIFIER_WEBHOOK, "http://dummy.slack.webhook"));
        assertFalse(notifier.notify(EVENT));
        assertEquals(0, notifier.getSlackMessageList().size());
    }

    @Test
    public void testSlackAlertWithDefaultOptions() throws NotificationException {
        MockSlackNotifier notifier = new MockSlackNotifier();
        notifier.configure(Map.of(SlackNotifier.SLACK_NOTIFIER_WEBHOOK, "http://dummy.slack.webhook",
                                  SlackNotifier.SLACK_NOTIFIER_CHANNEL, "#dummy-channel"));
        assertTrue(notifier.notify(EVENT));
        assertEquals(1, notifier.getSlackMessageList().size());
        SlackMessage message = notifier.getSlackMessageList().get(0);
        assertEquals("#dummy-channel", message.getChannel());
        assertEquals(SlackNotifier.DEFAULT_SLACK_NOTIFIER_USER, message.getUsername());
        assertEquals(SlackNotifier.DEFAULT_SLACK_NOTIFIER_ICON, message.getIconEmoji());
        assertTrue(message.getText().startsWith("Drift detected on cpu_percent"));
        assertTrue(message.toString().contains("\"channel\":\"#dummy-channel\""));
    }

    @Test
    public void testSlackDeliveryFailure() {
        SlackNotifier notifier = new SlackNotifier() {
            @Override
            protected boolean sendSlackMessage(SlackMessage slackMessage, String slackWebhookUrl) throws IOException {
                throw new IOException("Connection refused");
            }
        };
        notifier.configure(Map.of(SlackNotifier.SLACK_NOTIFIER_WEBHOOK, "http://dummy.slack.webhook",
                                  SlackNotifier.SLACK_NOTIFIER_CHANNEL, "#dummy-channel"));
        try {
            notifier.notify(EVENT);
            fail("Should have thrown NotificationException");
        } catch (NotificationException e) {
            assertTrue(e.getCause() instanceof IOException);
        }
    }

    private static class MockSlackNotifier extends SlackNotifier {
        private final List<SlackMessage> _slackMessageList = new ArrayList<>();

        @Override
        protected boolean sendSlackMessage(SlackMessage slackMessage, String slackWebhookUrl) {
            _slackMessageList.add(slackMessage);
            return true;
        }

        List<SlackMessage> getSlackMessageList() {
            return _slackMessageList;
        }
    }
}
