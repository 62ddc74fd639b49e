/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.notifier;

import com.linkedin.drift.detector.AnomalySeverity;
import com.linkedin.drift.detector.DetectionAlgorithm;
import com.linkedin.drift.exception.NotificationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class DiscordNotifierTest {

    @Test
    public void testDiscordAlertWithNoWebhook() throws NotificationException {
        MockDiscordNotifier notifier = new MockDiscordNotifier();
        notifier.configure(Collections.emptyMap());
        assertFalse(notifier.notify(event(DriftEvent.Type.ANOMALY, AnomalySeverity.MEDIUM)));
        assertEquals(0, notifier.getDiscordMessageList().size());
    }

    @Test
    public void testDiscordAlertColoredBySeverity() throws NotificationException {
        MockDiscordNotifier notifier = new MockDiscordNotifier();
        notifier.configure(Map.of(DiscordNotifier.DISCORD_NOTIFIER_WEBHOOK, "http://dummy.discord.webhook",
                                  DiscordNotifier.DISCORD_NOTIFIER_USER, "ops-bot"));
        assertTrue(notifier.notify(event(DriftEvent.Type.ANOMALY, AnomalySeverity.MEDIUM)));
        assertTrue(notifier.notify(event(DriftEvent.Type.ESCALATION, AnomalySeverity.HIGH)));
        assertTrue(notifier.notify(event(DriftEvent.Type.RECOVERY, AnomalySeverity.HIGH)));

        List<DiscordMessage> messages = notifier.getDiscordMessageList();
        assertEquals(3, messages.size());
        assertEquals("ops-bot", messages.get(0).getUsername());
        assertEquals(0xFFFF00, messages.get(0).getEmbeds().get(0).getColor());
        assertEquals(0xFF0000, messages.get(1).getEmbeds().get(0).getColor());
        DiscordMessage.Embed recovery = messages.get(2).getEmbeds().get(0);
        assertEquals(0x2ECC71, recovery.getColor());
        assertEquals("cpu_percent recovered", recovery.getTitle());
        assertEquals("Status", recovery.getFields().get(2).getName());
        assertEquals("Normal", recovery.getFields().get(2).getValue());
    }

    private static DriftEvent event(DriftEvent.Type type, AnomalySeverity severity) {
        return new DriftEvent(type, "cpu_percent", 90.0, 55.0, DetectionAlgorithm.CUMULATIVE, severity, 4, 0L);
    }

    private static class MockDiscordNotifier extends DiscordNotifier {
        private final List<DiscordMessage> _discordMessageList = new ArrayList<>();

        @Override
        protected boolean sendDiscordMessage(DiscordMessage discordMessage, String discordWebhookUrl) {
            _discordMessageList.add(discordMessage);
            return true;
        }

        List<DiscordMessage> getDiscordMessageList() {
            return _discordMessageList;
        }
    }
}
