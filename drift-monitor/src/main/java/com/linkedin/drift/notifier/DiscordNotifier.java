/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.notifier;

import com.linkedin.drift.exception.NotificationException;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.drift.DriftUtils.utcDateFor;

/**
 * Posts drift events to a Discord channel through a webhook, as an embed colored by severity.
 */
public class DiscordNotifier implements MetricNotifier {

    private static final Logger LOG = LoggerFactory.getLogger(DiscordNotifier.class);
    public static final String DISCORD_NOTIFIER_WEBHOOK = "discord.notifier.webhook";
    public static final String DISCORD_NOTIFIER_USER = "discord.notifier.user";
    public static final String DEFAULT_DISCORD_NOTIFIER_USER = "Drift Monitor";

    protected String _discordWebhook;
    protected String _discordUser;

    @Override
    public void configure(Map<String, ?> config) {
        _discordWebhook = (String) config.get(DISCORD_NOTIFIER_WEBHOOK);
        _discordUser = (String) config.get(DISCORD_NOTIFIER_USER);
        _discordUser = _discordUser == null ? DEFAULT_DISCORD_NOTIFIER_USER : _discordUser;
    }

    @Override
    public boolean notify(DriftEvent event) throws NotificationException {
        if (_discordWebhook == null) {
            LOG.warn("Discord webhook is null, can't send Discord drift notification");
            return false;
        }

        DiscordMessage.Embed embed = new DiscordMessage.Embed(NotifierUtils.headline(event), NotifierUtils.color(event),
                                                              utcDateFor(event.timestampMs()));
        embed.addField("Metric", event.metric())
             .addField("Value", String.format("%.2f", event.value()));
        if (event.type() == DriftEvent.Type.RECOVERY) {
            embed.addField("Status", "Normal")
                 .addField("Anomaly Duration", String.format("%d checks", event.duration()));
        } else {
            embed.addField("Severity", event.severity().toString())
                 .addField("Duration", String.format("%d checks", event.duration()))
                 .addField("Algorithm", event.algorithm().name())
                 .addField("Score", String.format("%.2f", event.score()));
        }

        try {
            return sendDiscordMessage(new DiscordMessage(_discordUser, embed), _discordWebhook);
        } catch (IOException e) {
            throw new NotificationException("ERROR sending alert to Discord", e);
        }
    }

    protected boolean sendDiscordMessage(DiscordMessage discordMessage, String discordWebhookUrl) throws IOException {
        return NotifierUtils.isSuccess(NotifierUtils.sendMessage(discordMessage.toString(), discordWebhookUrl));
    }
}
