/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.notifier;

import com.google.gson.Gson;
import com.google.gson.annotations.SerializedName;
import java.io.Serializable;

public final class SlackMessage implements Serializable {
    private static final long serialVersionUID = 2710947613045274818L;
    private static final Gson GSON = new Gson();
    @SerializedName("username")
    private final String _username;
    @SerializedName("text")
    private final String _text;
    @SerializedName("icon_emoji")
    private final String _iconEmoji;
    @SerializedName("channel")
    private final String _channel;

    public SlackMessage(String username, String text, String iconEmoji, String channel) {
        _username = username;
        _text = text;
        _iconEmoji = iconEmoji;
        _channel = channel;
    }

    public String getUsername() {
        return _username;
    }

    public String getText() {
        return _text;
    }

    public String getIconEmoji() {
        return _iconEmoji;
    }

    public String getChannel() {
        return _channel;
    }

    @Override
    public String toString() {
        return GSON.toJson(this);
    }
}
