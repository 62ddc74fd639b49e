/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.notifier;

import com.google.gson.Gson;
import com.google.gson.annotations.SerializedName;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Discord webhook payload with a single embed: https://discord.com/developers/docs/resources/webhook#execute-webhook
 */
public final class DiscordMessage implements Serializable {
    private static final long serialVersionUID = -3419702236184927312L;
    private static final Gson GSON = new Gson();
    @SerializedName("username")
    private final String _username;
    @SerializedName("embeds")
    private final List<Embed> _embeds;

    public DiscordMessage(String username, Embed embed) {
        _username = username;
        _embeds = Collections.singletonList(embed);
    }

    public String getUsername() {
        return _username;
    }

    public List<Embed> getEmbeds() {
        return _embeds;
    }

    @Override
    public String toString() {
        return GSON.toJson(this);
    }

    public static final class Embed implements Serializable {
        private static final long serialVersionUID = 6075383532151874451L;
        @SerializedName("title")
        private final String _title;
        @SerializedName("color")
        private final int _color;
        @SerializedName("timestamp")
        private final String _timestamp;
        @SerializedName("fields")
        private final List<Field> _fields;

        /**
         * @param title Title of the embed.
         * @param color Hex RGB color such as {@code #FF0000}.
         * @param timestamp ISO 8601 timestamp of the embed.
         */
        public Embed(String title, String color, String timestamp) {
            _title = title;
            _color = Integer.parseInt(color.substring(1), 16);
            _timestamp = timestamp;
            _fields = new ArrayList<>();
        }

        /**
         * Add an inline field.
         *
         * @param name Name of the field.
         * @param value Value of the field.
         * @return This embed.
         */
        public Embed addField(String name, String value) {
            _fields.add(new Field(name, value));
            return this;
        }

        public String getTitle() {
            return _title;
        }

        public int getColor() {
            return _color;
        }

        public String getTimestamp() {
            return _timestamp;
        }

        public List<Field> getFields() {
            return Collections.unmodifiableList(_fields);
        }
    }

    public static final class Field implements Serializable {
        private static final long serialVersionUID = -8821150327620937461L;
        @SerializedName("name")
        private final String _name;
        @SerializedName("value")
        private final String _value;
        @SerializedName("inline")
        private final boolean _inline;

        Field(String name, String value) {
            _name = name;
            _value = value;
            _inline = true;
        }

        public String getName() {
            return _name;
        }

        public String getValue() {
            return _value;
        }
    }
}
