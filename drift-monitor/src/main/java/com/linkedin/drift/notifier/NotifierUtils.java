/*
 * Copyright 2021 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.notifier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class NotifierUtils {

  private static final Logger LOG = LoggerFactory.getLogger(NotifierUtils.class);
  static final String ALERT_COLOR_MEDIUM = "#FFFF00";
  static final String ALERT_COLOR_HIGH = "#FF0000";
  static final String ALERT_COLOR_RECOVERY = "#2ECC71";
  static final int WEBHOOK_TIMEOUT_MS = (int) TimeUnit.SECONDS.toMillis(10);
  // Bounds every phase of a webhook call so that a stalled endpoint cannot block later deliveries.
  static final RequestConfig WEBHOOK_REQUEST_CONFIG = RequestConfig.custom()
                                                                   .setConnectionRequestTimeout(WEBHOOK_TIMEOUT_MS)
                                                                   .setConnectTimeout(WEBHOOK_TIMEOUT_MS)
                                                                   .setSocketTimeout(WEBHOOK_TIMEOUT_MS)
                                                                   .build();

  private NotifierUtils() { }

  /**
   * Send POST message to a specific URL (application/json)
   *
   * @param message The message that will be posted
   * @param postUrl The post URL
   * @return The HTTP status code of the response.
   * @throws IOException In case of issue with the API, including a connect or read timeout.
   */
  public static int sendMessage(String message, String postUrl) throws IOException {
    try (CloseableHttpClient client = HttpClients.custom().setDefaultRequestConfig(WEBHOOK_REQUEST_CONFIG).build()) {
      HttpPost httpPost = new HttpPost(postUrl);
      httpPost.setEntity(new StringEntity(message, ContentType.create("application/json", StandardCharsets.UTF_8)));
      httpPost.setHeader("Accept", "application/json");
      LOG.debug("Sending alert to: {}\nBody:\n{}", httpPost, message);
      try (CloseableHttpResponse httpResponse = client.execute(httpPost)) {
        int statusCode = httpResponse.getStatusLine().getStatusCode();
        // Consume the body so that the connection is released.
        EntityUtils.consume(httpResponse.getEntity());
        LOG.debug("Response status: {}", statusCode);
        return statusCode;
      }
    }
  }

  /**
   * @param statusCode HTTP status code.
   * @return {@code true} if the status code indicates success, {@code false} otherwise.
   */
  static boolean isSuccess(int statusCode) {
    return statusCode >= 200 && statusCode < 300;
  }

  /**
   * @param event The event to describe.
   * @return A one line human readable summary of the event.
   */
  static String headline(DriftEvent event) {
    switch (event.type()) {
      case ANOMALY:
        return String.format("Drift detected on %s", event.metric());
      case ESCALATION:
        return String.format("Drift on %s escalated to high severity", event.metric());
      case RECOVERY:
        return String.format("%s recovered", event.metric());
      default:
        throw new IllegalArgumentException("Unsupported event type " + event.type());
    }
  }

  /**
   * @param event The event to pick a color for.
   * @return The hex RGB color that represents the event.
   */
  static String color(DriftEvent event) {
    if (event.type() == DriftEvent.Type.RECOVERY) {
      return ALERT_COLOR_RECOVERY;
    }
    switch (event.severity()) {
      case HIGH:
        return ALERT_COLOR_HIGH;
      case MEDIUM:
        return ALERT_COLOR_MEDIUM;
      default:
        throw new IllegalArgumentException("Unsupported severity " + event.severity());
    }
  }
}
