/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.drift.notifier;

import com.linkedin.drift.detector.AnomalySeverity;
import com.linkedin.drift.detector.DetectionAlgorithm;
import java.util.concurrent.TimeUnit;
import org.apache.http.client.config.RequestConfig;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;


/**
 * Unit test for {@link NotifierUtils}.
 */
public class NotifierUtilsTest {

  private static DriftEvent event(DriftEvent.Type type, AnomalySeverity severity) {
    return new DriftEvent(type, "cpu_percent", 90.0, 55.0, DetectionAlgorithm.CUMULATIVE, severity, 3, 0L);
  }

  @Test
  public void testWebhookCallsAreBounded() {
    RequestConfig config = NotifierUtils.WEBHOOK_REQUEST_CONFIG;
    int tenSeconds = (int) TimeUnit.SECONDS.toMillis(10);
    assertEquals(tenSeconds, config.getConnectTimeout());
    assertEquals(tenSeconds, config.getSocketTimeout());
    assertEquals(tenSeconds, config.getConnectionRequestTimeout());
  }

  @Test
  public void testHeadlineAndColor() {
    DriftEvent anomaly = event(DriftEvent.Type.ANOMALY, AnomalySeverity.MEDIUM);
    assertEquals("Drift detected on cpu_percent", NotifierUtils.headline(anomaly));
    assertEquals(NotifierUtils.ALERT_COLOR_MEDIUM, NotifierUtils.color(anomaly));

    DriftEvent escalation = event(DriftEvent.Type.ESCALATION, AnomalySeverity.HIGH);
    assertEquals("Drift on cpu_percent escalated to high severity", NotifierUtils.headline(escalation));
    assertEquals(NotifierUtils.ALERT_COLOR_HIGH, NotifierUtils.color(escalation));

    // Recoveries keep the last severity but are always shown in the recovery color.
    DriftEvent recovery = event(DriftEvent.Type.RECOVERY, AnomalySeverity.HIGH);
    assertEquals("cpu_percent recovered", NotifierUtils.headline(recovery));
    assertEquals(NotifierUtils.ALERT_COLOR_RECOVERY, NotifierUtils.color(recovery));
  }

  @Test
  public void testIsSuccess() {
    assertTrue(NotifierUtils.isSuccess(200));
    assertTrue(NotifierUtils.isSuccess(204));
    assertFalse(NotifierUtils.isSuccess(302));
    assertFalse(NotifierUtils.isSuccess(500));
  }
}
