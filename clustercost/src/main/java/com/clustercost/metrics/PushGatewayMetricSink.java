/*
 * Click nbfs://nbhost/SystemFileSystem/Templates/Licenses/license-default.txt to change this license
 * Click nbfs://nbhost/SystemFileSystem/Templates/Classes/Class.java to edit this template
 */
package com.clustercost.metrics;

/**
 *
 * @author rachanakeshav
 */
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Gauge;
import io.prometheus.client.exporter.PushGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.URL;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pushes each value as a single gauge to a Pushgateway job URL
 * (e.g. {@code http://127.0.0.1:9091/metrics/job/cost}).
 */
public class PushGatewayMetricSink implements MetricSink {

  private static final Logger log = LoggerFactory.getLogger(PushGatewayMetricSink.class);

  static final String JOB_PATH = "/metrics/job/";
  static final String DEFAULT_JOB = "cost";

  // Where a push URL points: gateway base, job and any grouping labels after the job
  record Target(URL gateway, String job, Map<String, String> groupingKey) {
  }

  private final Target target;
  private final PushGateway gateway;

  public PushGatewayMetricSink(String url, Duration timeout) {
    this.target = parseTarget(url);
    this.gateway = new PushGateway(target.gateway());
    int millis = (int) timeout.toMillis();
    gateway.setConnectionFactory(u -> {
      HttpURLConnection conn = (HttpURLConnection) new URL(u).openConnection();
      conn.setConnectTimeout(millis);
      conn.setReadTimeout(millis);
      return conn;
    });
  }

  static Target parseTarget(String url) {
    try {
      int at = url.indexOf(JOB_PATH);
      if (at < 0) {
        return new Target(new URL(stripSlash(url)), DEFAULT_JOB, Map.of());
      }
      String[] rest = url.substring(at + JOB_PATH.length()).split("/");
      if (rest.length == 0 || rest[0].isEmpty()) {
        throw new IllegalArgumentException("push url has no job name: " + url);
      }
      Map<String, String> grouping = new LinkedHashMap<>();
      for (int i = 1; i + 1 < rest.length; i += 2) {
        grouping.put(rest[i], rest[i + 1]);
      }
      return new Target(new URL(url.substring(0, at)), rest[0], grouping);
    } catch (MalformedURLException e) {
      throw new IllegalArgumentException("bad push url " + url + ": " + e.getMessage(), e);
    }
  }

  private static String stripSlash(String s) {
    return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
  }

  @Override
  public void emit(String name, double value) {
    CollectorRegistry registry = new CollectorRegistry();
    Gauge.build()
        .name(name)
        .help("Cluster cost metric " + name)
        .register(registry)
        .set(value);
    try {
      if (target.groupingKey().isEmpty()) {
        gateway.pushAdd(registry, target.job());
      } else {
        gateway.pushAdd(registry, target.job(), target.groupingKey());
      }
      log.debug("Pushed {}={}", name, value);
    } catch (IOException e) {
      log.warn("Metric push {} failed: {}", name, e.toString());
    }
  }
}
