/*
 * Click nbfs://nbhost/SystemFileSystem/Templates/Licenses/license-default.txt to change this license
 * Click nbfs://nbhost/SystemFileSystem/Templates/Classes/Class.java to edit this template
 */
package com.clustercost;

/**
 *
 * @author rachanakeshav
 */
import java.util.HashMap;
import java.util.Map;

public final class Main {

  // command line flag -> config path it overrides
  static final Map<String, String> FLAGS = Map.of(
      "--region", "clustercost.region",
      "--cluster-config", "clustercost.cluster-config",
      "--push-url", "clustercost.metrics.push-url",
      "--cache", "clustercost.cache.store",
      "--cache-dir", "clustercost.cache.directory",
      "--sinfo", "clustercost.scheduler.sinfo-path"
  );

  public static void main(String[] args) {
    // mvn -pl clustercost exec:java -Dexec.args="--cache memory --push-url http://localhost:9091/metrics/job/cost"
    Map<String, String> cli = parseArgs(args);
    for (var e : cli.entrySet()) {
      String path = FLAGS.get(e.getKey());
      if (path == null) {
        System.err.println("Ignoring unknown option " + e.getKey());
        continue;
      }
      // system properties take precedence over application.conf in ConfigFactory.load()
      if (System.getProperty(path) == null) {
        System.setProperty(path, e.getValue());
      }
    }

    Boot.main(args);
  }

  static Map<String, String> parseArgs(String[] args) {
    Map<String, String> m = new HashMap<>();
    for (int i = 0; i < args.length; i++) {
      String a = args[i];
      if (a.startsWith("--")) {
        String v = (i + 1 < args.length && !args[i + 1].startsWith("--")) ? args[++i] : "true";
        m.put(a, v);
      }
    }
    return m;
  }
}
