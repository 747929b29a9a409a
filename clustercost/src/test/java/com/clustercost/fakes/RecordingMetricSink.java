package com.clustercost.fakes;

import com.clustercost.metrics.MetricSink;

import java.util.LinkedHashMap;
import java.util.Map;

public class RecordingMetricSink implements MetricSink {

    private final Map<String, Double> emitted = new LinkedHashMap<>();

    @Override
    public synchronized void emit(String name, double value) {
        emitted.put(name, value);
    }

    public synchronized Map<String, Double> emitted() {
        return new LinkedHashMap<>(emitted);
    }
}
