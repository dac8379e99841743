package com.seoanalyzer.core.observability;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** counter / histogram 수집기. 키는 name{label=value,...} (라벨 이름순) */
public final class MetricsCollector {

    /** histogram 요약 */
    public record HistogramSummary(long count, double min, double max, double avg) {}

    private final int maxRecent;
    private final List<Metric> recent = new ArrayList<>();
    private final Map<String, Double> counters = new TreeMap<>();
    private final Map<String, List<Double>> histograms = new TreeMap<>();

    public MetricsCollector() { this(10_000); }

    public MetricsCollector(int maxRecent) {
        this.maxRecent = Math.max(16, maxRecent);
    }

    public synchronized void counter(String name, Map<String, String> labels) {
        counter(name, 1, labels);
    }

    public synchronized void counter(String name, double value, Map<String, String> labels) {
        String key = key(name, labels);
        double v = counters.merge(key, value, Double::sum);
        add(new Metric(name, v, "count", Instant.now(), copy(labels)));
    }

    public synchronized void histogram(String name, double value, Map<String, String> labels) {
        histograms.computeIfAbsent(key(name, labels), k -> new ArrayList<>()).add(value);
        add(new Metric(name, value, "ms", Instant.now(), copy(labels)));
    }

    public synchronized double counterValue(String name, Map<String, String> labels) {
        return counters.getOrDefault(key(name, labels), 0d);
    }

    public synchronized Map<String, Double> counters() { return new LinkedHashMap<>(counters); }

    public synchronized Map<String, HistogramSummary> histograms() {
        Map<String, HistogramSummary> out = new LinkedHashMap<>();
        histograms.forEach((k, v) -> {
            double min = v.stream().mapToDouble(Double::doubleValue).min().orElse(0);
            double max = v.stream().mapToDouble(Double::doubleValue).max().orElse(0);
            double avg = v.stream().mapToDouble(Double::doubleValue).average().orElse(0);
            out.put(k, new HistogramSummary(v.size(), min, max, avg));
        });
        return out;
    }

    public synchronized List<Metric> recent() { return List.copyOf(recent); }

    public synchronized void clear() {
        recent.clear();
        counters.clear();
        histograms.clear();
    }

    private void add(Metric m) {
        recent.add(m);
        if (recent.size() > maxRecent) recent.remove(0);
    }

    static String key(String name, Map<String, String> labels) {
        if (labels == null || labels.isEmpty()) return name;
        StringBuilder sb = new StringBuilder(name).append('{');
        boolean first = true;
        for (Map.Entry<String, String> e : new TreeMap<>(labels).entrySet()) {
            if (!first) sb.append(',');
            sb.append(e.getKey()).append('=').append(e.getValue());
            first = false;
        }
        return sb.append('}').toString();
    }

    private static Map<String, String> copy(Map<String, String> labels) {
        return labels == null ? Map.of() : Map.copyOf(labels);
    }
}
