package io.github.manjago.mutagen.tracking;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.manjago.mutagen.core.Tier;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Records every mutation outcome and derives per-tier and per-operator
 * statistics from them.
 *
 * Statistics are computed from the record list on demand, so the counters
 * can never drift apart. Thread-safe: one read/write lock guards all state.
 */
public class TierPerformanceTracker {

    private static final Logger log = LoggerFactory.getLogger(TierPerformanceTracker.class);

    static final int TREND_MIN_RECORDS = 10;
    static final double TREND_THRESHOLD = 0.1;

    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<MutationRecord> records = new ArrayList<>();
    private long nextId = 1;

    // ========== Recording ==========

    public long record(Tier tier, String mutationType, boolean success, double performanceDelta) {
        return record(tier, mutationType, success, performanceDelta, null, Map.of());
    }

    /**
     * Record one outcome.
     *
     * @return id for a later {@link #recordPerformance}
     */
    public long record(Tier tier, String mutationType, boolean success, double performanceDelta,
                       @Nullable String strategyId, Map<String, Object> metadata) {
        lock.writeLock().lock();
        try {
            long id = nextId++;
            records.add(new MutationRecord(id, tier, mutationType, success, performanceDelta,
                strategyId, metadata, System.currentTimeMillis()));
            log.debug("Recorded #{}: tier {} {} success={}", id, tier.level(), mutationType, success);
            return id;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Attach the fitness change measured after the candidate was evaluated.
     *
     * @return false when no record has that id
     */
    public boolean recordPerformance(long recordId, double performanceDelta) {
        lock.writeLock().lock();
        try {
            for (int i = records.size() - 1; i >= 0; i--) {
                MutationRecord r = records.get(i);
                if (r.id() == recordId) {
                    records.set(i, r.withPerformanceDelta(performanceDelta));
                    return true;
                }
            }
            log.warn("No mutation record #{} to attach performance {}", recordId, performanceDelta);
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replace all records, e.g. with ones loaded from a store.
     */
    public void restore(List<MutationRecord> loaded) {
        lock.writeLock().lock();
        try {
            records.clear();
            records.addAll(loaded);
            records.sort(Comparator.comparingLong(MutationRecord::id));
            nextId = records.isEmpty() ? 1 : records.get(records.size() - 1).id() + 1;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void reset() {
        lock.writeLock().lock();
        try {
            records.clear();
            nextId = 1;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ========== Queries ==========

    public List<MutationRecord> records() {
        return records(r -> true);
    }

    public List<MutationRecord> records(Predicate<MutationRecord> filter) {
        lock.readLock().lock();
        try {
            return records.stream().filter(filter).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public TierStats tierStats(Tier tier) {
        return tierStats(tier, records(r -> r.tier() == tier));
    }

    private static TierStats tierStats(Tier tier, List<MutationRecord> list) {
        if (list.isEmpty()) {
            return TierStats.empty(tier);
        }
        long successes = 0;
        double total = 0;
        double max = Double.NEGATIVE_INFINITY;
        Map<String, Long> types = new TreeMap<>();
        for (MutationRecord r : list) {
            if (r.success()) {
                successes++;
                total += r.performanceDelta();
                max = Math.max(max, r.performanceDelta());
            }
            types.merge(r.mutationType(), 1L, Long::sum);
        }
        long attempts = list.size();
        // improvement aggregates cover successful mutations only
        double average = successes == 0 ? 0.0 : total / successes;
        return new TierStats(tier, attempts, successes, attempts - successes,
            (double) successes / attempts, total, average, successes == 0 ? 0.0 : max, types);
    }

    public TrackerSummary summary() {
        List<MutationRecord> all = records();
        Map<Tier, TierStats> tiers = new EnumMap<>(Tier.class);
        long successes = 0;
        for (Tier tier : Tier.values()) {
            TierStats stats = tierStats(tier, all.stream().filter(r -> r.tier() == tier).toList());
            tiers.put(tier, stats);
            successes += stats.successes();
        }
        double rate = all.isEmpty() ? 0.0 : (double) successes / all.size();
        return new TrackerSummary(all.size(), successes, rate, tiers);
    }

    public TierComparison comparison() {
        TrackerSummary summary = summary();
        long total = summary.totalRecords();
        Map<Tier, Long> distribution = new EnumMap<>(Tier.class);
        Map<Tier, Double> percent = new EnumMap<>(Tier.class);
        Map<Tier, Double> successRates = new EnumMap<>(Tier.class);
        Map<Tier, Double> improvement = new EnumMap<>(Tier.class);
        for (TierStats s : summary.tiers().values()) {
            distribution.put(s.tier(), s.attempts());
            percent.put(s.tier(), total == 0 ? 0.0 : 100.0 * s.attempts() / total);
            successRates.put(s.tier(), s.successRate());
            improvement.put(s.tier(), s.averageImprovement());
        }
        if (total == 0) {
            return new TierComparison(0, distribution, percent, successRates, improvement,
                Tier.TIER2, Tier.TIER2, Tier.TIER2);
        }
        return new TierComparison(total, distribution, percent, successRates, improvement,
            best(successRates, distribution), best(improvement, distribution), mostUsed(distribution));
    }

    /**
     * Highest value among tiers that have records; earlier tier wins ties.
     */
    private static Tier best(Map<Tier, Double> values, Map<Tier, Long> distribution) {
        Tier best = null;
        for (Tier tier : Tier.values()) {
            if (distribution.get(tier) == 0) {
                continue;
            }
            if (best == null || values.get(tier) > values.get(best)) {
                best = tier;
            }
        }
        return best == null ? Tier.TIER2 : best;
    }

    /**
     * Tier with the most records; the lowest tier wins ties.
     */
    private static Tier mostUsed(Map<Tier, Long> distribution) {
        Tier most = Tier.TIER1;
        for (Tier tier : Tier.values()) {
            if (distribution.get(tier) > distribution.get(most)) {
                most = tier;
            }
        }
        return most;
    }

    /**
     * Statistics per mutation type, sorted by name.
     */
    public Map<String, OperatorStats> mutationTypeAnalysis() {
        Map<String, List<MutationRecord>> byType = new TreeMap<>();
        for (MutationRecord r : records()) {
            byType.computeIfAbsent(r.mutationType(), k -> new ArrayList<>()).add(r);
        }
        Map<String, OperatorStats> result = new LinkedHashMap<>();
        byType.forEach((type, list) -> {
            long successes = list.stream().filter(MutationRecord::success).count();
            double improvement = list.stream()
                .filter(MutationRecord::success)
                .mapToDouble(MutationRecord::performanceDelta)
                .sum();
            result.put(type, new OperatorStats(type, list.size(), successes, list.size() - successes,
                (double) successes / list.size(), successes == 0 ? 0.0 : improvement / successes));
        });
        return result;
    }

    /**
     * Success rate per mutation type, the input operator adaptation uses.
     */
    public Map<String, Double> operatorSuccessRates() {
        Map<String, Double> rates = new LinkedHashMap<>();
        mutationTypeAnalysis().forEach((type, stats) -> rates.put(type, stats.successRate()));
        return rates;
    }

    public RecentTrends recentTrends(int window) {
        if (window <= 0) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        List<MutationRecord> all = records();
        List<MutationRecord> recent = all.subList(Math.max(0, all.size() - window), all.size());
        Map<Tier, Long> distribution = new EnumMap<>(Tier.class);
        Map<Tier, Double> rates = new EnumMap<>(Tier.class);
        long successes = 0;
        for (Tier tier : Tier.values()) {
            List<MutationRecord> ofTier = recent.stream().filter(r -> r.tier() == tier).toList();
            long ok = ofTier.stream().filter(MutationRecord::success).count();
            distribution.put(tier, (long) ofTier.size());
            rates.put(tier, ofTier.isEmpty() ? 0.0 : (double) ok / ofTier.size());
            successes += ok;
        }
        double overall = recent.isEmpty() ? 0.0 : (double) successes / recent.size();
        return new RecentTrends(window, recent.size(), distribution, rates, overall);
    }

    /**
     * Compares the success rate of the newer half of a tier's records
     * against the older half; a change beyond 0.1 is a trend.
     */
    public TierTrend trend(Tier tier) {
        List<MutationRecord> list = records(r -> r.tier() == tier);
        if (list.size() < TREND_MIN_RECORDS) {
            return TierTrend.INSUFFICIENT_DATA;
        }
        int mid = list.size() / 2;
        double delta = successRate(list.subList(mid, list.size())) - successRate(list.subList(0, mid));
        if (delta > TREND_THRESHOLD) {
            return TierTrend.IMPROVING;
        }
        if (delta < -TREND_THRESHOLD) {
            return TierTrend.DECLINING;
        }
        return TierTrend.STABLE;
    }

    private static double successRate(List<MutationRecord> list) {
        return (double) list.stream().filter(MutationRecord::success).count() / list.size();
    }

    // ========== Export ==========

    /**
     * Summary, comparison, per-type analysis and trends as JSON.
     */
    public String toJson() {
        Map<String, Object> export = new LinkedHashMap<>();
        export.put("summary", summary());
        export.put("comparison", comparison());
        export.put("mutation_types", mutationTypeAnalysis());
        Map<Tier, TierTrend> trends = new EnumMap<>(Tier.class);
        for (Tier tier : Tier.values()) {
            trends.put(tier, trend(tier));
        }
        export.put("trends", trends);
        try {
            return JSON.writeValueAsString(export);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
