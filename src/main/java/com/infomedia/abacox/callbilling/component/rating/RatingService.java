package com.infomedia.abacox.callbilling.component.rating;

import com.infomedia.abacox.callbilling.config.CallBillingProperties;
import com.infomedia.abacox.callbilling.db.entity.RateEntry;
import com.infomedia.abacox.callbilling.db.repository.RateEntryRepository;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Longest-prefix tariff lookup with effective-date windows.
 * <p>
 * Among rows whose prefix equals a leading substring of the dialled digits and whose window
 * contains {@code asOf}, the longest prefix wins, then the highest priority, then the lowest id.
 */
@Service
@Log4j2
public class RatingService {

    static final Comparator<RateEntry> SELECTION_ORDER = Comparator
            .comparingInt((RateEntry e) -> e.getDestinationPrefix().length()).reversed()
            .thenComparing(Comparator.comparingInt(RateEntry::getPriority).reversed())
            .thenComparing(RateEntry::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final RateEntryRepository rateEntryRepository;
    private final Clock clock;
    private final Duration cacheTtl;

    // CACHE: prefix -> rows sharing it
    private volatile Map<String, List<RateEntry>> rateCache = Map.of();
    private volatile Instant cacheLastUpdated;
    private final Object cacheLock = new Object();

    public RatingService(RateEntryRepository rateEntryRepository, CallBillingProperties properties, Clock clock) {
        this.rateEntryRepository = rateEntryRepository;
        this.clock = clock;
        this.cacheTtl = properties.getRating().getCacheTtl();
    }

    @Transactional(readOnly = true)
    public RatedResult rate(String destinationNumber, Instant asOf) {
        String digits = digitsOnly(destinationNumber);
        if (digits.isEmpty()) {
            return RatedResult.invalidNumber(destinationNumber);
        }

        List<String> candidates = new ArrayList<>(digits.length());
        for (int i = 1; i <= digits.length(); i++) {
            candidates.add(digits.substring(0, i));
        }

        Instant effectiveAt = asOf != null ? asOf : clock.instant();
        Optional<RateEntry> best = findCandidates(candidates).stream()
                .filter(entry -> entry.isEffectiveAt(effectiveAt))
                .min(SELECTION_ORDER);

        if (best.isEmpty()) {
            log.debug("No tariff for {} at {}", digits, effectiveAt);
            return RatedResult.unrated(destinationNumber);
        }
        RateEntry entry = best.get();
        log.debug("Rated {} with prefix {} ({}) at {}", digits, entry.getDestinationPrefix(), entry.getDestinationName(), entry.getRatePerMinute());
        return RatedResult.of(entry, destinationNumber);
    }

    public void invalidateCache() {
        synchronized (cacheLock) {
            cacheLastUpdated = null;
            rateCache = Map.of();
        }
        log.info("Rate table cache invalidated");
    }

    private List<RateEntry> findCandidates(List<String> candidates) {
        if (cacheTtl == null || cacheTtl.isZero() || cacheTtl.isNegative()) {
            return rateEntryRepository.findByDestinationPrefixIn(candidates);
        }
        Map<String, List<RateEntry>> table = getRateTable();
        List<RateEntry> matches = new ArrayList<>();
        for (String candidate : candidates) {
            matches.addAll(table.getOrDefault(candidate, List.of()));
        }
        return matches;
    }

    private Map<String, List<RateEntry>> getRateTable() {
        Instant lastUpdate = cacheLastUpdated;
        if (isStale(lastUpdate)) {
            synchronized (cacheLock) {
                // Double check locking
                if (isStale(cacheLastUpdated)) {
                    List<RateEntry> rows = rateEntryRepository.findAll();
                    rateCache = rows.stream()
                            .filter(row -> row.getDestinationPrefix() != null)
                            .collect(Collectors.groupingBy(RateEntry::getDestinationPrefix,
                                    Collectors.collectingAndThen(Collectors.toList(), List::copyOf)));
                    cacheLastUpdated = clock.instant();
                    log.debug("Reloaded rate table cache: {} rows, {} prefixes", rows.size(), rateCache.size());
                }
            }
        }
        return rateCache;
    }

    private boolean isStale(Instant lastUpdate) {
        return lastUpdate == null || lastUpdate.plus(cacheTtl).isBefore(clock.instant());
    }

    static String digitsOnly(String number) {
        if (number == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(number.length());
        for (int i = 0; i < number.length(); i++) {
            char c = number.charAt(i);
            if (c >= '0' && c <= '9') {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
