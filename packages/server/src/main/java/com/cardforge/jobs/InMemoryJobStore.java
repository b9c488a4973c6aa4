package com.cardforge.jobs;

import com.cardforge.exception.JobStoreException;
import com.cardforge.logging.LoggingService;
import com.cardforge.utility.JacksonUtility;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;

/**
 * In-memory JobStore with per-key expiry.
 *
 * <p>Keys are namespaced the way a shared key-value server would hold them ({@code
 * generation:job:<id>}, {@code generation:cancel:<id>}, {@code generation:user_jobs:<owner>}). Job
 * records are kept as JSON text, so callers never share an instance with the store. Expired keys
 * are dropped lazily on access, and every write sweeps the whole map once the purge interval has
 * passed since the previous sweep.
 */
public final class InMemoryJobStore implements JobStore {
  private static final Logger log = LoggingService.getLogger(InMemoryJobStore.class);

  static final String JOB_PREFIX = "generation:job:";
  static final String CANCEL_PREFIX = "generation:cancel:";
  static final String USER_JOBS_PREFIX = "generation:user_jobs:";

  static final Duration DEFAULT_PURGE_INTERVAL = Duration.ofMinutes(1);

  private final Map<String, Entry> map = new ConcurrentHashMap<>();
  private final Clock clock;
  private final Duration purgeInterval;
  private volatile Instant lastPurge;

  private record Entry(Object value, Instant expiresAt) {
    boolean isExpired(Instant now) {
      return expiresAt != null && !now.isBefore(expiresAt);
    }
  }

  public InMemoryJobStore() {
    this(Clock.systemUTC());
  }

  public InMemoryJobStore(Clock clock) {
    this(clock, DEFAULT_PURGE_INTERVAL);
  }

  public InMemoryJobStore(Clock clock, Duration purgeInterval) {
    this.clock = clock;
    this.purgeInterval = purgeInterval;
    this.lastPurge = clock.instant();
  }

  @Override
  public void put(GenerationJob job, Duration ttl) {
    String json;
    try {
      json = JacksonUtility.getJsonMapper().writeValueAsString(job);
    } catch (JsonProcessingException e) {
      throw new JobStoreException("Failed to serialize job " + job.getId(), e);
    }
    purgeIfDue();
    map.put(JOB_PREFIX + job.getId(), new Entry(json, expiry(ttl)));
  }

  @Override
  public Optional<GenerationJob> get(String jobId) {
    return live(JOB_PREFIX + jobId)
        .map(
            value -> {
              try {
                return JacksonUtility.getJsonMapper()
                    .readValue((String) value, GenerationJob.class);
              } catch (JsonProcessingException e) {
                throw new JobStoreException("Failed to deserialize job " + jobId, e);
              }
            });
  }

  @Override
  public void setCancelFlag(String jobId, Duration ttl) {
    purgeIfDue();
    map.put(CANCEL_PREFIX + jobId, new Entry(Boolean.TRUE, expiry(ttl)));
  }

  @Override
  public boolean isCancelled(String jobId) {
    return live(CANCEL_PREFIX + jobId).isPresent();
  }

  @Override
  public void pushRecent(String ownerId, String jobId, int maxKept, Duration ttl) {
    purgeIfDue();
    Instant now = clock.instant();
    map.compute(
        USER_JOBS_PREFIX + ownerId,
        (key, existing) -> {
          List<String> ids = new ArrayList<>();
          ids.add(jobId);
          if (existing != null && !existing.isExpired(now)) {
            @SuppressWarnings("unchecked")
            List<String> previous = (List<String>) existing.value();
            ids.addAll(previous);
          }
          List<String> kept = ids.size() > maxKept ? ids.subList(0, maxKept) : ids;
          return new Entry(List.copyOf(kept), expiry(ttl));
        });
  }

  @Override
  @SuppressWarnings("unchecked")
  public List<String> listRecent(String ownerId, int offset, int limit) {
    if (offset < 0 || limit <= 0) {
      return List.of();
    }
    List<String> ids =
        live(USER_JOBS_PREFIX + ownerId).map(v -> (List<String>) v).orElse(List.of());
    if (offset >= ids.size()) {
      return List.of();
    }
    return List.copyOf(ids.subList(offset, Math.min(ids.size(), offset + limit)));
  }

  /** Remove every expired key. Returns the number of keys removed. */
  public int purgeExpired() {
    Instant now = clock.instant();
    int before = map.size();
    map.entrySet().removeIf(e -> e.getValue().isExpired(now));
    int removed = before - map.size();
    if (removed > 0) {
      log.debug("Purged {} expired keys", removed);
    }
    return removed;
  }

  private void purgeIfDue() {
    Instant now = clock.instant();
    if (Duration.between(lastPurge, now).compareTo(purgeInterval) >= 0) {
      lastPurge = now;
      purgeExpired();
    }
  }

  /** Number of keys currently held, expired or not. */
  int keyCount() {
    return map.size();
  }

  private Optional<Object> live(String key) {
    Entry entry = map.get(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (entry.isExpired(clock.instant())) {
      map.remove(key, entry);
      return Optional.empty();
    }
    return Optional.of(entry.value());
  }

  private Instant expiry(Duration ttl) {
    return ttl == null ? null : clock.instant().plus(ttl);
  }
}
