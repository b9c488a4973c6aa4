package com.cardforge.jobs;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Key-value storage for job records, cancellation flags and per-owner recent-job lists.
 *
 * <p>Every read returns the last fully written value as a private copy. {@link #put} rewrites the
 * whole record; callers read, modify and write back. Storage failures are reported as {@link
 * com.cardforge.exception.JobStoreException}.
 */
public interface JobStore {
  void put(GenerationJob job, Duration ttl);

  Optional<GenerationJob> get(String jobId);

  /** Set the cancellation flag of a job. Flags are never cleared before they expire. */
  void setCancelFlag(String jobId, Duration ttl);

  boolean isCancelled(String jobId);

  /**
   * Prepend {@code jobId} to the owner's recent list, keeping at most {@code maxKept} ids. The list
   * expires {@code ttl} after its latest push.
   */
  void pushRecent(String ownerId, String jobId, int maxKept, Duration ttl);

  /** Recent job ids of an owner, newest first. */
  List<String> listRecent(String ownerId, int offset, int limit);
}
