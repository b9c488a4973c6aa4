package com.cardforge.jobs;

import com.cardforge.exception.ExceptionUtil;
import com.cardforge.exception.JobStateException;
import com.cardforge.exception.JobStoreException;
import com.cardforge.generation.CardGenerationPipeline;
import com.cardforge.generation.CardGenerationState;
import com.cardforge.generation.GeneratedCard;
import com.cardforge.generation.GenerationRequest;
import com.cardforge.logging.LoggingService;
import com.cardforge.pipeline.PipelineContext;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Creates, runs, cancels and reports on card generation jobs.
 *
 * <p>A job is written by exactly one party at a time: {@link #createJob} writes the initial
 * record, and afterwards only the run started by {@link #runJob} or {@link #submitJob} writes it.
 * {@link #cancelJob} only raises the cancellation flag; the read operations overlay that flag onto
 * jobs that have not reached a terminal state yet, and the run observes it at the next stage
 * boundary. Recognized configuration keys:
 *
 * <ul>
 *   <li>{@code jobs.ttl-hours} (default 24)
 *   <li>{@code jobs.max-recent} (default 100)
 *   <li>{@code jobs.worker-threads} (default 4)
 * </ul>
 */
public final class GenerationJobManager implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(GenerationJobManager.class);
  private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

  private final JobStore store;
  private final CardGenerationPipeline pipeline;
  private final ExecutorService executor;
  private final Duration jobTtl;
  private final int maxRecent;
  private final Clock clock;
  private final Set<String> activeRuns = ConcurrentHashMap.newKeySet();

  public GenerationJobManager(
      JobStore store, CardGenerationPipeline pipeline, Configuration configuration) {
    this(
        store,
        pipeline,
        Executors.newFixedThreadPool(
            Math.max(1, configuration.getInt("jobs.worker-threads", 4)),
            r -> {
              Thread t = new Thread(r, "generation-jobs-" + THREAD_COUNTER.incrementAndGet());
              t.setDaemon(true);
              return t;
            }),
        Duration.ofHours(configuration.getLong("jobs.ttl-hours", 24L)),
        configuration.getInt("jobs.max-recent", 100),
        Clock.systemUTC());
  }

  public GenerationJobManager(
      JobStore store,
      CardGenerationPipeline pipeline,
      ExecutorService executor,
      Duration jobTtl,
      int maxRecent,
      Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.jobTtl = jobTtl;
    this.maxRecent = maxRecent;
    this.clock = clock;
  }

  /**
   * Validate the request and persist a new PENDING job.
   *
   * @throws com.cardforge.exception.ValidationException if the request is out of bounds
   */
  public GenerationJob createJob(String ownerId, GenerationRequest request) {
    Objects.requireNonNull(ownerId, "ownerId");
    request.validate();
    GenerationJob job =
        new GenerationJob(UUID.randomUUID().toString(), ownerId, request, clock.instant());
    store.put(job, jobTtl);
    store.pushRecent(ownerId, job.getId(), maxRecent, jobTtl);
    log.info(
        "Created generation job {} for owner {} (topic '{}', {} cards)",
        job.getId(),
        ownerId,
        request.topic(),
        request.requestedCount());
    return job;
  }

  /**
   * Run a PENDING job on the calling thread and return its final record.
   *
   * @throws JobStateException if the job does not exist, is not PENDING, or is already being run
   */
  public GenerationJob runJob(String jobId) {
    if (!activeRuns.add(jobId)) {
      throw new JobStateException("Job " + jobId + " is already running");
    }
    try (MDC.MDCCloseable ignored = MDC.putCloseable("jobId", jobId)) {
      // Read after claiming, so a run that finished meanwhile is seen as terminal.
      return execute(requirePending(jobId));
    } finally {
      activeRuns.remove(jobId);
    }
  }

  /**
   * Run a PENDING job on the worker pool. State problems are reported synchronously; the returned
   * future completes with the final record.
   */
  public CompletableFuture<GenerationJob> submitJob(String jobId) {
    requireRunnable(jobId);
    return CompletableFuture.supplyAsync(() -> runJob(jobId), executor);
  }

  private void requireRunnable(String jobId) {
    requirePending(jobId);
    if (activeRuns.contains(jobId)) {
      throw new JobStateException("Job " + jobId + " is already running");
    }
  }

  private GenerationJob requirePending(String jobId) {
    GenerationJob job =
        store.get(jobId).orElseThrow(() -> new JobStateException("Unknown job: " + jobId));
    if (job.getStatus() != JobStatus.PENDING) {
      throw new JobStateException(
          "Job " + jobId + " cannot be started from status " + job.getStatus());
    }
    return job;
  }

  private GenerationJob execute(GenerationJob job) {
    String jobId = job.getId();
    if (store.isCancelled(jobId)) {
      log.info("Job {} was cancelled before it started", jobId);
      return finish(job, JobStatus.CANCELLED, null, List.of());
    }

    job.setStatus(JobStatus.RUNNING);
    job.setStartedAt(clock.instant());
    job.setUpdatedAt(job.getStartedAt());
    store.put(job, jobTtl);

    // Progress freezes at the stage that recorded an error; later stages only pass the state on.
    AtomicBoolean errorReported = new AtomicBoolean();
    CardGenerationState state;
    try {
      state =
          pipeline.run(
              job.getRequest(),
              new PipelineContext(
                  jobId,
                  () -> store.isCancelled(jobId),
                  (stage, progress, s) -> {
                    if (!s.hasError() || errorReported.compareAndSet(false, true)) {
                      recordProgress(jobId, stage, progress);
                    }
                  }));
    } catch (JobStoreException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("Job {} failed: {}", jobId, ExceptionUtil.formatCompactStackTrace(e), e);
      return finish(
          latest(job), JobStatus.FAILED, ExceptionUtil.extractErrorMessage(e), List.of());
    }

    GenerationJob current = latest(job);
    if (state.isCancelled() || store.isCancelled(jobId)) {
      log.info("Job {} was cancelled during processing", jobId);
      return finish(current, JobStatus.CANCELLED, null, List.of());
    }
    if (state.hasError()) {
      return finish(current, JobStatus.FAILED, state.getError(), List.of());
    }
    return finish(current, JobStatus.COMPLETED, null, state.getFinalCards());
  }

  private void recordProgress(String jobId, String stage, double progress) {
    store
        .get(jobId)
        .ifPresent(
            current -> {
              current.getMetadata().put(GenerationJob.META_CURRENT_STEP, stage);
              current.getMetadata().put(GenerationJob.META_PROGRESS, progress);
              current.setUpdatedAt(clock.instant());
              store.put(current, jobTtl);
            });
    log.debug("Job {} finished stage {} ({}%)", jobId, stage, progress);
  }

  private GenerationJob finish(
      GenerationJob job, JobStatus status, String errorMessage, List<GeneratedCard> cards) {
    List<GeneratedCard> kept =
        cards.size() > job.getRequestedCount() ? cards.subList(0, job.getRequestedCount()) : cards;
    job.setStatus(status);
    job.setErrorMessage(errorMessage);
    job.setCards(kept);
    job.setGeneratedCount(kept.size());
    job.setCompletedAt(clock.instant());
    job.setUpdatedAt(job.getCompletedAt());
    store.put(job, jobTtl);
    if (status == JobStatus.FAILED) {
      log.warn("Generation job {} failed: {}", job.getId(), errorMessage);
    } else {
      log.info("Generation job {} finished as {} with {} cards", job.getId(), status, kept.size());
    }
    return job;
  }

  private GenerationJob latest(GenerationJob fallback) {
    return store.get(fallback.getId()).orElse(fallback);
  }

  public Optional<GenerationJob> getJob(String jobId) {
    return store.get(jobId).map(this::withCancelOverlay);
  }

  public Optional<JobStatusView> getJobStatus(String jobId) {
    return getJob(jobId).map(JobStatusView::from);
  }

  /**
   * Request cancellation. Returns {@code false} when the job is unknown or already terminal;
   * otherwise the flag is set and the run stops at its next stage boundary.
   */
  public boolean cancelJob(String jobId) {
    Optional<GenerationJob> job = store.get(jobId);
    if (job.isEmpty() || job.get().getStatus().isTerminal()) {
      return false;
    }
    store.setCancelFlag(jobId, jobTtl);
    log.info("Cancellation requested for job {}", jobId);
    return true;
  }

  /**
   * Jobs of an owner, newest first. The status filter applies after paging, so a page may hold
   * fewer than {@code limit} jobs.
   *
   * @param statusFilter only jobs in this status, or {@code null} for all
   */
  public List<GenerationJob> listJobs(
      String ownerId, JobStatus statusFilter, int limit, int offset) {
    return store.listRecent(ownerId, offset, limit).stream()
        .map(this::getJob)
        .flatMap(Optional::stream)
        .filter(job -> statusFilter == null || job.getStatus() == statusFilter)
        .toList();
  }

  /**
   * Run a request as an independent, unpersisted pipeline invocation and stream its events. The
   * caller must close the stream.
   */
  public GenerationEventStream streamJob(GenerationRequest request) {
    request.validate();
    return GenerationEventStream.start(pipeline, request, executor);
  }

  private GenerationJob withCancelOverlay(GenerationJob job) {
    if (!job.getStatus().isTerminal() && store.isCancelled(job.getId())) {
      job.setStatus(JobStatus.CANCELLED);
    }
    return job;
  }

  /** Number of runs currently executing in this process. */
  public int activeRunCount() {
    return activeRuns.size();
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }
}
