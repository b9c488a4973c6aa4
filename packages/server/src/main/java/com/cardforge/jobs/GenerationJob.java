package com.cardforge.jobs;

import com.cardforge.generation.GeneratedCard;
import com.cardforge.generation.GenerationRequest;
import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted record of one generation request. Instances are plain data: the {@link JobStore}
 * keeps a serialized copy, so changing an instance has no effect until it is written back.
 */
public class GenerationJob {
  public static final String META_CURRENT_STEP = "current_step";
  public static final String META_PROGRESS = "progress";

  private String id;
  private String ownerId;
  private JobStatus status = JobStatus.PENDING;
  private GenerationRequest request;
  private int generatedCount;
  private List<GeneratedCard> cards = new ArrayList<>();
  private String errorMessage;
  private Instant createdAt;
  private Instant updatedAt;
  private Instant startedAt;
  private Instant completedAt;
  private Map<String, Object> metadata = new LinkedHashMap<>();

  public GenerationJob() {}

  public GenerationJob(String id, String ownerId, GenerationRequest request, Instant createdAt) {
    this.id = id;
    this.ownerId = ownerId;
    this.request = request;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public String getOwnerId() {
    return ownerId;
  }

  public void setOwnerId(String ownerId) {
    this.ownerId = ownerId;
  }

  public JobStatus getStatus() {
    return status;
  }

  public void setStatus(JobStatus status) {
    this.status = status;
  }

  public GenerationRequest getRequest() {
    return request;
  }

  public void setRequest(GenerationRequest request) {
    this.request = request;
  }

  @JsonIgnore
  public int getRequestedCount() {
    return request == null ? 0 : request.requestedCount();
  }

  public int getGeneratedCount() {
    return generatedCount;
  }

  public void setGeneratedCount(int generatedCount) {
    this.generatedCount = generatedCount;
  }

  public List<GeneratedCard> getCards() {
    return cards;
  }

  public void setCards(List<GeneratedCard> cards) {
    this.cards = cards == null ? new ArrayList<>() : new ArrayList<>(cards);
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public void setErrorMessage(String errorMessage) {
    this.errorMessage = errorMessage;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void setUpdatedAt(Instant updatedAt) {
    this.updatedAt = updatedAt;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public void setStartedAt(Instant startedAt) {
    this.startedAt = startedAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public void setCompletedAt(Instant completedAt) {
    this.completedAt = completedAt;
  }

  public Map<String, Object> getMetadata() {
    return metadata;
  }

  public void setMetadata(Map<String, Object> metadata) {
    this.metadata = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
  }

  /** Last stage progress persisted by the running pipeline, 0 when none was recorded. */
  public double persistedProgress() {
    Object value = metadata.get(META_PROGRESS);
    return value instanceof Number n ? n.doubleValue() : 0.0;
  }

  public String currentStep() {
    Object value = metadata.get(META_CURRENT_STEP);
    return value == null ? null : value.toString();
  }
}
