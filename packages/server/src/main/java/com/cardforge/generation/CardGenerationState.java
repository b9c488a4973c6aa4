package com.cardforge.generation;

import com.cardforge.pipeline.PipelineState;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Working state of one card generation run. */
public final class CardGenerationState extends PipelineState {
  private final GenerationRequest request;

  private List<ContextItem> contextItems = new ArrayList<>();
  private List<DraftCard> draftCards = new ArrayList<>();
  private String rawGeneration;
  private List<DuplicateVerdict> duplicateVerdicts = new ArrayList<>();
  private List<CardVerification> verifications = new ArrayList<>();
  private List<RoutedCard> approvedCards = new ArrayList<>();
  private List<RoutedCard> rejectedCards = new ArrayList<>();
  private List<GeneratedCard> finalCards = new ArrayList<>();

  public CardGenerationState(GenerationRequest request) {
    this.request = request;
  }

  public GenerationRequest getRequest() {
    return request;
  }

  public List<ContextItem> getContextItems() {
    return Collections.unmodifiableList(contextItems);
  }

  void setContextItems(List<ContextItem> contextItems) {
    this.contextItems = new ArrayList<>(contextItems);
  }

  public List<DraftCard> getDraftCards() {
    return Collections.unmodifiableList(draftCards);
  }

  void setDraftCards(List<DraftCard> draftCards) {
    this.draftCards = new ArrayList<>(draftCards);
  }

  public String getRawGeneration() {
    return rawGeneration;
  }

  void setRawGeneration(String rawGeneration) {
    this.rawGeneration = rawGeneration;
  }

  public List<DuplicateVerdict> getDuplicateVerdicts() {
    return Collections.unmodifiableList(duplicateVerdicts);
  }

  void setDuplicateVerdicts(List<DuplicateVerdict> duplicateVerdicts) {
    this.duplicateVerdicts = new ArrayList<>(duplicateVerdicts);
  }

  public List<CardVerification> getVerifications() {
    return Collections.unmodifiableList(verifications);
  }

  void setVerifications(List<CardVerification> verifications) {
    this.verifications = new ArrayList<>(verifications);
  }

  public List<RoutedCard> getApprovedCards() {
    return Collections.unmodifiableList(approvedCards);
  }

  public List<RoutedCard> getRejectedCards() {
    return Collections.unmodifiableList(rejectedCards);
  }

  void setRoutedCards(List<RoutedCard> routed) {
    this.approvedCards = new ArrayList<>();
    this.rejectedCards = new ArrayList<>();
    for (RoutedCard card : routed) {
      (card.isApproved() ? approvedCards : rejectedCards).add(card);
    }
  }

  /** Cards that survived routing, in generation order. Empty until the save stage has run. */
  public List<GeneratedCard> getFinalCards() {
    return Collections.unmodifiableList(finalCards);
  }

  void setFinalCards(List<GeneratedCard> finalCards) {
    this.finalCards = new ArrayList<>(finalCards);
  }
}
