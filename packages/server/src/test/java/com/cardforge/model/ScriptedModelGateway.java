package com.cardforge.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * In-memory {@link ModelGateway} for tests: generation answers are dequeued in order (the last one
 * repeats), claim verifications come from a function, and every call is recorded.
 */
public class ScriptedModelGateway implements ModelGateway {
  private final Deque<Object> generations = new ArrayDeque<>();
  private BiFunction<String, String, ClaimVerification> verifier =
      (claim, context) -> new ClaimVerification(0.9, List.of("encyclopedia"), "well known");
  private final List<CompletionRequest> generateCalls =
      Collections.synchronizedList(new ArrayList<>());
  private final List<String> verifiedClaims = Collections.synchronizedList(new ArrayList<>());
  private final AtomicInteger calls = new AtomicInteger();

  /** Queue a successful generation returning {@code content}. */
  public ScriptedModelGateway thenReturn(String content) {
    generations.add(content);
    return this;
  }

  /** Queue a failing generation. */
  public ScriptedModelGateway thenThrow(RuntimeException error) {
    generations.add(error);
    return this;
  }

  public ScriptedModelGateway verifyingWith(
      BiFunction<String, String, ClaimVerification> verifier) {
    this.verifier = verifier;
    return this;
  }

  @Override
  public synchronized CompletionResponse generate(CompletionRequest request) {
    calls.incrementAndGet();
    generateCalls.add(request);
    Object next = generations.size() > 1 ? generations.poll() : generations.peek();
    if (next == null) {
      return new CompletionResponse("[]", defaultModel(), 0, 0, "stop");
    }
    if (next instanceof RuntimeException error) {
      throw error;
    }
    return new CompletionResponse((String) next, defaultModel(), 10, 20, "stop");
  }

  @Override
  public ClaimVerification verifyClaim(String claim, String context) {
    calls.incrementAndGet();
    verifiedClaims.add(claim);
    return verifier.apply(claim, context);
  }

  @Override
  public String defaultModel() {
    return "scripted-model";
  }

  public List<CompletionRequest> generateCalls() {
    return List.copyOf(generateCalls);
  }

  public List<String> verifiedClaims() {
    return List.copyOf(verifiedClaims);
  }

  /** Total number of generate and verifyClaim calls. */
  public int callCount() {
    return calls.get();
  }
}
