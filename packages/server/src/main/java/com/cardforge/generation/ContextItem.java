package com.cardforge.generation;

/** A piece of grounding material made available to the generator. */
public record ContextItem(String content, String source, double relevance) {
  public static final String USER_PROVIDED = "user_provided";

  public static ContextItem userProvided(String content) {
    return new ContextItem(content, USER_PROVIDED, 1.0);
  }
}
