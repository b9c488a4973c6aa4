package com.cardforge.pipeline;

import com.cardforge.exception.PipelineDefinitionException;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable definition of a pipeline: one action per stage and exactly one outgoing edge per
 * stage. An edge is either unconditional (to another stage or to the end of the run) or
 * conditional, in which case a {@link Router} picks a member of a route enum and every member is
 * mapped to a stage.
 *
 * <p>Definitions are validated by {@link Builder#build()}; an incomplete graph never reaches the
 * executor.
 *
 * @param <K> stage enum
 * @param <S> state type
 */
public final class PipelineGraph<K extends Enum<K> & StageId, S extends PipelineState> {
  private final String name;
  private final K entryPoint;
  private final Map<K, StageAction<S>> actions;
  private final Map<K, Edge<K, S>> edges;

  private PipelineGraph(
      String name, K entryPoint, Map<K, StageAction<S>> actions, Map<K, Edge<K, S>> edges) {
    this.name = name;
    this.entryPoint = entryPoint;
    this.actions = actions;
    this.edges = edges;
  }

  public static <K extends Enum<K> & StageId, S extends PipelineState> Builder<K, S> builder(
      String name, Class<K> stageType) {
    return new Builder<>(name, stageType);
  }

  public String name() {
    return name;
  }

  K entryPoint() {
    return entryPoint;
  }

  StageAction<S> action(K stage) {
    return actions.get(stage);
  }

  /** The stage following {@code stage}, or empty at the end of the run. */
  Optional<K> next(K stage, S state) {
    return edges.get(stage).next(state);
  }

  @FunctionalInterface
  private interface Edge<K, S> {
    Optional<K> next(S state);
  }

  public static final class Builder<K extends Enum<K> & StageId, S extends PipelineState> {
    private final String name;
    private final Class<K> stageType;
    private final Map<K, StageAction<S>> actions;
    private final Map<K, Edge<K, S>> edges;
    private K entryPoint;

    private Builder(String name, Class<K> stageType) {
      this.name = Objects.requireNonNull(name, "name");
      this.stageType = Objects.requireNonNull(stageType, "stageType");
      this.actions = new EnumMap<>(stageType);
      this.edges = new EnumMap<>(stageType);
    }

    public Builder<K, S> entryPoint(K stage) {
      this.entryPoint = Objects.requireNonNull(stage, "stage");
      return this;
    }

    public Builder<K, S> addStage(K stage, StageAction<S> action) {
      Objects.requireNonNull(stage, "stage");
      Objects.requireNonNull(action, "action");
      if (actions.putIfAbsent(stage, action) != null) {
        throw new PipelineDefinitionException(
            name + ": stage '" + stage.stageName() + "' registered twice");
      }
      return this;
    }

    public Builder<K, S> addEdge(K from, K to) {
      Objects.requireNonNull(to, "to");
      Optional<K> target = Optional.of(to);
      return putEdge(from, state -> target);
    }

    public Builder<K, S> addEdgeToEnd(K from) {
      return putEdge(from, state -> Optional.empty());
    }

    /**
     * Add a conditional edge. {@code targets} must map every member of {@code routeType}.
     *
     * @throws PipelineDefinitionException if a route is unmapped
     */
    public <R extends Enum<R>> Builder<K, S> addConditionalEdges(
        K from, Class<R> routeType, Router<S, R> router, Map<R, K> targets) {
      Objects.requireNonNull(router, "router");
      EnumMap<R, K> mapping = new EnumMap<>(routeType);
      mapping.putAll(targets);
      for (R route : routeType.getEnumConstants()) {
        if (mapping.get(route) == null) {
          throw new PipelineDefinitionException(
              name
                  + ": route '"
                  + route.name()
                  + "' of stage '"
                  + from.stageName()
                  + "' has no target stage");
        }
      }
      return putEdge(
          from,
          state -> {
            R route = router.route(state);
            if (route == null) {
              throw new PipelineDefinitionException(
                  name + ": router of stage '" + from.stageName() + "' returned no route");
            }
            return Optional.of(mapping.get(route));
          });
    }

    private Builder<K, S> putEdge(K from, Edge<K, S> edge) {
      Objects.requireNonNull(from, "from");
      if (edges.putIfAbsent(from, edge) != null) {
        throw new PipelineDefinitionException(
            name + ": stage '" + from.stageName() + "' already has an outgoing edge");
      }
      return this;
    }

    /**
     * Validate and freeze the definition: an entry point is set and every stage of the enum has an
     * action and an outgoing edge.
     */
    public PipelineGraph<K, S> build() {
      if (entryPoint == null) {
        throw new PipelineDefinitionException(name + ": no entry point");
      }
      for (K stage : stageType.getEnumConstants()) {
        if (!actions.containsKey(stage)) {
          throw new PipelineDefinitionException(
              name + ": stage '" + stage.stageName() + "' has no action");
        }
        if (!edges.containsKey(stage)) {
          throw new PipelineDefinitionException(
              name + ": stage '" + stage.stageName() + "' has no outgoing edge");
        }
      }
      return new PipelineGraph<>(
          name, entryPoint, new EnumMap<>(actions), new EnumMap<>(edges));
    }
  }
}
