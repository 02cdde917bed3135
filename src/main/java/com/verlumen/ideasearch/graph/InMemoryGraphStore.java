package com.verlumen.ideasearch.graph;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import com.google.common.flogger.FluentLogger;
import com.verlumen.ideasearch.errors.CycleException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Process-local graph store built from adjacency multimaps. Thread safe. */
final class InMemoryGraphStore implements GraphStore {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Map<String, NodeType> types = new HashMap<>();
  private final Map<String, Idea> ideas = new HashMap<>();
  private final Map<String, Scenario> scenarios = new HashMap<>();
  private final Map<String, Context> contexts = new HashMap<>();
  private final Map<String, Backtest> backtests = new HashMap<>();
  private final SetMultimap<String, Relationship> outgoing = LinkedHashMultimap.create();
  private final SetMultimap<String, Relationship> incoming = LinkedHashMultimap.create();

  @Override
  public synchronized void putIdea(Idea idea) {
    claimId(idea.id(), NodeType.IDEA);
    ideas.put(idea.id(), idea);
  }

  @Override
  public synchronized void putScenario(Scenario scenario) {
    claimId(scenario.id(), NodeType.SCENARIO);
    scenarios.put(scenario.id(), scenario);
  }

  @Override
  public synchronized void putContext(Context context) {
    claimId(context.id(), NodeType.CONTEXT);
    contexts.put(context.id(), context);
  }

  @Override
  public synchronized void putBacktest(Backtest backtest) {
    checkState(!types.containsKey(backtest.id()), "Node already exists: %s", backtest.id());
    claimId(backtest.id(), NodeType.BACKTEST);
    backtests.put(backtest.id(), backtest);
  }

  @Override
  public synchronized void updateStatistics(String subjectId, long testCount, double totalScore) {
    checkArgument(testCount >= 0, "Test count cannot be negative: %s", testCount);
    NodeType type = types.get(subjectId);
    checkArgument(type != null && type.isSubject(), "Not an idea or scenario: %s", subjectId);
    if (type == NodeType.IDEA) {
      ideas.put(subjectId, ideas.get(subjectId).withStatistics(testCount, totalScore));
    } else {
      scenarios.put(subjectId, scenarios.get(subjectId).withStatistics(testCount, totalScore));
    }
  }

  @Override
  public synchronized void addRelationship(Relationship relationship) {
    NodeType sourceType = types.get(relationship.sourceId());
    NodeType targetType = types.get(relationship.targetId());
    checkArgument(sourceType != null, "Unknown source node: %s", relationship.sourceId());
    checkArgument(targetType != null, "Unknown target node: %s", relationship.targetId());
    checkArgument(
        relationship.type().accepts(sourceType, targetType),
        "%s cannot link %s to %s",
        relationship.type(),
        sourceType,
        targetType);
    if (outgoing.containsEntry(relationship.sourceId(), relationship)) {
      return;
    }

    switch (relationship.type()) {
      case SUBIDEA_OF:
        checkState(
            !hasOutgoing(relationship.sourceId(), RelationshipType.SUBIDEA_OF),
            "Scenario %s already has a parent",
            relationship.sourceId());
        if (closesCycle(relationship.sourceId(), relationship.targetId())) {
          throw new CycleException(relationship.sourceId(), relationship.targetId());
        }
        break;
      case TESTED_IN:
        checkState(
            !hasIncoming(relationship.targetId(), RelationshipType.TESTED_IN),
            "Backtest %s already has a subject",
            relationship.targetId());
        break;
      case EXECUTED_IN:
        checkState(
            !hasOutgoing(relationship.sourceId(), RelationshipType.EXECUTED_IN),
            "Backtest %s already has a context",
            relationship.sourceId());
        break;
      default:
        break;
    }

    outgoing.put(relationship.sourceId(), relationship);
    incoming.put(relationship.targetId(), relationship);
  }

  @Override
  public synchronized boolean removeRelationship(Relationship relationship) {
    boolean removed = outgoing.remove(relationship.sourceId(), relationship);
    incoming.remove(relationship.targetId(), relationship);
    return removed;
  }

  @Override
  public synchronized boolean removeNode(String id) {
    NodeType type = types.remove(id);
    if (type == null) {
      return false;
    }
    ideas.remove(id);
    scenarios.remove(id);
    contexts.remove(id);
    backtests.remove(id);
    for (Relationship relationship : ImmutableList.copyOf(outgoing.removeAll(id))) {
      incoming.remove(relationship.targetId(), relationship);
    }
    for (Relationship relationship : ImmutableList.copyOf(incoming.removeAll(id))) {
      outgoing.remove(relationship.sourceId(), relationship);
    }
    logger.atFine().log("Removed %s node %s", type, id);
    return true;
  }

  @Override
  public synchronized Optional<NodeType> typeOf(String id) {
    return Optional.ofNullable(types.get(id));
  }

  @Override
  public synchronized Optional<Idea> getIdea(String id) {
    return Optional.ofNullable(ideas.get(id));
  }

  @Override
  public synchronized Optional<Scenario> getScenario(String id) {
    return Optional.ofNullable(scenarios.get(id));
  }

  @Override
  public synchronized Optional<Context> getContext(String id) {
    return Optional.ofNullable(contexts.get(id));
  }

  @Override
  public synchronized Optional<Backtest> getBacktest(String id) {
    return Optional.ofNullable(backtests.get(id));
  }

  @Override
  public synchronized Optional<Subject> getSubject(String id) {
    Subject subject = ideas.containsKey(id) ? ideas.get(id) : scenarios.get(id);
    return Optional.ofNullable(subject);
  }

  @Override
  public synchronized ImmutableList<String> nodeIds(NodeType type) {
    return types.entrySet().stream()
        .filter(entry -> entry.getValue() == type)
        .map(Map.Entry::getKey)
        .sorted()
        .collect(toImmutableList());
  }

  @Override
  public synchronized ImmutableList<Relationship> outgoing(String id, RelationshipType type) {
    return filter(outgoing.get(id), type);
  }

  @Override
  public synchronized ImmutableList<Relationship> incoming(String id, RelationshipType type) {
    return filter(incoming.get(id), type);
  }

  @Override
  public synchronized ImmutableList<Relationship> relationshipsOf(String id) {
    return ImmutableList.<Relationship>builder()
        .addAll(outgoing.get(id))
        .addAll(incoming.get(id))
        .build();
  }

  private void claimId(String id, NodeType type) {
    checkNotNull(id, "Node id cannot be null");
    NodeType existing = types.putIfAbsent(id, type);
    checkArgument(
        existing == null || existing == type,
        "Id %s already belongs to a %s node",
        id,
        existing);
  }

  private boolean hasOutgoing(String id, RelationshipType type) {
    return outgoing.get(id).stream().anyMatch(relationship -> relationship.type() == type);
  }

  private boolean hasIncoming(String id, RelationshipType type) {
    return incoming.get(id).stream().anyMatch(relationship -> relationship.type() == type);
  }

  /** True when the proposed parent is the child itself or one of its descendants. */
  private boolean closesCycle(String childId, String parentId) {
    Set<String> seen = new HashSet<>();
    String current = parentId;
    while (current != null && seen.add(current)) {
      if (current.equals(childId)) {
        return true;
      }
      current =
          outgoing.get(current).stream()
              .filter(relationship -> relationship.type() == RelationshipType.SUBIDEA_OF)
              .map(Relationship::targetId)
              .findFirst()
              .orElse(null);
    }
    return false;
  }

  private static ImmutableList<Relationship> filter(
      Set<Relationship> relationships, RelationshipType type) {
    return relationships.stream()
        .filter(relationship -> relationship.type() == type)
        .sorted(Relationship.ORDERING)
        .collect(toImmutableList());
  }
}
