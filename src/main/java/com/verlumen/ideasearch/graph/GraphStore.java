package com.verlumen.ideasearch.graph;

import com.google.common.collect.ImmutableList;
import java.util.Optional;

/**
 * Storage for typed nodes and typed directed relationships.
 *
 * <p>Writes are constraint checked: node ids are unique across all types, relationship endpoints
 * must exist and have the types the relationship allows, a scenario has at most one SUBIDEA_OF
 * parent, and SUBIDEA_OF edges may not form a cycle. Every method may throw {@link
 * com.verlumen.ideasearch.errors.StoreUnavailableException} when the backing storage cannot be
 * reached.
 */
public interface GraphStore {
  /** Inserts the idea, or replaces an idea with the same id. */
  void putIdea(Idea idea);

  /** Inserts the scenario, or replaces a scenario with the same id. */
  void putScenario(Scenario scenario);

  /** Inserts the context, or replaces a context with the same id. */
  void putContext(Context context);

  /** Inserts a backtest. Backtests are immutable, so an existing id is rejected. */
  void putBacktest(Backtest backtest);

  /** Overwrites the counters of an idea or scenario. */
  void updateStatistics(String subjectId, long testCount, double totalScore);

  /**
   * Adds a relationship.
   *
   * @throws com.verlumen.ideasearch.errors.CycleException if a SUBIDEA_OF edge would close a cycle
   */
  void addRelationship(Relationship relationship);

  /** Removes a relationship, returning whether it was present. */
  boolean removeRelationship(Relationship relationship);

  /** Removes a node together with every relationship touching it. */
  boolean removeNode(String id);

  Optional<NodeType> typeOf(String id);

  Optional<Idea> getIdea(String id);

  Optional<Scenario> getScenario(String id);

  Optional<Context> getContext(String id);

  Optional<Backtest> getBacktest(String id);

  /** Returns the idea or scenario with the given id. */
  Optional<Subject> getSubject(String id);

  /** Ids of every node of the given type, in ascending order. */
  ImmutableList<String> nodeIds(NodeType type);

  ImmutableList<Relationship> outgoing(String id, RelationshipType type);

  ImmutableList<Relationship> incoming(String id, RelationshipType type);

  /** Every relationship touching the node, in either direction. */
  ImmutableList<Relationship> relationshipsOf(String id);
}
