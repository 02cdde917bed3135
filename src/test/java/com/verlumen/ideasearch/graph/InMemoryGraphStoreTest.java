package com.verlumen.ideasearch.graph;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.ideasearch.errors.CycleException;
import java.time.Instant;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class InMemoryGraphStoreTest {
  private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

  @Inject private GraphStore store;

  @Before
  public void setUp() {
    Guice.createInjector(GraphModule.create()).injectMembers(this);
    store.putIdea(idea("idea-1"));
    store.putScenario(scenario("scenario-1"));
    store.putScenario(scenario("scenario-2"));
    store.putContext(Context.create("context-1", "SPY", "DAILY", ""));
    store.addRelationship(subIdeaOf("scenario-1", "idea-1"));
    store.addRelationship(subIdeaOf("scenario-2", "scenario-1"));
  }

  @Test
  public void addRelationship_closingSubIdeaCycle_throwsCycleException() {
    // Arrange
    store.putScenario(scenario("scenario-3"));
    store.addRelationship(subIdeaOf("scenario-3", "scenario-2"));
    store.removeRelationship(subIdeaOf("scenario-1", "idea-1"));

    // Act & Assert
    assertThrows(
        CycleException.class, () -> store.addRelationship(subIdeaOf("scenario-1", "scenario-3")));
  }

  @Test
  public void addRelationship_selfLoop_throwsCycleException() {
    // Arrange
    store.putScenario(scenario("scenario-3"));

    // Act & Assert
    assertThrows(
        CycleException.class, () -> store.addRelationship(subIdeaOf("scenario-3", "scenario-3")));
  }

  @Test
  public void addRelationship_secondParent_isRejected() {
    assertThrows(
        IllegalStateException.class,
        () -> store.addRelationship(subIdeaOf("scenario-2", "idea-1")));
  }

  @Test
  public void addRelationship_wrongEndpointTypes_isRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            store.addRelationship(
                Relationship.create(RelationshipType.EXECUTED_IN, "idea-1", "context-1")));
  }

  @Test
  public void addRelationship_unknownNode_isRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> store.addRelationship(subIdeaOf("scenario-1", "idea-missing")));
  }

  @Test
  public void addRelationship_duplicate_isIgnored() {
    // Act
    store.addRelationship(subIdeaOf("scenario-1", "idea-1"));

    // Assert
    assertThat(store.incoming("idea-1", RelationshipType.SUBIDEA_OF)).hasSize(1);
  }

  @Test
  public void putIdea_idOfAnotherType_isRejected() {
    assertThrows(IllegalArgumentException.class, () -> store.putIdea(idea("scenario-1")));
  }

  @Test
  public void putBacktest_existingId_isRejected() {
    // Arrange
    store.putBacktest(backtest("bt-1"));

    // Act & Assert
    assertThrows(IllegalStateException.class, () -> store.putBacktest(backtest("bt-1")));
  }

  @Test
  public void removeNode_removesIncidentRelationships() {
    // Act
    boolean removed = store.removeNode("scenario-2");

    // Assert
    assertThat(removed).isTrue();
    assertThat(store.typeOf("scenario-2")).isEmpty();
    assertThat(store.incoming("scenario-1", RelationshipType.SUBIDEA_OF)).isEmpty();
    assertThat(store.relationshipsOf("scenario-2")).isEmpty();
  }

  @Test
  public void updateStatistics_replacesCounters() {
    // Act
    store.updateStatistics("scenario-1", 4, 2.5);

    // Assert
    Subject subject = store.getSubject("scenario-1").get();
    assertThat(subject.testCount()).isEqualTo(4);
    assertThat(subject.meanScore()).isWithin(1e-9).of(0.625);
  }

  @Test
  public void updateStatistics_onContext_isRejected() {
    assertThrows(
        IllegalArgumentException.class, () -> store.updateStatistics("context-1", 1, 1.0));
  }

  @Test
  public void nodeIds_returnsSortedIdsOfOneType() {
    assertThat(store.nodeIds(NodeType.SCENARIO))
        .containsExactly("scenario-1", "scenario-2")
        .inOrder();
  }

  @Test
  public void getSubject_returnsIdeasAndScenariosOnly() {
    assertThat(store.getSubject("idea-1").get().type()).isEqualTo(NodeType.IDEA);
    assertThat(store.getSubject("scenario-1").get().type()).isEqualTo(NodeType.SCENARIO);
    assertThat(store.getSubject("context-1")).isEmpty();
  }

  private static Idea idea(String id) {
    return Idea.builder().setId(id).setDescription("idea " + id).setCreatedAt(NOW).build();
  }

  private static Scenario scenario(String id) {
    return Scenario.builder()
        .setId(id)
        .setDescription("scenario " + id)
        .setTags(ImmutableSet.of("test"))
        .setCreatedAt(NOW)
        .build();
  }

  private static Backtest backtest(String id) {
    return Backtest.create(id, NOW, ImmutableMap.of("Sharpe", 1.0), "", false);
  }

  private static Relationship subIdeaOf(String child, String parent) {
    return Relationship.create(RelationshipType.SUBIDEA_OF, child, parent);
  }
}
