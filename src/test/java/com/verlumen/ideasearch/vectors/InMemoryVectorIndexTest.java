package com.verlumen.ideasearch.vectors;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.ideasearch.graph.NodeType;
import java.util.Optional;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class InMemoryVectorIndexTest {
  @Inject private VectorIndex index;

  @Before
  public void setUp() {
    Guice.createInjector(VectorsModule.create(3)).injectMembers(this);
  }

  @Test
  public void query_ordersByDescendingSimilarity() {
    // Arrange
    index.upsert("idea-far", new double[] {0, 1, 0}, NodeType.IDEA);
    index.upsert("idea-near", new double[] {1, 0.1, 0}, NodeType.IDEA);
    index.upsert("idea-mid", new double[] {1, 1, 0}, NodeType.IDEA);

    // Act
    ImmutableList<SimilarityMatch> matches =
        index.query(new double[] {1, 0, 0}, NodeType.IDEA, Optional.empty(), 10);

    // Assert
    assertThat(matches.stream().map(SimilarityMatch::id))
        .containsExactly("idea-near", "idea-mid", "idea-far")
        .inOrder();
    assertThat(matches.get(2).similarity()).isWithin(1e-9).of(0.0);
  }

  @Test
  public void query_equalSimilarity_breaksTiesByAscendingId() {
    // Arrange
    index.upsert("idea-b", new double[] {1, 0, 0}, NodeType.IDEA);
    index.upsert("idea-a", new double[] {2, 0, 0}, NodeType.IDEA);

    // Act
    ImmutableList<SimilarityMatch> matches =
        index.query(new double[] {1, 0, 0}, NodeType.IDEA, Optional.empty(), 2);

    // Assert
    assertThat(matches.stream().map(SimilarityMatch::id))
        .containsExactly("idea-a", "idea-b")
        .inOrder();
  }

  @Test
  public void query_returnsOnlyRequestedTypeAndAtMostTopK() {
    // Arrange
    index.upsert("idea-1", new double[] {1, 0, 0}, NodeType.IDEA);
    index.upsert("idea-2", new double[] {1, 1, 0}, NodeType.IDEA);
    index.upsert("scenario-1", new double[] {1, 0, 0}, NodeType.SCENARIO);

    // Act
    ImmutableList<SimilarityMatch> matches =
        index.query(new double[] {1, 0, 0}, NodeType.IDEA, Optional.empty(), 1);

    // Assert
    assertThat(matches).containsExactly(SimilarityMatch.create("idea-1", 1.0));
  }

  @Test
  public void query_noEntriesOfType_returnsEmpty() {
    // Arrange
    index.upsert("idea-1", new double[] {1, 0, 0}, NodeType.IDEA);

    // Act & Assert
    assertThat(index.query(new double[] {1, 0, 0}, NodeType.CONTEXT, Optional.empty(), 5))
        .isEmpty();
  }

  @Test
  public void query_withContext_returnsOnlyTaggedEntries() {
    // Arrange
    index.upsert("idea-1", new double[] {1, 0, 0}, NodeType.IDEA);
    index.upsert("idea-2", new double[] {1, 0, 0}, NodeType.IDEA);
    index.tagContext("idea-2", "context-1");

    // Act
    ImmutableList<SimilarityMatch> matches =
        index.query(new double[] {1, 0, 0}, NodeType.IDEA, Optional.of("context-1"), 5);

    // Assert
    assertThat(matches.stream().map(SimilarityMatch::id)).containsExactly("idea-2");
  }

  @Test
  public void upsert_existingEntry_keepsContextTags() {
    // Arrange
    index.upsert("idea-1", new double[] {1, 0, 0}, NodeType.IDEA);
    index.tagContext("idea-1", "context-1");

    // Act
    index.upsert("idea-1", new double[] {0, 1, 0}, NodeType.IDEA);

    // Assert
    assertThat(index.query(new double[] {0, 1, 0}, NodeType.IDEA, Optional.of("context-1"), 1))
        .containsExactly(SimilarityMatch.create("idea-1", 1.0));
  }

  @Test
  public void tagContext_unknownId_throws() {
    assertThrows(IllegalArgumentException.class, () -> index.tagContext("missing", "context-1"));
  }

  @Test
  public void remove_deletesEntry() {
    // Arrange
    index.upsert("idea-1", new double[] {1, 0, 0}, NodeType.IDEA);

    // Act
    boolean removed = index.remove("idea-1");

    // Assert
    assertThat(removed).isTrue();
    assertThat(index.contains("idea-1")).isFalse();
    assertThat(index.ids()).isEmpty();
  }

  @Test
  public void upsert_wrongDimension_throwsIllegalArgumentException() {
    assertThrows(
        IllegalArgumentException.class,
        () -> index.upsert("idea-1", new double[] {1, 0}, NodeType.IDEA));
    assertThat(index.contains("idea-1")).isFalse();
  }

  @Test
  public void query_wrongDimension_throwsIllegalArgumentException() {
    // Arrange
    index.upsert("idea-1", new double[] {1, 0, 0}, NodeType.IDEA);

    // Act & Assert
    assertThrows(
        IllegalArgumentException.class,
        () -> index.query(new double[] {1, 0, 0, 0}, NodeType.IDEA, Optional.empty(), 1));
  }
}
