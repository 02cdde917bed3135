package com.verlumen.ideasearch.search;

/** Explores refinements of a root idea by repeated select, expand, simulate and backpropagate. */
public interface TreeSearch {
  /**
   * Runs up to {@code iterations} iterations from the root idea. Failed simulations are logged and
   * skipped; the search stops early when the calling thread is interrupted.
   *
   * @throws com.verlumen.ideasearch.errors.NotFoundException if the root idea does not exist
   * @throws IllegalStateException if the root is already being searched
   */
  SearchResult search(String rootIdeaId, int iterations);
}
