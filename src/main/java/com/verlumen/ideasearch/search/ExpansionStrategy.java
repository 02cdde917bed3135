package com.verlumen.ideasearch.search;

import com.google.common.collect.ImmutableSet;

/** Proposes refinements of an idea or scenario during tree expansion. */
public interface ExpansionStrategy {
  Variation proposeVariation(String parentDescription, ImmutableSet<String> parentTags);
}
