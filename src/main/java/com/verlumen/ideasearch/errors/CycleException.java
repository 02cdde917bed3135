package com.verlumen.ideasearch.errors;

/** Thrown when a SUBIDEA_OF edge would make a node its own ancestor. Never retried. */
public class CycleException extends RuntimeException {
  public CycleException(String childId, String parentId) {
    super(
        String.format(
            "Linking %s under %s would create a SUBIDEA_OF cycle", childId, parentId));
  }
}
