package com.verlumen.ideasearch.errors;

/** Thrown when an operation references a node id that does not exist. Never retried. */
public class NotFoundException extends RuntimeException {
  private final String nodeId;

  public NotFoundException(String kind, String nodeId) {
    super(String.format("%s not found: %s", kind, nodeId));
    this.nodeId = nodeId;
  }

  public String nodeId() {
    return nodeId;
  }
}
