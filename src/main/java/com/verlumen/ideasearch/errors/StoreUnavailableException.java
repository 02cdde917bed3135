package com.verlumen.ideasearch.errors;

/**
 * Thrown by a graph store or vector index that cannot be reached. The memory layer retries these
 * with bounded backoff before surfacing them.
 */
public class StoreUnavailableException extends RuntimeException {
  public StoreUnavailableException(String message) {
    super(message);
  }

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
