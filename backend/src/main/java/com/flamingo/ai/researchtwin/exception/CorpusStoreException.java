package com.flamingo.ai.researchtwin.exception;

/** Exception thrown when a corpus snapshot cannot be persisted. */
public class CorpusStoreException extends RuntimeException {

  private final String namespaceId;
  private final String userMessage;

  public CorpusStoreException(String namespaceId, String message, Throwable cause) {
    super(message, cause);
    this.namespaceId = namespaceId;
    this.userMessage = "The knowledge base could not be saved. Please try again.";
  }

  public String getNamespaceId() {
    return namespaceId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
