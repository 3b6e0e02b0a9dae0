package com.flamingo.ai.researchtwin.exception;

/** Exception thrown when the chat model call fails. */
public class LlmServiceException extends RuntimeException {

  private final String userMessage;

  public LlmServiceException(String message) {
    super(message);
    this.userMessage = "AI service is temporarily unavailable. Please try again later.";
  }

  public LlmServiceException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "AI service is temporarily unavailable. Please try again later.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
