package io.nudge.queue.message;

/**
 * Describes a notification payload or message that was dropped by the listener. Never thrown into
 * the waiting caller; it travels to the {@code ErrorNotifier} as a diagnostic.
 */
public class MessageRejectedException extends RuntimeException {

  private final String messageType;

  public MessageRejectedException(String messageType, String message) {
    super(message);
    this.messageType = messageType;
  }

  public MessageRejectedException(String messageType, String message, Throwable cause) {
    super(message, cause);
    this.messageType = messageType;
  }

  /**
   * The message type, or {@code null} when the payload could not be decoded at all.
   */
  public String messageType() {
    return messageType;
  }
}
