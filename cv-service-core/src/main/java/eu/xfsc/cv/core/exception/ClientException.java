package eu.xfsc.cv.core.exception;

/**
 * Exception thrown when a request cannot be processed because of its content.
 */
public class ClientException extends ServiceException {

  /**
   * Constructs a new ClientException with the specified detail message.
   *
   * @param message Detailed message about the thrown exception.
   */
  public ClientException(String message) {
    super(message);
  }

  public ClientException(String message, Throwable cause) {
    super(message, cause);
  }
}
