package eu.xfsc.cv.core.exception;

/**
 * Base unchecked exception of the credential verifier.
 */
public class ServiceException extends RuntimeException {

  /**
   * Constructs a new ServiceException with the specified detail message.
   *
   * @param message Detailed message about the thrown exception.
   */
  public ServiceException(String message) {
    super(message);
  }

  /**
   * Constructs a new ServiceException with the specified detail message and cause.
   *
   * @param message Detailed message about the thrown exception.
   * @param cause Underlying failure.
   */
  public ServiceException(String message, Throwable cause) {
    super(message, cause);
  }
}
