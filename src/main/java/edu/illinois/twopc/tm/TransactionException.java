package edu.illinois.twopc.tm;

/**
 * Base class of all errors raised by transaction state transitions. The state
 * machine performs no I/O, so none of these are ever worth retrying as-is.
 */
public abstract class TransactionException extends Exception {

  private static final long serialVersionUID = 2719061594021467125L;

  public TransactionException() {
    super();
  }

  public TransactionException(String message, Throwable cause) {
    super(message, cause);
  }

  public TransactionException(String message) {
    super(message);
  }

  public TransactionException(Throwable cause) {
    super(cause);
  }

}
