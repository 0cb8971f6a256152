package hdlower.core;

/** Thrown when a user error leaves no sensible way to continue the current pass. */
public class FatalErrorException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final Message msg;

  public FatalErrorException(Message msg) {
    super(msg.toString());
    this.msg = msg;
  }

  public Message getMsg() { return msg; }
}
