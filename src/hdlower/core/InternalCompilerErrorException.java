package hdlower.core;

/** Thrown when an invariant of the lowering passes is broken. Not a user error. */
public class InternalCompilerErrorException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final Message msg;

  public InternalCompilerErrorException(Message msg) {
    super(msg.toString());
    this.msg = msg;
  }

  public Message getMsg() { return msg; }
}
