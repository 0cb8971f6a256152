package hdlower.core;

/** Handshake protocol of a port. */
public enum FlowControl {
  NONE,
  /** valid signal accompanying the payload */
  VALID,
  /** valid/ready handshake with back-pressure */
  READY;

  public boolean hasValid() { return this != NONE; }
  public boolean hasReady() { return this == READY; }
}
