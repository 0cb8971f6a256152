package hdlower.util;

import java.math.BigInteger;

/** Bit arithmetic on arbitrary-width values. */
public class Bits {
  public static int log2(int n) {
    if (n < 0)
      throw new IllegalArgumentException();
    return 31 - Integer.numberOfLeadingZeros(n);
  }

  /** Ceiling log2; clog2(1) is 0. */
  public static int clog2(int n) {
    if (n <= 0)
      throw new IllegalArgumentException();
    return n == 1 ? 0 : log2(n - 1) + 1;
  }

  /** Mask with the low {@code width} bits set. */
  public static BigInteger mask(int width) { return BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE); }

  /** Truncates {@code value} to {@code width} bits, interpreting the result as two's complement if {@code signed}. */
  public static BigInteger truncate(BigInteger value, int width, boolean signed) {
    BigInteger bits = value.and(mask(width));
    if (signed && bits.testBit(width - 1))
      return bits.subtract(BigInteger.ONE.shiftLeft(width));
    return bits;
  }

  /**
   * Extracts the bit field {@code [lsb + width - 1 : lsb]} of {@code value}.
   * Negative values are taken in two's complement.
   */
  public static BigInteger extract(BigInteger value, int lsb, int width, boolean signed) {
    if (lsb < 0 || width <= 0)
      throw new IllegalArgumentException("Invalid bit field [" + (lsb + width - 1) + ":" + lsb + "]");
    return truncate(value.shiftRight(lsb), width, signed);
  }
}
