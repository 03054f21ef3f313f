package com.repledger.interest;

import java.math.BigInteger;

/**
 * Integer arithmetic helpers shared by the interest, risk and ledger code.
 * All operations multiply before dividing on arbitrary-precision integers and
 * round toward zero unless the method name says otherwise.
 */
public final class WideMath {

    public static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(10_000);

    private WideMath() {}

    /** {@code floor(a * b / denominator)} for non-negative operands. */
    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger denominator) {
        if (denominator.signum() == 0) {
            throw new ArithmeticException("mulDiv by zero");
        }
        return a.multiply(b).divide(denominator);
    }

    /** {@code ceil(a * b / denominator)} for non-negative operands. */
    public static BigInteger mulDivUp(BigInteger a, BigInteger b, BigInteger denominator) {
        if (denominator.signum() == 0) {
            throw new ArithmeticException("mulDiv by zero");
        }
        BigInteger[] qr = a.multiply(b).divideAndRemainder(denominator);
        return qr[1].signum() > 0 ? qr[0].add(BigInteger.ONE) : qr[0];
    }

    /** {@code floor(amount * bps / 10000)}. */
    public static BigInteger applyBps(BigInteger amount, int bps) {
        return mulDiv(amount, BigInteger.valueOf(bps), BPS_DENOMINATOR);
    }
}
