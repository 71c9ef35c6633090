package io.feydor.abc.fmt;

/**
 * An exact musical duration, as a reduced fraction of the unit note length.
 */
public record Duration(long numerator, long denominator) implements Comparable<Duration> {
    public static final Duration ZERO = new Duration(0, 1);
    public static final Duration ONE = new Duration(1, 1);

    public Duration {
        if (denominator == 0) {
            throw new IllegalArgumentException("The denominator must not be 0");
        }
        if (denominator < 0) {
            numerator = -numerator;
            denominator = -denominator;
        }
        long gcd = gcd(Math.abs(numerator), denominator);
        if (gcd > 1) {
            numerator /= gcd;
            denominator /= gcd;
        }
    }

    public static Duration of(long numerator, long denominator) {
        return new Duration(numerator, denominator);
    }

    public Duration plus(Duration other) {
        return new Duration(numerator * other.denominator + other.numerator * denominator, denominator * other.denominator);
    }

    public Duration times(Duration other) {
        return new Duration(numerator * other.numerator, denominator * other.denominator);
    }

    @Override
    public int compareTo(Duration other) {
        return Long.compare(numerator * other.denominator, other.numerator * denominator);
    }

    @Override
    public String toString() {
        return denominator == 1 ? Long.toString(numerator) : numerator + "/" + denominator;
    }

    private static long gcd(long a, long b) {
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a == 0 ? 1 : a;
    }
}
