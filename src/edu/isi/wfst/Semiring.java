package edu.isi.wfst;
import java.io.Serializable;
// the general semiring over double weights. Subclasses do the operations.
// plus combines alternative paths, times combines sequential steps
public abstract class Semiring implements Serializable {
	// tolerance for weight comparison
	public static final double KDELTA = 1.0/1024.0;

	public abstract double plus(double a, double b);
	public abstract double times(double a, double b);
	// better means "closer to one"...sort of
	public abstract boolean better(double a, double b);
	public abstract boolean betteroreq(double a, double b);
	public abstract double ONE();
	public abstract double ZERO();

	public boolean isZero(double a) {
		return approxEqual(a, ZERO());
	}

	// infinities only match themselves
	public boolean approxEqual(double a, double b) {
		if (a == b)
			return true;
		if (Double.isInfinite(a) || Double.isInfinite(b))
			return false;
		return Math.abs(a-b) <= KDELTA;
	}

	// two fsts are only comparable if they share the algebra
	public boolean sameAs(Semiring other) {
		return other != null && getClass() == other.getClass();
	}

	public String toString() {
		return getClass().getSimpleName();
	}
}
