package edu.isi.wfst;

// log is -log(e^-a + e^-b), +, +INF, 0
// weights are negative log probabilities
public class LogSemiring extends Semiring {

	// past this gap the smaller term doesn't register
	static private int TOLERANCE=16;
	public double plus(double a, double b) {
		if (a == ZERO()) return b;
		if (b == ZERO()) return a;
		double x = Math.min(a, b);
		double y = Math.max(a, b);
		// x <= y. If y >> x, estimate as x
		if (y >= x+TOLERANCE)
			return x;
		return x - Math.log1p(Math.exp(x-y));
	}
	public double times(double a, double b) {
		if (a == ZERO() || b == ZERO())
			return ZERO();
		return a+b;
	}
	public boolean better(double a, double b) {
		return a<b;
	}
	public boolean betteroreq(double a, double b) {
		return a<=b;
	}
	public double ZERO(){return  Double.POSITIVE_INFINITY;}
	public double ONE() {
		return 0;
	}
}
