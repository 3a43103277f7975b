package edu.isi.wfst;

// tropical is min, +, +INF, 0
public class TropicalSemiring extends Semiring {
	public double plus(double a, double b) {
		return Math.min(a, b);
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
