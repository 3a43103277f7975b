package edu.isi.wfst;

// real is +, *, 0, 1
// lots of underflows on long paths; use LogSemiring for those
public class ProbabilitySemiring extends Semiring {

	public double plus(double a, double b) {
		return a+b;
	}
	public double times(double a, double b) {
		double prod = a*b;
		// keep a tiny positive product from rounding to zero
		if (prod == 0 && a > 0 && b > 0) {
			if (a > b)
				return b;
			return a;
		}
		return prod;
	}
	public boolean better(double a, double b) {
		return a>b;
	}
	public boolean betteroreq(double a, double b) {
		return a>=b;
	}
	public double ZERO(){return 0;}
	public double ONE() {return 1;}
}
