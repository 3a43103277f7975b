package edu.isi.wfst;

// boolean is or, and, false, true. true is 1.0, false is 0.0;
// anything nonzero counts as true
public class BooleanSemiring extends Semiring {
	public double plus(double a, double b) {
		return (a != 0 || b != 0) ? ONE() : ZERO();
	}
	public double times(double a, double b) {
		return (a != 0 && b != 0) ? ONE() : ZERO();
	}
	public boolean better(double a, double b) {
		return a != 0 && b == 0;
	}
	public boolean betteroreq(double a, double b) {
		return a != 0 || b == 0;
	}
	public boolean approxEqual(double a, double b) {
		return (a != 0) == (b != 0);
	}
	public double ZERO(){return 0;}
	public double ONE() {return 1;}
}
