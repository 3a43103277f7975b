package edu.isi.wfst;

// labeled, weighted edge. immutable; overwrite through MutableTrsIterator
public class Transition {
	private int ilabel;
	private int olabel;
	private double weight;
	private int nextState;

	public Transition(int il, int ol, double w, int next) {
		ilabel = il;
		olabel = ol;
		weight = w;
		nextState = next;
	}

	public int getILabel() { return ilabel; }
	public int getOLabel() { return olabel; }
	public double getWeight() { return weight; }
	public int getNextState() { return nextState; }

	public boolean isInputEpsilon() { return ilabel == SymbolTable.EPS_LABEL; }
	public boolean isOutputEpsilon() { return olabel == SymbolTable.EPS_LABEL; }

	// same edge, different destination. used when states get renumbered
	Transition redirect(int next) {
		return new Transition(ilabel, olabel, weight, next);
	}

	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Transition))
			return false;
		Transition t = (Transition)o;
		return ilabel == t.ilabel &&
			olabel == t.olabel &&
			nextState == t.nextState &&
			Double.compare(weight, t.weight) == 0;
	}

	public int hashCode() {
		long wbits = Double.doubleToLongBits(weight);
		int h = ilabel;
		h = 31*h + olabel;
		h = 31*h + nextState;
		h = 31*h + (int)(wbits ^ (wbits >>> 32));
		return h;
	}

	public String toString() {
		return ilabel+":"+olabel+" / "+weight+" -> "+nextState;
	}
}
