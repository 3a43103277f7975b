package edu.isi.wfst;

import gnu.trove.TIntArrayList;

// one accepted path: the non-epsilon input and output labels read along it and
// the product of its weights, final weight included
public class FstPath {
	private TIntArrayList ilabels;
	private TIntArrayList olabels;
	private double weight;
	private Semiring semiring;

	public FstPath(Semiring s) {
		semiring = s;
		ilabels = new TIntArrayList();
		olabels = new TIntArrayList();
		weight = s.ONE();
	}

	private FstPath(FstPath p) {
		semiring = p.semiring;
		ilabels = new TIntArrayList();
		olabels = new TIntArrayList();
		for (int i = 0; i < p.ilabels.size(); i++)
			ilabels.add(p.ilabels.get(i));
		for (int i = 0; i < p.olabels.size(); i++)
			olabels.add(p.olabels.get(i));
		weight = p.weight;
	}

	// this path extended by t
	public FstPath extend(Transition t) {
		FstPath p = new FstPath(this);
		if (!t.isInputEpsilon())
			p.ilabels.add(t.getILabel());
		if (!t.isOutputEpsilon())
			p.olabels.add(t.getOLabel());
		p.weight = semiring.times(weight, t.getWeight());
		return p;
	}

	// this path closed off with a final weight
	public FstPath finish(double finalWeight) {
		FstPath p = new FstPath(this);
		p.weight = semiring.times(weight, finalWeight);
		return p;
	}

	public int[] getILabels() { return labels(ilabels); }
	public int[] getOLabels() { return labels(olabels); }
	public double getWeight() { return weight; }

	private static int[] labels(TIntArrayList l) {
		int[] ret = new int[l.size()];
		for (int i = 0; i < ret.length; i++)
			ret[i] = l.get(i);
		return ret;
	}

	private static boolean sameLabels(TIntArrayList x, TIntArrayList y) {
		if (x.size() != y.size())
			return false;
		for (int i = 0; i < x.size(); i++)
			if (x.get(i) != y.get(i))
				return false;
		return true;
	}

	public boolean equals(Object o) {
		if (!(o instanceof FstPath))
			return false;
		FstPath p = (FstPath)o;
		return sameLabels(ilabels, p.ilabels) &&
			sameLabels(olabels, p.olabels) &&
			semiring.approxEqual(weight, p.weight);
	}

	public int hashCode() {
		int h = 0;
		for (int i = 0; i < ilabels.size(); i++)
			h = 31*h + ilabels.get(i);
		for (int i = 0; i < olabels.size(); i++)
			h = 17*h + olabels.get(i);
		return h;
	}

	public String toString() {
		StringBuffer buf = new StringBuffer();
		for (int i = 0; i < ilabels.size(); i++)
			buf.append((i > 0 ? " " : "")+ilabels.get(i));
		buf.append(" : ");
		for (int i = 0; i < olabels.size(); i++)
			buf.append((i > 0 ? " " : "")+olabels.get(i));
		buf.append(" / "+weight);
		return buf.toString();
	}
}
