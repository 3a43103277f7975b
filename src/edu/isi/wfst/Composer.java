package edu.isi.wfst;

import java.util.ArrayList;
import java.util.Date;

import gnu.trove.TIntObjectHashMap;
import gnu.trove.TObjectIntHashMap;

// Composition of weighted transducers: if a maps x to y and b maps y to z,
// the result maps x to z. Result states are (a state, b state, filter state)
// triples, created only when reached from the start triple, so the result is
// accessible by construction. The result is built privately and handed back
// only when finished.
public class Composer {

	// one composite state
	private static class StateTuple {
		final int sa;
		final int sb;
		final int fs;
		StateTuple(int a, int b, int f) {
			sa = a;
			sb = b;
			fs = f;
		}
		public boolean equals(Object o) {
			if (!(o instanceof StateTuple))
				return false;
			StateTuple t = (StateTuple)o;
			return sa == t.sa && sb == t.sb && fs == t.fs;
		}
		public int hashCode() {
			return (31*sa + sb)*31 + fs;
		}
		public String toString() {
			return "("+sa+", "+sb+", "+fs+")";
		}
	}

	private Fst a;
	private Fst b;
	private ComposeFilter filter;
	private Semiring semiring;
	private Fst result;

	// triple -> result state
	private TObjectIntHashMap tupleIds;
	// result state -> triple
	private ArrayList<StateTuple> tuples;
	// b state -> (input label -> ArrayList<Transition>), built on first visit
	private TIntObjectHashMap bIndex;

	// counters for the timing report
	private int pairsTried = 0;
	private int pairsBlocked = 0;

	private Composer(Fst fa, Fst fb, ComposeFilter f) {
		a = fa;
		b = fb;
		filter = f;
		semiring = fa.getSemiring();
		result = new Fst(semiring);
		tupleIds = new TObjectIntHashMap();
		tuples = new ArrayList<StateTuple>();
		bIndex = new TIntObjectHashMap();
	}

	public static Fst compose(Fst a, Fst b) throws ImproperConversionException, SymbolTableMismatchException {
		return compose(a, b, new ComposeConfig());
	}

	public static Fst compose(Fst a, Fst b, ComposeConfig config) throws ImproperConversionException, SymbolTableMismatchException {
		boolean debug = false;
		if (a == null || b == null)
			throw new NullPointerException("Can't compose null transducer");
		if (config == null)
			config = new ComposeConfig();
		if (debug) Debug.debug(debug, "Composing with "+config);
		if (!a.getSemiring().sameAs(b.getSemiring()))
			throw new ImproperConversionException("Transducers must have same semiring to be composed; got "+
					a.getSemiring()+" and "+b.getSemiring());
		if (config.isMatchSymbolTables() &&
				a.getOutputSymbols() != null &&
				b.getInputSymbols() != null &&
				!a.getOutputSymbols().equals(b.getInputSymbols()))
			throw new SymbolTableMismatchException("Output symbols of first transducer ("+
					a.getOutputSymbols().getNumSymbols()+" symbols) don't match input symbols of second ("+
					b.getInputSymbols().getNumSymbols()+" symbols)");

		Date preComposeTime = new Date();
		Composer c = new Composer(a, b, config.getFilter());
		Fst out = c.build();
		Debug.dbtime(1, preComposeTime, "Composition with "+config.getFilter()+" filter built "+
				out.getNumStates()+" states; "+c.pairsTried+" pairs tried, "+c.pairsBlocked+" blocked by filter");
		if (config.isConnect())
			out.connect();
		out.setInputSymbols(a.getInputSymbols());
		out.setOutputSymbols(b.getOutputSymbols());
		return out;
	}

	private Fst build() {
		boolean debug = false;
		// no start on either side is the empty relation
		if (!a.hasStart() || !b.hasStart()) {
			if (debug) Debug.debug(debug, "Missing start state; result is empty");
			return result;
		}
		result.setStart(findState(a.getStart(), b.getStart(), filter.start()));
		// ids are handed out in discovery order, so walking them in order
		// is a fifo worklist that grows as expand() finds new triples
		for (int s = 0; s < tuples.size(); s++)
			expand(s);
		return result;
	}

	// result state for a triple, creating it if it's new
	private int findState(int sa, int sb, int fs) {
		boolean debug = false;
		StateTuple key = new StateTuple(sa, sb, fs);
		if (tupleIds.containsKey(key))
			return tupleIds.get(key);
		int id = result.addState();
		tupleIds.put(key, id);
		tuples.add(key);
		if (debug) Debug.debug(debug, "New composite state "+id+" = "+key);
		return id;
	}

	// b's transitions out of sb keyed by input label
	private TIntObjectHashMap indexOf(int sb) {
		TIntObjectHashMap byLabel = (TIntObjectHashMap)bIndex.get(sb);
		if (byLabel != null)
			return byLabel;
		byLabel = new TIntObjectHashMap();
		for (TrsIterator it = new TrsIterator(b, sb); !it.done(); ) {
			Transition t = it.next();
			ArrayList<Transition> list = (ArrayList<Transition>)byLabel.get(t.getILabel());
			if (list == null) {
				list = new ArrayList<Transition>();
				byLabel.put(t.getILabel(), list);
			}
			list.add(t);
		}
		bIndex.put(sb, byLabel);
		return byLabel;
	}

	private void expand(int s) {
		boolean debug = false;
		StateTuple t = tuples.get(s);
		if (debug) Debug.debug(debug, "Expanding "+s+" = "+t);
		if (a.isFinal(t.sa) && b.isFinal(t.sb))
			result.setFinal(s, semiring.times(a.getFinalWeight(t.sa), b.getFinalWeight(t.sb)));

		ComposeFilter.StateProfile p = ComposeFilter.StateProfile.of(a, t.sa, b, t.sb);
		TIntObjectHashMap byLabel = indexOf(t.sb);
		for (TrsIterator it = new TrsIterator(a, t.sa); !it.done(); ) {
			Transition ta = it.next();
			ComposeFilter.MOVE m = ComposeFilter.MOVE.REAL;
			if (ta.isOutputEpsilon()) {
				// b stays put on its implicit epsilon loop
				addMove(s, t, ta, null, ComposeFilter.MOVE.LEFTEPS, p);
				m = ComposeFilter.MOVE.BOTHEPS;
			}
			ArrayList<Transition> matches = (ArrayList<Transition>)byLabel.get(ta.getOLabel());
			if (matches == null)
				continue;
			for (Transition tb : matches)
				addMove(s, t, ta, tb, m, p);
		}
		// a stays put while b reads nothing
		ArrayList<Transition> bEps = (ArrayList<Transition>)byLabel.get(SymbolTable.EPS_LABEL);
		if (bEps != null) {
			for (Transition tb : bEps)
				addMove(s, t, null, tb, ComposeFilter.MOVE.RIGHTEPS, p);
		}
	}

	// null ta or tb is that side's implicit epsilon loop
	private void addMove(int s, StateTuple t, Transition ta, Transition tb, ComposeFilter.MOVE m, ComposeFilter.StateProfile p) {
		boolean debug = false;
		pairsTried++;
		int nfs = filter.filter(t.fs, m, p);
		if (nfs == ComposeFilter.NO_STATE) {
			pairsBlocked++;
			if (debug) Debug.debug(debug, filter+" blocked "+m+" from "+t);
			return;
		}
		int il = ta == null ? SymbolTable.EPS_LABEL : ta.getILabel();
		int ol = tb == null ? SymbolTable.EPS_LABEL : tb.getOLabel();
		double w = semiring.times(ta == null ? semiring.ONE() : ta.getWeight(),
				tb == null ? semiring.ONE() : tb.getWeight());
		int na = ta == null ? t.sa : ta.getNextState();
		int nb = tb == null ? t.sb : tb.getNextState();
		int dest = findState(na, nb, nfs);
		result.addTr(s, new Transition(il, ol, w, dest));
		if (debug) Debug.debug(debug, "Added "+m+" transition "+s+" -> "+dest);
	}
}
