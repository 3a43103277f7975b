package edu.isi.wfst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Date;

import gnu.trove.TIntArrayList;
import gnu.trove.TIntHashSet;
import gnu.trove.TIntObjectHashMap;
import gnu.trove.TIntStack;

// Weighted transducer held as a vector of states. States are dense ints
// handed out in creation order; each holds an optional final weight and its
// outgoing transitions in insertion order. Built incrementally; the only
// operation that removes anything is connect().
public class Fst {

	public static final int NO_STATE = -1;

	// per-state storage
	static class StateRecord {
		boolean isFinal = false;
		double finalWeight;
		ArrayList<Transition> trs = new ArrayList<Transition>();
		int numInputEps = 0;
		int numOutputEps = 0;

		void add(Transition t) {
			trs.add(t);
			if (t.isInputEpsilon())
				numInputEps++;
			if (t.isOutputEpsilon())
				numOutputEps++;
		}
		void set(int pos, Transition t) {
			Transition old = trs.set(pos, t);
			if (old.isInputEpsilon())
				numInputEps--;
			if (old.isOutputEpsilon())
				numOutputEps--;
			if (t.isInputEpsilon())
				numInputEps++;
			if (t.isOutputEpsilon())
				numOutputEps++;
		}
	}

	private ArrayList<StateRecord> states;
	private int startState;
	private Semiring semiring;
	private SymbolTable inputSymbols;
	private SymbolTable outputSymbols;

	public Fst() {
		this(new TropicalSemiring());
	}

	public Fst(Semiring s) {
		if (s == null)
			throw new NullPointerException("Transducer needs a semiring");
		semiring = s;
		states = new ArrayList<StateRecord>();
		startState = NO_STATE;
		inputSymbols = null;
		outputSymbols = null;
	}

	// accessors

	public Semiring getSemiring() { return semiring; }
	public int getNumStates() { return states.size(); }
	public int getStart() { return startState; }
	public boolean hasStart() { return startState != NO_STATE; }

	public SymbolTable getInputSymbols() { return inputSymbols; }
	public SymbolTable getOutputSymbols() { return outputSymbols; }
	public void setInputSymbols(SymbolTable t) { inputSymbols = t; }
	public void setOutputSymbols(SymbolTable t) { outputSymbols = t; }

	private StateRecord record(int s) {
		if (s < 0 || s >= states.size())
			throw new InvalidStateException("State "+s+" not in transducer of "+states.size()+" states");
		return states.get(s);
	}

	public boolean isValidState(int s) {
		return s >= 0 && s < states.size();
	}

	// building

	public int addState() {
		states.add(new StateRecord());
		return states.size()-1;
	}

	public void setStart(int s) {
		record(s);
		startState = s;
	}

	// final with semiring one
	public void setFinal(int s) {
		setFinal(s, semiring.ONE());
	}

	public void setFinal(int s, double w) {
		StateRecord r = record(s);
		r.isFinal = true;
		r.finalWeight = w;
	}

	public void deleteFinalWeight(int s) {
		record(s).isFinal = false;
	}

	// destination doesn't have to exist yet
	public void addTr(int s, Transition t) {
		if (t == null)
			throw new NullPointerException("Null transition added to state "+s);
		record(s).add(t);
	}

	// per-state queries

	public boolean isFinal(int s) {
		return record(s).isFinal;
	}

	// semiring zero for non-final states
	public double getFinalWeight(int s) {
		StateRecord r = record(s);
		return r.isFinal ? r.finalWeight : semiring.ZERO();
	}

	public int getNumTrs(int s) {
		return record(s).trs.size();
	}

	public int getNumInputEpsilons(int s) {
		return record(s).numInputEps;
	}

	public int getNumOutputEpsilons(int s) {
		return record(s).numOutputEps;
	}

	// iterator support. positions are not range checked beyond the list's own check

	Transition getTr(int s, int pos) {
		return record(s).trs.get(pos);
	}

	void setTr(int s, int pos, Transition t) {
		if (t == null)
			throw new NullPointerException("Null transition set on state "+s);
		record(s).set(pos, t);
	}

	// composition

	public Fst compose(Fst other) throws ImproperConversionException, SymbolTableMismatchException {
		return Composer.compose(this, other);
	}

	public Fst compose(Fst other, ComposeConfig config) throws ImproperConversionException, SymbolTableMismatchException {
		return Composer.compose(this, other, config);
	}

	// Trim away states that can't be reached from the start, or from which no
	// final state can be reached. Survivors keep their relative order and are
	// renumbered densely. Transitions into states that were never created go too.
	public void connect() {
		boolean debug = false;
		Date preConnectTime = new Date();
		int before = states.size();

		// phase 1: top down from the start
		TIntHashSet accessible = new TIntHashSet();
		TIntStack readyStates = new TIntStack();
		if (startState != NO_STATE) {
			readyStates.push(startState);
			accessible.add(startState);
		}
		// reverse edges, only among accessible states, for phase 2
		TIntObjectHashMap preds = new TIntObjectHashMap();
		while (readyStates.size() > 0) {
			int currState = readyStates.pop();
			for (Transition t : states.get(currState).trs) {
				int next = t.getNextState();
				if (!isValidState(next))
					continue;
				if (!preds.containsKey(next))
					preds.put(next, new TIntArrayList());
				((TIntArrayList)preds.get(next)).add(currState);
				if (!accessible.contains(next)) {
					accessible.add(next);
					readyStates.push(next);
				}
			}
		}
		if (debug) Debug.debug(debug, accessible.size()+" of "+before+" states accessible");

		// phase 2: bottom up from accessible finals
		TIntHashSet useful = new TIntHashSet();
		for (int s = 0; s < states.size(); s++) {
			if (states.get(s).isFinal && accessible.contains(s)) {
				useful.add(s);
				readyStates.push(s);
			}
		}
		while (readyStates.size() > 0) {
			int currState = readyStates.pop();
			TIntArrayList in = (TIntArrayList)preds.get(currState);
			if (in == null)
				continue;
			for (int i = 0; i < in.size(); i++) {
				int prev = in.get(i);
				if (!useful.contains(prev)) {
					useful.add(prev);
					readyStates.push(prev);
				}
			}
		}
		if (debug) Debug.debug(debug, useful.size()+" of "+before+" states useful");

		keepStates(useful);
		Debug.dbtime(1, preConnectTime, "Connect removed "+(before-states.size())+" of "+before+" states");
	}

	// drop every state not in keep and renumber the rest in order
	private void keepStates(TIntHashSet keep) {
		int[] newId = new int[states.size()];
		ArrayList<StateRecord> kept = new ArrayList<StateRecord>();
		for (int s = 0; s < states.size(); s++) {
			if (keep.contains(s)) {
				newId[s] = kept.size();
				kept.add(states.get(s));
			}
			else
				newId[s] = NO_STATE;
		}
		for (StateRecord r : kept) {
			ArrayList<Transition> oldTrs = r.trs;
			r.trs = new ArrayList<Transition>();
			r.numInputEps = 0;
			r.numOutputEps = 0;
			for (Transition t : oldTrs) {
				int next = t.getNextState();
				if (!isValidState(next) || newId[next] == NO_STATE)
					continue;
				r.add(t.redirect(newId[next]));
			}
		}
		if (startState != NO_STATE)
			startState = newId[startState];
		states = kept;
	}

	// structural equality

	private static class TransitionComp implements Comparator<Transition> {
		public int compare(Transition a, Transition b) {
			if (a.getILabel() != b.getILabel())
				return a.getILabel() < b.getILabel() ? -1 : 1;
			if (a.getOLabel() != b.getOLabel())
				return a.getOLabel() < b.getOLabel() ? -1 : 1;
			if (a.getNextState() != b.getNextState())
				return a.getNextState() < b.getNextState() ? -1 : 1;
			return Double.compare(a.getWeight(), b.getWeight());
		}
	}

	private static final TransitionComp TRANSITION_ORDER = new TransitionComp();

	// same start, same number of states, same finals with matching weights, and
	// per state the same transitions regardless of order. weights compared
	// within the semiring's tolerance
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Fst))
			return false;
		Fst f = (Fst)o;
		if (!semiring.sameAs(f.semiring))
			return false;
		if (startState != f.startState || states.size() != f.states.size())
			return false;
		for (int s = 0; s < states.size(); s++) {
			StateRecord a = states.get(s);
			StateRecord b = f.states.get(s);
			if (a.isFinal != b.isFinal)
				return false;
			if (a.isFinal && !semiring.approxEqual(a.finalWeight, b.finalWeight))
				return false;
			if (a.trs.size() != b.trs.size())
				return false;
			ArrayList<Transition> at = new ArrayList<Transition>(a.trs);
			ArrayList<Transition> bt = new ArrayList<Transition>(b.trs);
			Collections.sort(at, TRANSITION_ORDER);
			Collections.sort(bt, TRANSITION_ORDER);
			for (int i = 0; i < at.size(); i++) {
				Transition x = at.get(i);
				Transition y = bt.get(i);
				if (x.getILabel() != y.getILabel() ||
						x.getOLabel() != y.getOLabel() ||
						x.getNextState() != y.getNextState() ||
						!semiring.approxEqual(x.getWeight(), y.getWeight()))
					return false;
			}
		}
		return true;
	}

	// order-independent and weight-free, to agree with the tolerant equals
	public int hashCode() {
		int h = 31*startState + states.size();
		for (StateRecord r : states) {
			h = 31*h + (r.isFinal ? 1 : 0);
			for (Transition t : r.trs)
				h += 17*t.getILabel() + 13*t.getOLabel() + t.getNextState();
		}
		return h;
	}

	// tab-separated listing, start state's lines first:
	// src dst ilabel olabel weight for transitions, state weight for finals
	public String toString() {
		StringBuffer buf = new StringBuffer();
		if (startState != NO_STATE)
			appendState(buf, startState);
		for (int s = 0; s < states.size(); s++)
			if (s != startState)
				appendState(buf, s);
		return buf.toString();
	}

	private void appendState(StringBuffer buf, int s) {
		StateRecord r = states.get(s);
		for (Transition t : r.trs)
			buf.append(s+"\t"+t.getNextState()+"\t"+t.getILabel()+"\t"+t.getOLabel()+"\t"+t.getWeight()+"\n");
		if (r.isFinal)
			buf.append(s+"\t"+r.finalWeight+"\n");
	}
}
