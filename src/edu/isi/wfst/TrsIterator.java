package edu.isi.wfst;

import java.util.Iterator;

// read-only walk over the transitions leaving one state, in insertion order.
// Not safe against another writer changing that state's transitions mid-walk.
public class TrsIterator implements Iterator<Transition> {
	private Fst fst;
	private int state;
	private int cursor;

	public TrsIterator(Fst f, int s) throws InvalidStateException {
		if (f == null)
			throw new NullPointerException("Can't iterate over null transducer");
		if (!f.isValidState(s))
			throw new InvalidStateException("State "+s+" not in transducer of "+f.getNumStates()+" states");
		fst = f;
		state = s;
		cursor = 0;
	}

	public int getState() { return state; }

	public boolean done() {
		return cursor >= fst.getNumTrs(state);
	}

	public boolean hasNext() {
		return !done();
	}

	// current transition, then advance
	public Transition next() throws IteratorExhaustedException {
		if (done())
			throw new IteratorExhaustedException("No more transitions from state "+state);
		return fst.getTr(state, cursor++);
	}

	public void reset() {
		cursor = 0;
	}

	public void remove() throws UnsupportedOperationException {
		throw new UnsupportedOperationException("Use MutableTrsIterator to change transitions");
	}
}
