package edu.isi.wfst;

// Walk over the transitions leaving one state that can overwrite the
// transition under the cursor. Same done/reset behavior as TrsIterator, but
// next() only advances and value() reads.
// Single writer: no other iterator may be open on the same state while this
// one writes. That is not checked.
public class MutableTrsIterator {
	private Fst fst;
	private int state;
	private int cursor;

	public MutableTrsIterator(Fst f, int s) throws InvalidStateException {
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

	public void next() throws IteratorExhaustedException {
		if (done())
			throw new IteratorExhaustedException("No more transitions from state "+state);
		cursor++;
	}

	public Transition value() throws IteratorExhaustedException {
		if (done())
			throw new IteratorExhaustedException("No transition under cursor of state "+state);
		return fst.getTr(state, cursor);
	}

	// replaces the current transition in the transducer; cursor stays put
	public void setValue(Transition t) throws IteratorExhaustedException {
		boolean debug = false;
		if (done())
			throw new IteratorExhaustedException("No transition under cursor of state "+state);
		if (debug) Debug.debug(debug, "Replacing "+fst.getTr(state, cursor)+" with "+t);
		fst.setTr(state, cursor, t);
	}

	public void reset() {
		cursor = 0;
	}
}
