package edu.isi.wfst;

import java.util.Iterator;

// walks state ids in creation order. Holds the transducer, so the transducer
// lives at least as long as the iterator. States added while iterating are
// picked up; there is no rewind.
public class StateIterator implements Iterator<Integer> {
	private Fst fst;
	private int cursor;

	public StateIterator(Fst f) {
		if (f == null)
			throw new NullPointerException("Can't iterate over null transducer");
		fst = f;
		cursor = 0;
	}

	public boolean done() {
		return cursor >= fst.getNumStates();
	}

	public boolean hasNext() {
		return !done();
	}

	public Integer next() throws IteratorExhaustedException {
		if (done())
			throw new IteratorExhaustedException("All "+fst.getNumStates()+" states already visited");
		return cursor++;
	}

	public void remove() throws UnsupportedOperationException {
		throw new UnsupportedOperationException("States can't be removed through an iterator");
	}
}
