package edu.isi.wfst;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedList;

// Breadth-first enumeration of the paths a transducer accepts, shortest
// first. Never ends on a transducer with a cycle reachable from the start.
public class PathsIterator implements Iterator<FstPath> {
	private Fst fst;
	// pending (state, path so far) pairs
	private LinkedList<Integer> stateQueue;
	private LinkedList<FstPath> pathQueue;
	// accepted paths found but not handed out yet
	private ArrayList<FstPath> ready;

	public PathsIterator(Fst f) {
		if (f == null)
			throw new NullPointerException("Can't iterate over null transducer");
		fst = f;
		stateQueue = new LinkedList<Integer>();
		pathQueue = new LinkedList<FstPath>();
		ready = new ArrayList<FstPath>();
		if (fst.hasStart()) {
			stateQueue.add(fst.getStart());
			pathQueue.add(new FstPath(fst.getSemiring()));
		}
	}

	// run the queue until some path is accepted or nothing is left
	private void fill() {
		while (ready.isEmpty() && !stateQueue.isEmpty()) {
			int s = stateQueue.removeFirst();
			FstPath path = pathQueue.removeFirst();
			for (TrsIterator it = new TrsIterator(fst, s); !it.done(); ) {
				Transition t = it.next();
				stateQueue.add(t.getNextState());
				pathQueue.add(path.extend(t));
			}
			if (fst.isFinal(s))
				ready.add(path.finish(fst.getFinalWeight(s)));
		}
	}

	public boolean done() {
		fill();
		return ready.isEmpty();
	}

	public boolean hasNext() {
		return !done();
	}

	public FstPath next() throws IteratorExhaustedException {
		if (done())
			throw new IteratorExhaustedException("No more accepted paths");
		return ready.remove(0);
	}

	public void remove() throws UnsupportedOperationException {
		throw new UnsupportedOperationException("Paths can't be removed");
	}
}
