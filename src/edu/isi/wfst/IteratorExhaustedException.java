package edu.isi.wfst;

import java.util.NoSuchElementException;

// thrown by the transducer iterators when asked to advance past their end
public class IteratorExhaustedException extends NoSuchElementException {
	public IteratorExhaustedException() { super(); }
	public IteratorExhaustedException(String message) { super(message); }
}
