package edu.isi.wfst;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.NoSuchElementException;

import gnu.trove.TObjectIntHashMap;

/**
 * Bijective mapping between integer labels and symbol strings. Id 0 is always
 * the epsilon symbol; other ids are handed out in order of first insertion.
 */
public class SymbolTable implements Iterable<SymbolTable.Entry> {

	public static final String EPS_SYMBOL = "<eps>";
	public static final int EPS_LABEL = 0;

	// id -> label is positional; label -> id is hashed
	private ArrayList<String> i2s;
	private TObjectIntHashMap s2i;

	public SymbolTable() {
		i2s = new ArrayList<String>();
		s2i = new TObjectIntHashMap();
		i2s.add(EPS_SYMBOL);
		s2i.put(EPS_SYMBOL, EPS_LABEL);
	}

	// epsilon followed by the given symbols, duplicates collapsed
	public static SymbolTable fromSymbols(String... symbols) {
		SymbolTable t = new SymbolTable();
		for (String s : symbols)
			t.addSymbol(s);
		return t;
	}

	/** id of s, allocating the next free id if s is new */
	public int addSymbol(String s) {
		boolean debug = false;
		if (s == null)
			throw new NullPointerException("Can't add null symbol");
		if (s2i.containsKey(s))
			return s2i.get(s);
		int id = i2s.size();
		i2s.add(s);
		s2i.put(s, id);
		if (debug) Debug.debug(debug, "Added "+s+" as "+id);
		return id;
	}

	/**
	 * Adds every label of other (epsilon excepted) that isn't already here,
	 * in other's id order.
	 */
	public void addTable(SymbolTable other) {
		boolean debug = false;
		int before = getNumSymbols();
		for (Entry e : other) {
			if (e.getId() == EPS_LABEL)
				continue;
			addSymbol(e.getLabel());
		}
		if (debug) Debug.debug(debug, "Merge added "+(getNumSymbols()-before)+" symbols");
	}

	public String find(int id) throws SymbolNotFoundException {
		if (!member(id))
			throw new SymbolNotFoundException("No symbol with id "+id);
		return i2s.get(id);
	}

	public int find(String s) throws SymbolNotFoundException {
		if (!member(s))
			throw new SymbolNotFoundException("No symbol "+s);
		return s2i.get(s);
	}

	public boolean member(int id) {
		return id >= 0 && id < i2s.size();
	}

	public boolean member(String s) {
		return s != null && s2i.containsKey(s);
	}

	public int getNumSymbols() {
		return i2s.size();
	}

	// independent deep copy
	public SymbolTable copy() {
		SymbolTable t = new SymbolTable();
		for (int i = 1; i < i2s.size(); i++)
			t.addSymbol(i2s.get(i));
		return t;
	}

	// ascending id order, starting with epsilon. each call starts over
	public Iterator<Entry> iterator() {
		return new Iterator<Entry>() {
			private int next = 0;
			public boolean hasNext() {
				return next < i2s.size();
			}
			public Entry next() {
				if (next >= i2s.size())
					throw new NoSuchElementException("Symbol table has only "+i2s.size()+" symbols");
				Entry e = new Entry(next, i2s.get(next));
				next++;
				return e;
			}
			public void remove() {
				throw new UnsupportedOperationException("Symbol tables are append-only");
			}
		};
	}

	// ids are dense, so equal (id, label) sets means equal label lists
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof SymbolTable))
			return false;
		return i2s.equals(((SymbolTable)o).i2s);
	}

	public int hashCode() {
		return i2s.hashCode();
	}

	public String toString() {
		StringBuffer buf = new StringBuffer();
		for (int i = 0; i < i2s.size(); i++)
			buf.append(i2s.get(i)+"\t"+i+"\n");
		return buf.toString();
	}

	// one (id, label) pair
	public static class Entry {
		private int id;
		private String label;
		public Entry(int i, String l) { id = i; label = l; }
		public int getId() { return id; }
		public String getLabel() { return label; }
		public boolean equals(Object o) {
			if (!(o instanceof Entry))
				return false;
			Entry e = (Entry)o;
			return id == e.id && label.equals(e.label);
		}
		public int hashCode() { return 31*id + label.hashCode(); }
		public String toString() { return "("+id+", "+label+")"; }
	}
}
