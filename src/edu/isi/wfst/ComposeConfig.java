package edu.isi.wfst;

// options for Composer. defaults: sequence filter, connect the result,
// insist the linking symbol tables agree
public class ComposeConfig {
	private ComposeFilter filter;
	private boolean connect;
	private boolean matchSymbolTables;

	public ComposeConfig() {
		this(ComposeFilter.SEQUENCE, true);
	}

	public ComposeConfig(ComposeFilter f, boolean c) {
		if (f == null)
			throw new NullPointerException("Compose filter must be set");
		filter = f;
		connect = c;
		matchSymbolTables = true;
	}

	public ComposeFilter getFilter() { return filter; }
	public boolean isConnect() { return connect; }
	public boolean isMatchSymbolTables() { return matchSymbolTables; }

	// when false, a's output table and b's input table are not compared
	public void setMatchSymbolTables(boolean b) { matchSymbolTables = b; }

	public String toString() {
		return "filter="+filter+" connect="+connect+" matchSymbolTables="+matchSymbolTables;
	}
}
