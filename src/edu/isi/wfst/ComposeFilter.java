package edu.isi.wfst;

/**
 * Policies deciding which epsilon moves may pair up during composition.
 * <p>
 * Besides its real transitions every state is treated as having an implicit
 * epsilon self-loop, so a composite state can advance one side on an epsilon
 * while the other side stays put. Without a filter the same epsilon path can
 * then be reached by several interleavings. Each policy keeps a small filter
 * state alongside the composite state and rejects all but one interleaving.
 * <ul>
 * <li>TRIVIAL: one filter state, admits every pair. Only safe when one of the
 * operands is epsilon-free.</li>
 * <li>SEQUENCE: once the first transducer stops taking output-epsilon moves,
 * the second takes its input-epsilon moves.</li>
 * <li>ALT_SEQUENCE: SEQUENCE with the roles of the operands swapped.</li>
 * <li>MATCH: prefers pairing epsilons on both sides; single-sided epsilon runs
 * can't switch sides.</li>
 * <li>NO_MATCH: forbids pairing epsilon with epsilon, allows the rest. Leaves
 * redundant paths.</li>
 * </ul>
 */
public enum ComposeFilter {
	TRIVIAL, SEQUENCE, ALT_SEQUENCE, MATCH, NO_MATCH;

	// returned when a pair is blocked
	public static final int NO_STATE = -1;

	// the kind of move a candidate transition pair makes
	public enum MOVE {
		// same non-epsilon symbol on both sides
		REAL,
		// output epsilon of the first paired with input epsilon of the second
		BOTHEPS,
		// first moves on an output epsilon, second stays
		LEFTEPS,
		// second moves on an input epsilon, first stays
		RIGHTEPS
	}

	// epsilon shape of the two component states, as the filters need it
	public static class StateProfile {
		// every transition of the state is an epsilon (on the matched side) and it's not final
		final boolean allEps1;
		final boolean noEps1;
		final boolean allEps2;
		final boolean noEps2;

		public StateProfile(boolean ae1, boolean ne1, boolean ae2, boolean ne2) {
			allEps1 = ae1;
			noEps1 = ne1;
			allEps2 = ae2;
			noEps2 = ne2;
		}

		// first side matches on output labels, second on input labels
		public static StateProfile of(Fst a, int sa, Fst b, int sb) {
			int ne1 = a.getNumOutputEpsilons(sa);
			int ne2 = b.getNumInputEpsilons(sb);
			return new StateProfile(
					ne1 == a.getNumTrs(sa) && !a.isFinal(sa), ne1 == 0,
					ne2 == b.getNumTrs(sb) && !b.isFinal(sb), ne2 == 0);
		}

		public String toString() {
			return "ae1="+allEps1+" ne1="+noEps1+" ae2="+allEps2+" ne2="+noEps2;
		}
	}

	public int start() {
		return 0;
	}

	public int getNumFilterStates() {
		switch (this) {
		case TRIVIAL:
		case NO_MATCH:
			return 1;
		case SEQUENCE:
		case ALT_SEQUENCE:
			return 2;
		case MATCH:
			return 3;
		default:
			throw new UnexpectedCaseException("Unknown filter "+this);
		}
	}

	/**
	 * Transition function: from filter state fs, may move m be taken, and
	 * into which filter state. Returns {@link #NO_STATE} if blocked.
	 */
	public int filter(int fs, MOVE m, StateProfile p) {
		if (fs < 0 || fs >= getNumFilterStates())
			throw new UnexpectedCaseException(this+" filter has no state "+fs);
		switch (this) {
		case TRIVIAL:
			return 0;
		case NO_MATCH:
			return m == MOVE.BOTHEPS ? NO_STATE : 0;
		case SEQUENCE:
			switch (m) {
			case RIGHTEPS:
				return p.allEps1 ? NO_STATE : (p.noEps1 ? 0 : 1);
			case LEFTEPS:
				return fs != 0 ? NO_STATE : 0;
			case BOTHEPS:
				return NO_STATE;
			case REAL:
				return 0;
			default:
				break;
			}
			break;
		case ALT_SEQUENCE:
			switch (m) {
			case LEFTEPS:
				return p.allEps2 ? NO_STATE : (p.noEps2 ? 0 : 1);
			case RIGHTEPS:
				return fs == 1 ? NO_STATE : 0;
			case BOTHEPS:
				return NO_STATE;
			case REAL:
				return 0;
			default:
				break;
			}
			break;
		case MATCH:
			switch (m) {
			case LEFTEPS:
				if (fs == 0)
					return p.noEps2 ? 0 : (p.allEps2 ? NO_STATE : 1);
				return fs == 1 ? 1 : NO_STATE;
			case RIGHTEPS:
				if (fs == 0)
					return p.noEps1 ? 0 : (p.allEps1 ? NO_STATE : 2);
				return fs == 2 ? 2 : NO_STATE;
			case BOTHEPS:
				return fs == 0 ? 0 : NO_STATE;
			case REAL:
				return 0;
			default:
				break;
			}
			break;
		default:
			break;
		}
		throw new UnexpectedCaseException(this+" filter can't handle move "+m+" from state "+fs);
	}
}
