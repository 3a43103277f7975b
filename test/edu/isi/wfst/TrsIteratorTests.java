package edu.isi.wfst;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.is;

/**
 * Tests for {@link TrsIterator}.
 */
public class TrsIteratorTests {

    @Test
    public void testSingleTransitionAndReset() {
        Fst fst = new Fst();
        int s1 = fst.addState();
        int s2 = fst.addState();
        fst.setStart(s1);
        fst.setFinal(s2, 0.54);
        Transition tr1 = new Transition(1, 18, 2.33, s2);
        fst.addTr(s1, tr1);

        TrsIterator it = new TrsIterator(fst, s1);
        Transition tr = it.next();
        assertThat(tr.getILabel(), is(1));
        assertThat(tr.getOLabel(), is(18));
        assertThat(tr.getWeight(), closeTo(2.33, 1e-9));
        assertThat(tr.getNextState(), is(s2));
        assertThat(it.done(), is(true));

        it.reset();
        assertThat(it.done(), is(false));
        int count = 0;
        while (!it.done()) {
            assertThat(it.next(), is(tr1));
            count++;
        }
        assertThat(count, is(1));
    }

    @Test
    public void testInsertionOrderIsStable() {
        Fst fst = new Fst();
        int s = fst.addState();
        Transition[] trs = new Transition[] {
                new Transition(3, 3, 0.0, s),
                new Transition(1, 1, 0.0, s),
                new Transition(2, 2, 0.0, s) };
        for (Transition t : trs) {
            fst.addTr(s, t);
        }
        TrsIterator first = new TrsIterator(fst, s);
        TrsIterator second = new TrsIterator(fst, s);
        for (Transition t : trs) {
            assertThat(first.next(), is(t));
            assertThat(second.next(), is(t));
        }
        assertThat(first.done(), is(true));
        assertThat(second.done(), is(true));
    }

    @Test
    public void testStateWithoutTransitions() {
        Fst fst = new Fst();
        int s = fst.addState();
        TrsIterator it = new TrsIterator(fst, s);
        assertThat(it.done(), is(true));
        it.reset();
        assertThat(it.done(), is(true));
    }

    @Test(expected = IteratorExhaustedException.class)
    public void testNextWhenDone() {
        Fst fst = new Fst();
        int s = fst.addState();
        fst.addTr(s, new Transition(1, 1, 0.0, s));
        TrsIterator it = new TrsIterator(fst, s);
        it.next();
        it.next();
    }

    @Test(expected = InvalidStateException.class)
    public void testMissingState() {
        new TrsIterator(new Fst(), 0);
    }
}
