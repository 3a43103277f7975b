package edu.isi.wfst;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

/**
 * Tests for {@link StateIterator}.
 */
public class StateIteratorTests {

    @Test
    public void testVisitsEveryStateInOrder() {
        Fst fst = new Fst();
        for (int i = 0; i < 5; i++) {
            fst.addState();
        }
        fst.setStart(0);
        fst.setFinal(4, 0.54);
        fst.addTr(0, new Transition(1, 18, 2.33, 4));

        StateIterator it = new StateIterator(fst);
        int expected = 0;
        while (!it.done()) {
            assertThat(it.next(), is(expected));
            expected++;
        }
        assertThat(expected, is(5));
    }

    @Test
    public void testEmptyFstIsDone() {
        assertThat(new StateIterator(new Fst()).done(), is(true));
    }

    @Test(expected = IteratorExhaustedException.class)
    public void testNextWhenDone() {
        Fst fst = new Fst();
        fst.addState();
        StateIterator it = new StateIterator(fst);
        it.next();
        it.next();
    }

    @Test
    public void testWorksAsJavaIterator() {
        Fst fst = new Fst();
        fst.addState();
        fst.addState();
        int count = 0;
        for (StateIterator it = new StateIterator(fst); it.hasNext(); ) {
            assertThat(it.next(), is(count));
            count++;
        }
        assertThat(count, is(2));
    }
}
