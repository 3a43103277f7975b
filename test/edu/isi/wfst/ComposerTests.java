package edu.isi.wfst;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;

/**
 * Tests for {@link Composer}.
 */
public class ComposerTests {

    // maps 1 -> 2 (reaching a state that also loops 3 -> 5) and 1 -> 4
    private static Fst exampleA() {
        Fst fst1 = new Fst();
        int s1 = fst1.addState();
        int s2 = fst1.addState();
        int s3 = fst1.addState();
        fst1.setStart(s1);
        fst1.setFinal(s2);
        fst1.setFinal(s3);
        fst1.addTr(s1, new Transition(1, 2, 1.0, s2));
        fst1.addTr(s1, new Transition(1, 4, 2.0, s3));
        fst1.addTr(s2, new Transition(3, 5, 2.0, s2));
        return fst1;
    }

    private static Fst exampleB() {
        Fst fst2 = new Fst();
        int s1 = fst2.addState();
        int s2 = fst2.addState();
        int s3 = fst2.addState();
        fst2.setStart(s1);
        fst2.setFinal(s3);
        fst2.addTr(s1, new Transition(2, 6, 1.0, s2));
        fst2.addTr(s2, new Transition(5, 7, 2.5, s3));
        fst2.addTr(s3, new Transition(5, 8, 1.5, s3));
        fst2.addTr(s1, new Transition(4, 9, 3.0, s3));
        return fst2;
    }

    private static Fst exampleResult() {
        Fst expected = new Fst();
        int s1 = expected.addState();
        int s2 = expected.addState();
        int s3 = expected.addState();
        int s4 = expected.addState();
        expected.setStart(s1);
        expected.setFinal(s3);
        expected.setFinal(s4);
        expected.addTr(s1, new Transition(1, 6, 2.0, s2));
        expected.addTr(s1, new Transition(1, 9, 5.0, s3));
        expected.addTr(s2, new Transition(3, 7, 4.5, s4));
        expected.addTr(s4, new Transition(3, 8, 3.5, s4));
        return expected;
    }

    // a reads 1 writing nothing, then 2 writing 3
    private static Fst epsilonA() {
        Fst a = new Fst();
        a.addState();
        a.addState();
        a.addState();
        a.setStart(0);
        a.setFinal(2);
        a.addTr(0, new Transition(1, 0, 1.0, 1));
        a.addTr(1, new Transition(2, 3, 2.0, 2));
        return a;
    }

    // b writes 4 reading nothing, then reads 3 writing 5
    private static Fst epsilonB() {
        Fst b = new Fst();
        b.addState();
        b.addState();
        b.addState();
        b.setStart(0);
        b.setFinal(2);
        b.addTr(0, new Transition(0, 4, 0.5, 1));
        b.addTr(1, new Transition(3, 5, 0.25, 2));
        return b;
    }

    private static List<FstPath> paths(Fst fst) {
        List<FstPath> list = new ArrayList<>();
        for (PathsIterator it = new PathsIterator(fst); !it.done(); ) {
            list.add(it.next());
        }
        return list;
    }

    @Test
    public void testComposeFst() throws Exception {
        Fst fst3 = exampleA().compose(exampleB());
        assertThat(fst3, is(exampleResult()));
    }

    @Test
    public void testComposeConfig() throws Exception {
        ComposeConfig config = new ComposeConfig(ComposeFilter.TRIVIAL, true);
        Fst fst3 = Composer.compose(exampleA(), exampleB(), config);
        assertThat(fst3, is(exampleResult()));
    }

    @Test
    public void testEveryFilterAgreesWithoutEpsilons() throws Exception {
        for (ComposeFilter f : ComposeFilter.values()) {
            for (boolean connect : new boolean[] { true, false }) {
                Fst fst3 = Composer.compose(exampleA(), exampleB(), new ComposeConfig(f, connect));
                assertThat(f + " connect=" + connect, fst3, is(exampleResult()));
            }
        }
    }

    @Test
    public void testMissingStartGivesEmptyRelation() throws Exception {
        Fst noStart = new Fst();
        noStart.addState();
        noStart.setFinal(0);

        Fst left = Composer.compose(noStart, exampleB(), new ComposeConfig(ComposeFilter.SEQUENCE, false));
        assertThat(left.hasStart(), is(false));
        assertThat(left.getNumStates(), is(0));

        Fst right = Composer.compose(exampleA(), noStart);
        assertThat(right.hasStart(), is(false));
        assertThat(right.getNumStates(), is(0));
    }

    @Test
    public void testDisjointAlphabets() throws Exception {
        Fst a = new Fst();
        a.addState();
        a.addState();
        a.setStart(0);
        a.setFinal(1);
        a.addTr(0, new Transition(1, 2, 1.0, 1));
        Fst b = new Fst();
        b.addState();
        b.addState();
        b.setStart(0);
        b.setFinal(1);
        b.addTr(0, new Transition(3, 4, 1.0, 1));

        Fst unconnected = Composer.compose(a, b, new ComposeConfig(ComposeFilter.SEQUENCE, false));
        assertThat(unconnected.hasStart(), is(true));
        assertThat(unconnected.getNumTrs(unconnected.getStart()), is(0));
        assertThat(new PathsIterator(unconnected).done(), is(true));

        Fst connected = Composer.compose(a, b);
        assertThat(connected.hasStart(), is(false));
        assertThat(connected.getNumStates(), is(0));
    }

    @Test
    public void testConnectFlagKeepsOrTrimsDeadEnds() throws Exception {
        Fst a = new Fst();
        a.addState();
        a.addState();
        a.addState();
        a.setStart(0);
        a.setFinal(1);
        a.addTr(0, new Transition(1, 2, 1.0, 1));
        a.addTr(0, new Transition(1, 3, 1.0, 2));
        Fst b = new Fst();
        b.addState();
        b.addState();
        b.addState();
        b.setStart(0);
        b.setFinal(1);
        b.addTr(0, new Transition(2, 2, 1.0, 1));
        b.addTr(0, new Transition(3, 3, 1.0, 2));

        Fst kept = Composer.compose(a, b, new ComposeConfig(ComposeFilter.SEQUENCE, false));
        assertThat(kept.getNumStates(), is(3));
        assertThat(kept.isFinal(2), is(false));

        Fst trimmed = Composer.compose(a, b, new ComposeConfig(ComposeFilter.SEQUENCE, true));
        assertThat(trimmed.getNumStates(), is(2));
        assertThat(trimmed.getNumTrs(trimmed.getStart()), is(1));
    }

    @Test
    public void testFinalWeightsCombine() throws Exception {
        Fst a = new Fst();
        a.addState();
        a.setStart(0);
        a.setFinal(0, 0.5);
        Fst b = new Fst();
        b.addState();
        b.setStart(0);
        b.setFinal(0, 0.25);

        Fst c = Composer.compose(a, b);
        assertThat(c.getNumStates(), is(1));
        assertThat(c.getFinalWeight(c.getStart()), closeTo(0.75, 1e-9));
    }

    @Test
    public void testSequenceFilterOnEpsilons() throws Exception {
        Fst c = Composer.compose(epsilonA(), epsilonB(), new ComposeConfig(ComposeFilter.SEQUENCE, true));

        // a's epsilon goes first, then b's, then the real match
        Fst expected = new Fst();
        for (int i = 0; i < 4; i++) {
            expected.addState();
        }
        expected.setStart(0);
        expected.setFinal(3);
        expected.addTr(0, new Transition(1, 0, 1.0, 1));
        expected.addTr(1, new Transition(0, 4, 0.5, 2));
        expected.addTr(2, new Transition(2, 5, 2.25, 3));
        assertThat(c, is(expected));
    }

    @Test
    public void testFiltersRemoveRedundantEpsilonPaths() throws Exception {
        FstPath only = new FstPath(new TropicalSemiring())
                .extend(new Transition(1, 4, 1.5, 0))
                .extend(new Transition(2, 5, 2.25, 0));

        Object[][] expectedCounts = new Object[][] {
                { ComposeFilter.SEQUENCE, 1 },
                { ComposeFilter.ALT_SEQUENCE, 1 },
                { ComposeFilter.MATCH, 1 },
                { ComposeFilter.NO_MATCH, 2 },
                { ComposeFilter.TRIVIAL, 3 } };
        for (Object[] row : expectedCounts) {
            ComposeFilter f = (ComposeFilter) row[0];
            List<FstPath> found = paths(Composer.compose(epsilonA(), epsilonB(), new ComposeConfig(f, true)));
            assertThat(f.toString(), found.size(), is(row[1]));
            assertThat(f.toString(), found, everyItem(is(only)));
        }
    }

    @Test
    public void testEpsilonLoopsTerminate() throws Exception {
        Fst a = new Fst();
        a.addState();
        a.addState();
        a.setStart(0);
        a.setFinal(1);
        a.addTr(0, new Transition(1, 0, 1.0, 0));
        a.addTr(0, new Transition(2, 3, 1.0, 1));
        Fst b = new Fst();
        b.addState();
        b.addState();
        b.setStart(0);
        b.setFinal(1);
        b.addTr(0, new Transition(0, 5, 1.0, 0));
        b.addTr(0, new Transition(3, 4, 1.0, 1));

        for (ComposeFilter f : ComposeFilter.values()) {
            Fst c = Composer.compose(a, b, new ComposeConfig(f, true));
            assertThat(f.toString(), c.hasStart(), is(true));
            // at most (2 a states) x (2 b states) x (filter states)
            assertThat(f.toString(), c.getNumStates() <= 4 * f.getNumFilterStates(), is(true));
        }
    }

    @Test
    public void testProbabilityWeightsMultiply() throws Exception {
        Semiring prob = new ProbabilitySemiring();
        Fst a = new Fst(prob);
        a.addState();
        a.addState();
        a.setStart(0);
        a.setFinal(1);
        a.addTr(0, new Transition(1, 2, 0.5, 1));
        Fst b = new Fst(prob);
        b.addState();
        b.addState();
        b.setStart(0);
        b.setFinal(1);
        b.addTr(0, new Transition(2, 3, 0.4, 1));

        Fst c = a.compose(b);
        assertThat(c.getSemiring(), is(sameInstance(prob)));
        Transition t = new TrsIterator(c, c.getStart()).next();
        assertThat(t.getWeight(), closeTo(0.2, 1e-9));
        assertThat(c.getFinalWeight(t.getNextState()), closeTo(1.0, 1e-9));
    }

    @Test(expected = ImproperConversionException.class)
    public void testSemiringMismatch() throws Exception {
        Fst a = new Fst(new TropicalSemiring());
        Fst b = new Fst(new LogSemiring());
        Composer.compose(a, b);
    }

    @Test(expected = SymbolTableMismatchException.class)
    public void testSymbolTableMismatch() throws Exception {
        Fst a = exampleA();
        Fst b = exampleB();
        a.setOutputSymbols(SymbolTable.fromSymbols("x", "y"));
        b.setInputSymbols(SymbolTable.fromSymbols("y", "x"));
        Composer.compose(a, b);
    }

    @Test
    public void testSymbolTableCheckCanBeSkipped() throws Exception {
        Fst a = exampleA();
        Fst b = exampleB();
        a.setOutputSymbols(SymbolTable.fromSymbols("x", "y"));
        b.setInputSymbols(SymbolTable.fromSymbols("y", "x"));
        ComposeConfig config = new ComposeConfig();
        config.setMatchSymbolTables(false);
        assertThat(Composer.compose(a, b, config), is(exampleResult()));
    }

    @Test
    public void testResultCarriesOuterSymbolTables() throws Exception {
        SymbolTable in = SymbolTable.fromSymbols("i");
        SymbolTable mid = SymbolTable.fromSymbols("m");
        SymbolTable out = SymbolTable.fromSymbols("o");
        Fst a = exampleA();
        Fst b = exampleB();
        a.setInputSymbols(in);
        a.setOutputSymbols(mid);
        b.setInputSymbols(mid.copy());
        b.setOutputSymbols(out);

        Fst c = Composer.compose(a, b);
        assertThat(c.getInputSymbols(), is(sameInstance(in)));
        assertThat(c.getOutputSymbols(), is(sameInstance(out)));
    }

    @Test
    public void testOneMissingTableIsCompatible() throws Exception {
        Fst a = exampleA();
        a.setOutputSymbols(SymbolTable.fromSymbols("x"));
        assertThat(Composer.compose(a, exampleB()), is(exampleResult()));
    }

    @Test
    public void testInputsAreNotModified() throws Exception {
        Fst a = exampleA();
        Fst b = exampleB();
        Composer.compose(a, b);
        assertThat(a, is(exampleA()));
        assertThat(b, is(exampleB()));
    }
}
