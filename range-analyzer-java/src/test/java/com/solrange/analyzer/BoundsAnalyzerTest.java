package com.solrange.analyzer;

import com.solrange.analyzer.ast.SolAst.BinaryOp;
import com.solrange.analyzer.ast.SolAst.ContractPart;
import com.solrange.analyzer.config.AnalyzerConfig;
import com.solrange.analyzer.graph.GraphModel.ContextKind;
import com.solrange.analyzer.graph.GraphModel.ContextNode;
import com.solrange.analyzer.report.BoundsAnalyzer;
import com.solrange.analyzer.report.BoundsReport;
import com.solrange.analyzer.report.ReportConfig;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.solrange.analyzer.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class BoundsAnalyzerTest {

    private static Analyzer analyze(ContractPart... parts) {
        Analyzer analyzer = new Analyzer(AnalyzerConfig.defaults(), new Diagnostics(true));
        analyzer.analyze(unit(contract("C", parts)), 0);
        return analyzer;
    }

    /** f(uint256 s) { uint256 a; if (s < 5) a = 1; else a = 2; } */
    private static Analyzer branching() {
        return analyze(function("f", params(param("uint256", "s")),
                declare("uint256", "a", null),
                ifElse(lt(var("s"), num(5)),
                        block(stmt(assign("a", num(1)))),
                        block(stmt(assign("a", num(2)))))));
    }

    private static int entry(Analyzer a) {
        return a.contextByPath("C.f").orElseThrow();
    }

    private static List<String> paths(List<BoundsReport> reports) {
        return reports.stream().map(BoundsReport::contextPath).collect(Collectors.toList());
    }

    @Test
    void subtreeIsPreOrderFromTheQueriedContext() {
        Analyzer a = branching();
        BoundsAnalyzer bounds = a.bounds();
        List<String> order = new ArrayList<>();
        for (int ctx : bounds.subtree(entry(a))) {
            order.add(a.graph().node(ctx, ContextNode.class).path());
        }
        assertEquals(List.of("C.f", "C.f.fork0.true", "C.f.fork0.false", "C.f.fork0.cont"), order);

        int arm = a.contextByPath("C.f.fork0.true").orElseThrow();
        assertEquals(List.of(arm), bounds.subtree(arm));
    }

    @Test
    void assertionFailureContextIsAChildButNotReported() {
        Analyzer a = analyze(function("f", params(param("uint256", "x")),
                require(lt(var("x"), num(10)))));
        int failure = a.contextByPath("C.f.require0").orElseThrow();
        BoundsAnalyzer bounds = a.bounds();

        assertTrue(bounds.children(entry(a)).contains(failure));
        assertFalse(bounds.subtree(entry(a)).contains(failure));
        assertTrue(bounds.boundsFor(failure, "x").isEmpty());
        assertEquals(ContextKind.ENTRY, bounds.boundsFor(entry(a), "x").get(0).contextKind());
    }

    @Test
    void liveVersionsAreKeyedInFirstBindingOrder() {
        Analyzer a = branching();
        assertEquals(List.of("s", "a"), List.copyOf(a.bounds().liveVersions(entry(a)).keySet()));
    }

    @Test
    void hidingConstantsLeavesOnlyTheMergedRange() {
        Analyzer a = branching();
        List<BoundsReport> reports = a.bounds().boundsFor(entry(a), "a", ReportConfig.defaults().withShowConsts(false));
        assertEquals(List.of("C.f.fork0.cont"), paths(reports));
        assertEquals(BigInteger.ONE, reports.get(0).range().min());
        assertEquals(BigInteger.TWO, reports.get(0).range().max());
    }

    @Test
    void valueNarrowedToOnePointIsNotTreatedAsAConstant() {
        Analyzer a = analyze(function("f", params(param("uint256", "x")),
                require(bin(BinaryOp.EQ, var("x"), num(5))),
                declare("uint256", "k", num(9))));
        ReportConfig noConsts = ReportConfig.defaults().withShowConsts(false);

        List<BoundsReport> x = a.bounds().boundsFor(entry(a), "x", noConsts);
        assertEquals(1, x.size());
        assertTrue(x.get(0).range().isExact());
        assertEquals(BigInteger.valueOf(5), x.get(0).range().min());
        assertTrue(a.bounds().boundsFor(entry(a), "k", noConsts).isEmpty());
    }

    @Test
    void withoutSubcontextsOnlyTheQueriedContextIsReported() {
        Analyzer a = branching();
        List<BoundsReport> reports = a.bounds().boundsFor(entry(a), "a", ReportConfig.defaults().withShowSubctxs(false));
        assertEquals(List.of("C.f"), paths(reports));
        assertTrue(reports.get(0).range().isExact());
    }

    @Test
    void temporariesAreHiddenUnlessRequested() {
        Analyzer a = analyze(function("f", params(param("uint256", "s")),
                stmt(add(var("s"), num(1)))));
        BoundsAnalyzer bounds = a.bounds();

        List<BoundsReport> hidden = bounds.boundsForAll(entry(a), ReportConfig.defaults());
        assertTrue(hidden.stream().noneMatch(BoundsReport::temporary));

        List<BoundsReport> shown = bounds.boundsForAll(entry(a), ReportConfig.defaults().withShowTmps(true));
        List<BoundsReport> tmps = shown.stream().filter(BoundsReport::temporary).collect(Collectors.toList());
        assertEquals(1, tmps.size());
        assertTrue(tmps.get(0).variable().startsWith("tmp"));
        assertEquals("s + 1", tmps.get(0).derivation());
    }

    @Test
    void withoutEvaluationOnlyTheDerivationIsReported() {
        Analyzer a = branching();
        ReportConfig symbolic = new ReportConfig(false, false, true, true, true);
        List<BoundsReport> reports = a.bounds().boundsFor(entry(a), "a", symbolic);
        assertEquals(4, reports.size());
        for (BoundsReport r : reports) {
            assertNull(r.range());
            assertNull(r.initialRange());
            assertNotNull(r.derivation());
            assertFalse(r.mayWrap());
        }
        assertEquals("default value", reports.get(0).derivation());
    }

    @Test
    void initialRangeIsOmittedWhenNotRequested() {
        Analyzer a = branching();
        int arm = a.contextByPath("C.f.fork0.true").orElseThrow();
        BoundsReport withInitial = a.bounds().boundsFor(arm, "s").get(0);
        assertNotNull(withInitial.initialRange());
        BoundsReport without = a.bounds().boundsFor(arm, "s", new ReportConfig(true, false, true, true, false)).get(0);
        assertNull(without.initialRange());
        assertEquals(withInitial.range(), without.range());
    }

    @Test
    void repeatedQueriesGiveTheSameAnswer() {
        Analyzer a = branching();
        List<BoundsReport> first = a.bounds().boundsForAll(entry(a), ReportConfig.defaults());
        int nodes = a.graph().size();
        List<BoundsReport> second = a.bounds().boundsForAll(entry(a), ReportConfig.defaults());
        assertEquals(first, second);
        assertEquals(nodes, a.graph().size(), "queries add nothing to the graph");
    }

    @Test
    void unknownNameGivesNoReports() {
        Analyzer a = branching();
        assertTrue(a.bounds().boundsFor(entry(a), "nope").isEmpty());
    }

    @Test
    void reportTypeNamesTheDeclaredType() {
        Analyzer a = analyze(function("f", params(param("uint8", "small"))));
        BoundsReport r = a.boundsFor(entry(a), "small").get(0);
        assertEquals("uint8", r.type());
        assertEquals(BigInteger.valueOf(255), r.range().max());
    }
}
