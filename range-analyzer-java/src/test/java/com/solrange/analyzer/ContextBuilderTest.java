package com.solrange.analyzer;

import com.solrange.analyzer.ast.SolAst.AssignOp;
import com.solrange.analyzer.ast.SolAst.BinaryOp;
import com.solrange.analyzer.ast.SolAst.ContractPart;
import com.solrange.analyzer.config.AnalyzerConfig;
import com.solrange.analyzer.graph.GraphModel.ContextKind;
import com.solrange.analyzer.graph.GraphModel.ContextNode;
import com.solrange.analyzer.graph.GraphModel.ContextVarNode;
import com.solrange.analyzer.graph.GraphModel.EdgeKind;
import com.solrange.analyzer.graph.GraphModel.VarOrigin;
import com.solrange.analyzer.graph.SemanticGraph;
import com.solrange.analyzer.range.Constraint;
import com.solrange.analyzer.range.NarrowingStep;
import com.solrange.analyzer.range.Range;
import com.solrange.analyzer.report.BoundsReport;
import com.solrange.analyzer.types.NumericDomain;
import com.google.gson.Gson;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;

import static com.solrange.analyzer.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ContextBuilderTest {

    private static final BigInteger UINT256_MAX = NumericDomain.UINT256.max();

    private static Analyzer analyze(ContractPart... parts) {
        return analyze(AnalyzerConfig.defaults(), parts);
    }

    private static Analyzer analyze(AnalyzerConfig config, ContractPart... parts) {
        Analyzer analyzer = new Analyzer(config, new Diagnostics(true));
        analyzer.analyze(unit(contract("C", parts)), 0);
        return analyzer;
    }

    private static int context(Analyzer analyzer, String path) {
        return analyzer.contextByPath(path).orElseThrow(() -> new AssertionError("no context " + path));
    }

    private static List<ContextVarNode> versions(Analyzer analyzer, int context, String name) {
        SemanticGraph g = analyzer.graph();
        return g.incoming(context, EdgeKind.CONTEXT_VAR).stream()
                .map(h -> g.node(h, ContextVarNode.class))
                .filter(v -> v.name().equals(name))
                .collect(Collectors.toList());
    }

    private static void assertRange(long min, long max, Range r) {
        assertTrue(r.isValue(), "expected a value range, got " + r);
        assertEquals(BigInteger.valueOf(min), r.min(), "min of " + r);
        assertEquals(BigInteger.valueOf(max), r.max(), "max of " + r);
    }

    @Test
    void compoundAssignmentToStateVariableCreatesSingleVersion() {
        Analyzer a = analyze(
                stateVar("uint256", "c"),
                function("b5", params(param("uint256", "s")),
                        stmt(assign(AssignOp.ADD, "c", var("s")))));
        int entry = context(a, "C.b5");

        List<BoundsReport> reports = a.boundsFor(entry, "c");
        assertEquals(1, reports.size());
        BoundsReport r = reports.get(0);
        assertEquals("C.b5", r.contextPath());
        assertEquals(VarOrigin.ASSIGNMENT, r.origin());
        assertEquals(BigInteger.ZERO, r.range().min());
        assertEquals(UINT256_MAX, r.range().max());
        assertTrue(r.range().overflow(), "top + top may overflow");
        assertEquals(1, versions(a, entry, "c").size());
    }

    @Test
    void ifElseAssignmentsMergeIntoContinuation() {
        Analyzer a = analyze(function("f", params(param("uint256", "s")),
                declare("uint256", "a", null),
                ifElse(lt(var("s"), num(5)),
                        block(stmt(assign("a", num(1)))),
                        block(stmt(assign("a", num(2)))))));
        int entry = context(a, "C.f");

        List<BoundsReport> reports = a.boundsFor(entry, "a");
        assertEquals(List.of("C.f", "C.f.fork0.true", "C.f.fork0.false", "C.f.fork0.cont"),
                reports.stream().map(BoundsReport::contextPath).collect(Collectors.toList()));
        assertRange(0, 0, reports.get(0).range());
        assertRange(1, 1, reports.get(1).range());
        assertRange(2, 2, reports.get(2).range());
        assertRange(1, 2, reports.get(3).range());
        assertEquals(VarOrigin.MERGED, reports.get(3).origin());
        assertEquals(2, a.graph().outgoing(reports.get(3).version(), EdgeKind.MERGE).size());
    }

    @Test
    void branchArmsNarrowTheTestedVariable() {
        Analyzer a = analyze(function("f", params(param("uint256", "s")),
                ifElse(lt(var("s"), num(5)),
                        block(),
                        null)));
        int t = context(a, "C.f.fork0.true");
        int f = context(a, "C.f.fork0.false");

        BoundsReport inTrue = a.boundsFor(t, "s").get(0);
        assertRange(0, 4, inTrue.range());
        assertEquals(1, inTrue.steps().size());
        NarrowingStep step = inTrue.steps().get(0);
        assertEquals(NarrowingStep.Kind.BRANCH, step.kind());
        assertEquals("s < 5", step.constraint());
        assertTrue(inTrue.initialRange().isTop());

        BoundsReport inFalse = a.boundsFor(f, "s").get(0);
        assertEquals(BigInteger.valueOf(5), inFalse.range().min());
        assertEquals(UINT256_MAX, inFalse.range().max());
        assertEquals("s >= 5", inFalse.steps().get(0).constraint());
    }

    @Test
    void siblingConditionsAreNegationsAndPartitionValues() {
        Analyzer a = analyze(function("f", params(param("uint8", "s")),
                ifElse(lt(var("s"), num(5)), block(), block())));
        ContextNode t = a.graph().node(context(a, "C.f.fork0.true"), ContextNode.class);
        ContextNode f = a.graph().node(context(a, "C.f.fork0.false"), ContextNode.class);

        assertEquals(1, t.conditions().size());
        Constraint onTrue = t.conditions().get(0);
        Constraint onFalse = f.conditions().get(0);
        assertEquals(onTrue.negate(), onFalse);
        for (int v = 0; v <= 255; v++) {
            BigInteger value = BigInteger.valueOf(v);
            assertTrue(onTrue.admits(value) ^ onFalse.admits(value), "value " + v + " in exactly one arm");
        }
    }

    @Test
    void inheritedVersionsKeepTheParentRange() {
        Analyzer a = analyze(function("f", params(param("uint256", "s")),
                declare("uint256", "b", num(7)),
                ifElse(lt(var("s"), num(5)),
                        block(stmt(assign("s", num(0)))),
                        block(stmt(assign("b", num(1)))))));
        SemanticGraph g = a.graph();
        int checked = 0;
        for (int h = 0; h < g.size(); h++) {
            if (g.node(h) instanceof ContextVarNode v && v.origin() == VarOrigin.INHERITED) {
                ContextVarNode prev = g.node(v.prev(), ContextVarNode.class);
                assertEquals(prev.range(), v.range(), "inherited copy of " + v.name());
                assertNotEquals(prev.context(), v.context());
                checked++;
            }
        }
        assertTrue(checked > 0);
    }

    @Test
    void untouchedVariableIsInheritedByContinuation() {
        Analyzer a = analyze(function("f", params(param("uint256", "s")),
                declare("uint256", "b", num(7)),
                ifElse(lt(var("s"), num(5)), block(), null)));
        int cont = context(a, "C.f.fork0.cont");
        BoundsReport b = a.boundsFor(cont, "b").get(0);
        assertEquals(VarOrigin.INHERITED, b.origin());
        assertRange(7, 7, b.range());
    }

    @Test
    void terminatedArmIsExcludedFromMerge() {
        Analyzer a = analyze(function("f", params(param("uint256", "s")),
                ifElse(lt(var("s"), num(5)), block(ret(null)), null),
                declare("uint256", "t", var("s"))));
        int cont = context(a, "C.f.fork0.cont");
        BoundsReport t = a.boundsFor(cont, "t").get(0);
        assertEquals(BigInteger.valueOf(5), t.range().min());
        assertTrue(a.graph().node(context(a, "C.f.fork0.true"), ContextNode.class).isTerminated());
    }

    @Test
    void allArmsTerminatedEndsTheFunction() {
        Analyzer a = analyze(function("f", params(param("uint256", "s")),
                ifElse(lt(var("s"), num(5)), block(revert()), block(ret(null))),
                declare("uint256", "z", num(1))));
        int entry = context(a, "C.f");
        assertTrue(a.graph().node(entry, ContextNode.class).isTerminated());
        assertTrue(a.contextByPath("C.f.fork0.cont").isEmpty());
        assertTrue(a.boundsFor(entry, "z").isEmpty());
    }

    @Test
    void constantConditionMakesOtherArmUnreachable() {
        Analyzer a = analyze(function("f", params(),
                declare("uint256", "a", null),
                ifElse(bool(true),
                        block(stmt(assign("a", num(1)))),
                        block(stmt(assign("a", num(2)))))));
        int entry = context(a, "C.f");
        ContextNode f = a.graph().node(context(a, "C.f.fork0.false"), ContextNode.class);
        assertTrue(f.isUnreachable());

        List<BoundsReport> reports = a.boundsFor(entry, "a");
        assertEquals(List.of("C.f", "C.f.fork0.true", "C.f.fork0.cont"),
                reports.stream().map(BoundsReport::contextPath).collect(Collectors.toList()));
        assertRange(1, 1, reports.get(2).range());
    }

    @Test
    void requireNarrowsInPlaceAndAddsFailureContext() {
        Analyzer a = analyze(function("g", params(param("uint256", "x")),
                require(lt(var("x"), num(10))),
                declare("uint256", "y", add(var("x"), num(1)))));
        int entry = context(a, "C.g");

        BoundsReport x = a.boundsFor(entry, "x").get(0);
        assertRange(0, 9, x.range());
        assertEquals(NarrowingStep.Kind.ASSERTION, x.steps().get(0).kind());

        List<BoundsReport> y = a.boundsFor(entry, "y");
        assertEquals(1, y.size());
        assertRange(1, 10, y.get(0).range());

        ContextNode failure = a.graph().node(context(a, "C.g.require0"), ContextNode.class);
        assertEquals(ContextKind.ASSERT_FAILURE, failure.kind());
        assertTrue(failure.isTerminated());
        assertEquals("x >= 10", failure.conditions().get(0).describe());
    }

    @Test
    void unsatisfiableRequireTerminatesContext() {
        Analyzer a = analyze(function("g", params(param("uint256", "x")),
                require(lt(var("x"), num(0))),
                declare("uint256", "y", num(1))));
        int entry = context(a, "C.g");
        assertTrue(a.graph().node(entry, ContextNode.class).isTerminated());
        assertTrue(a.boundsFor(entry, "y").isEmpty());
    }

    @Test
    void whileLoopExitIsNarrowedByNegatedCondition() {
        Analyzer a = analyze(function("h", params(),
                declare("uint256", "i", num(0)),
                whileLoop(lt(var("i"), num(10)),
                        block(stmt(assign("i", add(var("i"), num(1))))))));
        int body = context(a, "C.h.fork0.body");
        int cont = context(a, "C.h.fork0.cont");

        assertEquals(ContextKind.LOOP_BODY, a.graph().node(body, ContextNode.class).kind());
        assertRange(1, 10, a.boundsFor(body, "i").get(0).range());

        BoundsReport exit = a.boundsFor(cont, "i").get(0);
        assertRange(10, 10, exit.range());
        assertEquals(NarrowingStep.Kind.LOOP_EXIT, exit.steps().get(0).kind());
        assertRange(0, 10, exit.initialRange());
    }

    @Test
    void loopWithBreakWidensWrittenNames() {
        Analyzer a = analyze(function("h", params(),
                declare("uint256", "i", num(0)),
                whileLoop(lt(var("i"), num(10)),
                        block(stmt(assign("i", add(var("i"), num(1)))), brk()))));
        BoundsReport exit = a.boundsFor(context(a, "C.h.fork0.cont"), "i").get(0);
        assertEquals(VarOrigin.WIDENED, exit.origin());
        assertTrue(exit.range().isTop());
    }

    @Test
    void ternaryForksAndJoinsItsArms() {
        Analyzer a = analyze(function("t", params(param("uint256", "s")),
                declare("uint256", "m", ternary(lt(var("s"), num(5)), var("s"), num(5)))));
        List<BoundsReport> m = a.boundsFor(context(a, "C.t"), "m");
        assertEquals(1, m.size());
        assertEquals("C.t.fork0.cont", m.get(0).contextPath());
        assertRange(0, 5, m.get(0).range());
    }

    @Test
    void forkDepthLimitWidensInsteadOfForking() {
        AnalyzerConfig config = new Gson().fromJson("{\"max_fork_depth\": 0}", AnalyzerConfig.class);
        Analyzer a = analyze(config, function("f", params(param("uint256", "s")),
                declare("uint256", "a", null),
                ifElse(lt(var("s"), num(5)), block(stmt(assign("a", num(1)))), null)));
        int entry = context(a, "C.f");
        assertTrue(a.bounds().children(entry).isEmpty());
        BoundsReport r = a.boundsFor(entry, "a").get(0);
        assertEquals(VarOrigin.WIDENED, r.origin());
        assertTrue(r.range().isTop());
    }

    @Test
    void armsPastForkDepthAreStillWalked() {
        AnalyzerConfig config = new Gson().fromJson("{\"max_fork_depth\": 0}", AnalyzerConfig.class);
        Analyzer a = analyze(config,
                function("helper", params(), params(param("uint8", null))),
                function("f", params(param("uint256", "s")),
                        declare("uint256", "a", null),
                        ifElse(lt(var("s"), num(5)), block(stmt(call("helper")), ret(null)), null),
                        stmt(assign("a", num(3)))));
        int entry = context(a, "C.f");
        assertTrue(a.bounds().children(entry).isEmpty());
        assertEquals(1, a.graph().outgoing(entry, EdgeKind.CALL).size());
        assertFalse(a.graph().node(entry, ContextNode.class).isTerminated());
        assertRange(3, 3, a.boundsFor(entry, "a").get(0).range());
    }

    @Test
    void armsPastForkDepthThatAllReturnEndTheFunction() {
        AnalyzerConfig config = new Gson().fromJson("{\"max_fork_depth\": 0}", AnalyzerConfig.class);
        Analyzer a = analyze(config, function("f", params(param("uint256", "s")),
                ifElse(lt(var("s"), num(5)), block(ret(null)), block(revert())),
                declare("uint256", "z", num(1))));
        int entry = context(a, "C.f");
        assertTrue(a.graph().node(entry, ContextNode.class).isTerminated());
        assertTrue(a.boundsFor(entry, "z").isEmpty());
    }

    @Test
    void doWhileBodyThatAlwaysReturnsLeavesNothingAfterTheLoop() {
        Analyzer a = analyze(function("f", params(param("uint8", "s")),
                doWhile(block(ret(null)), lt(var("s"), num(5))),
                stmt(assign("s", num(7)))));
        ContextNode cont = a.graph().node(context(a, "C.f.fork0.cont"), ContextNode.class);
        assertTrue(cont.isUnreachable());

        List<String> paths = a.boundsFor(context(a, "C.f"), "s").stream()
                .map(BoundsReport::contextPath)
                .collect(Collectors.toList());
        assertEquals(List.of("C.f", "C.f.fork0.body"), paths);
    }

    @Test
    void doWhileExitIsNarrowedAfterTheFirstPass() {
        Analyzer a = analyze(function("f", params(),
                declare("uint256", "i", num(0)),
                doWhile(block(stmt(assign("i", add(var("i"), num(1))))), lt(var("i"), num(3)))));
        BoundsReport exit = a.boundsFor(context(a, "C.f.fork0.cont"), "i").get(0);
        assertFalse(a.graph().node(context(a, "C.f.fork0.cont"), ContextNode.class).isUnreachable());
        assertEquals(BigInteger.valueOf(3), exit.range().min());
    }

    @Test
    void malformedLiteralsBecomeUnknownInsteadOfFailing() {
        Analyzer a = analyze(function("f", params(),
                declare("bytes1", "h", hex("zz")),
                declare("uint256", "big", num("1", "999999999")),
                declare("uint256", "k", num("1", "3"))));
        int entry = context(a, "C.f");
        assertTrue(a.boundsFor(entry, "h").get(0).range().isTop());
        assertTrue(a.boundsFor(entry, "big").get(0).range().isTop());
        assertRange(1000, 1000, a.boundsFor(entry, "k").get(0).range());
    }

    @Test
    void returnRecordsReturnedVersion() {
        Analyzer a = analyze(function("r", params(param("uint256", "x")), params(param("uint256", null)),
                ret(var("x")),
                declare("uint256", "dead", num(1))));
        int entry = context(a, "C.r");
        List<Integer> returned = a.graph().outgoing(entry, EdgeKind.RETURN);
        assertEquals(1, returned.size());
        assertEquals("x", a.graph().node(returned.get(0), ContextVarNode.class).name());
        assertTrue(a.boundsFor(entry, "dead").isEmpty());
    }

    @Test
    void constantsAndEnumMembersAreExact() {
        Analyzer a = analyze(
                constant("uint256", "CAP", num(100)),
                enumeration("Color", "Red", "Green", "Blue"),
                function("k", params(),
                        declare("uint256", "y", bin(BinaryOp.MUL, var("CAP"), num(2))),
                        declare(var("Color"), "c", member(var("Color"), "Blue"))));
        int entry = context(a, "C.k");
        assertRange(200, 200, a.boundsFor(entry, "y").get(0).range());
        BoundsReport c = a.boundsFor(entry, "c").get(0);
        assertRange(2, 2, c.range());
        assertEquals("Color", c.type());
    }

    @Test
    void enumParameterIsBoundedByMemberCount() {
        Analyzer a = analyze(
                enumeration("Color", "Red", "Green", "Blue"),
                function("k", params(param(var("Color"), "c"))));
        BoundsReport c = a.boundsFor(context(a, "C.k"), "c").get(0);
        assertRange(0, 2, c.range());
    }

    @Test
    void callToDeclaredFunctionAddsCallEdge() {
        Analyzer a = analyze(
                function("helper", params(), params(param("uint8", null))),
                function("main", params(), declare("uint8", "v", call("helper"))));
        int entry = context(a, "C.main");
        List<Integer> called = a.graph().outgoing(entry, EdgeKind.CALL);
        assertEquals(1, called.size());
        assertRange(0, 255, a.boundsFor(entry, "v").get(0).range());
    }
}
