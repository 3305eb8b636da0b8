package com.solrange.analyzer.context;

import com.solrange.analyzer.Diagnostics;
import com.solrange.analyzer.ast.AstNames;
import com.solrange.analyzer.ast.SolAst;
import com.solrange.analyzer.ast.SolAst.*;
import com.solrange.analyzer.graph.GraphModel.*;
import com.solrange.analyzer.graph.SemanticGraph;
import com.solrange.analyzer.lowering.DeclarationLowering.PendingBody;
import com.solrange.analyzer.lowering.SymbolTable;
import com.solrange.analyzer.lowering.TypeResolver;
import com.solrange.analyzer.range.Constraint;
import com.solrange.analyzer.range.NarrowingStep;
import com.solrange.analyzer.range.PredicateNarrowing;
import com.solrange.analyzer.range.Range;
import com.solrange.analyzer.types.VarType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Walks function bodies and records their execution as a tree of contexts.
 *
 * A context is a straight-line slice of the function. Every split in control flow (if,
 * ternary, loop) adds a fork marker under the current context with one child per arm; each
 * child starts with a copy of the parent's live bindings, restricted by the arm's predicate.
 * After the arms a continuation context (also a child of the pre-fork context) takes the
 * merged bindings and the walk goes on there. require/assert narrow the current context in
 * place and hang a terminated assertion-failure child off it.
 *
 * Loops are not unrolled: names written in the body enter it widened to the top of their type,
 * the post-loop value is the union of the pre-loop value and the body's final value, narrowed
 * by the negated loop condition when the body cannot break out early.
 */
public class ContextBuilder {

    private final SemanticGraph graph;
    private final SymbolTable symbols;
    private final TypeResolver types;
    private final BuilderLimits limits;
    private final Diagnostics diagnostics;

    public ContextBuilder(SemanticGraph graph, SymbolTable symbols, TypeResolver types,
                          BuilderLimits limits, Diagnostics diagnostics) {
        this.graph = graph;
        this.symbols = symbols;
        this.types = types;
        this.limits = limits;
        this.diagnostics = diagnostics;
    }

    /** Builds the context tree of one function and returns its entry context. */
    public int build(PendingBody body) {
        return new FunctionWalk(body).run();
    }

    private class FunctionWalk implements ExpressionEvaluator.TernaryHandler {

        private final PendingBody body;
        private final ContextScope scope;
        private final ExpressionEvaluator eval;
        private int nesting;
        /** Arms walked past the fork depth limit, in the enclosing context. */
        private int flattened;
        /** The flattened arm being walked has reached a return, revert or jump. */
        private boolean exitedFlat;

        FunctionWalk(PendingBody body) {
            this.body = body;
            this.scope = new ContextScope(graph, body.function());
            this.eval = new ExpressionEvaluator(scope, symbols, types, body.scope(), diagnostics);
            this.eval.setTernaryHandler(this);
        }

        int run() {
            FunctionDefinition def = body.definition();
            int entry = scope.openEntry(body.path(), def.loc());

            for (int p : ordered(graph.incoming(body.function(), EdgeKind.FUNCTION_PARAM))) {
                FunctionParamNode param = graph.node(p, FunctionParamNode.class);
                if (param.name() == null) continue;
                VarType type = types.describe(param.type());
                scope.bind(param.name(), VarOrigin.PARAMETER, Range.top(type), type, null, param.loc(),
                        "parameter " + param.name());
            }
            for (int r : ordered(graph.incoming(body.function(), EdgeKind.FUNCTION_RETURN))) {
                FunctionReturnNode ret = graph.node(r, FunctionReturnNode.class);
                if (ret.name() == null) continue;
                VarType type = types.describe(ret.type());
                scope.bind(ret.name(), VarOrigin.DECLARATION, Range.zero(type), type, null, ret.loc(),
                        "default value");
            }

            walk(def.body());
            scope.sealAll();
            return entry;
        }

        private List<Integer> ordered(List<Integer> handles) {
            List<Integer> sorted = new ArrayList<>(handles);
            sorted.sort(Comparator.naturalOrder());
            return sorted;
        }

        // --- Statements ---

        private void walk(Statement s) {
            if (s == null || isDead(scope.current()) || exitedFlat) return;
            if (s instanceof Block b) {
                for (Statement inner : SolAst.orEmpty(b.statements())) {
                    walk(inner);
                    if (isDead(scope.current()) || exitedFlat) break;
                }
            } else if (s instanceof ExpressionStatement e) {
                expressionStatement(e.expression());
            } else if (s instanceof VariableDeclarationStatement d) {
                declaration(d);
            } else if (s instanceof If i) {
                ifStatement(i);
            } else if (s instanceof While w) {
                loop(w.loc(), "while", w.condition(), w.body(), null, false);
            } else if (s instanceof For f) {
                walk(f.init());
                if (!isDead(scope.current())) {
                    loop(f.loc(), "for", f.condition(), f.body(), f.next(), false);
                }
            } else if (s instanceof DoWhile d) {
                loop(d.loc(), "do-while", d.condition(), d.body(), null, true);
            } else if (s instanceof Return r) {
                returnStatement(r);
            } else if (s instanceof Revert r) {
                for (Expression arg : SolAst.orEmpty(r.args())) eval.evaluate(arg);
                terminate();
            } else if (s instanceof Break || s instanceof Continue) {
                // leaves the straight-line region; the enclosing loop accounts for it
                terminate();
            } else if (s instanceof UnsupportedStatement u) {
                diagnostics.warn("unsupported statement " + u.what() + " at " + u.loc() + ", skipped");
            } else {
                diagnostics.warn("unhandled statement " + s.getClass().getSimpleName() + " at " + s.loc());
            }
        }

        private boolean isDead(int context) {
            ContextNode c = scope.context(context);
            return c.isTerminated() || c.isUnreachable();
        }

        /** Ends the current context, or only the flattened arm when walking one. */
        private void terminate() {
            if (flattened > 0) {
                exitedFlat = true;
            } else {
                scope.currentContext().markTerminated();
            }
        }

        private void expressionStatement(Expression e) {
            if (e instanceof Call c && c.callee() instanceof Variable v && scope.binding(v.name().name()).isEmpty()) {
                String name = v.name().name();
                if ("require".equals(name) || "assert".equals(name)) {
                    assertion(c, name);
                    return;
                }
                if ("revert".equals(name)) {
                    for (Expression arg : SolAst.orEmpty(c.args())) eval.evaluate(arg);
                    terminate();
                    return;
                }
            }
            if (e instanceof Assign || e instanceof Unary u && (u.op().isIncDec() || u.op() == UnaryOp.DELETE)) {
                eval.evaluate(e);
                return;
            }
            Range value = eval.evaluate(e);
            if (e instanceof Call && value.isOpaque()) return;
            if (!isDead(scope.current())) {
                scope.temporary(AstNames.render(e), value, ExpressionEvaluator.tmpType(value), e.loc());
            }
        }

        private void declaration(VariableDeclarationStatement d) {
            VariableDeclaration decl = d.declaration();
            VarType type = types.describe(types.typeHandle(body.scope(), decl.ty()));
            Range value = d.initializer() != null ? eval.evaluate(d.initializer()) : null;
            if (decl.name() == null || isDead(scope.current())) return;
            Range range = value == null ? Range.zero(type) : ExpressionEvaluator.conform(value, type);
            scope.bind(decl.name().name(), VarOrigin.DECLARATION, range, type, null, d.loc(),
                    d.initializer() == null ? "default value" : AstNames.render(d.initializer()));
        }

        private void returnStatement(Return r) {
            int ctx = scope.current();
            if (r.value() != null) {
                Range value = eval.evaluate(r.value());
                int returned;
                if (r.value() instanceof Variable v && scope.binding(v.name().name()).isPresent()) {
                    returned = scope.binding(v.name().name()).get();
                } else {
                    returned = scope.temporary(AstNames.render(r.value()), value,
                            ExpressionEvaluator.tmpType(value), r.loc());
                }
                graph.addEdge(scope.current(), returned, EdgeKind.RETURN);
            } else {
                for (int ret : ordered(graph.incoming(body.function(), EdgeKind.FUNCTION_RETURN))) {
                    String name = graph.node(ret, FunctionReturnNode.class).name();
                    if (name == null) continue;
                    scope.binding(name).ifPresent(h -> graph.addEdge(ctx, h, EdgeKind.RETURN));
                }
            }
            terminate();
        }

        private void assertion(Call c, String kind) {
            List<Expression> args = SolAst.orEmpty(c.args());
            if (args.isEmpty()) {
                terminate();
                return;
            }
            Expression predicate = args.get(0);
            Range truth = eval.evaluate(predicate);
            for (Expression message : args.subList(1, args.size())) eval.evaluate(message);
            if (flattened > 0) {
                // holds on one arm only, so it cannot narrow the shared context
                if (truth.isExactBool(false)) terminate();
                return;
            }

            PredicateNarrowing narrowing = new PredicateNarrowing(eval::peek);
            List<Constraint> holds = narrowing.whenTrue(predicate);
            List<Constraint> fails = narrowing.whenFalse(predicate);

            int ctx = scope.current();
            String path = scope.context(ctx).path() + "." + kind + scope.nextSplit(ctx);
            int failure = scope.openDirectChild(ctx, ContextKind.ASSERT_FAILURE, path, fails, c.loc());
            scope.context(failure).markTerminated();

            if (truth.isExactBool(false) || !narrowInPlace(holds, NarrowingStep.Kind.ASSERTION, c.loc())) {
                scope.currentContext().markTerminated();
            }
        }

        /**
         * Restricts the current context's bindings by each constraint in turn, one NARROWED
         * version per change. Returns false when some variable is left with no value.
         */
        private boolean narrowInPlace(List<Constraint> constraints, NarrowingStep.Kind kind, Loc loc) {
            boolean feasible = true;
            for (Constraint c : constraints) {
                String name = c.variable();
                Range before;
                VarType type;
                Optional<Integer> bound = scope.binding(name);
                if (bound.isPresent()) {
                    ContextVarNode v = scope.var(bound.get());
                    if (v.isTmp()) continue;
                    before = v.range();
                    type = v.type();
                } else if (eval.declaredVariable(name).isPresent()) {
                    before = eval.declaredRange(name);
                    type = eval.declaredType(name);
                } else {
                    continue;
                }
                Range after = c.narrow(before);
                if (after == before) continue;
                NarrowingStep step = new NarrowingStep(kind, c.describe(), before, after, loc);
                scope.bind(name, VarOrigin.NARROWED, after, type, step, loc, "narrowed by " + c.describe());
                if (after.isEmpty()) feasible = false;
            }
            return feasible;
        }

        // --- Forks ---

        private void ifStatement(If s) {
            if (nesting >= limits.maxForkDepth()) {
                eval.evaluate(s.condition());
                if (isDead(scope.current())) return;
                boolean thenExits = walkFlattened(s.thenBranch());
                boolean elseExits = s.elseBranch() != null && walkFlattened(s.elseBranch());
                widenWrites(AstNames.assignedNames(s), s.loc(), "branch beyond fork depth " + limits.maxForkDepth());
                if (thenExits && elseExits) terminate();
                return;
            }
            Range truth = eval.evaluate(s.condition());
            if (isDead(scope.current())) return;
            PredicateNarrowing narrowing = new PredicateNarrowing(eval::peek);
            List<Constraint> onTrue = narrowing.whenTrue(s.condition());
            List<Constraint> onFalse = narrowing.whenFalse(s.condition());

            int parent = scope.current();
            String base = scope.context(parent).path() + ".fork" + scope.nextSplit(parent);
            int fork = scope.fork(parent, "if " + AstNames.render(s.condition()), s.loc());
            int t = openArm(fork, parent, ContextKind.TRUE_BRANCH, base + ".true", onTrue, Set.of(),
                    !truth.isExactBool(false), s.loc());
            int f = openArm(fork, parent, ContextKind.FALSE_BRANCH, base + ".false", onFalse, Set.of(),
                    !truth.isExactBool(true), s.loc());
            int tEnd = walkArm(t, s.thenBranch());
            int fEnd = walkArm(f, s.elseBranch());
            join(parent, base, List.of(tEnd, fEnd), s.loc());
        }

        @Override
        public Range branch(Ternary t) {
            if (nesting >= limits.maxForkDepth()) {
                eval.evaluate(t.condition());
                Range result = eval.evaluate(t.ifTrue()).union(eval.evaluate(t.ifFalse()));
                widenWrites(AstNames.assignedNames(t), t.loc(), "ternary beyond fork depth " + limits.maxForkDepth());
                return result;
            }
            Range truth = eval.evaluate(t.condition());
            PredicateNarrowing narrowing = new PredicateNarrowing(eval::peek);
            List<Constraint> onTrue = narrowing.whenTrue(t.condition());
            List<Constraint> onFalse = narrowing.whenFalse(t.condition());

            int parent = scope.current();
            String base = scope.context(parent).path() + ".fork" + scope.nextSplit(parent);
            int fork = scope.fork(parent, "ternary " + AstNames.render(t.condition()), t.loc());
            int tArm = openArm(fork, parent, ContextKind.TRUE_BRANCH, base + ".true", onTrue, Set.of(),
                    !truth.isExactBool(false), t.loc());
            int fArm = openArm(fork, parent, ContextKind.FALSE_BRANCH, base + ".false", onFalse, Set.of(),
                    !truth.isExactBool(true), t.loc());

            int[] arms = {tArm, fArm};
            Expression[] values = {t.ifTrue(), t.ifFalse()};
            Range result = null;
            List<Integer> ends = new ArrayList<>();
            for (int i = 0; i < arms.length; i++) {
                if (scope.context(arms[i]).isUnreachable()) {
                    ends.add(arms[i]);
                    continue;
                }
                scope.moveTo(arms[i]);
                nesting++;
                Range value = eval.evaluate(values[i]);
                scope.temporary(AstNames.render(values[i]), value, ExpressionEvaluator.tmpType(value), t.loc());
                nesting--;
                result = result == null ? value : result.union(value);
                ends.add(scope.current());
            }
            if (result == null) result = Range.opaque("no feasible arm in " + AstNames.render(t));
            int cont = join(parent, base, ends, t.loc());
            if (cont >= 0) {
                scope.temporary(AstNames.render(t), result, ExpressionEvaluator.tmpType(result), t.loc());
            }
            return result;
        }

        /**
         * Opens a child under {@code fork}: inherits every live non-temporary binding of the
         * parent (widening the names in {@code widen}), then applies the arm's constraints.
         * The current context is left on the child, or on the parent if the arm is infeasible.
         */
        private int openArm(int fork, int parent, ContextKind kind, String path, List<Constraint> conditions,
                            Set<String> widen, boolean feasible, Loc loc) {
            int child = scope.openChild(fork, parent, kind, path, conditions, loc);
            if (!feasible) {
                scope.context(child).markUnreachable();
                return child;
            }
            String parentPath = scope.context(parent).path();
            for (Map.Entry<String, Integer> e : new ArrayList<>(scope.liveIn(parent).entrySet())) {
                ContextVarNode v = scope.var(e.getValue());
                if (v.isTmp()) continue;
                if (widen.contains(e.getKey())) {
                    scope.bindIn(child, e.getKey(), e.getValue(), VarOrigin.WIDENED, Range.top(v.type()), v.type(),
                            null, loc, "widened: written in " + path);
                } else {
                    scope.bindIn(child, e.getKey(), e.getValue(), VarOrigin.INHERITED, v.range(), v.type(),
                            null, v.loc(), "inherited from " + parentPath);
                }
            }
            for (String name : widen) {
                if (scope.binding(child, name).isPresent() || !eval.isStateVariable(name)) continue;
                VarType type = eval.declaredType(name);
                scope.bindIn(child, name, -1, VarOrigin.WIDENED, Range.top(type), type, null, loc,
                        "widened: written in " + path);
            }
            scope.moveTo(child);
            if (!narrowInPlace(conditions, NarrowingStep.Kind.BRANCH, loc)) {
                scope.context(child).markUnreachable();
            }
            scope.moveTo(parent);
            return child;
        }

        /**
         * Walks an arm in the current context without forking, past the fork depth limit.
         * Returns true when the arm always leaves through a return, revert or jump.
         */
        private boolean walkFlattened(Statement stmt) {
            boolean outer = exitedFlat;
            flattened++;
            exitedFlat = false;
            walk(stmt);
            boolean exits = exitedFlat;
            flattened--;
            exitedFlat = outer;
            return exits;
        }

        /** Walks one arm and returns the context the arm ended in. */
        private int walkArm(int arm, Statement stmt) {
            if (scope.context(arm).isUnreachable()) return arm;
            scope.moveTo(arm);
            nesting++;
            walk(stmt);
            nesting--;
            return scope.current();
        }

        /**
         * Merges the arm end contexts into a continuation of {@code parent} and moves there.
         * Returns the continuation, or -1 when every arm terminated, in which case the parent is
         * terminated too.
         */
        private int join(int parent, String base, List<Integer> ends, Loc loc) {
            List<Integer> live = new ArrayList<>();
            for (int end : ends) {
                if (!isDead(end)) live.add(end);
            }
            if (live.isEmpty()) {
                scope.moveTo(parent);
                scope.context(parent).markTerminated();
                return -1;
            }
            int cont = scope.openDirectChild(parent, ContextKind.CONTINUATION, base + ".cont", List.of(), loc);

            Set<String> names = new LinkedHashSet<>();
            for (Map.Entry<String, Integer> e : scope.liveIn(parent).entrySet()) {
                if (!scope.var(e.getValue()).isTmp()) names.add(e.getKey());
            }
            for (int end : live) {
                for (String name : scope.liveIn(end).keySet()) {
                    if (!names.contains(name) && eval.isStateVariable(name)) names.add(name);
                }
            }

            for (String name : names) {
                int pv = scope.binding(parent, name).orElse(-1);
                boolean unchanged = true;
                Range merged = null;
                VarType type = pv >= 0 ? scope.var(pv).type() : eval.declaredType(name);
                Map<Integer, Integer> contributions = new LinkedHashMap<>();
                for (int end : live) {
                    Optional<Integer> h = scope.binding(end, name);
                    Range r;
                    if (h.isPresent()) {
                        ContextVarNode v = scope.var(h.get());
                        r = v.range();
                        contributions.put(end, h.get());
                        if (!inheritsFrom(h.get(), pv)) unchanged = false;
                    } else {
                        r = pv >= 0 ? scope.var(pv).range() : eval.declaredRange(name);
                    }
                    merged = merged == null ? r : merged.union(r);
                }
                if (unchanged && pv >= 0) {
                    ContextVarNode v = scope.var(pv);
                    scope.bindIn(cont, name, pv, VarOrigin.INHERITED, v.range(), v.type(), null, v.loc(),
                            "inherited from " + scope.context(parent).path());
                    continue;
                }
                List<String> from = new ArrayList<>();
                for (int end : contributions.keySet()) from.add(scope.context(end).path());
                int h = scope.bindIn(cont, name, pv, VarOrigin.MERGED, merged, type, null, loc,
                        "union of " + String.join(", ", from));
                for (int version : contributions.values()) graph.addEdge(h, version, EdgeKind.MERGE);
            }
            scope.moveTo(cont);
            return cont;
        }

        /** True if {@code version} is {@code ancestor} or reaches it through inherited copies only. */
        private boolean inheritsFrom(int version, int ancestor) {
            int h = version;
            while (h >= 0) {
                if (h == ancestor) return true;
                ContextVarNode v = scope.var(h);
                if (v.origin() != VarOrigin.INHERITED) return false;
                h = v.prev();
            }
            return false;
        }

        // --- Loops ---

        private void loop(Loc loc, String kind, Expression condition, Statement loopBody, Expression next,
                          boolean doWhile) {
            Set<String> written = new LinkedHashSet<>(AstNames.assignedNames(loopBody));
            if (next != null) written.addAll(AstNames.assignedNames(next));
            if (condition != null) written.addAll(AstNames.assignedNames(condition));

            boolean jumps = AstNames.containsJump(loopBody);
            if (nesting >= limits.maxForkDepth()) {
                if (condition != null && !doWhile) eval.evaluate(condition);
                if (isDead(scope.current())) return;
                boolean exits = walkFlattened(loopBody);
                if (next != null && !exits) eval.evaluate(next);
                if (doWhile && condition != null) eval.evaluate(condition);
                widenWrites(written, loc, kind + " beyond fork depth " + limits.maxForkDepth());
                if (doWhile && exits && !jumps) terminate();
                return;
            }

            Range entryTruth = Range.boolTop();
            if (condition != null && !doWhile) {
                entryTruth = eval.evaluate(condition);
                if (isDead(scope.current())) return;
            }
            List<Constraint> onEntry = condition != null && !doWhile
                    ? new PredicateNarrowing(eval::peek, written).whenTrue(condition)
                    : List.of();

            int parent = scope.current();
            String base = scope.context(parent).path() + ".fork" + scope.nextSplit(parent);
            int fork = scope.fork(parent, kind + " " + AstNames.render(condition), loc);
            int arm = openArm(fork, parent, ContextKind.LOOP_BODY, base + ".body", onEntry, written,
                    !entryTruth.isExactBool(false), loc);
            int end = walkArm(arm, loopBody);
            if (next != null && !isDead(end)) {
                scope.moveTo(end);
                eval.evaluate(next);
                end = scope.current();
            }
            boolean bodyCompletes = !isDead(end);
            boolean entered = !scope.context(arm).isUnreachable();

            int cont = scope.openDirectChild(parent, ContextKind.CONTINUATION, base + ".cont", List.of(), loc);
            Set<String> names = new LinkedHashSet<>();
            for (Map.Entry<String, Integer> e : scope.liveIn(parent).entrySet()) {
                if (!scope.var(e.getValue()).isTmp()) names.add(e.getKey());
            }
            for (String name : written) {
                if (eval.isStateVariable(name)) names.add(name);
            }

            for (String name : names) {
                int pv = scope.binding(parent, name).orElse(-1);
                if (!written.contains(name) || !entered) {
                    if (pv < 0) continue;
                    ContextVarNode v = scope.var(pv);
                    scope.bindIn(cont, name, pv, VarOrigin.INHERITED, v.range(), v.type(), null, v.loc(),
                            "inherited from " + scope.context(parent).path());
                    continue;
                }
                VarType type = pv >= 0 ? scope.var(pv).type() : eval.declaredType(name);
                Range pre = pv >= 0 ? scope.var(pv).range() : eval.declaredRange(name);
                Optional<Integer> last = bodyCompletes ? scope.binding(end, name) : Optional.empty();
                Range post;
                if (doWhile) {
                    post = last.map(h -> scope.var(h).range()).orElse(pre);
                } else {
                    post = last.map(h -> pre.union(scope.var(h).range())).orElse(pre);
                }
                if (jumps) {
                    int h = scope.bindIn(cont, name, pv, VarOrigin.WIDENED, Range.top(type), type, null, loc,
                            "widened: " + kind + " body may break or continue");
                    last.ifPresent(l -> graph.addEdge(h, l, EdgeKind.MERGE));
                    continue;
                }
                int h = scope.bindIn(cont, name, pv, VarOrigin.MERGED, post, type, null, loc,
                        "loop exit of " + base);
                if (pv >= 0 && !doWhile) graph.addEdge(h, pv, EdgeKind.MERGE);
                last.ifPresent(l -> graph.addEdge(h, l, EdgeKind.MERGE));
            }
            scope.moveTo(cont);

            if (doWhile && !bodyCompletes && !jumps) {
                // the body runs once and never reaches the condition
                scope.currentContext().markUnreachable();
                return;
            }
            if (jumps) return;
            if (condition == null) {
                // no condition and no way out of the body
                scope.currentContext().markUnreachable();
                return;
            }
            List<Constraint> onExit = new PredicateNarrowing(eval::peek).whenFalse(condition);
            if (!narrowInPlace(onExit, NarrowingStep.Kind.LOOP_EXIT, loc)) {
                scope.currentContext().markUnreachable();
            }
        }

        /** Approximation used past the fork depth limit: every written name becomes top. */
        private void widenWrites(Set<String> names, Loc loc, String reason) {
            for (String name : names) {
                if (scope.binding(name).isEmpty() && !eval.isStateVariable(name)) continue;
                VarType type = eval.declaredType(name);
                scope.bind(name, VarOrigin.WIDENED, Range.top(type), type, null, loc, "widened: " + reason);
            }
        }
    }
}
