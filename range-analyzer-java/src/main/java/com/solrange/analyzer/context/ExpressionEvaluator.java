package com.solrange.analyzer.context;

import com.solrange.analyzer.Diagnostics;
import com.solrange.analyzer.ast.AstNames;
import com.solrange.analyzer.ast.SolAst;
import com.solrange.analyzer.ast.SolAst.*;
import com.solrange.analyzer.graph.GraphModel.*;
import com.solrange.analyzer.graph.SemanticGraph;
import com.solrange.analyzer.lowering.SymbolTable;
import com.solrange.analyzer.lowering.TypeResolver;
import com.solrange.analyzer.range.Range;
import com.solrange.analyzer.range.RangeArithmetic;
import com.solrange.analyzer.types.BuiltinCatalog;
import com.solrange.analyzer.types.Concrete;
import com.solrange.analyzer.types.NumericDomain;
import com.solrange.analyzer.types.VarType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Computes the range of an expression in the current context of a {@link ContextScope}.
 *
 * {@link #evaluate} has effects: assignments and increments create new versions, nested
 * arithmetic operands become temporaries, calls to declared functions add CALL edges.
 * {@link #peek} computes the same range without touching the graph, for predicate operands.
 */
class ExpressionEvaluator {

    /** Ternaries fork the context, which only the statement walker can do. */
    interface TernaryHandler {
        Range branch(Ternary ternary);
    }

    private static final BigInteger UINT256_MAX = NumericDomain.UINT256.max();
    /** Decimal digits of 2^256 - 1. */
    private static final int MAX_LITERAL_DIGITS = 78;

    private final ContextScope scope;
    private final SemanticGraph graph;
    private final SymbolTable symbols;
    private final TypeResolver types;
    private final String contract;
    private final Diagnostics diagnostics;
    private final Set<String> constantsInProgress = new HashSet<>();
    private TernaryHandler ternaries;
    private int pureDepth;

    ExpressionEvaluator(ContextScope scope, SymbolTable symbols, TypeResolver types, String contract,
                        Diagnostics diagnostics) {
        this.scope = scope;
        this.graph = scope.graph();
        this.symbols = symbols;
        this.types = types;
        this.contract = contract;
        this.diagnostics = diagnostics;
    }

    void setTernaryHandler(TernaryHandler ternaries) {
        this.ternaries = ternaries;
    }

    Range evaluate(Expression e) {
        if (e == null) return Range.opaque("missing expression");
        if (e instanceof NumberLiteral n)  return number(n);
        if (e instanceof BoolLiteral b)    return bool(b);
        if (e instanceof StringLiteral s)  return string(s);
        if (e instanceof HexLiteral h)     return hex(h);
        if (e instanceof AddressLiteral a) return address(a);
        if (e instanceof Variable v)       return read(v.name().name());
        if (e instanceof MemberAccess m)   return member(m);
        if (e instanceof Binary b)         return binary(b);
        if (e instanceof Unary u)          return unary(u);
        if (e instanceof Assign a)         return assign(a);
        if (e instanceof Ternary t)        return ternary(t);
        if (e instanceof ArraySubscript s) return subscript(s);
        if (e instanceof Call c)           return call(c);
        if (e instanceof ElementaryType || e instanceof Mapping) {
            return Range.opaque("type expression " + AstNames.render(e));
        }
        if (e instanceof UnsupportedExpression u) {
            warn("unsupported expression " + u.what() + " at " + u.loc() + ", approximated as unknown");
            return Range.opaque("unsupported " + u.what());
        }
        warn("unhandled expression " + e.getClass().getSimpleName() + " at " + e.loc());
        return Range.opaque("unhandled " + e.getClass().getSimpleName());
    }

    /** Side-effect free evaluation. */
    Range peek(Expression e) {
        pureDepth++;
        try {
            return evaluate(e);
        } finally {
            pureDepth--;
        }
    }

    /**
     * Evaluates an operand of an enclosing operator; nested arithmetic is recorded as a
     * temporary in the current context.
     */
    Range operand(Expression e) {
        Range r = evaluate(e);
        if (!isPure() && isArithmetic(e)) {
            scope.temporary(AstNames.render(e), r, tmpType(r), e.loc());
        }
        return r;
    }

    boolean isPure() {
        return pureDepth > 0;
    }

    // --- Names ---

    Range read(String name) {
        Optional<Integer> bound = scope.binding(name);
        if (bound.isPresent()) return scope.var(bound.get()).range();
        Optional<VarNode> declared = declaredVariable(name);
        if (declared.isPresent()) return declaredRange(declared.get());
        Optional<String> global = BuiltinCatalog.globalType(name);
        if (global.isPresent()) return Range.top(elementaryType(global.get()));
        if ("this".equals(name)) return Range.top(NumericDomain.ADDRESS);
        Optional<Integer> symbol = symbols.lookup(contract, name);
        if (symbol.isPresent()) {
            return Range.opaque(name + " names a " + graph.node(symbols.resolve(symbol.get())).label());
        }
        return Range.opaque("unknown name " + name);
    }

    /** State variable or file-level constant visible under {@code name}. */
    Optional<VarNode> declaredVariable(String name) {
        return symbols.lookup(contract, name)
                .map(symbols::resolve)
                .flatMap(h -> graph.findNode(h, VarNode.class));
    }

    boolean isStateVariable(String name) {
        return declaredVariable(name).map(VarNode::stateVar).orElse(false);
    }

    /**
     * Range a declared variable has before the function writes it: the initialiser for
     * constants and immutables, the top of its type for everything else.
     */
    Range declaredRange(VarNode v) {
        VarType type = types.describe(v.type());
        if ((v.constant() || v.immutable()) && v.initializer() != null && constantsInProgress.add(v.name())) {
            try {
                return conform(peek(v.initializer()), type);
            } finally {
                constantsInProgress.remove(v.name());
            }
        }
        return Range.top(type);
    }

    Range declaredRange(String name) {
        return declaredVariable(name).map(this::declaredRange).orElse(Range.opaque("unknown name " + name));
    }

    /** Declared type of a name: its live binding's, else the state variable's. */
    VarType declaredType(String name) {
        Optional<Integer> bound = scope.binding(name);
        if (bound.isPresent()) return scope.var(bound.get()).type();
        Optional<VarNode> declared = declaredVariable(name);
        if (declared.isPresent()) return types.describe(declared.get().type());
        return new VarType(-1, name, null, null, "unknown name " + name);
    }

    /** Value as stored in a variable of {@code type}: re-tagged to its domain, no longer a literal. */
    static Range conform(Range value, VarType type) {
        if (!type.isNumeric()) {
            return value.isOpaque() && type.isResolved() ? value : Range.top(type);
        }
        if (value.isOpaque()) return Range.top(type);
        Range r = value.retag(type.domain()).withoutLiteral();
        if (type.upperBound() != null && r.isValue()) {
            r = r.intersect(Range.of(type.domain(), BigInteger.ZERO, type.upperBound()));
        }
        return r;
    }

    /** Writes a new version of {@code name} (nothing in pure mode) and returns the stored range. */
    Range write(String name, Range value, VarOrigin origin, Loc loc, String derivation) {
        VarType type = declaredType(name);
        Range stored = conform(value, type);
        if (!isPure()) {
            scope.bind(name, origin, stored, type, null, loc, derivation);
        }
        return stored;
    }

    // --- Literals ---

    private Range number(NumberLiteral n) {
        BigInteger value;
        try {
            String digits = n.value().replace("_", "");
            if (digits.startsWith("0x") || digits.startsWith("0X")) {
                value = new BigInteger(digits.substring(2), 16);
            } else {
                BigDecimal d = new BigDecimal(digits);
                if (n.exponent() != null && !n.exponent().isEmpty()) {
                    d = d.scaleByPowerOfTen(Integer.parseInt(n.exponent()));
                }
                if (d.signum() != 0 && (long) d.precision() - d.scale() > MAX_LITERAL_DIGITS) {
                    return Range.opaque("literal exceeds uint256: " + AstNames.render(n));
                }
                value = d.toBigIntegerExact();
            }
        } catch (NumberFormatException | ArithmeticException e) {
            return Range.opaque("not an integer literal: " + AstNames.render(n));
        }
        if (value.compareTo(UINT256_MAX) > 0) {
            return Range.opaque("literal exceeds uint256: " + value);
        }
        Concrete c = intern(Concrete.uint(256, value));
        return Range.literal(c.domain().orElse(NumericDomain.UINT256), value);
    }

    private Range bool(BoolLiteral b) {
        intern(Concrete.bool(b.value()));
        return Range.bool(b.value());
    }

    private Range string(StringLiteral s) {
        intern(Concrete.string(s.value()));
        return Range.opaque("string literal");
    }

    private Range hex(HexLiteral h) {
        String digits = h.hex().replace("_", "");
        if (digits.isEmpty() || digits.length() % 2 != 0 || digits.length() > 64) {
            return Range.opaque("hex literal");
        }
        BigInteger value;
        try {
            value = new BigInteger(digits, 16);
        } catch (NumberFormatException e) {
            return Range.opaque("malformed hex literal " + h.hex());
        }
        Concrete c = intern(Concrete.bytes(digits.length() / 2, value));
        return Range.literal(c.domain().orElse(NumericDomain.UINT256), value);
    }

    private Range address(AddressLiteral a) {
        String digits = a.address().startsWith("0x") ? a.address().substring(2) : a.address();
        BigInteger value;
        try {
            value = new BigInteger(digits, 16);
        } catch (NumberFormatException e) {
            return Range.opaque("malformed address literal " + a.address());
        }
        Concrete c = intern(Concrete.address(value));
        return Range.exact(c.domain().orElse(NumericDomain.ADDRESS), value);
    }

    private Concrete intern(Concrete c) {
        if (!isPure()) graph.concreteOrAdd(c);
        return c;
    }

    // --- Operators ---

    private Range binary(Binary b) {
        Range left = operand(b.left());
        Range right = operand(b.right());
        return RangeArithmetic.apply(b.op(), left, right);
    }

    private Range unary(Unary u) {
        if ((u.op().isIncDec() || u.op() == UnaryOp.DELETE) && u.operand() instanceof Variable v) {
            String name = v.name().name();
            Range before = read(name);
            if (u.op() == UnaryOp.DELETE) {
                return write(name, Range.zero(declaredType(name)), VarOrigin.ASSIGNMENT, u.loc(), AstNames.render(u));
            }
            Range after = write(name, RangeArithmetic.apply(u.op(), before), VarOrigin.ASSIGNMENT, u.loc(),
                    AstNames.render(u));
            return u.op().isPostfix() ? before : after;
        }
        Range value = operand(u.operand());
        if (u.op() == UnaryOp.DELETE) return Range.opaque("delete of " + AstNames.render(u.operand()));
        return RangeArithmetic.apply(u.op(), value);
    }

    private Range assign(Assign a) {
        BinaryOp arithmetic = a.op().binaryOp();
        Range value;
        String derivation;
        if (arithmetic == null) {
            value = evaluate(a.value());
            derivation = AstNames.render(a.value());
        } else {
            Range current = evaluate(a.target());
            value = RangeArithmetic.apply(arithmetic, current, operand(a.value()));
            derivation = AstNames.render(a.target()) + " " + arithmetic.symbol() + " " + AstNames.render(a.value());
        }
        if (a.target() instanceof Variable v) {
            return write(v.name().name(), value, VarOrigin.ASSIGNMENT, a.loc(), derivation);
        }
        // element or member of an aggregate: not tracked, but its index may have effects
        if (arithmetic == null) evaluateIndexes(a.target());
        return typeOf(a.target()).map(t -> conform(value, t)).orElse(value);
    }

    private Range ternary(Ternary t) {
        if (isPure() || ternaries == null) {
            peek(t.condition());
            return evaluate(t.ifTrue()).union(evaluate(t.ifFalse()));
        }
        return ternaries.branch(t);
    }

    private Range subscript(ArraySubscript s) {
        if (s.index() == null) return Range.opaque("type expression " + AstNames.render(s));
        evaluate(s.base());
        evaluate(s.index());
        return typeOf(s).map(t -> Range.top(t)).orElse(Range.opaque("element of " + AstNames.render(s.base())));
    }

    private void evaluateIndexes(Expression target) {
        if (target instanceof ArraySubscript s) {
            evaluateIndexes(s.base());
            if (s.index() != null) evaluate(s.index());
        } else if (target instanceof MemberAccess m) {
            evaluateIndexes(m.base());
        }
    }

    private Range member(MemberAccess m) {
        String member = m.member().name();
        if (m.base() instanceof Variable v && scope.binding(v.name().name()).isEmpty()) {
            String baseName = v.name().name();
            Optional<EnumNode> e = symbols.lookup(contract, baseName)
                    .map(symbols::resolve)
                    .flatMap(h -> graph.findNode(h, EnumNode.class));
            if (e.isPresent()) {
                int ordinal = e.get().values().indexOf(member);
                if (ordinal >= 0) return Range.exact(NumericDomain.uint(8), BigInteger.valueOf(ordinal));
                return Range.opaque("unknown member " + baseName + "." + member);
            }
            Optional<String> global = BuiltinCatalog.globalType(baseName + "." + member);
            if (global.isPresent()) return Range.top(elementaryType(global.get()));
        }
        if ("length".equals(member)) {
            evaluate(m.base());
            return Range.top(NumericDomain.UINT256);
        }
        evaluate(m.base());
        return typeOf(m).map(t -> Range.top(t)).orElse(Range.opaque("member " + AstNames.render(m)));
    }

    // --- Calls ---

    private Range call(Call c) {
        List<Expression> args = SolAst.orEmpty(c.args());
        Expression callee = c.callee();
        if (callee instanceof ElementaryType t) {
            return convert(args, elementaryType(t.name()));
        }
        if (callee instanceof Variable v) {
            String name = v.name().name();
            if ("payable".equals(name)) return convert(args, elementaryType("address"));
            if (scope.binding(name).isEmpty() && BuiltinCatalog.isFunction(name)) {
                return builtinCall(name, args);
            }
            Optional<Integer> symbol = symbols.lookup(contract, name).map(symbols::resolve);
            if (symbol.isPresent()) {
                return callDeclared(symbol.get(), name, args);
            }
            evaluateAll(args);
            return Range.opaque("unknown function " + name);
        }
        if (callee instanceof MemberAccess m && m.base() instanceof Variable lib
                && scope.binding(lib.name().name()).isEmpty() && namesContract(lib.name().name())) {
            // Library.f(...) or Base.f(...)
            Optional<Integer> target = symbols.lookup(lib.name().name(), m.member().name())
                    .map(symbols::resolve)
                    .filter(h -> graph.findNode(h, FunctionNode.class).isPresent());
            if (target.isPresent()) {
                return callDeclared(target.get(), m.member().name(), args);
            }
        }
        evaluate(callee);
        evaluateAll(args);
        return Range.opaque("external call " + AstNames.render(callee));
    }

    private boolean namesContract(String name) {
        return symbols.lookup(contract, name)
                .map(symbols::resolve)
                .flatMap(h -> graph.findNode(h, ContractNode.class))
                .isPresent();
    }

    private Range callDeclared(int handle, String name, List<Expression> args) {
        Node target = graph.node(handle);
        if (target instanceof FunctionNode) {
            evaluateAll(args);
            if (!isPure()) graph.addEdge(scope.current(), handle, EdgeKind.CALL);
            List<Integer> returns = graph.incoming(handle, EdgeKind.FUNCTION_RETURN);
            if (returns.size() == 1) {
                FunctionReturnNode r = graph.node(returns.get(0), FunctionReturnNode.class);
                return Range.top(types.describe(r.type()));
            }
            return Range.opaque(returns.isEmpty()
                    ? name + " returns nothing"
                    : name + " returns " + returns.size() + " values");
        }
        if (target instanceof ContractNode || target instanceof EnumNode || target instanceof TyNode) {
            return convert(args, types.describe(handle));
        }
        evaluateAll(args);
        return Range.opaque("call of " + target.label());
    }

    private Range builtinCall(String name, List<Expression> args) {
        List<Range> values = evaluateAll(args);
        if (("addmod".equals(name) || "mulmod".equals(name)) && values.size() == 3) {
            Range modulus = values.get(2);
            if (modulus.isValue()) {
                boolean mayBeZero = modulus.contains(BigInteger.ZERO);
                BigInteger hi = modulus.max().subtract(BigInteger.ONE).max(BigInteger.ZERO);
                return Range.of(NumericDomain.UINT256, BigInteger.ZERO, hi).withFlags(false, false, mayBeZero);
            }
        }
        List<String> returns = BuiltinCatalog.returnTypes(name);
        if (returns.size() == 1) return Range.top(elementaryType(returns.get(0)));
        return Range.opaque(name + " returns nothing");
    }

    /** Explicit conversion {@code T(x)}. */
    private Range convert(List<Expression> args, VarType target) {
        List<Range> values = evaluateAll(args);
        if (values.size() != 1) return Range.opaque("conversion to " + target.name() + " takes one argument");
        if (!target.isNumeric()) return Range.top(target);
        Range value = values.get(0);
        if (!value.isValue()) return value.isEmpty() ? Range.empty(target.domain()) : Range.top(target);
        Range converted = value.convert(target.domain());
        if (target.upperBound() != null) {
            converted = converted.intersect(Range.of(target.domain(), BigInteger.ZERO, target.upperBound()));
        }
        return converted;
    }

    private List<Range> evaluateAll(List<Expression> args) {
        List<Range> out = new ArrayList<>();
        for (Expression arg : args) out.add(operand(arg));
        return out;
    }

    // --- Types ---

    private VarType elementaryType(String name) {
        return types.describe(types.elementary(contract, name, null));
    }

    /** Declared type of an l-value-like expression, when it can be worked out. */
    Optional<VarType> typeOf(Expression e) {
        if (e instanceof Variable v) {
            VarType t = declaredType(v.name().name());
            return t.isResolved() ? Optional.of(t) : Optional.empty();
        }
        if (e instanceof ArraySubscript s) {
            return typeOf(s.base()).flatMap(types::elementType);
        }
        if (e instanceof MemberAccess m) {
            return typeOf(m.base()).flatMap(t -> fieldType(t, m.member().name()));
        }
        return Optional.empty();
    }

    private Optional<VarType> fieldType(VarType struct, String field) {
        int h = symbols.resolve(struct.handle());
        if (graph.findNode(h, StructNode.class).isEmpty()) return Optional.empty();
        for (int f : graph.incoming(h, EdgeKind.FIELD)) {
            FieldNode node = graph.node(f, FieldNode.class);
            if (field.equals(node.name())) return Optional.of(types.describe(node.type()));
        }
        return Optional.empty();
    }

    static VarType tmpType(Range r) {
        if (r.domain() != null) return VarType.numeric(-1, r.domain().toString(), r.domain());
        return VarType.opaque(-1, "unknown");
    }

    private static boolean isArithmetic(Expression e) {
        if (e instanceof Binary b) return !b.op().isComparison() && !b.op().isLogical();
        if (e instanceof Unary u) return u.op() == UnaryOp.NEG || u.op() == UnaryOp.BIT_NOT;
        return false;
    }

    private void warn(String message) {
        if (!isPure()) diagnostics.warn(message);
    }
}
