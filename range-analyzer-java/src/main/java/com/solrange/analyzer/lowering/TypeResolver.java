package com.solrange.analyzer.lowering;

import com.solrange.analyzer.ast.AstNames;
import com.solrange.analyzer.ast.SolAst.*;
import com.solrange.analyzer.graph.GraphModel.*;
import com.solrange.analyzer.graph.SemanticGraph;
import com.solrange.analyzer.types.Builtin;
import com.solrange.analyzer.types.DynBuiltin;
import com.solrange.analyzer.types.NumericDomain;
import com.solrange.analyzer.types.VarType;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Maps type expressions to graph handles and handles back to {@link VarType}s.
 *
 * Elementary types become interned builtin nodes; user-defined names go through the
 * {@link SymbolTable}, so a type used before its declaration is a placeholder until it resolves.
 */
public class TypeResolver {

    private static final int MAX_ALIAS_DEPTH = 16;

    private final SemanticGraph graph;
    private final SymbolTable symbols;

    public TypeResolver(SemanticGraph graph, SymbolTable symbols) {
        this.graph = graph;
        this.symbols = symbols;
    }

    /** Graph handle for a type expression seen from {@code scope}. */
    public int typeHandle(String scope, Expression ty) {
        if (ty instanceof ElementaryType t) {
            return elementary(scope, t.name(), t.loc());
        }
        if (ty instanceof Variable v) {
            return symbols.reference(scope, v.name().name(), v.loc());
        }
        if (ty instanceof MemberAccess m) {
            // Library.Type or Contract.Enum: the member names the declaration
            return symbols.reference(scope, m.member().name(), m.loc());
        }
        if (ty instanceof ArraySubscript s) {
            int element = typeHandle(scope, s.base());
            Optional<Integer> length = fixedLength(s.index());
            if (length.isPresent()) {
                return graph.dynBuiltinOrAdd(DynBuiltin.fixedArray(element, length.get()));
            }
            return graph.dynBuiltinOrAdd(DynBuiltin.array(element));
        }
        if (ty instanceof Mapping m) {
            return graph.dynBuiltinOrAdd(DynBuiltin.mapping(typeHandle(scope, m.key()), typeHandle(scope, m.value())));
        }
        String rendered = ty == null ? "<missing type>" : AstNames.render(ty);
        return symbols.reference(scope, rendered, ty == null ? null : ty.loc());
    }

    /** Handle for an elementary type name, or a placeholder for names that are not one. */
    public int elementary(String scope, String name, Loc loc) {
        Optional<Builtin> builtin = Builtin.tryFrom(name);
        if (builtin.isPresent()) return graph.builtinOrAdd(builtin.get());
        if ("string".equals(name)) return graph.dynBuiltinOrAdd(DynBuiltin.STRING);
        if ("bytes".equals(name)) return graph.dynBuiltinOrAdd(DynBuiltin.BYTES);
        return symbols.reference(scope, name, loc);
    }

    /** Describes the (resolved) type behind a handle. */
    public VarType describe(int handle) {
        return describe(handle, 0);
    }

    private VarType describe(int handle, int depth) {
        int h = symbols.resolve(handle);
        Node n = graph.node(h);
        if (n instanceof BuiltinNode b) {
            return VarType.numeric(h, b.builtin().typeName(), b.builtin().domain());
        }
        if (n instanceof DynBuiltinNode d) {
            return VarType.opaque(h, render(d.dynBuiltin(), depth));
        }
        if (n instanceof EnumNode e) {
            int members = Math.max(1, e.values().size());
            return new VarType(h, e.name(), NumericDomain.uint(8), BigInteger.valueOf(members - 1L), null);
        }
        if (n instanceof TyNode t) {
            if (depth >= MAX_ALIAS_DEPTH) return VarType.unknown(h, t.name());
            VarType underlying = describe(t.underlying(), depth + 1);
            return new VarType(h, t.name(), underlying.domain(), underlying.upperBound(), underlying.unresolved());
        }
        if (n instanceof ContractNode c) {
            return VarType.numeric(h, c.name(), NumericDomain.ADDRESS);
        }
        if (n instanceof StructNode s) {
            return VarType.opaque(h, s.name());
        }
        if (n instanceof UnresolvedNode u) {
            return VarType.unknown(h, u.name());
        }
        return VarType.unknown(h, n.label());
    }

    /** Element type of an indexable type (array element, mapping value), if any. */
    public Optional<VarType> elementType(VarType container) {
        Optional<DynBuiltinNode> d = graph.findNode(symbols.resolve(container.handle()), DynBuiltinNode.class);
        if (d.isEmpty() || !d.get().dynBuiltin().isIndexable()) return Optional.empty();
        return Optional.of(describe(d.get().dynBuiltin().valueType()));
    }

    private static Optional<Integer> fixedLength(Expression index) {
        if (!(index instanceof NumberLiteral n)) return Optional.empty();
        try {
            String digits = n.value().replace("_", "");
            int length = digits.startsWith("0x") ? Integer.parseInt(digits.substring(2), 16) : Integer.parseInt(digits);
            return Optional.of(length);
        } catch (NumberFormatException e) {
            // not a plain int; treated as dynamic
            return Optional.empty();
        }
    }

    private String render(DynBuiltin d, int depth) {
        if (depth >= MAX_ALIAS_DEPTH) return d.kind().name().toLowerCase();
        return switch (d.kind()) {
            case STRING -> "string";
            case BYTES -> "bytes";
            case ARRAY -> describe(d.valueType(), depth + 1).name() + "[]";
            case FIXED_ARRAY -> describe(d.valueType(), depth + 1).name() + "[" + d.length() + "]";
            case MAPPING -> "mapping(" + describe(d.keyType(), depth + 1).name() + " => "
                    + describe(d.valueType(), depth + 1).name() + ")";
        };
    }
}
