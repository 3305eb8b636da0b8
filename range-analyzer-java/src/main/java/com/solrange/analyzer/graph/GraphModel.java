package com.solrange.analyzer.graph;

import com.solrange.analyzer.ast.SolAst.Expression;
import com.solrange.analyzer.ast.SolAst.Loc;
import com.solrange.analyzer.range.Constraint;
import com.solrange.analyzer.range.NarrowingStep;
import com.solrange.analyzer.range.Range;
import com.solrange.analyzer.types.Builtin;
import com.solrange.analyzer.types.Concrete;
import com.solrange.analyzer.types.DynBuiltin;
import com.solrange.analyzer.types.VarType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node and edge values held by {@link SemanticGraph}.
 * Nodes refer to each other only through integer handles; {@code -1} marks an absent handle.
 */
public final class GraphModel {

    private GraphModel() {}

    /** Common view used by the debug export. */
    public interface Node {
        String label();
    }

    // --- Source structure ---

    public record SourceUnitNode(int fileNo) implements Node {
        public String label() { return "SourceUnit(" + fileNo + ")"; }
    }

    public record SourceUnitPartNode(int fileNo, int partNo) implements Node {
        public String label() { return "SourceUnitPart(" + fileNo + ", " + partNo + ")"; }
    }

    public record ContractNode(String name, String contractKind, List<String> bases, Loc loc) implements Node {
        public String label() { return contractKind + " " + name; }
    }

    public record FunctionNode(String name, String functionKind, List<String> attributes, Loc loc) implements Node {
        public String label() { return functionKind + " " + name; }
    }

    public record FunctionParamNode(String name, int order, int type, Loc loc) implements Node {
        public String label() { return "param #" + order + " " + (name != null ? name : "_"); }
    }

    public record FunctionReturnNode(String name, int order, int type, Loc loc) implements Node {
        public String label() { return "return #" + order + " " + (name != null ? name : "_"); }
    }

    public record StructNode(String name, Loc loc) implements Node {
        public String label() { return "struct " + name; }
    }

    public record FieldNode(String name, int order, int type, Loc loc) implements Node {
        public String label() { return "field #" + order + " " + name; }
    }

    public record EnumNode(String name, List<String> values, Loc loc) implements Node {
        public String label() { return "enum " + name + values; }
    }

    public record ErrorNode(String name, Loc loc) implements Node {
        public String label() { return "error " + name; }
    }

    public record ErrorParamNode(String name, int order, int type, Loc loc) implements Node {
        public String label() { return "error param #" + order + " " + (name != null ? name : "_"); }
    }

    /** Free or state variable; the initializer is kept so reads before any write can use it. */
    public record VarNode(
            String name,
            int type,
            boolean stateVar,
            boolean constant,
            boolean immutable,
            Expression initializer,
            Loc loc
    ) implements Node {
        public String label() { return (stateVar ? "state var " : "var ") + name; }
    }

    public record TyNode(String name, int underlying, Loc loc) implements Node {
        public String label() { return "type " + name; }
    }

    /** Name referenced before (or without) a declaration. */
    public record UnresolvedNode(String name, Loc loc) implements Node {
        public String label() { return "unresolved " + name; }
    }

    // --- Types and values ---

    public record BuiltinNode(Builtin builtin) implements Node {
        public String label() { return builtin.typeName(); }
    }

    public record DynBuiltinNode(DynBuiltin dynBuiltin) implements Node {
        public String label() { return dynBuiltin.kind().name().toLowerCase(); }
    }

    public record ConcreteNode(Concrete value) implements Node {
        public String label() { return value.toString(); }
    }

    // --- Execution contexts ---

    public enum ContextKind { ENTRY, TRUE_BRANCH, FALSE_BRANCH, LOOP_BODY, CONTINUATION, ASSERT_FAILURE }

    public enum VarOrigin {
        PARAMETER,
        DECLARATION,
        ASSIGNMENT,
        /** Copy of the parent's binding at a fork boundary. */
        INHERITED,
        NARROWED,
        MERGED,
        /** Widened to its type's top because a loop (or too-deep region) may have written it. */
        WIDENED,
        TEMPORARY;

        /** Origins that start a range rather than restrict or copy one. */
        public boolean startsChain() {
            return this != INHERITED && this != NARROWED;
        }
    }

    /**
     * One straight-line slice of symbolic execution. Flags may change only while the builder
     * walks the slice; {@link #seal()} freezes it.
     */
    public static final class ContextNode implements Node {
        private final String path;
        private final ContextKind kind;
        private final int function;
        private final int depth;
        private final List<Constraint> conditions;
        private final Loc loc;
        private boolean terminated;
        private boolean unreachable;
        private boolean sealed;

        public ContextNode(String path, ContextKind kind, int function, int depth,
                           List<Constraint> conditions, Loc loc) {
            this.path = path;
            this.kind = kind;
            this.function = function;
            this.depth = depth;
            this.conditions = Collections.unmodifiableList(new ArrayList<>(conditions));
            this.loc = loc;
        }

        public String path()                { return path; }
        public ContextKind kind()           { return kind; }
        public int function()               { return function; }
        public int depth()                  { return depth; }
        public List<Constraint> conditions() { return conditions; }
        public Loc loc()                    { return loc; }
        public boolean isTerminated()       { return terminated; }
        public boolean isUnreachable()      { return unreachable; }

        /** Contexts that take no part in merging or reporting. */
        public boolean isExcluded() {
            return unreachable || kind == ContextKind.ASSERT_FAILURE;
        }

        public void markTerminated() {
            checkOpen();
            terminated = true;
        }

        public void markUnreachable() {
            checkOpen();
            unreachable = true;
        }

        public void seal() {
            sealed = true;
        }

        private void checkOpen() {
            if (sealed) {
                throw new IllegalStateException("Context already sealed: " + path);
            }
        }

        @Override
        public String label() {
            return "ctx " + path + (terminated ? " (terminated)" : "") + (unreachable ? " (unreachable)" : "");
        }

        @Override
        public String toString() {
            return label();
        }
    }

    /**
     * One version of a source name inside one context.
     *
     * @param tmpOf      rendered expression for compiler-introduced temporaries, else null
     * @param prev       previous version of the same name, or -1
     * @param step       narrowing applied to produce this version, or null
     * @param derivation symbolic description of where the range came from
     */
    public record ContextVarNode(
            String name,
            int context,
            String tmpOf,
            int prev,
            VarOrigin origin,
            Range range,
            VarType type,
            NarrowingStep step,
            Loc loc,
            String derivation
    ) implements Node {
        public boolean isTmp() { return tmpOf != null; }

        public String label() { return name + " = " + range.describe() + " [" + origin.name().toLowerCase() + "]"; }
    }

    /** Branch point joining one parent context to its children. */
    public record ContextForkNode(int parent, String reason, Loc loc) implements Node {
        public String label() { return "fork(" + reason + ")"; }
    }

    // --- Edges ---

    public enum EdgeKind {
        PART,
        CONTRACT,
        STRUCT,
        ENUM,
        ERROR,
        ERROR_PARAM,
        FIELD,
        VAR,
        TY,
        FUNC,
        FUNCTION_PARAM,
        FUNCTION_RETURN,
        /** entry context -> function */
        CONTEXT,
        /** child context -> fork marker, or continuation / assertion failure -> parent context */
        SUBCONTEXT,
        /** fork marker -> parent context */
        FORK,
        /** context variable -> context */
        CONTEXT_VAR,
        /** context variable -> previous version */
        PREV,
        /** merged variable -> each arm's final version */
        MERGE,
        /** context -> called function */
        CALL,
        /** context -> returned variable */
        RETURN
    }

    public record Edge(int from, int to, EdgeKind kind) {}
}
