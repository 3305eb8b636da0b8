package com.solrange.analyzer.lowering;

import com.solrange.analyzer.Diagnostics;
import com.solrange.analyzer.ast.SolAst;
import com.solrange.analyzer.ast.SolAst.*;
import com.solrange.analyzer.graph.GraphModel.*;
import com.solrange.analyzer.graph.SemanticGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns the declarations of a source unit into graph nodes with containment edges
 * (child to owner) and registers every declared name in the {@link SymbolTable}.
 *
 * Function bodies are not walked here. They are returned as {@link PendingBody} entries so
 * that the caller builds contexts only once every declaration of the unit is known.
 */
public class DeclarationLowering {

    /** A function whose body still has to go through the context builder. */
    public record PendingBody(int function, FunctionDefinition definition, String scope, String path) {}

    public record LoweredUnit(int sourceUnit, List<PendingBody> bodies) {}

    private final SemanticGraph graph;
    private final SymbolTable symbols;
    private final TypeResolver types;
    private final Diagnostics diagnostics;

    public DeclarationLowering(SemanticGraph graph, SymbolTable symbols, TypeResolver types, Diagnostics diagnostics) {
        this.graph = graph;
        this.symbols = symbols;
        this.types = types;
        this.diagnostics = diagnostics;
    }

    public LoweredUnit lower(SourceUnit unit, int fileNo) {
        int sourceUnit = graph.addNode(new SourceUnitNode(fileNo));
        List<PendingBody> bodies = new ArrayList<>();
        List<SourceUnitPart> parts = SolAst.orEmpty(unit.parts());
        for (int i = 0; i < parts.size(); i++) {
            int part = graph.addNode(new SourceUnitPartNode(fileNo, i));
            graph.addEdge(part, sourceUnit, EdgeKind.PART);
            lowerSourceUnitPart(parts.get(i), part, bodies);
        }
        return new LoweredUnit(sourceUnit, Collections.unmodifiableList(bodies));
    }

    private void lowerSourceUnitPart(SourceUnitPart p, int owner, List<PendingBody> bodies) {
        if (p instanceof ContractDefinition c) {
            lowerContract(c, owner, bodies);
        } else if (p instanceof SkippedPart s) {
            diagnostics.warn("skipped " + s.what() + " at " + s.loc());
        } else if (p instanceof ContractPart cp) {
            // free functions, file-level structs/enums/errors/constants/aliases
            lowerMember(cp, null, owner, bodies);
        } else {
            diagnostics.warn("unsupported source unit part " + p.getClass().getSimpleName() + " at " + p.loc());
        }
    }

    private void lowerContract(ContractDefinition c, int owner, List<PendingBody> bodies) {
        String name = c.name().name();
        List<String> bases = SolAst.orEmpty(c.bases());
        String kind = c.contractKind() != null ? c.contractKind() : "contract";
        int contract = graph.addNode(new ContractNode(name, kind, List.copyOf(bases), c.loc()));
        graph.addEdge(contract, owner, EdgeKind.CONTRACT);
        symbols.declare(null, name, contract);
        symbols.setBases(name, bases);
        for (ContractPart part : SolAst.orEmpty(c.parts())) {
            lowerMember(part, name, contract, bodies);
        }
    }

    private void lowerMember(ContractPart part, String scope, int owner, List<PendingBody> bodies) {
        if (part instanceof FunctionDefinition f) {
            lowerFunction(f, scope, owner, bodies);
        } else if (part instanceof VariableDefinition v) {
            lowerVariable(v, scope, owner);
        } else if (part instanceof StructDefinition s) {
            lowerStruct(s, scope, owner);
        } else if (part instanceof EnumDefinition e) {
            List<String> values = new ArrayList<>();
            for (Identifier id : SolAst.orEmpty(e.values())) values.add(id.name());
            int node = graph.addNode(new EnumNode(e.name().name(), List.copyOf(values), e.loc()));
            graph.addEdge(node, owner, EdgeKind.ENUM);
            symbols.declare(scope, e.name().name(), node);
        } else if (part instanceof ErrorDefinition e) {
            lowerError(e, scope, owner);
        } else if (part instanceof TypeDefinition t) {
            int underlying = types.typeHandle(scope, t.ty());
            int node = graph.addNode(new TyNode(t.name().name(), underlying, t.loc()));
            graph.addEdge(node, owner, EdgeKind.TY);
            symbols.declare(scope, t.name().name(), node);
        } else if (part instanceof SkippedPart s) {
            diagnostics.warn("skipped " + s.what() + " at " + s.loc());
        } else {
            diagnostics.warn("unsupported contract part " + part.getClass().getSimpleName() + " at " + part.loc());
        }
    }

    private void lowerFunction(FunctionDefinition f, String scope, int owner, List<PendingBody> bodies) {
        String kind = f.functionKind() != null ? f.functionKind() : "function";
        String name = f.name() != null && f.name().name() != null && !f.name().name().isEmpty()
                ? f.name().name()
                : kind;
        int function = graph.addNode(new FunctionNode(name, kind, List.copyOf(SolAst.orEmpty(f.attributes())), f.loc()));
        graph.addEdge(function, owner, EdgeKind.FUNC);
        symbols.declare(scope, name, function);

        List<Parameter> params = SolAst.orEmpty(f.params());
        for (int i = 0; i < params.size(); i++) {
            Parameter p = params.get(i);
            int param = graph.addNode(new FunctionParamNode(nameOf(p.name()), i, types.typeHandle(scope, p.ty()), p.loc()));
            graph.addEdge(param, function, EdgeKind.FUNCTION_PARAM);
        }
        List<Parameter> returns = SolAst.orEmpty(f.returns());
        for (int i = 0; i < returns.size(); i++) {
            Parameter r = returns.get(i);
            int ret = graph.addNode(new FunctionReturnNode(nameOf(r.name()), i, types.typeHandle(scope, r.ty()), r.loc()));
            graph.addEdge(ret, function, EdgeKind.FUNCTION_RETURN);
        }

        if (f.body() != null) {
            String path = scope != null ? scope + "." + name : name;
            bodies.add(new PendingBody(function, f, scope, path));
        }
    }

    private void lowerVariable(VariableDefinition v, String scope, int owner) {
        List<String> attributes = SolAst.orEmpty(v.attributes());
        VarNode node = new VarNode(
                v.name().name(),
                types.typeHandle(scope, v.ty()),
                scope != null,
                attributes.contains("constant"),
                attributes.contains("immutable"),
                v.initializer(),
                v.loc());
        int handle = graph.addNode(node);
        graph.addEdge(handle, owner, EdgeKind.VAR);
        symbols.declare(scope, node.name(), handle);
    }

    private void lowerStruct(StructDefinition s, String scope, int owner) {
        int struct = graph.addNode(new StructNode(s.name().name(), s.loc()));
        graph.addEdge(struct, owner, EdgeKind.STRUCT);
        symbols.declare(scope, s.name().name(), struct);
        List<VariableDeclaration> fields = SolAst.orEmpty(s.fields());
        for (int i = 0; i < fields.size(); i++) {
            VariableDeclaration f = fields.get(i);
            int field = graph.addNode(new FieldNode(nameOf(f.name()), i, types.typeHandle(scope, f.ty()), f.loc()));
            graph.addEdge(field, struct, EdgeKind.FIELD);
        }
    }

    private void lowerError(ErrorDefinition e, String scope, int owner) {
        int error = graph.addNode(new ErrorNode(e.name().name(), e.loc()));
        graph.addEdge(error, owner, EdgeKind.ERROR);
        symbols.declare(scope, e.name().name(), error);
        List<Parameter> fields = SolAst.orEmpty(e.fields());
        for (int i = 0; i < fields.size(); i++) {
            Parameter p = fields.get(i);
            int param = graph.addNode(new ErrorParamNode(nameOf(p.name()), i, types.typeHandle(scope, p.ty()), p.loc()));
            graph.addEdge(param, error, EdgeKind.ERROR_PARAM);
        }
    }

    private static String nameOf(Identifier id) {
        return id != null ? id.name() : null;
    }
}
