package com.solrange.analyzer;

import com.solrange.analyzer.ast.SolAst.SourceUnit;
import com.solrange.analyzer.config.AnalyzerConfig;
import com.solrange.analyzer.context.ContextBuilder;
import com.solrange.analyzer.graph.GraphModel.ContextNode;
import com.solrange.analyzer.graph.GraphModel.EdgeKind;
import com.solrange.analyzer.graph.GraphModel.Node;
import com.solrange.analyzer.graph.SemanticGraph;
import com.solrange.analyzer.lowering.DeclarationLowering;
import com.solrange.analyzer.lowering.DeclarationLowering.LoweredUnit;
import com.solrange.analyzer.lowering.DeclarationLowering.PendingBody;
import com.solrange.analyzer.lowering.SymbolTable;
import com.solrange.analyzer.lowering.TypeResolver;
import com.solrange.analyzer.report.BoundsAnalyzer;
import com.solrange.analyzer.report.BoundsReport;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One analysis session: owns the graph and everything built on it. Source units are lowered
 * first, then every function body found is walked into its context tree.
 */
public class Analyzer {

    private final AnalyzerConfig config;
    private final Diagnostics diagnostics;
    private final SemanticGraph graph = new SemanticGraph();
    private final SymbolTable symbols = new SymbolTable(graph);
    private final TypeResolver types = new TypeResolver(graph, symbols);
    private final DeclarationLowering lowering;
    private final ContextBuilder builder;
    private final BoundsAnalyzer bounds = new BoundsAnalyzer(graph);
    private final List<Integer> sourceUnits = new ArrayList<>();

    public Analyzer() {
        this(AnalyzerConfig.defaults(), new Diagnostics());
    }

    public Analyzer(AnalyzerConfig config, Diagnostics diagnostics) {
        this.config = config;
        this.diagnostics = diagnostics;
        this.lowering = new DeclarationLowering(graph, symbols, types, diagnostics);
        this.builder = new ContextBuilder(graph, symbols, types, config.builderLimits(), diagnostics);
    }

    /**
     * Lowers the unit's declarations and builds a context tree for every function body in it.
     *
     * @return handle of the source-unit node
     */
    public int analyze(SourceUnit unit, int fileNo) {
        LoweredUnit lowered = lowering.lower(unit, fileNo);
        sourceUnits.add(lowered.sourceUnit());
        for (PendingBody body : lowered.bodies()) {
            builder.build(body);
        }
        for (SymbolTable.Obligation o : symbols.unresolved()) {
            diagnostics.warn("unresolved name " + o.name()
                    + (o.scope() != null ? " in " + o.scope() : ""));
        }
        diagnostics.info("Analyzed file " + fileNo + ": " + lowered.bodies().size() + " function bodies, "
                + graph.size() + " graph nodes");
        return lowered.sourceUnit();
    }

    /** Entry contexts of every function analyzed so far, by handle. */
    public List<Integer> entryContexts() {
        List<Integer> out = new ArrayList<>();
        for (int su : sourceUnits) {
            out.addAll(graph.searchChildren(su, EdgeKind.CONTEXT));
        }
        return out;
    }

    /** Looks a context up by its dotted path, e.g. {@code Storage.b5.fork0.true}. */
    public Optional<Integer> contextByPath(String path) {
        for (int h = 0; h < graph.size(); h++) {
            Node n = graph.node(h);
            if (n instanceof ContextNode c && c.path().equals(path)) return Optional.of(h);
        }
        return Optional.empty();
    }

    public List<BoundsReport> boundsFor(int context, String name) {
        return bounds.boundsFor(context, name, config.toReportConfig());
    }

    public List<BoundsReport> boundsForAll(int context) {
        return bounds.boundsForAll(context, config.toReportConfig());
    }

    /** Reports for every entry context; with {@code name} null, for every live name. */
    public List<BoundsReport> reportAll(String name) {
        List<BoundsReport> out = new ArrayList<>();
        for (int entry : entryContexts()) {
            out.addAll(name != null ? boundsFor(entry, name) : boundsForAll(entry));
        }
        return out;
    }

    public SemanticGraph graph()          { return graph; }
    public SymbolTable symbols()          { return symbols; }
    public BoundsAnalyzer bounds()        { return bounds; }
    public Diagnostics diagnostics()      { return diagnostics; }
    public AnalyzerConfig config()        { return config; }
}
