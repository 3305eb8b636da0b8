package com.solrange.analyzer;

import com.solrange.analyzer.ast.SolAst.FunctionDefinition;
import com.solrange.analyzer.ast.SolAst.SkippedPart;
import com.solrange.analyzer.ast.SolAst.SourceUnit;
import com.solrange.analyzer.graph.GraphModel.*;
import com.solrange.analyzer.graph.SemanticGraph;
import com.solrange.analyzer.lowering.DeclarationLowering;
import com.solrange.analyzer.lowering.DeclarationLowering.LoweredUnit;
import com.solrange.analyzer.lowering.SymbolTable;
import com.solrange.analyzer.lowering.TypeResolver;
import com.solrange.analyzer.types.NumericDomain;
import com.solrange.analyzer.types.VarType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static com.solrange.analyzer.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class DeclarationLoweringTest {

    private SemanticGraph graph;
    private SymbolTable symbols;
    private TypeResolver types;
    private Diagnostics diagnostics;
    private DeclarationLowering lowering;

    @BeforeEach
    void setUp() {
        graph = new SemanticGraph();
        symbols = new SymbolTable(graph);
        types = new TypeResolver(graph, symbols);
        diagnostics = new Diagnostics(true);
        lowering = new DeclarationLowering(graph, symbols, types, diagnostics);
    }

    private LoweredUnit lower(SourceUnit unit) {
        return lowering.lower(unit, 0);
    }

    private int onlyContract(LoweredUnit lowered) {
        List<Integer> contracts = graph.searchChildren(lowered.sourceUnit(), EdgeKind.CONTRACT);
        assertEquals(1, contracts.size());
        return contracts.get(0);
    }

    @Test
    void sourceUnitGetsOnePartPerTopLevelItem() {
        LoweredUnit lowered = lower(unit(contract("A"), contract("B")));
        assertEquals(2, graph.incoming(lowered.sourceUnit(), EdgeKind.PART).size());
        assertEquals(2, graph.searchChildren(lowered.sourceUnit(), EdgeKind.CONTRACT).size());
    }

    @Test
    void contractMembersAreAttachedWithTheirEdgeKinds() {
        LoweredUnit lowered = lower(unit(contract("C",
                stateVar("uint256", "total"),
                struct("Point", field("uint256", "x"), field("uint256", "y")),
                enumeration("Color", "Red", "Green"),
                error("TooBig", param("uint256", "value")),
                function("f", params(param("uint8", "a"), param("bool", "b")), params(param("uint256", null))))));
        int c = onlyContract(lowered);

        assertEquals(1, graph.incoming(c, EdgeKind.VAR).size());
        assertEquals(1, graph.incoming(c, EdgeKind.STRUCT).size());
        assertEquals(1, graph.incoming(c, EdgeKind.ENUM).size());
        assertEquals(1, graph.incoming(c, EdgeKind.ERROR).size());

        int struct = graph.incoming(c, EdgeKind.STRUCT).get(0);
        assertEquals(2, graph.incoming(struct, EdgeKind.FIELD).size());

        int error = graph.incoming(c, EdgeKind.ERROR).get(0);
        assertEquals(1, graph.incoming(error, EdgeKind.ERROR_PARAM).size());

        int f = graph.incoming(c, EdgeKind.FUNC).get(0);
        List<Integer> params = graph.incoming(f, EdgeKind.FUNCTION_PARAM);
        assertEquals(2, params.size());
        FunctionParamNode second = graph.node(params.get(1), FunctionParamNode.class);
        assertEquals("b", second.name());
        assertEquals(1, second.order());
        assertEquals("bool", types.describe(second.type()).name());

        FunctionReturnNode ret = graph.node(graph.incoming(f, EdgeKind.FUNCTION_RETURN).get(0), FunctionReturnNode.class);
        assertNull(ret.name());
        assertEquals(NumericDomain.UINT256, types.describe(ret.type()).domain());
    }

    @Test
    void typeUsedBeforeItsDeclarationResolves() {
        LoweredUnit lowered = lower(unit(contract("C",
                function("f", params(param(var("Point"), "p"))),
                struct("Point", field("uint256", "x")))));
        int c = onlyContract(lowered);
        int f = graph.incoming(c, EdgeKind.FUNC).get(0);
        FunctionParamNode p = graph.node(graph.incoming(f, EdgeKind.FUNCTION_PARAM).get(0), FunctionParamNode.class);

        int struct = graph.incoming(c, EdgeKind.STRUCT).get(0);
        assertEquals(struct, symbols.resolve(p.type()));
        assertEquals("Point", types.describe(p.type()).name());
        assertTrue(symbols.unresolved().isEmpty());
    }

    @Test
    void unknownTypeStaysAnOpenObligation() {
        lower(unit(contract("C", function("f", params(param(var("Missing"), "m"))))));
        assertEquals(1, symbols.unresolved().size());
        assertEquals("Missing", symbols.unresolved().get(0).name());
        assertEquals("C", symbols.unresolved().get(0).scope());
    }

    @Test
    void baseContractDeclaredLaterStillResolves() {
        lower(unit(
                contract("D", List.of("B"), function("f", params(param(var("S"), "s")))),
                contract("B", struct("S", field("uint8", "v")))));
        assertTrue(symbols.unresolved().isEmpty());
    }

    @Test
    void enumTypeIsBoundedByItsMemberCount() {
        lower(unit(contract("C", enumeration("Color", "Red", "Green", "Blue"))));
        VarType color = types.describe(symbols.lookup("C", "Color").orElseThrow());
        assertEquals("Color", color.name());
        assertEquals(BigInteger.TWO, color.upperBound());
    }

    @Test
    void stateAndFreeVariablesAreDistinguished() {
        LoweredUnit lowered = lower(unit(
                constant("uint256", "LIMIT", num(100)),
                contract("C", stateVar("uint8", "counter"))));
        List<Integer> vars = graph.searchChildren(lowered.sourceUnit(), EdgeKind.VAR);
        assertEquals(2, vars.size());

        VarNode free = graph.node(vars.get(0), VarNode.class);
        assertEquals("LIMIT", free.name());
        assertFalse(free.stateVar());
        assertTrue(free.constant());
        assertNotNull(free.initializer());

        VarNode state = graph.node(vars.get(1), VarNode.class);
        assertTrue(state.stateVar());
        assertFalse(state.constant());
    }

    @Test
    void onlyFunctionsWithBodiesArePending() {
        FunctionDefinition declared = new FunctionDefinition(null, "function", id("g"),
                List.of(), List.of(), List.of("external"), null);
        LoweredUnit lowered = lower(unit(contract("C", function("f", params()), declared)));
        assertEquals(1, lowered.bodies().size());
        assertEquals("C.f", lowered.bodies().get(0).path());
        assertEquals("C", lowered.bodies().get(0).scope());
        assertEquals(2, graph.searchChildren(lowered.sourceUnit(), EdgeKind.FUNC).size());
    }

    @Test
    void unnamedFunctionIsNamedAfterItsKind() {
        FunctionDefinition ctor = new FunctionDefinition(null, "constructor", null,
                List.of(), List.of(), List.of(), block());
        LoweredUnit lowered = lower(unit(contract("C", ctor)));
        int f = graph.searchChildren(lowered.sourceUnit(), EdgeKind.FUNC).get(0);
        assertEquals("constructor", graph.node(f, FunctionNode.class).name());
        assertEquals("C.constructor", lowered.bodies().get(0).path());
    }

    @Test
    void freeFunctionPathHasNoContractPrefix() {
        LoweredUnit lowered = lower(unit(function("helper", params())));
        assertEquals("helper", lowered.bodies().get(0).path());
        assertNull(lowered.bodies().get(0).scope());
    }

    @Test
    void skippedPartsAreReportedAndIgnored() {
        LoweredUnit lowered = lower(unit(new SkippedPart(null, "pragma"),
                contract("C", new SkippedPart(null, "event Transfer"))));
        assertEquals(2, diagnostics.warnings().size());
        assertTrue(diagnostics.warnings().get(0).contains("pragma"));
        assertTrue(diagnostics.warnings().get(1).contains("event Transfer"));
        assertEquals(1, graph.searchChildren(lowered.sourceUnit(), EdgeKind.CONTRACT).size());
    }
}
