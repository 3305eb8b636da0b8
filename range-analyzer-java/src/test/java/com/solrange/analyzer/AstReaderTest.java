package com.solrange.analyzer;

import com.solrange.analyzer.ast.AstReader;
import com.solrange.analyzer.ast.SolAst.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class AstReaderTest {

    private static final Path FIXTURES =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/contracts");

    private final AstReader reader = new AstReader();

    @Test
    void fixtureIsReadWithEveryPart() {
        SourceUnit unit = reader.read(FIXTURES.resolve("storage.ast.json"));
        assertEquals(2, unit.parts().size());
        assertInstanceOf(SkippedPart.class, unit.parts().get(0));

        ContractDefinition storage = (ContractDefinition) unit.parts().get(1);
        assertEquals("Storage", storage.name().name());
        assertEquals(new Loc(0, 34, 41), storage.name().loc());
        assertEquals(7, storage.parts().size());

        FunctionDefinition b5 = (FunctionDefinition) storage.parts().get(3);
        assertEquals("b5", b5.name().name());
        Block body = (Block) b5.body();
        Assign assign = (Assign) ((ExpressionStatement) body.statements().get(0)).expression();
        assertEquals(AssignOp.ADD, assign.op());
        assertEquals("c", ((Variable) assign.target()).name().name());
    }

    @Test
    void operatorsAndNestedStatementsAreDecoded() {
        SourceUnit unit = reader.read(FIXTURES.resolve("storage.ast.json"));
        ContractDefinition storage = (ContractDefinition) unit.parts().get(1);
        FunctionDefinition branches = (FunctionDefinition) storage.parts().get(4);
        If branch = (If) ((Block) branches.body()).statements().get(1);

        Binary condition = (Binary) branch.condition();
        assertEquals(BinaryOp.LT, condition.op());
        assertEquals("5", ((NumberLiteral) condition.right()).value());
        assertInstanceOf(Block.class, branch.thenBranch());
        assertInstanceOf(Block.class, branch.elseBranch());
        assertNull(branches.functionKind(), "kind is optional in the interchange form");
    }

    @Test
    void readsFromString() {
        SourceUnit unit = reader.read("""
            {"parts": [{"kind": "enum", "name": "Phase", "values": ["A", {"name": "B"}]}]}
            """, "inline");
        EnumDefinition e = (EnumDefinition) unit.parts().get(0);
        assertEquals("Phase", e.name().name());
        assertEquals("B", e.values().get(1).name());
    }

    @Test
    void missingKindIsRejected() {
        AstReader.AstReadException e = assertThrows(AstReader.AstReadException.class,
                () -> reader.read("{\"parts\": [{\"name\": \"C\"}]}", "inline"));
        assertTrue(e.getMessage().contains("kind"));
    }

    @Test
    void unknownKindIsRejected() {
        AstReader.AstReadException e = assertThrows(AstReader.AstReadException.class,
                () -> reader.read("{\"parts\": [{\"kind\": \"modifier-soup\"}]}", "inline"));
        assertTrue(e.getMessage().contains("modifier-soup"));
    }

    @Test
    void unknownBinaryOperatorIsRejected() {
        AstReader.AstReadException e = assertThrows(AstReader.AstReadException.class,
                () -> reader.read("""
                    {"parts": [{"kind": "variable", "name": "x", "ty": {"kind": "type", "name": "uint8"},
                      "initializer": {"kind": "binary", "op": "<>",
                        "left": {"kind": "number", "value": "1"}, "right": {"kind": "number", "value": "2"}}}]}
                    """, "inline"));
        assertTrue(e.getMessage().contains("<>"), e.getMessage());
    }

    @Test
    void unknownAssignmentOperatorIsRejected() {
        AstReader.AstReadException e = assertThrows(AstReader.AstReadException.class,
                () -> reader.read("""
                    {"parts": [{"kind": "function", "name": "f", "params": [],
                      "body": {"kind": "block", "statements": [{"kind": "expression",
                        "expression": {"kind": "assign", "op": ">>>=",
                          "target": {"kind": "variable", "name": "x"}, "value": {"kind": "number", "value": "1"}}}]}}]}
                    """, "inline"));
        assertTrue(e.getMessage().contains(">>>="), e.getMessage());
    }

    @Test
    void unknownUnaryOperatorIsRejected() {
        assertThrows(AstReader.AstReadException.class,
                () -> reader.read("""
                    {"parts": [{"kind": "variable", "name": "x", "ty": {"kind": "type", "name": "uint8"},
                      "initializer": {"kind": "unary", "op": "++", "operand": {"kind": "variable", "name": "y"}}}]}
                    """, "inline"));
    }

    @Test
    void contractCannotNestInsideContract() {
        assertThrows(AstReader.AstReadException.class,
                () -> reader.read("{\"parts\": [{\"kind\": \"contract\", \"name\": \"A\", "
                        + "\"parts\": [{\"kind\": \"contract\", \"name\": \"B\"}]}]}", "inline"));
    }

    @Test
    void missingFileThrowsAstReadException(@TempDir Path tmp) {
        AstReader.AstReadException e = assertThrows(AstReader.AstReadException.class,
                () -> reader.read(tmp.resolve("missing.json")));
        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    void emptyFileThrowsAstReadException(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("empty.json");
        Files.writeString(file, "");
        assertThrows(AstReader.AstReadException.class, () -> reader.read(file));
    }

    @Test
    void objectWithoutPartsIsRejected() {
        assertThrows(AstReader.AstReadException.class, () -> reader.read("{}", "inline"));
    }
}
