package com.solrange.analyzer.ast;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.solrange.analyzer.ast.SolAst.*;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.lang.reflect.Type;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Reads a {@link SourceUnit} from the JSON interchange form produced by the external parser.
 *
 * Every statement, expression and part object carries a "kind" field naming its record;
 * identifiers may be written either as {"name": ..., "loc": ...} or as a bare string.
 */
public class AstReader {

    private static final Map<String, Class<? extends SourceUnitPart>> PART_KINDS = new HashMap<>();
    private static final Map<String, Class<? extends Statement>> STATEMENT_KINDS = new HashMap<>();
    private static final Map<String, Class<? extends Expression>> EXPRESSION_KINDS = new HashMap<>();

    static {
        PART_KINDS.put("contract", ContractDefinition.class);
        PART_KINDS.put("struct", StructDefinition.class);
        PART_KINDS.put("enum", EnumDefinition.class);
        PART_KINDS.put("error", ErrorDefinition.class);
        PART_KINDS.put("function", FunctionDefinition.class);
        PART_KINDS.put("variable", VariableDefinition.class);
        PART_KINDS.put("type", TypeDefinition.class);
        PART_KINDS.put("skipped", SkippedPart.class);

        STATEMENT_KINDS.put("block", Block.class);
        STATEMENT_KINDS.put("expression", ExpressionStatement.class);
        STATEMENT_KINDS.put("if", If.class);
        STATEMENT_KINDS.put("declaration", VariableDeclarationStatement.class);
        STATEMENT_KINDS.put("return", Return.class);
        STATEMENT_KINDS.put("while", While.class);
        STATEMENT_KINDS.put("for", For.class);
        STATEMENT_KINDS.put("do_while", DoWhile.class);
        STATEMENT_KINDS.put("break", Break.class);
        STATEMENT_KINDS.put("continue", Continue.class);
        STATEMENT_KINDS.put("revert", Revert.class);
        STATEMENT_KINDS.put("unsupported", UnsupportedStatement.class);

        EXPRESSION_KINDS.put("number", NumberLiteral.class);
        EXPRESSION_KINDS.put("bool", BoolLiteral.class);
        EXPRESSION_KINDS.put("string", StringLiteral.class);
        EXPRESSION_KINDS.put("hex", HexLiteral.class);
        EXPRESSION_KINDS.put("address", AddressLiteral.class);
        EXPRESSION_KINDS.put("variable", Variable.class);
        EXPRESSION_KINDS.put("member", MemberAccess.class);
        EXPRESSION_KINDS.put("binary", Binary.class);
        EXPRESSION_KINDS.put("unary", Unary.class);
        EXPRESSION_KINDS.put("assign", Assign.class);
        EXPRESSION_KINDS.put("ternary", Ternary.class);
        EXPRESSION_KINDS.put("subscript", ArraySubscript.class);
        EXPRESSION_KINDS.put("type", ElementaryType.class);
        EXPRESSION_KINDS.put("mapping", Mapping.class);
        EXPRESSION_KINDS.put("call", Call.class);
        EXPRESSION_KINDS.put("unsupported", UnsupportedExpression.class);
    }

    private static final Gson GSON = new GsonBuilder()
            .registerTypeAdapter(SourceUnitPart.class, new KindDeserializer<>("source unit part", PART_KINDS))
            .registerTypeAdapter(ContractPart.class, new ContractPartDeserializer())
            .registerTypeAdapter(Statement.class, new KindDeserializer<>("statement", STATEMENT_KINDS))
            .registerTypeAdapter(Expression.class, new KindDeserializer<>("expression", EXPRESSION_KINDS))
            .registerTypeAdapter(Identifier.class, new IdentifierDeserializer())
            .create();

    /**
     * Reads and deserializes an AST file.
     *
     * @throws AstReadException if the file is missing, empty or not a valid AST
     */
    public SourceUnit read(Path astPath) {
        if (!astPath.toFile().exists()) {
            throw new AstReadException("AST file not found: " + astPath);
        }
        try (FileReader reader = new FileReader(astPath.toFile())) {
            return parse(reader, astPath.toString());
        } catch (FileNotFoundException e) {
            throw new AstReadException("AST file not found: " + astPath, e);
        } catch (IOException e) {
            throw new AstReadException("Failed to read AST: " + astPath + ": " + e.getMessage(), e);
        }
    }

    /** Parses an AST held in memory; {@code origin} only labels error messages. */
    public SourceUnit read(String json, String origin) {
        return parse(new StringReader(json), origin);
    }

    private SourceUnit parse(Reader reader, String origin) {
        SourceUnit unit;
        try {
            unit = GSON.fromJson(reader, SourceUnit.class);
        } catch (JsonParseException e) {
            throw new AstReadException("Malformed AST in " + origin + ": " + e.getMessage(), e);
        }
        if (unit == null || unit.parts() == null) {
            throw new AstReadException("AST is empty or has no parts: " + origin);
        }
        return unit;
    }

    private static String kindOf(JsonElement json, String family) {
        if (!json.isJsonObject()) {
            throw new JsonParseException("Expected an object for " + family + " but got: " + json);
        }
        JsonObject obj = json.getAsJsonObject();
        JsonElement kind = obj.get("kind");
        if (kind == null || !kind.isJsonPrimitive()) {
            throw new JsonParseException("Missing \"kind\" on " + family + ": " + json);
        }
        return kind.getAsString();
    }

    private static final class KindDeserializer<T> implements JsonDeserializer<T> {
        private final String family;
        private final Map<String, Class<? extends T>> kinds;

        KindDeserializer(String family, Map<String, Class<? extends T>> kinds) {
            this.family = family;
            this.kinds = kinds;
        }

        @Override
        public T deserialize(JsonElement json, Type typeOfT, JsonDeserializationContext ctx) {
            if (json.isJsonNull()) return null;
            String kind = kindOf(json, family);
            Class<? extends T> cls = kinds.get(kind);
            if (cls == null) {
                throw new JsonParseException("Unknown " + family + " kind: " + kind);
            }
            T node = ctx.deserialize(json, cls);
            if (hasUnknownOperator(node)) {
                throw new JsonParseException("Unknown operator " + json.getAsJsonObject().get("op")
                        + " on " + kind + " " + family);
            }
            return node;
        }
    }

    /** Gson maps an operator symbol no enum constant declares to null. */
    private static boolean hasUnknownOperator(Object node) {
        if (node instanceof Binary b) return b.op() == null;
        if (node instanceof Unary u)  return u.op() == null;
        if (node instanceof Assign a) return a.op() == null;
        return false;
    }

    /** Contract parts share their records with source unit parts; contracts cannot nest. */
    private static final class ContractPartDeserializer implements JsonDeserializer<ContractPart> {
        @Override
        public ContractPart deserialize(JsonElement json, Type typeOfT, JsonDeserializationContext ctx) {
            if (json.isJsonNull()) return null;
            String kind = kindOf(json, "contract part");
            Class<? extends SourceUnitPart> cls = PART_KINDS.get(kind);
            if (cls == null || !ContractPart.class.isAssignableFrom(cls)) {
                throw new JsonParseException("Unknown contract part kind: " + kind);
            }
            return (ContractPart) ctx.deserialize(json, cls);
        }
    }

    private static final class IdentifierDeserializer implements JsonDeserializer<Identifier> {
        @Override
        public Identifier deserialize(JsonElement json, Type typeOfT, JsonDeserializationContext ctx) {
            if (json.isJsonNull()) return null;
            if (json.isJsonPrimitive()) {
                return new Identifier(json.getAsString(), null);
            }
            JsonObject obj = json.getAsJsonObject();
            JsonElement name = obj.get("name");
            if (name == null) {
                throw new JsonParseException("Identifier without a name: " + json);
            }
            Loc loc = obj.has("loc") ? ctx.deserialize(obj.get("loc"), Loc.class) : null;
            return new Identifier(name.getAsString(), loc);
        }
    }

    public static class AstReadException extends RuntimeException {
        public AstReadException(String message) { super(message); }
        public AstReadException(String message, Throwable cause) { super(message, cause); }
    }
}
