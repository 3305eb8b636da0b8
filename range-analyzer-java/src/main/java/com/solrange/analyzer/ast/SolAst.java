package com.solrange.analyzer.ast;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * Records for the abstract syntax tree handed over by the external parser.
 * Shapes follow the conventional source unit / statement / expression split;
 * {@link AstReader} maps the JSON interchange form onto them using the "kind" field.
 * Optional children (else branch, initializer, loc, ...) are nullable.
 */
public final class SolAst {

    private SolAst() {}

    /** Lists omitted from the JSON form come back as null. */
    public static <T> List<T> orEmpty(List<T> list) {
        return list != null ? list : List.of();
    }

    /** Source position: file number plus byte offsets. */
    public record Loc(int file, int start, int end) {
        @Override
        public String toString() {
            return file + ":" + start + "-" + end;
        }
    }

    public record Identifier(String name, Loc loc) {}

    public record SourceUnit(List<SourceUnitPart> parts) {}

    /** Anything allowed at file level. */
    public interface SourceUnitPart {
        Loc loc();
    }

    /** Anything allowed inside a contract body. */
    public interface ContractPart {
        Loc loc();
    }

    public interface Statement {
        Loc loc();
    }

    public interface Expression {
        Loc loc();
    }

    // --- Declarations ---

    public record ContractDefinition(
            Loc loc,
            String contractKind,          // contract, interface, library, abstract
            Identifier name,
            List<String> bases,
            List<ContractPart> parts
    ) implements SourceUnitPart {}

    public record StructDefinition(Loc loc, Identifier name, List<VariableDeclaration> fields)
            implements SourceUnitPart, ContractPart {}

    public record EnumDefinition(Loc loc, Identifier name, List<Identifier> values)
            implements SourceUnitPart, ContractPart {}

    public record ErrorDefinition(Loc loc, Identifier name, List<Parameter> fields)
            implements SourceUnitPart, ContractPart {}

    public record FunctionDefinition(
            Loc loc,
            String functionKind,          // function, constructor, modifier, fallback, receive
            Identifier name,
            List<Parameter> params,
            List<Parameter> returns,
            List<String> attributes,
            Statement body
    ) implements SourceUnitPart, ContractPart {}

    public record Parameter(Loc loc, Expression ty, String storage, Identifier name) {}

    public record VariableDefinition(
            Loc loc,
            Expression ty,
            Identifier name,
            List<String> attributes,      // constant, immutable, public, ...
            Expression initializer
    ) implements SourceUnitPart, ContractPart {}

    public record TypeDefinition(Loc loc, Identifier name, Expression ty)
            implements SourceUnitPart, ContractPart {}

    /** Events, using-for, pragmas, imports, annotations and stray semicolons. */
    public record SkippedPart(Loc loc, String what) implements SourceUnitPart, ContractPart {}

    public record VariableDeclaration(Loc loc, Expression ty, String storage, Identifier name) {}

    // --- Statements ---

    public record Block(Loc loc, List<Statement> statements) implements Statement {}

    public record ExpressionStatement(Loc loc, Expression expression) implements Statement {}

    public record If(Loc loc, Expression condition, Statement thenBranch, Statement elseBranch)
            implements Statement {}

    public record VariableDeclarationStatement(Loc loc, VariableDeclaration declaration, Expression initializer)
            implements Statement {}

    public record Return(Loc loc, Expression value) implements Statement {}

    public record While(Loc loc, Expression condition, Statement body) implements Statement {}

    public record For(Loc loc, Statement init, Expression condition, Expression next, Statement body)
            implements Statement {}

    public record DoWhile(Loc loc, Statement body, Expression condition) implements Statement {}

    public record Break(Loc loc) implements Statement {}

    public record Continue(Loc loc) implements Statement {}

    public record Revert(Loc loc, String errorName, List<Expression> args) implements Statement {}

    public record UnsupportedStatement(Loc loc, String what) implements Statement {}

    // --- Expressions ---

    /** Decimal or 0x-prefixed number; the value is {@code value * 10^exponent}. */
    public record NumberLiteral(Loc loc, String value, String exponent) implements Expression {}

    public record BoolLiteral(Loc loc, boolean value) implements Expression {}

    public record StringLiteral(Loc loc, String value) implements Expression {}

    public record HexLiteral(Loc loc, String hex) implements Expression {}

    public record AddressLiteral(Loc loc, String address) implements Expression {}

    public record Variable(Loc loc, Identifier name) implements Expression {}

    public record MemberAccess(Loc loc, Expression base, Identifier member) implements Expression {}

    public record Binary(Loc loc, BinaryOp op, Expression left, Expression right) implements Expression {}

    public record Unary(Loc loc, UnaryOp op, Expression operand) implements Expression {}

    public record Assign(Loc loc, AssignOp op, Expression target, Expression value) implements Expression {}

    public record Ternary(Loc loc, Expression condition, Expression ifTrue, Expression ifFalse)
            implements Expression {}

    /** {@code base[index]}; in type position without an index it denotes a dynamic array type. */
    public record ArraySubscript(Loc loc, Expression base, Expression index) implements Expression {}

    /** Built-in type name such as uint8, int256, address, bool, bytes32, string. */
    public record ElementaryType(Loc loc, String name) implements Expression {}

    public record Mapping(Loc loc, Expression key, Expression value) implements Expression {}

    public record Call(Loc loc, Expression callee, List<Expression> args) implements Expression {}

    public record UnsupportedExpression(Loc loc, String what) implements Expression {}

    // --- Operators ---

    public enum BinaryOp {
        @SerializedName("+")  ADD("+"),
        @SerializedName("-")  SUB("-"),
        @SerializedName("*")  MUL("*"),
        @SerializedName("/")  DIV("/"),
        @SerializedName("%")  MOD("%"),
        @SerializedName("**") POW("**"),
        @SerializedName("<")  LT("<"),
        @SerializedName("<=") LE("<="),
        @SerializedName(">")  GT(">"),
        @SerializedName(">=") GE(">="),
        @SerializedName("==") EQ("=="),
        @SerializedName("!=") NE("!="),
        @SerializedName("&&") AND("&&"),
        @SerializedName("||") OR("||"),
        @SerializedName("&")  BIT_AND("&"),
        @SerializedName("|")  BIT_OR("|"),
        @SerializedName("^")  BIT_XOR("^"),
        @SerializedName("<<") SHL("<<"),
        @SerializedName(">>") SHR(">>");

        private final String symbol;

        BinaryOp(String symbol) { this.symbol = symbol; }

        public String symbol() { return symbol; }

        public boolean isComparison() {
            return this == LT || this == LE || this == GT || this == GE || this == EQ || this == NE;
        }

        public boolean isLogical() {
            return this == AND || this == OR;
        }
    }

    public enum UnaryOp {
        @SerializedName("-")      NEG("-"),
        @SerializedName("!")      NOT("!"),
        @SerializedName("~")      BIT_NOT("~"),
        @SerializedName("++pre")  PRE_INC("++"),
        @SerializedName("--pre")  PRE_DEC("--"),
        @SerializedName("++post") POST_INC("++"),
        @SerializedName("--post") POST_DEC("--"),
        @SerializedName("delete") DELETE("delete ");

        private final String symbol;

        UnaryOp(String symbol) { this.symbol = symbol; }

        public String symbol() { return symbol; }

        public boolean isIncDec() {
            return this == PRE_INC || this == PRE_DEC || this == POST_INC || this == POST_DEC;
        }

        public boolean isPostfix() {
            return this == POST_INC || this == POST_DEC;
        }
    }

    public enum AssignOp {
        @SerializedName("=")  ASSIGN("=", null),
        @SerializedName("+=") ADD("+=", BinaryOp.ADD),
        @SerializedName("-=") SUB("-=", BinaryOp.SUB),
        @SerializedName("*=") MUL("*=", BinaryOp.MUL),
        @SerializedName("/=") DIV("/=", BinaryOp.DIV),
        @SerializedName("%=") MOD("%=", BinaryOp.MOD),
        @SerializedName("&=") AND("&=", BinaryOp.BIT_AND),
        @SerializedName("|=") OR("|=", BinaryOp.BIT_OR),
        @SerializedName("^=") XOR("^=", BinaryOp.BIT_XOR),
        @SerializedName("<<=") SHL("<<=", BinaryOp.SHL),
        @SerializedName(">>=") SHR(">>=", BinaryOp.SHR);

        private final String symbol;
        private final BinaryOp binaryOp;

        AssignOp(String symbol, BinaryOp binaryOp) {
            this.symbol = symbol;
            this.binaryOp = binaryOp;
        }

        public String symbol() { return symbol; }

        /** Underlying arithmetic for compound assignment, null for plain {@code =}. */
        public BinaryOp binaryOp() { return binaryOp; }
    }
}
