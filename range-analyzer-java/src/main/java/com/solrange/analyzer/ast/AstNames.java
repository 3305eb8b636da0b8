package com.solrange.analyzer.ast;

import com.solrange.analyzer.ast.SolAst.*;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only queries over statements and expressions: rendering back to source-like text,
 * names read, names written, and whether a loop body jumps.
 */
public final class AstNames {

    private AstNames() {}

    /** Source-like rendering used for temporaries, derivations and constraint texts. */
    public static String render(Expression e) {
        if (e == null) return "";
        if (e instanceof NumberLiteral n) {
            return n.exponent() == null || n.exponent().isEmpty() ? n.value() : n.value() + "e" + n.exponent();
        }
        if (e instanceof BoolLiteral b)   return String.valueOf(b.value());
        if (e instanceof StringLiteral s) return "\"" + s.value() + "\"";
        if (e instanceof HexLiteral h)    return "hex\"" + h.hex() + "\"";
        if (e instanceof AddressLiteral a) return a.address();
        if (e instanceof Variable v)      return v.name().name();
        if (e instanceof MemberAccess m)  return render(m.base()) + "." + m.member().name();
        if (e instanceof Binary b) {
            return render(b.left()) + " " + b.op().symbol() + " " + render(b.right());
        }
        if (e instanceof Unary u) {
            return u.op().isPostfix()
                    ? render(u.operand()) + u.op().symbol()
                    : u.op().symbol() + render(u.operand());
        }
        if (e instanceof Assign a) {
            return render(a.target()) + " " + a.op().symbol() + " " + render(a.value());
        }
        if (e instanceof Ternary t) {
            return render(t.condition()) + " ? " + render(t.ifTrue()) + " : " + render(t.ifFalse());
        }
        if (e instanceof ArraySubscript s) {
            return render(s.base()) + "[" + render(s.index()) + "]";
        }
        if (e instanceof ElementaryType t) return t.name();
        if (e instanceof Mapping m) {
            return "mapping(" + render(m.key()) + " => " + render(m.value()) + ")";
        }
        if (e instanceof Call c) {
            return render(c.callee()) + "(" + SolAst.orEmpty(c.args()).stream()
                    .map(AstNames::render)
                    .collect(Collectors.joining(", ")) + ")";
        }
        if (e instanceof UnsupportedExpression u) return "<" + u.what() + ">";
        return "<?>";
    }

    /** Plain variable names read anywhere inside {@code e}. */
    public static Set<String> referencedNames(Expression e) {
        Set<String> out = new LinkedHashSet<>();
        collectReads(e, out);
        return out;
    }

    /** Plain variable names assigned, incremented or deleted anywhere inside {@code s}. */
    public static Set<String> assignedNames(Statement s) {
        Set<String> out = new LinkedHashSet<>();
        collectWrites(s, out);
        return out;
    }

    public static Set<String> assignedNames(Expression e) {
        Set<String> out = new LinkedHashSet<>();
        collectWrites(e, out);
        return out;
    }

    /** True if {@code s} contains a break or continue not nested in an inner loop. */
    public static boolean containsJump(Statement s) {
        if (s == null) return false;
        if (s instanceof Break || s instanceof Continue) return true;
        if (s instanceof Block b) {
            return SolAst.orEmpty(b.statements()).stream().anyMatch(AstNames::containsJump);
        }
        if (s instanceof If i) return containsJump(i.thenBranch()) || containsJump(i.elseBranch());
        return false;
    }

    private static void collectReads(Expression e, Set<String> out) {
        if (e == null) return;
        if (e instanceof Variable v) {
            out.add(v.name().name());
        } else if (e instanceof MemberAccess m) {
            collectReads(m.base(), out);
        } else if (e instanceof Binary b) {
            collectReads(b.left(), out);
            collectReads(b.right(), out);
        } else if (e instanceof Unary u) {
            collectReads(u.operand(), out);
        } else if (e instanceof Assign a) {
            collectReads(a.target(), out);
            collectReads(a.value(), out);
        } else if (e instanceof Ternary t) {
            collectReads(t.condition(), out);
            collectReads(t.ifTrue(), out);
            collectReads(t.ifFalse(), out);
        } else if (e instanceof ArraySubscript s) {
            collectReads(s.base(), out);
            collectReads(s.index(), out);
        } else if (e instanceof Call c) {
            collectReads(c.callee(), out);
            SolAst.orEmpty(c.args()).forEach(a -> collectReads(a, out));
        }
    }

    private static void collectWrites(Statement s, Set<String> out) {
        if (s == null) return;
        if (s instanceof Block b) {
            SolAst.orEmpty(b.statements()).forEach(st -> collectWrites(st, out));
        } else if (s instanceof ExpressionStatement es) {
            collectWrites(es.expression(), out);
        } else if (s instanceof If i) {
            collectWrites(i.condition(), out);
            collectWrites(i.thenBranch(), out);
            collectWrites(i.elseBranch(), out);
        } else if (s instanceof VariableDeclarationStatement d) {
            collectWrites(d.initializer(), out);
        } else if (s instanceof Return r) {
            collectWrites(r.value(), out);
        } else if (s instanceof While w) {
            collectWrites(w.condition(), out);
            collectWrites(w.body(), out);
        } else if (s instanceof For f) {
            collectWrites(f.init(), out);
            collectWrites(f.condition(), out);
            collectWrites(f.next(), out);
            collectWrites(f.body(), out);
        } else if (s instanceof DoWhile d) {
            collectWrites(d.body(), out);
            collectWrites(d.condition(), out);
        }
    }

    private static void collectWrites(Expression e, Set<String> out) {
        if (e == null) return;
        if (e instanceof Assign a) {
            if (a.target() instanceof Variable v) out.add(v.name().name());
            collectWrites(a.value(), out);
        } else if (e instanceof Unary u) {
            if ((u.op().isIncDec() || u.op() == UnaryOp.DELETE) && u.operand() instanceof Variable v) {
                out.add(v.name().name());
            }
            collectWrites(u.operand(), out);
        } else if (e instanceof Binary b) {
            collectWrites(b.left(), out);
            collectWrites(b.right(), out);
        } else if (e instanceof Ternary t) {
            collectWrites(t.condition(), out);
            collectWrites(t.ifTrue(), out);
            collectWrites(t.ifFalse(), out);
        } else if (e instanceof Call c) {
            SolAst.orEmpty(c.args()).forEach(a -> collectWrites(a, out));
        } else if (e instanceof ArraySubscript s) {
            collectWrites(s.index(), out);
        }
    }
}
