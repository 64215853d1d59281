package dev.lemma.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Encoder and recognizers for the equations macro family.
 *
 * <p>Shape of a group with functions {@code f_1 .. f_n}:</p>
 *
 * <pre>
 * equations[header](
 *     fun (f_1 : T_1) .. (f_n : T_n), fun (x_1 : A_1) .. (x_k : A_k), equation(f_i p_1 .. p_m, rhs),
 *     ...
 *     fun (f_1 : T_1) .. (f_n : T_n), no_equation,       -- function without equations
 *     [wf_tactics(t)])
 * </pre>
 *
 * Every clause repeats the function binders. Code outside {@code dev.lemma.eqns} should not
 * take these terms apart by hand.
 */
public final class Equations {
    private Equations() {}

    public static Expr mkEquations(EquationsHeader header, List<Expr> eqns) {
        return new Expr.Macro(new MacroDefinition.Equations(header), eqns);
    }

    public static Expr mkEquations(EquationsHeader header, List<Expr> eqns, Expr wfTactics) {
        Objects.requireNonNull(wfTactics, "wfTactics");
        List<Expr> args = new ArrayList<>(eqns.size() + 1);
        args.addAll(eqns);
        args.add(mkWfTactics(wfTactics));
        return new Expr.Macro(new MacroDefinition.Equations(header), args);
    }

    public static Expr mkEquation(Expr lhs, Expr rhs) {
        return mkEquation(lhs, rhs, false);
    }

    public static Expr mkEquation(Expr lhs, Expr rhs, boolean ignoreIfUnused) {
        return new Expr.Macro(new MacroDefinition.Equation(ignoreIfUnused), List.of(lhs, rhs));
    }

    public static Expr mkNoEquation() {
        return new Expr.Macro(new MacroDefinition.NoEquation(), List.of());
    }

    public static Expr mkWfTactics(Expr tactics) {
        return new Expr.Macro(new MacroDefinition.WfTactics(), List.of(tactics));
    }

    public static boolean isEquations(Expr e) {
        return e instanceof Expr.Macro m && m.definition() instanceof MacroDefinition.Equations;
    }

    public static boolean isEquation(Expr e) {
        return e instanceof Expr.Macro m
                && m.definition() instanceof MacroDefinition.Equation
                && m.args().size() == 2;
    }

    public static boolean isNoEquation(Expr e) {
        return e instanceof Expr.Macro m && m.definition() instanceof MacroDefinition.NoEquation;
    }

    public static boolean isWfTactics(Expr e) {
        return e instanceof Expr.Macro m
                && m.definition() instanceof MacroDefinition.WfTactics
                && m.args().size() == 1;
    }

    public static EquationsHeader header(Expr e) {
        return ((MacroDefinition.Equations) asEquations(e).definition()).header();
    }

    public static int numFns(Expr e) {
        return header(e).numFns();
    }

    public static boolean hasWfTactics(Expr e) {
        List<Expr> args = asEquations(e).args();
        return !args.isEmpty() && isWfTactics(args.get(args.size() - 1));
    }

    public static Optional<Expr> wfTactics(Expr e) {
        if (!hasWfTactics(e)) {
            return Optional.empty();
        }
        List<Expr> args = asEquations(e).args();
        return Optional.of(((Expr.Macro) args.get(args.size() - 1)).args().get(0));
    }

    /** The clause terms, without the trailing wf-tactics argument. */
    public static List<Expr> equations(Expr e) {
        List<Expr> args = asEquations(e).args();
        return hasWfTactics(e) ? args.subList(0, args.size() - 1) : args;
    }

    /** Same header and wf-tactics as {@code e}, new clauses. */
    public static Expr updateEquations(Expr e, List<Expr> newEqns) {
        Expr.Macro m = asEquations(e);
        List<Expr> args = new ArrayList<>(newEqns);
        if (hasWfTactics(e)) {
            args.add(m.args().get(m.args().size() - 1));
        }
        return new Expr.Macro(m.definition(), args);
    }

    public static Expr equationLhs(Expr e) {
        return asEquation(e).args().get(0);
    }

    public static Expr equationRhs(Expr e) {
        return asEquation(e).args().get(1);
    }

    public static boolean ignoreIfUnused(Expr e) {
        return ((MacroDefinition.Equation) asEquation(e).definition()).ignoreIfUnused();
    }

    private static Expr.Macro asEquations(Expr e) {
        if (!isEquations(e)) {
            throw new IllegalArgumentException("not an equations macro: " + e);
        }
        return (Expr.Macro) e;
    }

    private static Expr.Macro asEquation(Expr e) {
        if (!isEquation(e)) {
            throw new IllegalArgumentException("not an equation macro: " + e);
        }
        return (Expr.Macro) e;
    }
}
