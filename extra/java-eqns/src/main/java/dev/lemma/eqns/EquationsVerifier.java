package dev.lemma.eqns;

import dev.lemma.expr.Equations;
import dev.lemma.expr.Expr;
import dev.lemma.expr.Exprs;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Structural check of an encoded equations group, without decoding it.
 *
 * <p>Accepts exactly what {@link UnpackedEquations} can decode, and additionally rejects
 * placeholders whose {@link BinderStack} already closed or released them. Placeholders still
 * live in the context belong to an enclosing scope and are accepted like any other local.
 * Types are not checked.</p>
 */
public final class EquationsVerifier {
    private EquationsVerifier() {}

    public static void verify(TypeContext ctx, Expr e) throws IllFormedEquationsException {
        if (!Equations.isEquations(e)) {
            throw new IllFormedEquationsException("expected an equations macro, got " + UnpackedEquation.describe(e));
        }
        int numFns = Equations.numFns(e);
        List<Expr> clauses = Equations.equations(e);
        if (numFns == 0) {
            if (!clauses.isEmpty()) {
                throw new IllFormedEquationsException(
                        "group declares no functions but has " + clauses.size() + " equation(s)", 0);
            }
            return;
        }

        Expr.Lambda[] fnBinders = new Expr.Lambda[numFns];
        int[] arity = new int[numFns];
        Arrays.fill(arity, -1);
        // cur: function currently being filled. filled: it has equations or a no_equation.
        // closed: it was filled by no_equation, so no equation may follow for it.
        int cur = 0;
        boolean filled = false;
        boolean closed = false;
        for (int idx = 0; idx < clauses.size(); idx++) {
            Expr clause = clauses.get(idx);
            if (Exprs.hasLooseBVars(clause)) {
                throw new IllFormedEquationsException("equation has loose bound variables", idx);
            }
            Optional<Expr> leaked =
                    Exprs.find(clause, (t, offset) -> t instanceof Expr.Local l && isRetired(ctx, l));
            if (leaked.isPresent()) {
                throw new IllFormedEquationsException(
                        "dangling placeholder `" + ((Expr.Local) leaked.get()).ppName() + "`", idx);
            }

            Expr it = clause;
            for (int i = 0; i < numFns; i++) {
                if (!(it instanceof Expr.Lambda lam)) {
                    throw new IllFormedEquationsException(
                            "expected " + numFns + " function binder(s), found " + i, idx);
                }
                if (idx == 0) {
                    if (Exprs.hasLooseBVars(lam.domain())) {
                        throw new IllFormedEquationsException(
                                "type of function `" + lam.name() + "` depends on another function of the group", 0);
                    }
                    fnBinders[i] = lam;
                } else if (!sameBinder(lam, fnBinders[i])) {
                    throw new IllFormedEquationsException(
                            "binder of function `" + lam.name() + "` differs from the first equation", idx);
                }
                it = lam.body();
            }
            int numVars = 0;
            while (it instanceof Expr.Lambda lam) {
                numVars++;
                it = lam.body();
            }

            if (Equations.isNoEquation(it)) {
                if (numVars != 0) {
                    throw new IllFormedEquationsException("`no_equation` under pattern variable binders", idx);
                }
                if (filled) {
                    cur++;
                    if (cur >= numFns) {
                        throw new IllFormedEquationsException("more functions than declared in the header", idx);
                    }
                }
                filled = true;
                closed = true;
                continue;
            }
            if (!Equations.isEquation(it)) {
                throw new IllFormedEquationsException(
                        "expected `equation` or `no_equation`, got " + UnpackedEquation.describe(it), idx);
            }

            Expr lhs = Equations.equationLhs(it);
            int fidx = fnIndex(Exprs.getAppFn(lhs), numVars, numFns);
            if (fidx < 0) {
                throw new IllFormedEquationsException("lhs is not an application of a function of the group", idx);
            }
            if (fidx == cur && !closed) {
                filled = true;
            } else if (filled && fidx == cur + 1) {
                cur = fidx;
                closed = false;
            } else {
                throw new IllFormedEquationsException(
                        "equation for function #" + fidx + " out of order (expected #" + cur + ")", idx);
            }

            int n = Exprs.getAppNumArgs(lhs);
            if (arity[fidx] < 0) {
                arity[fidx] = n;
            } else if (arity[fidx] != n) {
                throw new IllFormedEquationsException(
                        "equation for function #" + fidx + " has " + n + " argument(s), expected " + arity[fidx],
                        idx);
            }
        }
        if (cur != numFns - 1 || !filled) {
            throw new IllFormedEquationsException(
                    "header declares " + numFns + " function(s), equations cover " + (filled ? cur + 1 : cur));
        }
    }

    private static boolean isRetired(TypeContext ctx, Expr.Local l) {
        return ctx.isPlaceholder(l.uniqueName()) && ctx.findLocal(l.uniqueName()).isEmpty();
    }

    private static boolean sameBinder(Expr.Lambda a, Expr.Lambda b) {
        return a.name().equals(b.name()) && a.domain().equals(b.domain()) && a.info() == b.info();
    }

    /** Index of the function bound by {@code head} under {@code numVars} pattern binders, or -1. */
    private static int fnIndex(Expr head, int numVars, int numFns) {
        if (!(head instanceof Expr.Var v)) {
            return -1;
        }
        int i = v.index() - numVars;
        if (i < 0 || i >= numFns) {
            return -1;
        }
        return numFns - 1 - i;
    }
}
