package dev.lemma.eqns;

import dev.lemma.expr.Equations;
import dev.lemma.expr.Expr;
import dev.lemma.expr.Exprs;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One clause of an equations group, opened up for editing.
 *
 * <p>Takes a clause as found in {@link UnpackedEquations#eqnsOf}, i.e.
 * {@code fun (x_1 : A_1) .. (x_k : A_k), equation(lhs, rhs)} with the functions of the group
 * already replaced by their placeholders. The pattern variables become placeholders on a stack
 * owned by this object.</p>
 */
public final class UnpackedEquation implements AutoCloseable {
    private final Expr src;
    private final BinderStack locals;
    private final List<Expr.Local> vars = new ArrayList<>();
    private final Expr nestedSrc;
    private boolean modifiedVars;
    private boolean done;
    private Expr lhs;
    private Expr rhs;

    public UnpackedEquation(TypeContext ctx, Expr eqn) throws IllFormedEquationsException {
        this.src = Objects.requireNonNull(eqn, "eqn");
        this.locals = new BinderStack(ctx);
        Expr it = eqn;
        while (it instanceof Expr.Lambda lam) {
            Expr d = Exprs.instantiateRev(lam.domain(), vars);
            if (Exprs.hasLooseBVars(d)) {
                locals.release();
                throw new IllFormedEquationsException(
                        "type of pattern variable `" + lam.name() + "` refers to an enclosing binder");
            }
            vars.add(locals.push(lam.name(), d, lam.info()));
            it = lam.body();
        }
        it = Exprs.instantiateRev(it, vars);
        if (Exprs.hasLooseBVars(it)) {
            locals.release();
            throw new IllFormedEquationsException("equation refers to a binder outside the clause");
        }
        if (!Equations.isEquation(it)) {
            locals.release();
            throw new IllFormedEquationsException(
                    "expected `equation` after " + vars.size() + " pattern variable binder(s), got " + describe(it));
        }
        this.nestedSrc = it;
        this.lhs = Equations.equationLhs(it);
        this.rhs = Equations.equationRhs(it);
    }

    /** Adds a pattern variable after the existing ones; {@code type} may mention them. */
    public Expr.Local addVar(String name, Expr type) {
        checkLive();
        modifiedVars = true;
        Expr.Local v = locals.push(name, type);
        vars.add(v);
        return v;
    }

    public List<Expr.Local> vars() {
        return Collections.unmodifiableList(vars);
    }

    public Expr lhs() {
        return lhs;
    }

    public Expr rhs() {
        return rhs;
    }

    public void setLhs(Expr lhs) {
        checkLive();
        this.lhs = Objects.requireNonNull(lhs, "lhs");
    }

    public void setRhs(Expr rhs) {
        checkLive();
        this.rhs = Objects.requireNonNull(rhs, "rhs");
    }

    /** Returns the original term when nothing changed. Consumes this object. */
    public Expr repack() {
        checkLive();
        done = true;
        if (!modifiedVars
                && Equations.equationLhs(nestedSrc).equals(lhs)
                && Equations.equationRhs(nestedSrc).equals(rhs)) {
            locals.release();
            return src;
        }
        Expr eqn = Equations.mkEquation(lhs, rhs, Equations.ignoreIfUnused(nestedSrc));
        return locals.close(eqn, 0);
    }

    @Override
    public void close() {
        if (!done) {
            done = true;
            locals.release();
        }
    }

    private void checkLive() {
        if (done) {
            throw new IllegalStateException("equation was already repacked or closed");
        }
    }

    static String describe(Expr e) {
        if (e instanceof Expr.Macro m) {
            return m.definition().getClass().getSimpleName() + " macro with " + m.args().size() + " arg(s)";
        }
        return e.getClass().getSimpleName();
    }
}
