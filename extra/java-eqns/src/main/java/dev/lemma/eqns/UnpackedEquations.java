package dev.lemma.eqns;

import dev.lemma.expr.Equations;
import dev.lemma.expr.EquationsHeader;
import dev.lemma.expr.Expr;
import dev.lemma.expr.Exprs;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jboss.logging.Logger;

/**
 * An equations group opened up for editing.
 *
 * <p>The functions being defined become placeholders ({@link #fn}), so clauses that call them
 * refer to stable locals instead of binder indices. The clauses of function {@code i} are
 * {@link #eqnsOf}{@code (i)}; each is {@code fun (pattern vars), equation(lhs, rhs)} and can be
 * opened further with {@link UnpackedEquation}. The per-clause function binders of the encoding
 * are stripped on decode and restored by {@link #repack}.</p>
 *
 * <p>{@code numFns() == arity.size() == eqns.size()} always.</p>
 */
public final class UnpackedEquations implements AutoCloseable {
    private static final Logger log = Logger.getLogger(UnpackedEquations.class);

    private final Expr src;
    private final BinderStack locals;
    private final List<Expr> fnTypes = new ArrayList<>();
    private final List<Expr.Local> fns = new ArrayList<>();
    // superseded.get(i): placeholders of fn i replaced by updateFnType, oldest first.
    private final List<List<Expr.Local>> superseded = new ArrayList<>();
    private final BitSet confirmed = new BitSet();
    // The information stored here is ignored by repack.
    private final List<Integer> arity = new ArrayList<>();
    private final List<List<Expr>> eqns = new ArrayList<>();
    private boolean done;

    public UnpackedEquations(TypeContext ctx, Expr e) throws IllFormedEquationsException {
        Objects.requireNonNull(ctx, "ctx");
        Objects.requireNonNull(e, "e");
        if (!Equations.isEquations(e)) {
            throw new IllFormedEquationsException("expected an equations macro, got " + UnpackedEquation.describe(e));
        }
        this.src = e;
        this.locals = new BinderStack(ctx);
        try {
            decode(Equations.numFns(e), Equations.equations(e));
        } catch (IllFormedEquationsException ex) {
            locals.release();
            throw ex;
        }
        log.debugf(
                "unpacked equations %s: %d function(s), %d equation(s)",
                header().fnNames(),
                fns.size(),
                eqns.stream().mapToInt(List::size).sum());
    }

    private void decode(int numFns, List<Expr> clauses) throws IllFormedEquationsException {
        if (numFns == 0) {
            if (!clauses.isEmpty()) {
                throw new IllFormedEquationsException(
                        "group declares no functions but has " + clauses.size() + " equation(s)", 0);
            }
            return;
        }
        if (clauses.isEmpty()) {
            throw new IllFormedEquationsException("group of " + numFns + " function(s) has no equations");
        }

        // The function binders of the first clause name and type the functions.
        Expr it = clauses.get(0);
        for (int i = 0; i < numFns; i++) {
            if (!(it instanceof Expr.Lambda lam)) {
                throw new IllFormedEquationsException(
                        "expected " + numFns + " function binder(s), found " + i, 0);
            }
            if (Exprs.hasLooseBVars(lam.domain())) {
                throw new IllFormedEquationsException(
                        "type of function `" + lam.name() + "` depends on another function of the group", 0);
            }
            fnTypes.add(lam.domain());
            fns.add(locals.push(lam.name(), lam.domain(), lam.info()));
            superseded.add(new ArrayList<>());
            it = lam.body();
        }

        int eqIdx = 0;
        for (int fidx = 0; fidx < numFns; fidx++) {
            Expr.Local fn = fns.get(fidx);
            List<Expr> fnEqns = new ArrayList<>();
            int fnArity = 0;
            boolean sawNoEquation = false;
            while (eqIdx < clauses.size()) {
                Expr eqn = Exprs.instantiateRev(stripFnBinders(clauses.get(eqIdx), eqIdx), fns);
                if (Exprs.hasLooseBVars(eqn)) {
                    throw new IllFormedEquationsException("equation refers to a binder outside the group", eqIdx);
                }
                Expr body = eqn;
                while (body instanceof Expr.Lambda lam) {
                    body = lam.body();
                }
                if (Equations.isEquation(body)) {
                    Expr lhs = Equations.equationLhs(body);
                    if (!(Exprs.getAppFn(lhs) instanceof Expr.Local head)
                            || !head.uniqueName().equals(fn.uniqueName())) {
                        break;
                    }
                    int n = Exprs.getAppNumArgs(lhs);
                    if (fnEqns.isEmpty()) {
                        fnArity = n;
                    } else if (n != fnArity) {
                        throw new IllFormedEquationsException(
                                "equation for `"
                                        + fn.ppName()
                                        + "` has "
                                        + n
                                        + " argument(s), previous equations have "
                                        + fnArity,
                                eqIdx);
                    }
                    fnEqns.add(eqn);
                    eqIdx++;
                } else if (Equations.isNoEquation(body)) {
                    if (!fnEqns.isEmpty()) {
                        // Belongs to the next function.
                        break;
                    }
                    if (body != eqn) {
                        throw new IllFormedEquationsException("`no_equation` under pattern variable binders", eqIdx);
                    }
                    sawNoEquation = true;
                    eqIdx++;
                    break;
                } else {
                    throw new IllFormedEquationsException(
                            "expected `equation` or `no_equation`, got " + UnpackedEquation.describe(body), eqIdx);
                }
            }
            if (fnEqns.isEmpty() && !sawNoEquation) {
                throw new IllFormedEquationsException(
                        "function `" + fn.ppName() + "` has neither equations nor `no_equation`", eqIdx);
            }
            arity.add(fnArity);
            eqns.add(fnEqns);
        }
        if (eqIdx != clauses.size()) {
            throw new IllFormedEquationsException(
                    "equation does not belong to the function being defined at this position", eqIdx);
        }
    }

    private Expr stripFnBinders(Expr clause, int eqIdx) throws IllFormedEquationsException {
        Expr it = clause;
        for (int i = 0; i < fns.size(); i++) {
            if (!(it instanceof Expr.Lambda lam)) {
                throw new IllFormedEquationsException(
                        "expected " + fns.size() + " function binder(s), found " + i, eqIdx);
            }
            Expr.Local fn = fns.get(i);
            if (!lam.domain().equals(fnTypes.get(i)) || !lam.name().equals(fn.ppName()) || lam.info() != fn.info()) {
                throw new IllFormedEquationsException(
                        "binder of function `" + lam.name() + "` differs from the first equation", eqIdx);
            }
            it = lam.body();
        }
        return it;
    }

    public EquationsHeader header() {
        return Equations.header(src);
    }

    public int numFns() {
        return fns.size();
    }

    public Expr.Local fn(int fidx) {
        return fns.get(Objects.checkIndex(fidx, fns.size()));
    }

    public int arity(int fidx) {
        return arity.get(Objects.checkIndex(fidx, arity.size()));
    }

    /** The clauses of function {@code fidx}; passes edit this list in place. */
    public List<Expr> eqnsOf(int fidx) {
        checkLive();
        return eqns.get(Objects.checkIndex(fidx, eqns.size()));
    }

    public List<Expr> eqnsView(int fidx) {
        return Collections.unmodifiableList(eqns.get(Objects.checkIndex(fidx, eqns.size())));
    }

    /**
     * Gives function {@code fidx} a new placeholder of type {@code type}. The clauses are not
     * touched and still mention the old placeholder: rewrite them, or call
     * {@link #confirmFnType} to have {@link #repack} point the leftovers at the new one.
     */
    public Expr.Local updateFnType(int fidx, Expr type) {
        checkLive();
        Expr.Local old = fn(fidx);
        Expr.Local updated = locals.push(old.ppName(), type, old.info());
        superseded.get(fidx).add(old);
        fns.set(fidx, updated);
        confirmed.clear(fidx);
        return updated;
    }

    /** Declares the clauses of {@code fidx} consistent with its current type. */
    public void confirmFnType(int fidx) {
        checkLive();
        Objects.checkIndex(fidx, fns.size());
        confirmed.set(fidx);
    }

    /**
     * Re-encodes the group. Consumes this object.
     *
     * @throws IllegalStateException if a clause still mentions a superseded function placeholder
     *     whose update was not confirmed, or if the result leaks a placeholder
     */
    public Expr repack() {
        checkLive();
        Map<String, Expr> retarget = retargetSuperseded();
        done = true;

        List<Expr> newEqns = new ArrayList<>();
        for (List<Expr> fnEqns : eqns) {
            if (fnEqns.isEmpty()) {
                newEqns.add(locals.abstractOver(Equations.mkNoEquation(), fns));
            }
            for (Expr eqn : fnEqns) {
                newEqns.add(locals.abstractOver(Exprs.replaceLocals(eqn, retarget), fns));
            }
        }
        Expr result = Equations.updateEquations(src, newEqns);
        TypeContext ctx = locals.context();
        locals.release();
        try {
            EquationsVerifier.verify(ctx, result);
        } catch (IllFormedEquationsException e) {
            throw new IllegalStateException("repacked equations are ill-formed", e);
        }
        log.debugf("repacked equations %s: %d equation(s)", header().fnNames(), newEqns.size());
        return result;
    }

    private Map<String, Expr> retargetSuperseded() {
        Map<String, Expr> retarget = new HashMap<>();
        for (int fidx = 0; fidx < fns.size(); fidx++) {
            for (Expr.Local old : superseded.get(fidx)) {
                if (!isMentioned(old)) {
                    continue;
                }
                if (!confirmed.get(fidx)) {
                    throw new IllegalStateException(
                            "equations still refer to `"
                                    + old.ppName()
                                    + "` at its previous type; update them or call confirmFnType("
                                    + fidx
                                    + ")");
                }
                log.warnf("retargeting stale references to `%s` at its new type", old.ppName());
                retarget.put(old.uniqueName(), fns.get(fidx));
            }
        }
        return retarget;
    }

    private boolean isMentioned(Expr.Local l) {
        for (List<Expr> fnEqns : eqns) {
            for (Expr eqn : fnEqns) {
                if (Exprs.hasLocal(eqn, l.uniqueName())) {
                    return true;
                }
            }
        }
        return false;
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
            throw new IllegalStateException("equations were already repacked or closed");
        }
    }
}
