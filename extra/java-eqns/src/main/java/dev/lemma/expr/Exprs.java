package dev.lemma.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;

/**
 * Locally nameless helpers over {@link Expr}.
 *
 * <p>The {@code offset} threaded through the traversals is the number of binders
 * crossed so far; a {@link Expr.Var} is loose iff {@code index >= offset}.</p>
 */
public final class Exprs {
    private Exprs() {}

    /** One past the largest loose de Bruijn index in {@code e}, or 0 if {@code e} has none. */
    public static int looseBVarRange(Expr e) {
        return looseBVarRange(e, 0);
    }

    private static int looseBVarRange(Expr e, int offset) {
        if (e instanceof Expr.Var v) {
            return v.index() >= offset ? v.index() - offset + 1 : 0;
        } else if (e instanceof Expr.App app) {
            return Math.max(looseBVarRange(app.fn(), offset), looseBVarRange(app.arg(), offset));
        } else if (e instanceof Expr.Lambda lam) {
            return Math.max(looseBVarRange(lam.domain(), offset), looseBVarRange(lam.body(), offset + 1));
        } else if (e instanceof Expr.Pi pi) {
            return Math.max(looseBVarRange(pi.domain(), offset), looseBVarRange(pi.body(), offset + 1));
        } else if (e instanceof Expr.Macro m) {
            int r = 0;
            for (Expr arg : m.args()) {
                r = Math.max(r, looseBVarRange(arg, offset));
            }
            return r;
        }
        return 0;
    }

    public static boolean hasLooseBVars(Expr e) {
        return looseBVarRange(e) > 0;
    }

    /**
     * Rebuilds {@code e} bottom-up. {@code fn} receives each subterm and the binder depth;
     * a non-null result replaces the subterm, {@code null} means "descend".
     */
    public static Expr replace(Expr e, BiFunction<Expr, Integer, Expr> fn) {
        Objects.requireNonNull(e, "e");
        Objects.requireNonNull(fn, "fn");
        return replace(e, 0, fn);
    }

    private static Expr replace(Expr e, int offset, BiFunction<Expr, Integer, Expr> fn) {
        Expr r = fn.apply(e, offset);
        if (r != null) {
            return r;
        }
        if (e instanceof Expr.App app) {
            Expr f = replace(app.fn(), offset, fn);
            Expr a = replace(app.arg(), offset, fn);
            return f == app.fn() && a == app.arg() ? e : new Expr.App(f, a);
        } else if (e instanceof Expr.Lambda lam) {
            Expr d = replace(lam.domain(), offset, fn);
            Expr b = replace(lam.body(), offset + 1, fn);
            return d == lam.domain() && b == lam.body() ? e : new Expr.Lambda(lam.name(), d, b, lam.info());
        } else if (e instanceof Expr.Pi pi) {
            Expr d = replace(pi.domain(), offset, fn);
            Expr b = replace(pi.body(), offset + 1, fn);
            return d == pi.domain() && b == pi.body() ? e : new Expr.Pi(pi.name(), d, b, pi.info());
        } else if (e instanceof Expr.Macro m) {
            List<Expr> args = new ArrayList<>(m.args().size());
            boolean changed = false;
            for (Expr arg : m.args()) {
                Expr newArg = replace(arg, offset, fn);
                changed |= newArg != arg;
                args.add(newArg);
            }
            return changed ? new Expr.Macro(m.definition(), args) : e;
        }
        return e;
    }

    /** First subterm (pre-order) satisfying {@code pred}; the predicate also receives the binder depth. */
    public static Optional<Expr> find(Expr e, BiPredicate<Expr, Integer> pred) {
        Objects.requireNonNull(pred, "pred");
        return Optional.ofNullable(find(e, 0, pred));
    }

    private static Expr find(Expr e, int offset, BiPredicate<Expr, Integer> pred) {
        if (pred.test(e, offset)) {
            return e;
        }
        Expr r = null;
        if (e instanceof Expr.App app) {
            r = find(app.fn(), offset, pred);
            if (r == null) {
                r = find(app.arg(), offset, pred);
            }
        } else if (e instanceof Expr.Lambda lam) {
            r = find(lam.domain(), offset, pred);
            if (r == null) {
                r = find(lam.body(), offset + 1, pred);
            }
        } else if (e instanceof Expr.Pi pi) {
            r = find(pi.domain(), offset, pred);
            if (r == null) {
                r = find(pi.body(), offset + 1, pred);
            }
        } else if (e instanceof Expr.Macro m) {
            for (Expr arg : m.args()) {
                r = find(arg, offset, pred);
                if (r != null) {
                    break;
                }
            }
        }
        return r;
    }

    public static boolean hasLocal(Expr e, String uniqueName) {
        return find(e, (t, offset) -> t instanceof Expr.Local l && l.uniqueName().equals(uniqueName))
                .isPresent();
    }

    public static Expr liftLooseBVars(Expr e, int d) {
        if (d == 0 || !hasLooseBVars(e)) {
            return e;
        }
        return replace(
                e,
                (t, offset) -> {
                    if (t instanceof Expr.Var v) {
                        return v.index() >= offset ? new Expr.Var(v.index() + d) : t;
                    }
                    return null;
                });
    }

    /**
     * Replaces the loose variables {@code #0 .. #n-1} of {@code e} with
     * {@code subst[n-1] .. subst[0]} and lowers the remaining loose variables by {@code n}.
     */
    public static Expr instantiateRev(Expr e, List<? extends Expr> subst) {
        int n = subst.size();
        if (n == 0 || !hasLooseBVars(e)) {
            return e;
        }
        return replace(
                e,
                (t, offset) -> {
                    if (t instanceof Expr.Var v) {
                        int idx = v.index();
                        if (idx < offset) {
                            return t;
                        }
                        if (idx < offset + n) {
                            return liftLooseBVars(subst.get(n - 1 - (idx - offset)), offset);
                        }
                        return new Expr.Var(idx - n);
                    }
                    return null;
                });
    }

    /** Instantiates the outermost loose variable {@code #0} of a binding body with {@code value}. */
    public static Expr instantiate(Expr body, Expr value) {
        return instantiateRev(body, List.of(value));
    }

    /**
     * Inverse of {@link #instantiateRev}: {@code locals[j]} becomes {@code #(offset + n - 1 - j)}.
     * Loose variables already present are not shifted; callers only abstract closed terms or
     * immediately wrap the result in {@code n} binders.
     */
    public static Expr abstractLocals(Expr e, List<Expr.Local> locals) {
        int n = locals.size();
        if (n == 0) {
            return e;
        }
        return replace(
                e,
                (t, offset) -> {
                    if (t instanceof Expr.Local l) {
                        for (int j = n - 1; j >= 0; j--) {
                            if (locals.get(j).uniqueName().equals(l.uniqueName())) {
                                return new Expr.Var(offset + n - 1 - j);
                            }
                        }
                        return t;
                    }
                    return null;
                });
    }

    /** {@code fun (locals...), body}; later domains may mention earlier locals. */
    public static Expr mkLambda(List<Expr.Local> locals, Expr body) {
        return mkBinding(locals, body, false);
    }

    /** {@code Pi (locals...), body}. */
    public static Expr mkPi(List<Expr.Local> locals, Expr body) {
        return mkBinding(locals, body, true);
    }

    private static Expr mkBinding(List<Expr.Local> locals, Expr body, boolean pi) {
        Expr r = body;
        // Innermost binder first, so each step abstracts exactly one local at depth 0.
        for (int i = locals.size() - 1; i >= 0; i--) {
            Expr.Local l = locals.get(i);
            Expr abstracted = abstractLocals(r, List.of(l));
            r =
                    pi
                            ? new Expr.Pi(l.ppName(), l.type(), abstracted, l.info())
                            : new Expr.Lambda(l.ppName(), l.type(), abstracted, l.info());
        }
        return r;
    }

    public static Expr getAppFn(Expr e) {
        while (e instanceof Expr.App app) {
            e = app.fn();
        }
        return e;
    }

    public static List<Expr> getAppArgs(Expr e) {
        List<Expr> args = new ArrayList<>();
        while (e instanceof Expr.App app) {
            args.add(app.arg());
            e = app.fn();
        }
        Collections.reverse(args);
        return args;
    }

    public static int getAppNumArgs(Expr e) {
        int n = 0;
        while (e instanceof Expr.App app) {
            n++;
            e = app.fn();
        }
        return n;
    }

    public static Expr mkApp(Expr fn, List<? extends Expr> args) {
        Expr r = fn;
        for (Expr arg : args) {
            r = new Expr.App(r, arg);
        }
        return r;
    }

    public static Expr mkApp(Expr fn, Expr... args) {
        return mkApp(fn, List.of(args));
    }

    /** Substitutes locals by unique name; the replacements must not contain loose variables. */
    public static Expr replaceLocals(Expr e, Map<String, ? extends Expr> byUniqueName) {
        if (byUniqueName.isEmpty()) {
            return e;
        }
        return replace(
                e,
                (t, offset) -> {
                    if (t instanceof Expr.Local l) {
                        Expr r = byUniqueName.get(l.uniqueName());
                        return r != null ? r : t;
                    }
                    return null;
                });
    }
}
