package dev.lemma.eqns;

import dev.lemma.expr.BinderInfo;
import dev.lemma.expr.Expr;
import dev.lemma.expr.Exprs;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Placeholders standing for binders while a term is opened up for editing.
 *
 * <p>Entries are pushed one at a time and closed back into nested binders as a contiguous top
 * segment: {@link #close} abstracts the most recent entry first. Closing anything else would
 * leave a placeholder free in the result.</p>
 */
public final class BinderStack {
    private final TypeContext ctx;
    private final List<Expr.Local> entries = new ArrayList<>();

    public BinderStack(TypeContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    TypeContext context() {
        return ctx;
    }

    public Expr.Local push(String name, Expr type) {
        return push(name, type, BinderInfo.DEFAULT);
    }

    public Expr.Local push(String name, Expr type, BinderInfo info) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(info, "info");
        if (Exprs.hasLooseBVars(type)) {
            throw new IllegalArgumentException("placeholder type has loose bound variables: " + type);
        }
        Expr.Local l = ctx.pushPlaceholder(name, type, info);
        entries.add(l);
        return l;
    }

    public int mark() {
        return entries.size();
    }

    public int size() {
        return entries.size();
    }

    public Expr.Local get(int i) {
        return entries.get(i);
    }

    public List<Expr.Local> since(int mark) {
        checkMark(mark);
        return List.copyOf(entries.subList(mark, entries.size()));
    }

    /**
     * Wraps {@code term} in one {@code fun} per entry pushed since {@code fromMark} (the oldest
     * outermost) and pops those entries.
     */
    public Expr close(Expr term, int fromMark) {
        Objects.requireNonNull(term, "term");
        checkMark(fromMark);
        Expr r = term;
        for (int i = entries.size() - 1; i >= fromMark; i--) {
            Expr.Local l = entries.remove(i);
            r = new Expr.Lambda(l.ppName(), l.type(), Exprs.abstractLocals(r, List.of(l)), l.info());
            ctx.retire(l);
        }
        return r;
    }

    /** {@code fun (locals...), term} without popping anything; every local must be on this stack. */
    public Expr abstractOver(Expr term, List<Expr.Local> locals) {
        for (Expr.Local l : locals) {
            if (!entries.contains(l)) {
                throw new IllegalArgumentException("`" + l.ppName() + "` is not a placeholder of this stack");
            }
        }
        return Exprs.mkLambda(locals, term);
    }

    /** Pops every entry without producing a term. */
    public void release() {
        for (int i = entries.size() - 1; i >= 0; i--) {
            ctx.retire(entries.remove(i));
        }
    }

    private void checkMark(int mark) {
        if (mark < 0 || mark > entries.size()) {
            throw new IndexOutOfBoundsException("mark " + mark + " out of range (size=" + entries.size() + ")");
        }
    }
}
