package dev.lemma.eqns;

import dev.lemma.env.Environment;
import dev.lemma.env.EquationsEnv;
import dev.lemma.expr.BinderInfo;
import dev.lemma.expr.Expr;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Elaboration state shared by the passes working on one definition: the environment, the
 * local declarations currently in scope and a fresh-name supply.
 *
 * <p>Not thread-safe. One pass at a time.</p>
 */
public final class TypeContext {
    private static final AtomicInteger CONTEXT_IDS = new AtomicInteger();

    private final Environment env;
    private final String freshPrefix = "_fresh." + CONTEXT_IDS.getAndIncrement() + ".";
    private final Map<String, Expr.Local> liveLocals = new LinkedHashMap<>();
    // Every unique name ever handed out by a BinderStack, including retired ones.
    private final Set<String> placeholders = new HashSet<>();
    private long nextId;

    public TypeContext(Environment env) {
        this.env = Objects.requireNonNull(env, "env");
    }

    public Environment env() {
        return env;
    }

    public EquationsEnv equationsEnv() {
        return EquationsEnv.of(env);
    }

    /** Declares a variable of the surrounding context (a section variable, an outer binder). */
    public Expr.Local declareLocal(String name, Expr type) {
        return declareLocal(name, type, BinderInfo.DEFAULT);
    }

    public Expr.Local declareLocal(String name, Expr type, BinderInfo info) {
        Expr.Local l = new Expr.Local(freshName(), name, type, info);
        liveLocals.put(l.uniqueName(), l);
        return l;
    }

    public Optional<Expr.Local> findLocal(String uniqueName) {
        return Optional.ofNullable(liveLocals.get(uniqueName));
    }

    public List<Expr.Local> liveLocals() {
        return List.copyOf(liveLocals.values());
    }

    public int numLiveLocals() {
        return liveLocals.size();
    }

    /** True iff {@code uniqueName} was issued by a {@link BinderStack}, live or not. */
    public boolean isPlaceholder(String uniqueName) {
        return placeholders.contains(uniqueName);
    }

    Expr.Local pushPlaceholder(String name, Expr type, BinderInfo info) {
        Expr.Local l = new Expr.Local(freshName(), name, type, info);
        liveLocals.put(l.uniqueName(), l);
        placeholders.add(l.uniqueName());
        return l;
    }

    void retire(Expr.Local l) {
        liveLocals.remove(l.uniqueName());
    }

    private String freshName() {
        return freshPrefix + nextId++;
    }
}
