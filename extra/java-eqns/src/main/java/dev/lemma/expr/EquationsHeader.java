package dev.lemma.expr;

import java.util.List;
import java.util.Objects;

public record EquationsHeader(
        int numFns,
        List<String> fnNames,
        List<String> fnActualNames,
        boolean isPrivate,
        boolean isLemma,
        boolean isMeta,
        boolean isNoncomputable,
        boolean auxLemmas) {
    public EquationsHeader {
        Objects.requireNonNull(fnNames, "fnNames");
        Objects.requireNonNull(fnActualNames, "fnActualNames");
        fnNames = List.copyOf(fnNames);
        fnActualNames = List.copyOf(fnActualNames);
        if (numFns < 0) {
            throw new IllegalArgumentException("numFns must be >= 0");
        }
        if (fnNames.size() != numFns || fnActualNames.size() != numFns) {
            throw new IllegalArgumentException(
                    "header names ("
                            + fnNames.size()
                            + ", "
                            + fnActualNames.size()
                            + ") do not match numFns "
                            + numFns);
        }
    }

    /** Header for a plain (public, computable, non-meta) definition whose actual names equal its names. */
    public static EquationsHeader of(List<String> fnNames) {
        return new EquationsHeader(fnNames.size(), fnNames, fnNames, false, false, false, false, false);
    }
}
