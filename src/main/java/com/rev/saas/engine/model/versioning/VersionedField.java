package com.rev.saas.engine.model.versioning;

import com.rev.saas.engine.model.DecisionContext;
import com.rev.saas.engine.model.Verdict;
import com.rev.saas.engine.model.documents.Decision;
import lombok.Getter;

import java.util.List;
import java.util.function.Function;
import java.util.function.ToIntFunction;

/**
 * Describes one versioned sub-document of a {@link Decision}: where its current value, counter and history live.
 *
 * @param <T> the versioned value type
 */
@Getter
public final class VersionedField<T> {

    public static final VersionedField<DecisionContext> CONTEXT = new VersionedField<>(
            "context", "context", "contextVersion", "contextVersions",
            Decision::getContext, Decision::getContextVersion, Decision::getContextVersions);

    public static final VersionedField<Verdict> VERDICT = new VersionedField<>(
            "verdict", "verdict", "verdictVersion", "verdictVersions",
            Decision::getVerdict, Decision::getVerdictVersion, Decision::getVerdictVersions);

    private final String name;
    private final String valuePath;
    private final String counterPath;
    private final String historyPath;

    @Getter(lombok.AccessLevel.NONE)
    private final Function<Decision, T> valueAccessor;
    @Getter(lombok.AccessLevel.NONE)
    private final ToIntFunction<Decision> counterAccessor;
    @Getter(lombok.AccessLevel.NONE)
    private final Function<Decision, List<VersionEntry<T>>> historyAccessor;

    private VersionedField(String name, String valuePath, String counterPath, String historyPath,
                           Function<Decision, T> valueAccessor,
                           ToIntFunction<Decision> counterAccessor,
                           Function<Decision, List<VersionEntry<T>>> historyAccessor) {
        this.name = name;
        this.valuePath = valuePath;
        this.counterPath = counterPath;
        this.historyPath = historyPath;
        this.valueAccessor = valueAccessor;
        this.counterAccessor = counterAccessor;
        this.historyAccessor = historyAccessor;
    }

    public T currentValue(Decision decision) {
        return valueAccessor.apply(decision);
    }

    public int currentVersion(Decision decision) {
        return counterAccessor.applyAsInt(decision);
    }

    public List<VersionEntry<T>> history(Decision decision) {
        List<VersionEntry<T>> h = historyAccessor.apply(decision);
        return h == null ? List.of() : h;
    }

    @Override
    public String toString() {
        return name;
    }
}
