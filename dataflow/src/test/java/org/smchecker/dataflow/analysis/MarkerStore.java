package org.smchecker.dataflow.analysis;

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

/** A store that remembers the names of the functions called along the path. */
final class MarkerStore implements PathStore<MarkerStore> {

    final ImmutableList<String> markers;
    final Facts facts;

    MarkerStore(ImmutableList<String> markers, Facts facts) {
        this.markers = markers;
        this.facts = facts;
    }

    static MarkerStore empty() {
        return new MarkerStore(ImmutableList.<String>of(), Facts.empty());
    }

    MarkerStore called(String function) {
        return new MarkerStore(
                ImmutableList.<String>builder().addAll(markers).add(function).build(), facts);
    }

    @Override
    public Facts getFacts() {
        return facts;
    }

    @Override
    public MarkerStore withFacts(Facts newFacts) {
        return new MarkerStore(markers, newFacts);
    }

    @Override
    public ConditionKey conditionKey(String variable) {
        return ConditionKey.ofVariable(variable);
    }

    @Override
    public boolean isMergeableWith(MarkerStore other) {
        return markers.equals(other.markers) && facts.equals(other.facts);
    }

    @Override
    public MarkerStore merge(MarkerStore other) {
        return this;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!(obj instanceof MarkerStore)) {
            return false;
        }
        MarkerStore other = (MarkerStore) obj;
        return markers.equals(other.markers) && facts.equals(other.facts);
    }

    @Override
    public int hashCode() {
        return 31 * markers.hashCode() + facts.hashCode();
    }

    @Override
    public String toString() {
        return String.join(",", markers);
    }
}
