package org.neuralchilli.tickflow.catalog;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Ordered, immutable list of pattern mappings. Declaration order is
 * specificity order: the first matching entry wins.
 */
public final class PatternCatalog {

    private final List<PatternMapping> mappings;
    private final Map<Trigger, PatternMapping> byTrigger;

    public PatternCatalog(List<PatternMapping> mappings) {
        if (mappings == null || mappings.isEmpty()) {
            throw new IllegalArgumentException("Pattern catalog cannot be empty");
        }
        Map<Trigger, PatternMapping> index = new EnumMap<>(Trigger.class);
        Set<String> names = new HashSet<>();
        for (PatternMapping mapping : mappings) {
            if (!names.add(mapping.name())) {
                throw new IllegalArgumentException("Duplicate pattern name: " + mapping.name());
            }
            if (index.put(mapping.trigger(), mapping) != null) {
                throw new IllegalArgumentException(
                        "Trigger " + mapping.trigger() + " is mapped more than once"
                );
            }
        }
        this.mappings = List.copyOf(mappings);
        this.byTrigger = index;
    }

    public List<PatternMapping> mappings() {
        return mappings;
    }

    public Optional<PatternMapping> forTrigger(Trigger trigger) {
        return Optional.ofNullable(byTrigger.get(trigger));
    }

    public Optional<PatternMapping> byName(String name) {
        return mappings.stream().filter(m -> m.name().equals(name)).findFirst();
    }

    /**
     * Workflow control patterns covered by at least one entry
     */
    public Set<Integer> coveredPatterns() {
        Set<Integer> covered = new TreeSet<>();
        mappings.forEach(m -> covered.add(m.wcp()));
        return covered;
    }

    public int size() {
        return mappings.size();
    }
}
