package br.com.analytics.pipeline.profit_analytics_batch.processor;

import br.com.analytics.pipeline.profit_analytics_batch.model.VariantCostComponent;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the most recent applicable override for a variant: among active components whose window contains the
 * order time, the one with the latest effective start wins. Ties go to the component loaded last.
 */
public class VariantCostResolver {

    private static final Comparator<VariantCostComponent> BY_EFFECTIVE_FROM =
            Comparator.comparingLong(component -> component.window().fromOrMin());

    private final Map<String, List<VariantCostComponent>> componentsByVariant = new HashMap<>();

    public VariantCostResolver(Collection<VariantCostComponent> components) {
        for (VariantCostComponent component : components) {
            if (component.variantId() == null) {
                continue;
            }
            componentsByVariant.computeIfAbsent(component.variantId(), id -> new ArrayList<>()).add(component);
        }
    }

    public static VariantCostResolver empty() {
        return new VariantCostResolver(List.of());
    }

    public Optional<VariantCostComponent> resolve(String variantId, long timestamp) {
        if (variantId == null) {
            return Optional.empty();
        }
        VariantCostComponent selected = null;
        for (VariantCostComponent candidate : componentsByVariant.getOrDefault(variantId, List.of())) {
            if (!candidate.appliesAt(timestamp)) {
                continue;
            }
            if (selected == null || BY_EFFECTIVE_FROM.compare(candidate, selected) >= 0) {
                selected = candidate;
            }
        }
        return Optional.ofNullable(selected);
    }
}
