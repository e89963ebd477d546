package com.example.menuimport.worker;

import com.example.menuimport.model.DestinationDescriptor;
import com.example.menuimport.model.ImportMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves a row's category label to a destination id for one run.
 *
 * <p>Bulk imports match the label case-insensitively against destination names. Prepackaged
 * imports first try a canonical label built from the weight category and the item's shake/flower
 * classification ({@code "3.5"} becomes {@code "3.5g Flower"}), then the raw label, then the raw
 * label with a {@code g} added or removed. When nothing matches and creation is allowed, a new
 * destination named after the raw label is registered for the rest of the run.
 *
 * <p>Every label that resolves once keeps resolving to the same id. In prepackaged mode the
 * classification is part of that key, since a shake row and a flower row of the same weight may
 * belong to different destinations.
 */
@Slf4j
class DestinationResolver {

    private static final String SHAKE_MARKER = "shake";
    private static final String GRAM_SUFFIX = "g";

    private final ImportMode mode;
    private final boolean allowCreate;
    private final IdentifierPool identifiers;
    private final Map<String, String> idsByName = new HashMap<>();
    private final Map<String, String> resolvedLabels = new HashMap<>();
    private final List<DestinationDescriptor> created = new ArrayList<>();

    DestinationResolver(ImportMode mode,
            List<DestinationDescriptor> existing,
            boolean allowCreate,
            IdentifierPool identifiers) {
        this.mode = mode;
        this.allowCreate = allowCreate;
        this.identifiers = identifiers;
        for (DestinationDescriptor destination : existing) {
            if (destination != null && destination.id() != null && destination.name() != null) {
                idsByName.put(lower(destination.name()), destination.id());
            }
        }
    }

    static boolean isShake(String itemName) {
        return lower(itemName).contains(SHAKE_MARKER);
    }

    Resolution resolve(String label, String itemName) {
        boolean shake = mode == ImportMode.PREPACKAGED && isShake(itemName);
        String memoKey = memoKey(label, shake);
        String known = resolvedLabels.get(memoKey);
        if (known != null) {
            return Resolution.resolved(known);
        }

        List<String> candidates = candidateLabels(label, shake);
        for (String candidate : candidates) {
            String id = idsByName.get(lower(candidate));
            if (id != null) {
                resolvedLabels.put(memoKey, id);
                return Resolution.resolved(id);
            }
        }

        if (!allowCreate) {
            return Resolution.unresolved(candidates);
        }

        DestinationDescriptor destination = new DestinationDescriptor(identifiers.get(), label);
        created.add(destination);
        idsByName.put(lower(label), destination.id());
        resolvedLabels.put(memoKey, destination.id());
        log.debug("Created destination id={} name={}", destination.id(), destination.name());
        return Resolution.resolved(destination.id());
    }

    List<DestinationDescriptor> createdDestinations() {
        return Collections.unmodifiableList(created);
    }

    private List<String> candidateLabels(String label, boolean shake) {
        if (mode != ImportMode.PREPACKAGED) {
            return List.of(label);
        }
        boolean hasGram = label.contains(GRAM_SUFFIX);
        String weight = hasGram ? label : label + GRAM_SUFFIX;
        List<String> candidates = new ArrayList<>(3);
        candidates.add(weight + (shake ? " Shake" : " Flower"));
        candidates.add(label);
        candidates.add(hasGram ? label.replaceFirst(GRAM_SUFFIX, "") : label + GRAM_SUFFIX);
        return candidates;
    }

    private String memoKey(String label, boolean shake) {
        if (mode != ImportMode.PREPACKAGED) {
            return lower(label);
        }
        return (shake ? "shake:" : "flower:") + lower(label);
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    record Resolution(String destinationId, List<String> attemptedLabels) {

        static Resolution resolved(String destinationId) {
            return new Resolution(destinationId, List.of());
        }

        static Resolution unresolved(List<String> attemptedLabels) {
            return new Resolution(null, List.copyOf(attemptedLabels));
        }

        boolean isResolved() {
            return destinationId != null;
        }
    }
}
