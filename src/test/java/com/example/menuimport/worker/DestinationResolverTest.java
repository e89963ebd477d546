package com.example.menuimport.worker;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.menuimport.model.DestinationDescriptor;
import com.example.menuimport.model.ImportMode;
import java.util.List;
import org.junit.jupiter.api.Test;

class DestinationResolverTest {

    private final IdentifierPool identifiers = new IdentifierPool(20);

    @Test
    void bulkModeMatchesNameCaseInsensitively() {
        DestinationResolver resolver = resolver(ImportMode.BULK, false,
                new DestinationDescriptor("top", "Top Shelf"));

        assertThat(resolver.resolve("TOP SHELF", "Blue Dream").destinationId()).isEqualTo("top");
        assertThat(resolver.resolve("top shelf", "Shake Mix").destinationId()).isEqualTo("top");
    }

    @Test
    void bulkModeDoesNotApplyWeightFallbacks() {
        DestinationResolver resolver = resolver(ImportMode.BULK, false,
                new DestinationDescriptor("d1", "3.5g Flower"));

        DestinationResolver.Resolution resolution = resolver.resolve("3.5", "Blue Dream");

        assertThat(resolution.isResolved()).isFalse();
        assertThat(resolution.attemptedLabels()).containsExactly("3.5");
    }

    @Test
    void prepackagedModePrefersCanonicalFlowerLabel() {
        DestinationResolver resolver = resolver(ImportMode.PREPACKAGED, false,
                new DestinationDescriptor("raw", "3.5"),
                new DestinationDescriptor("flower", "3.5g Flower"));

        assertThat(resolver.resolve("3.5", "Blue Dream").destinationId()).isEqualTo("flower");
    }

    @Test
    void prepackagedModeRoutesShakeToShakeDestination() {
        DestinationResolver resolver = resolver(ImportMode.PREPACKAGED, false,
                new DestinationDescriptor("flower", "7g Flower"),
                new DestinationDescriptor("shake", "7g shake"));

        assertThat(resolver.resolve("7g", "House SHAKE blend").destinationId()).isEqualTo("shake");
        assertThat(resolver.resolve("7g", "Gelato").destinationId()).isEqualTo("flower");
    }

    @Test
    void prepackagedModeFallsBackToRawAndGramVariants() {
        DestinationResolver addGram = resolver(ImportMode.PREPACKAGED, false,
                new DestinationDescriptor("d28", "28g"));
        assertThat(addGram.resolve("28", "Blue Dream").destinationId()).isEqualTo("d28");

        DestinationResolver dropGram = resolver(ImportMode.PREPACKAGED, false,
                new DestinationDescriptor("d14", "14"));
        assertThat(dropGram.resolve("14g", "Blue Dream").destinationId()).isEqualTo("d14");

        DestinationResolver raw = resolver(ImportMode.PREPACKAGED, false,
                new DestinationDescriptor("pre", "Pre-Rolls"));
        assertThat(raw.resolve("pre-rolls", "Blue Dream").destinationId()).isEqualTo("pre");
    }

    @Test
    void unresolvedLabelReportsEveryAttempt() {
        DestinationResolver resolver = resolver(ImportMode.PREPACKAGED, false);

        DestinationResolver.Resolution resolution = resolver.resolve("3.5", "Blue Dream");

        assertThat(resolution.isResolved()).isFalse();
        assertThat(resolution.attemptedLabels()).containsExactly("3.5g Flower", "3.5", "3.5g");
        assertThat(resolver.createdDestinations()).isEmpty();
    }

    @Test
    void createsOneDestinationPerRawLabel() {
        DestinationResolver resolver = resolver(ImportMode.BULK, true);

        String first = resolver.resolve("Value Flower", "Blue Dream").destinationId();
        String second = resolver.resolve("value flower", "Gelato").destinationId();
        String other = resolver.resolve("Premium", "Runtz").destinationId();

        assertThat(first).isNotNull().isEqualTo(second);
        assertThat(other).isNotEqualTo(first);
        assertThat(resolver.createdDestinations())
                .extracting(DestinationDescriptor::name)
                .containsExactly("Value Flower", "Premium");
        assertThat(resolver.createdDestinations().get(0).id()).isEqualTo(first);
    }

    @Test
    void createdPrepackagedDestinationIsReusedByLaterRows() {
        DestinationResolver resolver = resolver(ImportMode.PREPACKAGED, true);

        String shake = resolver.resolve("3.5", "Shake Blend").destinationId();
        String flower = resolver.resolve("3.5", "Blue Dream").destinationId();
        String shakeAgain = resolver.resolve("3.5", "Trim Shake").destinationId();

        assertThat(flower).isEqualTo(shake);
        assertThat(shakeAgain).isEqualTo(shake);
        assertThat(resolver.createdDestinations()).hasSize(1);
    }

    @Test
    void identifiesShakeBySubstring() {
        assertThat(DestinationResolver.isShake("Premium Shake")).isTrue();
        assertThat(DestinationResolver.isShake("SHAKEN not stirred")).isTrue();
        assertThat(DestinationResolver.isShake("Blue Dream")).isFalse();
        assertThat(DestinationResolver.isShake(null)).isFalse();
    }

    private DestinationResolver resolver(ImportMode mode, boolean allowCreate, DestinationDescriptor... existing) {
        return new DestinationResolver(mode, List.of(existing), allowCreate, identifiers);
    }
}
