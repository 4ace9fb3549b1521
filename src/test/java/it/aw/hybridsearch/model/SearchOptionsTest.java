package it.aw.hybridsearch.model;

import it.aw.hybridsearch.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SearchOptionsTest {

    @Test
    void defaultsAreHybrid() {
        SearchOptions options = SearchOptions.defaults();

        assertThat(options.topK()).isEqualTo(10);
        assertThat(options.minScore()).isEqualTo(0.1);
        assertThat(options.hybridSearch()).isTrue();
        assertThat(options.vectorWeight()).isEqualTo(0.7);
        assertThat(options.keywordWeight()).isEqualTo(0.3);
        assertThat(options.keywordBoost()).isEqualTo(1.5);
        assertThat(options.enableBm25()).isTrue();
    }

    @Test
    void vectorOnlySearchUsesFullVectorWeightAndHigherThreshold() {
        SearchOptions options = SearchOptions.of(null, null, false, 0.5, 0.5, null, null, null);

        assertThat(options.vectorWeight()).isEqualTo(1.0);
        assertThat(options.keywordWeight()).isZero();
        assertThat(options.minScore()).isEqualTo(0.7);
    }

    @Test
    void singleWeightGetsItsComplement() {
        assertThat(SearchOptions.of(null, null, null, null, 0.45, null, null, null).vectorWeight())
                .isCloseTo(0.55, within(1e-9));
    }

    @Test
    void invalidOptionsAreRejected() {
        assertThatThrownBy(() -> SearchOptions.of(0, null, null, null, null, null, null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> SearchOptions.of(101, null, null, null, null, null, null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> SearchOptions.of(null, 1.5, null, null, null, null, null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> SearchOptions.of(null, null, null, 0.8, 0.3, null, null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> SearchOptions.of(null, null, null, null, null, null, 0.5, null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void filtersRequireATenantAndAValidDateRange() {
        assertThatThrownBy(() -> SearchFilters.forTenant(" ")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new DateRange(null, null)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new DateRange(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 1, 1)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void canonicalFormIgnoresListOrder() {
        SearchOptions a = SearchOptions.of(null, null, null, null, null, List.of("FAR", "cloud"), null, null);
        SearchOptions b = SearchOptions.of(null, null, null, null, null, List.of("cloud", "far "), null, null);

        assertThat(a.canonical()).isEqualTo(b.canonical());
    }
}
