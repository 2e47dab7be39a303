package de.mirkosertic.mcp.travelserver.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ConstraintExtractor")
class ConstraintExtractorTest {

    private final ConstraintExtractor extractor = new ConstraintExtractor();

    @Test
    @DisplayName("Combined query should fill budget, mood and duration")
    void combinedQuery() {
        // When
        final QueryConstraints constraints = extractor.extract("budget 5000, adventure, 4 days");

        // Then
        assertThat(constraints.budgetMax()).isEqualTo(5000);
        assertThat(constraints.budgetMin()).isNull();
        assertThat(constraints.budgetInferred()).isFalse();
        assertThat(constraints.moods()).containsExactly("adventure");
        assertThat(constraints.durationDays()).isEqualTo(4);
        assertThat(constraints.distanceKm()).isNull();
        assertThat(constraints.searchTerms()).containsExactly("adventure");
    }

    @Test
    @DisplayName("Null query should be rejected")
    void nullQueryRejected() {
        assertThatThrownBy(() -> extractor.extract(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Query must not be null");
    }

    @Test
    @DisplayName("Empty query should be fully unconstrained")
    void emptyQuery() {
        assertThat(extractor.extract("   ")).isEqualTo(QueryConstraints.unconstrained());
    }

    @Test
    @DisplayName("Extraction should be deterministic")
    void deterministic() {
        final String query = "Cheap beach trip in winter within 800 km for 3 days";

        assertThat(extractor.extract(query)).isEqualTo(extractor.extract(query));
    }

    @Test
    @DisplayName("Affordable ceiling below 1 should be rejected")
    void invalidCeiling() {
        assertThatThrownBy(() -> new ConstraintExtractor(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("Budget")
    class Budget {

        @Test
        @DisplayName("Budget keyword without a number should infer the affordable ceiling")
        void keywordInfersCeiling() {
            final QueryConstraints constraints = extractor.extract("something cheap please");

            assertThat(constraints.budgetMax()).isEqualTo(ConstraintExtractor.DEFAULT_AFFORDABLE_CEILING);
            assertThat(constraints.budgetInferred()).isTrue();
        }

        @Test
        @DisplayName("Configured affordable ceiling should be used")
        void configuredCeiling() {
            final QueryConstraints constraints = new ConstraintExtractor(2000).extract("budget friendly");

            assertThat(constraints.budgetMax()).isEqualTo(2000);
            assertThat(constraints.budgetInferred()).isTrue();
        }

        @Test
        @DisplayName("An explicit number should beat the keyword")
        void numberBeatsKeyword() {
            final QueryConstraints constraints = extractor.extract("cheap trip under 4000");

            assertThat(constraints.budgetMax()).isEqualTo(4000);
            assertThat(constraints.budgetInferred()).isFalse();
        }

        @ParameterizedTest(name = "\"{0}\" -> {1}..{2}")
        @CsvSource(delimiter = '|', value = {
                "between 2000 and 5000|2000|5000",
                "2000-5000 rupees|2000|5000",
                "5000 to 2000|2000|5000",
                "₹1500 to ₹3000|1500|3000"
        })
        @DisplayName("Ranges should set both ends in ascending order")
        void ranges(final String query, final int min, final int max) {
            final QueryConstraints constraints = extractor.extract(query);

            assertThat(constraints.budgetMin()).isEqualTo(min);
            assertThat(constraints.budgetMax()).isEqualTo(max);
            assertThat(constraints.hasBudgetRange()).isTrue();
        }

        @ParameterizedTest(name = "\"{0}\" -> {1}")
        @CsvSource(delimiter = '|', value = {
                "budget 5000|5000",
                "budget of 7000|7000",
                "rs. 4000|4000",
                "3000 rupees|3000",
                "₹4,500|4500",
                "upto 6000|6000",
                "maximum 9000|9000",
                "hills 3000|3000",
                "budget 5000 may|5000"
        })
        @DisplayName("Single amounts should set the ceiling")
        void ceilings(final String query, final int max) {
            final QueryConstraints constraints = extractor.extract(query);

            assertThat(constraints.budgetMax()).isEqualTo(max);
            assertThat(constraints.budgetMin()).isNull();
        }

        @Test
        @DisplayName("Distance and duration numbers should not be read as budget")
        void unitsAreNotBudget() {
            final QueryConstraints constraints = extractor.extract("within 1000 km for 5 days");

            assertThat(constraints.budgetMax()).isNull();
            assertThat(constraints.distanceKm()).isEqualTo(1000);
            assertThat(constraints.durationDays()).isEqualTo(5);
        }

        @ParameterizedTest(name = "\"{0}\"")
        @CsvSource(delimiter = '|', value = {
                "adventure trip for 3-5 days",
                "adventure trip for 3 to 5 days",
                "2 to 3 weeks in the hills",
                "beach between 10-12 december",
                "beach between 10 and 12 dec",
                "road trip 100-300 km",
                "back by 15 march"
        })
        @DisplayName("Numbers bound to a unit or a date should never become a budget")
        void unitBoundNumbersAreNotBudget(final String query) {
            final QueryConstraints constraints = extractor.extract(query);

            assertThat(constraints.budgetMin()).isNull();
            assertThat(constraints.budgetMax()).isNull();
        }

        @Test
        @DisplayName("A duration range should still allow an explicit budget")
        void durationRangeWithBudget() {
            final QueryConstraints constraints = extractor.extract("3-5 days under 4000");
            final QueryConstraints joined = extractor.extract("budget 2000 and 5 days");

            assertThat(constraints.budgetMax()).isEqualTo(4000);
            assertThat(constraints.durationDays()).isEqualTo(5);
            assertThat(joined.budgetMax()).isEqualTo(2000);
            assertThat(joined.durationDays()).isEqualTo(5);
        }

        @Test
        @DisplayName("Range with an out of range number should be skipped")
        void overflowingRangeIgnored() {
            // When
            final QueryConstraints between = extractor.extract("between 99999999999 and 5000");
            final QueryConstraints dashed = extractor.extract("trip 1000-99999999999");

            // Then
            assertThat(between.budgetMin()).isNull();
            assertThat(between.budgetMax()).isNull();
            assertThat(dashed.budgetMin()).isNull();
            assertThat(dashed.budgetMax()).isEqualTo(1000);
        }
    }

    @Nested
    @DisplayName("Moods, months and place")
    class MoodsMonthsPlace {

        @Test
        @DisplayName("Mood keywords should map to catalog moods")
        void moodKeywords() {
            final QueryConstraints constraints = extractor.extract("trekking and meditation");

            assertThat(constraints.moods()).containsExactlyInAnyOrder("adventure", "spiritual");
        }

        @Test
        @DisplayName("Winter should expand to its months in calendar order")
        void winterExpands() {
            assertThat(extractor.extract("winter holiday").bestMonths())
                    .containsExactly("january", "february", "december");
        }

        @Test
        @DisplayName("Month names and abbreviations should be recognized")
        void monthNames() {
            assertThat(extractor.extract("going in Dec or march").bestMonths())
                    .containsExactly("march", "december");
            assertThat(extractor.extract("sept break").bestMonths())
                    .containsExactly("september");
        }

        @Test
        @DisplayName("Words that merely contain a month abbreviation should not count")
        void embeddedAbbreviationIgnored() {
            assertThat(extractor.extract("decent food").bestMonths()).isEmpty();
        }

        @Test
        @DisplayName("Known place aliases should set the place name")
        void placeAlias() {
            assertThat(extractor.extract("trip to Ladakh").placeName()).isEqualTo("Leh Ladakh Mountain");
            assertThat(extractor.extract("holiday somewhere new").placeName()).isNull();
        }
    }

    @Nested
    @DisplayName("Duration and distance")
    class DurationDistance {

        @ParameterizedTest(name = "\"{0}\" -> {1} days")
        @CsvSource(delimiter = '|', value = {
                "for 5 days|5",
                "3d getaway|3",
                "2 nights|2",
                "1 day|1",
                "3-5 days|5",
                "3 to 5 days|5",
                "2 weeks|14",
                "2 to 3 weeks|21"
        })
        void durations(final String query, final int days) {
            assertThat(extractor.extract(query).durationDays()).isEqualTo(days);
        }

        @ParameterizedTest(name = "\"{0}\" -> {1} km")
        @CsvSource(delimiter = '|', value = {
                "within 300 km|300",
                "max 450kms|450",
                "about 700 kilometers|700"
        })
        void distances(final String query, final int km) {
            assertThat(extractor.extract(query).distanceKm()).isEqualTo(km);
        }
    }
}
