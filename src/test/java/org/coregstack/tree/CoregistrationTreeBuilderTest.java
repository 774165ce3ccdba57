package org.coregstack.tree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

import org.coregstack.stack.AcquisitionDate;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class CoregistrationTreeBuilderTest {

    private static final AcquisitionDate D = AcquisitionDate.of(2020, 6, 1);

    private final CoregistrationTreeBuilder builder = new CoregistrationTreeBuilder(TreeSettings.defaults());

    // ==================== findScenesInRange ====================

    @Test
    void findScenesInRange_keepsDatesWithinThresholdInclusive() {
        List<AcquisitionDate> dates = List.of(D.plusDays(-64), D.plusDays(-63), D.plusDays(-12), D,
                D.plusDays(12), D.plusDays(63), D.plusDays(64));

        SceneRange range = builder.findScenesInRange(D, dates);

        assertThat(range.earlier()).containsExactly(D.plusDays(-63), D.plusDays(-12));
        assertThat(range.later()).containsExactly(D.plusDays(12), D.plusDays(63));
    }

    @Test
    void findScenesInRange_fallsBackToClosestDateOnEmptySide() {
        List<AcquisitionDate> dates = List.of(D.plusDays(-100), D.plusDays(-1), D.plusDays(200), D.plusDays(300));

        SceneRange range = builder.findScenesInRange(D, dates);

        assertThat(range.earlier()).containsExactly(D.plusDays(-1));
        assertThat(range.later()).containsExactly(D.plusDays(200));
    }

    @Test
    void findScenesInRange_withoutFallbackLeavesSideEmpty() {
        CoregistrationTreeBuilder strict = new CoregistrationTreeBuilder(new TreeSettings(63, false, false));

        SceneRange range = strict.findScenesInRange(D, List.of(D.plusDays(-100), D.plusDays(200)));

        assertThat(range.isEmpty()).isTrue();
    }

    // ==================== build ====================

    @Test
    void build_closestFallbackExample() {
        AcquisitionDate minus100 = D.plusDays(-100);
        AcquisitionDate minus1 = D.plusDays(-1);
        AcquisitionDate plus200 = D.plusDays(200);

        CoregistrationForest forest = builder.build(D, List.of(minus100, minus1, plus200));

        assertThat(forest.tiers()).hasSize(2);
        assertThat(forest.tiers().get(0).dates()).containsExactly(minus1, plus200);
        assertThat(forest.tiers().get(1).dates()).containsExactly(minus100);
        assertThat(forest.parentOf(minus1)).contains(D);
        assertThat(forest.parentOf(plus200)).contains(D);
        assertThat(forest.parentOf(minus100)).contains(minus1);
        assertThat(forest.pathToReference(minus100)).containsExactly(minus100, minus1, D);
        assertThat(forest.unreachable()).isEmpty();
    }

    @Test
    void build_extendsOutwardsFromTierExtremes() {
        List<AcquisitionDate> dates = new ArrayList<>();
        for (int i = -10; i <= 10; i++) {
            dates.add(D.plusDays(i * 30L));
        }

        CoregistrationForest forest = builder.build(D, dates);

        // 60 days per tier on each side: 2 dates per side per tier
        assertThat(forest.tierCount()).isEqualTo(5);
        assertThat(forest.tiers().get(0).dates())
                .containsExactly(D.plusDays(-60), D.plusDays(-30), D.plusDays(30), D.plusDays(60));
        assertThat(forest.parentOf(D.plusDays(-90))).contains(D.plusDays(-60));
        assertThat(forest.parentOf(D.plusDays(120))).contains(D.plusDays(60));
        assertThat(forest.tierOf(D.plusDays(300))).isEqualTo(5);
    }

    @Test
    void build_collapsesDuplicatesAndSkipsReference() {
        CoregistrationForest forest = builder.build(D, List.of(D, D.plusDays(12), D.plusDays(12), D.plusDays(-12)));

        assertThat(forest.tiers()).hasSize(1);
        assertThat(forest.tiers().get(0).dates()).containsExactly(D.plusDays(-12), D.plusDays(12));
        assertThat(forest.tierOf(D)).isZero();
        assertThat(forest.parentOf(D)).isEmpty();
    }

    @Test
    void build_singleDateStackHasNoTiers() {
        CoregistrationForest forest = builder.build(D, List.of(D));

        assertThat(forest.tiers()).isEmpty();
        assertThat(forest.edges()).isEmpty();
        assertThat(forest.dates()).containsExactly(D);
    }

    @Test
    void build_recordsUnreachableDatesWhenFallbackDisabled() {
        CoregistrationTreeBuilder strict = new CoregistrationTreeBuilder(new TreeSettings(63, false, true));
        AcquisitionDate far = D.plusDays(200);

        CoregistrationForest forest = strict.build(D, List.of(D.plusDays(-12), D.plusDays(24), far));

        assertThat(forest.unreachable()).containsExactly(far);
        assertThat(forest.contains(far)).isFalse();
        assertThatThrownBy(() -> forest.tierOf(far)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void build_coversEveryDateExactlyOnceWithinTierBound() {
        Random random = new Random(42);
        for (int round = 0; round < 200; round++) {
            int threshold = 6 + random.nextInt(120);
            CoregistrationTreeBuilder randomBuilder = new CoregistrationTreeBuilder(new TreeSettings(threshold, true, true));
            Set<AcquisitionDate> dates = new TreeSet<>();
            int count = 1 + random.nextInt(60);
            for (int i = 0; i < count; i++) {
                dates.add(D.plusDays(random.nextInt(2000) - 1000));
            }
            AcquisitionDate reference = CoregistrationTreeBuilder.referenceFor(dates);

            CoregistrationForest forest = randomBuilder.build(reference, dates);

            Set<AcquisitionDate> placed = new HashSet<>();
            for (CoregistrationTier tier : forest.tiers()) {
                for (AcquisitionDate date : tier.dates()) {
                    assertThat(placed.add(date)).as("%s placed twice", date).isTrue();
                }
            }
            Set<AcquisitionDate> expected = new HashSet<>(dates);
            expected.remove(reference);
            assertThat(placed).isEqualTo(expected);
            assertThat(forest.unreachable()).isEmpty();

            List<CoregistrationEdge> edges = forest.edges();
            assertThat(edges).hasSize(expected.size());
            for (CoregistrationEdge edge : edges) {
                assertThat(forest.tierOf(edge.source())).isLessThan(edge.tier());
            }

            // tiers are disjoint and never empty
            assertThat(forest.tierCount()).isLessThanOrEqualTo(expected.size());
        }
    }

    @Test
    void build_regularStackStaysWithinSpanOverThresholdTiers() {
        for (int spacing : new int[] {6, 12, 24, 35, 63}) {
            List<AcquisitionDate> dates = new ArrayList<>();
            for (int i = 0; i < 90; i++) {
                dates.add(D.plusDays((long) i * spacing));
            }
            AcquisitionDate reference = CoregistrationTreeBuilder.referenceFor(dates);

            CoregistrationForest forest = builder.build(reference, dates);

            long span = dates.get(0).daysUntil(dates.get(dates.size() - 1));
            long bound = (span + 63 - 1) / 63 + 1;
            assertThat((long) forest.tierCount()).as("spacing %d", spacing).isLessThanOrEqualTo(bound);
            assertThat(forest.dates()).hasSize(dates.size());
        }
    }

    // ==================== referenceFor ====================

    @Test
    void referenceFor_picksMiddleOfDescendingOrder() {
        List<AcquisitionDate> dates = List.of(D, D.plusDays(12), D.plusDays(24), D.plusDays(36));

        // descending [36, 24, 12, 0], index 2
        assertThat(CoregistrationTreeBuilder.referenceFor(dates)).isEqualTo(D.plusDays(12));
        assertThat(CoregistrationTreeBuilder.referenceFor(List.of(D, D.plusDays(12), D.plusDays(24))))
                .isEqualTo(D.plusDays(12));
    }

    @Test
    void referenceFor_rejectsEmptyStack() {
        assertThatThrownBy(() -> CoregistrationTreeBuilder.referenceFor(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
