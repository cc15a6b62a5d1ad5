package com.example.effectivediff.application;

import com.example.effectivediff.domain.DiffLine;
import com.example.effectivediff.domain.Hunk;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.effectivediff.application.DiffFixtures.addedHunk;
import static com.example.effectivediff.application.DiffFixtures.numbered;
import static org.assertj.core.api.Assertions.assertThat;

class ResidualRegionTest {

    @Test
    void paddingIsClampedToFileBoundaries() {
        Hunk hunk =
                new Hunk(
                        2,
                        3,
                        2,
                        2,
                        List.of(
                                DiffLine.context("l2", 2, 2),
                                DiffLine.removed("l3", 3),
                                DiffLine.context("l4", 4, 3)));

        List<ResidualRegion> regions = ResidualRegion.plan(List.of(hunk), 10, 9, 3);

        assertThat(regions).containsExactly(new ResidualRegion(1, 7, 1, 6));
    }

    @Test
    void nearbyHunksShareOneRegion() {
        Hunk first = new Hunk(5, 1, 5, 1, List.of(DiffLine.removed("a", 5), DiffLine.added("b", 5)));
        Hunk second = new Hunk(11, 1, 11, 1, List.of(DiffLine.removed("c", 11), DiffLine.added("d", 11)));
        Hunk far = new Hunk(30, 1, 30, 1, List.of(DiffLine.removed("e", 30), DiffLine.added("f", 30)));

        List<ResidualRegion> regions = ResidualRegion.plan(List.of(first, second, far), 40, 40, 3);

        assertThat(regions)
                .containsExactly(new ResidualRegion(2, 13, 2, 13), new ResidualRegion(27, 7, 27, 7));
    }

    @Test
    void addedFileHasAnEmptyOldSide() {
        List<ResidualRegion> regions = ResidualRegion.plan(List.of(addedHunk(1, numbered("n", 4))), 0, 4, 3);

        ResidualRegion region = regions.get(0);
        assertThat(region).isEqualTo(new ResidualRegion(1, 0, 1, 4));
        assertThat(region.oldText(List.of())).isEmpty();
        assertThat(region.newText(numbered("n", 4))).isEqualTo("n line 1\nn line 2\nn line 3\nn line 4\n");
    }

    @Test
    void localHunksAreShiftedByTheRegionOffsets() {
        ResidualRegion region = new ResidualRegion(5, 10, 8, 10);
        Hunk local =
                new Hunk(
                        1,
                        2,
                        1,
                        1,
                        List.of(
                                DiffLine.context("same", 1, 1),
                                DiffLine.removed("gone", 2)));

        Hunk absolute = region.toAbsolute(local);

        assertThat(absolute)
                .isEqualTo(
                        new Hunk(
                                5,
                                2,
                                8,
                                1,
                                List.of(DiffLine.context("same", 5, 8), DiffLine.removed("gone", 6))));
    }
}
