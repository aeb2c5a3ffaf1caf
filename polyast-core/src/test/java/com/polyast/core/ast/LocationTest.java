package com.polyast.core.ast;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Location}.
 */
class LocationTest {

    @Test
    void compareTo_sameFile_ordersByOffset() {
        Location earlier = new Location("a.js", 1, 5, 4);
        Location later = new Location("a.js", 1, 9, 8);

        assertThat(earlier).isLessThan(later);
        assertThat(later).isGreaterThan(earlier);
    }

    @Test
    void compareTo_differentFiles_ordersByFileFirst() {
        Location inA = new Location("a.js", 9, 1, 200);
        Location inB = new Location("b.js", 1, 1, 0);

        List<Location> locations = new ArrayList<>(List.of(inB, inA));
        locations.sort(null);

        assertThat(locations).containsExactly(inA, inB);
    }

    @Test
    void compareTo_unknownOffset_fallsBackToLineAndColumn() {
        Location known = new Location("a.js", 2, 1, 10);
        Location unknown = new Location("a.js", 1, 3, -1);

        assertThat(unknown).isLessThan(known);
        assertThat(new Location("a.js", 1, 3, -1)).isEqualByComparingTo(unknown);
    }

    @Test
    void constructor_rejectsZeroLine() {
        assertThatThrownBy(() -> new Location("a.js", 0, 1, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("line");
    }

    @Test
    void toString_isFileLineColumn() {
        assertThat(new Location("src/A.java", 3, 7, 40)).hasToString("src/A.java:3:7");
    }
}
