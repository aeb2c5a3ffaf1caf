package com.polyast.core.lang;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link LineIndex}.
 */
class LineIndexTest {

    @Test
    void lineAndColumn_areOneBased() {
        LineIndex index = new LineIndex("ab\ncd");

        assertThat(index.lineCount()).isEqualTo(2);
        assertThat(index.lineOf(0)).isEqualTo(1);
        assertThat(index.columnOf(0)).isEqualTo(1);
        assertThat(index.lineOf(3)).isEqualTo(2);
        assertThat(index.lineOf(4)).isEqualTo(2);
        assertThat(index.columnOf(4)).isEqualTo(2);
    }

    @Test
    void offsetOf_invertsLineAndColumn() {
        LineIndex index = new LineIndex("first\nsecond\nthird");

        int offset = index.offsetOf(2, 3);

        assertThat(offset).isEqualTo(8);
        assertThat(index.lineOf(offset)).isEqualTo(2);
        assertThat(index.columnOf(offset)).isEqualTo(3);
    }

    @Test
    void offsetOf_outsideFile_returnsMinusOne() {
        LineIndex index = new LineIndex("one line");

        assertThat(index.offsetOf(0, 1)).isEqualTo(-1);
        assertThat(index.offsetOf(2, 1)).isEqualTo(-1);
    }

    @Test
    void lineBreaks_crlfAndLoneCr_countAsOneBreak() {
        LineIndex crlf = new LineIndex("a\r\nb");
        LineIndex cr = new LineIndex("a\rb");

        assertThat(crlf.lineCount()).isEqualTo(2);
        assertThat(crlf.lineOf(3)).isEqualTo(2);
        assertThat(cr.lineCount()).isEqualTo(2);
        assertThat(cr.lineOf(2)).isEqualTo(2);
    }

    @Test
    void offsetsPastEnd_areClamped() {
        LineIndex index = new LineIndex("ab");

        assertThat(index.lineOf(100)).isEqualTo(1);
        assertThat(index.columnOf(100)).isEqualTo(3);
    }
}
