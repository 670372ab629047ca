package io.github.manjago.mutagen.exec;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FrameTest {

    private static final List<String> SYMBOLS = List.of("A", "B");

    /** Column A rises 10, 11, 12, 13, 14; column B falls 20, 18, 16, 14, 12. */
    private static Frame prices() {
        return new Frame(SYMBOLS, new double[][]{
            {10, 20},
            {11, 18},
            {12, 16},
            {13, 14},
            {14, 12},
        });
    }

    @Test
    @DisplayName("Rows must match the symbol count")
    void rowWidthChecked() {
        assertThrows(IllegalArgumentException.class,
            () -> new Frame(SYMBOLS, new double[][]{{1, 2, 3}}));
    }

    // ========== Time series ==========

    @Nested
    @DisplayName("Time series")
    class TimeSeries {

        @Test
        @DisplayName("shift(1) moves values one row later and pads with NaN")
        void shiftForward() {
            Frame shifted = prices().shift(1);
            assertTrue(Double.isNaN(shifted.get(0, 0)));
            assertEquals(10, shifted.get(1, 0));
            assertEquals(13, shifted.get(4, 0));
        }

        @Test
        @DisplayName("pct_change compares with the earlier row")
        void pctChange() {
            Frame change = prices().pctChange(1);
            assertEquals(0.1, change.get(1, 0), 1e-12);
            assertEquals(-0.1, change.get(1, 1), 1e-12);
        }

        @Test
        @DisplayName("diff subtracts the earlier row")
        void diff() {
            assertEquals(-4, prices().diff(2).get(2, 1));
        }
    }

    // ========== Rolling ==========

    @Nested
    @DisplayName("Rolling windows")
    class RollingWindows {

        @Test
        @DisplayName("Mean is NaN until the window fills")
        void meanWarmup() {
            Frame mean = prices().rolling(3).mean();
            assertTrue(Double.isNaN(mean.get(1, 0)));
            assertEquals(11, mean.get(2, 0), 1e-12);
            assertEquals(13, mean.get(4, 0), 1e-12);
        }

        @Test
        @DisplayName("Sum, max and min")
        void aggregates() {
            Frame.Rolling rolling = prices().rolling(2);
            assertEquals(23, rolling.sum().get(2, 0), 1e-12);
            assertEquals(18, rolling.max().get(2, 1), 1e-12);
            assertEquals(16, rolling.min().get(2, 1), 1e-12);
        }

        @Test
        @DisplayName("Sample standard deviation")
        void std() {
            assertEquals(1.0, prices().rolling(3).std().get(2, 0), 1e-12);
        }

        @Test
        @DisplayName("A NaN inside the window yields NaN")
        void nanInWindow() {
            Frame mean = prices().shift(1).rolling(2).mean();
            assertTrue(Double.isNaN(mean.get(1, 0)));
            assertEquals(10.5, mean.get(2, 0), 1e-12);
        }

        @Test
        @DisplayName("Window must be positive")
        void nonPositiveWindow() {
            assertThrows(EvaluationException.class, () -> prices().rolling(0));
        }
    }

    // ========== Ranking ==========

    @Test
    @DisplayName("is_largest marks the top n per row and skips NaN")
    void isLargest() {
        Frame frame = new Frame(List.of("A", "B", "C"), new double[][]{
            {3, 1, 2},
            {Double.NaN, 5, 4},
        });
        Frame top = frame.isLargest(2);

        assertEquals(1.0, top.get(0, 0));
        assertEquals(0.0, top.get(0, 1));
        assertEquals(1.0, top.get(0, 2));
        assertEquals(0.0, top.get(1, 0));
        assertEquals(1.0, top.get(1, 1));
        assertEquals(1.0, top.get(1, 2));
    }

    @Test
    @DisplayName("is_smallest marks the bottom n")
    void isSmallest() {
        Frame bottom = prices().isSmallest(1);
        assertEquals(1.0, bottom.get(0, 0));
        assertEquals(0.0, bottom.get(0, 1));
    }

    // ========== Element-wise ==========

    @Test
    @DisplayName("combine rejects frames of different shape")
    void combineShapes() {
        Frame small = Frame.filled(SYMBOLS, 2, 1.0);
        assertThrows(EvaluationException.class, () -> prices().combine(small, Double::sum));
    }

    @Test
    @DisplayName("fillna and overallMean")
    void fillnaAndMean() {
        Frame shifted = prices().shift(1);
        assertEquals(0.0, shifted.fillna(0).get(0, 0));
        assertEquals((10 + 11 + 12 + 13 + 20 + 18 + 16 + 14) / 8.0, shifted.overallMean(), 1e-12);
        assertTrue(Double.isNaN(Frame.filled(SYMBOLS, 1, Double.NaN).overallMean()));
    }

    @Test
    @DisplayName("Unknown attribute fails with the name")
    void unknownAttribute() {
        EvaluationException e = assertThrows(EvaluationException.class, () -> prices().getAttribute("to_csv"));
        assertTrue(e.getMessage().contains("to_csv"));
    }
}
