package com.flowsentinel.core.tail;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TailState}.
 */
class TailStateTest {

    private static final Path FILE = Path.of("eve.json");

    @Test
    @DisplayName("Should start a fresh state at offset zero with no observed size")
    void shouldStartFresh() {
        TailState state = TailState.fresh(FILE);

        assertThat(state.getOffset()).isZero();
        assertThat(state.getLastObservedSize()).isEqualTo(-1);
        assertThat(state.getPath()).isAbsolute();
    }

    @Test
    @DisplayName("Should reject a negative seeded offset")
    void shouldRejectNegativeOffset() {
        assertThatThrownBy(() -> TailState.startingAt(FILE, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should report truncation only when the size drops below the offset")
    void shouldDetectTruncation() {
        TailState state = TailState.startingAt(FILE, 100);

        assertThat(state.isTruncated(99)).isTrue();
        assertThat(state.isTruncated(100)).isFalse();
        assertThat(state.isTruncated(500)).isFalse();
    }

    @Test
    @DisplayName("Should report replacement only when both file keys are known and differ")
    void shouldDetectReplacement() {
        TailState state = TailState.fresh(FILE);

        assertThat(state.isReplaced("inode-1")).isFalse();
        state.observe(10, "inode-1");
        assertThat(state.isReplaced("inode-1")).isFalse();
        assertThat(state.isReplaced(null)).isFalse();
        assertThat(state.isReplaced("inode-2")).isTrue();
    }

    @Test
    @DisplayName("Should move back to zero on reset")
    void shouldResetOffset() {
        TailState state = TailState.startingAt(FILE, 42);
        state.advanceTo(84);

        state.reset();

        assertThat(state.getOffset()).isZero();
    }
}
