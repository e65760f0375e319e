package io.github.mmhelloworld.lazylist;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MemoizingCellTest {

    @ParameterizedTest
    @EnumSource(EvaluationMode.class)
    void producerIsNotRunUntilForced(EvaluationMode mode) {
        AtomicInteger invocations = new AtomicInteger();

        MemoizingCell<String> cell = MemoizingCell.of(() -> {
            invocations.incrementAndGet();
            return "value";
        }, mode);

        assertThat(invocations).hasValue(0);
        assertThat(cell.isEvaluated()).isFalse();
        assertThat(cell.toString()).contains("<pending>");
    }

    @ParameterizedTest
    @EnumSource(EvaluationMode.class)
    void forceRunsProducerAtMostOnce(EvaluationMode mode) {
        AtomicInteger invocations = new AtomicInteger();
        MemoizingCell<Object> cell = MemoizingCell.of(() -> {
            invocations.incrementAndGet();
            return new Object();
        }, mode);

        // when
        Object first = cell.force().orElseThrow();
        List<Object> later = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            later.add(cell.force().orElseThrow());
        }

        // then
        assertThat(invocations).hasValue(1);
        assertThat(later).allSatisfy(value -> assertThat(value).isSameAs(first));
        assertThat(cell.isEvaluated()).isTrue();
        assertThat(cell.getEvaluationMode()).isEqualTo(mode);
    }

    @ParameterizedTest
    @EnumSource(EvaluationMode.class)
    void reentrantForceIsNotYetAvailable(EvaluationMode mode) {
        AtomicReference<MemoizingCell<Integer>> self = new AtomicReference<>();
        AtomicReference<Optional<Integer>> observed = new AtomicReference<>();
        AtomicInteger invocations = new AtomicInteger();
        MemoizingCell<Integer> cell = MemoizingCell.of(() -> {
            invocations.incrementAndGet();
            observed.set(self.get().force());
            return 42;
        }, mode);
        self.set(cell);

        // when
        Optional<Integer> value = cell.force();

        // then
        assertThat(observed.get()).isEmpty();
        assertThat(value).contains(42);
        assertThat(invocations).hasValue(1);
    }

    @ParameterizedTest
    @EnumSource(EvaluationMode.class)
    void failedProducerPoisonsCell(EvaluationMode mode) {
        AtomicInteger invocations = new AtomicInteger();
        MemoizingCell<String> cell = MemoizingCell.of(() -> {
            invocations.incrementAndGet();
            throw new IllegalStateException("boom");
        }, mode);

        assertThatThrownBy(cell::force)
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("boom");

        assertThat(cell.isPoisoned()).isTrue();
        assertThat(cell.isEvaluated()).isFalse();
        assertThatThrownBy(cell::force)
            .isInstanceOf(PoisonedCellException.class)
            .isInstanceOf(LazyListException.class)
            .hasMessage("Memoizing cell has previously been poisoned");
        assertThatThrownBy(cell::force).isInstanceOf(PoisonedCellException.class);
        assertThat(invocations).hasValue(1);
        assertThat(cell.toString()).contains("<poisoned>");
    }

    @ParameterizedTest
    @EnumSource(EvaluationMode.class)
    void nullResultPoisonsCell(EvaluationMode mode) {
        MemoizingCell<String> cell = MemoizingCell.of(() -> null, mode);

        assertThatThrownBy(cell::force).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(cell::force).isInstanceOf(PoisonedCellException.class);
    }

    @ParameterizedTest
    @EnumSource(EvaluationMode.class)
    void evaluatedCellIsDoneFromTheStart(EvaluationMode mode) {
        MemoizingCell<String> cell = MemoizingCell.evaluated("done", mode);

        assertThat(cell.isEvaluated()).isTrue();
        assertThat(cell.force()).contains("done");
        assertThat(cell.toString()).contains("value=done");
    }

    @Test
    void defaultModeIsUsedWhenNoneGiven() {
        MemoizingCell<String> cell = MemoizingCell.of(() -> "x");

        assertThat(cell.getEvaluationMode()).isEqualTo(LazyListConfig.getDefaultEvaluationMode());
    }
}
