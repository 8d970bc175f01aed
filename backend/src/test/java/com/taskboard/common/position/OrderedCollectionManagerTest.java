package com.taskboard.common.position;

import com.taskboard.exception.InvalidRequestException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OrderedCollectionManager 단위 테스트")
class OrderedCollectionManagerTest {

    private static final Long CATEGORY_A = 10L;
    private static final Long CATEGORY_B = 20L;

    private SimpleMeterRegistry meterRegistry;
    private OrderedCollectionManager manager;
    private InMemoryScope scope;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        manager = new OrderedCollectionManager(meterRegistry);
        scope = new InMemoryScope();

        // A: 1, 2, 3 / B: 4, 5
        scope.put(1L, CATEGORY_A, 0);
        scope.put(2L, CATEGORY_A, 1);
        scope.put(3L, CATEGORY_A, 2);
        scope.put(4L, CATEGORY_B, 0);
        scope.put(5L, CATEGORY_B, 1);
    }

    @Test
    @DisplayName("스코프의 마지막 위치 다음 값을 반환한다")
    void appendPosition_ReturnsMaxPlusOne() {
        // when
        int position = manager.appendPosition(scope, CATEGORY_A);

        // then
        assertThat(position).isEqualTo(3);
        assertThat(scope.locked).containsExactly(CATEGORY_A);
    }

    @Test
    @DisplayName("빈 스코프에서는 0을 반환한다")
    void appendPosition_EmptyScope() {
        // when
        int position = manager.appendPosition(scope, 99L);

        // then
        assertThat(position).isZero();
    }

    @Test
    @DisplayName("스코프가 없으면 잠금 없이 0을 반환한다")
    void appendPosition_NullKey() {
        // when
        int position = manager.appendPosition(scope, null);

        // then
        assertThat(position).isZero();
        assertThat(scope.locked).isEmpty();
    }

    @Test
    @DisplayName("다른 카테고리로 이동하면 양쪽 스코프 모두 0..N-1을 유지한다")
    void move_AcrossCategories() {
        // when
        int position = manager.move(scope, 2L, CATEGORY_A, 1, CATEGORY_B, 1);

        // then
        assertThat(position).isEqualTo(1);
        assertThat(scope.orderOf(CATEGORY_A)).containsExactly(1L, 3L);
        assertThat(scope.orderOf(CATEGORY_B)).containsExactly(4L, 2L, 5L);
        assertDense(CATEGORY_A);
        assertDense(CATEGORY_B);
    }

    @Test
    @DisplayName("X=[A,B,C], Y=[D]에서 B를 Y의 0번으로 옮기면 X=[A,C], Y=[B,D]가 된다")
    void move_IntoFrontOfOtherCategory() {
        // given
        Long x = 30L;
        Long y = 40L;
        scope.put(101L, x, 0);
        scope.put(102L, x, 1);
        scope.put(103L, x, 2);
        scope.put(104L, y, 0);

        // when
        int position = manager.move(scope, 102L, x, 1, y, 0);

        // then
        assertThat(position).isZero();
        assertThat(scope.orderOf(x)).containsExactly(101L, 103L);
        assertThat(scope.orderOf(y)).containsExactly(102L, 104L);
        assertDense(x);
        assertDense(y);
    }

    @Test
    @DisplayName("추가, 이동, 삭제, 재정렬을 섞어도 매 단계마다 위치가 0..N-1로 유지된다")
    void mixedOperations_StayDense() {
        // append
        scope.put(6L, CATEGORY_A, manager.appendPosition(scope, CATEGORY_A));
        assertDense(CATEGORY_A);
        assertThat(scope.orderOf(CATEGORY_A)).containsExactly(1L, 2L, 3L, 6L);

        // move across, to the front
        manager.move(scope, 3L, CATEGORY_A, 2, CATEGORY_B, 0);
        assertDense(CATEGORY_A);
        assertDense(CATEGORY_B);

        // move within, past the end
        manager.move(scope, 1L, CATEGORY_A, 0, CATEGORY_A, 50);
        assertDense(CATEGORY_A);
        assertThat(scope.orderOf(CATEGORY_A)).containsExactly(2L, 6L, 1L);

        // remove from the middle
        manager.remove(scope, CATEGORY_B, 1, () -> scope.delete(4L));
        assertDense(CATEGORY_B);
        assertThat(scope.orderOf(CATEGORY_B)).containsExactly(3L, 5L);

        // move back, clamped to the end
        manager.move(scope, 5L, CATEGORY_B, 1, CATEGORY_A, 9);
        assertDense(CATEGORY_A);
        assertDense(CATEGORY_B);

        // reorder
        manager.reorder(scope, CATEGORY_A, List.of(5L, 1L, 6L, 2L));
        assertDense(CATEGORY_A);

        // append again
        scope.put(7L, CATEGORY_B, manager.appendPosition(scope, CATEGORY_B));
        assertDense(CATEGORY_B);

        assertThat(scope.orderOf(CATEGORY_A)).containsExactly(5L, 1L, 6L, 2L);
        assertThat(scope.orderOf(CATEGORY_B)).containsExactly(3L, 7L);
    }

    @Test
    @DisplayName("같은 스코프 안에서 뒤로 이동한다")
    void move_WithinScope_Forward() {
        // when
        int position = manager.move(scope, 1L, CATEGORY_A, 0, CATEGORY_A, 2);

        // then
        assertThat(position).isEqualTo(2);
        assertThat(scope.orderOf(CATEGORY_A)).containsExactly(2L, 3L, 1L);
        assertDense(CATEGORY_A);
    }

    @Test
    @DisplayName("같은 스코프 안에서 앞으로 이동한다")
    void move_WithinScope_Backward() {
        // when
        manager.move(scope, 3L, CATEGORY_A, 2, CATEGORY_A, 0);

        // then
        assertThat(scope.orderOf(CATEGORY_A)).containsExactly(3L, 1L, 2L);
        assertDense(CATEGORY_A);
    }

    @Test
    @DisplayName("범위를 넘는 인덱스는 스코프 끝으로 보정된다")
    void move_ClampsIndex() {
        // when
        int position = manager.move(scope, 1L, CATEGORY_A, 0, CATEGORY_B, 100);

        // then
        assertThat(position).isEqualTo(2);
        assertThat(scope.orderOf(CATEGORY_B)).containsExactly(4L, 5L, 1L);
        assertDense(CATEGORY_A);
        assertDense(CATEGORY_B);
    }

    @Test
    @DisplayName("같은 위치로의 이동은 아무것도 바꾸지 않는다")
    void move_SamePosition_NoOp() {
        // when
        int position = manager.move(scope, 2L, CATEGORY_A, 1, CATEGORY_A, 1);

        // then
        assertThat(position).isEqualTo(1);
        assertThat(scope.writes).isZero();
    }

    @Test
    @DisplayName("음수 인덱스는 거부된다")
    void move_NegativeIndex() {
        // when & then
        assertThatThrownBy(() -> manager.move(scope, 2L, CATEGORY_A, 1, CATEGORY_B, -1))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("Position must be a non-negative integer");
        assertThat(scope.locked).isEmpty();
    }

    @Test
    @DisplayName("두 스코프는 키 순서대로 잠근다")
    void move_LocksInKeyOrder() {
        // when
        manager.move(scope, 4L, CATEGORY_B, 0, CATEGORY_A, 0);

        // then
        assertThat(scope.locked).containsExactly(CATEGORY_A, CATEGORY_B);
    }

    @Test
    @DisplayName("이동 횟수를 스코프별로 집계한다")
    void move_CountsMoves() {
        // when
        manager.move(scope, 2L, CATEGORY_A, 1, CATEGORY_B, 0);

        // then
        assertThat(meterRegistry.counter("taskboard.positions.moves", "scope", "category").count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("삭제 후 남은 항목을 당겨 빈자리를 메운다")
    void remove_ClosesGap() {
        // when
        manager.remove(scope, CATEGORY_A, 0, () -> scope.delete(1L));

        // then
        assertThat(scope.orderOf(CATEGORY_A)).containsExactly(2L, 3L);
        assertDense(CATEGORY_A);
        assertThat(scope.locked).containsExactly(CATEGORY_A);
    }

    @Test
    @DisplayName("요청한 순서대로 0부터 위치를 다시 쓴다")
    void reorder_Success() {
        // when
        manager.reorder(scope, CATEGORY_A, List.of(3L, 1L, 2L));

        // then
        assertThat(scope.orderOf(CATEGORY_A)).containsExactly(3L, 1L, 2L);
        assertDense(CATEGORY_A);
    }

    @Test
    @DisplayName("중복 ID가 있으면 거부된다")
    void reorder_Duplicates() {
        // when & then
        assertThatThrownBy(() -> manager.reorder(scope, CATEGORY_A, List.of(1L, 1L, 2L)))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("duplicate");
    }

    @Test
    @DisplayName("스코프의 항목을 빠짐없이 포함하지 않으면 거부된다")
    void reorder_MissingItem() {
        // when & then
        assertThatThrownBy(() -> manager.reorder(scope, CATEGORY_A, List.of(1L, 2L)))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("exactly once");
        assertThat(scope.orderOf(CATEGORY_A)).containsExactly(1L, 2L, 3L);
    }

    @Test
    @DisplayName("스코프가 없으면 거부된다")
    void reorder_NullKey() {
        // when & then
        assertThatThrownBy(() -> manager.reorder(scope, null, List.of(1L)))
                .isInstanceOf(InvalidRequestException.class);
    }

    private void assertDense(Long key) {
        List<Integer> positions = scope.items.values().stream()
                .filter(item -> Objects.equals(item.key, key))
                .map(item -> item.position)
                .sorted()
                .collect(Collectors.toList());
        for (int i = 0; i < positions.size(); i++) {
            assertThat(positions.get(i)).isEqualTo(i);
        }
    }

    private static class Item {
        private Long key;
        private int position;

        Item(Long key, int position) {
            this.key = key;
            this.position = position;
        }
    }

    private static class InMemoryScope implements PositionScope<Long> {

        private final Map<Long, Item> items = new LinkedHashMap<>();
        private final List<Long> locked = new ArrayList<>();
        private int writes;

        void put(Long id, Long key, int position) {
            items.put(id, new Item(key, position));
        }

        void delete(Long id) {
            items.remove(id);
        }

        List<Long> orderOf(Long key) {
            return items.entrySet().stream()
                    .filter(e -> Objects.equals(e.getValue().key, key))
                    .sorted(Comparator.comparingInt(e -> e.getValue().position))
                    .map(Map.Entry::getKey)
                    .collect(Collectors.toList());
        }

        @Override
        public void lock(Long key) {
            locked.add(key);
        }

        @Override
        public int maxPosition(Long key) {
            return items.values().stream()
                    .filter(item -> Objects.equals(item.key, key))
                    .mapToInt(item -> item.position)
                    .max()
                    .orElse(-1);
        }

        @Override
        public long countExcluding(Long key, Long excludedId) {
            return items.entrySet().stream()
                    .filter(e -> Objects.equals(e.getValue().key, key) && !e.getKey().equals(excludedId))
                    .count();
        }

        @Override
        public void shiftUp(Long key, int fromInclusive, Long excludedId) {
            items.forEach((id, item) -> {
                if (Objects.equals(item.key, key) && !id.equals(excludedId) && item.position >= fromInclusive) {
                    item.position++;
                    writes++;
                }
            });
        }

        @Override
        public void shiftDown(Long key, int afterExclusive, Long excludedId) {
            items.forEach((id, item) -> {
                if (Objects.equals(item.key, key) && !id.equals(excludedId) && item.position > afterExclusive) {
                    item.position--;
                    writes++;
                }
            });
        }

        @Override
        public void place(Long id, Long key, int position) {
            Item item = items.get(id);
            item.key = key;
            item.position = position;
            writes++;
        }

        @Override
        public List<Long> idsInScope(Long key) {
            return orderOf(key);
        }

        @Override
        public String scopeName(Long key) {
            return "category";
        }
    }
}
