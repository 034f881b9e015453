package com.wakelink.store;

import com.wakelink.model.ArtifactKey;
import com.wakelink.testing.InMemoryFragmentDao;
import com.wakelink.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkStoreTest {

  private static final String DEVICE = "98A316F82928";
  private static final String IMAGE = "98A316F82928_20261018_123000.jpg";
  private static final ArtifactKey KEY = new ArtifactKey(DEVICE, IMAGE);

  private InMemoryFragmentDao fragmentDao;
  private MutableClock clock;
  private ChunkStore store;

  @BeforeEach
  void setUp() {
    fragmentDao = new InMemoryFragmentDao();
    clock = new MutableClock(Instant.parse("2026-10-18T12:30:00Z"));
    store = new ChunkStore(fragmentDao, Duration.ofMinutes(30), clock);
  }

  @Test
  @DisplayName("Повторная доставка фрагмента даёт ровно одну запись")
  void duplicateFragmentIsStoredOnce() {
    assertThat(store.storeFragment(DEVICE, IMAGE, 2, new byte[] {1, 2})).isTrue();
    assertThat(store.storeFragment(DEVICE, IMAGE, 2, new byte[] {1, 2})).isFalse();
    assertThat(store.storeFragment(DEVICE, IMAGE, 2, new byte[] {1, 2})).isFalse();

    assertThat(fragmentDao.rowCount(KEY)).isEqualTo(1);
  }

  @Test
  @DisplayName("Первая запись выигрывает: дубликат с другими байтами не перезаписывает")
  void firstWriteWins() throws Exception {
    store.storeFragment(DEVICE, IMAGE, 0, new byte[] {7});
    store.storeFragment(DEVICE, IMAGE, 0, new byte[] {9});

    assertThat(store.assemble(KEY, 1)).containsExactly((byte) 7);
  }

  @Test
  @DisplayName("missingIndices возвращает дополнение до 0..total-1 по возрастанию")
  void missingIndicesAreSortedComplement() {
    store.storeFragment(DEVICE, IMAGE, 4, new byte[] {4});
    store.storeFragment(DEVICE, IMAGE, 0, new byte[] {0});
    store.storeFragment(DEVICE, IMAGE, 2, new byte[] {2});

    assertThat(store.missingIndices(KEY, 6)).containsExactly(1, 3, 5);
    assertThat(store.isComplete(KEY, 6)).isFalse();
    assertThat(store.receivedCount(KEY, 6)).isEqualTo(3);
  }

  @Test
  @DisplayName("Полнота: все индексы 0..total-1 на месте")
  void completeWhenAllIndicesPresent() {
    for (int i = 2; i >= 0; i--) {
      store.storeFragment(DEVICE, IMAGE, i, new byte[] {(byte) i});
    }
    assertThat(store.isComplete(KEY, 3)).isTrue();
    assertThat(store.missingIndices(KEY, 3)).isEmpty();
  }

  @Test
  @DisplayName("Сборка идёт в порядке индексов, а не в порядке прихода")
  void assemblesInIndexOrder() throws Exception {
    store.storeFragment(DEVICE, IMAGE, 2, new byte[] {5, 6});
    store.storeFragment(DEVICE, IMAGE, 0, new byte[] {1, 2});
    store.storeFragment(DEVICE, IMAGE, 1, new byte[] {3, 4});

    assertThat(store.assemble(KEY, 3)).containsExactly(1, 2, 3, 4, 5, 6);
  }

  @Test
  @DisplayName("Сборка с пропуском падает с AssemblyException")
  void assemblyFailsOnGap() {
    store.storeFragment(DEVICE, IMAGE, 0, new byte[] {1});
    store.storeFragment(DEVICE, IMAGE, 2, new byte[] {3});

    assertThatThrownBy(() -> store.assemble(KEY, 4))
        .isInstanceOf(AssemblyException.class)
        .satisfies(e -> assertThat(((AssemblyException) e).getMissing()).containsExactly(1, 3));
  }

  @Test
  @DisplayName("Ключи разных устройств с одинаковым именем снимка не смешиваются")
  void keysIncludeDevice() {
    store.storeFragment(DEVICE, "same.jpg", 0, new byte[] {1});
    store.storeFragment("AABBCCDDEEFF", "same.jpg", 1, new byte[] {2});

    assertThat(store.missingIndices(new ArtifactKey(DEVICE, "same.jpg"), 2)).containsExactly(1);
    assertThat(store.missingIndices(new ArtifactKey("AABBCCDDEEFF", "same.jpg"), 2)).containsExactly(0);
  }

  @Test
  @DisplayName("clear удаляет все фрагменты снимка")
  void clearRemovesFragments() {
    store.storeFragment(DEVICE, IMAGE, 0, new byte[] {1});
    store.clear(KEY);

    assertThat(fragmentDao.rowCount(KEY)).isZero();
    assertThat(store.isComplete(KEY, 1)).isFalse();
  }

  @Test
  @DisplayName("Новый фрагмент продлевает срок жизни всего снимка")
  void newFragmentExtendsExpiry() {
    store.storeFragment(DEVICE, IMAGE, 0, new byte[] {1});
    clock.advance(Duration.ofMinutes(20));
    store.storeFragment(DEVICE, IMAGE, 1, new byte[] {2});
    clock.advance(Duration.ofMinutes(20));

    assertThat(store.sweepExpired()).isEmpty();
    assertThat(fragmentDao.rowCount(KEY)).isEqualTo(2);

    clock.advance(Duration.ofMinutes(11));
    assertThat(store.sweepExpired()).containsExactly(KEY);
    assertThat(fragmentDao.rowCount(KEY)).isZero();
  }

  @Test
  @DisplayName("Отрицательный индекс отклоняется")
  void negativeIndexRejected() {
    assertThatThrownBy(() -> store.storeFragment(DEVICE, IMAGE, -1, new byte[] {1}))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
