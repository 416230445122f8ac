package org.mediarr.service.indexer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchQueueTest {

    @Test
    void execute_returnsSearchResult() {
        SearchQueue queue = new SearchQueue(0);
        assertThat(queue.execute("movie 1", () -> 42)).isEqualTo(42);
    }

    @Test
    void execute_spacesSearchStarts() {
        SearchQueue queue = new SearchQueue(100);

        long first = queue.execute("first", System::currentTimeMillis);
        long second = queue.execute("second", System::currentTimeMillis);

        assertThat(second - first).isGreaterThanOrEqualTo(95);
    }

    @Test
    void execute_releasesQueueWhenSearchThrows() {
        SearchQueue queue = new SearchQueue(0);

        assertThatThrownBy(() -> queue.execute("broken", () -> {
            throw new IllegalArgumentException("boom");
        })).isInstanceOf(IllegalArgumentException.class);

        assertThat(queue.execute("next", () -> "ok")).isEqualTo("ok");
    }
}
