package org.pivotspec.distinct;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

@Tag("unit")
@DisplayName("PagedScanStrategy")
class PagedScanStrategyTest {

    private final IQueryBackend backend = mock(IQueryBackend.class);

    private static DistinctQuery query() {
        return DistinctQuery.builder().source("sales").field("region").where(Map.of("amount__gt", 1)).build();
    }

    private static PagedQueryResponse page(Long total, Object... values) {
        List<List<Object>> rows = Arrays.stream(values).map(v -> Arrays.asList(v)).toList();
        return new PagedQueryResponse(List.of("region"), rows, total);
    }

    @Test
    @DisplayName("Stops at the page ceiling")
    void pageCeiling() throws Exception {
        when(backend.query(any())).thenReturn(page(null, "a", "b"), page(null, "c", "d"), page(null, "e", "f"));

        List<String> values = new PagedScanStrategy(backend, 2, 2).resolve(query()).orElseThrow();

        assertThat(values).containsExactly("a", "b", "c", "d");
        verify(backend, times(2)).query(any());
    }

    @Test
    @DisplayName("Stops when the reported total is reached")
    void stopsAtTotal() throws Exception {
        when(backend.query(any())).thenReturn(page(4L, "a", "b"), page(4L, "b", "c"));

        List<String> values = new PagedScanStrategy(backend, 2, 10).resolve(query()).orElseThrow();

        assertThat(values).containsExactly("a", "b", "c");
        verify(backend, times(2)).query(any());
    }

    @Test
    @DisplayName("Sends a distinct fragment with advancing offsets")
    void requestShape() throws Exception {
        when(backend.query(any())).thenReturn(page(null, "a", "b"), page(null, "c"));

        new PagedScanStrategy(backend, 2, 10).resolve(query());

        ArgumentCaptor<PagedQueryRequest> requests = ArgumentCaptor.forClass(PagedQueryRequest.class);
        verify(backend, times(2)).query(requests.capture());
        PagedQueryRequest second = requests.getAllValues().get(1);
        assertThat(second.offset()).isEqualTo(2);
        assertThat(second.limit()).isEqualTo(2);
        assertThat(second.includeTotal()).isTrue();
        assertThat(second.spec().select()).containsExactly("region");
        assertThat(second.spec().agg()).isEqualTo(PagedScanStrategy.DISTINCT_AGG);
        assertThat(second.spec().where()).containsEntry("amount__gt", 1);
    }

    @Test
    @DisplayName("Null cells are skipped and nothing found is absent")
    void nullsAndEmpty() throws Exception {
        when(backend.query(any())).thenReturn(page(1L, (Object) null));

        assertThat(new PagedScanStrategy(backend, 2, 10).resolve(query())).isEmpty();
    }

    @Test
    @DisplayName("Custom columns are not scanned")
    void skipsFormulas() throws Exception {
        DistinctQuery custom = query().toBuilder().formula("[a] + 1").build();

        assertThat(new PagedScanStrategy(backend, 2, 10).resolve(custom)).isEmpty();
        verifyNoInteractions(backend);
    }
}
