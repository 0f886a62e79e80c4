package com.company.slr.source.lightstep;

import com.company.slr.time.DatetimeRange;
import com.company.slr.time.RelativeMinutesRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.company.slr.Fixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;

class TimeRangePaginatorTest {

    @Test
    @DisplayName("Pages advance by page size times resolution")
    void pages() {
        RelativeMinutesRange lastHour = new RelativeMinutesRange(60, 0);

        TimeRangePaginator.Page first = TimeRangePaginator.paginate(lastHour, 600, 1, 3, NOW);
        assertThat(first.getWindow()).isEqualTo(new DatetimeRange(
                Instant.parse("2024-01-10T11:00:00Z"), Instant.parse("2024-01-10T11:30:00Z")));
        assertThat(first.getPagination().getNextNum()).isEqualTo(2);
        assertThat(first.getPagination().getTotal()).isEqualTo(6);

        TimeRangePaginator.Page second = TimeRangePaginator.paginate(lastHour, 600, 2, 3, NOW);
        assertThat(second.getWindow()).isEqualTo(new DatetimeRange(
                Instant.parse("2024-01-10T11:30:00Z"), Instant.parse("2024-01-10T12:00:00Z")));
        assertThat(second.getPagination().hasNext()).isFalse();
    }

    @Test
    @DisplayName("A partial last bucket still counts as a page")
    void partialBucket() {
        TimeRangePaginator.Page page = TimeRangePaginator.paginate(new RelativeMinutesRange(65, 0), 600, 2, 3, NOW);

        assertThat(page.getPagination().getTotal()).isEqualTo(7);
        assertThat(page.getPagination().getNextNum()).isEqualTo(3);
    }

    @Test
    @DisplayName("Unpaged windows are extended to a whole number of buckets")
    void endCorrection() {
        TimeRangePaginator.Page page = TimeRangePaginator.paginate(new RelativeMinutesRange(25, 0), 600, null, null, NOW);

        assertThat(page.getPagination()).isNull();
        assertThat(page.getWindow().getStart()).isEqualTo(Instant.parse("2024-01-10T11:35:00Z"));
        assertThat(page.getWindow().getEnd()).isEqualTo(Instant.parse("2024-01-10T12:05:00Z"));

        TimeRangePaginator.Page aligned = TimeRangePaginator.paginate(new RelativeMinutesRange(30, 0), 600, null, null, NOW);
        assertThat(aligned.getWindow().getEnd()).isEqualTo(NOW);
    }
}
