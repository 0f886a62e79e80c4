package com.company.slr.service;

import com.company.slr.Fixtures;
import com.company.slr.domain.*;
import com.company.slr.domain.enums.ReportType;
import com.company.slr.domain.enums.Resolution;
import com.company.slr.dto.BucketSummary;
import com.company.slr.dto.ObjectiveReport;
import com.company.slr.dto.SloReport;
import com.company.slr.exception.ProductNotFoundException;
import com.company.slr.repository.IndicatorRepository;
import com.company.slr.repository.ObjectiveRepository;
import com.company.slr.repository.ProductRepository;
import com.company.slr.repository.TargetRepository;
import com.company.slr.source.SourceRegistry;
import com.company.slr.source.ZmonSource;
import com.company.slr.time.DatetimeRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.company.slr.Fixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SloReportServiceTest {

    @Mock
    private ProductRepository productRepository;
    @Mock
    private ObjectiveRepository objectiveRepository;
    @Mock
    private TargetRepository targetRepository;
    @Mock
    private IndicatorRepository indicatorRepository;
    @Mock
    private SourceRegistry sourceRegistry;
    @Mock
    private ZmonSource source;

    private SloReportService service;

    private final Product product = Product.builder()
            .id(1L).name("Checkout").slug("checkout").productGroupName("Payments").productGroupSlug("payments")
            .build();

    @BeforeEach
    void setUp() {
        service = new SloReportService(productRepository, objectiveRepository, targetRepository,
                indicatorRepository, sourceRegistry, Fixtures.fixedClock());
    }

    @Test
    @DisplayName("Weekly reports summarize each day per SLI and count breaches on raw values")
    void weeklyReport() {
        Indicator latency = Fixtures.indicator(7L, "checkout-latency", Fixtures.zmonSource("max"));
        Objective withTarget = Objective.builder().id(10L).productId(1L).title("Fast checkout").build();
        Objective withoutTarget = Objective.builder().id(11L).productId(1L).title("Draft").build();
        Target target = Target.builder().id(100L).indicatorId(7L).objectiveId(10L).targetTo(200.0).build();

        IndicatorValueAggregate day = IndicatorValueAggregate.builder()
                .timestamp(Instant.parse("2024-01-09T00:00:00Z"))
                .aggregate(320.0).sum(770.0).count(4).average(192.5).min(50.0).max(320.0)
                .values(List.of(50.0, 210.0, 190.0, 320.0))
                .build();

        when(productRepository.findById(1L)).thenReturn(Optional.of(product));
        when(objectiveRepository.findByProductId(1L)).thenReturn(List.of(withTarget, withoutTarget));
        when(targetRepository.findByObjectiveId(10L)).thenReturn(List.of(target));
        when(targetRepository.findByObjectiveId(11L)).thenReturn(List.of());
        when(indicatorRepository.findById(7L)).thenReturn(Optional.of(latency));
        when(sourceRegistry.fromIndicator(latency)).thenReturn(source);
        when(source.getIndicatorValueAggregates(new DatetimeRange(NOW.minus(Duration.ofDays(7)), NOW),
                EnumSet.of(Resolution.DAY)))
                .thenReturn(Map.of(Resolution.DAY, List.of(day)));

        SloReport report = service.buildReport(1L, ReportType.WEEKLY);

        assertThat(report.getProductGroupSlug()).isEqualTo("payments");
        assertThat(report.getReportType()).isEqualTo("weekly");
        assertThat(report.getSlo()).singleElement().satisfies(objective -> {
            assertThat(objective.getTitle()).isEqualTo("Fast checkout");
            assertThat(objective.getTargets()).singleElement()
                    .satisfies(t -> assertThat(t.getAggregation()).isEqualTo("max"));
        });

        ObjectiveReport objective = report.getSlo().get(0);
        BucketSummary summary = objective.getDays().get("2024-01-09T00:00:00Z").get("checkout-latency");
        assertThat(summary.getBreaches()).isEqualTo(2);
        assertThat(summary.getCount()).isEqualTo(4);
        assertThat(summary.getAvg()).isEqualTo(192.5);
    }

    @Test
    void unknownProduct() {
        when(productRepository.findById(9L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.buildReport(9L, ReportType.MONTHLY))
                .isInstanceOf(ProductNotFoundException.class);
        verifyNoInteractions(objectiveRepository);
    }
}
