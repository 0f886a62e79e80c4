package com.company.slr.service;

import com.company.slr.config.RedisCacheConfig;
import com.company.slr.domain.*;
import com.company.slr.domain.enums.ReportType;
import com.company.slr.domain.enums.Resolution;
import com.company.slr.dto.BucketSummary;
import com.company.slr.dto.ObjectiveReport;
import com.company.slr.dto.SloReport;
import com.company.slr.dto.TargetSummary;
import com.company.slr.exception.ProductNotFoundException;
import com.company.slr.repository.IndicatorRepository;
import com.company.slr.repository.ObjectiveRepository;
import com.company.slr.repository.ProductRepository;
import com.company.slr.repository.TargetRepository;
import com.company.slr.source.SourceRegistry;
import com.company.slr.time.DatetimeRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Per-objective bucket summaries of a product, the data behind SLO reports.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SloReportService {

    private final ProductRepository productRepository;
    private final ObjectiveRepository objectiveRepository;
    private final TargetRepository targetRepository;
    private final IndicatorRepository indicatorRepository;
    private final SourceRegistry sourceRegistry;
    private final Clock clock;

    @Cacheable(value = RedisCacheConfig.SLO_REPORTS_CACHE, key = "#productId + ':' + #reportType.name()")
    public SloReport buildReport(long productId, ReportType reportType) {
        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));

        Instant now = clock.instant();
        DatetimeRange window = new DatetimeRange(reportType.periodStart(now), now);
        Resolution resolution = reportType.getResolution();

        List<Objective> objectives = objectiveRepository.findByProductId(productId);
        List<ObjectiveReport> slo = new ArrayList<>();

        for (Objective objective : objectives) {
            List<Target> targets = targetRepository.findByObjectiveId(objective.getId());
            if (targets.isEmpty()) {
                log.debug("Skipping objective {} without targets", objective.getId());
                continue;
            }
            slo.add(buildObjectiveReport(objective, targets, window, resolution));
        }

        log.info("Built {} report for product {}: {} of {} objectives",
                reportType.name().toLowerCase(), product.getName(), slo.size(), objectives.size());

        return SloReport.builder()
                .productId(product.getId())
                .productName(product.getName())
                .productSlug(product.getSlug())
                .productGroupName(product.getProductGroupName())
                .productGroupSlug(product.getProductGroupSlug())
                .reportType(reportType.name().toLowerCase())
                .slo(slo)
                .build();
    }

    private ObjectiveReport buildObjectiveReport(Objective objective, List<Target> targets,
                                                 DatetimeRange window, Resolution resolution) {
        Map<String, Map<String, BucketSummary>> days = new TreeMap<>();
        List<TargetSummary> targetSummaries = new ArrayList<>();

        for (Target target : targets) {
            Optional<Indicator> found = indicatorRepository.findById(target.getIndicatorId());
            if (found.isEmpty()) {
                log.warn("Target {} references missing indicator {}", target.getId(), target.getIndicatorId());
                continue;
            }
            Indicator indicator = found.get();
            String aggregation = indicator.getAggregationType().getName();

            targetSummaries.add(TargetSummary.builder()
                    .from(target.getTargetFrom())
                    .to(target.getTargetTo())
                    .sliName(indicator.getName())
                    .unit(indicator.getUnit())
                    .aggregation(aggregation)
                    .build());

            List<IndicatorValueAggregate> buckets = sourceRegistry.fromIndicator(indicator)
                    .getIndicatorValueAggregates(window, EnumSet.of(resolution))
                    .getOrDefault(resolution, List.of());

            for (IndicatorValueAggregate bucket : buckets) {
                days.computeIfAbsent(bucket.getTimestamp().toString(), k -> new TreeMap<>())
                        .put(indicator.getName(), BucketSummary.builder()
                                .min(bucket.getMin())
                                .avg(bucket.getAverage())
                                .max(bucket.getMax())
                                .count(bucket.getCount())
                                .sum(bucket.getSum())
                                .breaches(bucket.countBreaches(target))
                                .aggregation(aggregation)
                                .build());
            }
        }

        return ObjectiveReport.builder()
                .id(objective.getId())
                .title(objective.getTitle())
                .description(objective.getDescription())
                .targets(targetSummaries)
                .days(days)
                .build();
    }
}
