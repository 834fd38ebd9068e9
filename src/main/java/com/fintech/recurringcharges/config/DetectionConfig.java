package com.fintech.recurringcharges.config;

import com.fintech.recurringcharges.service.analyzers.ConfidenceAdjustmentTable;
import com.fintech.recurringcharges.service.analyzers.ConfidenceScoreCalculator;
import com.fintech.recurringcharges.service.analyzers.FrequencyAnalyzer;
import com.fintech.recurringcharges.service.analyzers.TemporalPatternAnalyzer;
import com.fintech.recurringcharges.service.calendar.HolidayCalendar;
import com.fintech.recurringcharges.service.calendar.UsFederalHolidayCalendar;
import com.fintech.recurringcharges.service.criteria.AmountCriteriaBuilder;
import com.fintech.recurringcharges.service.criteria.MerchantCriteriaBuilder;
import com.fintech.recurringcharges.service.criteria.PatternCriteriaMatcher;
import com.fintech.recurringcharges.service.criteria.TemporalCriteriaBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Wires the detection engine components that take configuration.
 */
@Configuration
public class DetectionConfig {

    @Bean
    public HolidayCalendar holidayCalendar(DetectionProperties properties) {
        String country = properties.getHolidayCountry().toUpperCase(Locale.ROOT);
        switch (country) {
            case "US":
                return new UsFederalHolidayCalendar();
            case "NONE":
                return HolidayCalendar.NONE;
            default:
                throw new IllegalStateException("Unsupported holiday country: " + properties.getHolidayCountry());
        }
    }

    @Bean
    public FrequencyAnalyzer frequencyAnalyzer(DetectionProperties properties) {
        return new FrequencyAnalyzer(properties.resolveFrequencyBuckets());
    }

    @Bean
    public TemporalPatternAnalyzer temporalPatternAnalyzer(HolidayCalendar holidayCalendar,
                                                           DetectionProperties properties) {
        DetectionProperties.Temporal temporal = properties.getTemporal();
        return new TemporalPatternAnalyzer(holidayCalendar, temporal.getConsistencyThreshold(),
                temporal.getWeekdayThreshold(), temporal.getDayThreshold());
    }

    @Bean
    public ConfidenceAdjustmentTable confidenceAdjustmentTable() {
        return ConfidenceAdjustmentTable.defaults();
    }

    @Bean
    public ConfidenceScoreCalculator confidenceScoreCalculator(DetectionProperties properties,
                                                               ConfidenceAdjustmentTable adjustmentTable) {
        return new ConfidenceScoreCalculator(properties.getWeights().toConfidenceWeights(), adjustmentTable);
    }

    @Bean
    public TemporalCriteriaBuilder temporalCriteriaBuilder(FrequencyAnalyzer frequencyAnalyzer) {
        return new TemporalCriteriaBuilder(frequencyAnalyzer);
    }

    @Bean
    public PatternCriteriaMatcher patternCriteriaMatcher(MerchantCriteriaBuilder merchantCriteriaBuilder,
                                                         AmountCriteriaBuilder amountCriteriaBuilder,
                                                         HolidayCalendar holidayCalendar) {
        return new PatternCriteriaMatcher(merchantCriteriaBuilder, amountCriteriaBuilder, holidayCalendar);
    }
}
