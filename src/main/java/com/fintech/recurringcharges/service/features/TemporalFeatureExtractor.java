package com.fintech.recurringcharges.service.features;

import com.fintech.recurringcharges.model.Transaction;
import com.fintech.recurringcharges.service.calendar.HolidayCalendar;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.TemporalAdjusters;
import java.util.List;

/**
 * Encodes when a transaction happened (17 features).
 * <p>
 * Layout:
 * <ol start="0">
 *   <li>day of week sin/cos (period 7)</li>
 *   <li>day of month sin/cos (period 31)</li>
 *   <li>position in month sin/cos (period = days in month)</li>
 *   <li>week of month sin/cos (period 5)</li>
 *   <li>flags: working day, first working day, last working day, first weekday of its kind,
 *       last weekday of its kind, weekend, first day, last day</li>
 *   <li>normalized day position in month</li>
 * </ol>
 */
@Component
@RequiredArgsConstructor
public class TemporalFeatureExtractor implements FeatureExtractor {

    public static final int FEATURE_SIZE = 17;

    private static final double TWO_PI = 2 * Math.PI;

    private final HolidayCalendar holidayCalendar;

    @Override
    public int getFeatureSize() {
        return FEATURE_SIZE;
    }

    @Override
    public double[][] extractBatch(List<Transaction> transactions, ExtractionContext context) {
        double[][] rows = new double[transactions.size()][];
        for (int i = 0; i < transactions.size(); i++) {
            rows[i] = extract(transactions.get(i).getLocalDate());
        }
        return rows;
    }

    double[] extract(LocalDate date) {
        int dayOfWeek = date.getDayOfWeek().getValue() - 1; // Monday = 0
        int dayOfMonth = date.getDayOfMonth();
        int daysInMonth = date.lengthOfMonth();
        int weekOfMonth = (dayOfMonth - 1) / 7 + 1;

        double[] f = new double[FEATURE_SIZE];
        f[0] = Math.sin(TWO_PI * dayOfWeek / 7);
        f[1] = Math.cos(TWO_PI * dayOfWeek / 7);
        f[2] = Math.sin(TWO_PI * dayOfMonth / 31);
        f[3] = Math.cos(TWO_PI * dayOfMonth / 31);
        f[4] = Math.sin(TWO_PI * (dayOfMonth - 1) / daysInMonth);
        f[5] = Math.cos(TWO_PI * (dayOfMonth - 1) / daysInMonth);
        f[6] = Math.sin(TWO_PI * weekOfMonth / 5);
        f[7] = Math.cos(TWO_PI * weekOfMonth / 5);

        f[8] = flag(holidayCalendar.isWorkingDay(date));
        f[9] = flag(holidayCalendar.isFirstWorkingDay(date));
        f[10] = flag(holidayCalendar.isLastWorkingDay(date));
        f[11] = flag(isFirstOfWeekdayInMonth(date));
        f[12] = flag(isLastOfWeekdayInMonth(date));
        f[13] = flag(holidayCalendar.isWeekend(date));
        f[14] = flag(dayOfMonth == 1);
        f[15] = flag(dayOfMonth == daysInMonth);

        f[16] = daysInMonth > 1 ? (double) (dayOfMonth - 1) / (daysInMonth - 1) : 0.5;
        return f;
    }

    static boolean isFirstOfWeekdayInMonth(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return date.equals(YearMonth.from(date).atDay(1).with(TemporalAdjusters.firstInMonth(dow)));
    }

    static boolean isLastOfWeekdayInMonth(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return date.equals(YearMonth.from(date).atDay(1).with(TemporalAdjusters.lastInMonth(dow)));
    }

    private static double flag(boolean value) {
        return value ? 1.0 : 0.0;
    }
}
