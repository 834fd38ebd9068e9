package com.fintech.recurringcharges.service.calendar;

import lombok.extern.slf4j.Slf4j;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.temporal.TemporalAdjusters;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * US federal holidays computed from their rules.
 * <p>
 * Fixed-date holidays falling on a weekend are also observed on the nearest weekday
 * (Saturday to Friday, Sunday to Monday). Both the actual and the observed date count
 * as holidays. Holiday sets are computed once per year and cached.
 */
@Slf4j
public class UsFederalHolidayCalendar implements HolidayCalendar {

    private static final int JUNETEENTH_FIRST_YEAR = 2021;
    private static final int MLK_DAY_FIRST_YEAR = 1986;

    private final Map<Integer, Set<LocalDate>> holidaysByYear = new ConcurrentHashMap<>();

    @Override
    public boolean isHoliday(LocalDate date) {
        return holidaysFor(date.getYear()).contains(date);
    }

    public Set<LocalDate> holidaysFor(int year) {
        return holidaysByYear.computeIfAbsent(year, this::computeHolidays);
    }

    private Set<LocalDate> computeHolidays(int year) {
        Set<LocalDate> days = new HashSet<>();

        addFixed(days, LocalDate.of(year, Month.JANUARY, 1));
        if (year >= MLK_DAY_FIRST_YEAR) {
            days.add(nthWeekday(year, Month.JANUARY, DayOfWeek.MONDAY, 3));
        }
        days.add(nthWeekday(year, Month.FEBRUARY, DayOfWeek.MONDAY, 3));
        days.add(LocalDate.of(year, Month.MAY, 1).with(TemporalAdjusters.lastInMonth(DayOfWeek.MONDAY)));
        if (year >= JUNETEENTH_FIRST_YEAR) {
            addFixed(days, LocalDate.of(year, Month.JUNE, 19));
        }
        addFixed(days, LocalDate.of(year, Month.JULY, 4));
        days.add(nthWeekday(year, Month.SEPTEMBER, DayOfWeek.MONDAY, 1));
        days.add(nthWeekday(year, Month.OCTOBER, DayOfWeek.MONDAY, 2));
        addFixed(days, LocalDate.of(year, Month.NOVEMBER, 11));
        days.add(nthWeekday(year, Month.NOVEMBER, DayOfWeek.THURSDAY, 4));
        addFixed(days, LocalDate.of(year, Month.DECEMBER, 25));

        // Next New Year's Day on a Saturday is observed on Dec 31 of this year
        LocalDate nextNewYear = LocalDate.of(year + 1, Month.JANUARY, 1);
        if (nextNewYear.getDayOfWeek() == DayOfWeek.SATURDAY) {
            days.add(nextNewYear.minusDays(1));
        }

        days.removeIf(d -> d.getYear() != year);
        log.debug("Computed {} US federal holiday dates for {}", days.size(), year);
        return Collections.unmodifiableSet(days);
    }

    private static void addFixed(Set<LocalDate> days, LocalDate actual) {
        days.add(actual);
        if (actual.getDayOfWeek() == DayOfWeek.SATURDAY) {
            days.add(actual.minusDays(1));
        } else if (actual.getDayOfWeek() == DayOfWeek.SUNDAY) {
            days.add(actual.plusDays(1));
        }
    }

    private static LocalDate nthWeekday(int year, Month month, DayOfWeek dayOfWeek, int n) {
        return LocalDate.of(year, month, 1).with(TemporalAdjusters.dayOfWeekInMonth(n, dayOfWeek));
    }
}
