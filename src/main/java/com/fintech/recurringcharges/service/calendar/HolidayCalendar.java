package com.fintech.recurringcharges.service.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Source of public holidays used to tell working days from non-working days.
 * <p>
 * A working day is a Monday to Friday that is not a holiday.
 */
public interface HolidayCalendar {

    /**
     * Calendar with no holidays; only weekends are non-working.
     */
    HolidayCalendar NONE = date -> false;

    boolean isHoliday(LocalDate date);

    default boolean isWeekend(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY;
    }

    default boolean isWorkingDay(LocalDate date) {
        return !isWeekend(date) && !isHoliday(date);
    }

    /**
     * First working day of the month, or the first calendar day if the month has none.
     */
    default LocalDate firstWorkingDay(YearMonth month) {
        for (LocalDate day = month.atDay(1); !day.isAfter(month.atEndOfMonth()); day = day.plusDays(1)) {
            if (isWorkingDay(day)) {
                return day;
            }
        }
        return month.atDay(1);
    }

    /**
     * Last working day of the month, or the last calendar day if the month has none.
     */
    default LocalDate lastWorkingDay(YearMonth month) {
        for (LocalDate day = month.atEndOfMonth(); !day.isBefore(month.atDay(1)); day = day.minusDays(1)) {
            if (isWorkingDay(day)) {
                return day;
            }
        }
        return month.atEndOfMonth();
    }

    default boolean isFirstWorkingDay(LocalDate date) {
        return isWorkingDay(date) && date.equals(firstWorkingDay(YearMonth.from(date)));
    }

    default boolean isLastWorkingDay(LocalDate date) {
        return isWorkingDay(date) && date.equals(lastWorkingDay(YearMonth.from(date)));
    }
}
