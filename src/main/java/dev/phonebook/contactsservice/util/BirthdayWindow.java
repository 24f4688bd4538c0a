package dev.phonebook.contactsservice.util;

import java.time.LocalDate;
import java.time.MonthDay;

public final class BirthdayWindow {

    private BirthdayWindow() {
    }

    /**
     * First anniversary of {@code birthday} on or after {@code from}. February 29th falls on
     * February 28th in common years.
     */
    public static LocalDate nextOccurrence(LocalDate birthday, LocalDate from) {
        MonthDay monthDay = MonthDay.from(birthday);
        LocalDate candidate = monthDay.atYear(from.getYear());
        if (candidate.isBefore(from)) {
            candidate = monthDay.atYear(from.getYear() + 1);
        }
        return candidate;
    }

    /** True when the next anniversary lies in {@code [from, from + days]}. */
    public static boolean isWithin(LocalDate birthday, LocalDate from, int days) {
        return !nextOccurrence(birthday, from).isAfter(from.plusDays(days));
    }
}
