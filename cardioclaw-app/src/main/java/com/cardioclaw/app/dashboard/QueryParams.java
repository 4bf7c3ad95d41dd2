package com.cardioclaw.app.dashboard;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

final class QueryParams {

    private QueryParams() {
    }

    /**
     * @throws BadRequestException unless the value is a positive integer
     */
    static int positiveInt(String value, String name) {
        try {
            int n = Integer.parseInt(value.trim());
            if (n > 0)
                return n;
        } catch (NumberFormatException e) {
            // fall through
        }
        throw new BadRequestException(name + " must be a positive integer");
    }

    /**
     * ISO instant, ISO date-time with offset, or a bare date (midnight UTC).
     *
     * @return null when unparseable
     */
    static Instant instant(String value) {
        String v = value.trim();
        try {
            return Instant.parse(v);
        } catch (DateTimeException e) {
            // try the other forms
        }
        try {
            return OffsetDateTime.parse(v).toInstant();
        } catch (DateTimeException e) {
            // try the other forms
        }
        try {
            return LocalDate.parse(v).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeException e) {
            return null;
        }
    }
}
