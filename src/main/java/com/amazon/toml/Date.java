/*
 * Copyright 2007-2019 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.toml;

import com.amazon.toml.util.TomlTextUtils;
import java.io.IOException;
import java.time.LocalDate;

/**
 * An immutable local calendar date, with no time and no offset.
 * <p>
 * Fields are validated individually: the year must have at most four digits,
 * the month must be in 1-12 and the day in 1-31. Whether the day exists in
 * that month is not checked here; {@link #toLocalDate()} does.
 */
public final class Date
{
    private final int _year;
    private final int _month;
    private final int _day;

    /**
     * @throws IllegalArgumentException if a field is out of range.
     */
    public Date(int year, int month, int day)
    {
        if (year < 0 || year > 9999)
        {
            throw new IllegalArgumentException("Year " + year
                                               + " must be between 0 and 9999 inclusive");
        }
        if (month < 1 || month > 12)
        {
            throw new IllegalArgumentException("Month " + month
                                               + " must be between 1 and 12 inclusive");
        }
        if (day < 1 || day > 31)
        {
            throw new IllegalArgumentException("Day " + day
                                               + " must be between 1 and 31 inclusive");
        }
        _year = year;
        _month = month;
        _day = day;
    }

    /**
     * @throws IllegalArgumentException if the year has more than four digits.
     */
    public static Date forLocalDate(LocalDate date)
    {
        return new Date(date.getYear(), date.getMonthValue(),
                        date.getDayOfMonth());
    }


    public int getYear()
    {
        return _year;
    }

    public int getMonth()
    {
        return _month;
    }

    public int getDay()
    {
        return _day;
    }

    /**
     * @throws java.time.DateTimeException if the day doesn't exist in the
     * month, like February 30th.
     */
    public LocalDate toLocalDate()
    {
        return LocalDate.of(_year, _month, _day);
    }


    /**
     * Returns the date as {@code YYYY-MM-DD}.
     */
    @Override
    public String toString()
    {
        StringBuilder buffer = new StringBuilder(10);
        try
        {
            TomlTextUtils.printDate(buffer, this);
        }
        catch (IOException e)
        {
            throw new TomlException("Exception printing to StringBuilder", e);
        }
        return buffer.toString();
    }

    @Override
    public boolean equals(Object other)
    {
        if (other == this) return true;
        if (!(other instanceof Date)) return false;

        Date that = (Date) other;
        return _year == that._year
            && _month == that._month
            && _day == that._day;
    }

    @Override
    public int hashCode()
    {
        return (_year << 9) | (_month << 5) | _day;
    }
}
