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
import java.time.LocalTime;

/**
 * An immutable local time of day, with nanosecond precision and no offset.
 * A second of 60 is accepted to allow for leap seconds.
 */
public final class Time
{
    private final int _hour;
    private final int _minute;
    private final int _second;
    private final int _nanosecond;

    public Time(int hour, int minute, int second)
    {
        this(hour, minute, second, 0);
    }

    /**
     * @throws IllegalArgumentException if a field is out of range.
     */
    public Time(int hour, int minute, int second, int nanosecond)
    {
        if (hour < 0 || hour > 23)
        {
            throw new IllegalArgumentException("Hour " + hour
                                               + " must be between 0 and 23 inclusive");
        }
        if (minute < 0 || minute > 59)
        {
            throw new IllegalArgumentException("Minute " + minute
                                               + " must be between 0 and 59 inclusive");
        }
        if (second < 0 || second > 60)
        {
            throw new IllegalArgumentException("Second " + second
                                               + " must be between 0 and 60 inclusive");
        }
        if (nanosecond < 0 || nanosecond > 999999999)
        {
            throw new IllegalArgumentException("Nanosecond " + nanosecond
                                               + " must be between 0 and 999999999 inclusive");
        }
        _hour = hour;
        _minute = minute;
        _second = second;
        _nanosecond = nanosecond;
    }

    public static Time forLocalTime(LocalTime time)
    {
        return new Time(time.getHour(), time.getMinute(), time.getSecond(),
                        time.getNano());
    }


    public int getHour()
    {
        return _hour;
    }

    public int getMinute()
    {
        return _minute;
    }

    public int getSecond()
    {
        return _second;
    }

    public int getNanosecond()
    {
        return _nanosecond;
    }

    /**
     * @throws java.time.DateTimeException if this is a leap second.
     */
    public LocalTime toLocalTime()
    {
        return LocalTime.of(_hour, _minute, _second, _nanosecond);
    }


    /**
     * Returns the time as {@code HH:MM:SS}, followed by the fraction of a
     * second when there is one.
     */
    @Override
    public String toString()
    {
        StringBuilder buffer = new StringBuilder(18);
        try
        {
            TomlTextUtils.printTime(buffer, this);
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
        if (!(other instanceof Time)) return false;

        Time that = (Time) other;
        return _hour == that._hour
            && _minute == that._minute
            && _second == that._second
            && _nanosecond == that._nanosecond;
    }

    @Override
    public int hashCode()
    {
        int result = (_hour << 12) | (_minute << 6) | _second;
        return 31 * result + _nanosecond;
    }
}
