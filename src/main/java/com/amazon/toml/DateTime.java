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
import java.time.LocalDateTime;
import java.time.OffsetDateTime;

/**
 * An immutable date and time. With an offset it's an instant; without one
 * it's a local date-time.
 */
public final class DateTime
{
    private final Date _date;
    private final Time _time;
    private final TimeOffset _offset;

    /**
     * Constructs a local date-time.
     */
    public DateTime(Date date, Time time)
    {
        this(date, time, null);
    }

    /**
     * @param offset may be null, meaning a local date-time.
     *
     * @throws NullPointerException if {@code date} or {@code time} is null.
     */
    public DateTime(Date date, Time time, TimeOffset offset)
    {
        if (date == null) throw new NullPointerException("date is null");
        if (time == null) throw new NullPointerException("time is null");
        _date = date;
        _time = time;
        _offset = offset;
    }

    public static DateTime forLocalDateTime(LocalDateTime dateTime)
    {
        return new DateTime(Date.forLocalDate(dateTime.toLocalDate()),
                            Time.forLocalTime(dateTime.toLocalTime()));
    }

    /**
     * @throws IllegalArgumentException if the offset has a seconds part.
     */
    public static DateTime forOffsetDateTime(OffsetDateTime dateTime)
    {
        return new DateTime(Date.forLocalDate(dateTime.toLocalDate()),
                            Time.forLocalTime(dateTime.toLocalTime()),
                            TimeOffset.forZoneOffset(dateTime.getOffset()));
    }


    public Date getDate()
    {
        return _date;
    }

    public Time getTime()
    {
        return _time;
    }

    /**
     * @return the offset from UTC, or null for a local date-time.
     */
    public TimeOffset getOffset()
    {
        return _offset;
    }

    public boolean hasOffset()
    {
        return _offset != null;
    }

    /**
     * Drops the offset, if any.
     */
    public LocalDateTime toLocalDateTime()
    {
        return LocalDateTime.of(_date.toLocalDate(), _time.toLocalTime());
    }

    /**
     * @throws IllegalStateException if this is a local date-time.
     */
    public OffsetDateTime toOffsetDateTime()
    {
        if (_offset == null)
        {
            throw new IllegalStateException("Local date-time has no offset: "
                                            + this);
        }
        return OffsetDateTime.of(toLocalDateTime(), _offset.toZoneOffset());
    }


    /**
     * Returns the date-time as date, {@code T}, time and then the offset
     * when there is one.
     */
    @Override
    public String toString()
    {
        StringBuilder buffer = new StringBuilder(36);
        try
        {
            TomlTextUtils.printDateTime(buffer, this);
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
        if (!(other instanceof DateTime)) return false;

        DateTime that = (DateTime) other;
        return _date.equals(that._date)
            && _time.equals(that._time)
            && (_offset == null ? that._offset == null
                                : _offset.equals(that._offset));
    }

    @Override
    public int hashCode()
    {
        int result = _date.hashCode();
        result = 31 * result + _time.hashCode();
        result = 31 * result + (_offset == null ? 0 : _offset.hashCode());
        return result;
    }
}
