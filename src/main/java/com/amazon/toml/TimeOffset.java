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
import java.time.ZoneOffset;

/**
 * An immutable offset from UTC, in whole minutes.
 */
public final class TimeOffset
{
    /** The zero offset, printed as {@code Z}. */
    public static final TimeOffset UTC = new TimeOffset(0);

    private final int _minutes;

    /**
     * @param minutes the offset from UTC; negative west of Greenwich.
     *
     * @throws IllegalArgumentException if the offset is a day or more.
     */
    public TimeOffset(int minutes)
    {
        if (minutes <= -1440 || minutes >= 1440)
        {
            throw new IllegalArgumentException("Offset " + minutes
                                               + " must be between -1439 and 1439 minutes inclusive");
        }
        _minutes = minutes;
    }

    public static TimeOffset forMinutes(int minutes)
    {
        return (minutes == 0 ? UTC : new TimeOffset(minutes));
    }

    /**
     * @throws IllegalArgumentException if the offset has a seconds part.
     */
    public static TimeOffset forZoneOffset(ZoneOffset offset)
    {
        int seconds = offset.getTotalSeconds();
        if (seconds % 60 != 0)
        {
            throw new IllegalArgumentException("Offset " + offset
                                               + " is not a whole number of minutes");
        }
        return forMinutes(seconds / 60);
    }


    public int getMinutes()
    {
        return _minutes;
    }

    public ZoneOffset toZoneOffset()
    {
        return ZoneOffset.ofTotalSeconds(_minutes * 60);
    }


    /**
     * Returns the offset as {@code Z} or {@code +HH:MM}/{@code -HH:MM}.
     */
    @Override
    public String toString()
    {
        StringBuilder buffer = new StringBuilder(6);
        try
        {
            TomlTextUtils.printTimeOffset(buffer, this);
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
        if (!(other instanceof TimeOffset)) return false;
        return _minutes == ((TimeOffset) other)._minutes;
    }

    @Override
    public int hashCode()
    {
        return _minutes;
    }
}
