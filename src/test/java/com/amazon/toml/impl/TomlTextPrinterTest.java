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

package com.amazon.toml.impl;

import static com.amazon.toml.impl.TomlTextPrinter.LINE_WRAP_COLUMNS;
import static com.amazon.toml.impl.TomlTextPrinter.countInlineColumns;
import static com.amazon.toml.impl.TomlTextPrinter.forcesMultiline;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.amazon.toml.Date;
import com.amazon.toml.DateTime;
import com.amazon.toml.Time;
import com.amazon.toml.TomlArray;
import com.amazon.toml.TomlBoolean;
import com.amazon.toml.TomlDate;
import com.amazon.toml.TomlDateTime;
import com.amazon.toml.TomlFloat;
import com.amazon.toml.TomlInteger;
import com.amazon.toml.TomlString;
import com.amazon.toml.TomlTable;
import com.amazon.toml.TomlTime;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Checks the inline width estimate that decides between one-line and
 * one-element-per-line arrays.
 */
public class TomlTextPrinterTest
{
    static String repeat(char c, int count)
    {
        StringBuilder buf = new StringBuilder(count);
        for (int i = 0; i < count; i++)
        {
            buf.append(c);
        }
        return buf.toString();
    }

    static TomlArray arrayOfString(int length)
    {
        return new TomlArray(new TomlString(repeat('x', length)));
    }


    @ParameterizedTest
    @CsvSource({
        "0, 1",
        "7, 1",
        "123, 3",
        "1000, 4",
        "-45, 3",
        "-1, 2",
        "9223372036854775807, 19",
    })
    public void testIntegerWidth(long value, int expected)
    {
        assertEquals(expected, countInlineColumns(new TomlInteger(value)));
    }

    @ParameterizedTest
    @CsvSource({
        "0.0, 3",
        "1.5, 3",
        "0.001, 3",
        "-12.5, 5",
        "12345.0, 7",
    })
    public void testFloatWidth(double value, int expected)
    {
        assertEquals(expected, countInlineColumns(new TomlFloat(value)));
    }

    @Test
    public void testSpecialFloatWidths()
    {
        assertEquals(3, countInlineColumns(new TomlFloat(Double.POSITIVE_INFINITY)));
        assertEquals(4, countInlineColumns(new TomlFloat(Double.NEGATIVE_INFINITY)));
        assertEquals(3, countInlineColumns(new TomlFloat(Double.NaN)));
    }

    @Test
    public void testScalarWidths()
    {
        assertEquals(5, countInlineColumns(new TomlString("abc")));
        assertEquals(2, countInlineColumns(new TomlString("")));
        assertEquals(4, countInlineColumns(new TomlString("é")));
        assertEquals(5, countInlineColumns(new TomlBoolean(true)));
        assertEquals(5, countInlineColumns(new TomlBoolean(false)));
        assertEquals(10, countInlineColumns(new TomlDate(new Date(2000, 1, 1))));
        assertEquals(10, countInlineColumns(new TomlTime(new Time(1, 2, 3))));
        DateTime dt = new DateTime(new Date(2000, 1, 1), new Time(1, 2, 3));
        assertEquals(30, countInlineColumns(new TomlDateTime(dt)));
    }

    @Test
    public void testContainerWidths()
    {
        assertEquals(2, countInlineColumns(new TomlArray()));
        assertEquals(2, countInlineColumns(new TomlTable()));

        TomlArray numbers = new TomlArray(new TomlInteger(1),
                                          new TomlInteger(2),
                                          new TomlInteger(3));
        assertEquals(12, countInlineColumns(numbers));

        TomlTable table = new TomlTable(true);
        table.put("a", new TomlInteger(1));
        assertEquals(7, countInlineColumns(table));

        // { a = 1, bb = [ 1, 2, 3 ] }
        table.put("bb", numbers);
        assertEquals(7 + 2 + 12 + 2, countInlineColumns(table));
    }

    @Test
    public void testWrapBoundary()
    {
        assertEquals(LINE_WRAP_COLUMNS - 1, countInlineColumns(arrayOfString(112)));
        assertFalse(forcesMultiline(arrayOfString(112), 0));

        assertEquals(LINE_WRAP_COLUMNS, countInlineColumns(arrayOfString(113)));
        assertTrue(forcesMultiline(arrayOfString(113), 0));
    }

    @Test
    public void testStartingColumnBias()
    {
        TomlArray array = arrayOfString(100);   // 107 columns
        assertFalse(forcesMultiline(array, 12));
        assertTrue(forcesMultiline(array, 13));
    }

    @Test
    public void testWideArrayStopsCounting()
    {
        TomlArray ones = new TomlArray();
        for (int i = 0; i < 100; i++)
        {
            ones.add(new TomlInteger(1));
        }
        // 3 + 3 * 39 reaches the threshold; the rest is never counted.
        assertEquals(LINE_WRAP_COLUMNS, countInlineColumns(ones));
        assertTrue(forcesMultiline(ones, 0));
    }
}
