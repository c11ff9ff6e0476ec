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

package com.amazon.toml.util;

import com.amazon.toml.Date;
import com.amazon.toml.DateTime;
import com.amazon.toml.Time;
import com.amazon.toml.TimeOffset;
import com.amazon.toml.ValueFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.anyOf;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TomlTextUtilsTest
{
    private static String printInteger(long value, ValueFormat format)
        throws IOException
    {
        StringBuilder out = new StringBuilder();
        TomlTextUtils.printInteger(out, value, format);
        return out.toString();
    }

    private static String printFloat(double value, ValueFormat format)
        throws IOException
    {
        StringBuilder out = new StringBuilder();
        TomlTextUtils.printFloat(out, value, format);
        return out.toString();
    }

    private static String printTime(Time time)
        throws IOException
    {
        StringBuilder out = new StringBuilder();
        TomlTextUtils.printTime(out, time);
        return out.toString();
    }

    private static String printOffset(int minutes)
        throws IOException
    {
        StringBuilder out = new StringBuilder();
        TomlTextUtils.printTimeOffset(out, new TimeOffset(minutes));
        return out.toString();
    }


    //=========================================================================
    // Integers

    @ParameterizedTest
    @EnumSource(ValueFormat.class)
    public void testZeroInAnyBase(ValueFormat format)
        throws IOException
    {
        assertEquals("0", printInteger(0, format));
    }

    @ParameterizedTest
    @CsvSource({
        "255, NONE, 255",
        "255, HEXADECIMAL, 0xFF",
        "3054, HEXADECIMAL, 0xBEE",
        "5, BINARY, 0b101",
        "8, OCTAL, 0o10",
        "-255, HEXADECIMAL, -255",
        "-5, BINARY, -5",
        "-8, OCTAL, -8",
        "9223372036854775807, HEXADECIMAL, 0x7FFFFFFFFFFFFFFF",
        "-9223372036854775808, NONE, -9223372036854775808",
    })
    public void testIntegers(long value, ValueFormat format, String expected)
        throws IOException
    {
        assertEquals(expected, printInteger(value, format));
    }

    @Test
    public void testNullFormatMeansDecimal()
        throws IOException
    {
        assertEquals("17", printInteger(17, null));
    }


    //=========================================================================
    // Floats

    @Test
    public void testSpecialFloats()
        throws IOException
    {
        assertEquals("inf", printFloat(Double.POSITIVE_INFINITY, ValueFormat.NONE));
        assertEquals("-inf", printFloat(Double.NEGATIVE_INFINITY, ValueFormat.NONE));
        assertEquals("nan", printFloat(Double.NaN, ValueFormat.NONE));
    }

    @ParameterizedTest
    @CsvSource({
        "1.0, 1.0",
        "0.5, 0.5",
        "-0.0, -0.0",
        "3.14159, 3.14159",
        "1e300, 1.0E300",
        "-2.5e-10, -2.5E-10",
        "9999999.0, 9999999.0",
        "1e7, 10000000.0",
        "-1.5e7, -15000000.0",
        "12345678.9, 12345678.9",
        "9.999999999999998e15, 9999999999999998.0",
        "1e16, 1.0E16",
    })
    public void testFiniteFloats(double value, String expected)
        throws IOException
    {
        assertEquals(expected, printFloat(value, ValueFormat.NONE));
    }

    @ParameterizedTest
    @ValueSource(doubles = { 0.0, 1.0, 42.0, -7.0, 1e21, 123456789.0, 0.1, Double.MIN_VALUE, Double.MAX_VALUE })
    public void testFloatsNeverLookLikeIntegers(double value)
        throws IOException
    {
        String text = printFloat(value, ValueFormat.NONE);
        assertThat(text, anyOf(containsString("."),
                               containsString("e"),
                               containsString("E")));
        assertEquals(value, Double.parseDouble(text), 0.0);
    }

    @Test
    public void testHexadecimalFloat()
        throws IOException
    {
        assertEquals("0x1.0p0", printFloat(1.0, ValueFormat.HEXADECIMAL));
    }


    //=========================================================================
    // Dates and times

    @Test
    public void testDate()
        throws IOException
    {
        StringBuilder out = new StringBuilder();
        TomlTextUtils.printDate(out, new Date(1, 1, 1));
        assertEquals("0001-01-01", out.toString());
    }

    @Test
    public void testTime()
        throws IOException
    {
        assertEquals("01:02:03", printTime(new Time(1, 2, 3, 0)));
        assertEquals("01:02:03.12", printTime(new Time(1, 2, 3, 120000000)));
        assertEquals("23:59:59.000000001", printTime(new Time(23, 59, 59, 1)));
        assertEquals("00:00:00.999999999", printTime(new Time(0, 0, 0, 999999999)));
    }

    @ParameterizedTest
    @CsvSource({
        "0, Z",
        "330, +05:30",
        "-30, -00:30",
        "-480, -08:00",
        "59, +00:59",
        "1439, +23:59",
    })
    public void testTimeOffset(int minutes, String expected)
        throws IOException
    {
        assertEquals(expected, printOffset(minutes));
    }

    @Test
    public void testDateTime()
        throws IOException
    {
        Date date = new Date(1979, 5, 27);
        Time time = new Time(7, 32, 0);

        StringBuilder out = new StringBuilder();
        TomlTextUtils.printDateTime(out, new DateTime(date, time));
        assertEquals("1979-05-27T07:32:00", out.toString());

        out.setLength(0);
        TomlTextUtils.printDateTime(out, new DateTime(date, time, TimeOffset.UTC));
        assertEquals("1979-05-27T07:32:00Z", out.toString());
    }


    //=========================================================================
    // Keys

    @Test
    public void testBareKeys()
    {
        assertTrue(TomlTextUtils.isBareKey("bare_key-1"));
        assertTrue(TomlTextUtils.isBareKey("1234"));
        assertFalse(TomlTextUtils.isBareKey(""));
        assertFalse(TomlTextUtils.isBareKey("a.b"));
        assertFalse(TomlTextUtils.isBareKey("with space"));
        assertFalse(TomlTextUtils.isBareKey("café"));
    }

    @Test
    public void testUtf8Length()
    {
        assertEquals(0, TomlTextUtils.utf8Length(""));
        assertEquals(3, TomlTextUtils.utf8Length("abc"));
        assertEquals(2, TomlTextUtils.utf8Length("é"));
        assertEquals(3, TomlTextUtils.utf8Length("€"));
        assertEquals(4, TomlTextUtils.utf8Length("😀"));
    }
}
