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
import java.io.IOException;
import java.math.BigDecimal;
import java.util.Locale;


/**
 * Utility methods for working with TOML's text tokens.
 * <p>
 * Every method here is locale-independent and stateless.
 */
public class TomlTextUtils
{
    public static final String INF_TOKEN = "inf";
    public static final String NEGATIVE_INF_TOKEN = "-inf";
    public static final String NAN_TOKEN = "nan";

    /** Finite floats in this range print without an exponent. */
    private static final double PLAIN_FLOAT_MIN = 1e7;
    private static final double PLAIN_FLOAT_LIMIT = 1e16;

    private static final boolean[] BARE_KEY_CHAR_FLAGS = new boolean[128];
    static
    {
        for (char c = 'a'; c <= 'z'; c++)
        {
            BARE_KEY_CHAR_FLAGS[c] = true;
            BARE_KEY_CHAR_FLAGS[Character.toUpperCase(c)] = true;
        }
        for (char c = '0'; c <= '9'; c++)
        {
            BARE_KEY_CHAR_FLAGS[c] = true;
        }
        BARE_KEY_CHAR_FLAGS['_'] = true;
        BARE_KEY_CHAR_FLAGS['-'] = true;
    }


    //=========================================================================
    // Character classification


    /**
     * Determines whether a character may appear in a bare (unquoted) key:
     * {@code A-Z a-z 0-9 _ -}.
     */
    public static boolean isBareKeyChar(char c)
    {
        return c < 128 && BARE_KEY_CHAR_FLAGS[c];
    }

    /**
     * Determines whether text can be printed as a bare key.
     *
     * @return false if {@code text} is empty or has any character outside
     * {@code A-Z a-z 0-9 _ -}.
     */
    public static boolean isBareKey(CharSequence text)
    {
        int len = text.length();
        if (len == 0) return false;

        for (int i = 0; i < len; i++)
        {
            if (!isBareKeyChar(text.charAt(i))) return false;
        }
        return true;
    }

    /**
     * Counts the bytes needed to encode text as UTF-8. Unpaired surrogates
     * count as three bytes each.
     */
    public static int utf8Length(CharSequence text)
    {
        int len = text.length();
        int bytes = 0;
        for (int i = 0; i < len; i++)
        {
            char c = text.charAt(i);
            if (c < 0x80)
            {
                bytes += 1;
            }
            else if (c < 0x800)
            {
                bytes += 2;
            }
            else if (Character.isHighSurrogate(c)
                     && i + 1 < len
                     && Character.isLowSurrogate(text.charAt(i + 1)))
            {
                bytes += 4;
                i++;
            }
            else
            {
                bytes += 3;
            }
        }
        return bytes;
    }


    //=========================================================================
    // Numbers


    /**
     * Prints an integer token.
     * <p>
     * Zero is always {@code 0}. A positive value with a non-decimal
     * {@code format} is printed with that base's prefix and uppercase digits;
     * negative values are always decimal.
     *
     * @param format the requested base; null means decimal.
     *
     * @throws IOException propagated when the {@code Appendable} throws it.
     */
    public static void printInteger(Appendable out, long value,
                                    ValueFormat format)
        throws IOException
    {
        if (value == 0)
        {
            out.append('0');
        }
        else if (value > 0 && format != null && format != ValueFormat.NONE)
        {
            out.append(format.getPrefix());
            out.append(Long.toString(value, format.getRadix())
                           .toUpperCase(Locale.ROOT));
        }
        else
        {
            out.append(Long.toString(value));
        }
    }

    /**
     * Prints a float token that reads back as the same {@code double}.
     * <p>
     * Infinities and NaN print as {@code inf}, {@code -inf} and {@code nan}.
     * Finite decimal text always has a fraction or an exponent, adding
     * {@code .0} when needed, so that it never reads back as an integer.
     * Magnitudes from 1e7 up to 1e16 print in plain notation, so
     * {@code 1e7} prints as {@code 10000000.0}.
     *
     * @param format {@link ValueFormat#HEXADECIMAL} prints a hexadecimal
     * float as {@link Double#toHexString(double)} does; anything else,
     * including null, means decimal.
     *
     * @throws IOException propagated when the {@code Appendable} throws it.
     */
    public static void printFloat(Appendable out, double value,
                                  ValueFormat format)
        throws IOException
    {
        if (Double.isNaN(value))
        {
            out.append(NAN_TOKEN);
        }
        else if (Double.isInfinite(value))
        {
            out.append(value > 0 ? INF_TOKEN : NEGATIVE_INF_TOKEN);
        }
        else if (format == ValueFormat.HEXADECIMAL)
        {
            out.append(Double.toHexString(value));
        }
        else
        {
            String text = Double.toString(value);
            double magnitude = Math.abs(value);
            if (magnitude >= PLAIN_FLOAT_MIN && magnitude < PLAIN_FLOAT_LIMIT)
            {
                // Double.toString switches to an exponent from 1e7 upward
                text = new BigDecimal(text).toPlainString();
            }
            out.append(text);
            if (text.indexOf('.') < 0
                && text.indexOf('e') < 0
                && text.indexOf('E') < 0)
            {
                out.append(".0");
            }
        }
    }


    //=========================================================================
    // Dates and times


    /**
     * Prints {@code YYYY-MM-DD}.
     *
     * @throws IOException propagated when the {@code Appendable} throws it.
     */
    public static void printDate(Appendable out, Date date)
        throws IOException
    {
        printDigits(out, date.getYear(), 4);
        out.append('-');
        printDigits(out, date.getMonth(), 2);
        out.append('-');
        printDigits(out, date.getDay(), 2);
    }

    /**
     * Prints {@code HH:MM:SS}, then a {@code .} and the nanoseconds without
     * trailing zeros when they aren't zero.
     *
     * @throws IOException propagated when the {@code Appendable} throws it.
     */
    public static void printTime(Appendable out, Time time)
        throws IOException
    {
        printDigits(out, time.getHour(), 2);
        out.append(':');
        printDigits(out, time.getMinute(), 2);
        out.append(':');
        printDigits(out, time.getSecond(), 2);

        int fraction = time.getNanosecond();
        if (fraction > 0 && fraction <= 999999999)
        {
            int digits = 9;
            while (fraction % 10 == 0)
            {
                fraction /= 10;
                digits--;
            }
            out.append('.');
            printDigits(out, fraction, digits);
        }
    }

    /**
     * Prints {@code Z} for a zero offset, otherwise the sign followed by
     * {@code HH:MM}.
     *
     * @throws IOException propagated when the {@code Appendable} throws it.
     */
    public static void printTimeOffset(Appendable out, TimeOffset offset)
        throws IOException
    {
        int minutes = offset.getMinutes();
        if (minutes == 0)
        {
            out.append('Z');
            return;
        }

        if (minutes < 0)
        {
            out.append('-');
            minutes = -minutes;
        }
        else
        {
            out.append('+');
        }

        int hours = minutes / 60;
        minutes -= hours * 60;
        if (hours == 0)
        {
            out.append("00");
        }
        else
        {
            printDigits(out, hours, 2);
        }
        out.append(':');
        printDigits(out, minutes, 2);
    }

    /**
     * Prints the date, {@code T} and the time, followed by the offset when
     * there is one.
     *
     * @throws IOException propagated when the {@code Appendable} throws it.
     */
    public static void printDateTime(Appendable out, DateTime dateTime)
        throws IOException
    {
        printDate(out, dateTime.getDate());
        out.append('T');
        printTime(out, dateTime.getTime());
        if (dateTime.hasOffset())
        {
            printTimeOffset(out, dateTime.getOffset());
        }
    }


    /**
     * Prints the low {@code length} decimal digits of a non-negative value,
     * zero-padded on the left.
     */
    private static void printDigits(Appendable out, int value, int length)
        throws IOException
    {
        char temp[] = new char[length];
        while (length > 0) {
            length--;
            int next = value / 10;
            temp[length] =  (char)('0' + (value - next*10));
            value = next;
        }
        for (char c : temp) {
            out.append(c);
        }
    }
}
