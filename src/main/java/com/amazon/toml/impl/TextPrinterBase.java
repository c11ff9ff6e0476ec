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

import com.amazon.toml.NodeType;
import com.amazon.toml.ParseError;
import com.amazon.toml.ParseResult;
import com.amazon.toml.SourcePosition;
import com.amazon.toml.SourceRegion;
import com.amazon.toml.TomlBoolean;
import com.amazon.toml.TomlDate;
import com.amazon.toml.TomlDateTime;
import com.amazon.toml.TomlException;
import com.amazon.toml.TomlFloat;
import com.amazon.toml.TomlInteger;
import com.amazon.toml.TomlNode;
import com.amazon.toml.TomlString;
import com.amazon.toml.TomlTime;
import com.amazon.toml.ValueFormat;
import com.amazon.toml.util.AbstractNodeVisitor;
import com.amazon.toml.util.TomlTextUtils;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Output primitives shared by the TOML and JSON printers: indentation,
 * newline tracking, string quoting and scalar values.
 * <p>
 * A printer prints one document to one sink and is then discarded, so all
 * of its state starts fresh for every print.
 */
abstract class TextPrinterBase
{
    private static final Logger LOG =
        LoggerFactory.getLogger(TextPrinterBase.class);

    private static final char[] HEX_CHARS = "0123456789ABCDEF".toCharArray();

    /** Assumed to have had {@link _Private_TomlFormatterBuilder#fillDefaults()} called. */
    final _Private_TomlFormatterBuilder _options;

    private final Appendable _out;
    private final CharSequence _indentString;
    private final int _indentColumns;

    private final String _infToken;
    private final String _negativeInfToken;
    private final String _nanToken;

    private final ScalarPrinter _scalarPrinter = new ScalarPrinter();

    private int _indent;

    /** True when nothing has been printed since the last newline. */
    private boolean _nakedNewline = true;


    TextPrinterBase(_Private_TomlFormatterBuilder options,
                    Appendable out,
                    String infToken,
                    String negativeInfToken,
                    String nanToken)
    {
        _options = options;
        _out = out;
        _indentString = options.getIndent();
        _indentColumns = indentColumns(_indentString);
        _infToken = infToken;
        _negativeInfToken = negativeInfToken;
        _nanToken = nanToken;
    }


    /**
     * Prints a document rooted at the given node.
     */
    abstract void print(TomlNode root)
        throws IOException;

    /**
     * Prints the table of a successful parse, or else the diagnostic text of
     * the failure.
     */
    final void print(ParseResult result)
        throws IOException
    {
        if (result.succeeded())
        {
            print(result.getTable());
        }
        else
        {
            printFailedParse(result.getError());
        }
    }

    private void printFailedParse(ParseError error)
        throws IOException
    {
        SourceRegion source = error.getSource();
        if (LOG.isDebugEnabled())
        {
            LOG.debug("Printing parse failure at {} instead of a document",
                      source);
        }

        SourcePosition begin = source.getBegin();
        printUnformatted(error.getDescription());
        printUnformatted("\n\t(error occurred at line ");
        printUnformatted(Integer.toString(begin.getLine()));
        printUnformatted(", column ");
        printUnformatted(Integer.toString(begin.getColumn()));
        if (source.hasPath())
        {
            printUnformatted(" of '");
            printUnformatted(source.getPath());
            printUnformatted("'");
        }
        printUnformatted(")");
    }


    //=========================================================================
    // Indentation


    /**
     * Counts the columns taken by one level of indentation: four per tab,
     * one per other character.
     */
    static int indentColumns(CharSequence indent)
    {
        int columns = 0;
        for (int i = 0; i < indent.length(); i++)
        {
            columns += (indent.charAt(i) == '\t' ? 4 : 1);
        }
        return columns;
    }

    final int indentColumns()
    {
        return _indentColumns;
    }

    /**
     * Gets the current indentation depth, which may be negative: a negative
     * depth prints like zero.
     */
    final int getIndent()
    {
        return _indent;
    }

    final void setIndent(int indent)
    {
        _indent = indent;
    }

    final void increaseIndent()
    {
        _indent++;
    }

    final void decreaseIndent()
    {
        _indent--;
    }

    final void printIndent()
        throws IOException
    {
        for (int i = 0; i < _indent; i++)
        {
            _out.append(_indentString);
            _nakedNewline = false;
        }
    }


    //=========================================================================
    // Raw output


    /**
     * Starts a new line, unless nothing has been printed since the last one
     * and {@code force} is false.
     */
    final void printNewline(boolean force)
        throws IOException
    {
        if (!_nakedNewline || force)
        {
            _out.append('\n');
            _nakedNewline = true;
        }
    }

    final void printNewline()
        throws IOException
    {
        printNewline(false);
    }

    final void clearNakedNewline()
    {
        _nakedNewline = false;
    }

    final void printUnformatted(CharSequence text)
        throws IOException
    {
        _out.append(text);
        _nakedNewline = false;
    }

    final void printUnformatted(char c)
        throws IOException
    {
        _out.append(c);
        _nakedNewline = false;
    }


    //=========================================================================
    // Strings


    /**
     * Prints a string token, choosing the lightest form the options allow.
     *
     * @param allowMultiLine whether text with line breaks may use the
     * triple-quoted forms.
     * @param allowBare whether text made only of bare-key characters may be
     * printed without quotes. Only keys allow this.
     */
    final void printString(CharSequence text,
                           boolean allowMultiLine,
                           boolean allowBare)
        throws IOException
    {
        final boolean literalAllowed = _options.isLiteralStringsAllowed();

        if (text.length() == 0)
        {
            printUnformatted(literalAllowed ? "''" : "\"\"");
            return;
        }

        if (allowBare && TomlTextUtils.isBareKey(text))
        {
            printUnformatted(text);
            return;
        }

        boolean lineBreaks = false;
        boolean tabs = false;
        boolean singleQuotes = false;
        boolean controlChars = false;
        boolean unicode = false;
        for (int i = 0; i < text.length(); i++)
        {
            char c = text.charAt(i);
            switch (c)
            {
                case '\n':
                    lineBreaks = true;
                    break;
                case '\t':
                    tabs = true;
                    break;
                case '\'':
                    singleQuotes = true;
                    break;
                default:
                    if (isControlChar(c))
                    {
                        controlChars = true;
                    }
                    else if (Character.isSurrogate(c))
                    {
                        if (isSurrogatePair(text, i))
                        {
                            unicode = true;
                            i++;
                        }
                        else
                        {
                            // unpaired, so it must be escaped
                            controlChars = true;
                        }
                    }
                    else if (c >= 0x80)
                    {
                        unicode = true;
                    }
                    break;
            }
        }

        final boolean unicodeAllowed = _options.isUnicodeStringsAllowed();
        final boolean realTabs = _options.isRealTabsInStringsAllowed();

        final boolean multiLine = allowMultiLine
                               && _options.isMultiLineStringsAllowed()
                               && lineBreaks;

        final boolean literal = literalAllowed
                             && !controlChars
                             && (!singleQuotes || multiLine)
                             && (!tabs || realTabs)
                             && (!lineBreaks || multiLine)
                             && (!unicode || unicodeAllowed)
                             && !(multiLine && contains(text, "'''"));

        // A newline right after the opening delimiter is dropped by parsers.
        final boolean leadingNewline = multiLine && text.charAt(0) == '\n';

        if (literal)
        {
            String quote = multiLine ? "'''" : "'";
            printUnformatted(quote);
            if (leadingNewline) printUnformatted('\n');
            printUnformatted(text);
            printUnformatted(quote);
            return;
        }

        String quote = multiLine ? "\"\"\"" : "\"";
        printUnformatted(quote);
        if (leadingNewline) printUnformatted('\n');
        printEscaped(text, multiLine, unicodeAllowed, realTabs);
        printUnformatted(quote);
    }

    private void printEscaped(CharSequence text,
                              boolean multiLine,
                              boolean unicodeAllowed,
                              boolean realTabs)
        throws IOException
    {
        for (int i = 0; i < text.length(); i++)
        {
            char c = text.charAt(i);
            switch (c)
            {
                case '"':  printUnformatted("\\\""); break;
                case '\\': printUnformatted("\\\\"); break;
                case '\t':
                    printUnformatted(realTabs ? "\t" : "\\t");
                    break;
                case '\n':
                    printUnformatted(multiLine ? "\n" : "\\n");
                    break;
                case '\b': printUnformatted("\\b"); break;
                case '\f': printUnformatted("\\f"); break;
                case '\r': printUnformatted("\\r"); break;
                default:
                    if (isControlChar(c))
                    {
                        printUnicodeEscape(c, 4);
                    }
                    else if (isSurrogatePair(text, i))
                    {
                        char low = text.charAt(++i);
                        if (unicodeAllowed)
                        {
                            printUnformatted(c);
                            printUnformatted(low);
                        }
                        else
                        {
                            printUnicodeEscape(Character.toCodePoint(c, low), 8);
                        }
                    }
                    else if (Character.isSurrogate(c))
                    {
                        // unpaired, so not representable
                        printUnicodeEscape(0xFFFD, 4);
                    }
                    else if (c < 0x80 || unicodeAllowed)
                    {
                        printUnformatted(c);
                    }
                    else
                    {
                        printUnicodeEscape(c, 4);
                    }
                    break;
            }
        }
    }

    /**
     * Prints {@code \}{@code uXXXX} or {@code \}{@code UXXXXXXXX} with
     * uppercase digits.
     */
    private void printUnicodeEscape(int codePoint, int digits)
        throws IOException
    {
        char[] escape = new char[digits + 2];
        escape[0] = '\\';
        escape[1] = (digits == 4 ? 'u' : 'U');
        for (int i = digits + 1; i > 1; i--)
        {
            escape[i] = HEX_CHARS[codePoint & 0xF];
            codePoint >>>= 4;
        }
        printUnformatted(new String(escape));
    }

    /**
     * Control characters other than tab and line feed, including DEL and the
     * non-ASCII line separators.
     */
    private static boolean isControlChar(char c)
    {
        return (c < 0x20 && c != '\t' && c != '\n')
            || c == 0x7F
            || c == 0x85
            || c == 0x2028
            || c == 0x2029;
    }

    private static boolean isSurrogatePair(CharSequence text, int i)
    {
        return Character.isHighSurrogate(text.charAt(i))
            && i + 1 < text.length()
            && Character.isLowSurrogate(text.charAt(i + 1));
    }

    private static boolean contains(CharSequence text, String s)
    {
        return text.toString().indexOf(s) >= 0;
    }


    //=========================================================================
    // Scalars


    /**
     * Prints a scalar node.
     *
     * @throws IllegalStateException if {@code value} is a container.
     */
    final void printValue(TomlNode value)
        throws IOException
    {
        try
        {
            value.accept(_scalarPrinter);
        }
        catch (IOException | RuntimeException e)
        {
            throw e;
        }
        catch (Exception e)
        {
            throw new TomlException(e);
        }
    }

    final void printInteger(TomlInteger value)
        throws IOException
    {
        long v = value.longValue();
        ValueFormat format = value.getFormat();
        if (!isFormatAllowed(format))
        {
            format = ValueFormat.NONE;
        }

        StringBuilder buffer = new StringBuilder(24);
        TomlTextUtils.printInteger(buffer, v, format);
        printUnformatted(buffer);
    }

    private boolean isFormatAllowed(ValueFormat format)
    {
        switch (format)
        {
            case BINARY:      return _options.isBinaryIntegersAllowed();
            case OCTAL:       return _options.isOctalIntegersAllowed();
            case HEXADECIMAL: return _options.isHexadecimalIntegersAllowed();
            default:          return false;
        }
    }

    final void printFloat(TomlFloat value)
        throws IOException
    {
        double v = value.doubleValue();

        String special = null;
        if (Double.isNaN(v))
        {
            special = _nanToken;
        }
        else if (v == Double.POSITIVE_INFINITY)
        {
            special = _infToken;
        }
        else if (v == Double.NEGATIVE_INFINITY)
        {
            special = _negativeInfToken;
        }

        if (special != null)
        {
            if (_options.getQuoteInfinitiesAndNans())
            {
                printUnformatted('"');
                printUnformatted(special);
                printUnformatted('"');
            }
            else
            {
                printUnformatted(special);
            }
            return;
        }

        // Floats always print in decimal; the hint is not honored.
        StringBuilder buffer = new StringBuilder(26);
        TomlTextUtils.printFloat(buffer, v, ValueFormat.NONE);
        printUnformatted(buffer);
    }

    /**
     * Prints a date, time or date-time token, quoted when the options say
     * so.
     */
    private void printTemporal(CharSequence text)
        throws IOException
    {
        if (_options.getQuoteDatesAndTimes())
        {
            char quote = _options.isLiteralStringsAllowed() ? '\'' : '"';
            printUnformatted(quote);
            printUnformatted(text);
            printUnformatted(quote);
        }
        else
        {
            printUnformatted(text);
        }
    }


    private final class ScalarPrinter
        extends AbstractNodeVisitor
    {
        @Override
        protected void defaultVisit(TomlNode value)
        {
            NodeType type = value.getType();
            throw new IllegalStateException("unexpected type " + type);
        }

        @Override
        public void visit(TomlString value) throws IOException
        {
            printString(value.stringValue(), true, false);
        }

        @Override
        public void visit(TomlInteger value) throws IOException
        {
            printInteger(value);
        }

        @Override
        public void visit(TomlFloat value) throws IOException
        {
            printFloat(value);
        }

        @Override
        public void visit(TomlBoolean value) throws IOException
        {
            printUnformatted(value.booleanValue() ? "true" : "false");
        }

        @Override
        public void visit(TomlDate value) throws IOException
        {
            printTemporal(value.dateValue().toString());
        }

        @Override
        public void visit(TomlTime value) throws IOException
        {
            printTemporal(value.timeValue().toString());
        }

        @Override
        public void visit(TomlDateTime value) throws IOException
        {
            printTemporal(value.dateTimeValue().toString());
        }
    }
}
