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

package com.amazon.toml.system;

import com.amazon.toml.ParseResult;
import com.amazon.toml.TomlFormatter;
import com.amazon.toml.TomlNode;
import com.amazon.toml.impl._Private_TomlFormatterBuilder;

/**
 * The builder for creating {@link TomlFormatter}s.
 * <p>
 * <b>WARNING:</b> This class should not be extended by code outside of
 * this library.
 * <p>
 * Builders may be configured once and reused to construct multiple
 * objects.
 * <p>
 * <b>Instances of this class are not safe for use by multiple threads
 * unless they are {@linkplain #immutable() immutable}.</b>
 * <p>
 * The most general approach is to use the {@link #standard()} builder,
 * which prints canonical TOML:
 *<pre>
 *    String text = TomlFormatterBuilder.standard().build(table).toString();
 *</pre>
 * The {@link #json()} builder prints the same tree as JSON instead.
 *
 * <p>
 * Configuration properties follow the standard JavaBeans idiom in order to be
 * friendly to dependency injection systems.  They also provide alternative
 * {@code with...()} mutation methods that enable a more fluid style.
 */
public abstract class TomlFormatterBuilder
{
    /**
     * The text syntax printed by built formatters.
     */
    public enum Syntax
    {
        /**
         * Canonical TOML, choosing between inline and block layout by width.
         */
        TOML,

        /**
         * JSON, one member or element per line. Some options are forced in
         * this syntax; see {@link TomlFormatterBuilder#withJsonSyntax()}.
         */
        JSON
    }

    /** The indentation used when none is configured: four spaces. */
    public static final CharSequence DEFAULT_INDENT = "    ";


    /**
     * The standard builder of {@link TomlFormatter}s, with all configuration
     * properties having their default values. The output is canonical TOML.
     *
     * @return a new, mutable builder instance.
     *
     * @see #json()
     */
    public static TomlFormatterBuilder standard()
    {
        return _Private_TomlFormatterBuilder.standard();
    }

    /**
     * Creates a builder preconfigured for JSON output.
     *
     * @return a new, mutable builder instance.
     *
     * @see #withJsonSyntax()
     */
    public static TomlFormatterBuilder json()
    {
        return standard().withJsonSyntax();
    }

    //=========================================================================

    private Syntax mySyntax;
    private CharSequence myIndent;
    private boolean myLiteralStringsAllowed;
    private boolean myMultiLineStringsAllowed;
    private boolean myUnicodeStringsAllowed;
    private boolean myRealTabsInStringsAllowed;
    private boolean myBinaryIntegersAllowed;
    private boolean myOctalIntegersAllowed;
    private boolean myHexadecimalIntegersAllowed;
    private boolean myIndentArrayElements;
    private boolean myIndentSubTables;
    private boolean myQuoteDatesAndTimes;
    private boolean myQuoteInfinitiesAndNans;
    private boolean myTerseKeyValuePairs;


    /** NOT FOR APPLICATION USE! */
    protected TomlFormatterBuilder()
    {
        mySyntax                       = Syntax.TOML;
        myLiteralStringsAllowed        = true;
        myMultiLineStringsAllowed      = true;
        myUnicodeStringsAllowed        = false;
        myRealTabsInStringsAllowed     = false;
        myBinaryIntegersAllowed        = true;
        myOctalIntegersAllowed         = true;
        myHexadecimalIntegersAllowed   = true;
        myIndentArrayElements          = true;
        myIndentSubTables              = true;
        myQuoteDatesAndTimes           = false;
        myQuoteInfinitiesAndNans       = false;
        myTerseKeyValuePairs           = false;
    }

    /** NOT FOR APPLICATION USE! */
    protected TomlFormatterBuilder(TomlFormatterBuilder that)
    {
        this.mySyntax                       = that.mySyntax;
        this.myIndent                       = that.myIndent;
        this.myLiteralStringsAllowed        = that.myLiteralStringsAllowed;
        this.myMultiLineStringsAllowed      = that.myMultiLineStringsAllowed;
        this.myUnicodeStringsAllowed        = that.myUnicodeStringsAllowed;
        this.myRealTabsInStringsAllowed     = that.myRealTabsInStringsAllowed;
        this.myBinaryIntegersAllowed        = that.myBinaryIntegersAllowed;
        this.myOctalIntegersAllowed         = that.myOctalIntegersAllowed;
        this.myHexadecimalIntegersAllowed   = that.myHexadecimalIntegersAllowed;
        this.myIndentArrayElements          = that.myIndentArrayElements;
        this.myIndentSubTables              = that.myIndentSubTables;
        this.myQuoteDatesAndTimes           = that.myQuoteDatesAndTimes;
        this.myQuoteInfinitiesAndNans       = that.myQuoteInfinitiesAndNans;
        this.myTerseKeyValuePairs           = that.myTerseKeyValuePairs;
    }


    //=========================================================================


    /**
     * Creates a mutable copy of this builder.
     *
     * @return a new builder with the same configuration as {@code this}.
     */
    public abstract TomlFormatterBuilder copy();

    /**
     * Returns an immutable builder configured exactly like this one.
     *
     * @return this instance, if immutable;
     * otherwise an immutable copy of this instance.
     */
    public abstract TomlFormatterBuilder immutable();

    /**
     * Returns a mutable builder configured exactly like this one.
     *
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     */
    public abstract TomlFormatterBuilder mutable();


    /** NOT FOR APPLICATION USE! */
    protected void mutationCheck()
    {
        throw new UnsupportedOperationException("This builder is immutable");
    }


    //-------------------------------------------------------------------------

    /**
     * Gets the syntax printed by built formatters.
     * Default is {@link Syntax#TOML}.
     *
     * @see #setSyntax(Syntax)
     * @see #withSyntax(Syntax)
     */
    public final Syntax getSyntax()
    {
        return mySyntax;
    }

    /**
     * Sets the syntax printed by built formatters.
     *
     * @param syntax must not be null.
     *
     * @see #getSyntax()
     * @see #withSyntax(Syntax)
     *
     * @throws UnsupportedOperationException if this is immutable.
     * @throws NullPointerException if {@code syntax} is null.
     */
    public void setSyntax(Syntax syntax)
    {
        mutationCheck();
        if (syntax == null) throw new NullPointerException("syntax is null");
        mySyntax                       = syntax;
    }

    /**
     * Declares the syntax printed by built formatters,
     * returning a new mutable builder if this is immutable.
     *
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     *
     * @see #getSyntax()
     * @see #setSyntax(Syntax)
     */
    public final TomlFormatterBuilder withSyntax(Syntax syntax)
    {
        TomlFormatterBuilder b = mutable();
        b.setSyntax(syntax);
        return b;
    }

    /**
     * Declares that built formatters print JSON.
     * <p>
     * JSON can't express everything TOML can, so the following options are
     * forced when the formatter is built, whatever their configured value:
     * <ul>
     *   <li>literal, multi-line and non-decimal integer output is disabled;
     *   <li>tabs in strings are escaped;
     *   <li>unicode strings are allowed;
     *   <li>dates, times, infinities and NaN are printed as strings.
     * </ul>
     * This method also sets those options, so that the getters agree.
     *
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     */
    public abstract TomlFormatterBuilder withJsonSyntax();


    //-------------------------------------------------------------------------

    /**
     * Gets the text printed once per level of indentation.
     *
     * @return may be null, denoting the default of {@link #DEFAULT_INDENT}.
     *
     * @see #setIndent(CharSequence)
     * @see #withIndent(CharSequence)
     */
    public final CharSequence getIndent()
    {
        return myIndent;
    }

    /**
     * Sets the text printed once per level of indentation. For the layout
     * width estimate a tab counts as four columns and any other character as
     * one.
     *
     * @param indent may be null, denoting the default of
     * {@link #DEFAULT_INDENT}. May be empty to disable indentation.
     *
     * @see #getIndent()
     * @see #withIndent(CharSequence)
     *
     * @throws UnsupportedOperationException if this is immutable.
     * @throws IllegalArgumentException if {@code indent} holds anything
     * other than spaces and tabs.
     */
    public void setIndent(CharSequence indent)
    {
        mutationCheck();
        if (indent != null)
        {
            for (int i = 0; i < indent.length(); i++)
            {
                char c = indent.charAt(i);
                if (c != ' ' && c != '\t')
                {
                    throw new IllegalArgumentException("Indent must hold only spaces and tabs: \""
                                                       + indent + "\"");
                }
            }
            indent = indent.toString();
        }
        myIndent                       = indent;
    }

    /**
     * Declares the text printed once per level of indentation,
     * returning a new mutable builder if this is immutable.
     *
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     *
     * @see #getIndent()
     * @see #setIndent(CharSequence)
     */
    public final TomlFormatterBuilder withIndent(CharSequence indent)
    {
        TomlFormatterBuilder b = mutable();
        b.setIndent(indent);
        return b;
    }

    //-------------------------------------------------------------------------

    /**
     * Determines whether literal strings ({@code '...'}) may be printed when the text needs no escapes.
     * Default is true.
     *
     * @see #setLiteralStringsAllowed(boolean)
     * @see #withLiteralStringsAllowed(boolean)
     */
    public final boolean isLiteralStringsAllowed()
    {
        return myLiteralStringsAllowed;
    }

    /**
     * Sets whether literal strings ({@code '...'}) may be printed when the text needs no escapes.
     *
     * @see #isLiteralStringsAllowed()
     * @see #withLiteralStringsAllowed(boolean)
     *
     * @throws UnsupportedOperationException if this is immutable.
     */
    public void setLiteralStringsAllowed(boolean value)
    {
        mutationCheck();
        myLiteralStringsAllowed        = value;
    }

    /**
     * Declares whether literal strings ({@code '...'}) may be printed when the text needs no escapes,
     * returning a new mutable builder if this is immutable.
     *
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     *
     * @see #isLiteralStringsAllowed()
     * @see #setLiteralStringsAllowed(boolean)
     */
    public final TomlFormatterBuilder withLiteralStringsAllowed(boolean value)
    {
        TomlFormatterBuilder b = mutable();
        b.setLiteralStringsAllowed(value);
        return b;
    }

    //-------------------------------------------------------------------------

    /**
     * Determines whether strings holding line breaks may be printed in multi-line form.
     * Default is true.
     *
     * @see #setMultiLineStringsAllowed(boolean)
     * @see #withMultiLineStringsAllowed(boolean)
     */
    public final boolean isMultiLineStringsAllowed()
    {
        return myMultiLineStringsAllowed;
    }

    /**
     * Sets whether strings holding line breaks may be printed in multi-line form.
     *
     * @see #isMultiLineStringsAllowed()
     * @see #withMultiLineStringsAllowed(boolean)
     *
     * @throws UnsupportedOperationException if this is immutable.
     */
    public void setMultiLineStringsAllowed(boolean value)
    {
        mutationCheck();
        myMultiLineStringsAllowed      = value;
    }

    /**
     * Declares whether strings holding line breaks may be printed in multi-line form,
     * returning a new mutable builder if this is immutable.
     *
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     *
     * @see #isMultiLineStringsAllowed()
     * @see #setMultiLineStringsAllowed(boolean)
     */
    public final TomlFormatterBuilder withMultiLineStringsAllowed(boolean value)
    {
        TomlFormatterBuilder b = mutable();
        b.setMultiLineStringsAllowed(value);
        return b;
    }

    //-------------------------------------------------------------------------

    /**
     * Determines whether non-ASCII characters are printed as-is rather than escaped.
     * Default is false.
     *
     * @see #setUnicodeStringsAllowed(boolean)
     * @see #withUnicodeStringsAllowed(boolean)
     */
    public final boolean isUnicodeStringsAllowed()
    {
        return myUnicodeStringsAllowed;
    }

    /**
     * Sets whether non-ASCII characters are printed as-is rather than escaped.
     *
     * @see #isUnicodeStringsAllowed()
     * @see #withUnicodeStringsAllowed(boolean)
     *
     * @throws UnsupportedOperationException if this is immutable.
     */
    public void setUnicodeStringsAllowed(boolean value)
    {
        mutationCheck();
        myUnicodeStringsAllowed        = value;
    }

    /**
     * Declares whether non-ASCII characters are printed as-is rather than escaped,
     * returning a new mutable builder if this is immutable.
     *
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     *
     * @see #isUnicodeStringsAllowed()
     * @see #setUnicodeStringsAllowed(boolean)
     */
    public final TomlFormatterBuilder withUnicodeStringsAllowed(boolean value)
    {
        TomlFormatterBuilder b = mutable();
        b.setUnicodeStringsAllowed(value);
        return b;
    }

    //-------------------------------------------------------------------------

    /**
     * Determines whether tab characters are printed as-is rather than escaped.
     * Default is false, and JSON output always escapes them.
     *
     * @see #setRealTabsInStringsAllowed(boolean)
     * @see #withRealTabsInStringsAllowed(boolean)
     */
    public final boolean isRealTabsInStringsAllowed()
    {
        return myRealTabsInStringsAllowed;
    }

    /**
     * Sets whether tab characters are printed as-is rather than escaped.
     *
     * @see #isRealTabsInStringsAllowed()
     * @see #withRealTabsInStringsAllowed(boolean)
     *
     * @throws UnsupportedOperationException if this is immutable.
     */
    public void setRealTabsInStringsAllowed(boolean value)
    {
        mutationCheck();
        myRealTabsInStringsAllowed     = value;
    }

    /**
     * Declares whether tab characters are printed as-is rather than escaped,
     * returning a new mutable builder if this is immutable.
     *
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     *
     * @see #isRealTabsInStringsAllowed()
     * @see #setRealTabsInStringsAllowed(boolean)
     */
    public final TomlFormatterBuilder withRealTabsInStringsAllowed(boolean value)
    {
        TomlFormatterBuilder b = mutable();
        b.setRealTabsInStringsAllowed(value);
        return b;
    }

    //-------------------------------------------------------------------------

    /**
     * Determines whether integers hinting {@link com.amazon.toml.ValueFormat#BINARY} print in binary.
     * Default is true.
     *
     * @see #setBinaryIntegersAllowed(boolean)
     * @see #withBinaryIntegersAllowed(boolean)
     */
    public final boolean isBinaryIntegersAllowed()
    {
        return myBinaryIntegersAllowed;
    }

    /**
     * Sets whether integers hinting {@link com.amazon.toml.ValueFormat#BINARY} print in binary.
     *
     * @see #isBinaryIntegersAllowed()
     * @see #withBinaryIntegersAllowed(boolean)
     *
     * @throws UnsupportedOperationException if this is immutable.
     */
    public void setBinaryIntegersAllowed(boolean value)
    {
        mutationCheck();
        myBinaryIntegersAllowed        = value;
    }

    /**
     * Declares whether integers hinting {@link com.amazon.toml.ValueFormat#BINARY} print in binary,
     * returning a new mutable builder if this is immutable.
     *
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     *
     * @see #isBinaryIntegersAllowed()
     * @see #setBinaryIntegersAllowed(boolean)
     */
    public final TomlFormatterBuilder withBinaryIntegersAllowed(boolean value)
    {
        TomlFormatterBuilder b = mutable();
        b.setBinaryIntegersAllowed(value);
        return b;
    }

    //-------------------------------------------------------------------------

    /**
     * Determines whether integers hinting {@link com.amazon.toml.ValueFormat#OCTAL} print in octal.
     * Default is true.
     *
     * @see #setOctalIntegersAllowed(boolean)
     * @see #withOctalIntegersAllowed(boolean)
     */
    public final boolean isOctalIntegersAllowed()
    {
        return myOctalIntegersAllowed;
    }

    /**
     * Sets whether integers hinting {@link com.amazon.toml.ValueFormat#OCTAL} print in octal.
     *
     * @see #isOctalIntegersAllowed()
     * @see #withOctalIntegersAllowed(boolean)
     *
     * @throws UnsupportedOperationException if this is immutable.
     */
    public void setOctalIntegersAllowed(boolean value)
    {
        mutationCheck();
        myOctalIntegersAllowed         = value;
    }

    /**
     * Declares whether integers hinting {@link com.amazon.toml.ValueFormat#OCTAL} print in octal,
     * returning a new mutable builder if this is immutable.
     *
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     *
     * @see #isOctalIntegersAllowed()
     * @see #setOctalIntegersAllowed(boolean)
     */
    public final TomlFormatterBuilder withOctalIntegersAllowed(boolean value)
    {
        TomlFormatterBuilder b = mutable();
        b.setOctalIntegersAllowed(value);
        return b;
    }

    //-------------------------------------------------------------------------

    /**
     * Determines whether integers hinting {@link com.amazon.toml.ValueFormat#HEXADECIMAL} print in hexadecimal.
     * Default is true.
     *
     * @see #setHexadecimalIntegersAllowed(boolean)
     * @see #withHexadecimalIntegersAllowed(boolean)
     */
    public final boolean isHexadecimalIntegersAllowed()
    {
        return myHexadecimalIntegersAllowed;
    }

    /**
     * Sets whether integers hinting {@link com.amazon.toml.ValueFormat#HEXADECIMAL} print in hexadecimal.
     *
     * @see #isHexadecimalIntegersAllowed()
     * @see #withHexadecimalIntegersAllowed(boolean)
     *
     * @throws UnsupportedOperationException if this is immutable.
     */
    public void setHexadecimalIntegersAllowed(boolean value)
    {
        mutationCheck();
        myHexadecimalIntegersAllowed   = value;
    }

    /**
     * Declares whether integers hinting {@link com.amazon.toml.ValueFormat#HEXADECIMAL} print in hexadecimal,
     * returning a new mutable builder if this is immutable.
     *
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     *
     * @see #isHexadecimalIntegersAllowed()
     * @see #setHexadecimalIntegersAllowed(boolean)
     */
    public final TomlFormatterBuilder withHexadecimalIntegersAllowed(boolean value)
    {
        TomlFormatterBuilder b = mutable();
        b.setHexadecimalIntegersAllowed(value);
        return b;
    }

    //-------------------------------------------------------------------------

    /**
     * Determines whether the elements of a multi-line array are indented one level deeper than its brackets.
     * Default is true.
     *
     * @see #setIndentArrayElements(boolean)
     * @see #withIndentArrayElements(boolean)
     */
    public final boolean getIndentArrayElements()
    {
        return myIndentArrayElements;
    }

    /**
     * Sets whether the elements of a multi-line array are indented one level deeper than its brackets.
     *
     * @see #getIndentArrayElements()
     * @see #withIndentArrayElements(boolean)
     *
     * @throws UnsupportedOperationException if this is immutable.
     */
    public void setIndentArrayElements(boolean value)
    {
        mutationCheck();
        myIndentArrayElements          = value;
    }

    /**
     * Declares whether the elements of a multi-line array are indented one level deeper than its brackets,
     * returning a new mutable builder if this is immutable.
     *
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     *
     * @see #getIndentArrayElements()
     * @see #setIndentArrayElements(boolean)
     */
    public final TomlFormatterBuilder withIndentArrayElements(boolean value)
    {
        TomlFormatterBuilder b = mutable();
        b.setIndentArrayElements(value);
        return b;
    }

    //-------------------------------------------------------------------------

    /**
     * Determines whether nested table sections are indented one level per depth.
     * Default is true.
     *
     * @see #setIndentSubTables(boolean)
     * @see #withIndentSubTables(boolean)
     */
    public final boolean getIndentSubTables()
    {
        return myIndentSubTables;
    }

    /**
     * Sets whether nested table sections are indented one level per depth.
     *
     * @see #getIndentSubTables()
     * @see #withIndentSubTables(boolean)
     *
     * @throws UnsupportedOperationException if this is immutable.
     */
    public void setIndentSubTables(boolean value)
    {
        mutationCheck();
        myIndentSubTables              = value;
    }

    /**
     * Declares whether nested table sections are indented one level per depth,
     * returning a new mutable builder if this is immutable.
     *
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     *
     * @see #getIndentSubTables()
     * @see #setIndentSubTables(boolean)
     */
    public final TomlFormatterBuilder withIndentSubTables(boolean value)
    {
        TomlFormatterBuilder b = mutable();
        b.setIndentSubTables(value);
        return b;
    }

    //-------------------------------------------------------------------------

    /**
     * Determines whether dates, times and date-times are printed as quoted strings.
     * Default is false.
     *
     * @see #setQuoteDatesAndTimes(boolean)
     * @see #withQuoteDatesAndTimes(boolean)
     */
    public final boolean getQuoteDatesAndTimes()
    {
        return myQuoteDatesAndTimes;
    }

    /**
     * Sets whether dates, times and date-times are printed as quoted strings.
     *
     * @see #getQuoteDatesAndTimes()
     * @see #withQuoteDatesAndTimes(boolean)
     *
     * @throws UnsupportedOperationException if this is immutable.
     */
    public void setQuoteDatesAndTimes(boolean value)
    {
        mutationCheck();
        myQuoteDatesAndTimes           = value;
    }

    /**
     * Declares whether dates, times and date-times are printed as quoted strings,
     * returning a new mutable builder if this is immutable.
     *
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     *
     * @see #getQuoteDatesAndTimes()
     * @see #setQuoteDatesAndTimes(boolean)
     */
    public final TomlFormatterBuilder withQuoteDatesAndTimes(boolean value)
    {
        TomlFormatterBuilder b = mutable();
        b.setQuoteDatesAndTimes(value);
        return b;
    }

    //-------------------------------------------------------------------------

    /**
     * Determines whether infinities and NaN are printed as quoted strings.
     * Default is false.
     *
     * @see #setQuoteInfinitiesAndNans(boolean)
     * @see #withQuoteInfinitiesAndNans(boolean)
     */
    public final boolean getQuoteInfinitiesAndNans()
    {
        return myQuoteInfinitiesAndNans;
    }

    /**
     * Sets whether infinities and NaN are printed as quoted strings.
     *
     * @see #getQuoteInfinitiesAndNans()
     * @see #withQuoteInfinitiesAndNans(boolean)
     *
     * @throws UnsupportedOperationException if this is immutable.
     */
    public void setQuoteInfinitiesAndNans(boolean value)
    {
        mutationCheck();
        myQuoteInfinitiesAndNans       = value;
    }

    /**
     * Declares whether infinities and NaN are printed as quoted strings,
     * returning a new mutable builder if this is immutable.
     *
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     *
     * @see #getQuoteInfinitiesAndNans()
     * @see #setQuoteInfinitiesAndNans(boolean)
     */
    public final TomlFormatterBuilder withQuoteInfinitiesAndNans(boolean value)
    {
        TomlFormatterBuilder b = mutable();
        b.setQuoteInfinitiesAndNans(value);
        return b;
    }

    //-------------------------------------------------------------------------

    /**
     * Determines whether key/value pairs are printed without spaces around the separator.
     * Default is false.
     *
     * @see #setTerseKeyValuePairs(boolean)
     * @see #withTerseKeyValuePairs(boolean)
     */
    public final boolean getTerseKeyValuePairs()
    {
        return myTerseKeyValuePairs;
    }

    /**
     * Sets whether key/value pairs are printed without spaces around the separator.
     *
     * @see #getTerseKeyValuePairs()
     * @see #withTerseKeyValuePairs(boolean)
     *
     * @throws UnsupportedOperationException if this is immutable.
     */
    public void setTerseKeyValuePairs(boolean value)
    {
        mutationCheck();
        myTerseKeyValuePairs           = value;
    }

    /**
     * Declares whether key/value pairs are printed without spaces around the separator,
     * returning a new mutable builder if this is immutable.
     *
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     *
     * @see #getTerseKeyValuePairs()
     * @see #setTerseKeyValuePairs(boolean)
     */
    public final TomlFormatterBuilder withTerseKeyValuePairs(boolean value)
    {
        TomlFormatterBuilder b = mutable();
        b.setTerseKeyValuePairs(value);
        return b;
    }


    //=========================================================================


    /**
     * Creates a formatter that prints the given node as the root of a
     * document.
     *
     * @param root the node to print; typically a table.
     *
     * @return a new, immutable formatter.
     *
     * @throws NullPointerException if {@code root} is null.
     */
    public abstract TomlFormatter build(TomlNode root);

    /**
     * Creates a formatter that prints a parse result: its table when parsing
     * succeeded, otherwise the error's description and location as plain
     * text.
     *
     * @return a new, immutable formatter.
     *
     * @throws NullPointerException if {@code result} is null.
     */
    public abstract TomlFormatter build(ParseResult result);
}
