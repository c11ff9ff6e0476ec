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

import com.amazon.toml.ParseResult;
import com.amazon.toml.TomlFormatter;
import com.amazon.toml.TomlNode;
import com.amazon.toml.system.TomlFormatterBuilder;

/**
 * Contains configuration for TOML and JSON formatters.
 * NOT FOR APPLICATION USE!
 */
public class _Private_TomlFormatterBuilder
    extends TomlFormatterBuilder
{
    public static _Private_TomlFormatterBuilder standard()
    {
        return new _Private_TomlFormatterBuilder.Mutable();
    }

    public static final _Private_TomlFormatterBuilder STANDARD =
        standard().immutable();


    private _Private_TomlFormatterBuilder()
    {
        super();
    }

    private _Private_TomlFormatterBuilder(_Private_TomlFormatterBuilder that)
    {
        super(that);
    }


    @Override
    public final _Private_TomlFormatterBuilder copy()
    {
        return new Mutable(this);
    }

    @Override
    public _Private_TomlFormatterBuilder immutable()
    {
        return this;
    }

    @Override
    public _Private_TomlFormatterBuilder mutable()
    {
        return copy();
    }

    //=========================================================================

    @Override
    public final TomlFormatterBuilder withJsonSyntax()
    {
        _Private_TomlFormatterBuilder b = mutable();
        b.setSyntax(Syntax.JSON);
        b.forceJsonOptions();
        return b;
    }

    /** Requires a mutable builder. */
    private void forceJsonOptions()
    {
        setLiteralStringsAllowed(false);
        setMultiLineStringsAllowed(false);
        setUnicodeStringsAllowed(true);
        setRealTabsInStringsAllowed(false);
        setBinaryIntegersAllowed(false);
        setOctalIntegersAllowed(false);
        setHexadecimalIntegersAllowed(false);
        setQuoteDatesAndTimes(true);
        setQuoteInfinitiesAndNans(true);
    }

    //=========================================================================

    /**
     * Returns an immutable copy with every defaulted property resolved, and
     * the JSON restrictions applied when printing JSON.
     */
    _Private_TomlFormatterBuilder fillDefaults()
    {
        // Ensure that we don't modify the user's builder.
        _Private_TomlFormatterBuilder b = copy();

        if (b.getIndent() == null)
        {
            b.setIndent(DEFAULT_INDENT);
        }

        if (b.getSyntax() == Syntax.JSON)
        {
            b.forceJsonOptions();
        }

        return b.immutable();
    }


    @Override
    public final TomlFormatter build(TomlNode root)
    {
        if (root == null) throw new NullPointerException("root is null");
        return new TextFormatter(fillDefaults(), root, null);
    }

    @Override
    public final TomlFormatter build(ParseResult result)
    {
        if (result == null) throw new NullPointerException("result is null");
        return new TextFormatter(fillDefaults(), null, result);
    }

    //=========================================================================

    private static final class Mutable
        extends _Private_TomlFormatterBuilder
    {
        private Mutable() { }

        private Mutable(_Private_TomlFormatterBuilder that)
        {
            super(that);
        }

        @Override
        public _Private_TomlFormatterBuilder immutable()
        {
            return new _Private_TomlFormatterBuilder(this);
        }

        @Override
        public _Private_TomlFormatterBuilder mutable()
        {
            return this;
        }

        @Override
        protected void mutationCheck()
        {
        }
    }
}
