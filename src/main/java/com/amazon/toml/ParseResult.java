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

/**
 * The outcome of parsing a document: either its root table or the
 * {@link ParseError} that stopped the parser.
 */
public final class ParseResult
{
    private final TomlTable _table;
    private final ParseError _error;

    private ParseResult(TomlTable table, ParseError error)
    {
        _table = table;
        _error = error;
    }

    /**
     * @throws NullPointerException if {@code table} is null.
     */
    public static ParseResult success(TomlTable table)
    {
        if (table == null) throw new NullPointerException("table is null");
        return new ParseResult(table, null);
    }

    /**
     * @throws NullPointerException if {@code error} is null.
     */
    public static ParseResult failure(ParseError error)
    {
        if (error == null) throw new NullPointerException("error is null");
        return new ParseResult(null, error);
    }


    public boolean succeeded()
    {
        return _error == null;
    }

    /**
     * @throws IllegalStateException if parsing failed.
     */
    public TomlTable getTable()
    {
        if (_error != null)
        {
            throw new IllegalStateException("Parse failed: "
                                            + _error.getDescription());
        }
        return _table;
    }

    /**
     * @throws IllegalStateException if parsing succeeded.
     */
    public ParseError getError()
    {
        if (_error == null)
        {
            throw new IllegalStateException("Parse succeeded");
        }
        return _error;
    }
}
