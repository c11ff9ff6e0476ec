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
 * A line and column in a source document. Both are 1-based; zero means the
 * position is unknown.
 */
public final class SourcePosition
{
    private final int _line;
    private final int _column;

    /**
     * @throws IllegalArgumentException if either argument is negative.
     */
    public SourcePosition(int line, int column)
    {
        if (line < 0 || column < 0)
        {
            throw new IllegalArgumentException("Negative position "
                                               + line + ":" + column);
        }
        _line = line;
        _column = column;
    }

    public int getLine()
    {
        return _line;
    }

    public int getColumn()
    {
        return _column;
    }

    /**
     * @return true unless the line is zero.
     */
    public boolean isKnown()
    {
        return _line > 0;
    }


    @Override
    public String toString()
    {
        return "line " + _line + ", column " + _column;
    }

    @Override
    public boolean equals(Object other)
    {
        if (other == this) return true;
        if (!(other instanceof SourcePosition)) return false;

        SourcePosition that = (SourcePosition) other;
        return _line == that._line && _column == that._column;
    }

    @Override
    public int hashCode()
    {
        return 31 * _line + _column;
    }
}
