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
 * A TOML integer value: a signed 64-bit number plus a hint naming the base
 * it prefers to print in.
 */
public final class TomlInteger
    extends TomlNode
{
    private static final int HASH_SIGNATURE =
        NodeType.INTEGER.toString().hashCode();

    private long _value;
    private ValueFormat _format;

    public TomlInteger(long value)
    {
        this(value, ValueFormat.NONE);
    }

    /**
     * @throws NullPointerException if {@code format} is null.
     */
    public TomlInteger(long value, ValueFormat format)
    {
        _value = value;
        setFormat(format);
    }


    @Override
    public NodeType getType()
    {
        return NodeType.INTEGER;
    }

    public long longValue()
    {
        return _value;
    }

    public void setValue(long value)
    {
        _value = value;
    }

    public ValueFormat getFormat()
    {
        return _format;
    }

    /**
     * Sets the base this value prefers to print in. The hint is honored only
     * for non-negative values.
     *
     * @throws NullPointerException if {@code format} is null.
     */
    public void setFormat(ValueFormat format)
    {
        if (format == null) throw new NullPointerException("format is null");
        _format = format;
    }


    @Override
    public void accept(NodeVisitor visitor) throws Exception
    {
        visitor.visit(this);
    }

    @Override
    public TomlInteger clone()
    {
        return new TomlInteger(_value, _format);
    }

    /**
     * Integers are equal when their values are; the format hint is not
     * compared.
     */
    @Override
    public boolean equals(Object other)
    {
        if (other == this) return true;
        if (!(other instanceof TomlInteger)) return false;
        return _value == ((TomlInteger) other)._value;
    }

    @Override
    public int hashCode()
    {
        return HASH_SIGNATURE ^ Long.hashCode(_value);
    }
}
