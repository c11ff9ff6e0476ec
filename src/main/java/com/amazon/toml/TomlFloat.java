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
 * A TOML floating-point value, including infinities and NaN.
 */
public final class TomlFloat
    extends TomlNode
{
    private static final int HASH_SIGNATURE =
        NodeType.FLOATING_POINT.toString().hashCode();

    private double _value;
    private ValueFormat _format;

    public TomlFloat(double value)
    {
        this(value, ValueFormat.NONE);
    }

    /**
     * @throws NullPointerException if {@code format} is null.
     */
    public TomlFloat(double value, ValueFormat format)
    {
        _value = value;
        setFormat(format);
    }


    @Override
    public NodeType getType()
    {
        return NodeType.FLOATING_POINT;
    }

    public double doubleValue()
    {
        return _value;
    }

    public void setValue(double value)
    {
        _value = value;
    }

    /**
     * Gets the format hint. Formatters print floats in decimal whatever the
     * hint; it's kept so that trees survive a round trip unchanged.
     */
    public ValueFormat getFormat()
    {
        return _format;
    }

    /**
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
    public TomlFloat clone()
    {
        return new TomlFloat(_value, _format);
    }

    /**
     * Floats are equal when their bit patterns are, so NaN equals NaN and
     * {@code 0.0} differs from {@code -0.0}. The format hint is not compared.
     */
    @Override
    public boolean equals(Object other)
    {
        if (other == this) return true;
        if (!(other instanceof TomlFloat)) return false;
        return Double.doubleToLongBits(_value)
            == Double.doubleToLongBits(((TomlFloat) other)._value);
    }

    @Override
    public int hashCode()
    {
        return HASH_SIGNATURE ^ Double.hashCode(_value);
    }
}
