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
 * A TOML value holding a local time of day.
 */
public final class TomlTime
    extends TomlNode
{
    private static final int HASH_SIGNATURE =
        NodeType.TIME.toString().hashCode();

    private Time _value;

    /**
     * @throws NullPointerException if {@code value} is null.
     */
    public TomlTime(Time value)
    {
        setValue(value);
    }


    @Override
    public NodeType getType()
    {
        return NodeType.TIME;
    }

    public Time timeValue()
    {
        return _value;
    }

    /**
     * @throws NullPointerException if {@code value} is null.
     */
    public void setValue(Time value)
    {
        if (value == null) throw new NullPointerException("value is null");
        _value = value;
    }


    @Override
    public void accept(NodeVisitor visitor) throws Exception
    {
        visitor.visit(this);
    }

    @Override
    public TomlTime clone()
    {
        // the value is immutable, so sharing it is safe
        return new TomlTime(_value);
    }

    @Override
    public boolean equals(Object other)
    {
        if (other == this) return true;
        if (!(other instanceof TomlTime)) return false;
        return _value.equals(((TomlTime) other)._value);
    }

    @Override
    public int hashCode()
    {
        return HASH_SIGNATURE ^ _value.hashCode();
    }
}
