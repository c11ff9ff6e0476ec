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
 * A TOML value holding a date and time, with an optional UTC offset.
 */
public final class TomlDateTime
    extends TomlNode
{
    private static final int HASH_SIGNATURE =
        NodeType.DATE_TIME.toString().hashCode();

    private DateTime _value;

    /**
     * @throws NullPointerException if {@code value} is null.
     */
    public TomlDateTime(DateTime value)
    {
        setValue(value);
    }


    @Override
    public NodeType getType()
    {
        return NodeType.DATE_TIME;
    }

    public DateTime dateTimeValue()
    {
        return _value;
    }

    /**
     * @throws NullPointerException if {@code value} is null.
     */
    public void setValue(DateTime value)
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
    public TomlDateTime clone()
    {
        // the value is immutable, so sharing it is safe
        return new TomlDateTime(_value);
    }

    @Override
    public boolean equals(Object other)
    {
        if (other == this) return true;
        if (!(other instanceof TomlDateTime)) return false;
        return _value.equals(((TomlDateTime) other)._value);
    }

    @Override
    public int hashCode()
    {
        return HASH_SIGNATURE ^ _value.hashCode();
    }
}
