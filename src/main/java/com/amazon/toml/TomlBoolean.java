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
 * A TOML boolean value.
 */
public final class TomlBoolean
    extends TomlNode
{
    private static final int HASH_SIGNATURE =
        NodeType.BOOLEAN.toString().hashCode();

    private static final int TRUE_HASH
        = HASH_SIGNATURE ^ (16777619 * Boolean.TRUE.hashCode());

    private static final int FALSE_HASH
        = HASH_SIGNATURE ^ (16777619 * Boolean.FALSE.hashCode());

    private boolean _value;

    public TomlBoolean(boolean value)
    {
        _value = value;
    }


    @Override
    public NodeType getType()
    {
        return NodeType.BOOLEAN;
    }

    public boolean booleanValue()
    {
        return _value;
    }

    public void setValue(boolean value)
    {
        _value = value;
    }


    @Override
    public void accept(NodeVisitor visitor) throws Exception
    {
        visitor.visit(this);
    }

    @Override
    public TomlBoolean clone()
    {
        return new TomlBoolean(_value);
    }

    @Override
    public boolean equals(Object other)
    {
        if (other == this) return true;
        if (!(other instanceof TomlBoolean)) return false;
        return _value == ((TomlBoolean) other)._value;
    }

    @Override
    public int hashCode()
    {
        return _value ? TRUE_HASH : FALSE_HASH;
    }
}
