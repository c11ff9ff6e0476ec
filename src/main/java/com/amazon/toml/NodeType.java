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
 * Enumeration identifying the kinds of node in a TOML document tree.
 * <p>
 * Note that {@link #NONE} is a sentinel used only to mean "no particular
 * type"; it is never reported by a {@link TomlNode}.
 */
public enum NodeType
{
    NONE,
    TABLE,
    ARRAY,
    STRING,
    INTEGER,
    FLOATING_POINT,
    BOOLEAN,
    DATE,
    TIME,
    DATE_TIME;


    /**
     * Determines whether a type represents a container.
     *
     * @param t may be null.
     *
     * @return true when {@code t} is {@link #TABLE} or {@link #ARRAY}.
     */
    public static boolean isContainer(NodeType t)
    {
        return (t == TABLE) || (t == ARRAY);
    }

    /**
     * Determines whether a type represents a scalar value.
     *
     * @param t may be null.
     *
     * @return true when {@code t} is neither a container nor {@link #NONE}.
     */
    public static boolean isValue(NodeType t)
    {
        return (t != null && t.ordinal() >= STRING.ordinal());
    }

    /**
     * Determines whether a type represents a date, a time, or both.
     *
     * @param t may be null.
     *
     * @return true when {@code t} is {@link #DATE}, {@link #TIME}, or
     * {@link #DATE_TIME}.
     */
    public static boolean isTemporal(NodeType t)
    {
        return (t == DATE) || (t == TIME) || (t == DATE_TIME);
    }
}
