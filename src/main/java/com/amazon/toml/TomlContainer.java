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
 * Common functionality of TOML tables and arrays, the nodes that own other
 * nodes.
 * <p>
 * <b>WARNING:</b> This class should not be extended by code outside of
 * this library.
 */
public abstract class TomlContainer
    extends TomlNode
{
    TomlContainer()
    {
    }


    /**
     * Returns the number of children of this container.
     *
     * @return the number of children.
     */
    public abstract int size();

    /**
     * Checks if this container is empty.
     *
     * @return true if this container has no children.
     */
    public abstract boolean isEmpty();

    /**
     * Removes all children of this container. The removed nodes become
     * detached.
     */
    public abstract void clear();


    @Override
    public abstract TomlContainer clone();


    /**
     * Removes the given child, detaching it.
     *
     * @return false if {@code child} is not owned by this container.
     */
    abstract boolean removeChild(TomlNode child);


    /**
     * Ensures that a node may be adopted by a container.
     *
     * @throws NullPointerException if {@code child} is null.
     * @throws ContainedValueException if {@code child} already has a
     * container.
     * @throws IllegalArgumentException if {@code child} is {@code parent} or
     * one of its ancestors.
     */
    static void validateNewChild(TomlContainer parent, TomlNode child)
        throws ContainedValueException, NullPointerException,
               IllegalArgumentException
    {
        if (child == null) {
            throw new NullPointerException();
        }

        if (child.getContainer() != null)
        {
            throw new ContainedValueException();
        }

        for (TomlNode n = parent; n != null; n = n.getContainer())
        {
            if (n == child)
            {
                String message =
                    "A container can not be inserted into itself.";
                throw new IllegalArgumentException(message);
            }
        }
    }
}
