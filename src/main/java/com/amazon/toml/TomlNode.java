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

import com.amazon.toml.system.TomlFormatterBuilder;

/**
 * Base type for all nodes of a TOML document tree.
 * <p>
 * <b>WARNING:</b> This class should not be extended by code outside of
 * this library.
 *
 * <h2>Ownership</h2>
 *
 * Every node is owned by at most one container: the {@link TomlTable} or
 * {@link TomlArray} it was added to, available via {@link #getContainer()}.
 * A node with no container is owned by whoever holds the reference, normally
 * the caller holding the root. Adding a node that already has a container
 * throws {@link ContainedValueException}; to move a node, call
 * {@link #removeFromContainer()} first, and to share content, add a
 * {@link #clone()}.
 *
 * <h2>Mutability</h2>
 *
 * Nodes are mutable and are not safe for use by multiple threads while any
 * thread modifies the tree. In particular, a tree must not be changed while a
 * {@link TomlFormatter} is printing it.
 */
public abstract class TomlNode
    implements Cloneable
{
    /** The owner of this node, or null when detached. */
    TomlContainer _container;


    TomlNode()
    {
    }


    /**
     * Gets the kind of this node.
     *
     * @return never {@link NodeType#NONE} and never null.
     */
    public abstract NodeType getType();


    /**
     * Gets the container owning this node.
     *
     * @return the owning table or array, or null if this node is detached.
     */
    public final TomlContainer getContainer()
    {
        return _container;
    }


    /**
     * Removes this node from its container, if any.
     *
     * @return true if this node was removed; false if it had no container.
     */
    public final boolean removeFromContainer()
    {
        TomlContainer parent = _container;
        if (parent == null) return false;

        boolean removed = parent.removeChild(this);
        assert removed && _container == null;
        return removed;
    }


    public boolean isTable()
    {
        return false;
    }

    public boolean isArray()
    {
        return false;
    }

    /**
     * @return true when this node is a scalar rather than a container.
     */
    public boolean isValue()
    {
        return NodeType.isValue(getType());
    }

    /**
     * @return this node as a table, or null if it's not a table.
     */
    public TomlTable asTable()
    {
        return null;
    }

    /**
     * @return this node as an array, or null if it's not an array.
     */
    public TomlArray asArray()
    {
        return null;
    }


    /**
     * Entry point for visitor pattern.  Implementations of this method by
     * concrete classes will simply call the appropriate <code>visit</code>
     * method on the <code>visitor</code>.
     *
     * @param visitor will have one of its <code>visit</code> methods called.
     * @throws Exception any exception thrown by the visitor is propagated.
     * @throws NullPointerException if <code>visitor</code> is
     * <code>null</code>.
     */
    public abstract void accept(NodeVisitor visitor) throws Exception;


    /**
     * Creates a copy of this node and all of its children. The copy has no
     * container, so it may be added anywhere.
     *
     * @return a new, detached node equal to this one.
     */
    @Override
    public abstract TomlNode clone();


    /**
     * Renders this node with the standard formatter.
     *
     * @see TomlFormatterBuilder#standard()
     */
    @Override
    public String toString()
    {
        return TomlFormatterBuilder.standard().build(this).toString();
    }


    /** Invoked by a container when it takes ownership of this node. */
    final void attachTo(TomlContainer container)
    {
        assert _container == null;
        _container = container;
    }

    /** Invoked by a container when it gives up ownership of this node. */
    final void detachFromContainer()
    {
        _container = null;
    }
}
