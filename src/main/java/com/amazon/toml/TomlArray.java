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

import java.util.ArrayList;
import java.util.Collection;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An ordered sequence of nodes, owned by the array.
 * <p>
 * Element order is preserved by every operation; {@link #flatten()} keeps the
 * relative order of the surviving leaves.
 */
public final class TomlArray
    extends TomlContainer
    implements Iterable<TomlNode>
{
    private static final Logger LOG = LoggerFactory.getLogger(TomlArray.class);

    private static final int HASH_SIGNATURE =
        NodeType.ARRAY.toString().hashCode();

    private ArrayList<TomlNode> _children;

    /**
     * Constructs an empty array.
     */
    public TomlArray()
    {
        _children = new ArrayList<TomlNode>();
    }

    /**
     * Constructs an array holding the given elements, in order.
     *
     * @throws ContainedValueException if any element already has a container.
     * @throws NullPointerException if any element is null.
     */
    public TomlArray(TomlNode... elements)
    {
        this();
        for (TomlNode element : elements)
        {
            add(element);
        }
    }

    /**
     * Constructs an array holding the given elements, in iteration order.
     *
     * @throws ContainedValueException if any element already has a container.
     * @throws NullPointerException if any element is null.
     */
    public TomlArray(Collection<? extends TomlNode> elements)
    {
        _children = new ArrayList<TomlNode>(elements.size());
        for (TomlNode element : elements)
        {
            add(element);
        }
    }


    @Override
    public NodeType getType()
    {
        return NodeType.ARRAY;
    }

    @Override
    public boolean isArray()
    {
        return true;
    }

    @Override
    public TomlArray asArray()
    {
        return this;
    }


    //=========================================================================
    // Element access


    @Override
    public int size()
    {
        return _children.size();
    }

    @Override
    public boolean isEmpty()
    {
        return _children.isEmpty();
    }

    /**
     * @throws IndexOutOfBoundsException if the index is out of range.
     */
    public TomlNode get(int index)
    {
        return _children.get(index);
    }

    /**
     * Appends a node to the end of this array, taking ownership of it.
     *
     * @return true, as per {@link Collection#add(Object)}.
     *
     * @throws ContainedValueException if {@code element} already has a
     * container.
     * @throws NullPointerException if {@code element} is null.
     */
    public boolean add(TomlNode element)
    {
        validateNewChild(this, element);
        _children.add(element);
        element.attachTo(this);
        return true;
    }

    /**
     * Inserts a node at the given position, shifting later elements right.
     *
     * @throws IndexOutOfBoundsException if the index is out of range
     * ({@code index < 0 || index > size()}).
     * @throws ContainedValueException if {@code element} already has a
     * container.
     */
    public void add(int index, TomlNode element)
    {
        if (index < 0 || index > size())
        {
            throw new IndexOutOfBoundsException("" + index);
        }
        validateNewChild(this, element);
        _children.add(index, element);
        element.attachTo(this);
    }

    /**
     * Replaces the node at the given position.
     *
     * @return the replaced node, now detached.
     *
     * @throws IndexOutOfBoundsException if the index is out of range.
     * @throws ContainedValueException if {@code element} already has a
     * container.
     */
    public TomlNode set(int index, TomlNode element)
    {
        if (index < 0 || index >= size())
        {
            throw new IndexOutOfBoundsException("" + index);
        }
        validateNewChild(this, element);

        TomlNode removed = _children.set(index, element);
        removed.detachFromContainer();
        element.attachTo(this);
        return removed;
    }

    /**
     * Removes the node at the given position.
     *
     * @return the removed node, now detached.
     *
     * @throws IndexOutOfBoundsException if the index is out of range.
     */
    public TomlNode remove(int index)
    {
        TomlNode removed = _children.remove(index);
        removed.detachFromContainer();
        return removed;
    }

    @Override
    boolean removeChild(TomlNode child)
    {
        // Identity, not equality: only the owned instance counts.
        for (int ii = 0; ii < _children.size(); ii++)
        {
            if (_children.get(ii) == child)
            {
                remove(ii);
                return true;
            }
        }
        return false;
    }

    @Override
    public void clear()
    {
        for (TomlNode child : _children)
        {
            child.detachFromContainer();
        }
        _children.clear();
    }

    /**
     * Returns an iterator over the elements of this array.
     * {@link Iterator#remove()} is supported and detaches the removed node.
     */
    public Iterator<TomlNode> iterator()
    {
        return new ElementIterator();
    }


    //=========================================================================
    // Homogeneity


    /**
     * Checks if every element of this array has the given type.
     *
     * @param type the type to test for. {@link NodeType#NONE} means "the
     * type of the first element".
     *
     * @return true if this array is non-empty and all elements match.
     * An empty array is never homogeneous.
     */
    public boolean isHomogeneous(NodeType type)
    {
        return !_children.isEmpty() && getFirstNonMatch(type) == null;
    }

    /**
     * Checks if all elements of this array have the same type.
     *
     * @return true if this array is non-empty and all elements have the type
     * of the first one.
     */
    public boolean isHomogeneous()
    {
        return isHomogeneous(NodeType.NONE);
    }

    /**
     * Finds the first element that doesn't have the given type.
     *
     * @param type the type to test for. {@link NodeType#NONE} means "the
     * type of the first element".
     *
     * @return the first element of another type; null if there's none,
     * including when this array is empty.
     */
    public TomlNode getFirstNonMatch(NodeType type)
    {
        if (_children.isEmpty()) return null;

        if (type == null || type == NodeType.NONE)
        {
            type = _children.get(0).getType();
        }

        for (TomlNode child : _children)
        {
            if (child.getType() != type) return child;
        }
        return null;
    }

    /**
     * Checks whether this array is printed as a series of {@code [[key]]}
     * table blocks: it's non-empty, every element is a table, and no
     * element is an inline table.
     */
    public boolean isArrayOfTables()
    {
        if (!isHomogeneous(NodeType.TABLE)) return false;

        for (TomlNode child : _children)
        {
            if (child.asTable().isInline()) return false;
        }
        return true;
    }


    //=========================================================================
    // Flattening


    /**
     * Returns the number of elements this array would have after
     * {@link #flatten()}: nested arrays count their own leaves, everything
     * else counts as one.
     */
    public int totalLeafCount()
    {
        int leaves = 0;
        for (TomlNode child : _children)
        {
            TomlArray arr = child.asArray();
            leaves += (arr != null ? arr.totalLeafCount() : 1);
        }
        return leaves;
    }

    /**
     * Replaces every nested array with its leaf elements, recursively,
     * depth-first and left-to-right. Empty nested arrays contribute nothing.
     * The leaves become owned by this array; the nested arrays are emptied
     * and detached.
     * <p>
     * An array that holds no nested arrays is left untouched.
     *
     * @return this array.
     */
    public TomlArray flatten()
    {
        if (_children.isEmpty()) return this;

        boolean requiresFlattening = false;
        for (TomlNode child : _children)
        {
            if (child.isArray())
            {
                requiresFlattening = true;
                break;
            }
        }
        if (!requiresFlattening) return this;

        final int leafCount = totalLeafCount();
        ArrayList<TomlNode> flattened = new ArrayList<TomlNode>(leafCount);
        moveLeaves(this, flattened);
        assert flattened.size() == leafCount;

        if (LOG.isDebugEnabled())
        {
            LOG.debug("Flattened array of {} elements into {} leaves",
                      _children.size(), leafCount);
        }

        _children = flattened;
        for (TomlNode leaf : flattened)
        {
            leaf.attachTo(this);
        }
        return this;
    }

    /**
     * Detaches the leaves of {@code source} into {@code dest}. Nested arrays
     * are detached and left empty.
     */
    private static void moveLeaves(TomlArray source, ArrayList<TomlNode> dest)
    {
        for (TomlNode child : source._children)
        {
            child.detachFromContainer();

            TomlArray arr = child.asArray();
            if (arr != null)
            {
                moveLeaves(arr, dest);
                arr._children.clear();
            }
            else
            {
                dest.add(child);
            }
        }
    }


    //=========================================================================


    @Override
    public void accept(NodeVisitor visitor) throws Exception
    {
        visitor.visit(this);
    }

    @Override
    public TomlArray clone()
    {
        TomlArray copy = new TomlArray();
        copy._children.ensureCapacity(_children.size());
        for (TomlNode child : _children)
        {
            copy.add(child.clone());
        }
        return copy;
    }

    @Override
    public boolean equals(Object other)
    {
        if (other == this) return true;
        if (!(other instanceof TomlArray)) return false;

        TomlArray that = (TomlArray) other;
        return _children.equals(that._children);
    }

    @Override
    public int hashCode()
    {
        final int prime = 8191;
        int result = HASH_SIGNATURE;

        for (TomlNode child : _children)
        {
            result = prime * result + child.hashCode();
            // mixing at each step to make the hash code order-dependent
            result ^= (result << 29) ^ (result >> 3);
        }
        return result;
    }


    private final class ElementIterator
        implements Iterator<TomlNode>
    {
        private final ArrayList<TomlNode> _list = _children;
        private int _next;
        private int _last = -1;

        public boolean hasNext()
        {
            return _next < _list.size();
        }

        public TomlNode next()
        {
            if (_list != _children)
            {
                throw new ConcurrentModificationException();
            }
            if (_next >= _list.size())
            {
                throw new NoSuchElementException();
            }
            _last = _next++;
            return _list.get(_last);
        }

        public void remove()
        {
            if (_last < 0)
            {
                throw new IllegalStateException();
            }
            TomlArray.this.remove(_last);
            _next = _last;
            _last = -1;
        }
    }
}
