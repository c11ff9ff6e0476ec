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

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A mapping from unique string keys to owned nodes, iterated in insertion
 * order.
 * <p>
 * An <em>inline</em> table prints as <code>{ k = v, ... }</code>; any other
 * table prints as key/value lines under a <code>[section]</code> header.
 */
public final class TomlTable
    extends TomlContainer
    implements Iterable<Map.Entry<String, TomlNode>>
{
    private static final int HASH_SIGNATURE =
        NodeType.TABLE.toString().hashCode();

    private final LinkedHashMap<String, TomlNode> _fields;
    private boolean _inline;

    /**
     * Constructs an empty, non-inline table.
     */
    public TomlTable()
    {
        this(false);
    }

    /**
     * Constructs an empty table.
     *
     * @param inline whether the table prints with inline syntax.
     */
    public TomlTable(boolean inline)
    {
        _fields = new LinkedHashMap<String, TomlNode>();
        _inline = inline;
    }


    @Override
    public NodeType getType()
    {
        return NodeType.TABLE;
    }

    @Override
    public boolean isTable()
    {
        return true;
    }

    @Override
    public TomlTable asTable()
    {
        return this;
    }


    public boolean isInline()
    {
        return _inline;
    }

    public void setInline(boolean inline)
    {
        _inline = inline;
    }


    @Override
    public int size()
    {
        return _fields.size();
    }

    @Override
    public boolean isEmpty()
    {
        return _fields.isEmpty();
    }

    /**
     * @return the node with the given key, or null if there's none.
     *
     * @throws NullPointerException if {@code key} is null.
     */
    public TomlNode get(String key)
    {
        if (key == null) throw new NullPointerException("key is null");
        return _fields.get(key);
    }

    public boolean containsKey(String key)
    {
        if (key == null) throw new NullPointerException("key is null");
        return _fields.containsKey(key);
    }

    /**
     * Puts a node into this table, taking ownership of it. A new key is
     * appended after the existing ones; replacing the value of an existing
     * key keeps that key's position.
     *
     * @return the replaced node, now detached; null if the key is new.
     *
     * @throws NullPointerException if {@code key} or {@code value} is null.
     * @throws ContainedValueException if {@code value} already has a
     * container.
     */
    public TomlNode put(String key, TomlNode value)
    {
        if (key == null) throw new NullPointerException("key is null");
        validateNewChild(this, value);

        TomlNode previous = _fields.put(key, value);
        if (previous != null)
        {
            previous.detachFromContainer();
        }
        value.attachTo(this);
        return previous;
    }

    /**
     * Removes the entry with the given key.
     *
     * @return the removed node, now detached; null if the key is absent.
     */
    public TomlNode remove(String key)
    {
        if (key == null) throw new NullPointerException("key is null");

        TomlNode removed = _fields.remove(key);
        if (removed != null)
        {
            removed.detachFromContainer();
        }
        return removed;
    }

    @Override
    boolean removeChild(TomlNode child)
    {
        Iterator<TomlNode> i = _fields.values().iterator();
        while (i.hasNext())
        {
            if (i.next() == child)
            {
                i.remove();
                child.detachFromContainer();
                return true;
            }
        }
        return false;
    }

    @Override
    public void clear()
    {
        for (TomlNode child : _fields.values())
        {
            child.detachFromContainer();
        }
        _fields.clear();
    }

    /**
     * @return a read-only view of the keys, in insertion order.
     */
    public Set<String> keySet()
    {
        return Collections.unmodifiableSet(_fields.keySet());
    }

    /**
     * @return a read-only view of the entries, in insertion order.
     */
    public Set<Map.Entry<String, TomlNode>> entrySet()
    {
        return Collections.unmodifiableMap(_fields).entrySet();
    }

    /**
     * Returns a read-only iterator over the entries, in insertion order.
     */
    public Iterator<Map.Entry<String, TomlNode>> iterator()
    {
        return entrySet().iterator();
    }


    @Override
    public void accept(NodeVisitor visitor) throws Exception
    {
        visitor.visit(this);
    }

    @Override
    public TomlTable clone()
    {
        TomlTable copy = new TomlTable(_inline);
        for (Map.Entry<String, TomlNode> entry : _fields.entrySet())
        {
            copy.put(entry.getKey(), entry.getValue().clone());
        }
        return copy;
    }

    /**
     * Tables are equal when they hold equal values under the same keys.
     * Key order and the inline flag are not compared.
     */
    @Override
    public boolean equals(Object other)
    {
        if (other == this) return true;
        if (!(other instanceof TomlTable)) return false;

        TomlTable that = (TomlTable) other;
        return _fields.equals(that._fields);
    }

    @Override
    public int hashCode()
    {
        int result = HASH_SIGNATURE;
        for (Map.Entry<String, TomlNode> entry : _fields.entrySet())
        {
            // additive, so independent of key order
            result += entry.getKey().hashCode() ^ entry.getValue().hashCode();
        }
        return result;
    }
}
