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

import org.junit.jupiter.api.Test;

import java.util.Iterator;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.emptyIterable;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TomlArrayTest
{
    private static TomlInteger i(long v)
    {
        return new TomlInteger(v);
    }

    private static TomlTable tableOf(String key, long value, boolean inline)
    {
        TomlTable t = new TomlTable(inline);
        t.put(key, i(value));
        return t;
    }


    //=========================================================================
    // Homogeneity

    @Test
    public void testEmptyArrayIsNeverHomogeneous()
    {
        TomlArray array = new TomlArray();
        assertFalse(array.isHomogeneous());
        assertFalse(array.isHomogeneous(NodeType.INTEGER));
        assertFalse(array.isHomogeneous(NodeType.NONE));
        assertNull(array.getFirstNonMatch(NodeType.INTEGER));
    }

    @Test
    public void testSingleElementArrayIsHomogeneous()
    {
        TomlArray array = new TomlArray(new TomlString("x"));
        assertTrue(array.isHomogeneous());
        assertTrue(array.isHomogeneous(NodeType.STRING));
        assertFalse(array.isHomogeneous(NodeType.INTEGER));
    }

    @Test
    public void testMixedArray()
    {
        TomlString odd = new TomlString("three");
        TomlArray array = new TomlArray(i(1), i(2), odd, i(4));

        assertFalse(array.isHomogeneous());
        assertFalse(array.isHomogeneous(NodeType.INTEGER));
        assertSame(odd, array.getFirstNonMatch(NodeType.NONE));
        assertSame(odd, array.getFirstNonMatch(NodeType.INTEGER));
        assertSame(array.get(0), array.getFirstNonMatch(NodeType.STRING));
    }

    @Test
    public void testHomogeneityDoesNotMutate()
    {
        TomlArray array = new TomlArray(i(1), new TomlBoolean(true));
        TomlArray copy = array.clone();
        array.isHomogeneous();
        array.getFirstNonMatch(NodeType.FLOATING_POINT);
        assertEquals(copy, array);
    }

    @Test
    public void testArrayOfTables()
    {
        TomlArray tables = new TomlArray(tableOf("a", 1, false),
                                         tableOf("a", 2, false));
        assertTrue(tables.isArrayOfTables());

        tables.add(tableOf("a", 3, true));
        assertFalse(tables.isArrayOfTables());

        assertFalse(new TomlArray().isArrayOfTables());
        assertFalse(new TomlArray(tableOf("a", 1, false), i(2)).isArrayOfTables());
    }


    //=========================================================================
    // Flattening

    @Test
    public void testFlatten()
    {
        TomlArray innermost = new TomlArray(i(3), new TomlArray());
        TomlArray inner = new TomlArray(i(2), innermost, i(4));
        TomlArray array = new TomlArray(i(1), inner, new TomlArray(), i(5));

        assertEquals(5, array.totalLeafCount());

        TomlArray result = array.flatten();
        assertSame(array, result);
        assertEquals(new TomlArray(i(1), i(2), i(3), i(4), i(5)), array);

        for (TomlNode leaf : array)
        {
            assertSame(array, leaf.getContainer());
        }
        assertThat(inner.getContainer(), nullValue());
        assertTrue(inner.isEmpty());
        assertTrue(innermost.isEmpty());
    }

    @Test
    public void testFlattenIsIdempotent()
    {
        TomlArray array = new TomlArray(new TomlArray(i(1), new TomlArray(i(2))),
                                        new TomlString("x"));
        TomlArray once = array.clone().flatten();
        TomlArray twice = array.clone().flatten().flatten();
        assertEquals(once, twice);
        assertEquals(once.size(), array.totalLeafCount());
    }

    @Test
    public void testFlattenOfEmptyNestedArrays()
    {
        TomlArray array = new TomlArray(new TomlArray(),
                                        new TomlArray(new TomlArray()));
        assertEquals(0, array.totalLeafCount());
        array.flatten();
        assertTrue(array.isEmpty());
    }

    @Test
    public void testFlattenWithoutNestedArraysIsNoOp()
    {
        TomlInteger one = i(1);
        TomlTable table = tableOf("k", 2, true);
        TomlArray array = new TomlArray(one, table);

        array.flatten();

        assertEquals(2, array.size());
        assertSame(one, array.get(0));
        assertSame(table, array.get(1));
        assertSame(array, one.getContainer());
    }

    @Test
    public void testFlattenKeepsTablesInsideNestedArrays()
    {
        TomlTable table = tableOf("k", 1, true);
        TomlArray array = new TomlArray(new TomlArray(table, i(2)));
        array.flatten();
        assertSame(table, array.get(0));
        assertSame(array, table.getContainer());
    }


    //=========================================================================
    // Ownership

    @Test
    public void testAddingContainedNodeFails()
    {
        TomlInteger one = i(1);
        TomlArray first = new TomlArray(one);
        TomlArray second = new TomlArray();

        assertThrows(ContainedValueException.class, () -> second.add(one));
        assertSame(first, one.getContainer());

        assertTrue(one.removeFromContainer());
        assertThat(first, emptyIterable());
        second.add(one);
        assertSame(second, one.getContainer());
        assertFalse(new TomlString("loose").removeFromContainer());
    }

    @Test
    public void testAddingNull()
    {
        assertThrows(NullPointerException.class, () -> new TomlArray().add(null));
    }

    @Test
    public void testInsertingIntoItself()
    {
        TomlArray outer = new TomlArray();
        TomlArray inner = new TomlArray();
        outer.add(inner);

        assertThrows(IllegalArgumentException.class, () -> outer.add(outer));
        assertThrows(IllegalArgumentException.class, () -> inner.add(outer));
    }

    @Test
    public void testSetAndRemoveDetach()
    {
        TomlInteger one = i(1);
        TomlInteger two = i(2);
        TomlArray array = new TomlArray(one);

        assertSame(one, array.set(0, two));
        assertNull(one.getContainer());
        assertSame(array, two.getContainer());

        assertSame(two, array.remove(0));
        assertNull(two.getContainer());
        assertThrows(IndexOutOfBoundsException.class, () -> array.set(0, i(3)));
    }

    @Test
    public void testAddAtIndex()
    {
        TomlArray array = new TomlArray(i(1), i(3));
        array.add(1, i(2));
        assertEquals(new TomlArray(i(1), i(2), i(3)), array);
        assertThrows(IndexOutOfBoundsException.class, () -> array.add(5, i(4)));
    }

    @Test
    public void testIteratorRemoveDetaches()
    {
        TomlInteger one = i(1);
        TomlArray array = new TomlArray(one, i(2));

        Iterator<TomlNode> it = array.iterator();
        assertSame(one, it.next());
        it.remove();

        assertNull(one.getContainer());
        assertEquals(1, array.size());
        assertTrue(it.hasNext());
        assertEquals(i(2), it.next());
    }

    @Test
    public void testClear()
    {
        TomlInteger one = i(1);
        TomlArray array = new TomlArray(one);
        array.clear();
        assertTrue(array.isEmpty());
        assertNull(one.getContainer());
    }


    //=========================================================================
    // Cloning and equality

    @Test
    public void testCloneIsDeep()
    {
        TomlArray nested = new TomlArray(i(1));
        TomlArray array = new TomlArray(nested, new TomlString("s"));
        new TomlTable().put("a", array);

        TomlArray clone = array.clone();

        assertEquals(array, clone);
        assertThat(clone, not(sameInstance(array)));
        assertNull(clone.getContainer());
        assertThat(clone.get(0), not(sameInstance(array.get(0))));
        assertSame(clone, clone.get(0).getContainer());

        clone.get(0).asArray().add(i(2));
        assertNotEquals(array, clone);
        assertEquals(1, nested.size());
    }

    @Test
    public void testEqualityIsOrdered()
    {
        assertEquals(new TomlArray(i(1), i(2)), new TomlArray(i(1), i(2)));
        assertEquals(new TomlArray(i(1), i(2)).hashCode(),
                     new TomlArray(i(1), i(2)).hashCode());
        assertNotEquals(new TomlArray(i(1), i(2)), new TomlArray(i(2), i(1)));
    }

    @Test
    public void testAsAccessors()
    {
        TomlArray array = new TomlArray();
        assertTrue(array.isArray());
        assertFalse(array.isTable());
        assertFalse(array.isValue());
        assertSame(array, array.asArray());
        assertNull(array.asTable());
        assertThat(array.getType(), sameInstance(NodeType.ARRAY));
        assertThat(array, emptyIterable());
    }
}
