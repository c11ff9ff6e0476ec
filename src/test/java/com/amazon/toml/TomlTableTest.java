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

import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TomlTableTest
{
    @Test
    public void testInsertionOrder()
    {
        TomlTable table = new TomlTable();
        table.put("zebra", new TomlInteger(1));
        table.put("apple", new TomlInteger(2));
        table.put("mango", new TomlInteger(3));

        assertThat(table.keySet(), contains("zebra", "apple", "mango"));
    }

    @Test
    public void testReplaceKeepsPosition()
    {
        TomlTable table = new TomlTable();
        TomlInteger first = new TomlInteger(1);
        table.put("a", first);
        table.put("b", new TomlInteger(2));

        TomlString replacement = new TomlString("one");
        assertSame(first, table.put("a", replacement));

        assertThat(table.keySet(), contains("a", "b"));
        assertNull(first.getContainer());
        assertSame(table, replacement.getContainer());
        assertSame(replacement, table.get("a"));
    }

    @Test
    public void testRemove()
    {
        TomlTable table = new TomlTable();
        TomlBoolean value = new TomlBoolean(true);
        table.put("flag", value);

        assertTrue(table.containsKey("flag"));
        assertSame(value, table.remove("flag"));
        assertNull(value.getContainer());
        assertFalse(table.containsKey("flag"));
        assertNull(table.remove("flag"));
        assertTrue(table.isEmpty());
    }

    @Test
    public void testRemoveFromContainer()
    {
        TomlTable table = new TomlTable();
        TomlString value = new TomlString("v");
        table.put("k", value);

        assertTrue(value.removeFromContainer());
        assertEquals(0, table.size());
        assertNull(value.getContainer());
    }

    @Test
    public void testOwnership()
    {
        TomlTable first = new TomlTable();
        TomlTable second = new TomlTable();
        TomlString value = new TomlString("v");
        first.put("k", value);

        assertThrows(ContainedValueException.class, () -> second.put("k", value));
        second.put("k", value.clone());
        assertEquals(first, second);

        assertThrows(IllegalArgumentException.class, () -> first.put("self", first));
        assertThrows(NullPointerException.class, () -> first.put(null, new TomlString("x")));
        assertThrows(NullPointerException.class, () -> first.put("x", null));
        assertThrows(NullPointerException.class, () -> first.get(null));
    }

    @Test
    public void testViewsAreReadOnly()
    {
        TomlTable table = new TomlTable();
        table.put("k", new TomlInteger(1));

        assertThrows(UnsupportedOperationException.class, () -> table.keySet().clear());
        assertThrows(UnsupportedOperationException.class,
                     () -> table.entrySet().iterator().next().setValue(new TomlInteger(2)));
        assertThrows(UnsupportedOperationException.class, () -> {
            java.util.Iterator<Map.Entry<String, TomlNode>> it = table.iterator();
            it.next();
            it.remove();
        });
    }

    @Test
    public void testEqualityIgnoresOrderAndInlineFlag()
    {
        TomlTable left = new TomlTable(false);
        left.put("a", new TomlInteger(1));
        left.put("b", new TomlString("two"));

        TomlTable right = new TomlTable(true);
        right.put("b", new TomlString("two"));
        right.put("a", new TomlInteger(1));

        assertEquals(left, right);
        assertEquals(left.hashCode(), right.hashCode());

        right.put("a", new TomlInteger(3));
        assertNotEquals(left, right);
    }

    @Test
    public void testCloneIsDeep()
    {
        TomlTable inner = new TomlTable(true);
        inner.put("x", new TomlInteger(1));
        TomlTable table = new TomlTable();
        table.put("inner", inner);

        TomlTable clone = table.clone();

        assertEquals(table, clone);
        assertFalse(clone.isInline());
        assertThat(clone.get("inner"), not(sameInstance(inner)));
        assertTrue(clone.get("inner").asTable().isInline());
        assertSame(clone, clone.get("inner").getContainer());

        clone.get("inner").asTable().put("y", new TomlInteger(2));
        assertEquals(1, inner.size());
    }

    @Test
    public void testClear()
    {
        TomlTable table = new TomlTable();
        TomlInteger value = new TomlInteger(7);
        table.put("k", value);
        table.clear();
        assertTrue(table.isEmpty());
        assertNull(value.getContainer());
    }

    @Test
    public void testInlineFlag()
    {
        TomlTable table = new TomlTable();
        assertFalse(table.isInline());
        table.setInline(true);
        assertTrue(table.isInline());
        assertTrue(table.isTable());
        assertSame(table, table.asTable());
        assertNull(table.asArray());
    }

    @Test
    public void testToStringUsesStandardFormatter()
    {
        TomlTable table = new TomlTable();
        table.put("name", new TomlString("toml"));
        table.put("version", new TomlInteger(1));

        assertEquals("name = 'toml'\nversion = 1", table.toString());
    }
}
