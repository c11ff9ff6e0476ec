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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ScalarNodeTest
{
    private static <V extends TomlNode> V assertCloneable(V original)
    {
        @SuppressWarnings("unchecked")
        V clone = (V) original.clone();
        assertEquals(original, clone);
        assertEquals(original.hashCode(), clone.hashCode());
        assertThat(clone, not(sameInstance(original)));
        assertNull(clone.getContainer());
        return clone;
    }

    @Test
    public void testTypes()
    {
        assertSame(NodeType.STRING, new TomlString("").getType());
        assertSame(NodeType.INTEGER, new TomlInteger(0).getType());
        assertSame(NodeType.FLOATING_POINT, new TomlFloat(0).getType());
        assertSame(NodeType.BOOLEAN, new TomlBoolean(false).getType());
        assertSame(NodeType.DATE, new TomlDate(new Date(2000, 1, 1)).getType());
        assertSame(NodeType.TIME, new TomlTime(new Time(0, 0, 0)).getType());
        assertSame(NodeType.DATE_TIME,
                   new TomlDateTime(new DateTime(new Date(2000, 1, 1),
                                                 new Time(0, 0, 0))).getType());
        assertTrue(new TomlBoolean(true).isValue());
    }

    @Test
    public void testClone()
    {
        assertCloneable(new TomlString("text"));
        assertCloneable(new TomlBoolean(true));
        assertCloneable(new TomlDate(new Date(1999, 12, 31)));
        assertCloneable(new TomlTime(new Time(12, 0, 0, 5)));

        TomlInteger hex = assertCloneable(new TomlInteger(255, ValueFormat.HEXADECIMAL));
        assertSame(ValueFormat.HEXADECIMAL, hex.getFormat());

        TomlFloat nan = assertCloneable(new TomlFloat(Double.NaN));
        assertTrue(Double.isNaN(nan.doubleValue()));
    }

    @Test
    public void testEquality()
    {
        assertEquals(new TomlInteger(5), new TomlInteger(5, ValueFormat.BINARY));
        assertNotEquals(new TomlInteger(5), new TomlFloat(5.0));
        assertNotEquals(new TomlFloat(0.0), new TomlFloat(-0.0));
        assertNotEquals(new TomlString("a"), new TomlString("b"));
        assertNotEquals(new TomlBoolean(true), new TomlBoolean(false));
    }

    @Test
    public void testSetters()
    {
        TomlString s = new TomlString("a");
        s.setValue("b");
        assertEquals("b", s.stringValue());
        assertThrows(NullPointerException.class, () -> s.setValue(null));
        assertThrows(NullPointerException.class, () -> new TomlString(null));

        TomlInteger i = new TomlInteger(1);
        i.setValue(2);
        i.setFormat(ValueFormat.OCTAL);
        assertEquals(2, i.longValue());
        assertSame(ValueFormat.OCTAL, i.getFormat());
        assertThrows(NullPointerException.class, () -> i.setFormat(null));

        TomlBoolean b = new TomlBoolean(false);
        b.setValue(true);
        assertTrue(b.booleanValue());

        TomlDate d = new TomlDate(new Date(2000, 1, 1));
        assertThrows(NullPointerException.class, () -> d.setValue(null));
    }

    @Test
    public void testScalarToString()
    {
        assertEquals("42", new TomlInteger(42).toString());
        assertEquals("0xFF", new TomlInteger(255, ValueFormat.HEXADECIMAL).toString());
        assertEquals("'hello'", new TomlString("hello").toString());
        assertEquals("-inf", new TomlFloat(Double.NEGATIVE_INFINITY).toString());
        assertEquals("true", new TomlBoolean(true).toString());
        assertEquals("2000-01-01", new TomlDate(new Date(2000, 1, 1)).toString());
    }
}
