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

package com.amazon.toml.util;

import com.amazon.toml.NodeVisitor;
import com.amazon.toml.TomlArray;
import com.amazon.toml.TomlBoolean;
import com.amazon.toml.TomlDate;
import com.amazon.toml.TomlDateTime;
import com.amazon.toml.TomlFloat;
import com.amazon.toml.TomlInteger;
import com.amazon.toml.TomlNode;
import com.amazon.toml.TomlString;
import com.amazon.toml.TomlTable;
import com.amazon.toml.TomlTime;

/**
 * A base class for extending TOML {@link NodeVisitor}s.
 * All <code>visit</code> methods are implemented to call
 * {@link #defaultVisit(TomlNode)}.
 */
public abstract class AbstractNodeVisitor
    implements NodeVisitor
{

    /**
     * Default visitation behavior, called by all <code>visit</code> methods
     * in {@link AbstractNodeVisitor}.  Subclasses should override this unless
     * they override all <code>visit</code> methods.
     * <p>
     * This implementation always throws {@link UnsupportedOperationException}.
     *
     * @param value the node to visit.
     * @throws UnsupportedOperationException always thrown unless subclass
     * overrides this implementation.
     * @throws Exception subclasses can throw this; it will be propagated by
     * the other <code>visit</code> methods.
     */
    protected void defaultVisit(TomlNode value) throws Exception
    {
        throw new UnsupportedOperationException();
    }

    public void visit(TomlTable value) throws Exception
    {
        defaultVisit(value);
    }

    public void visit(TomlArray value) throws Exception
    {
        defaultVisit(value);
    }

    public void visit(TomlString value) throws Exception
    {
        defaultVisit(value);
    }

    public void visit(TomlInteger value) throws Exception
    {
        defaultVisit(value);
    }

    public void visit(TomlFloat value) throws Exception
    {
        defaultVisit(value);
    }

    public void visit(TomlBoolean value) throws Exception
    {
        defaultVisit(value);
    }

    public void visit(TomlDate value) throws Exception
    {
        defaultVisit(value);
    }

    public void visit(TomlTime value) throws Exception
    {
        defaultVisit(value);
    }

    public void visit(TomlDateTime value) throws Exception
    {
        defaultVisit(value);
    }
}
