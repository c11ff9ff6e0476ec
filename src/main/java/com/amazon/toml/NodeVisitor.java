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

import com.amazon.toml.util.AbstractNodeVisitor;

/**
 * A Visitor for the TOML node hierarchy.
 *
 * @see AbstractNodeVisitor
 */
public interface NodeVisitor
{
    public void visit(TomlTable value) throws Exception;

    public void visit(TomlArray value) throws Exception;

    public void visit(TomlString value) throws Exception;

    public void visit(TomlInteger value) throws Exception;

    public void visit(TomlFloat value) throws Exception;

    public void visit(TomlBoolean value) throws Exception;

    public void visit(TomlDate value) throws Exception;

    public void visit(TomlTime value) throws Exception;

    public void visit(TomlDateTime value) throws Exception;
}
