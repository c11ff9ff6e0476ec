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
 * A diagnostic produced by a parser that could not build a document.
 * <p>
 * This library never throws it; it is carried by a failed
 * {@link ParseResult}, which formatters print as plain text.
 */
public class ParseError
    extends TomlException
{
    private static final long serialVersionUID = -1870239566273497011L;

    private final SourceRegion _source;

    /**
     * @throws NullPointerException if {@code source} is null.
     */
    public ParseError(String description, SourceRegion source)
    {
        super(description);
        if (source == null) throw new NullPointerException("source is null");
        _source = source;
    }

    /**
     * @return the diagnostic text, never null.
     */
    public String getDescription()
    {
        String message = getMessage();
        return (message == null ? "" : message);
    }

    /**
     * @return the region of the source the diagnostic refers to.
     */
    public SourceRegion getSource()
    {
        return _source;
    }
}
