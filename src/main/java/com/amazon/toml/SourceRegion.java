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
 * A span of a source document, optionally naming the file it came from.
 */
public final class SourceRegion
{
    private final SourcePosition _begin;
    private final SourcePosition _end;
    private final String _path;

    public SourceRegion(SourcePosition begin, SourcePosition end)
    {
        this(begin, end, null);
    }

    /**
     * @param path may be null or empty when the source has no name.
     *
     * @throws NullPointerException if {@code begin} or {@code end} is null.
     */
    public SourceRegion(SourcePosition begin, SourcePosition end, String path)
    {
        if (begin == null) throw new NullPointerException("begin is null");
        if (end == null) throw new NullPointerException("end is null");
        _begin = begin;
        _end = end;
        _path = path;
    }

    public SourcePosition getBegin()
    {
        return _begin;
    }

    public SourcePosition getEnd()
    {
        return _end;
    }

    /**
     * @return the source path, or null if there's none.
     */
    public String getPath()
    {
        return _path;
    }

    public boolean hasPath()
    {
        return _path != null && !_path.isEmpty();
    }


    @Override
    public String toString()
    {
        String span = _begin + " to " + _end;
        return hasPath() ? _path + ": " + span : span;
    }
}
