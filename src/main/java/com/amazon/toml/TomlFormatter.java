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
import java.io.IOException;

/**
 * Renders a bound document as text.
 * <p>
 * Instances are immutable and may print any number of times, including from
 * several threads at once, provided the bound tree is not modified while a
 * print is in progress.
 *
 * @see TomlFormatterBuilder
 */
public interface TomlFormatter
{
    /**
     * Prints the bound document.
     *
     * @param out the sink; not null.
     *
     * @throws IOException propagated when the {@code Appendable} throws it.
     * @throws IllegalStateException if the tree holds a node of no known
     * type.
     */
    public void print(Appendable out) throws IOException;

    /**
     * Prints the bound document to a string.
     *
     * @return the full rendering.
     */
    public String toString();
}
