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
 * A hint attached to a numeric node requesting the base it is printed in.
 * Hints only apply to non-negative values; everything else prints in
 * decimal.
 */
public enum ValueFormat
{
    NONE(10, ""),
    BINARY(2, "0b"),
    OCTAL(8, "0o"),
    HEXADECIMAL(16, "0x");

    private final int radix;
    private final String prefix;

    ValueFormat(int radix, String prefix)
    {
        this.radix = radix;
        this.prefix = prefix;
    }

    public int getRadix()
    {
        return radix;
    }

    /**
     * @return the literal prefix for this base, empty for {@link #NONE}.
     */
    public String getPrefix()
    {
        return prefix;
    }
}
