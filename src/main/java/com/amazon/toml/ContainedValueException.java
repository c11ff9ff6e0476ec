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
 * An error caused by adding a node to a container when the node is
 * already owned by a container.
 * <p>
 * Use {@link TomlNode#removeFromContainer()} to move a node, or insert a
 * {@link TomlNode#clone()} of it.
 */
public class ContainedValueException
    extends TomlException
{
    private static final long serialVersionUID = -6185427716457418325L;

    public ContainedValueException()
    {
        super();
    }

    /**
     * @param message
     */
    public ContainedValueException(String message)
    {
        super(message);
    }
}
