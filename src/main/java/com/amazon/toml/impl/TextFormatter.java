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

package com.amazon.toml.impl;

import com.amazon.toml.ParseResult;
import com.amazon.toml.TomlException;
import com.amazon.toml.TomlFormatter;
import com.amazon.toml.TomlNode;
import com.amazon.toml.system.TomlFormatterBuilder.Syntax;
import java.io.IOException;

/**
 * Binds a configuration to a document. Every print runs on a fresh printer,
 * so this object holds no per-print state.
 */
final class TextFormatter
    implements TomlFormatter
{
    private final _Private_TomlFormatterBuilder _options;
    private final TomlNode _root;
    private final ParseResult _result;

    /**
     * Exactly one of {@code root} and {@code result} is non-null.
     *
     * @param options must be immutable and have its defaults filled.
     */
    TextFormatter(_Private_TomlFormatterBuilder options,
                  TomlNode root,
                  ParseResult result)
    {
        assert (root == null) != (result == null);
        _options = options;
        _root = root;
        _result = result;
    }


    private TextPrinterBase newPrinter(Appendable out)
    {
        Syntax syntax = _options.getSyntax();
        switch (syntax)
        {
            case TOML:
                return new TomlTextPrinter(_options, out);
            case JSON:
                return new JsonTextPrinter(_options, out);
            default:
                throw new IllegalStateException("unexpected syntax " + syntax);
        }
    }

    public void print(Appendable out)
        throws IOException
    {
        if (out == null) throw new NullPointerException("out is null");

        TextPrinterBase printer = newPrinter(out);
        if (_result != null)
        {
            printer.print(_result);
        }
        else
        {
            printer.print(_root);
        }
    }

    @Override
    public String toString()
    {
        StringBuilder buffer = new StringBuilder();
        try
        {
            print(buffer);
        }
        catch (IOException e)
        {
            throw new TomlException("Exception printing to StringBuilder", e);
        }
        return buffer.toString();
    }
}
