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

import com.amazon.toml.TomlArray;
import com.amazon.toml.TomlNode;
import com.amazon.toml.TomlTable;
import java.io.IOException;
import java.util.Map;

/**
 * Prints a document tree as JSON: one member or element per line, with
 * dates, times, infinities and NaN as strings.
 * <p>
 * The inline flag of tables is ignored, as is the layout heuristic used for
 * TOML.
 */
final class JsonTextPrinter
    extends TextPrinterBase
{
    static final String INF_TOKEN = "Infinity";
    static final String NEGATIVE_INF_TOKEN = "-Infinity";
    static final String NAN_TOKEN = "NaN";


    JsonTextPrinter(_Private_TomlFormatterBuilder options, Appendable out)
    {
        super(options, out, INF_TOKEN, NEGATIVE_INF_TOKEN, NAN_TOKEN);
    }


    @Override
    void print(TomlNode root)
        throws IOException
    {
        printNested(root);
    }

    private void printNested(TomlNode value)
        throws IOException
    {
        switch (value.getType())
        {
            case TABLE:
                printTable(value.asTable());
                break;
            case ARRAY:
                printArray(value.asArray());
                break;
            case NONE:
                throw new IllegalStateException("unexpected type NONE");
            default:
                printValue(value);
                break;
        }
    }

    private void printTable(TomlTable table)
        throws IOException
    {
        if (table.isEmpty())
        {
            printUnformatted("{}");
            return;
        }

        printUnformatted('{');
        if (_options.getIndentSubTables()) increaseIndent();

        boolean first = true;
        for (Map.Entry<String, TomlNode> entry : table)
        {
            if (!first) printUnformatted(',');
            first = false;

            printNewline(true);
            printIndent();
            printString(entry.getKey(), false, false);
            printUnformatted(_options.getTerseKeyValuePairs() ? ":" : " : ");
            printNested(entry.getValue());
        }

        if (_options.getIndentSubTables()) decreaseIndent();
        printNewline(true);
        printIndent();
        printUnformatted('}');
    }

    private void printArray(TomlArray array)
        throws IOException
    {
        if (array.isEmpty())
        {
            printUnformatted("[]");
            return;
        }

        printUnformatted('[');
        if (_options.getIndentArrayElements()) increaseIndent();

        for (int i = 0; i < array.size(); i++)
        {
            if (i > 0) printUnformatted(',');
            printNewline(true);
            printIndent();
            printNested(array.get(i));
        }

        if (_options.getIndentArrayElements()) decreaseIndent();
        printNewline(true);
        printIndent();
        printUnformatted(']');
    }
}
