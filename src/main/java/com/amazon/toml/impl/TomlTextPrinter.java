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

import com.amazon.toml.NodeType;
import com.amazon.toml.TomlArray;
import com.amazon.toml.TomlFloat;
import com.amazon.toml.TomlInteger;
import com.amazon.toml.TomlNode;
import com.amazon.toml.TomlString;
import com.amazon.toml.TomlTable;
import com.amazon.toml.util.TomlTextUtils;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Map;

/**
 * Prints canonical TOML.
 * <p>
 * Non-inline tables print as key/value lines followed by their sub-tables
 * under {@code [dotted.key]} headers, then their arrays of tables under
 * {@code [[dotted.key]]} headers. Arrays and inline tables print on one line
 * unless their estimated width reaches {@link #LINE_WRAP_COLUMNS}, in which
 * case arrays print one element per line.
 */
final class TomlTextPrinter
    extends TextPrinterBase
{
    /** Estimated width at which an array is printed on multiple lines. */
    static final int LINE_WRAP_COLUMNS = 120;

    /** Keys of the tables enclosing the one being printed. */
    private final ArrayList<String> _keyPath = new ArrayList<String>();

    /** Whether a blank line is owed before the next table header. */
    private boolean _pendingTableSeparator;


    TomlTextPrinter(_Private_TomlFormatterBuilder options, Appendable out)
    {
        super(options, out,
              TomlTextUtils.INF_TOKEN,
              TomlTextUtils.NEGATIVE_INF_TOKEN,
              TomlTextUtils.NAN_TOKEN);
    }


    //=========================================================================
    // Layout heuristic


    /**
     * Estimates the columns a node takes when printed inline.
     * <p>
     * Containers stop adding up their children once the estimate reaches
     * {@link #LINE_WRAP_COLUMNS}, so for wide containers the result is only
     * a lower bound, but one that's already past the threshold.
     */
    static int countInlineColumns(TomlNode node)
    {
        switch (node.getType())
        {
            case TABLE:
            {
                TomlTable table = node.asTable();
                if (table.isEmpty()) return 2;   // {}

                int weight = 3;                  // { }
                for (Map.Entry<String, TomlNode> entry : table)
                {
                    weight += TomlTextUtils.utf8Length(entry.getKey())
                            + countInlineColumns(entry.getValue())
                            + 2;                 // ,
                    if (weight >= LINE_WRAP_COLUMNS) break;
                }
                return weight;
            }
            case ARRAY:
            {
                TomlArray array = node.asArray();
                if (array.isEmpty()) return 2;   // []

                int weight = 3;                  // [ ]
                for (TomlNode element : array)
                {
                    weight += countInlineColumns(element) + 2;
                    if (weight >= LINE_WRAP_COLUMNS) break;
                }
                return weight;
            }
            case STRING:
            {
                String text = ((TomlString) node).stringValue();
                return TomlTextUtils.utf8Length(text) + 2;
            }
            case INTEGER:
            {
                long value = ((TomlInteger) node).longValue();
                if (value == 0) return 1;

                int weight = (value < 0 ? 1 : 0);
                double magnitude = Math.abs((double) value);
                return weight + (int) Math.floor(Math.log10(magnitude)) + 1;
            }
            case FLOATING_POINT:
            {
                double value = ((TomlFloat) node).doubleValue();
                if (value == 0.0) return 3;      // 0.0
                if (Double.isNaN(value))
                {
                    return TomlTextUtils.NAN_TOKEN.length();
                }
                if (Double.isInfinite(value))
                {
                    return (value > 0 ? TomlTextUtils.INF_TOKEN
                                      : TomlTextUtils.NEGATIVE_INF_TOKEN).length();
                }

                int weight = 2;                  // .0
                if (value < 0.0)
                {
                    weight += 1;
                    value = -value;
                }
                int exponent = (int) Math.floor(Math.log10(value));
                return weight + Math.max(exponent, 0) + 1;
            }
            case BOOLEAN:
                return 5;
            case DATE:
            case TIME:
                return 10;
            case DATE_TIME:
                return 30;
            default:
                throw new IllegalStateException("unexpected type "
                                                + node.getType());
        }
    }

    /**
     * Determines whether a node printed starting at the given column would
     * reach the wrap threshold.
     */
    static boolean forcesMultiline(TomlNode node, int startingColumnBias)
    {
        return countInlineColumns(node) + startingColumnBias
            >= LINE_WRAP_COLUMNS;
    }


    //=========================================================================
    // Printing


    @Override
    void print(TomlNode root)
        throws IOException
    {
        switch (root.getType())
        {
            case TABLE:
            {
                TomlTable table = root.asTable();
                if (table.isInline())
                {
                    printInline(table);
                }
                else
                {
                    // root key/values line up with top-level headers
                    decreaseIndent();
                    printBlock(table);
                }
                break;
            }
            case ARRAY:
                printArray(root.asArray());
                break;
            default:
                printValue(root);
                break;
        }
    }

    /**
     * Prints a node in value position: after {@code key = } or as an array
     * element.
     */
    private void printNested(TomlNode value)
        throws IOException
    {
        switch (value.getType())
        {
            case TABLE:
                printInline(value.asTable());
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

    private void printKeySeparator()
        throws IOException
    {
        printUnformatted(_options.getTerseKeyValuePairs() ? "=" : " = ");
    }

    private void printKey(String key)
        throws IOException
    {
        printString(key, false, true);
    }

    private void printKeyPath()
        throws IOException
    {
        for (int i = 0; i < _keyPath.size(); i++)
        {
            if (i > 0) printUnformatted('.');
            printKey(_keyPath.get(i));
        }
        clearNakedNewline();
    }

    private void printPendingTableSeparator()
        throws IOException
    {
        if (_pendingTableSeparator)
        {
            printNewline(true);
            printNewline(true);
            _pendingTableSeparator = false;
        }
    }


    private void printInline(TomlTable table)
        throws IOException
    {
        if (table.isEmpty())
        {
            printUnformatted("{}");
        }
        else
        {
            printUnformatted("{ ");

            boolean first = true;
            for (Map.Entry<String, TomlNode> entry : table)
            {
                if (!first) printUnformatted(", ");
                first = false;

                printKey(entry.getKey());
                printKeySeparator();
                printNested(entry.getValue());
            }

            printUnformatted(" }");
        }
        clearNakedNewline();
    }

    private void printArray(TomlArray array)
        throws IOException
    {
        if (array.isEmpty())
        {
            printUnformatted("[]");
        }
        else
        {
            final int originalIndent = getIndent();
            final boolean multiline =
                forcesMultiline(array,
                                indentColumns() * Math.max(originalIndent, 0));

            printUnformatted('[');
            if (multiline)
            {
                if (originalIndent < 0) setIndent(0);
                if (_options.getIndentArrayElements()) increaseIndent();
            }
            else
            {
                printUnformatted(' ');
            }

            for (int i = 0; i < array.size(); i++)
            {
                if (i > 0)
                {
                    printUnformatted(',');
                    if (!multiline) printUnformatted(' ');
                }

                if (multiline)
                {
                    printNewline(true);
                    printIndent();
                }

                printNested(array.get(i));
            }

            if (multiline)
            {
                setIndent(originalIndent);
                printNewline(true);
                printIndent();
            }
            else
            {
                printUnformatted(' ');
            }
            printUnformatted(']');
        }
        clearNakedNewline();
    }

    /**
     * Prints a non-inline table as three passes over its entries: key/value
     * lines, then sub-tables, then arrays of tables.
     */
    private void printBlock(TomlTable table)
        throws IOException
    {
        for (Map.Entry<String, TomlNode> entry : table)
        {
            TomlNode value = entry.getValue();
            if (isBlockTable(value) || isBlockArrayOfTables(value)) continue;

            _pendingTableSeparator = true;
            printNewline();
            printIndent();
            printKey(entry.getKey());
            printKeySeparator();
            printNested(value);
        }

        for (Map.Entry<String, TomlNode> entry : table)
        {
            TomlNode value = entry.getValue();
            if (!isBlockTable(value)) continue;
            TomlTable child = value.asTable();

            // A table holding nothing but other sections gets no header of
            // its own.
            final boolean skipSelf = hasOnlySections(child);

            _keyPath.add(entry.getKey());

            if (!skipSelf)
            {
                printPendingTableSeparator();
                if (_options.getIndentSubTables()) increaseIndent();
                printIndent();
                printUnformatted('[');
                printKeyPath();
                printUnformatted(']');
                _pendingTableSeparator = true;
            }

            printBlock(child);

            _keyPath.remove(_keyPath.size() - 1);
            if (!skipSelf && _options.getIndentSubTables()) decreaseIndent();
        }

        for (Map.Entry<String, TomlNode> entry : table)
        {
            TomlNode value = entry.getValue();
            if (!isBlockArrayOfTables(value)) continue;
            TomlArray array = value.asArray();

            if (_options.getIndentSubTables()) increaseIndent();
            _keyPath.add(entry.getKey());

            for (TomlNode element : array)
            {
                printPendingTableSeparator();
                printIndent();
                printUnformatted("[[");
                printKeyPath();
                printUnformatted("]]");
                _pendingTableSeparator = true;
                printBlock(element.asTable());
            }

            _keyPath.remove(_keyPath.size() - 1);
            if (_options.getIndentSubTables()) decreaseIndent();
        }
    }

    private static boolean isBlockTable(TomlNode node)
    {
        return node.getType() == NodeType.TABLE
            && !node.asTable().isInline();
    }

    private static boolean isBlockArrayOfTables(TomlNode node)
    {
        return node.getType() == NodeType.ARRAY
            && node.asArray().isArrayOfTables();
    }

    /**
     * Determines whether a table has at least one sub-table or array of
     * tables, and nothing printed as a key/value line.
     */
    private static boolean hasOnlySections(TomlTable table)
    {
        int valueCount = 0;
        int sectionCount = 0;
        for (Map.Entry<String, TomlNode> entry : table)
        {
            TomlNode child = entry.getValue();
            if (isBlockTable(child) || isBlockArrayOfTables(child))
            {
                sectionCount++;
            }
            else
            {
                valueCount++;
            }
        }
        return valueCount == 0 && sectionCount > 0;
    }
}
