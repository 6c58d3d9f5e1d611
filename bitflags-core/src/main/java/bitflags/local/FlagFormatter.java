/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package bitflags.local;

import java.util.ArrayList;
import java.util.List;

import bitflags.api.ResolvedVariantTable;
import bitflags.api.ResolvedVariantTable.Variant;

import static bitflags.primitives.FlagAlgebra.contains;

/**
 * Decomposes raw values into the named variants of one table and renders them canonically:
 * {@code Type::None} for zero, {@code Type::A} for a value equal to exactly one named variant,
 * {@code (Type::A | Type::C)} for anything else. Bits not covered by any contained named variant are
 * rendered as a trailing hex term, e.g. {@code (Type::A | 0x10)}, or {@code (0x10)} on their own.
 */
public class FlagFormatter
{
    private final ResolvedVariantTable table;

    public FlagFormatter(ResolvedVariantTable table)
    {
        this.table = table;
    }

    /**
     * @return the non-empty variants whose bits are all present in {@code bits}, in declaration order
     */
    public List<Variant> decompose(long bits)
    {
        List<Variant> result = new ArrayList<>();
        for (Variant variant : table)
        {
            if (!variant.isEmpty() && contains(bits, variant.value()))
                result.add(variant);
        }
        return result;
    }

    /**
     * @return the bits of {@code bits} that no contained named variant accounts for
     */
    public long residual(long bits)
    {
        return residual(bits, decompose(bits));
    }

    private static long residual(long bits, List<Variant> parts)
    {
        long covered = 0;
        for (Variant part : parts)
            covered |= part.value();
        return bits & ~covered;
    }

    public String format(long bits)
    {
        if (bits == 0)
            return table.qualifiedName(table.empty());

        List<Variant> parts = decompose(bits);
        if (parts.size() == 1 && parts.get(0).value() == bits)
            return table.qualifiedName(parts.get(0));

        StringBuilder builder = new StringBuilder("(");
        for (Variant part : parts)
        {
            if (builder.length() > 1)
                builder.append(" | ");
            builder.append(table.qualifiedName(part));
        }
        long residual = residual(bits, parts);
        if (residual != 0)
        {
            if (builder.length() > 1)
                builder.append(" | ");
            builder.append(table.width().toHexString(residual));
        }
        return builder.append(')').toString();
    }
}
