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
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import bitflags.api.AllocationException;
import bitflags.api.FlagEnumDescriptor;
import bitflags.api.FlagEnumDescriptor.VariantDeclaration;
import bitflags.api.ResolvedVariantTable;
import bitflags.api.ResolvedVariantTable.Variant;
import bitflags.api.Width;
import bitflags.utils.Names;

/**
 * Resolves the value of every variant of a {@link FlagEnumDescriptor}.
 *
 * Variants are visited once, in declaration order. An explicit value is taken as-is and claims
 * every bit it sets. A variant without one receives the lowest single bit not yet claimed, except
 * the designated empty variant which resolves to zero. Earlier variants are never renumbered, so an
 * explicit value that collides with an earlier assignment fails rather than shifting it.
 */
public class BitAllocator
{
    private static final Logger logger = LoggerFactory.getLogger(BitAllocator.class);

    private BitAllocator() {}

    public static ResolvedVariantTable allocate(FlagEnumDescriptor descriptor)
    {
        String typeName = descriptor.typeName();
        String emptyName = descriptor.emptyVariant();
        Width width = descriptor.width();
        validateNames(descriptor);

        List<Variant> entries = new ArrayList<>(descriptor.variants().size());
        Map<Long, String> claimed = new HashMap<>();
        long claimedBits = 0;
        int cursor = 0;
        for (VariantDeclaration declaration : descriptor.variants())
        {
            String name = declaration.name();
            boolean isEmpty = name.equals(emptyName);
            long value;
            if (declaration.hasExplicitValue())
            {
                value = declaration.explicitValue();
                if (!width.fits(value))
                    throw AllocationException.valueOutOfRange(typeName, name, value, width);
                if (value == 0 && !isEmpty)
                    throw AllocationException.duplicateValue(typeName, emptyName, name, 0);
                claimedBits |= value;
            }
            else if (isEmpty)
            {
                value = 0;
            }
            else
            {
                while (cursor < width.bits() && (claimedBits & (1L << cursor)) != 0)
                    ++cursor;
                if (cursor == width.bits())
                    throw AllocationException.widthExhausted(typeName, name, width);
                value = 1L << cursor++;
                claimedBits |= value;
            }

            String prev = claimed.putIfAbsent(value, name);
            if (prev != null)
                throw AllocationException.duplicateValue(typeName, prev, name, value);
            entries.add(new Variant(entries.size(), name, value));
        }

        if (!emptyName.equals(claimed.get(0L)))
            throw AllocationException.missingEmptyVariant(typeName, emptyName);

        ResolvedVariantTable table = new ResolvedVariantTable(typeName, width, entries, emptyName);
        logger.debug("Allocated {} over {} bits: {}", typeName, width.bits(), table.entries());
        return table;
    }

    private static void validateNames(FlagEnumDescriptor descriptor)
    {
        String typeName = descriptor.typeName();
        Set<String> names = new HashSet<>();
        Set<String> accessors = new HashSet<>();
        for (VariantDeclaration declaration : descriptor.variants())
        {
            String name = declaration.name();
            if (!Names.isIdentifier(name))
                throw AllocationException.invalidName(typeName, name);
            // distinct names may still share a has_ accessor, e.g. ReadWrite and read_write
            if (!names.add(name) || !accessors.add(Names.accessorName(name)))
                throw AllocationException.duplicateName(typeName, name);
        }
        if (!names.contains(descriptor.emptyVariant()))
            throw AllocationException.missingEmptyVariant(typeName, descriptor.emptyVariant());
    }
}
