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

package bitflags.api;

import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import bitflags.utils.Invariants;

import static bitflags.utils.Invariants.illegalArgument;
import static bitflags.utils.Invariants.require;

/**
 * The resolved value of every variant of one flag enum, in declaration order. Built once by the
 * allocator and shared read-only by the type and all of its values.
 */
public class ResolvedVariantTable implements Iterable<ResolvedVariantTable.Variant>
{
    public static class Variant
    {
        final int ordinal;
        final String name;
        final long value;

        public Variant(int ordinal, String name, long value)
        {
            this.ordinal = ordinal;
            this.name = name;
            this.value = value;
        }

        public int ordinal()
        {
            return ordinal;
        }

        public String name()
        {
            return name;
        }

        public long value()
        {
            return value;
        }

        public boolean isEmpty()
        {
            return value == 0;
        }

        @Override
        public String toString()
        {
            return name + '=' + Long.toUnsignedString(value);
        }
    }

    final String typeName;
    final Width width;
    final ImmutableList<Variant> entries;
    final ImmutableMap<String, Variant> byName;
    final Variant empty;
    // union of every named value
    final long namedBits;

    public ResolvedVariantTable(String typeName, Width width, List<Variant> entries, String emptyVariant)
    {
        this.typeName = typeName;
        this.width = width;
        this.entries = ImmutableList.copyOf(entries);
        ImmutableMap.Builder<String, Variant> byName = ImmutableMap.builderWithExpectedSize(entries.size());
        long namedBits = 0;
        for (Variant entry : entries)
        {
            byName.put(entry.name, entry);
            namedBits |= entry.value;
        }
        this.byName = byName.buildOrThrow();
        this.namedBits = namedBits;
        this.empty = Invariants.nonNull(this.byName.get(emptyVariant), emptyVariant);
        if (Invariants.isParanoid())
            validate();
    }

    private void validate()
    {
        require(empty.value == 0, "%s must resolve to 0", empty.name);
        Set<Long> seen = new HashSet<>();
        for (int i = 0 ; i < entries.size() ; ++i)
        {
            Variant entry = entries.get(i);
            require(entry.ordinal == i, "%s has ordinal %s", entry.name, entry.ordinal);
            require(width.fits(entry.value), "%s does not fit %s", entry, width);
            require(seen.add(entry.value), "%s is not distinct", entry);
        }
    }

    public String typeName()
    {
        return typeName;
    }

    public Width width()
    {
        return width;
    }

    public ImmutableList<Variant> entries()
    {
        return entries;
    }

    public int size()
    {
        return entries.size();
    }

    public Variant get(int ordinal)
    {
        return entries.get(ordinal);
    }

    @Nullable
    public Variant get(String name)
    {
        return byName.get(name);
    }

    public Variant variant(String name)
    {
        Variant variant = byName.get(name);
        if (variant == null)
            throw illegalArgument("%s has no variant %s", typeName, name);
        return variant;
    }

    public Variant empty()
    {
        return empty;
    }

    public long namedBits()
    {
        return namedBits;
    }

    public String qualifiedName(Variant variant)
    {
        return typeName + "::" + variant.name;
    }

    @Override
    public Iterator<Variant> iterator()
    {
        return entries.iterator();
    }

    @Override
    public String toString()
    {
        return typeName + entries;
    }
}
