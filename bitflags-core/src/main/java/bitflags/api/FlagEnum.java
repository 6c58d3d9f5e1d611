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

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import bitflags.api.ResolvedVariantTable.Variant;
import bitflags.local.BitAllocator;
import bitflags.local.FlagFormatter;
import bitflags.match.FlagCase;
import bitflags.match.FlagMatch;
import bitflags.utils.Names;

import static bitflags.utils.Invariants.illegalArgument;
import static bitflags.utils.Invariants.requireArgument;

/**
 * A declared flag enum: the resolved variant table plus one cached {@link FlagValue} per variant.
 * Created once per declaration via {@link #declare(FlagEnumDescriptor)}; immutable and safe to share
 * between threads.
 */
public class FlagEnum
{
    private final ResolvedVariantTable table;
    private final FlagFormatter formatter;
    private final FlagValue[] named;
    private final FlagValue all;
    private final ImmutableMap<String, Predicate<FlagValue>> accessors;

    private FlagEnum(ResolvedVariantTable table)
    {
        this.table = table;
        this.formatter = new FlagFormatter(table);
        this.named = new FlagValue[table.size()];
        ImmutableMap.Builder<String, Predicate<FlagValue>> accessors = ImmutableMap.builder();
        for (Variant variant : table)
        {
            named[variant.ordinal()] = new FlagValue(this, variant.value());
            long value = variant.value();
            accessors.put(Names.accessorName(variant.name()), v -> (own(v).bits & value) == value);
        }
        this.accessors = accessors.buildOrThrow();
        this.all = select(table.namedBits());
    }

    public static FlagEnum declare(FlagEnumDescriptor descriptor)
    {
        return new FlagEnum(BitAllocator.allocate(descriptor));
    }

    public String name()
    {
        return table.typeName();
    }

    public Width width()
    {
        return table.width();
    }

    public ResolvedVariantTable table()
    {
        return table;
    }

    FlagFormatter formatter()
    {
        return formatter;
    }

    public FlagValue of(String variant)
    {
        return named[table.variant(variant).ordinal()];
    }

    public FlagValue of(String first, String ... rest)
    {
        long bits = table.variant(first).value();
        for (String variant : rest)
            bits |= table.variant(variant).value();
        return select(bits);
    }

    public FlagValue none()
    {
        return named[table.empty().ordinal()];
    }

    /**
     * @return the union of every named variant
     */
    public FlagValue all()
    {
        return all;
    }

    /**
     * @return the named variants in declaration order, the empty variant included
     */
    public List<FlagValue> values()
    {
        return ImmutableList.copyOf(named);
    }

    public List<String> variantNames()
    {
        List<String> names = new ArrayList<>(table.size());
        for (Variant variant : table)
            names.add(variant.name());
        return names;
    }

    public FlagValue fromBits(long bits)
    {
        requireArgument(table.width().fits(bits), "%s does not fit in %s", Long.toUnsignedString(bits), table.width());
        return select(bits);
    }

    FlagValue select(long bits)
    {
        Variant variant = exact(bits);
        return variant != null ? named[variant.ordinal()] : new FlagValue(this, bits);
    }

    FlagValue select(long bits, FlagValue a, FlagValue b)
    {
        if (bits == a.bits) return a;
        if (bits == b.bits) return b;
        return select(bits);
    }

    @Nullable
    private Variant exact(long bits)
    {
        for (Variant variant : table)
        {
            if (variant.value() == bits)
                return variant;
        }
        return null;
    }

    /**
     * @param accessorName a generated accessor name such as {@code has_read_write}
     * @return a predicate testing whether a value contains that accessor's variant
     */
    public Predicate<FlagValue> accessor(String accessorName)
    {
        Predicate<FlagValue> accessor = accessors.get(accessorName);
        if (accessor == null)
            throw illegalArgument("%s has no accessor %s", name(), accessorName);
        return accessor;
    }

    public List<String> accessorNames()
    {
        return accessors.keySet().asList();
    }

    public List<String> decompose(FlagValue value)
    {
        List<String> names = new ArrayList<>();
        for (Variant variant : formatter.decompose(own(value).bits))
            names.add(variant.name());
        return names;
    }

    public String format(FlagValue value)
    {
        return formatter.format(own(value).bits);
    }

    /**
     * @return the first named variant whose value equals {@code value} exactly, otherwise the composed
     *         case carrying {@code value} unchanged
     */
    public FlagCase dispatch(FlagValue value)
    {
        Variant variant = exact(own(value).bits);
        return variant != null ? FlagCase.named(variant, value) : FlagCase.composed(value);
    }

    public <R> FlagMatch<R> match(FlagValue value)
    {
        return new FlagMatch<>(this, dispatch(value));
    }

    private FlagValue own(FlagValue value)
    {
        requireArgument(value.type == this, "%s is not a value of %s", value.type.name(), name());
        return value;
    }

    @Override
    public String toString()
    {
        return table.toString();
    }
}
