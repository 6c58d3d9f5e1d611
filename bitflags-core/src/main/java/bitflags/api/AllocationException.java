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

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A flag enum declaration could not be resolved into a value table. Always a programming error
 * in the declaration, raised once when the type is declared and never by an already resolved type.
 */
public class AllocationException extends IllegalArgumentException
{
    public enum Kind
    {
        /** no variant resolved to zero, or the designated empty variant is not declared */
        MISSING_EMPTY_VARIANT,
        /** two variants resolved to the same value */
        DUPLICATE_VALUE,
        /** an explicit value does not fit the declared width */
        VALUE_OUT_OF_RANGE,
        /** no free bit remained for a variant without an explicit value */
        WIDTH_EXHAUSTED,
        DUPLICATE_NAME,
        INVALID_NAME
    }

    public final Kind kind;
    public final String typeName;
    public final ImmutableList<String> variants;

    AllocationException(Kind kind, String typeName, List<String> variants, String message)
    {
        super(typeName + ": " + message);
        this.kind = kind;
        this.typeName = typeName;
        this.variants = ImmutableList.copyOf(variants);
    }

    public static AllocationException missingEmptyVariant(String typeName, String emptyVariant)
    {
        return new AllocationException(Kind.MISSING_EMPTY_VARIANT, typeName, ImmutableList.of(emptyVariant),
                                       "no variant " + emptyVariant + " resolving to 0");
    }

    public static AllocationException duplicateValue(String typeName, String a, String b, long value)
    {
        return new AllocationException(Kind.DUPLICATE_VALUE, typeName, ImmutableList.of(a, b),
                                       a + " and " + b + " both resolve to " + Long.toUnsignedString(value));
    }

    public static AllocationException valueOutOfRange(String typeName, String variant, long value, Width width)
    {
        return new AllocationException(Kind.VALUE_OUT_OF_RANGE, typeName, ImmutableList.of(variant),
                                       variant + " = " + Long.toUnsignedString(value) + " does not fit in " + width.bits() + " bits");
    }

    public static AllocationException widthExhausted(String typeName, String variant, Width width)
    {
        return new AllocationException(Kind.WIDTH_EXHAUSTED, typeName, ImmutableList.of(variant),
                                       "no free bit left in " + width.bits() + " bits for " + variant);
    }

    public static AllocationException duplicateName(String typeName, String variant)
    {
        return new AllocationException(Kind.DUPLICATE_NAME, typeName, ImmutableList.of(variant),
                                       variant + " is declared more than once");
    }

    public static AllocationException invalidName(String typeName, String variant)
    {
        return new AllocationException(Kind.INVALID_NAME, typeName, ImmutableList.of(variant),
                                       '"' + variant + "\" is not a valid variant name");
    }

    public Kind kind()
    {
        return kind;
    }
}
