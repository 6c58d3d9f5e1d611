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

import bitflags.primitives.FlagAlgebra;

import static bitflags.utils.Invariants.requireArgument;

/**
 * An immutable value of one {@link FlagEnum}: a bit pattern of the type's width. A value may equal a
 * named variant, the empty value, a union of named variants, or carry bits no variant names; those
 * bits are kept by every operation and are significant to {@link #equals(Object)}.
 *
 * Operations never modify the receiver. Combining values of two different flag enums is rejected.
 */
public final class FlagValue
{
    final FlagEnum type;
    final long bits;

    FlagValue(FlagEnum type, long bits)
    {
        this.type = type;
        this.bits = bits;
    }

    public FlagEnum type()
    {
        return type;
    }

    public long bits()
    {
        return bits;
    }

    /** {@code this | that} */
    public FlagValue or(FlagValue that)
    {
        return type.select(FlagAlgebra.union(bits, check(that).bits), this, that);
    }

    /** {@code this & that} */
    public FlagValue and(FlagValue that)
    {
        return type.select(FlagAlgebra.intersect(bits, check(that).bits), this, that);
    }

    /** {@code this ^ that} */
    public FlagValue xor(FlagValue that)
    {
        return type.select(FlagAlgebra.symmetricDifference(bits, check(that).bits), this, that);
    }

    /** {@code !this}, masked to the type's width */
    public FlagValue not()
    {
        return type.fromBits(FlagAlgebra.complement(type.width(), bits));
    }

    /** {@code this - that}, i.e. {@code this & !that} */
    public FlagValue minus(FlagValue that)
    {
        return type.select(FlagAlgebra.difference(type.width(), bits, check(that).bits), this, that);
    }

    public FlagValue union(FlagValue that)
    {
        return or(that);
    }

    public FlagValue intersect(FlagValue that)
    {
        return and(that);
    }

    public FlagValue symmetricDifference(FlagValue that)
    {
        return xor(that);
    }

    public FlagValue complement()
    {
        return not();
    }

    public FlagValue difference(FlagValue that)
    {
        return minus(that);
    }

    /**
     * @return true iff every bit of {@code that} is set in this value
     */
    public boolean contains(FlagValue that)
    {
        return FlagAlgebra.contains(bits, check(that).bits);
    }

    public boolean hasFlag(FlagValue flag)
    {
        return contains(flag);
    }

    /**
     * @return true iff every bit of the named variant is set in this value
     */
    public boolean has(String variant)
    {
        return FlagAlgebra.contains(bits, type.table().variant(variant).value());
    }

    public boolean intersects(FlagValue that)
    {
        return FlagAlgebra.containsAny(bits, check(that).bits);
    }

    public boolean isEmpty()
    {
        return FlagAlgebra.isEmpty(bits);
    }

    /**
     * @return true iff this value is exactly the union of every named variant
     */
    public boolean isAll()
    {
        return bits == type.table().namedBits();
    }

    public boolean equalsBits(long bits)
    {
        return FlagAlgebra.equals(this.bits, bits);
    }

    public List<String> decompose()
    {
        return type.decompose(this);
    }

    public long residual()
    {
        return type.formatter().residual(bits);
    }

    private FlagValue check(FlagValue that)
    {
        requireArgument(that.type == type, "Cannot combine %s with %s", type.name(), that.type.name());
        return that;
    }

    @Override
    public boolean equals(Object that)
    {
        return that instanceof FlagValue && type == ((FlagValue) that).type && bits == ((FlagValue) that).bits;
    }

    @Override
    public int hashCode()
    {
        return type.hashCode() * 31 + Long.hashCode(bits);
    }

    @Override
    public String toString()
    {
        return type.format(this);
    }
}
