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

package bitflags.match;

import javax.annotation.Nullable;

import bitflags.api.FlagValue;
import bitflags.api.ResolvedVariantTable.Variant;

/**
 * The outcome of dispatching a {@link FlagValue} over the cases of its flag enum: either one of the
 * named variants, or the synthetic composed case for any value equal to none of them. The composed
 * case carries the dispatched value unmodified, so guards can compare it against constructed
 * combinations with {@link FlagValue#equals(Object)}.
 */
public abstract class FlagCase
{
    final FlagValue value;

    FlagCase(FlagValue value)
    {
        this.value = value;
    }

    public static Named named(Variant variant, FlagValue value)
    {
        return new Named(variant, value);
    }

    public static Composed composed(FlagValue value)
    {
        return new Composed(value);
    }

    public FlagValue value()
    {
        return value;
    }

    public abstract boolean isComposed();

    /**
     * @return the matched variant, or null for the composed case
     */
    @Nullable
    public abstract Variant variant();

    public static final class Named extends FlagCase
    {
        final Variant variant;

        Named(Variant variant, FlagValue value)
        {
            super(value);
            this.variant = variant;
        }

        @Override
        public boolean isComposed()
        {
            return false;
        }

        @Override
        public Variant variant()
        {
            return variant;
        }

        public String name()
        {
            return variant.name();
        }

        @Override
        public String toString()
        {
            return value.toString();
        }
    }

    public static final class Composed extends FlagCase
    {
        Composed(FlagValue value)
        {
            super(value);
        }

        @Override
        public boolean isComposed()
        {
            return true;
        }

        @Override
        public Variant variant()
        {
            return null;
        }

        @Override
        public String toString()
        {
            return "Composed(" + value + ')';
        }
    }
}
